package io.wwtours.backoffice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The rate table has no row for the requested combination. Pricing never falls back to zero, so
 * this always reaches the caller.
 */
public class NoRateTierFoundException extends ErrorResponseException {

  public NoRateTierFoundException(String detail) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("No rate tier found");
    problem.setDetail(detail);
    problem.setProperty("kind", "NoRateTierFound");
    return problem;
  }
}
