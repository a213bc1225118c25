package io.wwtours.backoffice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class InvalidOverrideException extends ErrorResponseException {

  public InvalidOverrideException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid price override");
    problem.setDetail(detail);
    problem.setProperty("kind", "InvalidOverride");
    problem.setProperty("field", "override");
    return problem;
  }
}
