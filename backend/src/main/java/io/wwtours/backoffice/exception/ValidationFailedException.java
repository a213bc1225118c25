package io.wwtours.backoffice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a request value is present but unacceptable (zero duration, party size out of
 * range, decline reason too short, discount outside 0-100).
 */
public class ValidationFailedException extends ErrorResponseException {

  private final String field;

  public ValidationFailedException(String field, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(field, detail), null);
    this.field = field;
  }

  public String getField() {
    return field;
  }

  private static ProblemDetail createProblem(String field, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid value for " + field);
    problem.setDetail(detail);
    problem.setProperty("kind", "ValidationFailed");
    problem.setProperty("field", field);
    return problem;
  }
}
