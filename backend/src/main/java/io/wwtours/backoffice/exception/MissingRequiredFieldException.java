package io.wwtours.backoffice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A field the service category needs for pricing (date, party size, distance) is absent. */
public class MissingRequiredFieldException extends ErrorResponseException {

  private final String field;

  public MissingRequiredFieldException(String field, String context) {
    super(HttpStatus.BAD_REQUEST, createProblem(field, context), null);
    this.field = field;
  }

  public String getField() {
    return field;
  }

  private static ProblemDetail createProblem(String field, String context) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Missing required field");
    problem.setDetail(field + " is required for " + context);
    problem.setProperty("kind", "MissingRequiredField");
    problem.setProperty("field", field);
    return problem;
  }
}
