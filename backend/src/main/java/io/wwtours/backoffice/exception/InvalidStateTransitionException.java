package io.wwtours.backoffice.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A lifecycle event is not allowed from the proposal's current status, a transition guard
 * failed, or a concurrent update won the race for the same proposal.
 */
public class InvalidStateTransitionException extends ErrorResponseException {

  public InvalidStateTransitionException(UUID proposalId, String detail) {
    super(HttpStatus.CONFLICT, createProblem(proposalId, detail), null);
  }

  private static ProblemDetail createProblem(UUID proposalId, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Invalid state transition");
    problem.setDetail(detail);
    problem.setProperty("kind", "InvalidStateTransition");
    problem.setProperty("proposalId", proposalId != null ? proposalId.toString() : null);
    return problem;
  }
}
