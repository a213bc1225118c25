package io.wwtours.backoffice.exception;

import java.time.Instant;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ProposalExpiredException extends ErrorResponseException {

  public ProposalExpiredException(UUID proposalId, Instant validUntil) {
    super(HttpStatus.CONFLICT, createProblem(proposalId, validUntil), null);
  }

  private static ProblemDetail createProblem(UUID proposalId, Instant validUntil) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Proposal expired");
    problem.setDetail("Proposal " + proposalId + " was valid until " + validUntil);
    problem.setProperty("kind", "ProposalExpired");
    problem.setProperty("proposalId", proposalId != null ? proposalId.toString() : null);
    return problem;
  }
}
