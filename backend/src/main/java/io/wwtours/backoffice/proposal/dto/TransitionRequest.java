package io.wwtours.backoffice.proposal.dto;

import io.wwtours.backoffice.proposal.ProposalEvent;
import jakarta.validation.constraints.NotNull;

/**
 * A lifecycle event with its payload. Only the part matching the event is read: {@code acceptance}
 * for ACCEPT, {@code decline} for DECLINE, {@code paymentReference} for CONVERT.
 */
public record TransitionRequest(
    @NotNull(message = "event is required") ProposalEvent event,
    AcceptanceRequest acceptance,
    DeclineRequest decline,
    String paymentReference) {

  public static TransitionRequest of(ProposalEvent event) {
    return new TransitionRequest(event, null, null, null);
  }
}
