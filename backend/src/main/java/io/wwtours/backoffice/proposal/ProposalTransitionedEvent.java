package io.wwtours.backoffice.proposal;

import java.time.Instant;
import java.util.UUID;

/** Published after a lifecycle transition; consumed once the transaction commits. */
public record ProposalTransitionedEvent(
    UUID proposalId,
    String proposalNumber,
    ProposalEvent event,
    ProposalStatus fromStatus,
    ProposalStatus toStatus,
    String clientEmail,
    Instant occurredAt) {}
