package io.wwtours.backoffice.proposal;

import java.math.BigDecimal;
import java.util.UUID;

/** Published when an accepted proposal becomes a booking. */
public record ProposalConvertedEvent(
    UUID proposalId,
    String proposalNumber,
    UUID bookingId,
    String bookingNumber,
    String clientEmail,
    BigDecimal total,
    String currency) {}
