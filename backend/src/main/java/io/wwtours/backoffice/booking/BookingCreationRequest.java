package io.wwtours.backoffice.booking;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Everything a booking is created from. {@code sourceProposalId} doubles as the idempotency key: a
 * repeated request for the same proposal yields the same booking.
 */
public record BookingCreationRequest(
    UUID sourceProposalId,
    String proposalNumber,
    String clientName,
    String clientEmail,
    String clientPhone,
    List<BookingLine> lines,
    String currency,
    BigDecimal total,
    BigDecimal depositAmount,
    BigDecimal balanceAmount,
    BigDecimal gratuityAmount,
    String paymentReference) {

  public BookingCreationRequest {
    Objects.requireNonNull(sourceProposalId, "sourceProposalId must not be null");
    Objects.requireNonNull(total, "total must not be null");
    lines = lines != null ? List.copyOf(lines) : List.of();
  }
}
