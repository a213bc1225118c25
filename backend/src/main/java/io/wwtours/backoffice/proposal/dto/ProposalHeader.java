package io.wwtours.backoffice.proposal.dto;

import java.math.BigDecimal;
import java.time.Instant;

/** Client and pricing fields of a proposal that an operator edits directly. */
public record ProposalHeader(
    String clientName,
    String clientEmail,
    String clientPhone,
    String title,
    BigDecimal discountPercentage,
    boolean gratuityEnabled,
    BigDecimal suggestedGratuityPercentage,
    boolean gratuityOptional,
    Instant validUntil) {}
