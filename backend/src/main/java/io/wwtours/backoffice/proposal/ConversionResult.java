package io.wwtours.backoffice.proposal;

import java.util.UUID;

/**
 * Outcome of converting a proposal.
 *
 * @param alreadyConverted true if the booking existed before this call and nothing was changed
 */
public record ConversionResult(
    UUID proposalId, UUID bookingId, String bookingNumber, boolean alreadyConverted) {}
