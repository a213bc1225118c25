package io.wwtours.backoffice.proposal;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Proposal lifecycle settings.
 *
 * @param declineReasonMinLength shortest decline reason accepted, after trimming
 * @param defaultValidityDays days a new proposal stays open when no deadline is given
 * @param expiry scheduled expiry sweep
 */
@ConfigurationProperties(prefix = "proposal")
public record ProposalProperties(
    Integer declineReasonMinLength, Integer defaultValidityDays, Expiry expiry) {

  public ProposalProperties {
    declineReasonMinLength = declineReasonMinLength != null ? declineReasonMinLength : 10;
    defaultValidityDays = defaultValidityDays != null ? defaultValidityDays : 30;
    expiry = expiry != null ? expiry : new Expiry(false);
  }

  /**
   * @param sweepEnabled whether overdue proposals are expired on a schedule in addition to on read
   */
  public record Expiry(boolean sweepEnabled) {}
}
