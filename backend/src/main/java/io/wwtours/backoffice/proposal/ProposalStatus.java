package io.wwtours.backoffice.proposal;

public enum ProposalStatus {
  DRAFT,
  SENT,
  VIEWED,
  ACCEPTED,
  DECLINED,
  EXPIRED,
  CONVERTED;

  /** Statuses in which items, add-ons and pricing fields may still change. */
  public boolean isEditable() {
    return this == DRAFT || this == SENT || this == VIEWED;
  }

  /** Statuses with no outgoing transition. */
  public boolean isTerminal() {
    return this == DECLINED || this == EXPIRED || this == CONVERTED;
  }
}
