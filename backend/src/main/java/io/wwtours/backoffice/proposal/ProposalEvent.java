package io.wwtours.backoffice.proposal;

/** Inputs to the proposal state machine. */
public enum ProposalEvent {
  SEND("proposal.sent"),
  VIEW("proposal.viewed"),
  ACCEPT("proposal.accepted"),
  DECLINE("proposal.declined"),
  EXPIRE("proposal.expired"),
  CONVERT("proposal.converted");

  private final String auditEventType;

  ProposalEvent(String auditEventType) {
    this.auditEventType = auditEventType;
  }

  public String getAuditEventType() {
    return auditEventType;
  }
}
