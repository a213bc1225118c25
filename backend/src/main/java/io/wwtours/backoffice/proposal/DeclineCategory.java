package io.wwtours.backoffice.proposal;

/** Why the client turned a proposal down. */
public enum DeclineCategory {
  PRICE,
  DATES,
  SERVICES,
  TIMING,
  COMPETITOR,
  OTHER
}
