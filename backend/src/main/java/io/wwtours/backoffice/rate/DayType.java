package io.wwtours.backoffice.rate;

/** Pricing bucket a calendar date falls into. */
public enum DayType {
  /** Sunday through Wednesday by default. */
  STANDARD,

  /** Thursday through Saturday by default. */
  PREMIUM
}
