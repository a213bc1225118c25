package io.wwtours.backoffice.pricing;

public enum OverrideMode {
  /** Operator rate multiplied by the item quantity. */
  HOURLY,
  /** Operator amount used verbatim. */
  FIXED
}
