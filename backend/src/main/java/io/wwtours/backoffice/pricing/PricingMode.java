package io.wwtours.backoffice.pricing;

public enum PricingMode {
  CALCULATED,
  HOURLY_OVERRIDE,
  FIXED_OVERRIDE
}
