package io.wwtours.backoffice.pricing;

public enum VarianceKind {
  NONE,
  DISCOUNT,
  PREMIUM
}
