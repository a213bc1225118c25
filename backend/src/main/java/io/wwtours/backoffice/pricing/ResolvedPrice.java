package io.wwtours.backoffice.pricing;

import java.math.BigDecimal;
import java.util.List;

/**
 * Calculated and effective price of an item. The calculated price is always kept so the variance
 * stays visible.
 */
public record ResolvedPrice(
    BigDecimal calculatedPrice,
    BigDecimal effectivePrice,
    PricingMode pricingMode,
    BigDecimal variance,
    VarianceKind varianceKind,
    List<String> warnings) {

  public static final String OVERRIDE_REASON_MISSING = "OVERRIDE_REASON_MISSING";

  public ResolvedPrice {
    warnings = warnings != null ? List.copyOf(warnings) : List.of();
  }

  public boolean isOverridden() {
    return pricingMode != PricingMode.CALCULATED;
  }
}
