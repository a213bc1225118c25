package io.wwtours.backoffice.pricing;

import io.wwtours.backoffice.exception.InvalidOverrideException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Chooses between the calculated price and an operator override. */
@Component
public class OverrideResolver {

  private static final Logger log = LoggerFactory.getLogger(OverrideResolver.class);

  /**
   * Resolves the effective price of an item.
   *
   * @param calculatedPrice price from the rate table, returned unchanged
   * @param override operator override, may be null
   * @param quantity item quantity; required for hourly overrides
   * @return calculated and effective price with the variance between them
   * @throws InvalidOverrideException if an enabled override has no mode or a non-positive amount
   */
  public ResolvedPrice resolve(
      BigDecimal calculatedPrice, PriceOverride override, BigDecimal quantity) {
    var calculated = calculatedPrice.setScale(2, RoundingMode.HALF_UP);
    if (override == null || !override.enabled()) {
      return new ResolvedPrice(
          calculated,
          calculated,
          PricingMode.CALCULATED,
          BigDecimal.ZERO.setScale(2),
          VarianceKind.NONE,
          null);
    }

    if (override.mode() == null) {
      throw new InvalidOverrideException("Override mode is required when the override is enabled");
    }
    if (override.rateOrAmount() == null || override.rateOrAmount().signum() <= 0) {
      throw new InvalidOverrideException(
          "Override "
              + (override.mode() == OverrideMode.HOURLY ? "rate" : "amount")
              + " must be greater than zero");
    }

    BigDecimal effective;
    PricingMode mode;
    if (override.mode() == OverrideMode.HOURLY) {
      if (quantity == null || quantity.signum() <= 0) {
        throw new InvalidOverrideException("Hourly override needs a positive item quantity");
      }
      effective = override.rateOrAmount().multiply(quantity).setScale(2, RoundingMode.HALF_UP);
      mode = PricingMode.HOURLY_OVERRIDE;
    } else {
      effective = override.rateOrAmount().setScale(2, RoundingMode.HALF_UP);
      mode = PricingMode.FIXED_OVERRIDE;
    }

    var variance = effective.subtract(calculated);
    var kind =
        switch (variance.signum()) {
          case -1 -> VarianceKind.DISCOUNT;
          case 1 -> VarianceKind.PREMIUM;
          default -> VarianceKind.NONE;
        };

    var warnings = new ArrayList<String>();
    if (kind != VarianceKind.NONE && (override.reason() == null || override.reason().isBlank())) {
      log.warn(
          "Price override without a reason: calculated={}, effective={}", calculated, effective);
      warnings.add(ResolvedPrice.OVERRIDE_REASON_MISSING);
    }
    return new ResolvedPrice(calculated, effective, mode, variance, kind, warnings);
  }
}
