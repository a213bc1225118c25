package io.wwtours.backoffice.pricing;

import java.math.BigDecimal;

/**
 * Operator-supplied replacement for a calculated price.
 *
 * @param enabled whether the override applies; a disabled override is kept but ignored
 * @param mode hourly rate or fixed amount
 * @param rateOrAmount hourly rate for {@link OverrideMode#HOURLY}, amount for {@link
 *     OverrideMode#FIXED}
 * @param reason why the price differs from the rate table
 */
public record PriceOverride(
    boolean enabled, OverrideMode mode, BigDecimal rateOrAmount, String reason) {

  public static PriceOverride none() {
    return new PriceOverride(false, null, null, null);
  }

  public static PriceOverride hourly(BigDecimal rate, String reason) {
    return new PriceOverride(true, OverrideMode.HOURLY, rate, reason);
  }

  public static PriceOverride fixed(BigDecimal amount, String reason) {
    return new PriceOverride(true, OverrideMode.FIXED, amount, reason);
  }
}
