package io.wwtours.backoffice.rate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One row of the rate table. Immutable reference data, only replaced by a new configuration
 * version.
 *
 * <p>Price for a quantity {@code q} (hours or miles):
 *
 * <pre>
 *   billable   = max(q, minimumUnits)
 *   chargeable = max(0, billable - includedUnits)
 *   price      = max(baseAmount + perUnitAmount * chargeable, minimumCharge)
 * </pre>
 *
 * Fractional quantities are priced linearly. A {@code null} day-type matches every day; a {@code
 * null} season bound is open-ended.
 *
 * @param category service category the rule prices
 * @param dayType day-type the rule applies to, or null for any
 * @param partySize guest-count bracket
 * @param unit what {@code perUnitAmount} is charged per
 * @param baseAmount flat component charged once
 * @param perUnitAmount hourly or per-mile component
 * @param minimumUnits billable floor, e.g. the 4-hour tour minimum
 * @param includedUnits units covered by {@code baseAmount}, e.g. the first 10 miles
 * @param minimumCharge price floor
 * @param effectiveFrom first day of the season, inclusive
 * @param effectiveTo last day of the season, inclusive
 * @param priority higher wins when several rules match
 * @param tierLabel human-readable tier name shown in price breakdowns
 */
public record RateRule(
    ServiceCategory category,
    DayType dayType,
    PartySizeRange partySize,
    DurationUnit unit,
    BigDecimal baseAmount,
    BigDecimal perUnitAmount,
    BigDecimal minimumUnits,
    BigDecimal includedUnits,
    BigDecimal minimumCharge,
    LocalDate effectiveFrom,
    LocalDate effectiveTo,
    int priority,
    String tierLabel) {

  public RateRule {
    Objects.requireNonNull(category, "category must not be null");
    Objects.requireNonNull(partySize, "partySize must not be null");
    Objects.requireNonNull(unit, "unit must not be null");
    baseAmount = baseAmount != null ? baseAmount : BigDecimal.ZERO;
    perUnitAmount = perUnitAmount != null ? perUnitAmount : BigDecimal.ZERO;
    minimumUnits = minimumUnits != null ? minimumUnits : BigDecimal.ZERO;
    includedUnits = includedUnits != null ? includedUnits : BigDecimal.ZERO;
    minimumCharge = minimumCharge != null ? minimumCharge : BigDecimal.ZERO;
    if (baseAmount.signum() < 0 || perUnitAmount.signum() < 0 || minimumCharge.signum() < 0) {
      throw new IllegalArgumentException("Rate amounts must not be negative for " + category);
    }
    if (effectiveFrom != null && effectiveTo != null && effectiveTo.isBefore(effectiveFrom)) {
      throw new IllegalArgumentException("Season ends before it starts for " + category);
    }
    if (tierLabel == null || tierLabel.isBlank()) {
      tierLabel = partySize.label();
    }
  }

  /** Returns true if this rule prices the given request. */
  public boolean matches(
      ServiceCategory category, DayType dayType, int partySize, LocalDate serviceDate) {
    return this.category == category
        && (this.dayType == null || this.dayType == dayType)
        && this.partySize.contains(partySize)
        && isInSeason(serviceDate);
  }

  public boolean isInSeason(LocalDate date) {
    if (date == null) {
      return effectiveFrom == null && effectiveTo == null;
    }
    return (effectiveFrom == null || !date.isBefore(effectiveFrom))
        && (effectiveTo == null || !date.isAfter(effectiveTo));
  }

  /** Billable quantity after the minimum-units floor. */
  public BigDecimal billableUnits(BigDecimal quantity) {
    return quantity.max(minimumUnits);
  }

  /** Prices the given quantity. Scale 2, HALF_UP. */
  public BigDecimal priceFor(BigDecimal quantity) {
    BigDecimal chargeable = billableUnits(quantity).subtract(includedUnits).max(BigDecimal.ZERO);
    BigDecimal price = baseAmount.add(perUnitAmount.multiply(chargeable)).max(minimumCharge);
    return price.setScale(2, RoundingMode.HALF_UP);
  }
}
