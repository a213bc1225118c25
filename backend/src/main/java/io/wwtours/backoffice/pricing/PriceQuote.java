package io.wwtours.backoffice.pricing;

import io.wwtours.backoffice.rate.DayType;
import io.wwtours.backoffice.rate.ServiceCategory;
import java.math.BigDecimal;

/**
 * Result of pricing one item, with enough breakdown to explain the number.
 *
 * @param category category that was priced
 * @param calculatedPrice price before any override, scale 2
 * @param dayType day-type the rate was chosen for; null when the category ignores dates
 * @param tierLabel rate tier or route that was applied
 * @param billableUnits hours or miles actually charged, after minimums
 * @param unitRate hourly or per-mile rate; null for fixed amounts
 * @param configVersion rate configuration the price was taken from
 */
public record PriceQuote(
    ServiceCategory category,
    BigDecimal calculatedPrice,
    DayType dayType,
    String tierLabel,
    BigDecimal billableUnits,
    BigDecimal unitRate,
    String configVersion) {}
