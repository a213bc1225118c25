package io.wwtours.backoffice.rate;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.util.Map;
import java.util.Objects;

/**
 * Versioned, read-only snapshot of everything pricing depends on. A request reads one snapshot and
 * uses it throughout, so a configuration change never mixes rates within a single quote.
 */
public record RateConfiguration(
    String version,
    String currency,
    Map<DayOfWeek, DayType> weekdayDayTypes,
    RateTable rateTable,
    BigDecimal taxRate,
    BigDecimal depositFraction,
    int minPartySize,
    int maxPartySize) {

  public RateConfiguration {
    Objects.requireNonNull(version, "version must not be null");
    Objects.requireNonNull(currency, "currency must not be null");
    Objects.requireNonNull(rateTable, "rateTable must not be null");
    Objects.requireNonNull(taxRate, "taxRate must not be null");
    Objects.requireNonNull(depositFraction, "depositFraction must not be null");
    weekdayDayTypes = weekdayDayTypes != null ? Map.copyOf(weekdayDayTypes) : Map.of();
    if (taxRate.signum() < 0) {
      throw new IllegalArgumentException("taxRate must not be negative");
    }
    if (depositFraction.signum() < 0 || depositFraction.compareTo(BigDecimal.ONE) > 0) {
      throw new IllegalArgumentException("depositFraction must be between 0 and 1");
    }
    if (minPartySize < 1 || maxPartySize < minPartySize) {
      throw new IllegalArgumentException(
          "Invalid party size limits " + minPartySize + "-" + maxPartySize);
    }
  }
}
