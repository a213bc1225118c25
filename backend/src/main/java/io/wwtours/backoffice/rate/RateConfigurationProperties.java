package io.wwtours.backoffice.rate;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Rate table and pricing constants bound from the {@code pricing} tree of {@code application.yml}.
 *
 * @param version identifier stamped on every quote and proposal priced with this configuration
 * @param currency ISO currency code all amounts are expressed in
 * @param taxRate tax applied after discount, e.g. 0.091
 * @param depositFraction share of the total due at conversion, e.g. 0.50
 * @param minPartySize smallest accepted party
 * @param maxPartySize largest accepted party
 * @param weekdays weekday to day-type mapping; unmapped days are standard
 * @param rules rate rules
 * @param routes fixed-price transfer routes
 * @param cacheTtl how long a loaded snapshot is reused
 */
@ConfigurationProperties(prefix = "pricing")
public record RateConfigurationProperties(
    String version,
    String currency,
    BigDecimal taxRate,
    BigDecimal depositFraction,
    Integer minPartySize,
    Integer maxPartySize,
    Map<DayOfWeek, DayType> weekdays,
    List<Rule> rules,
    List<Route> routes,
    Duration cacheTtl) {

  public RateConfigurationProperties {
    version = version != null ? version : "unversioned";
    currency = currency != null ? currency : "USD";
    taxRate = taxRate != null ? taxRate : BigDecimal.ZERO;
    depositFraction = depositFraction != null ? depositFraction : new BigDecimal("0.50");
    minPartySize = minPartySize != null ? minPartySize : 1;
    maxPartySize = maxPartySize != null ? maxPartySize : 14;
    weekdays = weekdays != null ? weekdays : Map.of();
    rules = rules != null ? rules : List.of();
    routes = routes != null ? routes : List.of();
    cacheTtl = cacheTtl != null ? cacheTtl : Duration.ofMinutes(5);
  }

  public record Rule(
      ServiceCategory category,
      DayType dayType,
      int minParty,
      int maxParty,
      DurationUnit unit,
      BigDecimal baseAmount,
      BigDecimal perUnitAmount,
      BigDecimal minimumUnits,
      BigDecimal includedUnits,
      BigDecimal minimumCharge,
      LocalDate effectiveFrom,
      LocalDate effectiveTo,
      int priority,
      String tierLabel) {}

  public record Route(String code, String origin, String destination, BigDecimal amount) {}
}
