package io.wwtours.backoffice.rate;

import io.wwtours.backoffice.exception.NoRateTierFoundException;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of rate rules and fixed transfer routes. Lookups never default: a miss raises
 * {@link NoRateTierFoundException}.
 */
public final class RateTable {

  // Most specific first: explicit priority, then day-specific over any-day, then narrower bracket
  private static final Comparator<RateRule> SPECIFICITY =
      Comparator.comparingInt(RateRule::priority)
          .reversed()
          .thenComparing(rule -> rule.dayType() == null)
          .thenComparingInt(rule -> rule.partySize().width());

  private final List<RateRule> rules;
  private final Map<String, TransferRoute> routes;

  public RateTable(List<RateRule> rules, Collection<TransferRoute> routes) {
    this.rules = List.copyOf(rules);
    var byCode = new LinkedHashMap<String, TransferRoute>();
    for (var route : routes) {
      var existing = byCode.putIfAbsent(normalize(route.code()), route);
      if (existing != null) {
        throw new IllegalArgumentException("Duplicate transfer route " + route.code());
      }
    }
    this.routes = Map.copyOf(byCode);
  }

  /**
   * Finds the rule pricing the given request.
   *
   * @param category service category
   * @param dayType day-type of the service date; may be null for categories that ignore it
   * @param partySize number of guests
   * @param serviceDate date used for the season window; may be null
   * @return the most specific matching rule
   * @throws NoRateTierFoundException if no rule matches
   */
  public RateRule findRule(
      ServiceCategory category, DayType dayType, int partySize, LocalDate serviceDate) {
    return rules.stream()
        .filter(rule -> rule.matches(category, dayType, partySize, serviceDate))
        .min(SPECIFICITY)
        .orElseThrow(
            () ->
                new NoRateTierFoundException(
                    "No %s rate for %d guests on a %s day%s"
                        .formatted(
                            category.getDisplayLabel().toLowerCase(Locale.ROOT),
                            partySize,
                            dayType != null ? dayType.name().toLowerCase(Locale.ROOT) : "any",
                            serviceDate != null ? " (" + serviceDate + ")" : "")));
  }

  public Optional<TransferRoute> findRoute(String routeCode) {
    if (routeCode == null || routeCode.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(routes.get(normalize(routeCode)));
  }

  public List<RateRule> getRules() {
    return rules;
  }

  public Collection<TransferRoute> getRoutes() {
    return routes.values();
  }

  private static String normalize(String code) {
    return code.trim().toUpperCase(Locale.ROOT);
  }
}
