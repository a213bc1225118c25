package io.wwtours.backoffice.rate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/** Builds the rate configuration from {@link RateConfigurationProperties}. */
@Component
@EnableConfigurationProperties(RateConfigurationProperties.class)
public class PropertiesRateConfigurationStore implements RateConfigurationStore {

  private static final Logger log = LoggerFactory.getLogger(PropertiesRateConfigurationStore.class);

  private final RateConfigurationProperties properties;

  public PropertiesRateConfigurationStore(RateConfigurationProperties properties) {
    this.properties = properties;
    // Fail at startup rather than on the first quote
    current();
  }

  @Override
  public RateConfiguration current() {
    var rules =
        properties.rules().stream()
            .map(
                rule ->
                    new RateRule(
                        rule.category(),
                        rule.dayType(),
                        new PartySizeRange(rule.minParty(), rule.maxParty()),
                        rule.unit() != null ? rule.unit() : DurationUnit.HOUR,
                        rule.baseAmount(),
                        rule.perUnitAmount(),
                        rule.minimumUnits(),
                        rule.includedUnits(),
                        rule.minimumCharge(),
                        rule.effectiveFrom(),
                        rule.effectiveTo(),
                        rule.priority(),
                        rule.tierLabel()))
            .toList();
    var routes =
        properties.routes().stream()
            .map(
                route ->
                    new TransferRoute(
                        route.code(), route.origin(), route.destination(), route.amount()))
            .toList();
    var configuration =
        new RateConfiguration(
            properties.version(),
            properties.currency(),
            properties.weekdays(),
            new RateTable(rules, routes),
            properties.taxRate(),
            properties.depositFraction(),
            properties.minPartySize(),
            properties.maxPartySize());
    log.debug(
        "Loaded rate configuration {}: {} rules, {} routes",
        configuration.version(),
        rules.size(),
        routes.size());
    return configuration;
  }
}
