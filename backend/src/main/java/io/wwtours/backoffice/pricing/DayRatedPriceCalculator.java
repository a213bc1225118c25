package io.wwtours.backoffice.pricing;

import io.wwtours.backoffice.rate.DayTypeClassifier;
import io.wwtours.backoffice.rate.RateConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hourly pricing keyed by day-type and party size, with a per-rule minimum number of billable
 * hours.
 */
public abstract class DayRatedPriceCalculator implements ItemPriceCalculator {

  private static final Logger log = LoggerFactory.getLogger(DayRatedPriceCalculator.class);

  private final DayTypeClassifier dayTypeClassifier;

  protected DayRatedPriceCalculator(DayTypeClassifier dayTypeClassifier) {
    this.dayTypeClassifier = dayTypeClassifier;
  }

  @Override
  public PriceQuote calculate(PricingInput input, RateConfiguration configuration) {
    var date = PricingChecks.requireServiceDate(input);
    int partySize = PricingChecks.requirePartySize(input, configuration);
    var hours = PricingChecks.requirePositiveQuantity(input);

    var dayType = dayTypeClassifier.classify(date, configuration.weekdayDayTypes());
    var rule = configuration.rateTable().findRule(category(), dayType, partySize, date);
    var price = rule.priceFor(hours);
    var billable = rule.billableUnits(hours);

    log.debug(
        "Priced {} on {} ({}) for {} guests: {}h billable at {} = {}",
        category(),
        date,
        dayType,
        partySize,
        billable,
        rule.perUnitAmount(),
        price);
    return new PriceQuote(
        category(),
        price,
        dayType,
        rule.tierLabel(),
        billable,
        rule.perUnitAmount(),
        configuration.version());
  }
}
