package io.wwtours.backoffice.pricing;

import io.wwtours.backoffice.exception.MissingRequiredFieldException;
import io.wwtours.backoffice.rate.RateConfiguration;
import io.wwtours.backoffice.rate.ServiceCategory;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Point-to-point transfers. A known route code is charged its fixed amount; anything else is priced
 * by distance against the transfer rule for the party size.
 */
@Component
public class TransferPriceCalculator implements ItemPriceCalculator {

  private static final Logger log = LoggerFactory.getLogger(TransferPriceCalculator.class);

  @Override
  public ServiceCategory category() {
    return ServiceCategory.POINT_TO_POINT_TRANSFER;
  }

  @Override
  public PriceQuote calculate(PricingInput input, RateConfiguration configuration) {
    if (input.partySize() != null) {
      PricingChecks.checkPartySize(input.partySize(), configuration);
    }

    var route = configuration.rateTable().findRoute(input.routeCode());
    if (route.isPresent()) {
      var amount = route.get().amount().setScale(2, RoundingMode.HALF_UP);
      log.debug("Priced transfer on route {}: {}", route.get().code(), amount);
      return new PriceQuote(
          category(),
          amount,
          null,
          route.get().code(),
          BigDecimal.ONE,
          null,
          configuration.version());
    }

    if (input.quantity() == null) {
      // Unknown or absent route, so distance is the only way left to price it
      throw new MissingRequiredFieldException(
          "quantity",
          input.routeCode() != null
              ? "transfer on unknown route " + input.routeCode()
              : "transfer without a route");
    }
    var miles = PricingChecks.requirePositiveQuantity(input);
    int partySize =
        input.partySize() != null ? input.partySize() : configuration.minPartySize();
    var rule = configuration.rateTable().findRule(category(), null, partySize, null);
    var price = rule.priceFor(miles);
    log.debug("Priced transfer by distance: {} miles = {}", miles, price);
    return new PriceQuote(
        category(),
        price,
        null,
        rule.tierLabel(),
        rule.billableUnits(miles),
        rule.perUnitAmount(),
        configuration.version());
  }
}
