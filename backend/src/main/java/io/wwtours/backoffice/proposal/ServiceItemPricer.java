package io.wwtours.backoffice.proposal;

import io.wwtours.backoffice.pricing.OverrideResolver;
import io.wwtours.backoffice.pricing.PriceCalculationService;
import io.wwtours.backoffice.pricing.ResolvedPrice;
import io.wwtours.backoffice.rate.RateConfiguration;
import org.springframework.stereotype.Component;

/** Prices a stored service item and writes the result back onto it. */
@Component
public class ServiceItemPricer {

  private final PriceCalculationService priceCalculationService;
  private final OverrideResolver overrideResolver;

  public ServiceItemPricer(
      PriceCalculationService priceCalculationService, OverrideResolver overrideResolver) {
    this.priceCalculationService = priceCalculationService;
    this.overrideResolver = overrideResolver;
  }

  public ResolvedPrice price(ProposalServiceItem item, RateConfiguration configuration) {
    var quote = priceCalculationService.calculatePrice(item.toPricingInput(), configuration);
    var resolved =
        overrideResolver.resolve(quote.calculatedPrice(), item.toOverride(), item.getQuantity());
    item.applyPrice(quote, resolved);
    return resolved;
  }
}
