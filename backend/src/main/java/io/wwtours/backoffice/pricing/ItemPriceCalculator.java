package io.wwtours.backoffice.pricing;

import io.wwtours.backoffice.rate.RateConfiguration;
import io.wwtours.backoffice.rate.ServiceCategory;

/**
 * Prices one service category. Implementations are stateless and never return a negative price or
 * silently fall back to zero.
 */
public interface ItemPriceCalculator {

  /** The single category this calculator handles. */
  ServiceCategory category();

  PriceQuote calculate(PricingInput input, RateConfiguration configuration);
}
