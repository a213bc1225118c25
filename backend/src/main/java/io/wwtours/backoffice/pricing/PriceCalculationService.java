package io.wwtours.backoffice.pricing;

import io.wwtours.backoffice.exception.MissingRequiredFieldException;
import io.wwtours.backoffice.rate.RateConfiguration;
import io.wwtours.backoffice.rate.RateConfigurationStore;
import io.wwtours.backoffice.rate.ServiceCategory;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/** Dispatches a pricing request to the calculator registered for its category. */
@Service
public class PriceCalculationService {

  private final Map<ServiceCategory, ItemPriceCalculator> calculators =
      new EnumMap<>(ServiceCategory.class);
  private final RateConfigurationStore rateConfigurationStore;

  public PriceCalculationService(
      List<ItemPriceCalculator> calculators, RateConfigurationStore rateConfigurationStore) {
    this.rateConfigurationStore = rateConfigurationStore;
    // Fail fast if two calculators claim the same category, or one is missing
    for (var calculator : calculators) {
      var existing = this.calculators.putIfAbsent(calculator.category(), calculator);
      if (existing != null) {
        throw new IllegalStateException(
            "Duplicate price calculator for "
                + calculator.category()
                + ": "
                + existing.getClass().getName()
                + " and "
                + calculator.getClass().getName());
      }
    }
    for (var category : ServiceCategory.values()) {
      if (!this.calculators.containsKey(category)) {
        throw new IllegalStateException("No price calculator registered for " + category);
      }
    }
  }

  /** Prices the item against the current rate configuration. */
  public PriceQuote calculatePrice(PricingInput input) {
    return calculatePrice(input, rateConfigurationStore.current());
  }

  /** Prices the item against the given snapshot, so several items share one configuration. */
  public PriceQuote calculatePrice(PricingInput input, RateConfiguration configuration) {
    if (input == null || input.category() == null) {
      throw new MissingRequiredFieldException("serviceCategory", "pricing");
    }
    return calculators.get(input.category()).calculate(input, configuration);
  }

  public RateConfiguration currentConfiguration() {
    return rateConfigurationStore.current();
  }
}
