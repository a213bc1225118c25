package io.wwtours.backoffice.pricing;

import io.wwtours.backoffice.exception.MissingRequiredFieldException;
import io.wwtours.backoffice.exception.ValidationFailedException;
import io.wwtours.backoffice.rate.RateConfiguration;
import io.wwtours.backoffice.rate.ServiceCategory;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/** Operator-entered flat amount. Independent of date, party size and the rate table. */
@Component
public class CustomFlatPriceCalculator implements ItemPriceCalculator {

  @Override
  public ServiceCategory category() {
    return ServiceCategory.CUSTOM_FLAT;
  }

  @Override
  public PriceQuote calculate(PricingInput input, RateConfiguration configuration) {
    if (input.flatAmount() == null) {
      throw new MissingRequiredFieldException("flatAmount", "custom item");
    }
    if (input.flatAmount().signum() < 0) {
      throw new ValidationFailedException(
          "flatAmount", "Custom item amount must not be negative, got " + input.flatAmount());
    }
    return new PriceQuote(
        category(),
        input.flatAmount().setScale(2, RoundingMode.HALF_UP),
        null,
        "Custom",
        BigDecimal.ONE,
        null,
        configuration.version());
  }
}
