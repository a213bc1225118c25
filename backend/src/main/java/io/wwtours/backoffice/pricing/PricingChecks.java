package io.wwtours.backoffice.pricing;

import io.wwtours.backoffice.exception.MissingRequiredFieldException;
import io.wwtours.backoffice.exception.ValidationFailedException;
import io.wwtours.backoffice.rate.RateConfiguration;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;

/** Input checks shared by the calculators. */
final class PricingChecks {

  private PricingChecks() {}

  static LocalDate requireServiceDate(PricingInput input) {
    if (input.serviceDate() == null) {
      throw new MissingRequiredFieldException(
          "serviceDate", input.category().getDisplayLabel().toLowerCase(Locale.ROOT));
    }
    return input.serviceDate();
  }

  static int requirePartySize(PricingInput input, RateConfiguration configuration) {
    if (input.partySize() == null) {
      throw new MissingRequiredFieldException(
          "partySize", input.category().getDisplayLabel().toLowerCase(Locale.ROOT));
    }
    return checkPartySize(input.partySize(), configuration);
  }

  static int checkPartySize(int partySize, RateConfiguration configuration) {
    if (partySize < configuration.minPartySize() || partySize > configuration.maxPartySize()) {
      throw new ValidationFailedException(
          "partySize",
          "Party size must be between %d and %d, got %d"
              .formatted(configuration.minPartySize(), configuration.maxPartySize(), partySize));
    }
    return partySize;
  }

  static BigDecimal requirePositiveQuantity(PricingInput input) {
    if (input.quantity() == null) {
      throw new MissingRequiredFieldException(
          "quantity", input.category().getDisplayLabel().toLowerCase(Locale.ROOT));
    }
    if (input.quantity().signum() <= 0) {
      throw new ValidationFailedException(
          "quantity", "Quantity must be greater than zero, got " + input.quantity());
    }
    return input.quantity();
  }
}
