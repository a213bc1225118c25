package io.wwtours.backoffice.pricing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.wwtours.backoffice.exception.MissingRequiredFieldException;
import io.wwtours.backoffice.exception.ValidationFailedException;
import io.wwtours.backoffice.testutil.TestRates;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class CustomFlatPriceCalculatorTest {

  private final CustomFlatPriceCalculator calculator = new CustomFlatPriceCalculator();

  @Test
  void calculate_returnsAmountAtScaleTwo() {
    var quote =
        calculator.calculate(
            PricingInput.customFlat(new BigDecimal("249.999")), TestRates.configuration());

    assertThat(quote.calculatedPrice()).isEqualByComparingTo("250.00");
    assertThat(quote.tierLabel()).isEqualTo("Custom");
  }

  @Test
  void calculate_zeroIsAllowed() {
    var quote =
        calculator.calculate(PricingInput.customFlat(BigDecimal.ZERO), TestRates.configuration());

    assertThat(quote.calculatedPrice()).isEqualByComparingTo("0.00");
  }

  @Test
  void calculate_missingOrNegativeAmountRejected() {
    assertThatThrownBy(
            () -> calculator.calculate(PricingInput.customFlat(null), TestRates.configuration()))
        .isInstanceOf(MissingRequiredFieldException.class);
    assertThatThrownBy(
            () ->
                calculator.calculate(
                    PricingInput.customFlat(new BigDecimal("-1")), TestRates.configuration()))
        .isInstanceOf(ValidationFailedException.class);
  }
}
