package io.wwtours.backoffice.pricing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.wwtours.backoffice.exception.ValidationFailedException;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class TotalsCalculatorTest {

  private static final BigDecimal TAX = new BigDecimal("0.091");
  private static final BigDecimal HALF = new BigDecimal("0.50");

  private final TotalsCalculator calculator = new TotalsCalculator();

  @Test
  void recompute_discountTaxDepositAndGratuity() {
    var totals =
        calculator.recompute(
            new TotalsInput(
                List.of(new BigDecimal("510.00")),
                List.of(),
                new BigDecimal("10"),
                TAX,
                HALF,
                true,
                new BigDecimal("18")));

    assertThat(totals.subtotal()).isEqualByComparingTo("510.00");
    assertThat(totals.discountAmount()).isEqualByComparingTo("51.00");
    assertThat(totals.afterDiscount()).isEqualByComparingTo("459.00");
    assertThat(totals.taxAmount()).isEqualByComparingTo("41.77");
    assertThat(totals.total()).isEqualByComparingTo("500.77");
    assertThat(totals.depositAmount()).isEqualByComparingTo("250.39");
    assertThat(totals.balanceAmount()).isEqualByComparingTo("250.38");
    assertThat(totals.gratuityAmount()).isEqualByComparingTo("90.14");
  }

  @Test
  void recompute_depositPlusBalanceAlwaysEqualsTotal() {
    var totals =
        calculator.recompute(
            new TotalsInput(
                List.of(new BigDecimal("333.33"), new BigDecimal("0.01")),
                List.of(new BigDecimal("45.50")),
                new BigDecimal("7.5"),
                TAX,
                new BigDecimal("0.3333"),
                false,
                null));

    assertThat(totals.depositAmount().add(totals.balanceAmount()))
        .isEqualByComparingTo(totals.total());
    assertThat(totals.servicesSubtotal()).isEqualByComparingTo("333.34");
    assertThat(totals.addonsSubtotal()).isEqualByComparingTo("45.50");
    assertThat(totals.gratuityAmount()).isEqualByComparingTo("0.00");
  }

  @Test
  void recompute_emptyProposalIsZero() {
    var totals = calculator.recompute(new TotalsInput(null, null, null, TAX, HALF, false, null));

    assertThat(totals).isEqualTo(ProposalTotals.zero());
  }

  @Test
  void recompute_fullDiscountLeavesNothingToTax() {
    var totals =
        calculator.recompute(
            new TotalsInput(
                List.of(new BigDecimal("200")),
                List.of(),
                new BigDecimal("100"),
                TAX,
                HALF,
                false,
                null));

    assertThat(totals.total()).isEqualByComparingTo("0.00");
    assertThat(totals.depositAmount()).isEqualByComparingTo("0.00");
  }

  @Test
  void recompute_discountOutOfRangeRejected() {
    assertThatThrownBy(
            () ->
                calculator.recompute(
                    new TotalsInput(
                        List.of(), List.of(), new BigDecimal("101"), TAX, HALF, false, null)))
        .isInstanceOf(ValidationFailedException.class);
    assertThatThrownBy(
            () ->
                calculator.recompute(
                    new TotalsInput(
                        List.of(), List.of(), new BigDecimal("-1"), TAX, HALF, false, null)))
        .isInstanceOf(ValidationFailedException.class);
  }

  @Test
  void recompute_negativeAmountRejected() {
    assertThatThrownBy(
            () ->
                calculator.recompute(
                    new TotalsInput(
                        List.of(new BigDecimal("-5")), List.of(), null, TAX, HALF, false, null)))
        .isInstanceOf(ValidationFailedException.class);
  }
}
