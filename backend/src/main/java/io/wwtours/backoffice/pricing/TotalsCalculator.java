package io.wwtours.backoffice.pricing;

import io.wwtours.backoffice.exception.ValidationFailedException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Derives proposal totals. Every intermediate amount is rounded to 2 places HALF_UP, and the
 * balance is taken as {@code total - deposit} so the two always add back up to the total.
 */
@Component
public class TotalsCalculator {

  private static final BigDecimal HUNDRED = new BigDecimal("100");

  public ProposalTotals recompute(TotalsInput input) {
    var discountPercentage = input.discountPercentage();
    if (discountPercentage.signum() < 0 || discountPercentage.compareTo(HUNDRED) > 0) {
      throw new ValidationFailedException(
          "discountPercentage", "Discount must be between 0 and 100, got " + discountPercentage);
    }

    var servicesSubtotal = sum(input.serviceItemPrices(), "serviceItems");
    var addonsSubtotal = sum(input.addOnAmounts(), "addOns");
    var subtotal = servicesSubtotal.add(addonsSubtotal);

    var discountAmount = round(subtotal.multiply(discountPercentage).divide(HUNDRED));
    var afterDiscount = subtotal.subtract(discountAmount);
    var taxAmount = round(afterDiscount.multiply(input.taxRate()));
    var total = afterDiscount.add(taxAmount);

    var depositAmount = round(total.multiply(input.depositFraction()));
    var balanceAmount = total.subtract(depositAmount);

    var gratuityAmount =
        input.gratuityEnabled()
            ? round(total.multiply(input.suggestedGratuityPercentage()).divide(HUNDRED))
            : BigDecimal.ZERO.setScale(2);

    return new ProposalTotals(
        servicesSubtotal,
        addonsSubtotal,
        subtotal,
        discountAmount,
        afterDiscount,
        taxAmount,
        total,
        depositAmount,
        balanceAmount,
        gratuityAmount);
  }

  private static BigDecimal sum(List<BigDecimal> amounts, String field) {
    var total = BigDecimal.ZERO.setScale(2);
    for (var amount : amounts) {
      if (amount == null || amount.signum() < 0) {
        throw new ValidationFailedException(field, "Amounts must be present and non-negative");
      }
      total = total.add(round(amount));
    }
    return total;
  }

  private static BigDecimal round(BigDecimal value) {
    return value.setScale(2, RoundingMode.HALF_UP);
  }
}
