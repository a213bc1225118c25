package io.wwtours.backoffice.pricing;

import java.math.BigDecimal;

/** Derived totals of a proposal. {@code gratuityAmount} is advisory and not part of the total. */
public record ProposalTotals(
    BigDecimal servicesSubtotal,
    BigDecimal addonsSubtotal,
    BigDecimal subtotal,
    BigDecimal discountAmount,
    BigDecimal afterDiscount,
    BigDecimal taxAmount,
    BigDecimal total,
    BigDecimal depositAmount,
    BigDecimal balanceAmount,
    BigDecimal gratuityAmount) {

  public static ProposalTotals zero() {
    var zero = BigDecimal.ZERO.setScale(2);
    return new ProposalTotals(zero, zero, zero, zero, zero, zero, zero, zero, zero, zero);
  }
}
