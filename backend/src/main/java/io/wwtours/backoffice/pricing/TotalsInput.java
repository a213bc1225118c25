package io.wwtours.backoffice.pricing;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything the totals depend on.
 *
 * @param serviceItemPrices effective price of each service item
 * @param addOnAmounts amount of each add-on
 * @param discountPercentage 0 to 100
 * @param taxRate fraction, e.g. 0.091
 * @param depositFraction fraction of the total due as deposit
 * @param gratuityEnabled whether a gratuity is suggested at all
 * @param suggestedGratuityPercentage gratuity percentage, e.g. 18
 */
public record TotalsInput(
    List<BigDecimal> serviceItemPrices,
    List<BigDecimal> addOnAmounts,
    BigDecimal discountPercentage,
    BigDecimal taxRate,
    BigDecimal depositFraction,
    boolean gratuityEnabled,
    BigDecimal suggestedGratuityPercentage) {

  public TotalsInput {
    serviceItemPrices = serviceItemPrices != null ? List.copyOf(serviceItemPrices) : List.of();
    addOnAmounts = addOnAmounts != null ? List.copyOf(addOnAmounts) : List.of();
    discountPercentage = discountPercentage != null ? discountPercentage : BigDecimal.ZERO;
    taxRate = taxRate != null ? taxRate : BigDecimal.ZERO;
    depositFraction = depositFraction != null ? depositFraction : BigDecimal.ZERO;
    suggestedGratuityPercentage =
        suggestedGratuityPercentage != null ? suggestedGratuityPercentage : BigDecimal.ZERO;
  }
}
