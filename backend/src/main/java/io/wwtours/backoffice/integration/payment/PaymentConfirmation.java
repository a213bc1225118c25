package io.wwtours.backoffice.integration.payment;

import java.math.BigDecimal;

/**
 * What the payment provider knows about a payment reference.
 *
 * @param reference the reference that was looked up
 * @param verified whether the provider confirms the payment as settled
 * @param amount amount actually received; null if unverified
 * @param currency ISO currency code of {@code amount}
 * @param failureReason why verification failed; null when verified
 */
public record PaymentConfirmation(
    String reference, boolean verified, BigDecimal amount, String currency, String failureReason) {

  public static PaymentConfirmation verified(String reference, BigDecimal amount, String currency) {
    return new PaymentConfirmation(reference, true, amount, currency, null);
  }

  public static PaymentConfirmation rejected(String reference, String failureReason) {
    return new PaymentConfirmation(reference, false, null, null, failureReason);
  }
}
