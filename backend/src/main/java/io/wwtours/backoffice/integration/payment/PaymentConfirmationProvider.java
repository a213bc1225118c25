package io.wwtours.backoffice.integration.payment;

/** Port to the payment service provider. Used only to check a deposit before conversion. */
public interface PaymentConfirmationProvider {

  String providerId();

  /**
   * Looks up a payment reference. Never throws for an unknown reference; returns an unverified
   * confirmation instead.
   */
  PaymentConfirmation confirm(String paymentReference);
}
