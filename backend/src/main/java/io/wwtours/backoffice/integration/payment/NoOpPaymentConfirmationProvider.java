package io.wwtours.backoffice.integration.payment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default provider when no PSP is configured. Confirms nothing, so no proposal can be converted
 * until it is replaced by a real provider.
 */
@Component
public class NoOpPaymentConfirmationProvider implements PaymentConfirmationProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpPaymentConfirmationProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public PaymentConfirmation confirm(String paymentReference) {
    log.warn("NoOp payment provider cannot verify reference {}", paymentReference);
    return PaymentConfirmation.rejected(paymentReference, "No payment provider configured");
  }
}
