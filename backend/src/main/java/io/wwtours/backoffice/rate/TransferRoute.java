package io.wwtours.backoffice.rate;

import java.math.BigDecimal;
import java.util.Objects;

/** A named origin/destination pair with a fixed price, e.g. SEATAC_TO_WALLA. */
public record TransferRoute(String code, String origin, String destination, BigDecimal amount) {

  public TransferRoute {
    Objects.requireNonNull(code, "code must not be null");
    Objects.requireNonNull(amount, "amount must not be null");
    if (amount.signum() <= 0) {
      throw new IllegalArgumentException("Route " + code + " must have a positive amount");
    }
  }
}
