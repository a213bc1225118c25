package io.wwtours.backoffice.booking;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/** One priced line copied from the proposal into the booking. */
public record BookingLine(
    String kind,
    String category,
    String description,
    LocalDate serviceDate,
    Integer partySize,
    BigDecimal quantity,
    BigDecimal amount) {

  Map<String, Object> toMap() {
    var map = new LinkedHashMap<String, Object>();
    map.put("kind", kind);
    map.put("category", category);
    map.put("description", description);
    map.put("service_date", serviceDate != null ? serviceDate.toString() : null);
    map.put("party_size", partySize);
    map.put("quantity", quantity != null ? quantity.toPlainString() : null);
    map.put("amount", amount.toPlainString());
    return map;
  }
}
