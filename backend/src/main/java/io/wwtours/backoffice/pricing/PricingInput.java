package io.wwtours.backoffice.pricing;

import io.wwtours.backoffice.rate.ServiceCategory;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * What a calculator needs to price one service item. Which fields are required depends on the
 * category.
 *
 * @param category service category, selects the calculator
 * @param serviceDate date of service; required for date-sensitive categories
 * @param partySize number of guests
 * @param quantity duration in hours, or distance in miles for transfers
 * @param routeCode known transfer route, priced at its fixed amount
 * @param flatAmount amount of a custom flat item
 */
public record PricingInput(
    ServiceCategory category,
    LocalDate serviceDate,
    Integer partySize,
    BigDecimal quantity,
    String routeCode,
    BigDecimal flatAmount) {

  public static PricingInput timedTour(LocalDate date, int partySize, BigDecimal hours) {
    return new PricingInput(ServiceCategory.TIMED_TOUR, date, partySize, hours, null, null);
  }

  public static PricingInput hourlyWait(LocalDate date, int partySize, BigDecimal hours) {
    return new PricingInput(ServiceCategory.HOURLY_WAIT, date, partySize, hours, null, null);
  }

  public static PricingInput transfer(String routeCode, Integer partySize, BigDecimal miles) {
    return new PricingInput(
        ServiceCategory.POINT_TO_POINT_TRANSFER, null, partySize, miles, routeCode, null);
  }

  public static PricingInput customFlat(BigDecimal amount) {
    return new PricingInput(ServiceCategory.CUSTOM_FLAT, null, null, null, null, amount);
  }
}
