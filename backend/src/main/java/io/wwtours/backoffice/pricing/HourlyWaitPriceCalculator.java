package io.wwtours.backoffice.pricing;

import io.wwtours.backoffice.rate.DayTypeClassifier;
import io.wwtours.backoffice.rate.ServiceCategory;
import org.springframework.stereotype.Component;

/** Driver wait time between legs. */
@Component
public class HourlyWaitPriceCalculator extends DayRatedPriceCalculator {

  public HourlyWaitPriceCalculator(DayTypeClassifier dayTypeClassifier) {
    super(dayTypeClassifier);
  }

  @Override
  public ServiceCategory category() {
    return ServiceCategory.HOURLY_WAIT;
  }
}
