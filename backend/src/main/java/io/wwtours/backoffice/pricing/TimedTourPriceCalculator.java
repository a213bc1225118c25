package io.wwtours.backoffice.pricing;

import io.wwtours.backoffice.rate.DayTypeClassifier;
import io.wwtours.backoffice.rate.ServiceCategory;
import org.springframework.stereotype.Component;

/** Guided tours billed by the hour, with a higher minimum on premium days. */
@Component
public class TimedTourPriceCalculator extends DayRatedPriceCalculator {

  public TimedTourPriceCalculator(DayTypeClassifier dayTypeClassifier) {
    super(dayTypeClassifier);
  }

  @Override
  public ServiceCategory category() {
    return ServiceCategory.TIMED_TOUR;
  }
}
