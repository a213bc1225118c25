package io.wwtours.backoffice.rate;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Maps a service date to its {@link DayType}. Stateless; the weekday mapping comes from the active
 * rate configuration so that it can change without a code change.
 */
@Component
public class DayTypeClassifier {

  /**
   * Classifies the date. A weekday missing from the mapping is treated as {@link
   * DayType#STANDARD}.
   */
  public DayType classify(LocalDate date, Map<DayOfWeek, DayType> weekdayDayTypes) {
    Objects.requireNonNull(date, "date must not be null");
    if (weekdayDayTypes == null) {
      return DayType.STANDARD;
    }
    return weekdayDayTypes.getOrDefault(date.getDayOfWeek(), DayType.STANDARD);
  }
}
