package io.wwtours.backoffice.rate;

/** Closed set of bookable service kinds. Each has exactly one price calculator. */
public enum ServiceCategory {
  TIMED_TOUR("Timed tour", true),
  POINT_TO_POINT_TRANSFER("Transfer", false),
  HOURLY_WAIT("Wait time", true),
  CUSTOM_FLAT("Custom item", false);

  private final String displayLabel;
  private final boolean dateSensitive;

  ServiceCategory(String displayLabel, boolean dateSensitive) {
    this.displayLabel = displayLabel;
    this.dateSensitive = dateSensitive;
  }

  public String getDisplayLabel() {
    return displayLabel;
  }

  /** Returns true if the price depends on the day-type of the service date. */
  public boolean isDateSensitive() {
    return dateSensitive;
  }
}
