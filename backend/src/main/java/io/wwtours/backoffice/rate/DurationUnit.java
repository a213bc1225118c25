package io.wwtours.backoffice.rate;

public enum DurationUnit {
  HOUR,
  MILE,
  FLAT
}
