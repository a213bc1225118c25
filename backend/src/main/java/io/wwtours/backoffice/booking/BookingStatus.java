package io.wwtours.backoffice.booking;

public enum BookingStatus {
  CONFIRMED,
  CANCELLED
}
