package io.wwtours.backoffice.booking;

/** Creates confirmed bookings. Only the conversion of an accepted proposal calls this. */
public interface BookingStore {

  /**
   * Creates the booking, or returns the one already created for the same source proposal.
   *
   * @param request booking content, keyed by its source proposal
   * @return id and human-readable number of the booking
   */
  BookingReference createBooking(BookingCreationRequest request);
}
