package io.wwtours.backoffice.booking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Booking store backed by the {@code bookings} table. Idempotent per source proposal. */
@Service
public class JpaBookingStore implements BookingStore {

  private static final Logger log = LoggerFactory.getLogger(JpaBookingStore.class);

  private final BookingRepository bookingRepository;
  private final BookingNumberService bookingNumberService;

  public JpaBookingStore(
      BookingRepository bookingRepository, BookingNumberService bookingNumberService) {
    this.bookingRepository = bookingRepository;
    this.bookingNumberService = bookingNumberService;
  }

  @Override
  @Transactional
  public BookingReference createBooking(BookingCreationRequest request) {
    var existing = bookingRepository.findBySourceProposalId(request.sourceProposalId());
    if (existing.isPresent()) {
      log.info(
          "Booking {} already exists for proposal {}",
          existing.get().getBookingNumber(),
          request.sourceProposalId());
      return existing.get().toReference();
    }

    var booking = new Booking(bookingNumberService.allocateNumber(), request);
    booking = bookingRepository.save(booking);
    log.info(
        "Created booking {} from proposal {} (total {} {})",
        booking.getBookingNumber(),
        request.proposalNumber(),
        request.total(),
        request.currency());
    return booking.toReference();
  }
}
