package io.wwtours.backoffice.booking;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.util.random.RandomGenerator;
import org.springframework.stereotype.Service;

/**
 * Generates booking numbers of the form {@code WWT-<year>-<6 digits>}. The digits are random, so
 * uniqueness is checked against existing bookings and a collision draws again.
 */
@Service
public class BookingNumberService {

  static final int MAX_ATTEMPTS = 10;

  private final BookingRepository bookingRepository;
  private final Clock clock;
  private final RandomGenerator random;

  public BookingNumberService(BookingRepository bookingRepository, Clock clock) {
    this(bookingRepository, clock, new SecureRandom());
  }

  BookingNumberService(BookingRepository bookingRepository, Clock clock, RandomGenerator random) {
    this.bookingRepository = bookingRepository;
    this.clock = clock;
    this.random = random;
  }

  public String allocateNumber() {
    int year = LocalDate.now(clock).getYear();
    for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
      var candidate = String.format("WWT-%d-%06d", year, random.nextInt(1_000_000));
      if (!bookingRepository.existsByBookingNumber(candidate)) {
        return candidate;
      }
    }
    throw new IllegalStateException(
        "Could not allocate a unique booking number after " + MAX_ATTEMPTS + " attempts");
  }
}
