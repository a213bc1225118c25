package io.wwtours.backoffice.booking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.random.RandomGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BookingNumberServiceTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-05-01T10:00:00Z"), ZoneOffset.UTC);

  @Mock private BookingRepository bookingRepository;
  @Mock private RandomGenerator random;

  @Test
  void allocateNumber_formatsYearAndSixDigits() {
    when(random.nextInt(1_000_000)).thenReturn(4711);
    when(bookingRepository.existsByBookingNumber("WWT-2026-004711")).thenReturn(false);

    var number = new BookingNumberService(bookingRepository, CLOCK, random).allocateNumber();

    assertThat(number).isEqualTo("WWT-2026-004711");
  }

  @Test
  void allocateNumber_drawsAgainOnCollision() {
    when(random.nextInt(1_000_000)).thenReturn(1, 2);
    when(bookingRepository.existsByBookingNumber("WWT-2026-000001")).thenReturn(true);
    when(bookingRepository.existsByBookingNumber("WWT-2026-000002")).thenReturn(false);

    var number = new BookingNumberService(bookingRepository, CLOCK, random).allocateNumber();

    assertThat(number).isEqualTo("WWT-2026-000002");
  }

  @Test
  void allocateNumber_givesUpAfterMaxAttempts() {
    when(random.nextInt(1_000_000)).thenReturn(7);
    when(bookingRepository.existsByBookingNumber(anyString())).thenReturn(true);

    assertThatThrownBy(
            () -> new BookingNumberService(bookingRepository, CLOCK, random).allocateNumber())
        .isInstanceOf(IllegalStateException.class);
    verify(bookingRepository, times(BookingNumberService.MAX_ATTEMPTS))
        .existsByBookingNumber("WWT-2026-000007");
  }
}
