package io.wwtours.backoffice.booking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JpaBookingStoreTest {

  private static final UUID PROPOSAL_ID = UUID.randomUUID();

  @Mock private BookingRepository bookingRepository;
  @Mock private BookingNumberService bookingNumberService;
  @InjectMocks private JpaBookingStore store;

  private static BookingCreationRequest request() {
    return new BookingCreationRequest(
        PROPOSAL_ID,
        "TP-0007",
        "Jordan Reyes",
        "jordan@example.com",
        null,
        List.of(
            new BookingLine(
                "SERVICE",
                "TIMED_TOUR",
                "Southside wineries",
                LocalDate.of(2026, 6, 1),
                2,
                new BigDecimal("6"),
                new BigDecimal("510.00"))),
        "USD",
        new BigDecimal("500.77"),
        new BigDecimal("250.39"),
        new BigDecimal("250.38"),
        null,
        "pay_123");
  }

  @Test
  void createBooking_newProposal_savesWithAllocatedNumber() {
    when(bookingRepository.findBySourceProposalId(PROPOSAL_ID)).thenReturn(Optional.empty());
    when(bookingNumberService.allocateNumber()).thenReturn("WWT-2026-004711");
    when(bookingRepository.save(any(Booking.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));

    var reference = store.createBooking(request());

    assertThat(reference.bookingNumber()).isEqualTo("WWT-2026-004711");
  }

  @Test
  void createBooking_existingBookingForProposal_returnedUnchanged() {
    var existing = new Booking("WWT-2026-000001", request());
    when(bookingRepository.findBySourceProposalId(PROPOSAL_ID)).thenReturn(Optional.of(existing));

    var reference = store.createBooking(request());

    assertThat(reference.bookingNumber()).isEqualTo("WWT-2026-000001");
    verify(bookingRepository, never()).save(any());
    verifyNoInteractions(bookingNumberService);
  }
}
