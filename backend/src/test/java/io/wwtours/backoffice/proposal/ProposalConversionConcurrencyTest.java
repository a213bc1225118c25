package io.wwtours.backoffice.proposal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import io.wwtours.backoffice.TestcontainersConfiguration;
import io.wwtours.backoffice.booking.BookingRepository;
import io.wwtours.backoffice.integration.payment.PaymentConfirmation;
import io.wwtours.backoffice.integration.payment.PaymentConfirmationProvider;
import io.wwtours.backoffice.proposal.dto.AcceptanceRequest;
import io.wwtours.backoffice.proposal.dto.ProposalHeader;
import io.wwtours.backoffice.proposal.dto.ServiceItemRequest;
import io.wwtours.backoffice.rate.ServiceCategory;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ProposalConversionConcurrencyTest {

  private static final int CALLERS = 4;

  @Autowired private ProposalService proposalService;
  @Autowired private ProposalLifecycleService lifecycleService;
  @Autowired private ProposalConversionService conversionService;
  @Autowired private BookingRepository bookingRepository;
  @MockitoBean private PaymentConfirmationProvider paymentConfirmationProvider;

  private UUID acceptedProposal() {
    var proposal =
        proposalService.createProposal(
            new ProposalHeader(
                "Sam Ortiz",
                "sam.ortiz@example.com",
                null,
                "Harvest tour",
                null,
                false,
                null,
                true,
                null),
            List.of(
                new ServiceItemRequest(
                    ServiceCategory.TIMED_TOUR,
                    "Westside tasting",
                    LocalDate.of(2026, 6, 1),
                    4,
                    new BigDecimal("6"),
                    null,
                    null,
                    null)),
            List.of());
    lifecycleService.send(proposal.getId());
    lifecycleService.accept(
        proposal.getId(),
        new AcceptanceRequest(
            "data:image/png;base64,iVBORw0KGgo=",
            "Sam Ortiz",
            "sam.ortiz@example.com",
            false,
            "203.0.113.7"));
    return proposal.getId();
  }

  @Test
  void concurrentConversions_createExactlyOneBooking() throws Exception {
    var proposalId = acceptedProposal();
    when(paymentConfirmationProvider.confirm(anyString()))
        .thenReturn(PaymentConfirmation.verified("pay_race", new BigDecimal("1000.00"), "USD"));

    var start = new CountDownLatch(1);
    var executor = Executors.newFixedThreadPool(CALLERS);
    try {
      var futures = new ArrayList<Future<ConversionResult>>();
      for (int i = 0; i < CALLERS; i++) {
        Callable<ConversionResult> call =
            () -> {
              start.await();
              return conversionService.convert(proposalId, "pay_race");
            };
        futures.add(executor.submit(call));
      }
      start.countDown();

      var results = new ArrayList<ConversionResult>();
      for (var future : futures) {
        results.add(future.get());
      }

      assertThat(results).filteredOn(r -> !r.alreadyConverted()).hasSize(1);
      assertThat(results).filteredOn(ConversionResult::alreadyConverted).hasSize(CALLERS - 1);
      assertThat(results)
          .extracting(ConversionResult::bookingNumber)
          .containsOnly(results.get(0).bookingNumber());
    } finally {
      executor.shutdownNow();
    }

    var booking = bookingRepository.findBySourceProposalId(proposalId);
    assertThat(booking).isPresent();
    assertThat(booking.get().getTotal()).isEqualByComparingTo("621.87");
    assertThat(proposalService.getProposal(proposalId).getStatus())
        .isEqualTo(ProposalStatus.CONVERTED);
  }
}
