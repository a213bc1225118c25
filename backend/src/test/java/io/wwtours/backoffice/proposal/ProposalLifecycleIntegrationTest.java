package io.wwtours.backoffice.proposal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.wwtours.backoffice.TestcontainersConfiguration;
import io.wwtours.backoffice.booking.BookingRepository;
import io.wwtours.backoffice.integration.payment.PaymentConfirmation;
import io.wwtours.backoffice.integration.payment.PaymentConfirmationProvider;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class ProposalLifecycleIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private BookingRepository bookingRepository;
  @MockitoBean private PaymentConfirmationProvider paymentConfirmationProvider;

  private String createProposal(String clientEmail, Instant validUntil) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/proposals")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {
                          "clientName": "Jordan Reyes",
                          "clientEmail": "%s",
                          "title": "Anniversary weekend",
                          "discountPercentage": 10,
                          "gratuityEnabled": true,
                          "suggestedGratuityPercentage": 18,
                          "validUntil": %s,
                          "items": [
                            {
                              "serviceCategory": "TIMED_TOUR",
                              "description": "Southside wineries",
                              "serviceDate": "2026-06-01",
                              "partySize": 2,
                              "quantity": 6
                            }
                          ]
                        }
                        """
                            .formatted(
                                clientEmail,
                                validUntil != null ? "\"" + validUntil + "\"" : "null")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.proposal.status").value("DRAFT"))
            .andExpect(jsonPath("$.proposal.total").value(500.77))
            .andExpect(jsonPath("$.proposal.depositAmount").value(250.39))
            .andExpect(jsonPath("$.items[0].effectivePrice").value(510.00))
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.proposal.id");
  }

  private void send(String proposalId) throws Exception {
    mockMvc
        .perform(
            post("/api/proposals/{id}/transitions", proposalId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"event\": \"SEND\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("SENT"));
  }

  private static String acceptanceJson() {
    return """
        {
          "signature": "data:image/png;base64,iVBORw0KGgo=",
          "signerName": "Jordan Reyes",
          "signerEmail": "jordan@example.com",
          "gratuityAccepted": true
        }
        """;
  }

  @Test
  void fullLifecycle_createSendViewAcceptConvert() throws Exception {
    var proposalId = createProposal("lifecycle@example.com", null);
    send(proposalId);

    mockMvc
        .perform(get("/portal/api/proposals/{id}", proposalId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("VIEWED"));

    mockMvc
        .perform(
            post("/portal/api/proposals/{id}/accept", proposalId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(acceptanceJson()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ACCEPTED"));

    when(paymentConfirmationProvider.confirm("pay_lifecycle"))
        .thenReturn(
            PaymentConfirmation.verified("pay_lifecycle", new BigDecimal("250.39"), "USD"));

    var first =
        mockMvc
            .perform(
                post("/api/proposals/{id}/convert", proposalId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"paymentReference\": \"pay_lifecycle\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.alreadyConverted").value(false))
            .andReturn();
    String bookingNumber =
        JsonPath.read(first.getResponse().getContentAsString(), "$.bookingNumber");
    assertThat(bookingNumber).matches("WWT-\\d{4}-\\d{6}");

    mockMvc
        .perform(
            post("/api/proposals/{id}/convert", proposalId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"paymentReference\": \"pay_lifecycle\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.alreadyConverted").value(true))
        .andExpect(jsonPath("$.bookingNumber").value(bookingNumber));

    var booking = bookingRepository.findBySourceProposalId(UUID.fromString(proposalId));
    assertThat(booking).isPresent();
    assertThat(booking.get().getTotal()).isEqualByComparingTo("500.77");
    assertThat(booking.get().getGratuityAmount()).isEqualByComparingTo("90.14");
    assertThat(booking.get().getLines()).hasSize(1);

    mockMvc
        .perform(get("/api/proposals/{id}", proposalId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.proposal.status").value("CONVERTED"))
        .andExpect(jsonPath("$.proposal.bookingNumber").value(bookingNumber));

    mockMvc
        .perform(get("/api/proposals/{id}/activity", proposalId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].eventType").value("proposal.converted"));
  }

  @Test
  void acceptAfterValidUntil_reportsProposalExpired() throws Exception {
    var proposalId =
        createProposal("late@example.com", Instant.now().minus(1, ChronoUnit.HOURS));
    send(proposalId);

    mockMvc
        .perform(
            post("/portal/api/proposals/{id}/accept", proposalId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(acceptanceJson()))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.kind").value("ProposalExpired"));

    // Reading it afterwards applies lazy expiry
    mockMvc
        .perform(get("/api/proposals/{id}", proposalId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.proposal.status").value("EXPIRED"));
  }

  @Test
  void listingOverdueProposal_reportsItExpired() throws Exception {
    var proposalId =
        createProposal("overdue-list@example.com", Instant.now().minus(1, ChronoUnit.HOURS));
    send(proposalId);

    mockMvc
        .perform(
            get("/api/proposals")
                .param("status", "SENT")
                .param("clientEmail", "overdue-list@example.com"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content").isEmpty());

    mockMvc
        .perform(get("/api/proposals").param("clientEmail", "overdue-list@example.com"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.content[0].id").value(proposalId))
        .andExpect(jsonPath("$.content[0].status").value("EXPIRED"));
  }

  @Test
  void convertWithoutVerifiedPayment_leavesProposalAccepted() throws Exception {
    var proposalId = createProposal("unpaid@example.com", null);
    send(proposalId);
    mockMvc
        .perform(
            post("/api/proposals/{id}/transitions", proposalId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"event\": \"ACCEPT\", \"acceptance\": " + acceptanceJson() + "}"))
        .andExpect(status().isOk());
    when(paymentConfirmationProvider.confirm(anyString()))
        .thenReturn(PaymentConfirmation.rejected("pay_x", "Card declined"));

    mockMvc
        .perform(
            post("/api/proposals/{id}/convert", proposalId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"paymentReference\": \"pay_x\"}"))
        .andExpect(status().isPaymentRequired())
        .andExpect(jsonPath("$.kind").value("PaymentNotVerified"));

    mockMvc
        .perform(get("/api/proposals/{id}", proposalId))
        .andExpect(jsonPath("$.proposal.status").value("ACCEPTED"));
    assertThat(bookingRepository.findBySourceProposalId(UUID.fromString(proposalId))).isEmpty();
  }

  @Test
  void invalidTransition_returnsConflict() throws Exception {
    var proposalId = createProposal("invalid@example.com", null);

    mockMvc
        .perform(
            post("/api/proposals/{id}/transitions", proposalId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"event\": \"ACCEPT\", \"acceptance\": " + acceptanceJson() + "}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.kind").value("InvalidStateTransition"));
  }

  @Test
  void quote_premiumDayTour() throws Exception {
    mockMvc
        .perform(
            post("/api/pricing/quote")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {
                      "serviceCategory": "TIMED_TOUR",
                      "serviceDate": "2026-06-04",
                      "partySize": 2,
                      "quantity": 3
                    }
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.dayType").value("PREMIUM"))
        .andExpect(jsonPath("$.billableUnits").value(5))
        .andExpect(jsonPath("$.calculatedPrice").value(475.00));
  }

  @Test
  void quote_missingServiceDate_returnsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/pricing/quote")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"serviceCategory": "TIMED_TOUR", "partySize": 2, "quantity": 4}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.kind").value("MissingRequiredField"))
        .andExpect(jsonPath("$.field").value("serviceDate"));
  }
}
