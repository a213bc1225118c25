package io.wwtours.backoffice.proposal;

import io.wwtours.backoffice.audit.AuditEventBuilder;
import io.wwtours.backoffice.audit.AuditService;
import io.wwtours.backoffice.booking.BookingCreationRequest;
import io.wwtours.backoffice.booking.BookingLine;
import io.wwtours.backoffice.booking.BookingStore;
import io.wwtours.backoffice.exception.InvalidStateTransitionException;
import io.wwtours.backoffice.exception.MissingRequiredFieldException;
import io.wwtours.backoffice.exception.PaymentNotVerifiedException;
import io.wwtours.backoffice.exception.ResourceNotFoundException;
import io.wwtours.backoffice.integration.payment.PaymentConfirmationProvider;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns an accepted, paid proposal into a booking, exactly once.
 *
 * <p>The proposal row is locked for the whole transaction, so concurrent conversions of the same
 * proposal run one after the other and the second finds {@code convertedToBookingId} already set.
 * The booking store is also keyed by the proposal id.
 */
@Service
public class ProposalConversionService {

  private static final Logger log = LoggerFactory.getLogger(ProposalConversionService.class);

  private final ProposalRepository proposalRepository;
  private final ProposalServiceItemRepository serviceItemRepository;
  private final ProposalAddOnRepository addOnRepository;
  private final PaymentConfirmationProvider paymentConfirmationProvider;
  private final BookingStore bookingStore;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public ProposalConversionService(
      ProposalRepository proposalRepository,
      ProposalServiceItemRepository serviceItemRepository,
      ProposalAddOnRepository addOnRepository,
      PaymentConfirmationProvider paymentConfirmationProvider,
      BookingStore bookingStore,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.proposalRepository = proposalRepository;
    this.serviceItemRepository = serviceItemRepository;
    this.addOnRepository = addOnRepository;
    this.paymentConfirmationProvider = paymentConfirmationProvider;
    this.bookingStore = bookingStore;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  /**
   * Converts the proposal. Calling it again for a converted proposal returns the existing booking
   * with {@code alreadyConverted = true} and changes nothing.
   *
   * @throws InvalidStateTransitionException if the proposal is not ACCEPTED
   * @throws PaymentNotVerifiedException if the payment is unverified, in another currency, or less
   *     than the deposit
   */
  @Transactional
  public ConversionResult convert(UUID proposalId, String paymentReference) {
    var proposal =
        proposalRepository
            .findByIdForUpdate(proposalId)
            .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));

    if (proposal.isConverted()) {
      log.info(
          "Proposal {} already converted to booking {}",
          proposal.getProposalNumber(),
          proposal.getBookingNumber());
      return new ConversionResult(
          proposalId, proposal.getConvertedToBookingId(), proposal.getBookingNumber(), true);
    }
    if (proposal.getStatus() != ProposalStatus.ACCEPTED) {
      throw new InvalidStateTransitionException(
          proposalId,
          "Only accepted proposals can be converted, status is " + proposal.getStatus());
    }
    if (paymentReference == null || paymentReference.isBlank()) {
      throw new MissingRequiredFieldException("paymentReference", "converting a proposal");
    }

    verifyPayment(proposal, paymentReference);

    var booking = bookingStore.createBooking(buildBookingRequest(proposal, paymentReference));
    proposal.markConverted(
        booking.bookingId(), booking.bookingNumber(), paymentReference, clock.instant());
    proposalRepository.saveAndFlush(proposal);

    log.info(
        "Converted proposal {} to booking {}",
        proposal.getProposalNumber(),
        booking.bookingNumber());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(ProposalEvent.CONVERT.getAuditEventType())
            .entityType("proposal")
            .entityId(proposalId)
            .details(
                Map.of(
                    "proposal_number", proposal.getProposalNumber(),
                    "booking_id", booking.bookingId().toString(),
                    "booking_number", booking.bookingNumber(),
                    "payment_reference", paymentReference,
                    "from_status", ProposalStatus.ACCEPTED.name(),
                    "to_status", ProposalStatus.CONVERTED.name()))
            .build());
    eventPublisher.publishEvent(
        new ProposalConvertedEvent(
            proposalId,
            proposal.getProposalNumber(),
            booking.bookingId(),
            booking.bookingNumber(),
            proposal.getClientEmail(),
            proposal.getTotal(),
            proposal.getCurrency()));

    return new ConversionResult(proposalId, booking.bookingId(), booking.bookingNumber(), false);
  }

  private void verifyPayment(Proposal proposal, String paymentReference) {
    var confirmation = paymentConfirmationProvider.confirm(paymentReference);
    String failure = null;
    if (confirmation == null || !confirmation.verified()) {
      failure =
          confirmation != null && confirmation.failureReason() != null
              ? confirmation.failureReason()
              : "Payment provider did not verify the payment";
    } else if (confirmation.amount() == null
        || !proposal.getCurrency().equalsIgnoreCase(confirmation.currency())) {
      failure =
          "Payment currency %s does not match proposal currency %s"
              .formatted(confirmation.currency(), proposal.getCurrency());
    } else if (confirmation.amount().compareTo(proposal.getDepositAmount()) < 0) {
      failure =
          "Payment of %s is less than the deposit of %s"
              .formatted(confirmation.amount(), proposal.getDepositAmount());
    }
    if (failure != null) {
      log.warn(
          "Payment {} rejected for proposal {}: {}",
          paymentReference,
          proposal.getProposalNumber(),
          failure);
      throw new PaymentNotVerifiedException(proposal.getId(), paymentReference, failure);
    }
  }

  private BookingCreationRequest buildBookingRequest(Proposal proposal, String paymentReference) {
    var lines = new ArrayList<BookingLine>();
    for (var item : serviceItemRepository.findByProposalIdOrderBySortOrder(proposal.getId())) {
      lines.add(
          new BookingLine(
              "SERVICE",
              item.getServiceCategory().name(),
              item.getDescription() != null
                  ? item.getDescription()
                  : item.getServiceCategory().getDisplayLabel(),
              item.getServiceDate(),
              item.getPartySize(),
              item.getQuantity(),
              item.getEffectivePrice()));
    }
    for (var addOn : addOnRepository.findByProposalIdOrderBySortOrder(proposal.getId())) {
      lines.add(
          new BookingLine(
              "ADD_ON", null, addOn.getDescription(), null, null, null, addOn.getAmount()));
    }
    var acceptance = proposal.getAcceptance();
    return new BookingCreationRequest(
        proposal.getId(),
        proposal.getProposalNumber(),
        proposal.getClientName(),
        proposal.getClientEmail(),
        proposal.getClientPhone(),
        List.copyOf(lines),
        proposal.getCurrency(),
        proposal.getTotal(),
        proposal.getDepositAmount(),
        proposal.getBalanceAmount(),
        acceptance != null && acceptance.isGratuityAccepted()
            ? proposal.getGratuityAmount()
            : null,
        paymentReference);
  }
}
