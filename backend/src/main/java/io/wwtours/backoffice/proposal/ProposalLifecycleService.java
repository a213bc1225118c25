package io.wwtours.backoffice.proposal;

import io.wwtours.backoffice.audit.AuditEventBuilder;
import io.wwtours.backoffice.audit.AuditService;
import io.wwtours.backoffice.exception.InvalidStateTransitionException;
import io.wwtours.backoffice.exception.MissingRequiredFieldException;
import io.wwtours.backoffice.exception.ResourceNotFoundException;
import io.wwtours.backoffice.proposal.dto.AcceptanceRequest;
import io.wwtours.backoffice.proposal.dto.DeclineRequest;
import io.wwtours.backoffice.proposal.dto.TransitionRequest;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Applies lifecycle events to proposals. Each transition is guarded by the entity, audited, and
 * announced with a {@link ProposalTransitionedEvent}.
 *
 * <p>Saves are flushed immediately so that a version conflict with a concurrent transition
 * surfaces here as {@link InvalidStateTransitionException} rather than at commit.
 */
@Service
@EnableConfigurationProperties(ProposalProperties.class)
public class ProposalLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(ProposalLifecycleService.class);

  private final ProposalRepository proposalRepository;
  private final ProposalServiceItemRepository serviceItemRepository;
  private final ProposalConversionService conversionService;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;
  private final ProposalProperties properties;
  private final Clock clock;

  public ProposalLifecycleService(
      ProposalRepository proposalRepository,
      ProposalServiceItemRepository serviceItemRepository,
      ProposalConversionService conversionService,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher,
      ProposalProperties properties,
      Clock clock) {
    this.proposalRepository = proposalRepository;
    this.serviceItemRepository = serviceItemRepository;
    this.conversionService = conversionService;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Applies {@code event} to the proposal.
   *
   * @return the proposal after the transition
   * @throws InvalidStateTransitionException if the event is not allowed from the current status,
   *     a guard fails, or a concurrent transition won
   */
  @Transactional
  public Proposal transition(UUID proposalId, ProposalEvent event, TransitionRequest payload) {
    var request = payload != null ? payload : TransitionRequest.of(event);
    return switch (event) {
      case SEND -> send(proposalId);
      case VIEW -> recordView(proposalId);
      case ACCEPT -> accept(proposalId, request.acceptance());
      case DECLINE -> decline(proposalId, request.decline());
      case EXPIRE -> expire(proposalId);
      case CONVERT -> {
        conversionService.convert(proposalId, request.paymentReference());
        yield load(proposalId);
      }
    };
  }

  @Transactional
  public Proposal send(UUID proposalId) {
    var proposal = load(proposalId);
    var from = proposal.getStatus();
    int itemCount = (int) serviceItemRepository.countByProposalId(proposalId);
    proposal.markSent(itemCount, clock.instant());
    proposal = save(proposal);
    log.info("Sent proposal {} to {}", proposal.getProposalNumber(), proposal.getClientEmail());
    recordTransition(
        proposal, ProposalEvent.SEND, from, Map.of("client_email", proposal.getClientEmail()));
    return proposal;
  }

  @Transactional
  public Proposal recordView(UUID proposalId) {
    var proposal = load(proposalId);
    var from = proposal.getStatus();
    proposal.recordView(clock.instant());
    proposal = save(proposal);
    log.debug(
        "Proposal {} viewed ({} views)", proposal.getProposalNumber(), proposal.getViewCount());
    // Only the first view is a status change worth announcing
    if (from != proposal.getStatus()) {
      recordTransition(
          proposal, ProposalEvent.VIEW, from, Map.of("view_count", proposal.getViewCount()));
    }
    return proposal;
  }

  @Transactional
  public Proposal accept(UUID proposalId, AcceptanceRequest acceptance) {
    if (acceptance == null) {
      throw new MissingRequiredFieldException("acceptance", "accepting a proposal");
    }
    var proposal = load(proposalId);
    var from = proposal.getStatus();
    boolean gratuityAccepted =
        proposal.isGratuityEnabled()
            && (!proposal.isGratuityOptional() || acceptance.gratuityAccepted());
    proposal.markAccepted(
        new AcceptanceRecord(
            acceptance.signature(),
            acceptance.signerName(),
            acceptance.signerEmail(),
            acceptance.ipAddress(),
            gratuityAccepted),
        clock.instant());
    proposal = save(proposal);
    log.info(
        "Proposal {} accepted by {} (total {} {})",
        proposal.getProposalNumber(),
        acceptance.signerName(),
        proposal.getTotal(),
        proposal.getCurrency());

    var details = new HashMap<String, Object>();
    details.put("signer_name", acceptance.signerName());
    details.put("total", proposal.getTotal().toPlainString());
    details.put("gratuity_accepted", gratuityAccepted);
    if (acceptance.ipAddress() != null) {
      details.put("ip_address", acceptance.ipAddress());
    }
    recordTransition(proposal, ProposalEvent.ACCEPT, from, details);
    return proposal;
  }

  @Transactional
  public Proposal decline(UUID proposalId, DeclineRequest decline) {
    if (decline == null) {
      throw new MissingRequiredFieldException("reason", "declining a proposal");
    }
    var proposal = load(proposalId);
    var from = proposal.getStatus();
    proposal.markDeclined(
        decline.reason(),
        decline.category(),
        decline.desiredChanges(),
        decline.openToCounter(),
        properties.declineReasonMinLength(),
        clock.instant());
    proposal = save(proposal);
    log.info(
        "Proposal {} declined ({})", proposal.getProposalNumber(), proposal.getDeclineCategory());

    var details = new HashMap<String, Object>();
    details.put("reason", proposal.getDeclineReason());
    if (proposal.getDeclineCategory() != null) {
      details.put("category", proposal.getDeclineCategory().name());
    }
    if (proposal.getOpenToCounter() != null) {
      details.put("open_to_counter", proposal.getOpenToCounter());
    }
    recordTransition(proposal, ProposalEvent.DECLINE, from, details);
    return proposal;
  }

  @Transactional
  public Proposal expire(UUID proposalId) {
    var proposal = load(proposalId);
    var from = proposal.getStatus();
    proposal.markExpired(clock.instant());
    proposal = save(proposal);
    log.info("Proposal {} expired", proposal.getProposalNumber());
    recordTransition(
        proposal,
        ProposalEvent.EXPIRE,
        from,
        Map.of("valid_until", proposal.getValidUntil().toString()));
    return proposal;
  }

  /**
   * Expires the proposal if it is open and past its deadline. Called on read and by the sweep.
   *
   * @return true if the proposal was expired by this call
   */
  @Transactional
  public boolean expireIfOverdue(Proposal proposal) {
    if (!proposal.isOverdue(clock.instant())) {
      return false;
    }
    var from = proposal.getStatus();
    proposal.markExpired(clock.instant());
    save(proposal);
    log.info(
        "Proposal {} expired on access (valid until {})",
        proposal.getProposalNumber(),
        proposal.getValidUntil());
    recordTransition(
        proposal,
        ProposalEvent.EXPIRE,
        from,
        Map.of("valid_until", proposal.getValidUntil().toString(), "lazy", true));
    return true;
  }

  private Proposal load(UUID proposalId) {
    return proposalRepository
        .findById(proposalId)
        .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));
  }

  private Proposal save(Proposal proposal) {
    try {
      return proposalRepository.saveAndFlush(proposal);
    } catch (ObjectOptimisticLockingFailureException e) {
      log.warn("Lost transition race on proposal {}", proposal.getProposalNumber());
      throw new InvalidStateTransitionException(
          proposal.getId(), "Proposal was modified concurrently. Reload and retry.");
    }
  }

  private void recordTransition(
      Proposal proposal, ProposalEvent event, ProposalStatus from, Map<String, Object> extra) {
    var details = new HashMap<String, Object>(extra);
    details.put("proposal_number", proposal.getProposalNumber());
    details.put("from_status", from.name());
    details.put("to_status", proposal.getStatus().name());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(event.getAuditEventType())
            .entityType("proposal")
            .entityId(proposal.getId())
            .details(details)
            .build());
    eventPublisher.publishEvent(
        new ProposalTransitionedEvent(
            proposal.getId(),
            proposal.getProposalNumber(),
            event,
            from,
            proposal.getStatus(),
            proposal.getClientEmail(),
            clock.instant()));
  }
}
