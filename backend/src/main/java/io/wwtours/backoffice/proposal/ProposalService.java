package io.wwtours.backoffice.proposal;

import io.wwtours.backoffice.audit.AuditEvent;
import io.wwtours.backoffice.audit.AuditEventBuilder;
import io.wwtours.backoffice.audit.AuditService;
import io.wwtours.backoffice.exception.InvalidStateTransitionException;
import io.wwtours.backoffice.exception.MissingRequiredFieldException;
import io.wwtours.backoffice.exception.ResourceNotFoundException;
import io.wwtours.backoffice.exception.ValidationFailedException;
import io.wwtours.backoffice.pricing.ProposalTotals;
import io.wwtours.backoffice.pricing.TotalsCalculator;
import io.wwtours.backoffice.pricing.TotalsInput;
import io.wwtours.backoffice.proposal.dto.AddOnRequest;
import io.wwtours.backoffice.proposal.dto.PricedItem;
import io.wwtours.backoffice.proposal.dto.ProposalFilterCriteria;
import io.wwtours.backoffice.proposal.dto.ProposalHeader;
import io.wwtours.backoffice.proposal.dto.ProposalStats;
import io.wwtours.backoffice.proposal.dto.ServiceItemRequest;
import io.wwtours.backoffice.rate.RateConfiguration;
import io.wwtours.backoffice.rate.RateConfigurationStore;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Operator-facing proposal editing. Every change to items, add-ons, discount or gratuity re-prices
 * all items against one rate configuration snapshot and refreshes the cached totals.
 */
@Service
public class ProposalService {

  private static final Logger log = LoggerFactory.getLogger(ProposalService.class);

  private final ProposalRepository proposalRepository;
  private final ProposalServiceItemRepository serviceItemRepository;
  private final ProposalAddOnRepository addOnRepository;
  private final ProposalNumberService proposalNumberService;
  private final ProposalLifecycleService lifecycleService;
  private final ServiceItemPricer serviceItemPricer;
  private final TotalsCalculator totalsCalculator;
  private final RateConfigurationStore rateConfigurationStore;
  private final AuditService auditService;
  private final ProposalProperties properties;
  private final Clock clock;

  public ProposalService(
      ProposalRepository proposalRepository,
      ProposalServiceItemRepository serviceItemRepository,
      ProposalAddOnRepository addOnRepository,
      ProposalNumberService proposalNumberService,
      ProposalLifecycleService lifecycleService,
      ServiceItemPricer serviceItemPricer,
      TotalsCalculator totalsCalculator,
      RateConfigurationStore rateConfigurationStore,
      AuditService auditService,
      ProposalProperties properties,
      Clock clock) {
    this.proposalRepository = proposalRepository;
    this.serviceItemRepository = serviceItemRepository;
    this.addOnRepository = addOnRepository;
    this.proposalNumberService = proposalNumberService;
    this.lifecycleService = lifecycleService;
    this.serviceItemPricer = serviceItemPricer;
    this.totalsCalculator = totalsCalculator;
    this.rateConfigurationStore = rateConfigurationStore;
    this.auditService = auditService;
    this.properties = properties;
    this.clock = clock;
  }

  // --- CRUD ---

  @Transactional
  public Proposal createProposal(
      ProposalHeader header, List<ServiceItemRequest> items, List<AddOnRequest> addOns) {
    if (header == null || header.clientName() == null || header.clientName().isBlank()) {
      throw new MissingRequiredFieldException("clientName", "creating a proposal");
    }
    var configuration = rateConfigurationStore.current();
    var proposal =
        new Proposal(
            proposalNumberService.allocateNumber(),
            header.clientName().trim(),
            configuration.currency());
    applyHeader(proposal, header);
    if (proposal.getValidUntil() == null) {
      proposal.setValidUntil(
          clock.instant().plus(Duration.ofDays(properties.defaultValidityDays())));
    }
    proposal = proposalRepository.save(proposal);

    int order = 0;
    for (var item : items != null ? items : List.<ServiceItemRequest>of()) {
      serviceItemRepository.save(newItem(proposal.getId(), order++, item, configuration));
    }
    replaceAddOnRows(proposal.getId(), addOns);
    refreshTotals(proposal);

    log.info(
        "Created proposal {} for {} with {} items",
        proposal.getProposalNumber(),
        proposal.getClientName(),
        order);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("proposal.created")
            .entityType("proposal")
            .entityId(proposal.getId())
            .details(
                Map.of(
                    "proposal_number", proposal.getProposalNumber(),
                    "client_name", proposal.getClientName(),
                    "total", proposal.getTotal().toPlainString()))
            .build());
    return proposal;
  }

  @Transactional
  public Proposal updateProposal(UUID proposalId, ProposalHeader header) {
    var proposal = loadForEdit(proposalId);
    if (header.clientName() == null || header.clientName().isBlank()) {
      throw new MissingRequiredFieldException("clientName", "updating a proposal");
    }
    applyHeader(proposal, header);
    refreshTotals(proposal);
    logUpdate(proposal, "header");
    return proposal;
  }

  /** Loads the proposal, expiring it first if it is open and past its deadline. */
  @Transactional
  public Proposal getProposal(UUID proposalId) {
    var proposal = load(proposalId);
    lifecycleService.expireIfOverdue(proposal);
    return proposal;
  }

  /** Lists proposals. Open proposals past their deadline are expired first. */
  @Transactional
  public Page<Proposal> listProposals(ProposalFilterCriteria criteria, Pageable pageable) {
    expireOverdue();
    return proposalRepository.findFiltered(criteria.status(), criteria.clientEmail(), pageable);
  }

  @Transactional(readOnly = true)
  public List<ProposalServiceItem> getServiceItems(UUID proposalId) {
    load(proposalId);
    return serviceItemRepository.findByProposalIdOrderBySortOrder(proposalId);
  }

  @Transactional(readOnly = true)
  public List<ProposalAddOn> getAddOns(UUID proposalId) {
    load(proposalId);
    return addOnRepository.findByProposalIdOrderBySortOrder(proposalId);
  }

  /** Audit trail of the proposal, newest first. */
  @Transactional(readOnly = true)
  public List<AuditEvent> getActivity(UUID proposalId) {
    load(proposalId);
    return auditService.findByEntity("proposal", proposalId);
  }

  /** Deletes a draft with its items and add-ons. Sent proposals are kept for the record. */
  @Transactional
  public void deleteProposal(UUID proposalId) {
    var proposal = load(proposalId);
    if (proposal.getStatus() != ProposalStatus.DRAFT) {
      throw new InvalidStateTransitionException(
          proposalId, "Only draft proposals can be deleted, status is " + proposal.getStatus());
    }
    serviceItemRepository.deleteByProposalId(proposalId);
    addOnRepository.deleteByProposalId(proposalId);
    proposalRepository.delete(proposal);
    log.info("Deleted draft proposal {}", proposal.getProposalNumber());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("proposal.deleted")
            .entityType("proposal")
            .entityId(proposalId)
            .details(Map.of("proposal_number", proposal.getProposalNumber()))
            .build());
  }

  // --- Service items ---

  @Transactional
  public PricedItem addServiceItem(UUID proposalId, ServiceItemRequest request) {
    var proposal = loadForEdit(proposalId);
    proposal.requireEditable();
    int order = (int) serviceItemRepository.countByProposalId(proposalId);
    var item =
        serviceItemRepository.save(
            newItem(proposalId, order, request, rateConfigurationStore.current()));
    var warnings = refreshTotals(proposal).getOrDefault(item.getId(), List.of());
    logUpdate(proposal, "item_added");
    return new PricedItem(item, warnings);
  }

  @Transactional
  public PricedItem updateServiceItem(UUID proposalId, UUID itemId, ServiceItemRequest request) {
    var proposal = loadForEdit(proposalId);
    proposal.requireEditable();
    var item = loadItem(proposalId, itemId);
    item.updateDetails(
        request.serviceCategory(),
        request.description(),
        request.serviceDate(),
        request.partySize(),
        request.quantity(),
        request.routeCode(),
        request.flatAmount());
    item.updateOverride(request.override());
    var warnings = refreshTotals(proposal).getOrDefault(item.getId(), List.of());
    logUpdate(proposal, "item_updated");
    return new PricedItem(item, warnings);
  }

  @Transactional
  public void removeServiceItem(UUID proposalId, UUID itemId) {
    var proposal = loadForEdit(proposalId);
    proposal.requireEditable();
    var item = loadItem(proposalId, itemId);
    // A sent proposal must keep at least one item, just like sending requires one
    if (proposal.getStatus() != ProposalStatus.DRAFT
        && serviceItemRepository.countByProposalId(proposalId) <= 1) {
      throw new InvalidStateTransitionException(
          proposalId, "Cannot remove the last service item of a sent proposal");
    }
    serviceItemRepository.delete(item);
    serviceItemRepository.flush();
    var remaining = serviceItemRepository.findByProposalIdOrderBySortOrder(proposalId);
    for (int i = 0; i < remaining.size(); i++) {
      remaining.get(i).setSortOrder(i);
    }
    refreshTotals(proposal);
    logUpdate(proposal, "item_removed");
  }

  /** Reorders items. {@code orderedItemIds} must name every item of the proposal exactly once. */
  @Transactional
  public List<ProposalServiceItem> reorderServiceItems(UUID proposalId, List<UUID> orderedItemIds) {
    var proposal = loadForEdit(proposalId);
    proposal.requireEditable();
    var items = serviceItemRepository.findByProposalIdOrderBySortOrder(proposalId);
    var known = items.stream().map(ProposalServiceItem::getId).toList();
    if (orderedItemIds.size() != known.size()
        || !new HashSet<>(orderedItemIds).equals(new HashSet<>(known))) {
      throw new ValidationFailedException(
          "itemIds", "Item order must list every item of the proposal exactly once");
    }
    for (var item : items) {
      item.setSortOrder(orderedItemIds.indexOf(item.getId()));
    }
    logUpdate(proposal, "items_reordered");
    return items.stream()
        .sorted(Comparator.comparingInt(ProposalServiceItem::getSortOrder))
        .toList();
  }

  // --- Add-ons ---

  @Transactional
  public List<ProposalAddOn> replaceAddOns(UUID proposalId, List<AddOnRequest> addOns) {
    var proposal = loadForEdit(proposalId);
    proposal.requireEditable();
    var saved = replaceAddOnRows(proposalId, addOns);
    refreshTotals(proposal);
    logUpdate(proposal, "add_ons_replaced");
    return saved;
  }

  // --- Totals ---

  /**
   * Returns the proposal totals. For an editable proposal the items are re-priced against the
   * current rate configuration and the result is stored; otherwise the totals are derived from the
   * frozen item prices and the tax snapshot taken when the proposal was last edited.
   */
  @Transactional
  public ProposalTotals recomputeTotals(UUID proposalId) {
    var proposal =
        proposalRepository
            .findByIdForUpdate(proposalId)
            .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));
    if (proposal.isEditable()) {
      refreshTotals(proposal);
      return totalsOf(proposal);
    }
    return totalsCalculator.recompute(
        totalsInput(
            proposal,
            proposal.getTaxRate(),
            proposal.getDepositFraction(),
            serviceItemRepository.findByProposalIdOrderBySortOrder(proposalId),
            addOnRepository.findByProposalIdOrderBySortOrder(proposalId)));
  }

  // --- Reissue ---

  /**
   * Copies a declined or expired proposal into a new draft. The original is left untouched and
   * stays terminal.
   */
  @Transactional
  public Proposal reissue(UUID proposalId) {
    var original = load(proposalId);
    if (original.getStatus() != ProposalStatus.DECLINED
        && original.getStatus() != ProposalStatus.EXPIRED) {
      throw new InvalidStateTransitionException(
          proposalId,
          "Only declined or expired proposals can be reissued, status is "
              + original.getStatus());
    }
    var configuration = rateConfigurationStore.current();
    var copy =
        new Proposal(
            proposalNumberService.allocateNumber(),
            original.getClientName(),
            configuration.currency());
    copy.updateClient(
        original.getClientName(), original.getClientEmail(), original.getClientPhone());
    copy.setTitle(original.getTitle());
    copy.setDiscountPercentage(original.getDiscountPercentage());
    copy.setGratuity(
        original.isGratuityEnabled(),
        original.getSuggestedGratuityPercentage(),
        original.isGratuityOptional());
    copy.setValidUntil(clock.instant().plus(Duration.ofDays(properties.defaultValidityDays())));
    copy.setReissuedFromId(original.getId());
    copy = proposalRepository.save(copy);

    for (var item : serviceItemRepository.findByProposalIdOrderBySortOrder(proposalId)) {
      var clone =
          new ProposalServiceItem(copy.getId(), item.getSortOrder(), item.getServiceCategory());
      clone.updateDetails(
          item.getServiceCategory(),
          item.getDescription(),
          item.getServiceDate(),
          item.getPartySize(),
          item.getQuantity(),
          item.getRouteCode(),
          item.getFlatAmount());
      clone.updateOverride(item.toOverride());
      serviceItemPricer.price(clone, configuration);
      serviceItemRepository.save(clone);
    }
    var addOns =
        addOnRepository.findByProposalIdOrderBySortOrder(proposalId).stream()
            .map(addOn -> new AddOnRequest(addOn.getDescription(), addOn.getAmount()))
            .toList();
    replaceAddOnRows(copy.getId(), addOns);
    refreshTotals(copy);

    log.info(
        "Reissued proposal {} as {}", original.getProposalNumber(), copy.getProposalNumber());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("proposal.reissued")
            .entityType("proposal")
            .entityId(copy.getId())
            .details(
                Map.of(
                    "proposal_number", copy.getProposalNumber(),
                    "reissued_from", original.getProposalNumber()))
            .build());
    return copy;
  }

  // --- Stats ---

  @Transactional
  public ProposalStats getStats() {
    expireOverdue();
    long draft = proposalRepository.countByStatus(ProposalStatus.DRAFT);
    long sent = proposalRepository.countByStatus(ProposalStatus.SENT);
    long viewed = proposalRepository.countByStatus(ProposalStatus.VIEWED);
    long accepted = proposalRepository.countByStatus(ProposalStatus.ACCEPTED);
    long declined = proposalRepository.countByStatus(ProposalStatus.DECLINED);
    long expired = proposalRepository.countByStatus(ProposalStatus.EXPIRED);
    long converted = proposalRepository.countByStatus(ProposalStatus.CONVERTED);

    double acceptanceRate = 0.0;
    long won = accepted + converted;
    long decided = won + declined;
    if (decided > 0) {
      acceptanceRate = (double) won / decided * 100.0;
    }
    return new ProposalStats(
        draft, sent, viewed, accepted, declined, expired, converted, acceptanceRate);
  }

  // --- Internals ---

  /**
   * Re-prices every item against one configuration snapshot and stores the new totals.
   *
   * @return pricing warnings per item id; items without warnings are absent
   */
  private Map<UUID, List<String>> refreshTotals(Proposal proposal) {
    var configuration = rateConfigurationStore.current();
    var items = serviceItemRepository.findByProposalIdOrderBySortOrder(proposal.getId());
    var warnings = new HashMap<UUID, List<String>>();
    for (var item : items) {
      var resolved = serviceItemPricer.price(item, configuration);
      if (!resolved.warnings().isEmpty()) {
        warnings.put(item.getId(), resolved.warnings());
      }
    }
    var totals =
        totalsCalculator.recompute(
            totalsInput(
                proposal,
                configuration.taxRate(),
                configuration.depositFraction(),
                items,
                addOnRepository.findByProposalIdOrderBySortOrder(proposal.getId())));
    proposal.applyTotals(
        totals, configuration.taxRate(), configuration.depositFraction(), configuration.version());
    proposalRepository.save(proposal);
    log.debug(
        "Recomputed totals for proposal {}: total={}",
        proposal.getProposalNumber(),
        totals.total());
    return warnings;
  }

  private static TotalsInput totalsInput(
      Proposal proposal,
      BigDecimal taxRate,
      BigDecimal depositFraction,
      List<ProposalServiceItem> items,
      List<ProposalAddOn> addOns) {
    return new TotalsInput(
        items.stream().map(ProposalServiceItem::getEffectivePrice).toList(),
        addOns.stream().map(ProposalAddOn::getAmount).toList(),
        proposal.getDiscountPercentage(),
        taxRate,
        depositFraction,
        proposal.isGratuityEnabled(),
        proposal.getSuggestedGratuityPercentage());
  }

  private static ProposalTotals totalsOf(Proposal proposal) {
    return new ProposalTotals(
        proposal.getServicesSubtotal(),
        proposal.getAddonsSubtotal(),
        proposal.getSubtotal(),
        proposal.getDiscountAmount(),
        proposal.getSubtotal().subtract(proposal.getDiscountAmount()),
        proposal.getTaxAmount(),
        proposal.getTotal(),
        proposal.getDepositAmount(),
        proposal.getBalanceAmount(),
        proposal.getGratuityAmount());
  }

  private static void applyHeader(Proposal proposal, ProposalHeader header) {
    proposal.updateClient(header.clientName().trim(), header.clientEmail(), header.clientPhone());
    proposal.setTitle(header.title());
    proposal.setDiscountPercentage(header.discountPercentage());
    proposal.setGratuity(
        header.gratuityEnabled(), header.suggestedGratuityPercentage(), header.gratuityOptional());
    if (header.validUntil() != null) {
      proposal.setValidUntil(header.validUntil());
    }
  }

  // Priced before it is saved: price columns are not nullable
  private ProposalServiceItem newItem(
      UUID proposalId,
      int sortOrder,
      ServiceItemRequest request,
      RateConfiguration configuration) {
    var item = new ProposalServiceItem(proposalId, sortOrder, request.serviceCategory());
    item.updateDetails(
        request.serviceCategory(),
        request.description(),
        request.serviceDate(),
        request.partySize(),
        request.quantity(),
        request.routeCode(),
        request.flatAmount());
    item.updateOverride(request.override());
    serviceItemPricer.price(item, configuration);
    return item;
  }

  private List<ProposalAddOn> replaceAddOnRows(UUID proposalId, List<AddOnRequest> addOns) {
    addOnRepository.deleteByProposalId(proposalId);
    addOnRepository.flush();
    var saved = new ArrayList<ProposalAddOn>();
    int order = 0;
    for (var addOn : addOns != null ? addOns : List.<AddOnRequest>of()) {
      saved.add(
          addOnRepository.save(
              new ProposalAddOn(proposalId, order++, addOn.description(), addOn.amount())));
    }
    return saved;
  }

  private void expireOverdue() {
    var overdue =
        proposalRepository.findByStatusInAndValidUntilBefore(
            EnumSet.of(ProposalStatus.DRAFT, ProposalStatus.SENT, ProposalStatus.VIEWED),
            clock.instant());
    for (var proposal : overdue) {
      lifecycleService.expireIfOverdue(proposal);
    }
  }

  private Proposal loadForEdit(UUID proposalId) {
    return proposalRepository
        .findByIdForEdit(proposalId)
        .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));
  }

  private Proposal load(UUID proposalId) {
    return proposalRepository
        .findById(proposalId)
        .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));
  }

  private ProposalServiceItem loadItem(UUID proposalId, UUID itemId) {
    return serviceItemRepository
        .findById(itemId)
        .filter(item -> item.getProposalId().equals(proposalId))
        .orElseThrow(() -> new ResourceNotFoundException("ServiceItem", itemId));
  }

  private void logUpdate(Proposal proposal, String change) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("proposal.updated")
            .entityType("proposal")
            .entityId(proposal.getId())
            .details(
                Map.of(
                    "proposal_number", proposal.getProposalNumber(),
                    "change", change,
                    "total", proposal.getTotal().toPlainString()))
            .build());
  }
}
