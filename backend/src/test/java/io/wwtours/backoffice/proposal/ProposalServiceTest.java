package io.wwtours.backoffice.proposal;

import static io.wwtours.backoffice.testutil.TestProposals.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.wwtours.backoffice.audit.AuditService;
import io.wwtours.backoffice.exception.InvalidStateTransitionException;
import io.wwtours.backoffice.exception.ValidationFailedException;
import io.wwtours.backoffice.pricing.CustomFlatPriceCalculator;
import io.wwtours.backoffice.pricing.HourlyWaitPriceCalculator;
import io.wwtours.backoffice.pricing.OverrideResolver;
import io.wwtours.backoffice.pricing.PriceCalculationService;
import io.wwtours.backoffice.pricing.PriceOverride;
import io.wwtours.backoffice.pricing.ResolvedPrice;
import io.wwtours.backoffice.pricing.TimedTourPriceCalculator;
import io.wwtours.backoffice.pricing.TotalsCalculator;
import io.wwtours.backoffice.pricing.TransferPriceCalculator;
import io.wwtours.backoffice.proposal.dto.ProposalFilterCriteria;
import io.wwtours.backoffice.proposal.dto.ProposalHeader;
import io.wwtours.backoffice.proposal.dto.ServiceItemRequest;
import io.wwtours.backoffice.rate.DayTypeClassifier;
import io.wwtours.backoffice.rate.RateConfiguration;
import io.wwtours.backoffice.rate.ServiceCategory;
import io.wwtours.backoffice.testutil.TestProposals;
import io.wwtours.backoffice.testutil.TestRates;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
class ProposalServiceTest {

  private static final UUID PROPOSAL_ID = UUID.randomUUID();

  @Mock private ProposalRepository proposalRepository;
  @Mock private ProposalServiceItemRepository serviceItemRepository;
  @Mock private ProposalAddOnRepository addOnRepository;
  @Mock private ProposalNumberService proposalNumberService;
  @Mock private ProposalLifecycleService lifecycleService;
  @Mock private AuditService auditService;

  private final List<ProposalServiceItem> storedItems = new ArrayList<>();
  private RateConfiguration configuration = TestRates.configuration();
  private ServiceItemPricer pricer;
  private ProposalService service;

  @BeforeEach
  void setUp() {
    var classifier = new DayTypeClassifier();
    var priceCalculationService =
        new PriceCalculationService(
            List.of(
                new TimedTourPriceCalculator(classifier),
                new HourlyWaitPriceCalculator(classifier),
                new TransferPriceCalculator(),
                new CustomFlatPriceCalculator()),
            () -> configuration);
    pricer = new ServiceItemPricer(priceCalculationService, new OverrideResolver());
    service =
        new ProposalService(
            proposalRepository,
            serviceItemRepository,
            addOnRepository,
            proposalNumberService,
            lifecycleService,
            pricer,
            new TotalsCalculator(),
            () -> configuration,
            auditService,
            new ProposalProperties(10, 30, null),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  /** Backs the item repository with {@link #storedItems} and assigns ids on save. */
  private void stubItemStorage() {
    lenient()
        .when(serviceItemRepository.save(any(ProposalServiceItem.class)))
        .thenAnswer(
            invocation -> {
              ProposalServiceItem item = invocation.getArgument(0);
              if (item.getId() == null) {
                TestProposals.setField(item, "id", UUID.randomUUID());
              }
              if (!storedItems.contains(item)) {
                storedItems.add(item);
              }
              return item;
            });
    lenient()
        .when(serviceItemRepository.findByProposalIdOrderBySortOrder(any()))
        .thenAnswer(
            invocation ->
                storedItems.stream()
                    .filter(item -> item.getProposalId().equals(invocation.getArgument(0)))
                    .toList());
    lenient()
        .when(serviceItemRepository.countByProposalId(any()))
        .thenAnswer(
            invocation ->
                storedItems.stream()
                    .filter(item -> item.getProposalId().equals(invocation.getArgument(0)))
                    .count());
  }

  private void stubProposalSave() {
    when(proposalRepository.save(any(Proposal.class)))
        .thenAnswer(
            invocation -> {
              Proposal proposal = invocation.getArgument(0);
              if (proposal.getId() == null) {
                TestProposals.setField(proposal, "id", UUID.randomUUID());
              }
              return proposal;
            });
  }

  private static ProposalHeader header(BigDecimal discount, boolean gratuity) {
    return new ProposalHeader(
        "Jordan Reyes",
        "jordan@example.com",
        null,
        "Anniversary weekend",
        discount,
        gratuity,
        gratuity ? new BigDecimal("18") : null,
        true,
        null);
  }

  private static ServiceItemRequest sixHourTour(PriceOverride override) {
    return new ServiceItemRequest(
        ServiceCategory.TIMED_TOUR,
        "Southside wineries",
        TestRates.MONDAY,
        2,
        new BigDecimal("6"),
        null,
        null,
        override);
  }

  @Test
  void createProposal_pricesItemsAndStoresTotals() {
    stubItemStorage();
    stubProposalSave();
    when(proposalNumberService.allocateNumber()).thenReturn("TP-0007");

    var proposal =
        service.createProposal(
            header(new BigDecimal("10"), true), List.of(sixHourTour(null)), List.of());

    assertThat(proposal.getProposalNumber()).isEqualTo("TP-0007");
    assertThat(proposal.getStatus()).isEqualTo(ProposalStatus.DRAFT);
    assertThat(storedItems).hasSize(1);
    assertThat(storedItems.get(0).getEffectivePrice()).isEqualByComparingTo("510.00");
    assertThat(proposal.getTotal()).isEqualByComparingTo("500.77");
    assertThat(proposal.getDepositAmount()).isEqualByComparingTo("250.39");
    assertThat(proposal.getBalanceAmount()).isEqualByComparingTo("250.38");
    assertThat(proposal.getGratuityAmount()).isEqualByComparingTo("90.14");
    assertThat(proposal.getRateConfigVersion()).isEqualTo(TestRates.VERSION);
    assertThat(proposal.getValidUntil()).isEqualTo(NOW.plus(Duration.ofDays(30)));
    verify(auditService).log(argThat(record -> record.eventType().equals("proposal.created")));
  }

  @Test
  void addServiceItem_overrideWithoutReason_returnsWarning() {
    stubItemStorage();
    var proposal = TestProposals.draft(PROPOSAL_ID);
    when(proposalRepository.findByIdForEdit(PROPOSAL_ID)).thenReturn(Optional.of(proposal));

    var priced =
        service.addServiceItem(
            PROPOSAL_ID, sixHourTour(PriceOverride.fixed(new BigDecimal("450"), null)));

    assertThat(priced.warnings()).containsExactly(ResolvedPrice.OVERRIDE_REASON_MISSING);
    assertThat(priced.item().getCalculatedPrice()).isEqualByComparingTo("510.00");
    assertThat(priced.item().getEffectivePrice()).isEqualByComparingTo("450.00");
    assertThat(proposal.getServicesSubtotal()).isEqualByComparingTo("450.00");
  }

  @Test
  void addServiceItem_onAcceptedProposal_rejected() {
    when(proposalRepository.findByIdForEdit(PROPOSAL_ID))
        .thenReturn(Optional.of(TestProposals.accepted(PROPOSAL_ID)));

    assertThatThrownBy(() -> service.addServiceItem(PROPOSAL_ID, sixHourTour(null)))
        .isInstanceOf(InvalidStateTransitionException.class);
    verify(serviceItemRepository, never()).save(any());
  }

  @Test
  void recomputeTotals_frozenProposalUsesTaxSnapshot() {
    stubItemStorage();
    var proposal = TestProposals.sent(PROPOSAL_ID);
    var item = TestProposals.item(PROPOSAL_ID, UUID.randomUUID(), 0);
    item.updateDetails(
        ServiceCategory.TIMED_TOUR, null, TestRates.MONDAY, 2, new BigDecimal("6"), null, null);
    pricer.price(item, configuration);
    storedItems.add(item);
    when(proposalRepository.findByIdForUpdate(PROPOSAL_ID)).thenReturn(Optional.of(proposal));
    service.recomputeTotals(PROPOSAL_ID);
    proposal.markAccepted(TestProposals.acceptance(false), NOW);

    configuration = TestRates.configuration(new BigDecimal("0.20"), new BigDecimal("0.25"));
    var totals = service.recomputeTotals(PROPOSAL_ID);

    assertThat(totals.taxAmount()).isEqualByComparingTo("46.41");
    assertThat(totals.total()).isEqualByComparingTo("556.41");
    assertThat(totals.total()).isEqualByComparingTo(proposal.getTotal());
    assertThat(totals.depositAmount()).isEqualByComparingTo("278.21");
  }

  @Test
  void reorderServiceItems_mustListEveryItemOnce() {
    stubItemStorage();
    var first = TestProposals.item(PROPOSAL_ID, UUID.randomUUID(), 0);
    var second = TestProposals.item(PROPOSAL_ID, UUID.randomUUID(), 1);
    storedItems.addAll(List.of(first, second));
    when(proposalRepository.findByIdForEdit(PROPOSAL_ID))
        .thenReturn(Optional.of(TestProposals.draft(PROPOSAL_ID)));

    assertThatThrownBy(() -> service.reorderServiceItems(PROPOSAL_ID, List.of(first.getId())))
        .isInstanceOf(ValidationFailedException.class);

    var reordered =
        service.reorderServiceItems(PROPOSAL_ID, List.of(second.getId(), first.getId()));

    assertThat(reordered).containsExactly(second, first);
    assertThat(second.getSortOrder()).isZero();
  }

  @Test
  void reorderServiceItems_acceptedBeforeEditLock_rejected() {
    stubItemStorage();
    var first = TestProposals.item(PROPOSAL_ID, UUID.randomUUID(), 0);
    var second = TestProposals.item(PROPOSAL_ID, UUID.randomUUID(), 1);
    storedItems.addAll(List.of(first, second));
    // The locked read sees the acceptance that committed while the edit was waiting
    when(proposalRepository.findByIdForEdit(PROPOSAL_ID))
        .thenReturn(Optional.of(TestProposals.accepted(PROPOSAL_ID)));

    assertThatThrownBy(
            () -> service.reorderServiceItems(PROPOSAL_ID, List.of(second.getId(), first.getId())))
        .isInstanceOf(InvalidStateTransitionException.class);

    assertThat(first.getSortOrder()).isZero();
    assertThat(second.getSortOrder()).isEqualTo(1);
    verify(proposalRepository, never()).findById(any());
  }

  @Test
  void replaceAddOns_acceptedBeforeEditLock_rejected() {
    when(proposalRepository.findByIdForEdit(PROPOSAL_ID))
        .thenReturn(Optional.of(TestProposals.accepted(PROPOSAL_ID)));

    assertThatThrownBy(() -> service.replaceAddOns(PROPOSAL_ID, List.of()))
        .isInstanceOf(InvalidStateTransitionException.class);
    verifyNoInteractions(addOnRepository);
  }

  @Test
  void removeServiceItem_lastItemOfSentProposal_rejected() {
    stubItemStorage();
    var only = TestProposals.item(PROPOSAL_ID, UUID.randomUUID(), 0);
    storedItems.add(only);
    when(proposalRepository.findByIdForEdit(PROPOSAL_ID))
        .thenReturn(Optional.of(TestProposals.sent(PROPOSAL_ID)));
    when(serviceItemRepository.findById(only.getId())).thenReturn(Optional.of(only));

    assertThatThrownBy(() -> service.removeServiceItem(PROPOSAL_ID, only.getId()))
        .isInstanceOf(InvalidStateTransitionException.class);
    verify(serviceItemRepository, never()).delete(any());
  }

  @Test
  void reissue_declinedProposal_copiesIntoNewDraft() {
    stubItemStorage();
    stubProposalSave();
    var declined = TestProposals.sent(PROPOSAL_ID);
    var item = TestProposals.item(PROPOSAL_ID, UUID.randomUUID(), 0);
    item.updateDetails(
        ServiceCategory.TIMED_TOUR, null, TestRates.MONDAY, 2, new BigDecimal("6"), null, null);
    pricer.price(item, configuration);
    storedItems.add(item);
    declined.markDeclined("Dates no longer work", DeclineCategory.DATES, null, true, 10, NOW);
    when(proposalRepository.findById(PROPOSAL_ID)).thenReturn(Optional.of(declined));
    when(proposalNumberService.allocateNumber()).thenReturn("TP-0008");

    var copy = service.reissue(PROPOSAL_ID);

    assertThat(copy.getStatus()).isEqualTo(ProposalStatus.DRAFT);
    assertThat(copy.getProposalNumber()).isEqualTo("TP-0008");
    assertThat(copy.getReissuedFromId()).isEqualTo(PROPOSAL_ID);
    assertThat(copy.getClientEmail()).isEqualTo("jordan@example.com");
    assertThat(declined.getStatus()).isEqualTo(ProposalStatus.DECLINED);
    assertThat(storedItems).hasSize(2);
    assertThat(copy.getServicesSubtotal()).isEqualByComparingTo("510.00");
  }

  @Test
  void reissue_openProposal_rejected() {
    when(proposalRepository.findById(PROPOSAL_ID))
        .thenReturn(Optional.of(TestProposals.sent(PROPOSAL_ID)));

    assertThatThrownBy(() -> service.reissue(PROPOSAL_ID))
        .isInstanceOf(InvalidStateTransitionException.class);
  }

  @Test
  void deleteProposal_onlyDrafts() {
    when(proposalRepository.findById(PROPOSAL_ID))
        .thenReturn(Optional.of(TestProposals.sent(PROPOSAL_ID)));

    assertThatThrownBy(() -> service.deleteProposal(PROPOSAL_ID))
        .isInstanceOf(InvalidStateTransitionException.class);
    verify(proposalRepository, never()).delete(any());
  }

  @Test
  void getStats_acceptanceRateCountsConvertedAsWon() {
    // Unstubbed statuses count zero
    lenient().when(proposalRepository.countByStatus(ProposalStatus.ACCEPTED)).thenReturn(2L);
    lenient().when(proposalRepository.countByStatus(ProposalStatus.CONVERTED)).thenReturn(1L);
    lenient().when(proposalRepository.countByStatus(ProposalStatus.DECLINED)).thenReturn(1L);

    var stats = service.getStats();

    assertThat(stats.totalConverted()).isEqualTo(1);
    assertThat(stats.acceptanceRate()).isEqualTo(75.0);
  }

  @Test
  void listProposals_expiresOverdueProposalsBeforeFiltering() {
    var overdue = TestProposals.sent(PROPOSAL_ID);
    TestProposals.setField(overdue, "validUntil", NOW.minus(Duration.ofDays(1)));
    when(proposalRepository.findByStatusInAndValidUntilBefore(any(), eq(NOW)))
        .thenReturn(List.of(overdue));
    when(lifecycleService.expireIfOverdue(overdue))
        .thenAnswer(
            invocation -> {
              overdue.markExpired(NOW);
              return true;
            });
    var pageable = PageRequest.of(0, 20);
    when(proposalRepository.findFiltered(null, null, pageable))
        .thenReturn(new PageImpl<>(List.of(overdue), pageable, 1));

    var page = service.listProposals(new ProposalFilterCriteria(null, null), pageable);

    assertThat(page.getContent())
        .extracting(Proposal::getStatus)
        .containsExactly(ProposalStatus.EXPIRED);
    var order = inOrder(lifecycleService, proposalRepository);
    order.verify(lifecycleService).expireIfOverdue(overdue);
    order.verify(proposalRepository).findFiltered(null, null, pageable);
  }

  @Test
  void getStats_expiresOverdueProposalsBeforeCounting() {
    var overdue = TestProposals.sent(PROPOSAL_ID);
    TestProposals.setField(overdue, "validUntil", NOW.minus(Duration.ofDays(1)));
    when(proposalRepository.findByStatusInAndValidUntilBefore(any(), eq(NOW)))
        .thenReturn(List.of(overdue));

    service.getStats();

    var order = inOrder(lifecycleService, proposalRepository);
    order.verify(lifecycleService).expireIfOverdue(overdue);
    order.verify(proposalRepository).countByStatus(ProposalStatus.SENT);
  }

  @Test
  void getProposal_appliesLazyExpiry() {
    var proposal = TestProposals.sent(PROPOSAL_ID);
    when(proposalRepository.findById(PROPOSAL_ID)).thenReturn(Optional.of(proposal));

    service.getProposal(PROPOSAL_ID);

    verify(lifecycleService).expireIfOverdue(proposal);
  }
}
