package io.wwtours.backoffice.proposal;

import io.wwtours.backoffice.pricing.PricingMode;
import io.wwtours.backoffice.pricing.ProposalTotals;
import io.wwtours.backoffice.proposal.dto.AddOnRequest;
import io.wwtours.backoffice.proposal.dto.PricedItem;
import io.wwtours.backoffice.proposal.dto.ProposalFilterCriteria;
import io.wwtours.backoffice.proposal.dto.ProposalHeader;
import io.wwtours.backoffice.proposal.dto.ProposalStats;
import io.wwtours.backoffice.proposal.dto.ServiceItemRequest;
import io.wwtours.backoffice.proposal.dto.TransitionRequest;
import io.wwtours.backoffice.rate.DayType;
import io.wwtours.backoffice.rate.ServiceCategory;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProposalController {

  private final ProposalService proposalService;
  private final ProposalLifecycleService lifecycleService;
  private final ProposalConversionService conversionService;

  public ProposalController(
      ProposalService proposalService,
      ProposalLifecycleService lifecycleService,
      ProposalConversionService conversionService) {
    this.proposalService = proposalService;
    this.lifecycleService = lifecycleService;
    this.conversionService = conversionService;
  }

  // --- CRUD ---

  @PostMapping("/api/proposals")
  public ResponseEntity<ProposalDetailResponse> createProposal(
      @Valid @RequestBody CreateProposalRequest request) {
    var proposal =
        proposalService.createProposal(request.header(), request.items(), request.addOns());
    return ResponseEntity.created(URI.create("/api/proposals/" + proposal.getId()))
        .body(detail(proposal));
  }

  @GetMapping("/api/proposals")
  public ResponseEntity<Page<ProposalResponse>> listProposals(
      @RequestParam(required = false) ProposalStatus status,
      @RequestParam(required = false) String clientEmail,
      Pageable pageable) {
    var page =
        proposalService.listProposals(new ProposalFilterCriteria(status, clientEmail), pageable);
    return ResponseEntity.ok(page.map(ProposalResponse::from));
  }

  @GetMapping("/api/proposals/stats")
  public ResponseEntity<ProposalStats> getStats() {
    return ResponseEntity.ok(proposalService.getStats());
  }

  @GetMapping("/api/proposals/{id}")
  public ResponseEntity<ProposalDetailResponse> getProposal(@PathVariable UUID id) {
    return ResponseEntity.ok(detail(proposalService.getProposal(id)));
  }

  @PutMapping("/api/proposals/{id}")
  public ResponseEntity<ProposalDetailResponse> updateProposal(
      @PathVariable UUID id, @Valid @RequestBody UpdateProposalRequest request) {
    var proposal = proposalService.updateProposal(id, request.toHeader());
    return ResponseEntity.ok(detail(proposal));
  }

  @DeleteMapping("/api/proposals/{id}")
  public ResponseEntity<Void> deleteProposal(@PathVariable UUID id) {
    proposalService.deleteProposal(id);
    return ResponseEntity.noContent().build();
  }

  // --- Items and add-ons ---

  @PostMapping("/api/proposals/{id}/items")
  public ResponseEntity<ServiceItemResponse> addServiceItem(
      @PathVariable UUID id, @Valid @RequestBody ServiceItemRequest request) {
    var priced = proposalService.addServiceItem(id, request);
    return ResponseEntity.created(
            URI.create("/api/proposals/" + id + "/items/" + priced.item().getId()))
        .body(ServiceItemResponse.from(priced));
  }

  @PutMapping("/api/proposals/{id}/items/{itemId}")
  public ResponseEntity<ServiceItemResponse> updateServiceItem(
      @PathVariable UUID id,
      @PathVariable UUID itemId,
      @Valid @RequestBody ServiceItemRequest request) {
    var priced = proposalService.updateServiceItem(id, itemId, request);
    return ResponseEntity.ok(ServiceItemResponse.from(priced));
  }

  @DeleteMapping("/api/proposals/{id}/items/{itemId}")
  public ResponseEntity<Void> removeServiceItem(@PathVariable UUID id, @PathVariable UUID itemId) {
    proposalService.removeServiceItem(id, itemId);
    return ResponseEntity.noContent().build();
  }

  @PutMapping("/api/proposals/{id}/items/order")
  public ResponseEntity<List<ServiceItemResponse>> reorderServiceItems(
      @PathVariable UUID id, @RequestBody List<UUID> itemIds) {
    var items = proposalService.reorderServiceItems(id, itemIds);
    return ResponseEntity.ok(items.stream().map(ServiceItemResponse::from).toList());
  }

  @PutMapping("/api/proposals/{id}/add-ons")
  public ResponseEntity<List<AddOnResponse>> replaceAddOns(
      @PathVariable UUID id, @Valid @RequestBody List<AddOnRequest> addOns) {
    var saved = proposalService.replaceAddOns(id, addOns);
    return ResponseEntity.ok(saved.stream().map(AddOnResponse::from).toList());
  }

  @GetMapping("/api/proposals/{id}/totals")
  public ResponseEntity<ProposalTotals> getTotals(@PathVariable UUID id) {
    return ResponseEntity.ok(proposalService.recomputeTotals(id));
  }

  // --- Lifecycle ---

  @PostMapping("/api/proposals/{id}/transitions")
  public ResponseEntity<ProposalResponse> transition(
      @PathVariable UUID id,
      @Valid @RequestBody TransitionRequest request,
      HttpServletRequest httpRequest) {
    var payload =
        request.acceptance() != null
            ? new TransitionRequest(
                request.event(),
                request.acceptance().withIpAddress(httpRequest.getRemoteAddr()),
                request.decline(),
                request.paymentReference())
            : request;
    var proposal = lifecycleService.transition(id, request.event(), payload);
    return ResponseEntity.ok(ProposalResponse.from(proposal));
  }

  @PostMapping("/api/proposals/{id}/convert")
  public ResponseEntity<ConversionResult> convert(
      @PathVariable UUID id, @Valid @RequestBody ConvertRequest request) {
    return ResponseEntity.ok(conversionService.convert(id, request.paymentReference()));
  }

  @PostMapping("/api/proposals/{id}/reissue")
  public ResponseEntity<ProposalDetailResponse> reissue(@PathVariable UUID id) {
    var copy = proposalService.reissue(id);
    return ResponseEntity.created(URI.create("/api/proposals/" + copy.getId())).body(detail(copy));
  }

  @GetMapping("/api/proposals/{id}/activity")
  public ResponseEntity<List<ActivityResponse>> getActivity(@PathVariable UUID id) {
    var events =
        proposalService.getActivity(id).stream()
            .map(
                event ->
                    new ActivityResponse(
                        event.getEventType(),
                        event.getActorType(),
                        event.getDetails(),
                        event.getOccurredAt()))
            .toList();
    return ResponseEntity.ok(events);
  }

  private ProposalDetailResponse detail(Proposal proposal) {
    var items =
        proposalService.getServiceItems(proposal.getId()).stream()
            .map(ServiceItemResponse::from)
            .toList();
    var addOns =
        proposalService.getAddOns(proposal.getId()).stream().map(AddOnResponse::from).toList();
    return new ProposalDetailResponse(ProposalResponse.from(proposal), items, addOns);
  }

  // --- DTOs ---

  public record CreateProposalRequest(
      @NotBlank(message = "clientName is required")
          @Size(max = 200, message = "clientName must not exceed 200 characters")
          String clientName,
      @Size(max = 255) String clientEmail,
      @Size(max = 50) String clientPhone,
      @Size(max = 200) String title,
      BigDecimal discountPercentage,
      boolean gratuityEnabled,
      BigDecimal suggestedGratuityPercentage,
      Boolean gratuityOptional,
      Instant validUntil,
      List<@Valid ServiceItemRequest> items,
      List<@Valid AddOnRequest> addOns) {

    ProposalHeader header() {
      return new ProposalHeader(
          clientName,
          clientEmail,
          clientPhone,
          title,
          discountPercentage,
          gratuityEnabled,
          suggestedGratuityPercentage,
          gratuityOptional == null || gratuityOptional,
          validUntil);
    }
  }

  public record UpdateProposalRequest(
      @NotBlank(message = "clientName is required")
          @Size(max = 200, message = "clientName must not exceed 200 characters")
          String clientName,
      @Size(max = 255) String clientEmail,
      @Size(max = 50) String clientPhone,
      @Size(max = 200) String title,
      BigDecimal discountPercentage,
      boolean gratuityEnabled,
      BigDecimal suggestedGratuityPercentage,
      Boolean gratuityOptional,
      Instant validUntil) {

    ProposalHeader toHeader() {
      return new ProposalHeader(
          clientName,
          clientEmail,
          clientPhone,
          title,
          discountPercentage,
          gratuityEnabled,
          suggestedGratuityPercentage,
          gratuityOptional == null || gratuityOptional,
          validUntil);
    }
  }

  public record ConvertRequest(
      @NotBlank(message = "paymentReference is required") String paymentReference) {}

  public record ProposalResponse(
      UUID id,
      String proposalNumber,
      ProposalStatus status,
      String clientName,
      String clientEmail,
      String clientPhone,
      String title,
      String currency,
      BigDecimal discountPercentage,
      boolean gratuityEnabled,
      BigDecimal suggestedGratuityPercentage,
      boolean gratuityOptional,
      BigDecimal servicesSubtotal,
      BigDecimal addonsSubtotal,
      BigDecimal subtotal,
      BigDecimal discountAmount,
      BigDecimal taxAmount,
      BigDecimal total,
      BigDecimal depositAmount,
      BigDecimal balanceAmount,
      BigDecimal gratuityAmount,
      String rateConfigVersion,
      Instant validUntil,
      Instant sentAt,
      Instant firstViewedAt,
      Instant lastViewedAt,
      int viewCount,
      Instant acceptedAt,
      String acceptedByName,
      Boolean gratuityAccepted,
      Instant declinedAt,
      String declineReason,
      DeclineCategory declineCategory,
      Instant expiredAt,
      Instant convertedAt,
      UUID convertedToBookingId,
      String bookingNumber,
      UUID reissuedFromId,
      Instant createdAt,
      Instant updatedAt) {

    public static ProposalResponse from(Proposal proposal) {
      var acceptance = proposal.getAcceptance();
      return new ProposalResponse(
          proposal.getId(),
          proposal.getProposalNumber(),
          proposal.getStatus(),
          proposal.getClientName(),
          proposal.getClientEmail(),
          proposal.getClientPhone(),
          proposal.getTitle(),
          proposal.getCurrency(),
          proposal.getDiscountPercentage(),
          proposal.isGratuityEnabled(),
          proposal.getSuggestedGratuityPercentage(),
          proposal.isGratuityOptional(),
          proposal.getServicesSubtotal(),
          proposal.getAddonsSubtotal(),
          proposal.getSubtotal(),
          proposal.getDiscountAmount(),
          proposal.getTaxAmount(),
          proposal.getTotal(),
          proposal.getDepositAmount(),
          proposal.getBalanceAmount(),
          proposal.getGratuityAmount(),
          proposal.getRateConfigVersion(),
          proposal.getValidUntil(),
          proposal.getSentAt(),
          proposal.getFirstViewedAt(),
          proposal.getLastViewedAt(),
          proposal.getViewCount(),
          proposal.getAcceptedAt(),
          acceptance != null ? acceptance.getSignerName() : null,
          acceptance != null ? acceptance.isGratuityAccepted() : null,
          proposal.getDeclinedAt(),
          proposal.getDeclineReason(),
          proposal.getDeclineCategory(),
          proposal.getExpiredAt(),
          proposal.getConvertedAt(),
          proposal.getConvertedToBookingId(),
          proposal.getBookingNumber(),
          proposal.getReissuedFromId(),
          proposal.getCreatedAt(),
          proposal.getUpdatedAt());
    }
  }

  public record ServiceItemResponse(
      UUID id,
      int sortOrder,
      ServiceCategory serviceCategory,
      String description,
      LocalDate serviceDate,
      Integer partySize,
      BigDecimal quantity,
      String routeCode,
      BigDecimal flatAmount,
      PricingMode pricingMode,
      BigDecimal calculatedPrice,
      BigDecimal effectivePrice,
      BigDecimal variance,
      DayType dayType,
      String tierLabel,
      String overrideReason,
      List<String> warnings) {

    public static ServiceItemResponse from(ProposalServiceItem item) {
      return from(new PricedItem(item, List.of()));
    }

    public static ServiceItemResponse from(PricedItem priced) {
      var item = priced.item();
      return new ServiceItemResponse(
          item.getId(),
          item.getSortOrder(),
          item.getServiceCategory(),
          item.getDescription(),
          item.getServiceDate(),
          item.getPartySize(),
          item.getQuantity(),
          item.getRouteCode(),
          item.getFlatAmount(),
          item.getPricingMode(),
          item.getCalculatedPrice(),
          item.getEffectivePrice(),
          item.getEffectivePrice().subtract(item.getCalculatedPrice()),
          item.getDayType(),
          item.getTierLabel(),
          item.getOverrideReason(),
          priced.warnings());
    }
  }

  public record AddOnResponse(UUID id, int sortOrder, String description, BigDecimal amount) {

    public static AddOnResponse from(ProposalAddOn addOn) {
      return new AddOnResponse(
          addOn.getId(), addOn.getSortOrder(), addOn.getDescription(), addOn.getAmount());
    }
  }

  public record ProposalDetailResponse(
      ProposalResponse proposal, List<ServiceItemResponse> items, List<AddOnResponse> addOns) {}

  public record ActivityResponse(
      String eventType, String actorType, Map<String, Object> details, Instant occurredAt) {}
}
