package io.wwtours.backoffice.proposal;

import io.wwtours.backoffice.pricing.OverrideMode;
import io.wwtours.backoffice.pricing.PriceOverride;
import io.wwtours.backoffice.pricing.PriceQuote;
import io.wwtours.backoffice.pricing.PricingInput;
import io.wwtours.backoffice.pricing.PricingMode;
import io.wwtours.backoffice.pricing.ResolvedPrice;
import io.wwtours.backoffice.rate.DayType;
import io.wwtours.backoffice.rate.ServiceCategory;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * One priced service on a proposal. Holds both the calculated price and the effective price so an
 * override never hides what the rate table said.
 */
@Entity
@Table(name = "proposal_service_items")
public class ProposalServiceItem {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "proposal_id", nullable = false)
  private UUID proposalId;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Enumerated(EnumType.STRING)
  @Column(name = "service_category", nullable = false, length = 30)
  private ServiceCategory serviceCategory;

  @Column(name = "description", length = 500)
  private String description;

  @Column(name = "service_date")
  private LocalDate serviceDate;

  @Column(name = "party_size")
  private Integer partySize;

  @Column(name = "quantity", precision = 8, scale = 2)
  private BigDecimal quantity;

  @Column(name = "route_code", length = 50)
  private String routeCode;

  @Column(name = "flat_amount", precision = 12, scale = 2)
  private BigDecimal flatAmount;

  // --- Override ---

  @Column(name = "override_enabled", nullable = false)
  private boolean overrideEnabled;

  @Enumerated(EnumType.STRING)
  @Column(name = "override_mode", length = 10)
  private OverrideMode overrideMode;

  @Column(name = "override_rate_or_amount", precision = 12, scale = 2)
  private BigDecimal overrideRateOrAmount;

  @Column(name = "override_reason", length = 500)
  private String overrideReason;

  // --- Pricing result ---

  @Enumerated(EnumType.STRING)
  @Column(name = "pricing_mode", nullable = false, length = 20)
  private PricingMode pricingMode = PricingMode.CALCULATED;

  @Column(name = "calculated_price", nullable = false, precision = 12, scale = 2)
  private BigDecimal calculatedPrice = BigDecimal.ZERO;

  @Column(name = "effective_price", nullable = false, precision = 12, scale = 2)
  private BigDecimal effectivePrice = BigDecimal.ZERO;

  @Enumerated(EnumType.STRING)
  @Column(name = "day_type", length = 20)
  private DayType dayType;

  @Column(name = "tier_label", length = 100)
  private String tierLabel;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ProposalServiceItem() {}

  public ProposalServiceItem(UUID proposalId, int sortOrder, ServiceCategory serviceCategory) {
    this.proposalId = Objects.requireNonNull(proposalId, "proposalId must not be null");
    this.sortOrder = sortOrder;
    this.serviceCategory =
        Objects.requireNonNull(serviceCategory, "serviceCategory must not be null");
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  /** Replaces the pricing inputs. The caller re-prices the item afterwards. */
  public void updateDetails(
      ServiceCategory serviceCategory,
      String description,
      LocalDate serviceDate,
      Integer partySize,
      BigDecimal quantity,
      String routeCode,
      BigDecimal flatAmount) {
    this.serviceCategory =
        Objects.requireNonNull(serviceCategory, "serviceCategory must not be null");
    this.description = description;
    this.serviceDate = serviceDate;
    this.partySize = partySize;
    this.quantity = quantity;
    this.routeCode = routeCode;
    this.flatAmount = flatAmount;
  }

  public void updateOverride(PriceOverride override) {
    var value = override != null ? override : PriceOverride.none();
    this.overrideEnabled = value.enabled();
    this.overrideMode = value.mode();
    this.overrideRateOrAmount = value.rateOrAmount();
    this.overrideReason = value.reason();
  }

  public void applyPrice(PriceQuote quote, ResolvedPrice resolved) {
    this.calculatedPrice = resolved.calculatedPrice();
    this.effectivePrice = resolved.effectivePrice();
    this.pricingMode = resolved.pricingMode();
    this.dayType = quote.dayType();
    this.tierLabel = quote.tierLabel();
  }

  public PricingInput toPricingInput() {
    return new PricingInput(
        serviceCategory, serviceDate, partySize, quantity, routeCode, flatAmount);
  }

  public PriceOverride toOverride() {
    return new PriceOverride(overrideEnabled, overrideMode, overrideRateOrAmount, overrideReason);
  }

  public void setSortOrder(int sortOrder) {
    this.sortOrder = sortOrder;
  }

  public UUID getId() {
    return id;
  }

  public UUID getProposalId() {
    return proposalId;
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public ServiceCategory getServiceCategory() {
    return serviceCategory;
  }

  public String getDescription() {
    return description;
  }

  public LocalDate getServiceDate() {
    return serviceDate;
  }

  public Integer getPartySize() {
    return partySize;
  }

  public BigDecimal getQuantity() {
    return quantity;
  }

  public String getRouteCode() {
    return routeCode;
  }

  public BigDecimal getFlatAmount() {
    return flatAmount;
  }

  public boolean isOverrideEnabled() {
    return overrideEnabled;
  }

  public OverrideMode getOverrideMode() {
    return overrideMode;
  }

  public BigDecimal getOverrideRateOrAmount() {
    return overrideRateOrAmount;
  }

  public String getOverrideReason() {
    return overrideReason;
  }

  public PricingMode getPricingMode() {
    return pricingMode;
  }

  public BigDecimal getCalculatedPrice() {
    return calculatedPrice;
  }

  public BigDecimal getEffectivePrice() {
    return effectivePrice;
  }

  public DayType getDayType() {
    return dayType;
  }

  public String getTierLabel() {
    return tierLabel;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
