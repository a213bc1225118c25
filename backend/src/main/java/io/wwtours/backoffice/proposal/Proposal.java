package io.wwtours.backoffice.proposal;

import io.wwtours.backoffice.exception.InvalidStateTransitionException;
import io.wwtours.backoffice.exception.MissingRequiredFieldException;
import io.wwtours.backoffice.exception.ProposalExpiredException;
import io.wwtours.backoffice.exception.ValidationFailedException;
import io.wwtours.backoffice.pricing.ProposalTotals;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A priced offer to a client for one or more tour services.
 *
 * <p>Lifecycle: DRAFT → SENT → VIEWED → ACCEPTED → CONVERTED, with DECLINED and EXPIRED as exits
 * from any open status. Items and pricing fields are editable in DRAFT, SENT and VIEWED only. The
 * stored totals are a cache of what {@code TotalsCalculator} derives from items and add-ons.
 *
 * <p>{@link #version} guards every status change: a transition computed from a stale read fails on
 * flush instead of overwriting a concurrent one.
 */
@Entity
@Table(name = "proposals")
public class Proposal {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "proposal_number", nullable = false, unique = true, length = 20)
  private String proposalNumber;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ProposalStatus status;

  // --- Client contact ---

  @Column(name = "client_name", nullable = false, length = 200)
  private String clientName;

  @Column(name = "client_email", length = 255)
  private String clientEmail;

  @Column(name = "client_phone", length = 50)
  private String clientPhone;

  @Column(name = "title", length = 200)
  private String title;

  // --- Pricing inputs ---

  @Column(name = "discount_percentage", nullable = false, precision = 5, scale = 2)
  private BigDecimal discountPercentage = BigDecimal.ZERO;

  @Column(name = "gratuity_enabled", nullable = false)
  private boolean gratuityEnabled;

  @Column(name = "suggested_gratuity_percentage", nullable = false, precision = 5, scale = 2)
  private BigDecimal suggestedGratuityPercentage = BigDecimal.ZERO;

  @Column(name = "gratuity_optional", nullable = false)
  private boolean gratuityOptional = true;

  @Column(name = "valid_until")
  private Instant validUntil;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  // --- Computed totals ---

  @Column(name = "services_subtotal", nullable = false, precision = 12, scale = 2)
  private BigDecimal servicesSubtotal = BigDecimal.ZERO;

  @Column(name = "addons_subtotal", nullable = false, precision = 12, scale = 2)
  private BigDecimal addonsSubtotal = BigDecimal.ZERO;

  @Column(name = "subtotal", nullable = false, precision = 12, scale = 2)
  private BigDecimal subtotal = BigDecimal.ZERO;

  @Column(name = "discount_amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal discountAmount = BigDecimal.ZERO;

  @Column(name = "tax_amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal taxAmount = BigDecimal.ZERO;

  @Column(name = "total", nullable = false, precision = 12, scale = 2)
  private BigDecimal total = BigDecimal.ZERO;

  @Column(name = "deposit_amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal depositAmount = BigDecimal.ZERO;

  @Column(name = "balance_amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal balanceAmount = BigDecimal.ZERO;

  @Column(name = "gratuity_amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal gratuityAmount = BigDecimal.ZERO;

  @Column(name = "tax_rate", nullable = false, precision = 6, scale = 4)
  private BigDecimal taxRate = BigDecimal.ZERO;

  @Column(name = "deposit_fraction", nullable = false, precision = 5, scale = 4)
  private BigDecimal depositFraction = BigDecimal.ZERO;

  @Column(name = "rate_config_version", length = 50)
  private String rateConfigVersion;

  // --- Lifecycle ---

  @Embedded private AcceptanceRecord acceptance;

  @Column(name = "sent_at")
  private Instant sentAt;

  @Column(name = "first_viewed_at")
  private Instant firstViewedAt;

  @Column(name = "last_viewed_at")
  private Instant lastViewedAt;

  @Column(name = "view_count", nullable = false)
  private int viewCount;

  @Column(name = "accepted_at")
  private Instant acceptedAt;

  @Column(name = "declined_at")
  private Instant declinedAt;

  @Column(name = "decline_reason", length = 2000)
  private String declineReason;

  @Enumerated(EnumType.STRING)
  @Column(name = "decline_category", length = 20)
  private DeclineCategory declineCategory;

  @Column(name = "decline_desired_changes", length = 2000)
  private String declineDesiredChanges;

  @Column(name = "open_to_counter")
  private Boolean openToCounter;

  @Column(name = "expired_at")
  private Instant expiredAt;

  // --- Conversion (set once) ---

  @Column(name = "converted_at")
  private Instant convertedAt;

  @Column(name = "converted_to_booking_id", unique = true)
  private UUID convertedToBookingId;

  @Column(name = "booking_number", length = 20)
  private String bookingNumber;

  @Column(name = "payment_reference", length = 100)
  private String paymentReference;

  @Column(name = "reissued_from_id")
  private UUID reissuedFromId;

  // --- Metadata ---

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  /** JPA-required no-arg constructor. */
  protected Proposal() {}

  public Proposal(String proposalNumber, String clientName, String currency) {
    this.proposalNumber = Objects.requireNonNull(proposalNumber, "proposalNumber must not be null");
    this.clientName = Objects.requireNonNull(clientName, "clientName must not be null");
    this.currency = Objects.requireNonNull(currency, "currency must not be null");
    this.status = ProposalStatus.DRAFT;
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

  // --- Lifecycle methods ---

  /**
   * Sends the proposal to the client.
   *
   * @param itemCount number of service items currently on the proposal
   */
  public void markSent(int itemCount, Instant now) {
    var next = ProposalStateMachine.require(id, status, ProposalEvent.SEND);
    if (itemCount < 1) {
      throw new InvalidStateTransitionException(
          id, "A proposal needs at least one service item before it can be sent");
    }
    if (isBlank(clientName)) {
      throw new MissingRequiredFieldException("clientName", "sending a proposal");
    }
    if (isBlank(clientEmail)) {
      throw new MissingRequiredFieldException("clientEmail", "sending a proposal");
    }
    this.status = next;
    this.sentAt = now;
  }

  /** Records a client view. The first view moves SENT to VIEWED; later views only count. */
  public void recordView(Instant now) {
    this.status = ProposalStateMachine.require(id, status, ProposalEvent.VIEW);
    if (firstViewedAt == null) {
      this.firstViewedAt = now;
    }
    this.lastViewedAt = now;
    this.viewCount++;
  }

  /**
   * Accepts the proposal with the client's signature.
   *
   * @throws ProposalExpiredException if {@code validUntil} has passed; nothing is changed
   */
  public void markAccepted(AcceptanceRecord acceptance, Instant now) {
    var next = ProposalStateMachine.require(id, status, ProposalEvent.ACCEPT);
    if (isPastValidUntil(now)) {
      throw new ProposalExpiredException(id, validUntil);
    }
    Objects.requireNonNull(acceptance, "acceptance must not be null");
    if (isBlank(acceptance.getSignature())) {
      throw new MissingRequiredFieldException("signature", "accepting a proposal");
    }
    if (isBlank(acceptance.getSignerName())) {
      throw new MissingRequiredFieldException("signerName", "accepting a proposal");
    }
    this.acceptance = acceptance;
    this.status = next;
    this.acceptedAt = now;
  }

  /**
   * Declines the proposal.
   *
   * @param minReasonLength shortest accepted reason, after trimming
   */
  public void markDeclined(
      String reason,
      DeclineCategory category,
      String desiredChanges,
      Boolean openToCounter,
      int minReasonLength,
      Instant now) {
    var next = ProposalStateMachine.require(id, status, ProposalEvent.DECLINE);
    if (reason == null || reason.trim().length() < minReasonLength) {
      throw new ValidationFailedException(
          "reason", "Decline reason must be at least " + minReasonLength + " characters");
    }
    this.status = next;
    this.declineReason = reason.trim();
    this.declineCategory = category;
    this.declineDesiredChanges = desiredChanges;
    this.openToCounter = openToCounter;
    this.declinedAt = now;
  }

  /** Expires the proposal. Only allowed once {@code validUntil} has passed. */
  public void markExpired(Instant now) {
    var next = ProposalStateMachine.require(id, status, ProposalEvent.EXPIRE);
    if (!isPastValidUntil(now)) {
      throw new InvalidStateTransitionException(
          id,
          validUntil == null
              ? "Proposal has no validity deadline and cannot expire"
              : "Proposal is valid until " + validUntil);
    }
    this.status = next;
    this.expiredAt = now;
  }

  /** Records the booking created from this proposal. The booking reference is set once. */
  public void markConverted(
      UUID bookingId, String bookingNumber, String paymentReference, Instant now) {
    var next = ProposalStateMachine.require(id, status, ProposalEvent.CONVERT);
    if (convertedToBookingId != null) {
      throw new InvalidStateTransitionException(
          id, "Proposal was already converted to booking " + this.bookingNumber);
    }
    this.convertedToBookingId = Objects.requireNonNull(bookingId, "bookingId must not be null");
    this.bookingNumber = bookingNumber;
    this.paymentReference = paymentReference;
    this.convertedAt = now;
    this.status = next;
  }

  // --- Guards ---

  public boolean isEditable() {
    return status.isEditable();
  }

  /** Throws if items or pricing fields can no longer change. */
  public void requireEditable() {
    if (!isEditable()) {
      throw new InvalidStateTransitionException(
          id, "Cannot edit a proposal in status " + status);
    }
  }

  public boolean isPastValidUntil(Instant now) {
    return validUntil != null && !now.isBefore(validUntil);
  }

  /** True if reading the proposal now should move it to EXPIRED. */
  public boolean isOverdue(Instant now) {
    return isPastValidUntil(now) && ProposalStateMachine.isAllowed(status, ProposalEvent.EXPIRE);
  }

  public boolean isConverted() {
    return convertedToBookingId != null;
  }

  // --- Guarded setters ---

  public void updateClient(String clientName, String clientEmail, String clientPhone) {
    requireEditable();
    this.clientName = Objects.requireNonNull(clientName, "clientName must not be null");
    this.clientEmail = clientEmail;
    this.clientPhone = clientPhone;
  }

  public void setTitle(String title) {
    requireEditable();
    this.title = title;
  }

  public void setDiscountPercentage(BigDecimal discountPercentage) {
    requireEditable();
    var value = discountPercentage != null ? discountPercentage : BigDecimal.ZERO;
    if (value.signum() < 0 || value.compareTo(new BigDecimal("100")) > 0) {
      throw new ValidationFailedException(
          "discountPercentage", "Discount must be between 0 and 100, got " + value);
    }
    this.discountPercentage = value;
  }

  public void setGratuity(boolean enabled, BigDecimal suggestedPercentage, boolean optional) {
    requireEditable();
    var value = suggestedPercentage != null ? suggestedPercentage : BigDecimal.ZERO;
    if (value.signum() < 0 || value.compareTo(new BigDecimal("100")) > 0) {
      throw new ValidationFailedException(
          "suggestedGratuityPercentage", "Gratuity must be between 0 and 100, got " + value);
    }
    this.gratuityEnabled = enabled;
    this.suggestedGratuityPercentage = value;
    this.gratuityOptional = optional;
  }

  public void setValidUntil(Instant validUntil) {
    requireEditable();
    this.validUntil = validUntil;
  }

  /** Replaces the cached totals together with the configuration they were computed from. */
  public void applyTotals(
      ProposalTotals totals,
      BigDecimal taxRate,
      BigDecimal depositFraction,
      String rateConfigVersion) {
    requireEditable();
    this.servicesSubtotal = totals.servicesSubtotal();
    this.addonsSubtotal = totals.addonsSubtotal();
    this.subtotal = totals.subtotal();
    this.discountAmount = totals.discountAmount();
    this.taxAmount = totals.taxAmount();
    this.total = totals.total();
    this.depositAmount = totals.depositAmount();
    this.balanceAmount = totals.balanceAmount();
    this.gratuityAmount = totals.gratuityAmount();
    this.taxRate = taxRate;
    this.depositFraction = depositFraction;
    this.rateConfigVersion = rateConfigVersion;
  }

  /** Links a reissued draft to the declined or expired proposal it was copied from. */
  public void setReissuedFromId(UUID reissuedFromId) {
    requireEditable();
    this.reissuedFromId = reissuedFromId;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getProposalNumber() {
    return proposalNumber;
  }

  public ProposalStatus getStatus() {
    return status;
  }

  public String getClientName() {
    return clientName;
  }

  public String getClientEmail() {
    return clientEmail;
  }

  public String getClientPhone() {
    return clientPhone;
  }

  public String getTitle() {
    return title;
  }

  public BigDecimal getDiscountPercentage() {
    return discountPercentage;
  }

  public boolean isGratuityEnabled() {
    return gratuityEnabled;
  }

  public BigDecimal getSuggestedGratuityPercentage() {
    return suggestedGratuityPercentage;
  }

  public boolean isGratuityOptional() {
    return gratuityOptional;
  }

  public Instant getValidUntil() {
    return validUntil;
  }

  public String getCurrency() {
    return currency;
  }

  public BigDecimal getServicesSubtotal() {
    return servicesSubtotal;
  }

  public BigDecimal getAddonsSubtotal() {
    return addonsSubtotal;
  }

  public BigDecimal getSubtotal() {
    return subtotal;
  }

  public BigDecimal getDiscountAmount() {
    return discountAmount;
  }

  public BigDecimal getTaxAmount() {
    return taxAmount;
  }

  public BigDecimal getTotal() {
    return total;
  }

  public BigDecimal getDepositAmount() {
    return depositAmount;
  }

  public BigDecimal getBalanceAmount() {
    return balanceAmount;
  }

  public BigDecimal getGratuityAmount() {
    return gratuityAmount;
  }

  public BigDecimal getTaxRate() {
    return taxRate;
  }

  public BigDecimal getDepositFraction() {
    return depositFraction;
  }

  public String getRateConfigVersion() {
    return rateConfigVersion;
  }

  public AcceptanceRecord getAcceptance() {
    return acceptance;
  }

  public Instant getSentAt() {
    return sentAt;
  }

  public Instant getFirstViewedAt() {
    return firstViewedAt;
  }

  public Instant getLastViewedAt() {
    return lastViewedAt;
  }

  public int getViewCount() {
    return viewCount;
  }

  public Instant getAcceptedAt() {
    return acceptedAt;
  }

  public Instant getDeclinedAt() {
    return declinedAt;
  }

  public String getDeclineReason() {
    return declineReason;
  }

  public DeclineCategory getDeclineCategory() {
    return declineCategory;
  }

  public String getDeclineDesiredChanges() {
    return declineDesiredChanges;
  }

  public Boolean getOpenToCounter() {
    return openToCounter;
  }

  public Instant getExpiredAt() {
    return expiredAt;
  }

  public Instant getConvertedAt() {
    return convertedAt;
  }

  public UUID getConvertedToBookingId() {
    return convertedToBookingId;
  }

  public String getBookingNumber() {
    return bookingNumber;
  }

  public String getPaymentReference() {
    return paymentReference;
  }

  public UUID getReissuedFromId() {
    return reissuedFromId;
  }

  public long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
