package io.wwtours.backoffice.booking;

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
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A confirmed booking. Created only by converting an accepted proposal; {@code sourceProposalId} is
 * unique, so a proposal can never produce two bookings.
 */
@Entity
@Table(name = "bookings")
public class Booking {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "booking_number", nullable = false, unique = true, length = 20)
  private String bookingNumber;

  @Column(name = "source_proposal_id", nullable = false, unique = true, updatable = false)
  private UUID sourceProposalId;

  @Column(name = "proposal_number", length = 20)
  private String proposalNumber;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private BookingStatus status;

  @Column(name = "client_name", nullable = false, length = 200)
  private String clientName;

  @Column(name = "client_email", length = 255)
  private String clientEmail;

  @Column(name = "client_phone", length = 50)
  private String clientPhone;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "lines", nullable = false, columnDefinition = "jsonb")
  private List<Map<String, Object>> lines = List.of();

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "total", nullable = false, precision = 12, scale = 2)
  private BigDecimal total;

  @Column(name = "deposit_paid", nullable = false, precision = 12, scale = 2)
  private BigDecimal depositPaid;

  @Column(name = "balance_due", nullable = false, precision = 12, scale = 2)
  private BigDecimal balanceDue;

  @Column(name = "gratuity_amount", precision = 12, scale = 2)
  private BigDecimal gratuityAmount;

  @Column(name = "payment_reference", length = 100)
  private String paymentReference;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Booking() {}

  public Booking(String bookingNumber, BookingCreationRequest request) {
    this.bookingNumber = Objects.requireNonNull(bookingNumber, "bookingNumber must not be null");
    this.sourceProposalId = request.sourceProposalId();
    this.proposalNumber = request.proposalNumber();
    this.status = BookingStatus.CONFIRMED;
    this.clientName = Objects.requireNonNull(request.clientName(), "clientName must not be null");
    this.clientEmail = request.clientEmail();
    this.clientPhone = request.clientPhone();
    this.lines = request.lines().stream().map(BookingLine::toMap).toList();
    this.currency = request.currency();
    this.total = request.total();
    this.depositPaid = request.depositAmount();
    this.balanceDue = request.balanceAmount();
    this.gratuityAmount = request.gratuityAmount();
    this.paymentReference = request.paymentReference();
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

  public BookingReference toReference() {
    return new BookingReference(id, bookingNumber);
  }

  public UUID getId() {
    return id;
  }

  public String getBookingNumber() {
    return bookingNumber;
  }

  public UUID getSourceProposalId() {
    return sourceProposalId;
  }

  public String getProposalNumber() {
    return proposalNumber;
  }

  public BookingStatus getStatus() {
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

  public List<Map<String, Object>> getLines() {
    return lines;
  }

  public String getCurrency() {
    return currency;
  }

  public BigDecimal getTotal() {
    return total;
  }

  public BigDecimal getDepositPaid() {
    return depositPaid;
  }

  public BigDecimal getBalanceDue() {
    return balanceDue;
  }

  public BigDecimal getGratuityAmount() {
    return gratuityAmount;
  }

  public String getPaymentReference() {
    return paymentReference;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
