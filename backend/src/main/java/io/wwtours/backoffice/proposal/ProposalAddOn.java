package io.wwtours.backoffice.proposal;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.UUID;

/** Extra charged on top of the service items, e.g. a picnic lunch. Not rate-table priced. */
@Entity
@Table(name = "proposal_add_ons")
public class ProposalAddOn {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "proposal_id", nullable = false)
  private UUID proposalId;

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "description", nullable = false, length = 500)
  private String description;

  @Column(name = "amount", nullable = false, precision = 12, scale = 2)
  private BigDecimal amount;

  protected ProposalAddOn() {}

  public ProposalAddOn(UUID proposalId, int sortOrder, String description, BigDecimal amount) {
    this.proposalId = Objects.requireNonNull(proposalId, "proposalId must not be null");
    this.sortOrder = sortOrder;
    this.description = Objects.requireNonNull(description, "description must not be null");
    this.amount = Objects.requireNonNull(amount, "amount must not be null");
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

  public String getDescription() {
    return description;
  }

  public BigDecimal getAmount() {
    return amount;
  }
}
