package io.wwtours.backoffice.proposal;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProposalRepository extends JpaRepository<Proposal, UUID> {

  /** Loads the proposal with a row lock held until the transaction ends. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT p FROM Proposal p WHERE p.id = :id")
  Optional<Proposal> findByIdForUpdate(@Param("id") UUID id);

  /**
   * Loads the proposal for an edit of its items, add-ons or header. The row lock plus the forced
   * version bump make a transition that read the proposal earlier fail on commit.
   */
  @Lock(LockModeType.PESSIMISTIC_FORCE_INCREMENT)
  @Query("SELECT p FROM Proposal p WHERE p.id = :id")
  Optional<Proposal> findByIdForEdit(@Param("id") UUID id);

  List<Proposal> findByStatusInAndValidUntilBefore(
      Collection<ProposalStatus> statuses, Instant now);

  long countByStatus(ProposalStatus status);

  @Query(
      """
      SELECT p FROM Proposal p
      WHERE (:status IS NULL OR p.status = :status)
        AND (CAST(:clientEmail AS string) IS NULL
             OR LOWER(p.clientEmail) = LOWER(CAST(:clientEmail AS string)))
      ORDER BY p.createdAt DESC
      """)
  Page<Proposal> findFiltered(
      @Param("status") ProposalStatus status,
      @Param("clientEmail") String clientEmail,
      Pageable pageable);
}
