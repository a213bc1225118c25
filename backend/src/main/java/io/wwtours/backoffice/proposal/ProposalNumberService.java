package io.wwtours.backoffice.proposal;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Generates sequential proposal numbers from a singleton counter row.
 *
 * <p>Numbers are gap-free while transactions commit; a rollback returns the number. Deleted drafts
 * leave gaps. Format: "TP-" + zero-padded 4-digit number.
 */
@Service
public class ProposalNumberService {

  @PersistenceContext private EntityManager entityManager;

  /**
   * Assigns the next proposal number. Two concurrent calls serialize on the row lock taken by the
   * upsert.
   *
   * @return formatted proposal number (e.g., "TP-0001")
   */
  @Transactional
  public String allocateNumber() {
    var result =
        entityManager
            .createNativeQuery(
                "INSERT INTO proposal_counters (id, next_number, singleton)"
                    + " VALUES (gen_random_uuid(), 2, TRUE)"
                    + " ON CONFLICT ON CONSTRAINT proposal_counters_singleton"
                    + " DO UPDATE SET next_number = proposal_counters.next_number + 1"
                    + " RETURNING next_number - 1")
            .getSingleResult();
    int number = ((Number) result).intValue();
    return String.format("TP-%04d", number);
  }
}
