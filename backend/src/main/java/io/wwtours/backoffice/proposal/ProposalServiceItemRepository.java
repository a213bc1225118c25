package io.wwtours.backoffice.proposal;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProposalServiceItemRepository extends JpaRepository<ProposalServiceItem, UUID> {

  List<ProposalServiceItem> findByProposalIdOrderBySortOrder(UUID proposalId);

  long countByProposalId(UUID proposalId);

  void deleteByProposalId(UUID proposalId);
}
