package io.wwtours.backoffice.proposal;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ProposalAddOnRepository extends JpaRepository<ProposalAddOn, UUID> {

  List<ProposalAddOn> findByProposalIdOrderBySortOrder(UUID proposalId);

  void deleteByProposalId(UUID proposalId);
}
