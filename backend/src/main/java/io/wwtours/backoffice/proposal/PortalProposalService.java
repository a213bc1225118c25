package io.wwtours.backoffice.proposal;

import io.wwtours.backoffice.exception.ResourceNotFoundException;
import io.wwtours.backoffice.proposal.dto.AcceptanceRequest;
import io.wwtours.backoffice.proposal.dto.DeclineRequest;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Client-facing view of a proposal. Drafts are invisible to clients. */
@Service
public class PortalProposalService {

  private final ProposalRepository proposalRepository;
  private final ProposalService proposalService;
  private final ProposalLifecycleService lifecycleService;

  public PortalProposalService(
      ProposalRepository proposalRepository,
      ProposalService proposalService,
      ProposalLifecycleService lifecycleService) {
    this.proposalRepository = proposalRepository;
    this.proposalService = proposalService;
    this.lifecycleService = lifecycleService;
  }

  /** Returns the proposal and counts the view while it is still open for a decision. */
  @Transactional
  public Proposal viewProposal(UUID proposalId) {
    var proposal = proposalService.getProposal(proposalId);
    requireVisible(proposal);
    if (ProposalStateMachine.isAllowed(proposal.getStatus(), ProposalEvent.VIEW)) {
      return lifecycleService.recordView(proposalId);
    }
    return proposal;
  }

  @Transactional
  public Proposal acceptProposal(UUID proposalId, AcceptanceRequest acceptance) {
    // Lazy expiry skipped: a late acceptance reports ProposalExpired
    requireVisible(load(proposalId));
    return lifecycleService.accept(proposalId, acceptance);
  }

  @Transactional
  public Proposal declineProposal(UUID proposalId, DeclineRequest decline) {
    requireVisible(load(proposalId));
    return lifecycleService.decline(proposalId, decline);
  }

  private Proposal load(UUID proposalId) {
    return proposalRepository
        .findById(proposalId)
        .orElseThrow(() -> new ResourceNotFoundException("Proposal", proposalId));
  }

  private static void requireVisible(Proposal proposal) {
    if (proposal.getStatus() == ProposalStatus.DRAFT) {
      throw new ResourceNotFoundException("Proposal", proposal.getId());
    }
  }
}
