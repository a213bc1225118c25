package io.wwtours.backoffice.proposal;

import io.wwtours.backoffice.proposal.ProposalController.ProposalDetailResponse;
import io.wwtours.backoffice.proposal.ProposalController.ProposalResponse;
import io.wwtours.backoffice.proposal.dto.AcceptanceRequest;
import io.wwtours.backoffice.proposal.dto.DeclineRequest;
import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Client-facing endpoints for viewing, accepting and declining a proposal. */
@RestController
@RequestMapping("/portal/api/proposals")
public class PortalProposalController {

  private final PortalProposalService portalProposalService;
  private final ProposalService proposalService;

  public PortalProposalController(
      PortalProposalService portalProposalService, ProposalService proposalService) {
    this.portalProposalService = portalProposalService;
    this.proposalService = proposalService;
  }

  @GetMapping("/{id}")
  public ResponseEntity<ProposalDetailResponse> viewProposal(@PathVariable UUID id) {
    var proposal = portalProposalService.viewProposal(id);
    var items =
        proposalService.getServiceItems(id).stream()
            .map(ProposalController.ServiceItemResponse::from)
            .toList();
    var addOns =
        proposalService.getAddOns(id).stream()
            .map(ProposalController.AddOnResponse::from)
            .toList();
    return ResponseEntity.ok(
        new ProposalDetailResponse(ProposalResponse.from(proposal), items, addOns));
  }

  @PostMapping("/{id}/accept")
  public ResponseEntity<ProposalResponse> acceptProposal(
      @PathVariable UUID id,
      @RequestBody AcceptanceRequest request,
      HttpServletRequest httpRequest) {
    var acceptance = request.withIpAddress(httpRequest.getRemoteAddr());
    var proposal = portalProposalService.acceptProposal(id, acceptance);
    return ResponseEntity.ok(ProposalResponse.from(proposal));
  }

  @PostMapping("/{id}/decline")
  public ResponseEntity<ProposalResponse> declineProposal(
      @PathVariable UUID id, @RequestBody DeclineRequest request) {
    var proposal = portalProposalService.declineProposal(id, request);
    return ResponseEntity.ok(ProposalResponse.from(proposal));
  }
}
