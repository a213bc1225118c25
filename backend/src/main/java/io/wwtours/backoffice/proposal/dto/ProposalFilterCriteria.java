package io.wwtours.backoffice.proposal.dto;

import io.wwtours.backoffice.proposal.ProposalStatus;

public record ProposalFilterCriteria(ProposalStatus status, String clientEmail) {}
