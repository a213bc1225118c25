package io.wwtours.backoffice.proposal.dto;

import io.wwtours.backoffice.proposal.DeclineCategory;

public record DeclineRequest(
    String reason, DeclineCategory category, String desiredChanges, Boolean openToCounter) {}
