package io.wwtours.backoffice.proposal.dto;

public record ProposalStats(
    long totalDraft,
    long totalSent,
    long totalViewed,
    long totalAccepted,
    long totalDeclined,
    long totalExpired,
    long totalConverted,
    double acceptanceRate) {}
