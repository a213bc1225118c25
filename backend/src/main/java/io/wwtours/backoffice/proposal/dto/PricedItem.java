package io.wwtours.backoffice.proposal.dto;

import io.wwtours.backoffice.proposal.ProposalServiceItem;
import java.util.List;

/** A saved service item plus any soft pricing warnings, e.g. an override without a reason. */
public record PricedItem(ProposalServiceItem item, List<String> warnings) {}
