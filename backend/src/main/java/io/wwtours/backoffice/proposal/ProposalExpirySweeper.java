package io.wwtours.backoffice.proposal;

import java.time.Clock;
import java.util.EnumSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Scheduled job that expires open proposals past their deadline, so they show as expired in lists
 * without waiting for someone to open them. Each proposal is expired in its own transaction; one
 * failure does not stop the rest.
 */
@Component
@ConditionalOnProperty(prefix = "proposal.expiry", name = "sweep-enabled", havingValue = "true")
public class ProposalExpirySweeper {

  private static final Logger log = LoggerFactory.getLogger(ProposalExpirySweeper.class);

  private final ProposalRepository proposalRepository;
  private final ProposalLifecycleService lifecycleService;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public ProposalExpirySweeper(
      ProposalRepository proposalRepository,
      ProposalLifecycleService lifecycleService,
      TransactionTemplate transactionTemplate,
      Clock clock) {
    this.proposalRepository = proposalRepository;
    this.lifecycleService = lifecycleService;
    this.transactionTemplate = transactionTemplate;
    this.clock = clock;
  }

  @Scheduled(fixedRateString = "${proposal.expiry.interval:3600000}")
  public int sweep() {
    var overdue =
        proposalRepository.findByStatusInAndValidUntilBefore(
            EnumSet.of(ProposalStatus.DRAFT, ProposalStatus.SENT, ProposalStatus.VIEWED),
            clock.instant());
    int expired = 0;
    for (var candidate : overdue) {
      try {
        Boolean done =
            transactionTemplate.execute(
                status ->
                    proposalRepository
                        .findById(candidate.getId())
                        .map(lifecycleService::expireIfOverdue)
                        .orElse(false));
        if (Boolean.TRUE.equals(done)) {
          expired++;
        }
      } catch (RuntimeException e) {
        log.error("Failed to expire proposal {}", candidate.getProposalNumber(), e);
      }
    }
    if (expired > 0) {
      log.info("Proposal expiry sweep completed: {} proposals expired", expired);
    } else {
      log.debug("Proposal expiry sweep completed: no proposals expired");
    }
    return expired;
  }
}
