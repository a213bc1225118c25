package io.wwtours.backoffice.proposal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Post-commit hand-off point for lifecycle side effects such as client and operator
 * notifications. Delivery is not part of this service; events are logged for the downstream
 * consumer.
 */
@Component
public class ProposalLifecycleEventHandler {

  private static final Logger log = LoggerFactory.getLogger(ProposalLifecycleEventHandler.class);

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onTransitioned(ProposalTransitionedEvent event) {
    log.info(
        "Proposal {} {} -> {} ({})",
        event.proposalNumber(),
        event.fromStatus(),
        event.toStatus(),
        event.event());
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
  public void onConverted(ProposalConvertedEvent event) {
    log.info(
        "Proposal {} booked as {} for {} {}",
        event.proposalNumber(),
        event.bookingNumber(),
        event.total(),
        event.currency());
  }
}
