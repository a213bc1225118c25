package io.wwtours.backoffice.proposal;

import io.wwtours.backoffice.exception.InvalidStateTransitionException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Transition table of the proposal lifecycle. Pure lookup; guards that need proposal data (items,
 * validity, acceptance record) live on {@link Proposal}.
 *
 * <pre>
 *   DRAFT    --SEND--> SENT     --VIEW--> VIEWED --VIEW--> VIEWED
 *   SENT, VIEWED --ACCEPT--> ACCEPTED --CONVERT--> CONVERTED
 *   DRAFT, SENT, VIEWED --DECLINE--> DECLINED
 *   DRAFT, SENT, VIEWED --EXPIRE--> EXPIRED
 * </pre>
 */
public final class ProposalStateMachine {

  private static final Map<ProposalStatus, Map<ProposalEvent, ProposalStatus>> TRANSITIONS =
      buildTable();

  private ProposalStateMachine() {}

  /** Returns the status the event leads to, or empty if the event is not allowed. */
  public static Optional<ProposalStatus> next(ProposalStatus from, ProposalEvent event) {
    return Optional.ofNullable(TRANSITIONS.getOrDefault(from, Map.of()).get(event));
  }

  public static boolean isAllowed(ProposalStatus from, ProposalEvent event) {
    return next(from, event).isPresent();
  }

  /**
   * Returns the next status or throws.
   *
   * @throws InvalidStateTransitionException if the table has no entry for {@code (from, event)}
   */
  public static ProposalStatus require(UUID proposalId, ProposalStatus from, ProposalEvent event) {
    return next(from, event)
        .orElseThrow(
            () ->
                new InvalidStateTransitionException(
                    proposalId,
                    "Cannot "
                        + event.name().toLowerCase(Locale.ROOT)
                        + " a proposal in "
                        + from));
  }

  private static Map<ProposalStatus, Map<ProposalEvent, ProposalStatus>> buildTable() {
    var table =
        new EnumMap<ProposalStatus, Map<ProposalEvent, ProposalStatus>>(ProposalStatus.class);

    var draft = new EnumMap<ProposalEvent, ProposalStatus>(ProposalEvent.class);
    draft.put(ProposalEvent.SEND, ProposalStatus.SENT);
    draft.put(ProposalEvent.DECLINE, ProposalStatus.DECLINED);
    draft.put(ProposalEvent.EXPIRE, ProposalStatus.EXPIRED);
    table.put(ProposalStatus.DRAFT, Collections.unmodifiableMap(draft));

    // SENT and VIEWED share a row; VIEW from VIEWED only bumps the view counter
    var open = new EnumMap<ProposalEvent, ProposalStatus>(ProposalEvent.class);
    open.put(ProposalEvent.VIEW, ProposalStatus.VIEWED);
    open.put(ProposalEvent.ACCEPT, ProposalStatus.ACCEPTED);
    open.put(ProposalEvent.DECLINE, ProposalStatus.DECLINED);
    open.put(ProposalEvent.EXPIRE, ProposalStatus.EXPIRED);
    table.put(ProposalStatus.SENT, Collections.unmodifiableMap(open));
    table.put(ProposalStatus.VIEWED, Collections.unmodifiableMap(open));

    var accepted = new EnumMap<ProposalEvent, ProposalStatus>(ProposalEvent.class);
    accepted.put(ProposalEvent.CONVERT, ProposalStatus.CONVERTED);
    table.put(ProposalStatus.ACCEPTED, Collections.unmodifiableMap(accepted));

    return Collections.unmodifiableMap(table);
  }
}
