package ca.gc.eccc.sentinel.domain.incident;

import java.util.Set;

/**
 * Workflow states of an incident and the transitions permitted between them.
 *
 * <pre>
 * PENDING_OBSERVATION -> OBSERVED -> CLASSIFIED -> [AWAITING_APPROVAL -> APPROVED | REJECTED | EXPIRED]
 *   CLASSIFIED | APPROVED -> DISPATCHED | DISPATCH_FAILED
 *   REJECTED | EXPIRED -> DONE
 *   any non-terminal -> ABORTED
 * </pre>
 *
 * @since 0.1.0
 */
public enum IncidentState {
  PENDING_OBSERVATION,
  OBSERVED,
  CLASSIFIED,
  AWAITING_APPROVAL,
  APPROVED,
  REJECTED,
  EXPIRED,
  DISPATCHED,
  DISPATCH_FAILED,
  DONE,
  ABORTED;

  /**
   * Indicates whether no further transition can leave this state.
   *
   * @return {@code true} for DONE, DISPATCHED, DISPATCH_FAILED and ABORTED
   */
  public boolean isTerminal() {
    return this == DONE || this == DISPATCHED || this == DISPATCH_FAILED || this == ABORTED;
  }

  /**
   * Indicates whether the incident is parked waiting for an external actor.
   *
   * @return {@code true} for AWAITING_APPROVAL
   */
  public boolean isSuspended() {
    return this == AWAITING_APPROVAL;
  }

  /**
   * Checks the transition table.
   *
   * @param next candidate next state
   * @return {@code true} when {@code this -> next} is a legal transition
   */
  public boolean canTransitionTo(IncidentState next) {
    return successors().contains(next);
  }

  /**
   * Returns the states reachable in one transition.
   *
   * @return immutable successor set; empty for terminal states
   */
  public Set<IncidentState> successors() {
    return switch (this) {
      case PENDING_OBSERVATION -> Set.of(OBSERVED, ABORTED);
      case OBSERVED -> Set.of(CLASSIFIED, ABORTED);
      case CLASSIFIED -> Set.of(AWAITING_APPROVAL, DISPATCHED, DISPATCH_FAILED, ABORTED);
      case AWAITING_APPROVAL -> Set.of(APPROVED, REJECTED, EXPIRED, ABORTED);
      case APPROVED -> Set.of(DISPATCHED, DISPATCH_FAILED, ABORTED);
      case REJECTED, EXPIRED -> Set.of(DONE, ABORTED);
      case DISPATCHED, DISPATCH_FAILED, DONE, ABORTED -> Set.of();
    };
  }
}
