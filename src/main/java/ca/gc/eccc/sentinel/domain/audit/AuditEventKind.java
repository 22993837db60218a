package ca.gc.eccc.sentinel.domain.audit;

import ca.gc.eccc.sentinel.domain.incident.IncidentState;
import java.util.Set;

/**
 * Kinds of audit records and the incident states each kind may record.
 *
 * <p>{@link #POLICY_DECIDED} records a decision without a transition; its state stays
 * {@link IncidentState#CLASSIFIED}. Every other kind records exactly one transition.</p>
 *
 * @since 0.1.0
 */
public enum AuditEventKind {
  OBSERVED(Set.of(IncidentState.OBSERVED)),
  CLASSIFIED(Set.of(IncidentState.CLASSIFIED)),
  POLICY_DECIDED(Set.of(IncidentState.CLASSIFIED)),
  APPROVAL_REQUESTED(Set.of(IncidentState.AWAITING_APPROVAL)),
  APPROVAL_RESOLVED(
      Set.of(IncidentState.APPROVED, IncidentState.REJECTED, IncidentState.EXPIRED)),
  DISPATCHED(Set.of(IncidentState.DISPATCHED)),
  DISPATCH_FAILED(Set.of(IncidentState.DISPATCH_FAILED)),
  ABORTED(Set.of(IncidentState.ABORTED)),
  COMPLETED(Set.of(IncidentState.DONE));

  private final Set<IncidentState> recordedStates;

  AuditEventKind(Set<IncidentState> recordedStates) {
    this.recordedStates = recordedStates;
  }

  /**
   * Returns whether a record of this kind may carry the given state.
   *
   * @param state state carried by the record
   * @return {@code true} when consistent
   */
  public boolean records(IncidentState state) {
    return recordedStates.contains(state);
  }

  /**
   * Indicates whether this kind records a state transition.
   *
   * @return {@code false} only for {@link #POLICY_DECIDED}
   */
  public boolean isTransition() {
    return this != POLICY_DECIDED;
  }
}
