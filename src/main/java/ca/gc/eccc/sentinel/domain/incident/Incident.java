package ca.gc.eccc.sentinel.domain.incident;

import ca.gc.eccc.sentinel.domain.alert.ResponseDepartment;
import ca.gc.eccc.sentinel.domain.alert.ResponsePlan;
import ca.gc.eccc.sentinel.domain.approval.ApprovalRequest;
import ca.gc.eccc.sentinel.domain.assessment.Assessment;
import ca.gc.eccc.sentinel.domain.observation.Observation;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Snapshot of one workflow execution for a location in a polling cycle.
 * <p><strong>Why:</strong> The workflow replaces its current snapshot on every transition, so readers
 * always see a consistent view without locking.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; {@code with*} methods return copies.</p>
 *
 * @param id incident identifier
 * @param location monitored location
 * @param cycle polling cycle number
 * @param state current workflow state
 * @param observation observation once fetched; {@code null} before
 * @param assessment assessment once classified; {@code null} before
 * @param department routed department once classified; {@code null} before
 * @param plan response plan once produced; {@code null} before
 * @param approval approval request when one was created; {@code null} otherwise
 * @param dispatch dispatch outcome once dispatch finished; {@code null} before
 * @param abortReason reason when {@link IncidentState#ABORTED}; {@code null} otherwise
 * @param startedAt creation instant
 * @param updatedAt instant of the last transition
 * @since 0.1.0
 */
public record Incident(
    IncidentId id,
    String location,
    long cycle,
    IncidentState state,
    Observation observation,
    Assessment assessment,
    ResponseDepartment department,
    ResponsePlan plan,
    ApprovalRequest approval,
    DispatchOutcome dispatch,
    AbortReason abortReason,
    Instant startedAt,
    Instant updatedAt) {

  public Incident {
    id = Objects.requireNonNull(id, "id");
    location = Objects.requireNonNull(location, "location");
    state = Objects.requireNonNull(state, "state");
    startedAt = Objects.requireNonNull(startedAt, "startedAt");
    updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
  }

  /**
   * Creates a fresh incident in {@link IncidentState#PENDING_OBSERVATION}.
   *
   * @param id identifier
   * @param location monitored location
   * @param cycle polling cycle number
   * @param now creation instant
   * @return new incident
   */
  public static Incident start(IncidentId id, String location, long cycle, Instant now) {
    return new Incident(id, location, cycle, IncidentState.PENDING_OBSERVATION,
        null, null, null, null, null, null, null, now, now);
  }

  /**
   * Returns a copy in {@code next}, validating the transition table.
   *
   * @param next target state
   * @param at transition instant
   * @return transitioned copy
   * @throws IllegalStateException when {@code state -> next} is not permitted
   */
  public Incident transition(IncidentState next, Instant at) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException("illegal transition " + state + " -> " + next + " for " + id);
    }
    return new Incident(id, location, cycle, next, observation, assessment, department, plan,
        approval, dispatch, abortReason, startedAt, at);
  }

  public Incident withObservation(Observation value) {
    return new Incident(id, location, cycle, state, value, assessment, department, plan,
        approval, dispatch, abortReason, startedAt, updatedAt);
  }

  public Incident withAssessment(Assessment value) {
    return new Incident(id, location, cycle, state, observation, value, department, plan,
        approval, dispatch, abortReason, startedAt, updatedAt);
  }

  public Incident withRouting(ResponseDepartment dept, ResponsePlan responsePlan) {
    return new Incident(id, location, cycle, state, observation, assessment, dept, responsePlan,
        approval, dispatch, abortReason, startedAt, updatedAt);
  }

  public Incident withApproval(ApprovalRequest value) {
    return new Incident(id, location, cycle, state, observation, assessment, department, plan,
        value, dispatch, abortReason, startedAt, updatedAt);
  }

  public Incident withDispatch(DispatchOutcome value) {
    return new Incident(id, location, cycle, state, observation, assessment, department, plan,
        approval, value, abortReason, startedAt, updatedAt);
  }

  public Incident withAbortReason(AbortReason value) {
    return new Incident(id, location, cycle, state, observation, assessment, department, plan,
        approval, dispatch, value, startedAt, updatedAt);
  }

  public Optional<ApprovalRequest> approvalRequest() {
    return Optional.ofNullable(approval);
  }

  public Optional<DispatchOutcome> dispatchOutcome() {
    return Optional.ofNullable(dispatch);
  }
}
