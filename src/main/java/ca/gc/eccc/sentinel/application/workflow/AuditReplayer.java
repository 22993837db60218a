package ca.gc.eccc.sentinel.application.workflow;

import ca.gc.eccc.sentinel.domain.audit.AuditEventKind;
import ca.gc.eccc.sentinel.domain.audit.AuditRecord;
import ca.gc.eccc.sentinel.domain.incident.IncidentId;
import ca.gc.eccc.sentinel.domain.incident.IncidentState;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reconstructs each incident's state from its audit records.
 *
 * <p>Records are grouped per incident and applied in sequence order starting from
 * {@link IncidentState#PENDING_OBSERVATION}. Sequence gaps, duplicate sequences and transitions the
 * state machine does not permit are reported as anomalies; replay still adopts the recorded state so the
 * result is deterministic.</p>
 *
 * @since 0.1.0
 */
public final class AuditReplayer {
  private AuditReplayer() {}

  /**
   * Replayed view of one incident.
   *
   * @param incidentId incident identifier
   * @param location monitored location
   * @param state state after the last record
   * @param lastSequence sequence of the last record applied
   * @param records number of records applied
   * @param anomalies ordering or transition problems found; empty for a clean trail
   */
  public record ReplayedIncident(
      IncidentId incidentId,
      String location,
      IncidentState state,
      long lastSequence,
      int records,
      List<String> anomalies) {

    public ReplayedIncident {
      anomalies = List.copyOf(anomalies);
    }

    /** Indicates whether the incident reached a terminal state. */
    public boolean terminal() {
      return state.isTerminal();
    }

    /** Indicates whether the incident stopped at the approval gate and could be resumed. */
    public boolean resumable() {
      return state.isSuspended();
    }
  }

  /**
   * Replays records of any number of incidents.
   *
   * @param records audit records in any order
   * @return replayed incidents keyed by identifier, in order of first appearance
   */
  public static Map<IncidentId, ReplayedIncident> replay(List<AuditRecord> records) {
    Map<IncidentId, List<AuditRecord>> grouped = new LinkedHashMap<>();
    for (AuditRecord record : records) {
      grouped.computeIfAbsent(record.incidentId(), id -> new ArrayList<>()).add(record);
    }
    Map<IncidentId, ReplayedIncident> result = new LinkedHashMap<>();
    grouped.forEach((id, trail) -> result.put(id, replayIncident(id, trail)));
    return result;
  }

  /**
   * Replays the records of a single incident.
   *
   * @param id incident identifier
   * @param trail records of that incident
   * @return replayed incident
   */
  public static ReplayedIncident replayIncident(IncidentId id, List<AuditRecord> trail) {
    List<AuditRecord> ordered = new ArrayList<>(trail);
    ordered.sort(Comparator.comparingLong(AuditRecord::sequence));
    List<String> anomalies = new ArrayList<>();
    IncidentState state = IncidentState.PENDING_OBSERVATION;
    long expected = 1;
    long last = 0;
    String location = ordered.isEmpty() ? "" : ordered.get(0).location();
    for (AuditRecord record : ordered) {
      if (!record.incidentId().equals(id)) {
        anomalies.add("record " + record.sequence() + " belongs to " + record.incidentId());
        continue;
      }
      if (record.sequence() == last) {
        anomalies.add("duplicate sequence " + record.sequence());
        continue;
      }
      if (record.sequence() != expected) {
        anomalies.add("sequence gap: expected " + expected + " but found " + record.sequence());
      }
      if (record.kind() == AuditEventKind.POLICY_DECIDED) {
        if (state != IncidentState.CLASSIFIED) {
          anomalies.add("POLICY_DECIDED recorded in state " + state);
        }
      } else if (!state.canTransitionTo(record.state())) {
        anomalies.add("illegal transition " + state + " -> " + record.state() + " at sequence "
            + record.sequence());
      }
      state = record.state();
      last = record.sequence();
      expected = last + 1;
    }
    return new ReplayedIncident(id, location, state, last, ordered.size(), anomalies);
  }
}
