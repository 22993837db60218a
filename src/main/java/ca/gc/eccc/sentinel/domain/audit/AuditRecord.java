package ca.gc.eccc.sentinel.domain.audit;

import ca.gc.eccc.sentinel.domain.incident.IncidentId;
import ca.gc.eccc.sentinel.domain.incident.IncidentState;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable entry of the append-only audit trail.
 * <p><strong>Why:</strong> Each incident transition and decision is recorded so the final state can be
 * reconstructed from the trail alone.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; payload is defensively copied.</p>
 *
 * @param incidentId incident the record belongs to
 * @param location monitored location of the incident
 * @param sequence 1-based position within the incident's trail
 * @param kind event kind
 * @param state incident state after the event
 * @param timestamp instant the event was recorded
 * @param payload snapshot of event details; never {@code null}
 * @since 0.1.0
 */
public record AuditRecord(
    IncidentId incidentId,
    String location,
    long sequence,
    AuditEventKind kind,
    IncidentState state,
    Instant timestamp,
    Map<String, String> payload) {

  /**
   * Validates fields and copies the payload.
   */
  public AuditRecord {
    incidentId = Objects.requireNonNull(incidentId, "incidentId");
    location = Objects.requireNonNull(location, "location");
    kind = Objects.requireNonNull(kind, "kind");
    state = Objects.requireNonNull(state, "state");
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    payload = payload == null ? Map.of() : Map.copyOf(payload);
    if (sequence < 1) {
      throw new IllegalArgumentException("sequence must be >= 1");
    }
    if (!kind.records(state)) {
      throw new IllegalArgumentException(kind + " cannot record state " + state);
    }
  }
}
