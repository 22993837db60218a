package ca.gc.eccc.sentinel.infrastructure.audit;

import ca.gc.eccc.sentinel.application.port.AuditSink;
import ca.gc.eccc.sentinel.domain.audit.AuditRecord;
import ca.gc.eccc.sentinel.domain.incident.IncidentId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link AuditSink} keeping records in memory. Used by {@code --dry-run} and tests.
 *
 * @since 0.1.0
 */
public final class InMemoryAuditSink implements AuditSink {
  private final List<AuditRecord> records = new ArrayList<>();

  @Override
  public synchronized void append(AuditRecord record) {
    records.add(Objects.requireNonNull(record, "record"));
  }

  public synchronized List<AuditRecord> records() {
    return List.copyOf(records);
  }

  public synchronized List<AuditRecord> recordsFor(IncidentId incidentId) {
    List<AuditRecord> result = new ArrayList<>();
    for (AuditRecord record : records) {
      if (record.incidentId().equals(incidentId)) {
        result.add(record);
      }
    }
    return result;
  }
}
