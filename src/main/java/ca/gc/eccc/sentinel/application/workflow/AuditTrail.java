package ca.gc.eccc.sentinel.application.workflow;

import ca.gc.eccc.sentinel.application.port.AuditSink;
import ca.gc.eccc.sentinel.application.port.AuditSinkException;
import ca.gc.eccc.sentinel.application.port.MetricsPort;
import ca.gc.eccc.sentinel.domain.audit.AuditRecord;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Front door to the {@link AuditSink} used by every incident.
 * <p><strong>Why:</strong> A logging outage must not halt disaster response, yet it must never pass
 * silently. Sink failures are reported on the dedicated {@value #DEGRADED_LOGGER} logger and counted as
 * {@code audit.append.failed}, separate from workflow failures.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; ordering per incident is the caller's job.</p>
 *
 * @since 0.1.0
 */
public final class AuditTrail {
  /** Logger that carries degraded-logging warnings. */
  public static final String DEGRADED_LOGGER = "ca.gc.eccc.sentinel.audit.degraded";

  private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);
  private static final Logger degradedLog = LoggerFactory.getLogger(DEGRADED_LOGGER);

  private final AuditSink sink;
  private final MetricsPort metrics;
  private final AtomicBoolean degraded = new AtomicBoolean();
  private final AtomicLong failedAppends = new AtomicLong();

  public AuditTrail(AuditSink sink, MetricsPort metrics) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Appends a record; never throws for sink failures.
   *
   * @param record record to append
   * @return {@code true} when the sink accepted the record
   */
  public boolean record(AuditRecord record) {
    Objects.requireNonNull(record, "record");
    try {
      sink.append(record);
    } catch (AuditSinkException | RuntimeException ex) {
      failedAppends.incrementAndGet();
      metrics.increment("audit.append.failed");
      if (degraded.compareAndSet(false, true)) {
        degradedLog.warn("Audit sink unavailable; continuing in degraded-logging mode (first lost record {}#{} {}): {}",
            record.incidentId(), record.sequence(), record.kind(), ex.getMessage(), ex);
      } else {
        degradedLog.warn("Audit record lost {}#{} {}: {}",
            record.incidentId(), record.sequence(), record.kind(), ex.getMessage());
      }
      return false;
    }
    if (degraded.compareAndSet(true, false)) {
      degradedLog.info("Audit sink recovered after {} lost record(s)", failedAppends.get());
    }
    log.debug("Audit {}#{} {} -> {}", record.incidentId(), record.sequence(), record.kind(), record.state());
    return true;
  }

  public boolean isDegraded() {
    return degraded.get();
  }

  public long failedAppends() {
    return failedAppends.get();
  }
}
