package ca.gc.eccc.sentinel.application.port;

import ca.gc.eccc.sentinel.domain.audit.AuditRecord;

/**
 * <strong>What:</strong> Append-only destination for audit records.
 * <p><strong>Why:</strong> Provides the durable trail from which incident states can be reconstructed.</p>
 * <p><strong>Role:</strong> Port implemented by {@code JsonLinesAuditSink}, {@code InMemoryAuditSink} and
 * {@code KafkaAuditSink}.</p>
 * <p><strong>Thread-safety:</strong> Appends arrive concurrently from many incidents; each append must be
 * atomic so records never interleave.</p>
 *
 * @since 0.1.0
 */
public interface AuditSink extends AutoCloseable {
  /**
   * Appends one record.
   *
   * @param record record to append; never {@code null}
   * @throws AuditSinkException when the sink is unavailable
   */
  void append(AuditRecord record) throws AuditSinkException;

  /**
   * Flushes and releases resources.
   *
   * @throws AuditSinkException when buffered records cannot be flushed
   */
  @Override
  default void close() throws AuditSinkException {}
}
