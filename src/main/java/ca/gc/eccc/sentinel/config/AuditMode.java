package ca.gc.eccc.sentinel.config;

import java.util.Locale;

/**
 * Destination of the audit trail.
 *
 * @since 0.1.0
 */
public enum AuditMode {
  /** JSON-lines file at {@code auditLog}. */
  FILE,
  /** Kafka topic {@code kafkaAuditTopic}. */
  KAFKA,
  /** Kept in memory only; selected by {@code --dry-run}. */
  MEMORY;

  public static AuditMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return FILE;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("auditMode must be FILE, KAFKA or MEMORY (was " + raw + ")", ex);
    }
  }
}
