package ca.gc.eccc.sentinel.config;

import java.util.Locale;

/**
 * Transport used to deliver alerts.
 *
 * @since 0.1.0
 */
public enum NotifierMode {
  /** Writes alerts to the {@code ca.gc.eccc.sentinel.alerts} logger. */
  LOG,
  /** Drops one text file per alert into {@code alertsOut}. */
  FILE,
  /** Publishes alerts to {@code kafkaAlertsTopic}. */
  KAFKA;

  /**
   * Parses a configured mode.
   *
   * @param raw value such as {@code file}; blank selects {@link #LOG}
   * @return mode
   */
  public static NotifierMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return LOG;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("notifierMode must be LOG, FILE or KAFKA (was " + raw + ")", ex);
    }
  }
}
