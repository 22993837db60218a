package ca.gc.eccc.sentinel.application.port;

/**
 * Raised when an {@link AuditSink} cannot accept a record (sink unavailable).
 *
 * @since 0.1.0
 */
public final class AuditSinkException extends Exception {
  private static final long serialVersionUID = 1L;

  public AuditSinkException(String message, Throwable cause) {
    super(message, cause);
  }

  public AuditSinkException(String message) {
    super(message);
  }
}
