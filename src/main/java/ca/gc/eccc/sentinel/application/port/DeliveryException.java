package ca.gc.eccc.sentinel.application.port;

/**
 * Failure raised by a {@link Notifier}. Transient failures (connection refused, broker timeout) are
 * retried; terminal failures (malformed recipient, authentication rejected) are not.
 *
 * @since 0.1.0
 */
public final class DeliveryException extends CapabilityException {
  private static final long serialVersionUID = 1L;

  public DeliveryException(FailureKind kind, String code, String message, Throwable cause) {
    super(Notifier.CAPABILITY, kind, code, message, cause);
  }

  public static DeliveryException transientFailure(String code, String message, Throwable cause) {
    return new DeliveryException(FailureKind.TRANSIENT, code, message, cause);
  }

  public static DeliveryException terminal(String code, String message) {
    return new DeliveryException(FailureKind.TERMINAL, code, message, null);
  }
}
