package ca.gc.eccc.sentinel.application.port;

/**
 * Failure raised by a {@link Classifier}.
 *
 * @since 0.1.0
 */
public final class ClassificationException extends CapabilityException {
  private static final long serialVersionUID = 1L;

  /** Failure reasons; {@link #MALFORMED_OUTPUT} is terminal, the rest are transient. */
  public enum Reason {
    TIMEOUT("timeout", FailureKind.TRANSIENT),
    MODEL_UNAVAILABLE("model-unavailable", FailureKind.TRANSIENT),
    MALFORMED_OUTPUT("malformed-output", FailureKind.TERMINAL);

    private final String code;
    private final FailureKind kind;

    Reason(String code, FailureKind kind) {
      this.code = code;
      this.kind = kind;
    }
  }

  private final Reason reason;

  public ClassificationException(Reason reason, String message, Throwable cause) {
    super(Classifier.CAPABILITY, reason.kind, reason.code, message, cause);
    this.reason = reason;
  }

  public ClassificationException(Reason reason, String message) {
    this(reason, message, null);
  }

  public Reason reason() {
    return reason;
  }
}
