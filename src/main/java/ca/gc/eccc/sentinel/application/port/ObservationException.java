package ca.gc.eccc.sentinel.application.port;

/**
 * Failure raised by an {@link ObservationSource}.
 *
 * @since 0.1.0
 */
public final class ObservationException extends CapabilityException {
  private static final long serialVersionUID = 1L;

  /** Failure reasons; {@link #NOT_FOUND} is terminal, the rest are transient. */
  public enum Reason {
    TIMEOUT("timeout", FailureKind.TRANSIENT),
    NOT_FOUND("not-found", FailureKind.TERMINAL),
    PROVIDER_ERROR("provider-error", FailureKind.TRANSIENT);

    private final String code;
    private final FailureKind kind;

    Reason(String code, FailureKind kind) {
      this.code = code;
      this.kind = kind;
    }
  }

  private final Reason reason;

  public ObservationException(Reason reason, String message, Throwable cause) {
    super(ObservationSource.CAPABILITY, reason.kind, reason.code, message, cause);
    this.reason = reason;
  }

  public ObservationException(Reason reason, String message) {
    this(reason, message, null);
  }

  public Reason reason() {
    return reason;
  }
}
