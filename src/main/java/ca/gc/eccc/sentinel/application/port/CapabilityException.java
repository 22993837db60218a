package ca.gc.eccc.sentinel.application.port;

import java.util.Objects;

/**
 * <strong>What:</strong> Base failure raised by an external capability.
 * <p><strong>Why:</strong> The workflow only needs the capability name, a retry classification and a stable
 * code to drive its retry policy and audit payloads.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public class CapabilityException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Code used when the harness cancels a call that exceeded its timeout. */
  public static final String TIMEOUT_CODE = "timeout";

  private final String capability;
  private final FailureKind kind;
  private final String code;

  /**
   * Creates a capability failure.
   *
   * @param capability capability name (e.g. {@code notifier})
   * @param kind retry classification
   * @param code stable machine code (e.g. {@code provider-error})
   * @param message human readable message
   * @param cause underlying cause; may be {@code null}
   */
  public CapabilityException(
      String capability, FailureKind kind, String code, String message, Throwable cause) {
    super(message, cause);
    this.capability = Objects.requireNonNull(capability, "capability");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.code = Objects.requireNonNull(code, "code");
  }

  public CapabilityException(String capability, FailureKind kind, String code, String message) {
    this(capability, kind, code, message, null);
  }

  /**
   * Builds the failure reported when a call exceeds its timeout.
   *
   * @param capability capability name
   * @param timeoutMillis timeout that elapsed
   * @return transient timeout failure
   */
  public static CapabilityException timeout(String capability, long timeoutMillis) {
    return new CapabilityException(
        capability, FailureKind.TRANSIENT, TIMEOUT_CODE,
        capability + " call exceeded " + timeoutMillis + " ms");
  }

  public String capability() {
    return capability;
  }

  public FailureKind kind() {
    return kind;
  }

  public String code() {
    return code;
  }

  public boolean isTransient() {
    return kind == FailureKind.TRANSIENT;
  }
}
