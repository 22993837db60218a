package ca.gc.eccc.sentinel.application.port;

/**
 * Failure raised by a {@link ResponsePlanner}.
 *
 * @since 0.1.0
 */
public final class PlanningException extends CapabilityException {
  private static final long serialVersionUID = 1L;

  public PlanningException(FailureKind kind, String code, String message, Throwable cause) {
    super(ResponsePlanner.CAPABILITY, kind, code, message, cause);
  }
}
