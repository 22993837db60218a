package ca.gc.eccc.sentinel.application.workflow;

/**
 * Raised when an approval request is resolved after it already reached a final resolution.
 *
 * @since 0.1.0
 */
public class InvalidStateException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public InvalidStateException(String message) {
    super(message);
  }
}
