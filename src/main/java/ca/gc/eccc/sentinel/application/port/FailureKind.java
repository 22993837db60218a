package ca.gc.eccc.sentinel.application.port;

/**
 * Retry classification of a capability failure.
 *
 * @since 0.1.0
 */
public enum FailureKind {
  /** Retried under the retry policy until the budget is exhausted. */
  TRANSIENT,
  /** Never retried; ends the attempt immediately. */
  TERMINAL
}
