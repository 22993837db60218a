package ca.gc.eccc.sentinel.domain.incident;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of dispatching an alert for an incident.
 *
 * @param delivered whether the notifier acknowledged the alert
 * @param attempts number of send attempts made (at least one)
 * @param reference notifier acknowledgement reference; empty on failure
 * @param failureCode failure code of the last attempt; empty on success
 * @param failureMessage failure message of the last attempt; empty on success
 * @param completedAt instant the final attempt finished
 * @since 0.1.0
 */
public record DispatchOutcome(
    boolean delivered,
    int attempts,
    String reference,
    String failureCode,
    String failureMessage,
    Instant completedAt) {

  /**
   * Validates invariants.
   */
  public DispatchOutcome {
    if (attempts < 1) {
      throw new IllegalArgumentException("attempts must be >= 1");
    }
    reference = reference == null ? "" : reference;
    failureCode = failureCode == null ? "" : failureCode;
    failureMessage = failureMessage == null ? "" : failureMessage;
    completedAt = Objects.requireNonNull(completedAt, "completedAt");
  }

  public static DispatchOutcome delivered(int attempts, String reference, Instant completedAt) {
    return new DispatchOutcome(true, attempts, reference, "", "", completedAt);
  }

  public static DispatchOutcome failed(int attempts, String code, String message, Instant completedAt) {
    return new DispatchOutcome(false, attempts, "", code, message, completedAt);
  }
}
