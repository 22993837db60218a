package ca.gc.eccc.sentinel.application.workflow;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff retry budget applied to transient capability failures.
 *
 * @param maxRetries retries after the first attempt; a call is attempted at most {@code maxRetries + 1} times
 * @param initialBackoff delay before the first retry
 * @param multiplier growth factor applied per retry; at least 1.0
 * @param maxBackoff upper bound on any single delay
 * @since 0.1.0
 */
public record RetryPolicy(int maxRetries, Duration initialBackoff, double multiplier, Duration maxBackoff) {

  public RetryPolicy {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
    maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
    if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
      throw new IllegalArgumentException("backoff must not be negative");
    }
    if (!(multiplier >= 1.0d) || Double.isInfinite(multiplier)) {
      throw new IllegalArgumentException("multiplier must be >= 1.0");
    }
  }

  /** Defaults: 3 retries, 500 ms initial backoff doubling up to 10 s. */
  public static RetryPolicy defaults() {
    return new RetryPolicy(3, Duration.ofMillis(500), 2.0d, Duration.ofSeconds(10));
  }

  /** Single attempt, no retries. */
  public static RetryPolicy none() {
    return new RetryPolicy(0, Duration.ZERO, 1.0d, Duration.ZERO);
  }

  public int maxAttempts() {
    return maxRetries + 1;
  }

  /**
   * Returns the delay to wait before the given attempt.
   *
   * @param attempt 1-based attempt number
   * @return zero for the first attempt; {@code min(maxBackoff, initial * multiplier^(attempt - 2))} afterwards
   */
  public Duration backoffBefore(int attempt) {
    if (attempt <= 1) {
      return Duration.ZERO;
    }
    double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 2);
    long capped = (long) Math.min(millis, (double) maxBackoff.toMillis());
    return Duration.ofMillis(capped);
  }
}
