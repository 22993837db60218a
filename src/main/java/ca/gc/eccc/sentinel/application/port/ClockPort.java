package ca.gc.eccc.sentinel.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the workflow.
 * <p><strong>Why:</strong> Approval deadlines and audit timestamps must be deterministic in tests.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.eccc.sentinel.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /** Default clock using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
