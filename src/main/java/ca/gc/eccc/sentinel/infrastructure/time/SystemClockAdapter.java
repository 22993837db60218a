package ca.gc.eccc.sentinel.infrastructure.time;

import ca.gc.eccc.sentinel.application.port.ClockPort;

/**
 * {@link ClockPort} backed by the system wall clock.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
