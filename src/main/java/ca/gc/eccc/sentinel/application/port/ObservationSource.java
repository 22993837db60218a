package ca.gc.eccc.sentinel.application.port;

import ca.gc.eccc.sentinel.domain.observation.Observation;
import java.time.Duration;

/**
 * <strong>What:</strong> Port supplying a weather snapshot for a named location.
 * <p><strong>Why:</strong> Isolates the workflow from the weather provider and its wire format.</p>
 * <p><strong>Role:</strong> Capability port implemented by adapters such as
 * {@code FileObservationSource}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls for different locations.</p>
 * <p><strong>Performance:</strong> Calls may block on I/O; the workflow bounds them with {@code timeout}
 * and cancels overdue calls.</p>
 *
 * @since 0.1.0
 */
public interface ObservationSource {
  /** Capability name used in failures, logs and audit payloads. */
  String CAPABILITY = "observation-source";

  /**
   * Fetches the current observation for a location.
   *
   * @param location monitored location name; never {@code null}
   * @param timeout call budget; implementations should honour it where they can
   * @return observation; never {@code null}
   * @throws ObservationException when the provider times out, does not know the location or fails
   */
  Observation fetch(String location, Duration timeout) throws ObservationException;
}
