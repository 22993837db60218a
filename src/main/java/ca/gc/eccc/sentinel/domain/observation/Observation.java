package ca.gc.eccc.sentinel.domain.observation;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Weather snapshot for a monitored location at a point in time.
 * <p><strong>Why:</strong> Input to classification; the same snapshot is quoted in dispatched alerts.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; the raw payload map is defensively copied.</p>
 *
 * <p>Numeric readings that the provider did not report are {@link Double#NaN}.</p>
 *
 * @param location monitored location name; never {@code null}
 * @param observedAt provider timestamp of the reading; never {@code null}
 * @param temperatureCelsius air temperature in degrees Celsius
 * @param windSpeedMetersPerSecond sustained wind speed in m/s
 * @param humidityPercent relative humidity in percent
 * @param pressureHectopascals sea-level pressure in hPa
 * @param precipitationMillimetres precipitation over the last hour in mm
 * @param cloudCoverPercent cloud cover in percent
 * @param conditions short provider description (e.g. {@code heavy rain}); empty when absent
 * @param rawPayload provider-specific fields kept opaque; never {@code null}
 * @since 0.1.0
 */
public record Observation(
    String location,
    Instant observedAt,
    double temperatureCelsius,
    double windSpeedMetersPerSecond,
    double humidityPercent,
    double pressureHectopascals,
    double precipitationMillimetres,
    double cloudCoverPercent,
    String conditions,
    Map<String, String> rawPayload) {

  /**
   * Validates identifiers and copies the raw payload.
   */
  public Observation {
    location = Objects.requireNonNull(location, "location");
    observedAt = Objects.requireNonNull(observedAt, "observedAt");
    conditions = conditions == null ? "" : conditions.trim();
    rawPayload = rawPayload == null ? Map.of() : Map.copyOf(rawPayload);
  }

  /**
   * Indicates whether a reading was reported.
   *
   * @param value reading to test
   * @return {@code true} when the value is a finite number
   */
  public static boolean reported(double value) {
    return Double.isFinite(value);
  }
}
