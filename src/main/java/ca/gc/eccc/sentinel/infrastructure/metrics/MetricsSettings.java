package ca.gc.eccc.sentinel.infrastructure.metrics;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Exporter settings for the OpenTelemetry metrics pipeline.
 *
 * @param exporter exporter mode
 * @param endpoint OTLP gRPC endpoint (e.g. {@code http://localhost:4317})
 * @param resourceAttributes extra resource attributes as {@code k=v,k2=v2}; may be empty
 * @param exportInterval periodic export interval
 * @since 0.1.0
 */
public record MetricsSettings(
    Exporter exporter, String endpoint, String resourceAttributes, Duration exportInterval) {

  /** Default OTLP collector endpoint. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  /** Supported exporters. */
  public enum Exporter {
    OTLP,
    NONE;

    /**
     * Parses {@code otlp} or {@code none}.
     *
     * @param raw configured value; blank selects {@link #OTLP}
     * @return exporter
     */
    public static Exporter parse(String raw) {
      if (raw == null || raw.isBlank()) {
        return OTLP;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none' (was " + raw + ")");
      };
    }
  }

  public MetricsSettings {
    exporter = Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
    exportInterval = exportInterval == null ? Duration.ofSeconds(30) : exportInterval;
  }

  public static MetricsSettings disabled() {
    return new MetricsSettings(Exporter.NONE, null, null, null);
  }
}
