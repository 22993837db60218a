package ca.gc.eccc.sentinel.application.port;

/**
 * <strong>What:</strong> Port abstracting SENTINEL metrics emission.
 * <p><strong>Why:</strong> Lets the workflow record counters and latencies without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from every incident.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g. {@code workflow.incident.started},
 * {@code dispatch.attempts}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
