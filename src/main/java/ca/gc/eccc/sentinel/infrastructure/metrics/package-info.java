/**
 * OpenTelemetry adapter for {@link ca.gc.eccc.sentinel.application.port.MetricsPort}.
 * <p>Counters and histograms are created lazily per metric key and cached. Only metadata is exported;
 * alert bodies, rationales and plans never become metric attributes.</p>
 */
package ca.gc.eccc.sentinel.infrastructure.metrics;
