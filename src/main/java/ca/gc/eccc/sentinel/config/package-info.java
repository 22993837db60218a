/**
 * Configuration loading and composition root wiring for the SENTINEL commands.
 * <p><strong>Role:</strong> Bootstrap layer: merges embedded defaults, YAML and CLI arguments, validates
 * them into {@link ca.gc.eccc.sentinel.config.MonitorConfig}, and selects the adapters behind each port.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates paths, hosts and topic names through {@code ca.gc.eccc.sentinel.validation}.</p>
 */
package ca.gc.eccc.sentinel.config;
