package ca.gc.eccc.sentinel.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each SENTINEL command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys and CLI invocations; the
 * approval gating table in particular lives here ({@code policy.requiresApproval.*}).</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode target command (monitor, approve, replay)
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "monitor" -> buildMonitorDefaults();
      case "approve" -> buildApproveDefaults();
      case "replay" -> buildReplayDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildMonitorDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("locations", "");
    map.put("pollIntervalSeconds", "60");
    map.put("cycles", "0");
    map.put("workers", "4");
    map.put("retry.maxRetries", "3");
    map.put("retry.initialBackoffMillis", "500");
    map.put("retry.multiplier", "2.0");
    map.put("retry.maxBackoffMillis", "10000");
    map.put("timeout.observationMillis", "5000");
    map.put("timeout.classifierMillis", "15000");
    map.put("timeout.plannerMillis", "15000");
    map.put("timeout.notifierMillis", "10000");
    map.put("timeout.auditMillis", "2000");
    map.put("approvalTimeoutSeconds", "900");
    map.put("awaitApprovalsOnExit", "true");
    map.put("policy.requiresApproval.CRITICAL", "false");
    map.put("policy.requiresApproval.HIGH", "false");
    map.put("policy.requiresApproval.MEDIUM", "true");
    map.put("policy.requiresApproval.LOW", "true");
    map.put("recipients", "");
    map.put("observationDir", "./observations");
    map.put("notifierMode", NotifierMode.LOG.name());
    map.put("alertsOut", "./alerts");
    map.put("auditMode", AuditMode.FILE.name());
    map.put("auditLog", "./sentinel-audit.jsonl");
    map.put("kafkaBootstrap", "");
    map.put("kafkaAlertsTopic", "sentinel.alerts.v1");
    map.put("kafkaAuditTopic", "sentinel.audit.v1");
    map.put("approvalInbox", "./approvals");
    map.put("approvalPollMillis", "1000");
    map.put("dryRun", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildApproveDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("inbox", "./approvals");
    map.put("operator", System.getProperty("user.name", "operator"));
    return Map.copyOf(map);
  }

  private static Map<String, String> buildReplayDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("auditLog", "./sentinel-audit.jsonl");
    map.put("incident", "");
    return Map.copyOf(map);
  }
}
