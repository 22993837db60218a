package ca.gc.eccc.sentinel.config;

import ca.gc.eccc.sentinel.application.workflow.CapabilityTimeouts;
import ca.gc.eccc.sentinel.application.workflow.RetryPolicy;
import ca.gc.eccc.sentinel.application.workflow.SeverityPolicy;
import ca.gc.eccc.sentinel.domain.assessment.Severity;
import ca.gc.eccc.sentinel.infrastructure.metrics.MetricsSettings;
import ca.gc.eccc.sentinel.validation.Net;
import ca.gc.eccc.sentinel.validation.Numbers;
import ca.gc.eccc.sentinel.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated settings for the {@code monitor} command.
 * <p><strong>Why:</strong> Turns the merged key/value map into the typed policies and adapter choices the
 * composition root wires together, failing fast on bad input before any capability is contacted.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param locations monitored locations in polling order
 * @param pollInterval delay between cycle starts
 * @param cycles cycle budget; {@code 0} runs until stopped
 * @param workers workflow worker threads
 * @param retryPolicy retry/backoff policy shared by all capabilities
 * @param timeouts per-capability call timeouts and the audit append bound
 * @param approvalTimeout time an approval request stays pending before it expires
 * @param awaitApprovalsOnExit whether a bounded run waits for suspended incidents before returning
 * @param severityPolicy approval gating table
 * @param recipients alert recipients
 * @param observationDir directory of per-location observation snapshots
 * @param notifierMode alert transport
 * @param alertsOut output directory of the FILE notifier
 * @param auditMode audit trail destination
 * @param auditLog JSON-lines audit log of the FILE audit mode
 * @param kafkaBootstrap Kafka bootstrap servers; present when a Kafka mode is selected
 * @param kafkaAlertsTopic alert topic of the KAFKA notifier
 * @param kafkaAuditTopic audit topic of the KAFKA audit mode
 * @param approvalInbox approval inbox directory; empty disables the operator inbox
 * @param approvalPollInterval inbox poll interval
 * @param metrics OpenTelemetry exporter settings
 * @since 0.1.0
 */
public record MonitorConfig(
    List<String> locations,
    Duration pollInterval,
    long cycles,
    int workers,
    RetryPolicy retryPolicy,
    CapabilityTimeouts timeouts,
    Duration approvalTimeout,
    boolean awaitApprovalsOnExit,
    SeverityPolicy severityPolicy,
    List<String> recipients,
    Path observationDir,
    NotifierMode notifierMode,
    Path alertsOut,
    AuditMode auditMode,
    Path auditLog,
    Optional<String> kafkaBootstrap,
    String kafkaAlertsTopic,
    String kafkaAuditTopic,
    Optional<Path> approvalInbox,
    Duration approvalPollInterval,
    MetricsSettings metrics) {

  static final String POLICY_PREFIX = "policy.requiresApproval.";

  public MonitorConfig {
    locations = List.copyOf(Objects.requireNonNull(locations, "locations"));
    if (locations.isEmpty()) {
      throw new IllegalArgumentException("locations is required");
    }
    recipients = List.copyOf(Objects.requireNonNull(recipients, "recipients"));
    if (recipients.isEmpty()) {
      throw new IllegalArgumentException("recipients is required");
    }
    Objects.requireNonNull(pollInterval, "pollInterval");
    Objects.requireNonNull(retryPolicy, "retryPolicy");
    Objects.requireNonNull(timeouts, "timeouts");
    Objects.requireNonNull(approvalTimeout, "approvalTimeout");
    Objects.requireNonNull(severityPolicy, "severityPolicy");
    Objects.requireNonNull(observationDir, "observationDir");
    notifierMode = Objects.requireNonNullElse(notifierMode, NotifierMode.LOG);
    auditMode = Objects.requireNonNullElse(auditMode, AuditMode.FILE);
    Objects.requireNonNull(alertsOut, "alertsOut");
    Objects.requireNonNull(auditLog, "auditLog");
    kafkaBootstrap = Objects.requireNonNullElse(kafkaBootstrap, Optional.empty());
    kafkaAlertsTopic = Strings.sanitizeTopic("kafkaAlertsTopic", kafkaAlertsTopic);
    kafkaAuditTopic = Strings.sanitizeTopic("kafkaAuditTopic", kafkaAuditTopic);
    approvalInbox = Objects.requireNonNullElse(approvalInbox, Optional.empty());
    Objects.requireNonNull(approvalPollInterval, "approvalPollInterval");
    metrics = Objects.requireNonNullElse(metrics, MetricsSettings.disabled());
    if (cycles < 0) {
      throw new IllegalArgumentException("cycles must be >= 0");
    }
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    boolean kafkaUsed = notifierMode == NotifierMode.KAFKA || auditMode == AuditMode.KAFKA;
    if (kafkaUsed && kafkaBootstrap.isEmpty()) {
      throw new IllegalArgumentException("kafkaBootstrap is required when notifierMode or auditMode is KAFKA");
    }
  }

  /**
   * Creates a configuration from merged key/value pairs (see {@link DefaultsForMode}).
   *
   * @param options merged configuration
   * @return validated configuration
   * @throws IllegalArgumentException naming the offending key when a value is missing or invalid
   */
  public static MonitorConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Map<String, String> defaults = DefaultsForMode.asFlatMap("monitor");

    List<String> locations = Strings.splitList("locations", value(options, defaults, "locations"));
    for (String location : locations) {
      if (location.length() > 128) {
        throw new IllegalArgumentException("locations entries must be at most 128 characters: " + location);
      }
    }
    Duration pollInterval = Duration.ofSeconds(
        Numbers.parseLong("pollIntervalSeconds", value(options, defaults, "pollIntervalSeconds"), 1, 86_400));
    long cycles = Numbers.parseLong("cycles", value(options, defaults, "cycles"), 0, Long.MAX_VALUE);
    int workers = (int) Numbers.parseLong("workers", value(options, defaults, "workers"), 1, 256);

    RetryPolicy retryPolicy = new RetryPolicy(
        (int) Numbers.parseLong("retry.maxRetries", value(options, defaults, "retry.maxRetries"), 0, 10),
        Duration.ofMillis(Numbers.parseLong("retry.initialBackoffMillis",
            value(options, defaults, "retry.initialBackoffMillis"), 0, 600_000)),
        Numbers.parseDouble("retry.multiplier", value(options, defaults, "retry.multiplier"), 1.0d, 10.0d),
        Duration.ofMillis(Numbers.parseLong("retry.maxBackoffMillis",
            value(options, defaults, "retry.maxBackoffMillis"), 0, 3_600_000)));

    CapabilityTimeouts timeouts = new CapabilityTimeouts(
        millis(options, defaults, "timeout.observationMillis"),
        millis(options, defaults, "timeout.classifierMillis"),
        millis(options, defaults, "timeout.plannerMillis"),
        millis(options, defaults, "timeout.notifierMillis"),
        Duration.ofMillis(Numbers.parseLong("timeout.auditMillis",
            value(options, defaults, "timeout.auditMillis"), 50, 60_000)));

    Duration approvalTimeout = Duration.ofSeconds(Numbers.parseLong("approvalTimeoutSeconds",
        value(options, defaults, "approvalTimeoutSeconds"), 1, 7 * 86_400));
    boolean awaitApprovals = parseBoolean("awaitApprovalsOnExit", value(options, defaults, "awaitApprovalsOnExit"));

    SeverityPolicy severityPolicy = SeverityPolicy.withOverrides(policyOverrides(options));
    List<String> recipients = Strings.splitList("recipients", value(options, defaults, "recipients"));

    NotifierMode notifierMode = NotifierMode.fromString(value(options, defaults, "notifierMode"));
    AuditMode auditMode = AuditMode.fromString(value(options, defaults, "auditMode"));
    Optional<String> kafkaBootstrap = optionalString(options.get("kafkaBootstrap"))
        .map(v -> Net.validateBootstrapServers("kafkaBootstrap", v));
    // An explicit blank value disables the inbox.
    String inboxRaw = options.containsKey("approvalInbox") ? options.get("approvalInbox") : defaults.get("approvalInbox");
    Optional<Path> approvalInbox = optionalString(inboxRaw)
        .map(v -> parsePath("approvalInbox", v));
    Duration approvalPoll = Duration.ofMillis(Numbers.parseLong("approvalPollMillis",
        value(options, defaults, "approvalPollMillis"), 50, 60_000));

    MetricsSettings metrics = new MetricsSettings(
        MetricsSettings.Exporter.parse(value(options, defaults, "metricsExporter")),
        options.get("otelEndpoint"),
        options.get("otelResourceAttributes"),
        null);

    return new MonitorConfig(
        locations,
        pollInterval,
        cycles,
        workers,
        retryPolicy,
        timeouts,
        approvalTimeout,
        awaitApprovals,
        severityPolicy,
        recipients,
        parsePath("observationDir", value(options, defaults, "observationDir")),
        notifierMode,
        parsePath("alertsOut", value(options, defaults, "alertsOut")),
        auditMode,
        parsePath("auditLog", value(options, defaults, "auditLog")),
        kafkaBootstrap,
        value(options, defaults, "kafkaAlertsTopic"),
        value(options, defaults, "kafkaAuditTopic"),
        approvalInbox,
        approvalPoll,
        metrics);
  }

  private static Map<Severity, Boolean> policyOverrides(Map<String, String> options) {
    Map<Severity, Boolean> overrides = new EnumMap<>(Severity.class);
    for (Map.Entry<String, String> entry : options.entrySet()) {
      String key = entry.getKey();
      if (!key.startsWith(POLICY_PREFIX)) {
        continue;
      }
      String level = key.substring(POLICY_PREFIX.length());
      Severity severity = Severity.parse(level)
          .orElseThrow(() -> new IllegalArgumentException(
              key + " does not name a severity level (Critical, High, Medium, Low)"));
      overrides.put(severity, parseBoolean(key, entry.getValue()));
    }
    return overrides;
  }

  private static Duration millis(Map<String, String> options, Map<String, String> defaults, String key) {
    return Duration.ofMillis(Numbers.parseLong(key, value(options, defaults, key), 1, 3_600_000));
  }

  private static String value(Map<String, String> options, Map<String, String> defaults, String key) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaults.get(key);
    }
    return raw.trim();
  }

  private static boolean parseBoolean(String key, String raw) {
    String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + raw + ")");
    };
  }

  private static Optional<String> optionalString(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
  }

  private static Path parsePath(String name, String value) {
    String trimmed = Strings.requireNonBlank(name, value);
    try {
      return Path.of(trimmed).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
