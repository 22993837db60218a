package ca.gc.eccc.sentinel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.eccc.sentinel.domain.assessment.Severity;
import ca.gc.eccc.sentinel.infrastructure.metrics.MetricsSettings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MonitorConfigTest {

  private static Map<String, String> minimal() {
    Map<String, String> options = new HashMap<>();
    options.put("locations", "Ottawa, Halifax,Ottawa");
    options.put("recipients", "ops@example.org");
    return options;
  }

  @Test
  void defaultsApplyWhenOnlyRequiredKeysGiven() {
    MonitorConfig config = MonitorConfig.fromMap(minimal());

    assertEquals(List.of("Ottawa", "Halifax"), config.locations());
    assertEquals(List.of("ops@example.org"), config.recipients());
    assertEquals(Duration.ofSeconds(60), config.pollInterval());
    assertEquals(0L, config.cycles());
    assertEquals(4, config.workers());
    assertEquals(4, config.retryPolicy().maxAttempts());
    assertEquals(Duration.ofMillis(500), config.retryPolicy().initialBackoff());
    assertEquals(Duration.ofSeconds(900), config.approvalTimeout());
    assertEquals(Duration.ofSeconds(2), config.timeouts().audit());
    assertTrue(config.awaitApprovalsOnExit());
    assertEquals(NotifierMode.LOG, config.notifierMode());
    assertEquals(AuditMode.FILE, config.auditMode());
    assertTrue(config.auditLog().isAbsolute());
    assertTrue(config.approvalInbox().isPresent());
    assertEquals(Optional.empty(), config.kafkaBootstrap());
    assertEquals("sentinel.alerts.v1", config.kafkaAlertsTopic());
    assertEquals(MetricsSettings.Exporter.OTLP, config.metrics().exporter());
    assertEquals(MetricsSettings.DEFAULT_ENDPOINT, config.metrics().endpoint());
    assertTrue(config.severityPolicy().decide(Severity.MEDIUM).requiresApproval());
    assertFalse(config.severityPolicy().decide(Severity.CRITICAL).requiresApproval());
  }

  @Test
  void explicitValuesOverrideDefaults() {
    Map<String, String> options = minimal();
    options.put("pollIntervalSeconds", "5");
    options.put("cycles", "2");
    options.put("workers", "1");
    options.put("retry.maxRetries", "0");
    options.put("timeout.notifierMillis", "250");
    options.put("timeout.auditMillis", "750");
    options.put("approvalTimeoutSeconds", "30");
    options.put("awaitApprovalsOnExit", "FALSE");
    options.put("notifierMode", "file");
    options.put("alertsOut", "out/../alerts");
    options.put("metricsExporter", "none");

    MonitorConfig config = MonitorConfig.fromMap(options);

    assertEquals(Duration.ofSeconds(5), config.pollInterval());
    assertEquals(2L, config.cycles());
    assertEquals(1, config.workers());
    assertEquals(1, config.retryPolicy().maxAttempts());
    assertEquals(Duration.ofMillis(250), config.timeouts().notifier());
    assertEquals(Duration.ofMillis(750), config.timeouts().audit());
    assertEquals(Duration.ofSeconds(30), config.approvalTimeout());
    assertFalse(config.awaitApprovalsOnExit());
    assertEquals(NotifierMode.FILE, config.notifierMode());
    assertEquals(Path.of("alerts").toAbsolutePath().normalize(), config.alertsOut());
    assertEquals(MetricsSettings.Exporter.NONE, config.metrics().exporter());
  }

  @Test
  void policyOverridesAcceptSeverityLabelsInAnyCase() {
    Map<String, String> options = minimal();
    options.put("policy.requiresApproval.medium", "false");
    options.put("policy.requiresApproval.HIGH", "true");

    MonitorConfig config = MonitorConfig.fromMap(options);

    assertFalse(config.severityPolicy().decide(Severity.MEDIUM).requiresApproval());
    assertTrue(config.severityPolicy().decide(Severity.HIGH).requiresApproval());
    assertTrue(config.severityPolicy().decide(Severity.LOW).requiresApproval());
  }

  @Test
  void policyOverrideForUnknownLevelIsRejected() {
    Map<String, String> options = minimal();
    options.put("policy.requiresApproval.Severe", "true");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> MonitorConfig.fromMap(options));
    assertTrue(ex.getMessage().contains("policy.requiresApproval.Severe"));
  }

  @Test
  void blankApprovalInboxDisablesInbox() {
    Map<String, String> options = minimal();
    options.put("approvalInbox", " ");

    assertEquals(Optional.empty(), MonitorConfig.fromMap(options).approvalInbox());
  }

  @Test
  void locationsAndRecipientsAreRequired() {
    Map<String, String> noLocations = minimal();
    noLocations.remove("locations");
    Map<String, String> noRecipients = minimal();
    noRecipients.put("recipients", " , ");

    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(noLocations));
    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(noRecipients));
  }

  @Test
  void outOfRangeValuesNameTheKey() {
    Map<String, String> options = minimal();
    options.put("retry.maxRetries", "11");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> MonitorConfig.fromMap(options));
    assertTrue(ex.getMessage().startsWith("retry.maxRetries"));

    Map<String, String> badWorkers = minimal();
    badWorkers.put("workers", "many");
    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(badWorkers));
  }

  @Test
  void kafkaModeNeedsValidBootstrap() {
    Map<String, String> missing = minimal();
    missing.put("auditMode", "KAFKA");
    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(missing));

    Map<String, String> bad = minimal();
    bad.put("notifierMode", "KAFKA");
    bad.put("kafkaBootstrap", "broker-without-port");
    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(bad));

    Map<String, String> good = minimal();
    good.put("notifierMode", "KAFKA");
    good.put("kafkaBootstrap", "broker1:9092, broker2:9093");
    assertEquals(Optional.of("broker1:9092,broker2:9093"), MonitorConfig.fromMap(good).kafkaBootstrap());
  }

  @Test
  void invalidBooleanIsRejected() {
    Map<String, String> options = minimal();
    options.put("awaitApprovalsOnExit", "yes");

    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(options));
  }
}
