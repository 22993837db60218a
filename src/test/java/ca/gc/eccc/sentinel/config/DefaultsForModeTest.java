package ca.gc.eccc.sentinel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void monitorDefaultsCarryWorkflowSettings() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("monitor");

    assertEquals("otlp", defaults.get("metricsExporter"));
    assertEquals("3", defaults.get("retry.maxRetries"));
    assertEquals("900", defaults.get("approvalTimeoutSeconds"));
    assertEquals("true", defaults.get("awaitApprovalsOnExit"));
    assertEquals("LOG", defaults.get("notifierMode"));
    assertEquals("FILE", defaults.get("auditMode"));
    assertEquals("false", defaults.get("policy.requiresApproval.HIGH"));
    assertEquals("true", defaults.get("policy.requiresApproval.LOW"));
  }

  @Test
  void modeNameIsCaseInsensitive() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Replay ");

    assertTrue(defaults.containsKey("auditLog"));
    assertEquals("", defaults.get("incident"));
    assertFalse(defaults.containsKey("workers"));
  }

  @Test
  void approveDefaultsNameAnInbox() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("approve");

    assertEquals("./approvals", defaults.get("inbox"));
    assertFalse(defaults.get("operator").isBlank());
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
