package ca.gc.eccc.sentinel.application.workflow;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.eccc.sentinel.domain.assessment.Severity;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SeverityPolicyTest {
  private final SeverityPolicy policy = SeverityPolicy.defaults();

  @Test
  void criticalAndHighBypassApproval() {
    assertFalse(policy.decide(Severity.CRITICAL).requiresApproval());
    assertFalse(policy.decide(Severity.HIGH).requiresApproval());
  }

  @Test
  void mediumAndLowRequireApproval() {
    assertTrue(policy.decide(Severity.MEDIUM).requiresApproval());
    assertTrue(policy.decide(Severity.LOW).requiresApproval());
  }

  @Test
  void labelsAreMatchedCaseInsensitively() {
    assertFalse(policy.decide(" critical ").requiresApproval());
    assertTrue(policy.decide("LOW.").requiresApproval());
    assertFalse(policy.decide("low").failSafe());
  }

  @Test
  void unknownOrMissingLabelFailsSafe() {
    PolicyDecision unknown = policy.decide("Severe-ish");
    assertTrue(unknown.requiresApproval());
    assertTrue(unknown.failSafe());
    assertTrue(unknown.recognizedSeverity().isEmpty());

    assertTrue(policy.decide((String) null).requiresApproval());
    assertTrue(policy.decide((Severity) null).failSafe());
  }

  @Test
  void overridesReplaceOnlyNamedLevels() {
    SeverityPolicy custom = SeverityPolicy.withOverrides(Map.of(Severity.LOW, Boolean.FALSE));

    assertFalse(custom.decide(Severity.LOW).requiresApproval());
    assertTrue(custom.decide(Severity.MEDIUM).requiresApproval());
    assertFalse(custom.decide(Severity.CRITICAL).requiresApproval());
  }
}
