package ca.gc.eccc.sentinel.application.workflow;

import ca.gc.eccc.sentinel.domain.assessment.Severity;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps a severity level to whether human approval is mandatory before dispatch.
 *
 * <p>Deterministic and free of I/O. Critical and High bypass approval by default, Medium and Low
 * require it. Overrides come from configuration ({@code policy.requiresApproval.<LEVEL>}).
 * Unrecognized or missing severities always require approval.</p>
 *
 * @since 0.1.0
 */
public final class SeverityPolicy {
  private final Map<Severity, Boolean> requiresApproval;

  private SeverityPolicy(Map<Severity, Boolean> requiresApproval) {
    this.requiresApproval = Collections.unmodifiableMap(requiresApproval);
  }

  /** Default gating rule. */
  public static SeverityPolicy defaults() {
    return withOverrides(Map.of());
  }

  /**
   * Builds a policy from the defaults with per-level overrides applied.
   *
   * @param overrides levels whose approval requirement differs from the defaults
   * @return policy
   */
  public static SeverityPolicy withOverrides(Map<Severity, Boolean> overrides) {
    Objects.requireNonNull(overrides, "overrides");
    EnumMap<Severity, Boolean> table = new EnumMap<>(Severity.class);
    table.put(Severity.CRITICAL, Boolean.FALSE);
    table.put(Severity.HIGH, Boolean.FALSE);
    table.put(Severity.MEDIUM, Boolean.TRUE);
    table.put(Severity.LOW, Boolean.TRUE);
    overrides.forEach((severity, value) ->
        table.put(Objects.requireNonNull(severity, "severity"), Objects.requireNonNull(value, "value")));
    return new SeverityPolicy(table);
  }

  /**
   * Decides for a recognized severity.
   *
   * @param severity severity level; {@code null} is treated as unrecognized
   * @return decision
   */
  public PolicyDecision decide(Severity severity) {
    if (severity == null) {
      return new PolicyDecision(null, true, true);
    }
    return new PolicyDecision(severity, requiresApproval.get(severity), false);
  }

  /**
   * Decides for a raw severity label.
   *
   * @param label classifier label; unrecognized values require approval
   * @return decision
   */
  public PolicyDecision decide(String label) {
    return Severity.parse(label)
        .map(this::decide)
        .orElseGet(() -> new PolicyDecision(null, true, true));
  }

  public Map<Severity, Boolean> table() {
    return requiresApproval;
  }

  @Override
  public String toString() {
    return "SeverityPolicy" + requiresApproval;
  }
}
