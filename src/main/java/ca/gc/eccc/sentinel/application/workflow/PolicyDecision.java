package ca.gc.eccc.sentinel.application.workflow;

import ca.gc.eccc.sentinel.domain.assessment.Severity;
import java.util.Optional;

/**
 * Result of consulting the {@link SeverityPolicy}.
 *
 * @param severity recognized severity; {@code null} when the label was not recognized
 * @param requiresApproval whether human approval is mandatory before dispatch
 * @param failSafe {@code true} when the decision came from the fail-safe default for an unrecognized label
 * @since 0.1.0
 */
public record PolicyDecision(Severity severity, boolean requiresApproval, boolean failSafe) {

  public Optional<Severity> recognizedSeverity() {
    return Optional.ofNullable(severity);
  }
}
