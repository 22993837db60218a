package ca.gc.eccc.sentinel.domain.assessment;

import ca.gc.eccc.sentinel.domain.observation.Observation;
import java.util.Objects;

/**
 * <strong>What:</strong> Classifier judgment derived from exactly one {@link Observation}.
 * <p><strong>Why:</strong> Drives severity gating and supplies the rationale quoted in alerts.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * <p>An unrecognized severity label is normalized to {@link Severity#MEDIUM} so that the incident
 * is held for human approval; {@link #severityDefaulted()} then reports {@code true} and
 * {@link #reportedSeverity()} keeps the original label.</p>
 *
 * @param disasterType disaster label (e.g. {@code Severe Storm}); never blank
 * @param severity normalized severity; never {@code null}
 * @param reportedSeverity severity label exactly as the classifier reported it; may be empty
 * @param severityDefaulted whether {@code severity} was substituted for an unrecognized label
 * @param rationale short explanation produced by the classifier; never {@code null}
 * @param observation observation the assessment was derived from; never {@code null}
 * @since 0.1.0
 */
public record Assessment(
    String disasterType,
    Severity severity,
    String reportedSeverity,
    boolean severityDefaulted,
    String rationale,
    Observation observation) {

  /** Severity assumed when the classifier output does not name a recognized level. */
  public static final Severity FAIL_SAFE_SEVERITY = Severity.MEDIUM;

  /**
   * Validates required fields.
   */
  public Assessment {
    disasterType = Objects.requireNonNull(disasterType, "disasterType").trim();
    if (disasterType.isEmpty()) {
      throw new IllegalArgumentException("disasterType must not be blank");
    }
    severity = Objects.requireNonNull(severity, "severity");
    reportedSeverity = reportedSeverity == null ? "" : reportedSeverity.trim();
    rationale = rationale == null ? "" : rationale.trim();
    observation = Objects.requireNonNull(observation, "observation");
  }

  /**
   * Builds an assessment from a raw classifier severity label.
   *
   * @param disasterType disaster label
   * @param severityLabel raw severity label; unrecognized values fall back to {@link #FAIL_SAFE_SEVERITY}
   * @param rationale classifier explanation
   * @param observation source observation
   * @return normalized assessment
   */
  public static Assessment fromLabel(
      String disasterType, String severityLabel, String rationale, Observation observation) {
    return Severity.parse(severityLabel)
        .map(s -> new Assessment(disasterType, s, severityLabel, false, rationale, observation))
        .orElseGet(() -> new Assessment(
            disasterType, FAIL_SAFE_SEVERITY, severityLabel, true, rationale, observation));
  }
}
