package ca.gc.eccc.sentinel.domain.incident;

/**
 * Reasons an incident can end in {@link IncidentState#ABORTED}.
 *
 * @since 0.1.0
 */
public enum AbortReason {
  /** Observation source failed or timed out after the retry budget. */
  OBSERVATION_UNAVAILABLE("observation-unavailable"),
  /** Classifier failed or timed out after the retry budget. */
  CLASSIFICATION_FAILED("classification-failed"),
  /** Unexpected failure inside the workflow itself. */
  INTERNAL_ERROR("internal-error");

  private final String code;

  AbortReason(String code) {
    this.code = code;
  }

  /**
   * Returns the stable code recorded in audit payloads.
   *
   * @return kebab-case reason code
   */
  public String code() {
    return code;
  }

  /**
   * Resolves a reason from its audit code.
   *
   * @param code kebab-case code
   * @return matching reason
   * @throws IllegalArgumentException when the code is unknown
   */
  public static AbortReason fromCode(String code) {
    for (AbortReason reason : values()) {
      if (reason.code.equals(code)) {
        return reason;
      }
    }
    throw new IllegalArgumentException("unknown abort reason: " + code);
  }
}
