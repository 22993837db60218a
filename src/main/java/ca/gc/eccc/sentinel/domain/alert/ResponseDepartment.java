package ca.gc.eccc.sentinel.domain.alert;

/**
 * Department that owns the response to an incident.
 *
 * @since 0.1.0
 */
public enum ResponseDepartment {
  /** Immediate, life-safety response for critical and high severity events. */
  EMERGENCY_MANAGEMENT("Emergency Management"),
  /** Public safety measures for lower-severity events. */
  CIVIL_DEFENSE("Civil Defense"),
  /** Infrastructure protection for floods and storms. */
  PUBLIC_WORKS("Public Works");

  private final String displayName;

  ResponseDepartment(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }
}
