package ca.gc.eccc.sentinel.application.workflow;

import ca.gc.eccc.sentinel.domain.alert.ResponseDepartment;
import ca.gc.eccc.sentinel.domain.assessment.Assessment;
import ca.gc.eccc.sentinel.domain.assessment.Severity;
import java.util.Locale;

/**
 * Routes a classified incident to the department that owns the response.
 *
 * @since 0.1.0
 */
public final class ResponseRouter {
  private ResponseRouter() {}

  /**
   * Selects the department: emergency management for critical and high severity, public works for
   * floods and storms, civil defense otherwise.
   *
   * @param assessment classified assessment
   * @return owning department
   */
  public static ResponseDepartment route(Assessment assessment) {
    Severity severity = assessment.severity();
    if (severity == Severity.CRITICAL || severity == Severity.HIGH) {
      return ResponseDepartment.EMERGENCY_MANAGEMENT;
    }
    String type = assessment.disasterType().toLowerCase(Locale.ROOT);
    if (type.contains("flood") || type.contains("storm")) {
      return ResponseDepartment.PUBLIC_WORKS;
    }
    return ResponseDepartment.CIVIL_DEFENSE;
  }
}
