package ca.gc.eccc.sentinel.application.port;

import ca.gc.eccc.sentinel.domain.alert.ResponseDepartment;
import ca.gc.eccc.sentinel.domain.alert.ResponsePlan;
import ca.gc.eccc.sentinel.domain.assessment.Assessment;
import java.time.Duration;

/**
 * Port producing a department-specific response plan for a classified incident.
 *
 * <p>Planner failures never abort an incident; the workflow substitutes
 * {@link ResponsePlan#unavailable(ResponseDepartment)}.</p>
 *
 * @since 0.1.0
 */
public interface ResponsePlanner {
  /** Capability name used in failures, logs and audit payloads. */
  String CAPABILITY = "response-planner";

  /**
   * Produces a plan.
   *
   * @param department department that owns the response
   * @param assessment classified assessment
   * @param timeout call budget
   * @return generated plan
   * @throws PlanningException when no plan can be produced
   */
  ResponsePlan plan(ResponseDepartment department, Assessment assessment, Duration timeout)
      throws PlanningException;
}
