package ca.gc.eccc.sentinel.domain.alert;

import java.util.Objects;

/**
 * Department-specific response plan attached to an alert.
 *
 * @param department owning department; never {@code null}
 * @param text plan body; never {@code null}
 * @param generated {@code false} when the planner failed and {@code text} is a placeholder
 * @since 0.1.0
 */
public record ResponsePlan(ResponseDepartment department, String text, boolean generated) {

  /** Placeholder body used when no plan could be produced. */
  public static final String UNAVAILABLE_TEXT = "Response plan unavailable";

  public ResponsePlan {
    department = Objects.requireNonNull(department, "department");
    text = Objects.requireNonNull(text, "text");
  }

  /**
   * Builds the placeholder plan used when the planner fails.
   *
   * @param department owning department
   * @return placeholder plan
   */
  public static ResponsePlan unavailable(ResponseDepartment department) {
    return new ResponsePlan(department, UNAVAILABLE_TEXT, false);
  }
}
