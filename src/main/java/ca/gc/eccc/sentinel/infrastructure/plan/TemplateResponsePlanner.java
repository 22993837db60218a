package ca.gc.eccc.sentinel.infrastructure.plan;

import ca.gc.eccc.sentinel.application.port.ResponsePlanner;
import ca.gc.eccc.sentinel.domain.alert.ResponseDepartment;
import ca.gc.eccc.sentinel.domain.alert.ResponsePlan;
import ca.gc.eccc.sentinel.domain.assessment.Assessment;
import java.time.Duration;

/**
 * Deterministic {@link ResponsePlanner} producing department checklists.
 *
 * <p>Emergency management gets immediate actions, civil defense public safety measures, and public works
 * infrastructure protection steps.</p>
 *
 * @since 0.1.0
 */
public final class TemplateResponsePlanner implements ResponsePlanner {

  @Override
  public ResponsePlan plan(ResponseDepartment department, Assessment assessment, Duration timeout) {
    String location = assessment.observation().location();
    String header = department.displayName() + " response plan: " + assessment.disasterType()
        + " (" + assessment.severity().label() + " severity) in " + location;
    String steps = switch (department) {
      case EMERGENCY_MANAGEMENT -> String.join("\n",
          "1. Activate the emergency operations centre and notify on-call responders.",
          "2. Issue public warnings through all broadcast channels.",
          "3. Pre-position search and rescue, medical and evacuation resources.",
          "4. Open shelters and confirm evacuation routes are passable.",
          "5. Report status to provincial emergency management every hour.");
      case CIVIL_DEFENSE -> String.join("\n",
          "1. Publish public safety advisories with protective actions for residents.",
          "2. Check on vulnerable populations and care facilities.",
          "3. Prepare cooling, warming or reception centres as conditions require.",
          "4. Coordinate with local police and fire services on patrols.");
      case PUBLIC_WORKS -> String.join("\n",
          "1. Inspect and clear storm drains, culverts and pumping stations.",
          "2. Stage barriers, sandbags and generators at known flood points.",
          "3. Secure construction sites and loose infrastructure against wind.",
          "4. Dispatch crews to monitor bridges, underpasses and power lines.");
    };
    return new ResponsePlan(department, header + "\n" + steps, true);
  }
}
