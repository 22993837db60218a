package ca.gc.eccc.sentinel.application.workflow;

import ca.gc.eccc.sentinel.application.port.Classifier;
import ca.gc.eccc.sentinel.application.port.Notifier;
import ca.gc.eccc.sentinel.application.port.ObservationSource;
import ca.gc.eccc.sentinel.application.port.ResponsePlanner;
import java.util.Objects;

/**
 * External capabilities injected into the {@link WorkflowEngine}.
 *
 * @since 0.1.0
 */
public record WorkflowCapabilities(
    ObservationSource observationSource,
    Classifier classifier,
    ResponsePlanner planner,
    Notifier notifier) {

  public WorkflowCapabilities {
    observationSource = Objects.requireNonNull(observationSource, "observationSource");
    classifier = Objects.requireNonNull(classifier, "classifier");
    planner = Objects.requireNonNull(planner, "planner");
    notifier = Objects.requireNonNull(notifier, "notifier");
  }
}
