package ca.gc.eccc.sentinel.application.workflow;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-call timeouts for each external capability, plus the bound on a single audit append.
 *
 * @since 0.1.0
 */
public record CapabilityTimeouts(
    Duration observation, Duration classifier, Duration planner, Duration notifier, Duration audit) {

  public static final Duration DEFAULT_AUDIT = Duration.ofSeconds(2);

  public CapabilityTimeouts {
    observation = requirePositive(observation, "observation");
    classifier = requirePositive(classifier, "classifier");
    planner = requirePositive(planner, "planner");
    notifier = requirePositive(notifier, "notifier");
    audit = requirePositive(audit, "audit");
  }

  public CapabilityTimeouts(Duration observation, Duration classifier, Duration planner, Duration notifier) {
    this(observation, classifier, planner, notifier, DEFAULT_AUDIT);
  }

  public static CapabilityTimeouts defaults() {
    return new CapabilityTimeouts(
        Duration.ofSeconds(5), Duration.ofSeconds(15), Duration.ofSeconds(15), Duration.ofSeconds(10),
        DEFAULT_AUDIT);
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " timeout must be positive");
    }
    return value;
  }
}
