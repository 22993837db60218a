package ca.gc.eccc.sentinel.application.port;

import ca.gc.eccc.sentinel.domain.assessment.Assessment;
import ca.gc.eccc.sentinel.domain.observation.Observation;
import java.time.Duration;

/**
 * <strong>What:</strong> Port deriving a disaster type, severity and rationale from an observation.
 * <p><strong>Why:</strong> Keeps the classification model opaque; the workflow only consumes its judgment.</p>
 * <p><strong>Role:</strong> Capability port implemented by adapters such as {@code ThresholdClassifier}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use.</p>
 *
 * @implNote Implementations should build results with {@link Assessment#fromLabel} so unrecognized
 * severity labels fall back to the fail-safe level.
 * @since 0.1.0
 */
public interface Classifier {
  /** Capability name used in failures, logs and audit payloads. */
  String CAPABILITY = "classifier";

  /**
   * Classifies one observation.
   *
   * @param observation observation to judge; never {@code null}
   * @param timeout call budget
   * @return assessment referencing {@code observation}
   * @throws ClassificationException when the model times out, is unavailable or returns malformed output
   */
  Assessment classify(Observation observation, Duration timeout) throws ClassificationException;
}
