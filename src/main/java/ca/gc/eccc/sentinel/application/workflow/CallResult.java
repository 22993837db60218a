package ca.gc.eccc.sentinel.application.workflow;

import ca.gc.eccc.sentinel.application.port.CapabilityException;

/**
 * Outcome of a capability call made through {@link CapabilityInvoker}.
 *
 * @param value returned value; {@code null} on failure
 * @param failure last failure; {@code null} on success
 * @param attempts number of attempts made
 * @param <T> value type
 * @since 0.1.0
 */
public record CallResult<T>(T value, CapabilityException failure, int attempts) {

  static <T> CallResult<T> success(T value, int attempts) {
    return new CallResult<>(value, null, attempts);
  }

  static <T> CallResult<T> failure(CapabilityException failure, int attempts) {
    return new CallResult<>(null, failure, attempts);
  }

  public boolean succeeded() {
    return failure == null;
  }
}
