package ca.gc.eccc.sentinel.application.workflow;

import ca.gc.eccc.sentinel.application.port.CapabilityException;
import ca.gc.eccc.sentinel.application.port.FailureKind;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Retry and timeout harness wrapped around every external capability call.
 * <p><strong>Why:</strong> No workflow wait may be unbounded, and transient failures are retried under a
 * single exponential backoff policy.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; each call runs on the shared call executor
 * and the caller blocks for at most the per-attempt timeout plus backoff.</p>
 *
 * <p>Timed-out calls are cancelled with interruption and reported as transient
 * {@link CapabilityException#TIMEOUT_CODE} failures. Runtime exceptions thrown by adapters are
 * treated as transient. Terminal failures end the call immediately.</p>
 *
 * @since 0.1.0
 */
public final class CapabilityInvoker {
  private static final Logger log = LoggerFactory.getLogger(CapabilityInvoker.class);

  /** Blocking capability call. */
  @FunctionalInterface
  public interface Call<T> {
    T call() throws CapabilityException;
  }

  /** Waits between attempts. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;

    Sleeper THREAD = duration -> {
      if (!duration.isZero()) {
        Thread.sleep(duration.toMillis());
      }
    };
  }

  private final ExecutorService callExecutor;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;

  public CapabilityInvoker(ExecutorService callExecutor, RetryPolicy retryPolicy) {
    this(callExecutor, retryPolicy, Sleeper.THREAD);
  }

  public CapabilityInvoker(ExecutorService callExecutor, RetryPolicy retryPolicy, Sleeper sleeper) {
    this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  /**
   * Invokes a capability under the retry policy.
   *
   * @param capability capability name used in logs and synthesized failures
   * @param timeout per-attempt timeout
   * @param call blocking call
   * @param <T> result type
   * @return result carrying the value or the last failure, and the attempt count
   */
  public <T> CallResult<T> invoke(String capability, Duration timeout, Call<T> call) {
    Objects.requireNonNull(call, "call");
    int maxAttempts = retryPolicy.maxAttempts();
    CapabilityException last = null;
    int attempt = 0;
    while (attempt < maxAttempts) {
      attempt++;
      if (attempt > 1) {
        Duration backoff = retryPolicy.backoffBefore(attempt);
        try {
          sleeper.sleep(backoff);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          return CallResult.failure(interrupted(capability, ex), attempt - 1);
        }
      }
      try {
        T value = attemptOnce(capability, timeout, call);
        if (attempt > 1) {
          log.info("{} succeeded on attempt {}/{}", capability, attempt, maxAttempts);
        }
        return CallResult.success(value, attempt);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return CallResult.failure(interrupted(capability, ex), attempt);
      } catch (CapabilityException ex) {
        last = ex;
        if (!ex.isTransient()) {
          log.warn("{} failed terminally on attempt {}: {} ({})",
              capability, attempt, ex.getMessage(), ex.code());
          return CallResult.failure(ex, attempt);
        }
        log.warn("{} attempt {}/{} failed: {} ({})",
            capability, attempt, maxAttempts, ex.getMessage(), ex.code());
      }
    }
    return CallResult.failure(last, attempt);
  }

  private <T> T attemptOnce(String capability, Duration timeout, Call<T> call)
      throws CapabilityException, InterruptedException {
    Callable<T> task = call::call;
    Future<T> future;
    try {
      future = callExecutor.submit(task);
    } catch (RejectedExecutionException ex) {
      throw new CapabilityException(
          capability, FailureKind.TERMINAL, "rejected", "call executor is shut down", ex);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw CapabilityException.timeout(capability, timeout.toMillis());
    } catch (InterruptedException ex) {
      future.cancel(true);
      throw ex;
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof CapabilityException capabilityFailure) {
        throw capabilityFailure;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new CapabilityException(
          capability, FailureKind.TRANSIENT, "unexpected",
          cause == null ? "unexpected failure" : cause.toString(), cause);
    }
  }

  private static CapabilityException interrupted(String capability, InterruptedException ex) {
    return new CapabilityException(
        capability, FailureKind.TERMINAL, "interrupted", capability + " call interrupted", ex);
  }
}
