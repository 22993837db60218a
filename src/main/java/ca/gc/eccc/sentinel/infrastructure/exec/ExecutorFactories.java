package ca.gc.eccc.sentinel.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the named thread pools used by the workflow engine.
 *
 * <ul>
 *   <li>workflow pool: fixed size, non-daemon, runs incident transitions;</li>
 *   <li>call pool: unbounded daemon threads running capability calls so that timed-out calls can be
 *   abandoned without blocking a workflow thread;</li>
 *   <li>timer: single daemon thread firing approval expiries.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Creates the fixed-size pool that runs incident transitions.
   *
   * @param size worker count; must be positive
   * @param prefix thread name prefix
   * @param handler uncaught exception handler; {@code null} logs the failure
   * @return executor service
   */
  public static ExecutorService newWorkflowPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadFactory factory = threadFactory(defaultPrefix(prefix, "sentinel-workflow"), false, handler);
    return new ThreadPoolExecutor(
        size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Creates the pool that runs capability calls under timeouts.
   *
   * @param prefix thread name prefix
   * @return executor service
   */
  public static ExecutorService newCallPool(String prefix) {
    ThreadFactory factory = threadFactory(defaultPrefix(prefix, "sentinel-call"), true, null);
    return new ThreadPoolExecutor(
        0, Integer.MAX_VALUE, 30L, TimeUnit.SECONDS, new SynchronousQueue<>(), factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Creates the single-threaded scheduler used for approval expiry.
   *
   * @param prefix thread name prefix
   * @return scheduler
   */
  public static ScheduledExecutorService newTimer(String prefix) {
    ScheduledThreadPoolExecutor timer =
        new ScheduledThreadPoolExecutor(1, threadFactory(defaultPrefix(prefix, "sentinel-timer"), true, null));
    timer.setRemoveOnCancelPolicy(true);
    return timer;
  }

  /**
   * Shuts an executor down, waiting up to {@code timeout} before forcing termination.
   *
   * @param executor executor to stop; ignored when {@code null}
   * @param timeout graceful wait
   * @return {@code true} when the executor terminated within the timeout
   */
  public static boolean shutdownGracefully(ExecutorService executor, Duration timeout) {
    if (executor == null) {
      return true;
    }
    executor.shutdown();
    try {
      if (executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
      log.warn("Executor did not terminate within {}; forcing shutdown", timeout);
      executor.shutdownNow();
      return false;
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static ThreadFactory threadFactory(String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    UncaughtExceptionHandler effective = Objects.requireNonNullElse(handler,
        (thread, ex) -> log.error("Uncaught exception on {}", thread.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(effective);
      return thread;
    };
  }

  private static String defaultPrefix(String prefix, String fallback) {
    return prefix == null || prefix.isBlank() ? fallback : prefix;
  }
}
