package ca.gc.eccc.sentinel.application.workflow;

import ca.gc.eccc.sentinel.domain.incident.IncidentState;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs polling cycles over the monitored locations until the cycle budget is spent or {@link #stop()}
 * is called.
 *
 * <p>Cancellation takes effect between cycles. Incidents already started are allowed to reach their next
 * terminal or suspension point before {@link #run()} returns. When the run ends on its own (cycle budget
 * spent) and {@code awaitApprovals} is set, suspended incidents are also given until their approval
 * deadline to finish.</p>
 *
 * <p>Instances are not reusable; invoke {@link #run()} at most once.</p>
 *
 * @since 0.1.0
 */
public final class MonitoringUseCase {
  private static final Logger log = LoggerFactory.getLogger(MonitoringUseCase.class);

  private final WorkflowEngine engine;
  private final List<String> locations;
  private final Duration pollInterval;
  private final long cycles;
  private final boolean awaitApprovals;
  private final Duration approvalTimeout;
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final AtomicBoolean started = new AtomicBoolean();
  // handles of incidents not yet terminal; finished ones are tallied and dropped after each cycle
  private final List<IncidentWorkflow> unfinished = new ArrayList<>();

  /**
   * Creates the use case.
   *
   * @param engine workflow engine
   * @param locations monitored locations; never empty
   * @param pollInterval delay between cycle starts
   * @param cycles cycle budget; {@code 0} runs until stopped
   * @param awaitApprovals whether to wait for suspended incidents when the budget is spent
   * @param approvalTimeout approval timeout used to bound that wait
   */
  public MonitoringUseCase(
      WorkflowEngine engine,
      List<String> locations,
      Duration pollInterval,
      long cycles,
      boolean awaitApprovals,
      Duration approvalTimeout) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.locations = List.copyOf(Objects.requireNonNull(locations, "locations"));
    if (this.locations.isEmpty()) {
      throw new IllegalArgumentException("locations must not be empty");
    }
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    if (cycles < 0) {
      throw new IllegalArgumentException("cycles must be >= 0");
    }
    this.cycles = cycles;
    this.awaitApprovals = awaitApprovals;
    this.approvalTimeout = Objects.requireNonNull(approvalTimeout, "approvalTimeout");
  }

  /**
   * Runs cycles until the budget is spent or the run is stopped.
   *
   * @return run summary
   * @throws InterruptedException when the calling thread is interrupted
   */
  public MonitoringSummary run() throws InterruptedException {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("monitoring run already started");
    }
    Map<IncidentState, Long> states = new EnumMap<>(IncidentState.class);
    long incidents = 0;
    long cycle = 0;
    while (!stopRequested.get() && (cycles == 0 || cycle < cycles)) {
      cycle++;
      long cycleStart = System.nanoTime();
      log.info("Polling cycle {} started for {} location(s)", cycle, locations.size());
      List<IncidentWorkflow> launched = engine.runCycle(locations, cycle);
      incidents += launched.size();
      engine.awaitSettled(launched, engine.settleBudget());
      unfinished.addAll(launched);
      tallyFinished(states);
      log.info("Polling cycle {} settled in {} ms", cycle,
          TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - cycleStart));
      if (cycles != 0 && cycle >= cycles) {
        break;
      }
      long elapsed = System.nanoTime() - cycleStart;
      long waitNanos = pollInterval.toNanos() - elapsed;
      if (waitNanos > 0 && stopSignal.await(waitNanos, TimeUnit.NANOSECONDS)) {
        break;
      }
    }
    boolean stoppedEarly = stopRequested.get();
    if (!stoppedEarly && awaitApprovals) {
      List<IncidentWorkflow> suspended = engine.live();
      if (!suspended.isEmpty()) {
        log.info("Waiting up to {} for {} incident(s) awaiting approval", approvalTimeout, suspended.size());
        awaitOrStop(suspended, approvalTimeout.plus(engine.settleBudget()));
      }
    }
    // remaining handles are counted in their state at exit
    for (IncidentWorkflow workflow : unfinished) {
      states.merge(workflow.snapshot().state(), 1L, Long::sum);
    }
    MonitoringSummary summary = new MonitoringSummary(cycle, incidents, states, stoppedEarly);
    log.info("Monitoring finished after {} cycle(s): {}", summary.cyclesRun(), summary.finalStates());
    return summary;
  }

  /** Requests cancellation; takes effect at the next cycle boundary. */
  public void stop() {
    if (stopRequested.compareAndSet(false, true)) {
      log.info("Monitoring stop requested");
      stopSignal.countDown();
    }
  }

  public boolean isStopRequested() {
    return stopRequested.get();
  }

  private void awaitOrStop(List<IncidentWorkflow> suspended, Duration budget) throws InterruptedException {
    long deadline = System.nanoTime() + budget.toNanos();
    for (IncidentWorkflow workflow : suspended) {
      while (!workflow.completion().isDone()) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return;
        }
        if (stopSignal.await(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(100)), TimeUnit.NANOSECONDS)) {
          return;
        }
      }
    }
  }

  /** Number of incident handles the run still holds; only meaningful once {@link #run()} returned. */
  int retainedHandles() {
    return unfinished.size();
  }

  private void tallyFinished(Map<IncidentState, Long> states) {
    Iterator<IncidentWorkflow> it = unfinished.iterator();
    while (it.hasNext()) {
      IncidentWorkflow workflow = it.next();
      if (workflow.completion().isDone()) {
        states.merge(workflow.snapshot().state(), 1L, Long::sum);
        it.remove();
      }
    }
  }
}
