package ca.gc.eccc.sentinel.application.workflow;

import ca.gc.eccc.sentinel.application.port.ApprovalNoticePort;
import ca.gc.eccc.sentinel.application.port.ClockPort;
import ca.gc.eccc.sentinel.application.port.MetricsPort;
import ca.gc.eccc.sentinel.domain.incident.Incident;
import ca.gc.eccc.sentinel.domain.incident.IncidentId;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Orchestrates one {@link IncidentWorkflow} per monitored location per polling cycle.
 * <p><strong>Why:</strong> Incidents must progress independently; a failure or suspension in one never
 * blocks another.</p>
 * <p><strong>Role:</strong> Application service wired by {@code CompositionRoot} and driven by
 * {@link MonitoringUseCase}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use. Incidents run on the worker pool; the registry
 * of live incidents is guarded by its own monitor.</p>
 * <p><strong>Observability:</strong> Emits {@code workflow.incident.*}, {@code dispatch.attempts} and
 * approval metrics through {@link MetricsPort}.</p>
 *
 * @since 0.1.0
 */
public final class WorkflowEngine {
  private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

  /** Upper bound on the audit records one incident writes. */
  static final int MAX_RECORDS_PER_INCIDENT = 7;

  private final WorkflowCapabilities capabilities;
  private final CapabilityTimeouts timeouts;
  private final SeverityPolicy policy;
  private final ApprovalGate gate;
  private final AuditTrail auditTrail;
  private final CapabilityInvoker invoker;
  private final AlertComposer composer;
  private final ExecutorService workers;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ApprovalNoticePort notices;

  private final Map<String, IncidentWorkflow> live = new LinkedHashMap<>();

  /**
   * Creates the engine.
   *
   * @param capabilities external capabilities
   * @param timeouts per-capability call timeouts
   * @param policy severity gating rule
   * @param gate approval gate shared by all incidents
   * @param auditTrail audit trail shared by all incidents
   * @param invoker retry/timeout harness
   * @param composer alert formatter carrying the recipient list
   * @param workers pool that runs incident transitions
   * @param clock time source
   * @param metrics metrics sink
   * @param notices publisher of approval notices for operators
   */
  public WorkflowEngine(
      WorkflowCapabilities capabilities,
      CapabilityTimeouts timeouts,
      SeverityPolicy policy,
      ApprovalGate gate,
      AuditTrail auditTrail,
      CapabilityInvoker invoker,
      AlertComposer composer,
      ExecutorService workers,
      ClockPort clock,
      MetricsPort metrics,
      ApprovalNoticePort notices) {
    this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
    this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.gate = Objects.requireNonNull(gate, "gate");
    this.auditTrail = Objects.requireNonNull(auditTrail, "auditTrail");
    this.invoker = Objects.requireNonNull(invoker, "invoker");
    this.composer = Objects.requireNonNull(composer, "composer");
    this.workers = Objects.requireNonNull(workers, "workers");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.notices = notices == null ? ApprovalNoticePort.NONE : notices;
  }

  /**
   * Starts the incident for one location in one cycle.
   *
   * @param location monitored location
   * @param cycle polling cycle number
   * @param cycleStartedAt instant the cycle started
   * @return handle on the running incident
   * @throws IllegalStateException when an incident for the same location and cycle is still live, or the
   *     worker pool is shut down
   */
  public IncidentWorkflow start(String location, long cycle, Instant cycleStartedAt) {
    Objects.requireNonNull(location, "location");
    String key = key(location, cycle);
    IncidentWorkflow workflow;
    synchronized (live) {
      if (live.containsKey(key)) {
        throw new IllegalStateException("incident already live for " + location + " in cycle " + cycle);
      }
      Incident incident = Incident.start(
          IncidentId.of(location, cycle, cycleStartedAt), location, cycle, clock.now());
      workflow = new IncidentWorkflow(this, incident);
      live.put(key, workflow);
    }
    try {
      workers.execute(workflow::run);
    } catch (RejectedExecutionException ex) {
      synchronized (live) {
        live.remove(key);
      }
      throw new IllegalStateException("worker pool is shut down", ex);
    }
    return workflow;
  }

  /**
   * Starts one incident per location for a polling cycle.
   *
   * @param locations monitored locations
   * @param cycle polling cycle number
   * @return handles in location order
   */
  public List<IncidentWorkflow> runCycle(List<String> locations, long cycle) {
    Instant startedAt = clock.now();
    List<IncidentWorkflow> started = new ArrayList<>(locations.size());
    for (String location : locations) {
      try {
        started.add(start(location, cycle, startedAt));
      } catch (IllegalStateException ex) {
        log.warn("Skipping {} in cycle {}: {}", location, cycle, ex.getMessage());
      }
    }
    return started;
  }

  /**
   * Waits until every given incident has settled (terminal or suspended).
   *
   * @param workflows incidents to wait for
   * @param budget total wait budget
   * @return {@code true} when all settled within the budget
   * @throws InterruptedException when interrupted while waiting
   */
  public boolean awaitSettled(Collection<IncidentWorkflow> workflows, Duration budget)
      throws InterruptedException {
    return await(workflows, budget, false);
  }

  /**
   * Waits until every given incident has reached a terminal state.
   *
   * @param workflows incidents to wait for
   * @param budget total wait budget
   * @return {@code true} when all completed within the budget
   * @throws InterruptedException when interrupted while waiting
   */
  public boolean awaitCompletion(Collection<IncidentWorkflow> workflows, Duration budget)
      throws InterruptedException {
    return await(workflows, budget, true);
  }

  private boolean await(Collection<IncidentWorkflow> workflows, Duration budget, boolean terminal)
      throws InterruptedException {
    long deadline = System.nanoTime() + budget.toNanos();
    for (IncidentWorkflow workflow : workflows) {
      long remaining = deadline - System.nanoTime();
      try {
        (terminal ? workflow.completion() : workflow.settled()).get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
      } catch (TimeoutException ex) {
        log.warn("Incident {} did not {} within {}", workflow.id(),
            terminal ? "complete" : "settle", budget);
        return false;
      } catch (ExecutionException ex) {
        log.error("Incident {} completed exceptionally", workflow.id(), ex.getCause());
      }
    }
    return true;
  }

  /**
   * Upper bound on the time an incident needs to settle, derived from the retry policy and timeouts.
   * Includes one audit append bound per record an incident can write, so a degraded sink does not
   * trip the settle wait.
   *
   * @return settle budget
   */
  public Duration settleBudget() {
    RetryPolicy retry = invoker.retryPolicy();
    Duration perAttempt = timeouts.observation()
        .plus(timeouts.classifier())
        .plus(timeouts.planner())
        .plus(timeouts.notifier());
    return perAttempt.multipliedBy(retry.maxAttempts())
        .plus(retry.maxBackoff().multipliedBy(4L * retry.maxRetries()))
        .plus(timeouts.audit().multipliedBy(MAX_RECORDS_PER_INCIDENT))
        .plus(Duration.ofSeconds(1));
  }

  /** Returns handles of incidents that have not reached a terminal state. */
  public List<IncidentWorkflow> live() {
    synchronized (live) {
      return List.copyOf(live.values());
    }
  }

  public Optional<IncidentWorkflow> find(IncidentId id) {
    synchronized (live) {
      return live.values().stream().filter(w -> w.id().equals(id)).findFirst();
    }
  }

  public ApprovalGate gate() {
    return gate;
  }

  public AuditTrail auditTrail() {
    return auditTrail;
  }

  void onFinished(IncidentWorkflow workflow) {
    Incident incident = workflow.snapshot();
    synchronized (live) {
      live.remove(key(incident.location(), incident.cycle()), workflow);
    }
  }

  WorkflowCapabilities capabilities() {
    return capabilities;
  }

  CapabilityTimeouts timeouts() {
    return timeouts;
  }

  SeverityPolicy policy() {
    return policy;
  }

  CapabilityInvoker invoker() {
    return invoker;
  }

  AlertComposer composer() {
    return composer;
  }

  ExecutorService workers() {
    return workers;
  }

  ClockPort clock() {
    return clock;
  }

  MetricsPort metrics() {
    return metrics;
  }

  ApprovalNoticePort notices() {
    return notices;
  }

  private static String key(String location, long cycle) {
    return location + '#' + cycle;
  }
}
