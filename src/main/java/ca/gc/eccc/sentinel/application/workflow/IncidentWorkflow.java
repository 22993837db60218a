package ca.gc.eccc.sentinel.application.workflow;

import ca.gc.eccc.sentinel.application.port.CapabilityException;
import ca.gc.eccc.sentinel.application.port.Classifier;
import ca.gc.eccc.sentinel.application.port.Notifier;
import ca.gc.eccc.sentinel.application.port.ObservationSource;
import ca.gc.eccc.sentinel.application.port.ResponsePlanner;
import ca.gc.eccc.sentinel.domain.alert.AlertMessage;
import ca.gc.eccc.sentinel.domain.alert.DeliveryReceipt;
import ca.gc.eccc.sentinel.domain.alert.ResponseDepartment;
import ca.gc.eccc.sentinel.domain.alert.ResponsePlan;
import ca.gc.eccc.sentinel.domain.approval.ApprovalRequest;
import ca.gc.eccc.sentinel.domain.assessment.Assessment;
import ca.gc.eccc.sentinel.domain.assessment.Severity;
import ca.gc.eccc.sentinel.domain.audit.AuditEventKind;
import ca.gc.eccc.sentinel.domain.audit.AuditRecord;
import ca.gc.eccc.sentinel.domain.incident.AbortReason;
import ca.gc.eccc.sentinel.domain.incident.DispatchOutcome;
import ca.gc.eccc.sentinel.domain.incident.Incident;
import ca.gc.eccc.sentinel.domain.incident.IncidentId;
import ca.gc.eccc.sentinel.domain.incident.IncidentState;
import ca.gc.eccc.sentinel.domain.observation.Observation;
import ca.gc.eccc.sentinel.logging.Logs;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> State machine driving one incident from observation to a terminal state.
 * <p><strong>Why:</strong> Each monitored location in each polling cycle progresses independently; this
 * class owns the only mutable state of one such execution.</p>
 * <p><strong>Thread-safety:</strong> All transitions run under the instance monitor, so audit records for
 * one incident are appended in strict transition order. Different incidents never share a lock.</p>
 *
 * <p>{@link #settled()} completes when the incident reaches a terminal state or suspends at the approval
 * gate; {@link #completion()} completes only at a terminal state.</p>
 *
 * @since 0.1.0
 */
public final class IncidentWorkflow {
  private static final Logger log = LoggerFactory.getLogger(IncidentWorkflow.class);

  static final String MDC_LOCATION = "location";
  static final String MDC_INCIDENT = "incident";

  private final WorkflowEngine engine;
  private final CompletableFuture<Incident> settled = new CompletableFuture<>();
  private final CompletableFuture<Incident> completion = new CompletableFuture<>();
  private volatile Incident incident;
  private long sequence;

  IncidentWorkflow(WorkflowEngine engine, Incident initial) {
    this.engine = engine;
    this.incident = initial;
  }

  public IncidentId id() {
    return incident.id();
  }

  /** Returns the latest incident snapshot. */
  public Incident snapshot() {
    return incident;
  }

  /** Completes at the first terminal state or approval suspension. */
  public CompletableFuture<Incident> settled() {
    return settled.copy();
  }

  /** Completes at the terminal state. */
  public CompletableFuture<Incident> completion() {
    return completion.copy();
  }

  synchronized void run() {
    enterMdc();
    try {
      if (incident.state() != IncidentState.PENDING_OBSERVATION) {
        return;
      }
      engine.metrics().increment("workflow.incident.started");
      log.info("Incident {} started for {} (cycle {})",
          incident.id(), incident.location(), incident.cycle());
      if (!observe()) {
        return;
      }
      if (!classify()) {
        return;
      }
      gate();
    } catch (RuntimeException ex) {
      failInternally(ex);
    } finally {
      exitMdc();
    }
  }

  void onApprovalResolved(ApprovalRequest request) {
    try {
      engine.workers().execute(() -> resume(request));
    } catch (RejectedExecutionException ex) {
      log.warn("Worker pool rejected resumption of {}; resuming on resolver thread", incident.id());
      resume(request);
    }
  }

  synchronized void resume(ApprovalRequest request) {
    enterMdc();
    try {
      if (incident.state() != IncidentState.AWAITING_APPROVAL) {
        log.debug("Ignoring approval resolution for {} in state {}", incident.id(), incident.state());
        return;
      }
      incident = incident.withApproval(request);
      Map<String, String> payload = payload();
      payload.put("requestId", request.requestId());
      payload.put("resolution", request.resolution().name());
      payload.put("resolvedBy", request.resolvedBy());
      switch (request.resolution()) {
        case APPROVED -> {
          transition(IncidentState.APPROVED, AuditEventKind.APPROVAL_RESOLVED, payload);
          publishResolved(request);
          dispatch();
        }
        case REJECTED, EXPIRED -> {
          IncidentState outcome = IncidentState.valueOf(request.resolution().name());
          transition(outcome, AuditEventKind.APPROVAL_RESOLVED, payload);
          publishResolved(request);
          Map<String, String> done = payload();
          done.put("dispatched", "false");
          done.put("outcome", outcome.name().toLowerCase(Locale.ROOT));
          log.info("Incident {} closed without dispatch: approval {}", incident.id(),
              outcome.name().toLowerCase(Locale.ROOT));
          transition(IncidentState.DONE, AuditEventKind.COMPLETED, done);
        }
        default -> throw new IllegalStateException("approval request " + request.requestId() + " is not resolved");
      }
    } catch (RuntimeException ex) {
      failInternally(ex);
    } finally {
      exitMdc();
    }
  }

  private boolean observe() {
    ObservationSource source = engine.capabilities().observationSource();
    Duration timeout = engine.timeouts().observation();
    String location = incident.location();
    CallResult<Observation> result =
        engine.invoker().invoke(ObservationSource.CAPABILITY, timeout, () -> source.fetch(location, timeout));
    if (!result.succeeded() || result.value() == null) {
      abort(AbortReason.OBSERVATION_UNAVAILABLE, result);
      return false;
    }
    Observation observation = result.value();
    incident = incident.withObservation(observation);
    Map<String, String> payload = payload();
    payload.put("observedAt", observation.observedAt().toString());
    payload.put("temperatureCelsius", Double.toString(observation.temperatureCelsius()));
    payload.put("windSpeedMetersPerSecond", Double.toString(observation.windSpeedMetersPerSecond()));
    payload.put("humidityPercent", Double.toString(observation.humidityPercent()));
    payload.put("pressureHectopascals", Double.toString(observation.pressureHectopascals()));
    payload.put("precipitationMillimetres", Double.toString(observation.precipitationMillimetres()));
    payload.put("conditions", observation.conditions());
    payload.put("attempts", Integer.toString(result.attempts()));
    transition(IncidentState.OBSERVED, AuditEventKind.OBSERVED, payload);
    return true;
  }

  private boolean classify() {
    Classifier classifier = engine.capabilities().classifier();
    Duration timeout = engine.timeouts().classifier();
    Observation observation = incident.observation();
    CallResult<Assessment> result =
        engine.invoker().invoke(Classifier.CAPABILITY, timeout, () -> classifier.classify(observation, timeout));
    if (!result.succeeded() || result.value() == null) {
      abort(AbortReason.CLASSIFICATION_FAILED, result);
      return false;
    }
    Assessment assessment = result.value();
    incident = incident.withAssessment(assessment);
    if (assessment.severityDefaulted()) {
      engine.metrics().increment("workflow.policy.ambiguous");
      log.warn("Classifier severity '{}' not recognized for {}; assuming {}",
          assessment.reportedSeverity(), incident.id(), assessment.severity().label());
    }
    Map<String, String> payload = payload();
    payload.put("disasterType", assessment.disasterType());
    payload.put("severity", assessment.severity().name());
    payload.put("reportedSeverity", assessment.reportedSeverity());
    payload.put("severityDefaulted", Boolean.toString(assessment.severityDefaulted()));
    payload.put("rationale", assessment.rationale());
    payload.put("attempts", Integer.toString(result.attempts()));
    transition(IncidentState.CLASSIFIED, AuditEventKind.CLASSIFIED, payload);
    return true;
  }

  private void gate() {
    Assessment assessment = incident.assessment();
    ResponseDepartment department = ResponseRouter.route(assessment);
    ResponsePlan plan = plan(department, assessment);
    incident = incident.withRouting(department, plan);

    PolicyDecision decision = assessment.severityDefaulted()
        ? engine.policy().decide((Severity) null)
        : engine.policy().decide(assessment.severity());
    Map<String, String> payload = payload();
    payload.put("severity", assessment.severity().name());
    payload.put("requiresApproval", Boolean.toString(decision.requiresApproval()));
    payload.put("failSafe", Boolean.toString(decision.failSafe()));
    payload.put("department", department.name());
    payload.put("planGenerated", Boolean.toString(plan.generated()));
    append(AuditEventKind.POLICY_DECIDED, payload);
    log.info("Incident {} classified {} / {}; routed to {}; approval {}",
        incident.id(), assessment.disasterType(), assessment.severity().label(),
        department.displayName(), decision.requiresApproval() ? "required" : "bypassed");

    if (decision.requiresApproval()) {
      suspend();
    } else {
      dispatch();
    }
  }

  private ResponsePlan plan(ResponseDepartment department, Assessment assessment) {
    ResponsePlanner planner = engine.capabilities().planner();
    Duration timeout = engine.timeouts().planner();
    CallResult<ResponsePlan> result = engine.invoker().invoke(
        ResponsePlanner.CAPABILITY, timeout, () -> planner.plan(department, assessment, timeout));
    if (!result.succeeded() || result.value() == null) {
      CapabilityException failure = result.failure();
      log.warn("Response plan unavailable for {}: {}", incident.id(),
          failure == null ? "no plan returned" : failure.getMessage());
      return ResponsePlan.unavailable(department);
    }
    log.debug("Response plan for {}: {}", incident.id(), Logs.truncate(result.value().text(), 200));
    return result.value();
  }

  private void suspend() {
    ApprovalRequest request = engine.gate().requestApproval(incident, this::onApprovalResolved);
    incident = incident.withApproval(request);
    Map<String, String> payload = payload();
    payload.put("requestId", request.requestId());
    payload.put("requestedAt", request.requestedAt().toString());
    payload.put("deadline", request.deadline().toString());
    transition(IncidentState.AWAITING_APPROVAL, AuditEventKind.APPROVAL_REQUESTED, payload);
    try {
      engine.notices().requested(request, incident);
    } catch (RuntimeException ex) {
      log.warn("Failed to publish approval notice {}: {}", request.requestId(), ex.getMessage(), ex);
    }
    settled.complete(incident);
  }

  private void dispatch() {
    Notifier notifier = engine.capabilities().notifier();
    Duration timeout = engine.timeouts().notifier();
    AlertMessage message = engine.composer().compose(incident, engine.clock().now());
    CallResult<DeliveryReceipt> result =
        engine.invoker().invoke(Notifier.CAPABILITY, timeout, () -> notifier.send(message, timeout));
    for (int i = 0; i < result.attempts(); i++) {
      engine.metrics().increment("dispatch.attempts");
    }
    Instant now = engine.clock().now();
    Map<String, String> payload = payload();
    payload.put("attempts", Integer.toString(result.attempts()));
    payload.put("subject", message.subject());
    payload.put("recipients", String.join(",", message.recipients()));
    if (result.succeeded()) {
      String reference = result.value() == null ? "" : result.value().reference();
      incident = incident.withDispatch(DispatchOutcome.delivered(result.attempts(), reference, now));
      payload.put("reference", reference);
      transition(IncidentState.DISPATCHED, AuditEventKind.DISPATCHED, payload);
    } else {
      CapabilityException failure = result.failure();
      incident = incident.withDispatch(
          DispatchOutcome.failed(result.attempts(), failure.code(), failure.getMessage(), now));
      payload.put("failureCode", failure.code());
      payload.put("failureKind", failure.kind().name());
      payload.put("failureMessage", String.valueOf(failure.getMessage()));
      log.error("Dispatch failed for {} after {} attempt(s): {}",
          incident.id(), result.attempts(), failure.getMessage());
      transition(IncidentState.DISPATCH_FAILED, AuditEventKind.DISPATCH_FAILED, payload);
    }
  }

  private void abort(AbortReason reason, CallResult<?> result) {
    Map<String, String> payload = payload();
    payload.put("reason", reason.code());
    payload.put("attempts", Integer.toString(result.attempts()));
    CapabilityException failure = result.failure();
    if (failure != null) {
      payload.put("capability", failure.capability());
      payload.put("failureCode", failure.code());
      payload.put("failureMessage", String.valueOf(failure.getMessage()));
    }
    log.warn("Incident {} aborted: {} after {} attempt(s)", incident.id(), reason.code(), result.attempts());
    abort(reason, payload);
  }

  private void abort(AbortReason reason, Map<String, String> payload) {
    incident = incident.withAbortReason(reason);
    transition(IncidentState.ABORTED, AuditEventKind.ABORTED, payload);
  }

  private void failInternally(RuntimeException ex) {
    log.error("Incident {} failed unexpectedly in state {}", incident.id(), incident.state(), ex);
    if (incident.state().isTerminal()) {
      return;
    }
    Map<String, String> payload = payload();
    payload.put("reason", AbortReason.INTERNAL_ERROR.code());
    payload.put("failureMessage", ex.toString());
    try {
      abort(AbortReason.INTERNAL_ERROR, payload);
    } catch (RuntimeException nested) {
      log.error("Unable to abort incident {}", incident.id(), nested);
      finish();
    }
  }

  private void transition(IncidentState next, AuditEventKind kind, Map<String, String> payload) {
    IncidentState previous = incident.state();
    incident = incident.transition(next, engine.clock().now());
    append(kind, payload);
    log.debug("Incident {} {} -> {}", incident.id(), previous, next);
    if (next.isTerminal()) {
      finish();
    }
  }

  private void append(AuditEventKind kind, Map<String, String> payload) {
    sequence++;
    engine.auditTrail().record(new AuditRecord(
        incident.id(), incident.location(), sequence, kind, incident.state(),
        engine.clock().now(), payload));
  }

  private void finish() {
    Incident last = incident;
    String state = last.state().name().toLowerCase(Locale.ROOT);
    engine.metrics().increment("workflow.incident.terminal." + state);
    engine.metrics().observe("workflow.incident.latencyMillis",
        Math.max(0L, last.updatedAt().toEpochMilli() - last.startedAt().toEpochMilli()));
    log.info("Incident {} finished {}", last.id(), last.state());
    engine.gate().forget(last.id());
    engine.onFinished(this);
    // completion first: anyone woken by settled must already see the incident as complete
    completion.complete(last);
    settled.complete(last);
  }

  private void publishResolved(ApprovalRequest request) {
    try {
      engine.notices().resolved(request);
    } catch (RuntimeException ex) {
      log.warn("Failed to withdraw approval notice {}: {}", request.requestId(), ex.getMessage());
    }
  }

  private void enterMdc() {
    MDC.put(MDC_LOCATION, incident.location());
    MDC.put(MDC_INCIDENT, incident.id().value());
  }

  private static void exitMdc() {
    MDC.remove(MDC_LOCATION);
    MDC.remove(MDC_INCIDENT);
  }

  private static Map<String, String> payload() {
    return new LinkedHashMap<>();
  }
}
