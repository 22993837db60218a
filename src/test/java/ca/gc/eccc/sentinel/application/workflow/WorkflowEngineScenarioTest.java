package ca.gc.eccc.sentinel.application.workflow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.eccc.sentinel.application.port.ApprovalNoticePort;
import ca.gc.eccc.sentinel.application.port.ClassificationException;
import ca.gc.eccc.sentinel.application.port.DeliveryException;
import ca.gc.eccc.sentinel.application.port.FailureKind;
import ca.gc.eccc.sentinel.application.port.ObservationException;
import ca.gc.eccc.sentinel.application.port.PlanningException;
import ca.gc.eccc.sentinel.domain.alert.ResponseDepartment;
import ca.gc.eccc.sentinel.domain.alert.ResponsePlan;
import ca.gc.eccc.sentinel.domain.approval.ApprovalDecision;
import ca.gc.eccc.sentinel.domain.approval.ApprovalRequest;
import ca.gc.eccc.sentinel.domain.approval.ApprovalResolution;
import ca.gc.eccc.sentinel.domain.assessment.Severity;
import ca.gc.eccc.sentinel.domain.audit.AuditEventKind;
import ca.gc.eccc.sentinel.domain.audit.AuditRecord;
import ca.gc.eccc.sentinel.domain.incident.AbortReason;
import ca.gc.eccc.sentinel.domain.incident.Incident;
import ca.gc.eccc.sentinel.domain.incident.IncidentState;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class WorkflowEngineScenarioTest {
  private final EngineHarness harness = new EngineHarness();

  @AfterEach
  void tearDown() throws InterruptedException {
    harness.close();
  }

  @Test
  void highSeverityStormBypassesApprovalAndDispatchesOnce() throws Exception {
    harness.classifyAs("Severe Storm", "High").build();

    IncidentWorkflow workflow = harness.engine().start("Toronto", 1, Fixtures.T0);
    Incident done = workflow.completion().get(5, TimeUnit.SECONDS);

    assertEquals(IncidentState.DISPATCHED, done.state());
    assertEquals(1, harness.sendAttempts.get());
    assertEquals(1, harness.sent.size());
    assertEquals("Weather Alert: High severity weather event in Toronto", harness.sent.get(0).subject());
    assertEquals(ResponseDepartment.EMERGENCY_MANAGEMENT, done.department());
    assertTrue(done.approvalRequest().isEmpty());
    assertEquals(
        List.of(AuditEventKind.OBSERVED, AuditEventKind.CLASSIFIED, AuditEventKind.POLICY_DECIDED,
            AuditEventKind.DISPATCHED),
        kinds(done));
    assertEquals(1, harness.metrics.count("workflow.incident.terminal.dispatched"));
    assertTrue(harness.engine().live().isEmpty());
  }

  @Test
  void lowSeverityWithoutDecisionExpiresToDoneWithoutDispatch() throws Exception {
    harness.classifyAs("Severe Storm", "Low").build();

    IncidentWorkflow workflow = harness.engine().start("Toronto", 1, Fixtures.T0);
    Incident suspended = workflow.settled().get(5, TimeUnit.SECONDS);
    assertEquals(IncidentState.AWAITING_APPROVAL, suspended.state());
    assertFalse(workflow.completion().isDone());

    harness.clock.advance(Duration.ofHours(2));
    assertEquals(1, harness.gate().expireOverdue());
    Incident done = workflow.completion().get(5, TimeUnit.SECONDS);

    assertEquals(IncidentState.DONE, done.state());
    assertEquals(0, harness.sendAttempts.get());
    assertEquals(ApprovalResolution.EXPIRED, done.approval().resolution());
    assertEquals(ApprovalGate.EXPIRY_ACTOR, done.approval().resolvedBy());
    List<AuditRecord> trail = harness.sink.recordsFor(done.id());
    assertEquals(IncidentState.EXPIRED, trail.get(trail.size() - 2).state());
    assertEquals("false", trail.get(trail.size() - 1).payload().get("dispatched"));
    assertEquals("expired", trail.get(trail.size() - 1).payload().get("outcome"));
    assertEquals(1, harness.metrics.count("approval.expired"));
  }

  @Test
  void mediumSeverityApprovedBeforeDeadlineDispatchesOnce() throws Exception {
    harness.classifyAs("Flood", "Medium").build();

    IncidentWorkflow workflow = harness.engine().start("Winnipeg", 1, Fixtures.T0);
    Incident suspended = workflow.settled().get(5, TimeUnit.SECONDS);
    String requestId = suspended.approval().requestId();
    assertEquals("apr-" + suspended.id().value(), requestId);

    harness.clock.advance(Duration.ofMinutes(5));
    ApprovalRequest resolved = harness.gate().resolve(requestId, ApprovalDecision.APPROVE, "duty-officer");
    Incident done = workflow.completion().get(5, TimeUnit.SECONDS);

    assertEquals(ApprovalResolution.APPROVED, resolved.resolution());
    assertEquals(IncidentState.DISPATCHED, done.state());
    assertEquals(1, harness.sendAttempts.get());
    assertEquals(ResponseDepartment.PUBLIC_WORKS, done.department());
    assertTrue(harness.sent.get(0).body().contains("verified by a human operator"));
    assertEquals(
        List.of(AuditEventKind.OBSERVED, AuditEventKind.CLASSIFIED, AuditEventKind.POLICY_DECIDED,
            AuditEventKind.APPROVAL_REQUESTED, AuditEventKind.APPROVAL_RESOLVED, AuditEventKind.DISPATCHED),
        kinds(done));
    AuditRecord resolution = harness.sink.recordsFor(done.id()).get(4);
    assertEquals("duty-officer", resolution.payload().get("resolvedBy"));
  }

  @Test
  void observationTimingOutOnEveryAttemptAbortsWithoutDownstreamCalls() throws Exception {
    harness.classifyAs("Severe Storm", "High").build();
    harness.observationSource = (location, timeout) -> {
      harness.observationCalls.incrementAndGet();
      throw new ObservationException(ObservationException.Reason.TIMEOUT, "provider did not answer");
    };

    Incident done = harness.engine().start("Halifax", 1, Fixtures.T0).completion().get(5, TimeUnit.SECONDS);

    assertEquals(IncidentState.ABORTED, done.state());
    assertEquals(AbortReason.OBSERVATION_UNAVAILABLE, done.abortReason());
    assertEquals(4, harness.observationCalls.get());
    assertEquals(0, harness.classifierCalls.get());
    assertEquals(0, harness.sendAttempts.get());
    assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400)), harness.sleeps);
    AuditRecord aborted = harness.sink.recordsFor(done.id()).get(0);
    assertEquals(AuditEventKind.ABORTED, aborted.kind());
    assertEquals("observation-unavailable", aborted.payload().get("reason"));
    assertEquals("4", aborted.payload().get("attempts"));
  }

  @Test
  void notifierRecoveringOnThirdAttemptStillDispatches() throws Exception {
    harness.classifyAs("Severe Storm", "Critical").build();
    harness.failSends(
        DeliveryException.transientFailure("smtp-unavailable", "mail relay down", null),
        DeliveryException.transientFailure("smtp-unavailable", "mail relay down", null));

    Incident done = harness.engine().start("Calgary", 1, Fixtures.T0).completion().get(5, TimeUnit.SECONDS);

    assertEquals(IncidentState.DISPATCHED, done.state());
    assertEquals(3, harness.sendAttempts.get());
    assertEquals(3, done.dispatch().attempts());
    assertEquals("receipt-3", done.dispatch().reference());
    assertEquals(3, harness.metrics.count("dispatch.attempts"));
    AuditRecord dispatched = last(done);
    assertEquals("3", dispatched.payload().get("attempts"));
  }

  @Test
  void terminalDeliveryFailureEndsInDispatchFailedAfterOneAttempt() throws Exception {
    harness.classifyAs("Severe Storm", "High").build();
    harness.failSends(DeliveryException.terminal("bad-recipient", "mailbox does not exist"));

    Incident done = harness.engine().start("Regina", 1, Fixtures.T0).completion().get(5, TimeUnit.SECONDS);

    assertEquals(IncidentState.DISPATCH_FAILED, done.state());
    assertEquals(1, harness.sendAttempts.get());
    assertFalse(done.dispatch().delivered());
    assertEquals("bad-recipient", done.dispatch().failureCode());
    assertEquals("TERMINAL", last(done).payload().get("failureKind"));
  }

  @Test
  void transientDeliveryFailuresExhaustRetryBudgetAndEndInDispatchFailed() throws Exception {
    harness.classifyAs("Hurricane", "Critical").build();
    DeliveryException relayDown = DeliveryException.transientFailure("smtp-unavailable", "mail relay down", null);
    harness.failSends(relayDown, relayDown, relayDown, relayDown, relayDown, relayDown);

    Incident done = harness.engine().start("Sydney", 1, Fixtures.T0).completion().get(5, TimeUnit.SECONDS);

    assertEquals(IncidentState.DISPATCH_FAILED, done.state());
    assertEquals(4, harness.sendAttempts.get());
    assertEquals(4, done.dispatch().attempts());
    assertTrue(harness.sent.isEmpty());
    assertEquals(4, harness.metrics.count("dispatch.attempts"));
    AuditRecord failed = last(done);
    assertEquals(AuditEventKind.DISPATCH_FAILED, failed.kind());
    assertEquals("4", failed.payload().get("attempts"));
    assertEquals("TRANSIENT", failed.payload().get("failureKind"));
  }

  @Test
  void decisionArrivingAfterExpiryAndCompletionIsRefusedAsInvalidState() throws Exception {
    harness.classifyAs("Severe Storm", "Low").build();

    IncidentWorkflow workflow = harness.engine().start("Toronto", 1, Fixtures.T0);
    String requestId = workflow.settled().get(5, TimeUnit.SECONDS).approval().requestId();
    harness.clock.advance(Duration.ofHours(2));
    assertEquals(1, harness.gate().expireOverdue());
    Incident done = workflow.completion().get(5, TimeUnit.SECONDS);
    assertEquals(IncidentState.DONE, done.state());

    InvalidStateException ex = assertThrows(InvalidStateException.class,
        () -> harness.gate().resolve(requestId, ApprovalDecision.APPROVE, "late-operator"));
    assertTrue(ex.getMessage().contains("EXPIRED"));
    assertEquals(ApprovalResolution.EXPIRED, harness.gate().find(requestId).orElseThrow().resolution());
    assertEquals(0, harness.sendAttempts.get());
    assertEquals(1, harness.metrics.count("approval.requested"));
  }

  @Test
  void decisionArrivingAfterRejectionCompletedIsRefusedAsInvalidState() throws Exception {
    harness.classifyAs("Heatwave", "Medium").build();

    IncidentWorkflow workflow = harness.engine().start("Ottawa", 1, Fixtures.T0);
    String requestId = workflow.settled().get(5, TimeUnit.SECONDS).approval().requestId();
    harness.gate().resolve(requestId, ApprovalDecision.REJECT, "duty-officer");
    workflow.completion().get(5, TimeUnit.SECONDS);

    assertThrows(InvalidStateException.class,
        () -> harness.gate().resolve(requestId, ApprovalDecision.APPROVE, "duty-officer"));
    assertEquals(0, harness.sendAttempts.get());
  }

  @Test
  void rejectedApprovalClosesWithoutDispatch() throws Exception {
    harness.classifyAs("Heatwave", "Low").build();

    IncidentWorkflow workflow = harness.engine().start("Ottawa", 1, Fixtures.T0);
    String requestId = workflow.settled().get(5, TimeUnit.SECONDS).approval().requestId();
    harness.gate().resolve(requestId, ApprovalDecision.REJECT, "duty-officer");
    Incident done = workflow.completion().get(5, TimeUnit.SECONDS);

    assertEquals(IncidentState.DONE, done.state());
    assertEquals(ResponseDepartment.CIVIL_DEFENSE, done.department());
    assertEquals(0, harness.sendAttempts.get());
    assertEquals("rejected", last(done).payload().get("outcome"));
  }

  @Test
  void unrecognizedSeverityFailsSafeToApproval() throws Exception {
    harness.classifyAs("Severe Storm", "Apocalyptic").build();

    Incident suspended = harness.engine().start("Toronto", 1, Fixtures.T0).settled().get(5, TimeUnit.SECONDS);

    assertEquals(IncidentState.AWAITING_APPROVAL, suspended.state());
    assertTrue(suspended.assessment().severityDefaulted());
    assertEquals(1, harness.metrics.count("workflow.policy.ambiguous"));
    AuditRecord policy = harness.sink.recordsFor(suspended.id()).get(2);
    assertEquals(AuditEventKind.POLICY_DECIDED, policy.kind());
    assertEquals("true", policy.payload().get("failSafe"));
    assertEquals("Apocalyptic", harness.sink.recordsFor(suspended.id()).get(1).payload().get("reportedSeverity"));
  }

  @Test
  void overriddenPolicyGatesHighSeverity() throws Exception {
    harness.classifyAs("Severe Storm", "High")
        .build(SeverityPolicy.withOverrides(Map.of(Severity.HIGH, Boolean.TRUE)),
            Duration.ofHours(1), ApprovalNoticePort.NONE);

    Incident suspended = harness.engine().start("Toronto", 1, Fixtures.T0).settled().get(5, TimeUnit.SECONDS);

    assertEquals(IncidentState.AWAITING_APPROVAL, suspended.state());
  }

  @Test
  void plannerFailureDoesNotBlockDispatch() throws Exception {
    harness.classifyAs("Severe Storm", "High").build();
    harness.planner = (department, assessment, timeout) -> {
      throw new PlanningException(FailureKind.TERMINAL, "model-error", "planner refused", null);
    };

    Incident done = harness.engine().start("Toronto", 1, Fixtures.T0).completion().get(5, TimeUnit.SECONDS);

    assertEquals(IncidentState.DISPATCHED, done.state());
    assertFalse(done.plan().generated());
    assertTrue(harness.sent.get(0).body().contains(ResponsePlan.UNAVAILABLE_TEXT));
  }

  @Test
  void malformedClassifierOutputAbortsWithoutRetry() throws Exception {
    harness.build();
    harness.classifier = (observation, timeout) -> {
      harness.classifierCalls.incrementAndGet();
      throw new ClassificationException(ClassificationException.Reason.MALFORMED_OUTPUT, "no severity field");
    };

    Incident done = harness.engine().start("Toronto", 1, Fixtures.T0).completion().get(5, TimeUnit.SECONDS);

    assertEquals(IncidentState.ABORTED, done.state());
    assertEquals(AbortReason.CLASSIFICATION_FAILED, done.abortReason());
    assertEquals(1, harness.classifierCalls.get());
    assertEquals(0, harness.sendAttempts.get());
  }

  @Test
  void locationsProgressIndependently() throws Exception {
    harness.classifyAs("Severe Storm", "High").build();
    harness.observationSource = (location, timeout) -> {
      if (location.equals("Iqaluit")) {
        throw new ObservationException(ObservationException.Reason.NOT_FOUND, "unknown station");
      }
      return Fixtures.stormObservation(location);
    };

    List<IncidentWorkflow> started = harness.engine().runCycle(List.of("Toronto", "Iqaluit"), 1);
    assertTrue(harness.engine().awaitCompletion(started, Duration.ofSeconds(5)));

    assertEquals(IncidentState.DISPATCHED, started.get(0).snapshot().state());
    assertEquals(IncidentState.ABORTED, started.get(1).snapshot().state());
    assertEquals(1, harness.sendAttempts.get());
  }

  @Test
  void auditSequenceIsContiguousPerIncident() throws Exception {
    harness.classifyAs("Flood", "Medium").build();

    IncidentWorkflow workflow = harness.engine().start("Montreal", 1, Fixtures.T0);
    String requestId = workflow.settled().get(5, TimeUnit.SECONDS).approval().requestId();
    harness.gate().resolve(requestId, ApprovalDecision.APPROVE, "duty-officer");
    Incident done = workflow.completion().get(5, TimeUnit.SECONDS);

    List<AuditRecord> trail = harness.sink.recordsFor(done.id());
    for (int i = 0; i < trail.size(); i++) {
      assertEquals(i + 1, trail.get(i).sequence());
    }
    AuditReplayer.ReplayedIncident replayed = AuditReplayer.replayIncident(done.id(), trail);
    assertEquals(IncidentState.DISPATCHED, replayed.state());
    assertTrue(replayed.anomalies().isEmpty());
  }

  @Test
  void secondIncidentForSameLocationAndCycleIsRefusedWhileLive() throws Exception {
    harness.classifyAs("Severe Storm", "High").build();
    CountDownLatch release = new CountDownLatch(1);
    harness.observationSource = (location, timeout) -> {
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      return Fixtures.stormObservation(location);
    };

    IncidentWorkflow first = harness.engine().start("Toronto", 1, Fixtures.T0);
    try {
      assertThrows(IllegalStateException.class, () -> harness.engine().start("Toronto", 1, Fixtures.T0));
    } finally {
      release.countDown();
    }
    assertEquals(IncidentState.DISPATCHED, first.completion().get(5, TimeUnit.SECONDS).state());
  }

  @Test
  void approvalNoticesArePublishedAndWithdrawn() throws Exception {
    List<String> events = new CopyOnWriteArrayList<>();
    ApprovalNoticePort notices = new ApprovalNoticePort() {
      @Override
      public void requested(ApprovalRequest request, Incident incident) {
        events.add("requested:" + request.requestId());
      }

      @Override
      public void resolved(ApprovalRequest request) {
        events.add("resolved:" + request.resolution());
      }
    };
    harness.classifyAs("Flood", "Low").build(SeverityPolicy.defaults(), Duration.ofHours(1), notices);

    IncidentWorkflow workflow = harness.engine().start("Toronto", 1, Fixtures.T0);
    String requestId = workflow.settled().get(5, TimeUnit.SECONDS).approval().requestId();
    harness.gate().resolve(requestId, ApprovalDecision.REJECT, "ops");
    workflow.completion().get(5, TimeUnit.SECONDS);

    assertEquals(List.of("requested:" + requestId, "resolved:REJECTED"), events);
  }

  @Test
  void settleBudgetAllowsForSlowAuditAppends() {
    harness.build();

    // 4 attempts of 8 s of calls, 12 capped backoffs of 1 s, 7 audit appends of 2 s, 1 s slack
    assertEquals(Duration.ofSeconds(59), harness.engine().settleBudget());
  }

  private List<AuditEventKind> kinds(Incident incident) {
    return harness.sink.recordsFor(incident.id()).stream().map(AuditRecord::kind).toList();
  }

  private AuditRecord last(Incident incident) {
    List<AuditRecord> trail = harness.sink.recordsFor(incident.id());
    return trail.get(trail.size() - 1);
  }
}
