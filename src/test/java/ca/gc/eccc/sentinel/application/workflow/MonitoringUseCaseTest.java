package ca.gc.eccc.sentinel.application.workflow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.eccc.sentinel.application.port.ApprovalNoticePort;
import ca.gc.eccc.sentinel.domain.incident.IncidentState;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class MonitoringUseCaseTest {
  private final EngineHarness harness = new EngineHarness();

  @AfterEach
  void tearDown() throws InterruptedException {
    harness.close();
  }

  @Test
  void runsConfiguredCyclesForEveryLocation() throws Exception {
    harness.classifyAs("Severe Storm", "High").build();
    MonitoringUseCase useCase = new MonitoringUseCase(
        harness.engine(), List.of("Toronto", "Ottawa"), Duration.ofMillis(10), 2, false, Duration.ofSeconds(1));

    MonitoringSummary summary = useCase.run();

    assertEquals(2, summary.cyclesRun());
    assertEquals(4, summary.incidentsStarted());
    assertEquals(4, summary.count(IncidentState.DISPATCHED));
    assertFalse(summary.stoppedEarly());
    assertEquals(4, harness.sendAttempts.get());
  }

  @Test
  void finishedIncidentsAreTalliedAndReleasedAfterEachCycle() throws Exception {
    harness.classifyAs("Severe Storm", "High").build();
    MonitoringUseCase useCase = new MonitoringUseCase(
        harness.engine(), List.of("Toronto", "Ottawa", "Halifax"), Duration.ofMillis(1), 5, false,
        Duration.ofSeconds(1));

    MonitoringSummary summary = useCase.run();

    assertEquals(15, summary.incidentsStarted());
    assertEquals(15, summary.count(IncidentState.DISPATCHED));
    assertEquals(0, useCase.retainedHandles());
  }

  @Test
  void onlySuspendedIncidentsKeepTheirHandles() throws Exception {
    harness.classifyAs("Flood", "Low").build();
    MonitoringUseCase useCase = new MonitoringUseCase(
        harness.engine(), List.of("Winnipeg"), Duration.ofMillis(1), 3, false, Duration.ofSeconds(1));

    MonitoringSummary summary = useCase.run();

    assertEquals(3, summary.count(IncidentState.AWAITING_APPROVAL));
    assertEquals(3, useCase.retainedHandles());
  }

  @Test
  void waitsForPendingApprovalsToExpireBeforeReturning() throws Exception {
    harness.classifyAs("Flood", "Low").build(SeverityPolicy.defaults(), Duration.ofMillis(100),
        ApprovalNoticePort.NONE);
    MonitoringUseCase useCase = new MonitoringUseCase(
        harness.engine(), List.of("Winnipeg"), Duration.ofMillis(10), 1, true, Duration.ofMillis(100));

    MonitoringSummary summary = useCase.run();

    assertEquals(1, summary.count(IncidentState.DONE));
    assertEquals(0, harness.sendAttempts.get());
  }

  @Test
  void leavesSuspendedIncidentsWhenNotWaiting() throws Exception {
    harness.classifyAs("Flood", "Low").build();
    MonitoringUseCase useCase = new MonitoringUseCase(
        harness.engine(), List.of("Winnipeg"), Duration.ofMillis(10), 1, false, Duration.ofSeconds(1));

    MonitoringSummary summary = useCase.run();

    assertEquals(1, summary.count(IncidentState.AWAITING_APPROVAL));
    assertEquals(1, harness.engine().live().size());
  }

  @Test
  void stopInterruptsTheWaitBetweenCycles() throws Exception {
    harness.classifyAs("Severe Storm", "High").build();
    MonitoringUseCase useCase = new MonitoringUseCase(
        harness.engine(), List.of("Toronto"), Duration.ofHours(1), 0, true, Duration.ofSeconds(1));
    ExecutorService runner = Executors.newSingleThreadExecutor();
    try {
      Future<MonitoringSummary> running = runner.submit(useCase::run);
      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
      while (harness.sent.isEmpty() && System.nanoTime() < deadline) {
        Thread.sleep(10);
      }
      useCase.stop();

      MonitoringSummary summary = running.get(5, TimeUnit.SECONDS);
      assertTrue(summary.stoppedEarly());
      assertEquals(1, summary.cyclesRun());
      assertTrue(useCase.isStopRequested());
    } finally {
      runner.shutdownNow();
    }
  }

  @Test
  void runCanOnlyStartOnce() throws Exception {
    harness.classifyAs("Severe Storm", "High").build();
    MonitoringUseCase useCase = new MonitoringUseCase(
        harness.engine(), List.of("Toronto"), Duration.ofMillis(10), 1, false, Duration.ofSeconds(1));

    useCase.run();

    assertThrows(IllegalStateException.class, useCase::run);
  }

  @Test
  void rejectsEmptyLocations() {
    harness.classifyAs("Severe Storm", "High").build();

    assertThrows(IllegalArgumentException.class, () -> new MonitoringUseCase(
        harness.engine(), List.of(), Duration.ofSeconds(1), 1, false, Duration.ofSeconds(1)));
  }
}
