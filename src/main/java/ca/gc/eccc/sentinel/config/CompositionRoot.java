package ca.gc.eccc.sentinel.config;

import ca.gc.eccc.sentinel.adapter.kafka.KafkaAlertNotifier;
import ca.gc.eccc.sentinel.adapter.kafka.KafkaAuditSink;
import ca.gc.eccc.sentinel.application.port.ApprovalNoticePort;
import ca.gc.eccc.sentinel.application.port.AuditSink;
import ca.gc.eccc.sentinel.application.port.ClockPort;
import ca.gc.eccc.sentinel.application.port.MetricsPort;
import ca.gc.eccc.sentinel.application.port.Notifier;
import ca.gc.eccc.sentinel.application.workflow.AlertComposer;
import ca.gc.eccc.sentinel.application.workflow.ApprovalGate;
import ca.gc.eccc.sentinel.application.workflow.AuditTrail;
import ca.gc.eccc.sentinel.application.workflow.CapabilityInvoker;
import ca.gc.eccc.sentinel.application.workflow.MonitoringUseCase;
import ca.gc.eccc.sentinel.application.workflow.WorkflowCapabilities;
import ca.gc.eccc.sentinel.application.workflow.WorkflowEngine;
import ca.gc.eccc.sentinel.infrastructure.approval.DirectoryApprovalInbox;
import ca.gc.eccc.sentinel.infrastructure.audit.InMemoryAuditSink;
import ca.gc.eccc.sentinel.infrastructure.audit.JsonLinesAuditSink;
import ca.gc.eccc.sentinel.infrastructure.classify.ThresholdClassifier;
import ca.gc.eccc.sentinel.infrastructure.exec.ExecutorFactories;
import ca.gc.eccc.sentinel.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.eccc.sentinel.infrastructure.notify.FileAlertNotifier;
import ca.gc.eccc.sentinel.infrastructure.notify.LoggingAlertNotifier;
import ca.gc.eccc.sentinel.infrastructure.observation.FileObservationSource;
import ca.gc.eccc.sentinel.infrastructure.plan.TemplateResponsePlanner;
import ca.gc.eccc.sentinel.infrastructure.time.SystemClockAdapter;
import ca.gc.eccc.sentinel.validation.Paths;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the monitoring use case to concrete adapters.
 * <p><strong>Why:</strong> Keeps adapter selection (notifier transport, audit destination, metrics exporter)
 * in one place driven by {@link MonitorConfig}.</p>
 * <p><strong>Failure:</strong> {@link #open()} validates every filesystem location and starts the approval
 * inbox before the first cycle; a failure there releases whatever was already created and propagates, so
 * the CLI can exit non-zero without having contacted any capability.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MonitorConfig config;
  private final ClockPort clock;
  private final MetricsPort metricsOverride;

  public CompositionRoot(MonitorConfig config) {
    this(config, new SystemClockAdapter(), null);
  }

  /**
   * Creates a composition root with explicit clock and metrics.
   *
   * @param config validated configuration
   * @param clock clock shared by the engine and the approval gate
   * @param metricsOverride metrics port to use instead of OpenTelemetry; {@code null} builds the OpenTelemetry adapter
   */
  CompositionRoot(MonitorConfig config, ClockPort clock, MetricsPort metricsOverride) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metricsOverride = metricsOverride;
  }

  /**
   * Wires a runnable monitoring session.
   *
   * @return runtime owning every created resource
   * @throws IOException when the approval inbox cannot be created
   * @throws IllegalArgumentException when a configured path is unusable
   */
  public MonitorRuntime open() throws IOException {
    List<AutoCloseable> closeables = new ArrayList<>();
    MetricsPort metrics = metricsOverride;
    if (metrics == null) {
      OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(config.metrics());
      closeables.add(adapter);
      metrics = adapter;
    }
    AuditSink auditSink = null;
    ExecutorService workers = null;
    ExecutorService calls = null;
    ScheduledExecutorService timer = null;
    try {
      FileObservationSource observations = new FileObservationSource(
          Paths.validateReadableDir("observationDir", config.observationDir()), clock);
      Notifier notifier = createNotifier(closeables);
      auditSink = createAuditSink();
      workers = ExecutorFactories.newWorkflowPool(config.workers(), "sentinel-workflow", null);
      calls = ExecutorFactories.newCallPool("sentinel-call");
      timer = ExecutorFactories.newTimer("sentinel-timer");

      ApprovalGate gate = new ApprovalGate(clock, config.approvalTimeout(), timer, metrics);
      DirectoryApprovalInbox inbox = null;
      ApprovalNoticePort notices = ApprovalNoticePort.NONE;
      if (config.approvalInbox().isPresent()) {
        inbox = new DirectoryApprovalInbox(config.approvalInbox().get(), gate, timer, config.approvalPollInterval());
        inbox.start();
        notices = inbox;
      }

      WorkflowCapabilities capabilities = new WorkflowCapabilities(
          observations, new ThresholdClassifier(), new TemplateResponsePlanner(), notifier);
      WorkflowEngine engine = new WorkflowEngine(
          capabilities,
          config.timeouts(),
          config.severityPolicy(),
          gate,
          new AuditTrail(auditSink, metrics),
          new CapabilityInvoker(calls, config.retryPolicy()),
          new AlertComposer(config.recipients()),
          workers,
          clock,
          metrics,
          notices);
      MonitoringUseCase useCase = new MonitoringUseCase(
          engine,
          config.locations(),
          config.pollInterval(),
          config.cycles(),
          config.awaitApprovalsOnExit(),
          config.approvalTimeout());
      log.info("Monitoring {} location(s); notifier={}, audit={}, approvals via {}",
          config.locations().size(), config.notifierMode(), config.auditMode(),
          inbox == null ? "timeout only" : inbox.directory());
      return new MonitorRuntime(useCase, engine, inbox, auditSink, closeables, workers, calls, timer);
    } catch (IOException | RuntimeException ex) {
      release(closeables, auditSink, workers, calls, timer);
      throw ex;
    }
  }

  private Notifier createNotifier(List<AutoCloseable> closeables) {
    return switch (config.notifierMode()) {
      case LOG -> new LoggingAlertNotifier();
      case FILE -> new FileAlertNotifier(Paths.validateWritableDir("alertsOut", config.alertsOut(), true));
      case KAFKA -> {
        KafkaAlertNotifier kafka = new KafkaAlertNotifier(
            config.kafkaBootstrap().orElseThrow(), config.kafkaAlertsTopic(), config.timeouts().notifier());
        closeables.add(kafka);
        yield kafka;
      }
    };
  }

  private AuditSink createAuditSink() {
    return switch (config.auditMode()) {
      case FILE -> new JsonLinesAuditSink(Paths.validateWritableFile("auditLog", config.auditLog()));
      case KAFKA -> new KafkaAuditSink(
          config.kafkaBootstrap().orElseThrow(), config.kafkaAuditTopic(), config.timeouts().audit());
      case MEMORY -> new InMemoryAuditSink();
    };
  }

  private static void release(
      List<AutoCloseable> closeables,
      AuditSink auditSink,
      ExecutorService workers,
      ExecutorService calls,
      ScheduledExecutorService timer) {
    if (workers != null) {
      workers.shutdownNow();
    }
    if (calls != null) {
      calls.shutdownNow();
    }
    if (timer != null) {
      timer.shutdownNow();
    }
    List<AutoCloseable> all = new ArrayList<>(closeables);
    if (auditSink != null) {
      all.add(auditSink);
    }
    for (AutoCloseable closeable : all) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.debug("Ignoring close failure during aborted startup", ex);
      }
    }
  }
}
