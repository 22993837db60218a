package ca.gc.eccc.sentinel.config;

import ca.gc.eccc.sentinel.application.port.AuditSink;
import ca.gc.eccc.sentinel.application.port.AuditSinkException;
import ca.gc.eccc.sentinel.application.workflow.ApprovalGate;
import ca.gc.eccc.sentinel.application.workflow.MonitoringUseCase;
import ca.gc.eccc.sentinel.application.workflow.WorkflowEngine;
import ca.gc.eccc.sentinel.infrastructure.approval.DirectoryApprovalInbox;
import ca.gc.eccc.sentinel.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A wired {@code monitor} run: the use case plus every resource that must be released afterwards.
 *
 * <p>{@link #close()} stops the inbox and approval timers, drains the workflow pool, abandons outstanding
 * capability calls, then closes the notifier, the audit sink and the metrics exporter in that order.</p>
 *
 * @since 0.1.0
 */
public final class MonitorRuntime implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MonitorRuntime.class);
  private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(10);

  private final MonitoringUseCase useCase;
  private final WorkflowEngine engine;
  private final DirectoryApprovalInbox inbox;
  private final AuditSink auditSink;
  private final List<AutoCloseable> closeables;
  private final ExecutorService workers;
  private final ExecutorService calls;
  private final ScheduledExecutorService timer;
  private boolean closed;

  MonitorRuntime(
      MonitoringUseCase useCase,
      WorkflowEngine engine,
      DirectoryApprovalInbox inbox,
      AuditSink auditSink,
      List<AutoCloseable> closeables,
      ExecutorService workers,
      ExecutorService calls,
      ScheduledExecutorService timer) {
    this.useCase = Objects.requireNonNull(useCase, "useCase");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.inbox = inbox;
    this.auditSink = Objects.requireNonNull(auditSink, "auditSink");
    this.closeables = List.copyOf(closeables);
    this.workers = Objects.requireNonNull(workers, "workers");
    this.calls = Objects.requireNonNull(calls, "calls");
    this.timer = Objects.requireNonNull(timer, "timer");
  }

  public MonitoringUseCase useCase() {
    return useCase;
  }

  public WorkflowEngine engine() {
    return engine;
  }

  public ApprovalGate gate() {
    return engine.gate();
  }

  public Optional<DirectoryApprovalInbox> inbox() {
    return Optional.ofNullable(inbox);
  }

  public AuditSink auditSink() {
    return auditSink;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (inbox != null) {
      inbox.close();
    }
    engine.gate().close();
    ExecutorFactories.shutdownGracefully(workers, DRAIN_TIMEOUT);
    calls.shutdownNow();
    timer.shutdownNow();
    for (AutoCloseable closeable : closeables) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close {}", closeable.getClass().getSimpleName(), ex);
      }
    }
    try {
      auditSink.close();
    } catch (AuditSinkException ex) {
      log.warn("Failed to close audit sink", ex);
    }
  }
}
