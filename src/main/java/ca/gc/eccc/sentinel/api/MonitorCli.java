package ca.gc.eccc.sentinel.api;

import ca.gc.eccc.sentinel.application.workflow.MonitoringSummary;
import ca.gc.eccc.sentinel.application.workflow.MonitoringUseCase;
import ca.gc.eccc.sentinel.config.CompositionRoot;
import ca.gc.eccc.sentinel.config.MonitorConfig;
import ca.gc.eccc.sentinel.config.MonitorRuntime;
import ca.gc.eccc.sentinel.domain.incident.IncidentState;
import ca.gc.eccc.sentinel.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code monitor} command: polls the configured locations and drives each incident
 * through the decision-and-dispatch workflow.
 *
 * @since 0.1.0
 */
public final class MonitorCli {
  private static final Logger log = LoggerFactory.getLogger(MonitorCli.class);
  static final String MODE = "monitor";
  private static final long SHUTDOWN_WAIT_SECONDS = 30;
  private static final String SUMMARY_USAGE =
      "usage: monitor locations=A,B recipients=ADDR[,ADDR] [config=PATH] [cycles=N] "
          + "[pollIntervalSeconds=N] [notifierMode=LOG|FILE|KAFKA] [auditMode=FILE|KAFKA] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      SENTINEL monitor

      Usage:
        monitor locations=A,B recipients=ADDR [options]

      Polling:
        locations=A,B              Monitored locations (required)
        pollIntervalSeconds=N      Delay between cycles (default 60)
        cycles=N                   Number of cycles; 0 runs until stopped (default 0)
        workers=N                  Workflow worker threads (default 4)
        observationDir=DIR         Directory of <location>.json observation snapshots

      Decisions:
        policy.requiresApproval.<LEVEL>=true|false
                                   Approval gating per severity (CRITICAL, HIGH, MEDIUM, LOW)
        approvalTimeoutSeconds=N   Pending approvals expire after N seconds (default 900)
        approvalInbox=DIR          Operator inbox for <request>.pending / <request>.decision files
        awaitApprovalsOnExit=BOOL  Wait for pending approvals after the last cycle (default true)

      Delivery and audit:
        recipients=ADDR[,ADDR]     Alert recipients (required)
        notifierMode=LOG|FILE|KAFKA
        alertsOut=DIR              FILE notifier output directory
        auditMode=FILE|KAFKA       auditLog=PATH for FILE (JSON lines)
        kafkaBootstrap=HOST:PORT   Required for Kafka modes
        kafkaAlertsTopic=T kafkaAuditTopic=T

      Retry and timeouts:
        retry.maxRetries retry.initialBackoffMillis retry.multiplier retry.maxBackoffMillis
        timeout.observationMillis timeout.classifierMillis timeout.plannerMillis timeout.notifierMillis
        timeout.auditMillis        Bound on one audit append (Kafka audit mode)

      Global options:
        config=PATH                YAML file with common: and monitor: sections
        metricsExporter=otlp|none  otelEndpoint=URL otelResourceAttributes=k=v,...
        --dry-run                  Log alerts instead of sending them; keep the audit trail in memory
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private MonitorCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, true);
  }

  /**
   * Executes the monitor command.
   *
   * @param args raw CLI arguments
   * @param installShutdownHook whether SIGINT/SIGTERM should stop the run between cycles
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args, boolean installShutdownHook) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for monitor CLI");
    }

    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.hasFlag("--dry-run")) {
      cliKv.put("dryRun", "true");
    }

    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig(MODE, cliKv, log, SUMMARY_USAGE);
    } catch (ConfigCliUtils.CliAbort abort) {
      return abort.exitCode();
    }
    if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose", false)) {
      LoggingConfigurator.enableVerboseLogging();
    }

    MonitorConfig config;
    try {
      config = MonitorConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid monitor configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    MonitorRuntime runtime;
    try {
      runtime = new CompositionRoot(config).open();
    } catch (IllegalArgumentException ex) {
      log.error("Unable to initialize monitoring: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to initialize monitoring", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure initializing monitoring", ex);
      return ExitCode.CONFIG_ERROR;
    }

    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = installShutdownHook ? installHook(runtime.useCase(), finished) : null;
    try {
      MonitoringSummary summary = runtime.useCase().run();
      printSummary(summary);
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Monitoring interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in monitoring", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      runtime.close();
      finished.countDown();
      removeHook(hook);
    }
  }

  private static Thread installHook(MonitoringUseCase useCase, CountDownLatch finished) {
    Thread hook = new Thread(() -> {
      useCase.stop();
      try {
        if (!finished.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
          log.warn("Monitoring did not stop within {} s", SHUTDOWN_WAIT_SECONDS);
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "sentinel-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    return hook;
  }

  private static void removeHook(Thread hook) {
    if (hook == null) {
      return;
    }
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; shutdown hook left in place");
    }
  }

  private static void printSummary(MonitoringSummary summary) {
    StringBuilder states = new StringBuilder();
    for (IncidentState state : IncidentState.values()) {
      long count = summary.count(state);
      if (count > 0) {
        if (states.length() > 0) {
          states.append(", ");
        }
        states.append(state).append('=').append(count);
      }
    }
    CliPrinter.printLines(
        "Monitoring finished" + (summary.stoppedEarly() ? " (stopped)" : ""),
        " Cycles run       : " + summary.cyclesRun(),
        " Incidents        : " + summary.incidentsStarted(),
        " Final states     : " + (states.length() == 0 ? "<none>" : states));
  }
}
