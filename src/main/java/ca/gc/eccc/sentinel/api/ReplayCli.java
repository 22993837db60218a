package ca.gc.eccc.sentinel.api;

import ca.gc.eccc.sentinel.application.workflow.AuditReplayer;
import ca.gc.eccc.sentinel.application.workflow.AuditReplayer.ReplayedIncident;
import ca.gc.eccc.sentinel.domain.incident.IncidentId;
import ca.gc.eccc.sentinel.infrastructure.audit.JsonLinesAuditReader;
import ca.gc.eccc.sentinel.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code replay} command: reconstructs each incident's last state from a JSON-lines
 * audit log and flags incidents that never reached a terminal state.
 *
 * @since 0.1.0
 */
public final class ReplayCli {
  private static final Logger log = LoggerFactory.getLogger(ReplayCli.class);
  static final String MODE = "replay";
  private static final String SUMMARY_USAGE = "usage: replay auditLog=PATH [incident=ID] [config=PATH]";
  private static final String HELP_TEXT = """
      SENTINEL replay

      Usage:
        replay auditLog=PATH [incident=ID]

      Options:
        auditLog=PATH      JSON-lines audit log written by monitor (default ./sentinel-audit.jsonl)
        incident=ID        Only replay this incident
        config=PATH        YAML file with common: and replay: sections
        --verbose          Enable DEBUG logging
        --help             Show this message
      """;

  private ReplayCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig(MODE, cliKv, log, SUMMARY_USAGE);
    } catch (ConfigCliUtils.CliAbort abort) {
      return abort.exitCode();
    }

    Path auditLog;
    IncidentId only = null;
    try {
      auditLog = Path.of(effective.get("auditLog"));
      String incident = effective.get("incident");
      if (incident != null && !incident.isBlank()) {
        only = new IncidentId(incident.trim());
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid replay arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    JsonLinesAuditReader.Result result;
    try {
      result = new JsonLinesAuditReader().read(auditLog);
    } catch (IOException ex) {
      log.error("Unable to read audit log {}: {}", auditLog, ex.toString());
      return ExitCode.IO_ERROR;
    }

    Map<IncidentId, ReplayedIncident> replayed = AuditReplayer.replay(result.records());
    List<ReplayedIncident> selected = new ArrayList<>();
    for (ReplayedIncident incident : replayed.values()) {
      if (only == null || only.equals(incident.incidentId())) {
        selected.add(incident);
      }
    }
    if (only != null && selected.isEmpty()) {
      CliPrinter.println("No audit records for incident " + only + " in " + auditLog);
      return ExitCode.SUCCESS;
    }

    int terminal = 0;
    int resumable = 0;
    for (ReplayedIncident incident : selected) {
      CliPrinter.println(describe(incident));
      for (String anomaly : incident.anomalies()) {
        CliPrinter.println("    anomaly: " + anomaly);
      }
      if (incident.terminal()) {
        terminal++;
      } else if (incident.resumable()) {
        resumable++;
      }
    }
    CliPrinter.println(selected.size() + " incident(s): " + terminal + " terminal, " + resumable
        + " awaiting approval, " + (selected.size() - terminal - resumable) + " dangling; "
        + result.malformedLines() + " malformed line(s) skipped");
    return ExitCode.SUCCESS;
  }

  static String describe(ReplayedIncident incident) {
    String status;
    if (incident.terminal()) {
      status = "terminal";
    } else if (incident.resumable()) {
      status = "resumable";
    } else {
      status = "dangling";
    }
    return incident.incidentId() + " location=" + incident.location() + " state=" + incident.state()
        + " records=" + incident.records() + " lastSequence=" + incident.lastSequence() + " [" + status + "]";
  }
}
