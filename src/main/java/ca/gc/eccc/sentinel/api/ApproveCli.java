package ca.gc.eccc.sentinel.api;

import ca.gc.eccc.sentinel.domain.approval.ApprovalDecision;
import ca.gc.eccc.sentinel.infrastructure.approval.DirectoryApprovalInbox;
import ca.gc.eccc.sentinel.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the {@code approve} command: records an operator decision in the approval inbox of a
 * running {@code monitor}.
 *
 * @since 0.1.0
 */
public final class ApproveCli {
  private static final Logger log = LoggerFactory.getLogger(ApproveCli.class);
  static final String MODE = "approve";
  private static final String SUMMARY_USAGE =
      "usage: approve inbox=DIR request=ID decision=approve|reject [operator=NAME] [config=PATH]";
  private static final String HELP_TEXT = """
      SENTINEL approve

      Usage:
        approve inbox=DIR request=ID decision=approve|reject [operator=NAME]

      Options:
        inbox=DIR          Approval inbox watched by the monitor (default ./approvals)
        request=ID         Approval request id, as listed by the <ID>.pending notice
        decision=VALUE     approve or reject
        operator=NAME      Name recorded on the decision (default: current user)
        config=PATH        YAML file with common: and approve: sections
        --verbose          Enable DEBUG logging
        --help             Show this message
      """;

  private ApproveCli() {}

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

    Path inbox;
    String requestId = effective.get("request");
    ApprovalDecision decision;
    try {
      inbox = Path.of(effective.get("inbox"));
      if (requestId == null || requestId.isBlank()) {
        throw new IllegalArgumentException("request is required");
      }
      decision = ApprovalDecision.parse(effective.get("decision"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid approve arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (!Files.exists(inbox.resolve(requestId + DirectoryApprovalInbox.PENDING_SUFFIX))) {
      log.warn("No pending notice for {} in {}; the decision will be ignored if the request is unknown",
          requestId, inbox);
    }
    try {
      Path written = DirectoryApprovalInbox.writeDecision(inbox, requestId, decision, effective.get("operator"));
      CliPrinter.println("Decision " + decision.name().toLowerCase(Locale.ROOT)
          + " for " + requestId + " written to " + written);
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid approve arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to write decision to {}", inbox, ex);
      return ExitCode.IO_ERROR;
    }
  }
}
