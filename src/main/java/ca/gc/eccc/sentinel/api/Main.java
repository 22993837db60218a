package ca.gc.eccc.sentinel.api;

import ca.gc.eccc.sentinel.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SENTINEL CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: sentinel <monitor|approve|replay> [options]";
  private static final String HELP_TEXT = """
      SENTINEL severe weather decision-and-dispatch

      Usage:
        sentinel <command> [options]

      Commands:
        monitor   Poll locations, classify observations and dispatch alerts (monitor --help)
        approve   Approve or reject a pending alert (approve --help)
        replay    Reconstruct incident states from the audit log (replay --help)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first positional token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safeArgs.length; i++) {
      String arg = safeArgs[i] == null ? "" : safeArgs[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.contains("=")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    List<String> delegate = new ArrayList<>(Arrays.asList(safeArgs).subList(0, commandIndex));
    delegate.addAll(Arrays.asList(safeArgs).subList(commandIndex + 1, safeArgs.length));
    String[] delegateArgs = delegate.toArray(String[]::new);
    if (CliInput.parse(delegateArgs).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    return switch (command) {
      case "monitor" -> MonitorCli.run(delegateArgs);
      case "approve" -> ApproveCli.run(delegateArgs);
      case "replay" -> ReplayCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
