package ca.gc.eccc.sentinel.api;

import ca.gc.eccc.sentinel.config.ConfigMerger;
import ca.gc.eccc.sentinel.config.DefaultsForMode;
import ca.gc.eccc.sentinel.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared steps for commands that mix CLI arguments with a YAML file and embedded defaults.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /** Carries the exit code of a configuration step that already reported its failure. */
  static final class CliAbort extends Exception {
    private static final long serialVersionUID = 1L;
    private final ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(null, null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Builds the effective configuration for a command: defaults, then YAML ({@code config=PATH}), then CLI.
   *
   * @param mode command name
   * @param cliKv CLI arguments; {@code config} is removed from the map
   * @param log logger of the calling command
   * @param usage usage line printed on invalid input
   * @return merged configuration
   * @throws CliAbort when the YAML file is missing, unreadable or invalid, or the merge fails
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cliKv, Logger log, String usage)
      throws CliAbort {
    String configPath = extractConfigPath(cliKv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        throw new CliAbort(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(usage);
        throw new CliAbort(ExitCode.INVALID_ARGS);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        throw new CliAbort(ExitCode.IO_ERROR);
      }
    }
    try {
      return ConfigMerger.buildEffectiveConfig(mode, yaml, cliKv, DefaultsForMode.asFlatMap(mode), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
