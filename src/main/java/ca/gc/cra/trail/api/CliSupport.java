package ca.gc.cra.trail.api;

import ca.gc.cra.trail.config.CompositionRoot;
import ca.gc.cra.trail.config.TrailConfig;
import ca.gc.cra.trail.validation.Numbers;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Argument and configuration handling shared by the subcommands.
 */
final class CliSupport {
  private static final Logger log = LoggerFactory.getLogger(CliSupport.class);

  private CliSupport() {}

  /**
   * Parses the {@code key=value} arguments of a subcommand, rejecting unknown flags.
   *
   * @param input subcommand input
   * @param usage one-line usage printed on failure
   * @return mutable settings map
   * @throws CliAbort with {@link ExitCode#INVALID_ARGS} when the arguments are malformed
   */
  static Map<String, String> parseSettings(CliInput input, String usage) throws CliAbort {
    if (!input.flags().isEmpty()) {
      log.error("Unknown option: {}", String.join(" ", input.flags()));
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    try {
      return new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  /**
   * Resolves the effective configuration with the remaining arguments as overrides.
   *
   * @param settings CLI settings, command-specific keys already removed
   * @param usage one-line usage printed on failure
   * @return effective configuration
   * @throws CliAbort with {@link ExitCode#INVALID_ARGS} or {@link ExitCode#IO_ERROR}
   */
  static TrailConfig loadConfig(Map<String, String> settings, String usage) throws CliAbort {
    try {
      return CompositionRoot.loadConfig(settings);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    } catch (UncheckedIOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  /**
   * Removes and parses an integer option.
   *
   * @param settings CLI settings
   * @param key option name
   * @param fallback value when absent or blank
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @param usage one-line usage printed on failure
   * @return parsed value
   * @throws CliAbort with {@link ExitCode#INVALID_ARGS} when out of range
   */
  static int takeInt(Map<String, String> settings, String key, int fallback, int min, int max, String usage)
      throws CliAbort {
    String raw = settings.remove(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return (int) Numbers.parseRange(key, raw, min, max);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  static String humanBytes(long bytes) {
    if (bytes < 1024) {
      return bytes + " B";
    }
    double value = bytes;
    String[] units = {"KiB", "MiB", "GiB", "TiB"};
    int unit = -1;
    while (value >= 1024 && unit < units.length - 1) {
      value /= 1024;
      unit++;
    }
    return String.format(Locale.ROOT, "%.1f %s", value, units[unit]);
  }

  /** Stops a subcommand early with the exit code to report. */
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
}
