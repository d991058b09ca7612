package ca.gc.cra.trail.api;

import ca.gc.cra.trail.logging.LoggingConfigurator;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trail CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: trail <demo|logs|rotate|verify> [options]";
  private static final String HELP_TEXT = """
      Activity trail command dispatcher

      Usage:
        trail <command> [options]

      Commands:
        demo        Record a sample session with the effective configuration
        logs        List session log files and directory totals
        rotate      Delete session logs beyond the retention count
        verify      Check a session log for schema, id, and parent problems

      Global flags:
        --help      Show this message (or <command> --help for details)
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first word is the subcommand)
   * @return exit code reported by the subcommand
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] words = input.keyValueArgs();
    if (input.help() && words.length == 0) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (words.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = words[0].toLowerCase(Locale.ROOT);
    CliInput delegate = input.withoutCommand();
    return switch (command) {
      case "demo" -> DemoCli.run(delegate);
      case "logs" -> LogsCli.run(delegate);
      case "rotate" -> RotateCli.run(delegate);
      case "verify" -> VerifyCli.run(delegate);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
