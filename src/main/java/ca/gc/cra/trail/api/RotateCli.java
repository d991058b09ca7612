package ca.gc.cra.trail.api;

import ca.gc.cra.trail.api.CliSupport.CliAbort;
import ca.gc.cra.trail.config.TrailConfig;
import ca.gc.cra.trail.infrastructure.persistence.LogFileCatalog;
import ca.gc.cra.trail.infrastructure.persistence.LogFileCatalog.RotationResult;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes session logs beyond the retention count, keeping the most recently written sessions.
 *
 * @since 0.1.0
 */
public final class RotateCli {
  private static final Logger log = LoggerFactory.getLogger(RotateCli.class);
  private static final int MAX_KEEP = 10_000;
  private static final String SUMMARY_USAGE = "usage: trail rotate [keep=0-10000] [logDir=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      Apply log retention

      Usage:
        trail rotate [keep=N] [logDir=PATH]

      Options:
        keep=0-10000      Sessions to keep, newest first (default: retentionCount, 2)
        logDir=PATH       Log directory (default ./.trail/logs)

      Rolled parts of a session are kept or deleted together. keep=0 deletes every session log.
      """;

  private RotateCli() {}

  static ExitCode run(CliInput input) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    TrailConfig config;
    int keep;
    try {
      Map<String, String> settings = CliSupport.parseSettings(input, SUMMARY_USAGE);
      Map<String, String> keepSetting = new HashMap<>();
      if (settings.containsKey("keep")) {
        keepSetting.put("keep", settings.remove("keep"));
      }
      config = CliSupport.loadConfig(settings, SUMMARY_USAGE);
      keep = CliSupport.takeInt(keepSetting, "keep", config.retentionCount(), 0, MAX_KEEP, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    RotationResult result;
    try {
      result = new LogFileCatalog(config.logDir()).rotate(keep, null);
    } catch (IOException ex) {
      log.error("Unable to rotate logs in {}: {}", config.logDir(), ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    for (String session : result.sessionsDeleted()) {
      CliPrinter.printf("deleted %s", session);
    }
    CliPrinter.printf("%d file(s) deleted, %d kept, %s freed",
        result.filesDeleted(), result.filesKept(), CliSupport.humanBytes(result.bytesFreed()));
    if (!result.errors().isEmpty()) {
      result.errors().forEach(error -> log.error("Rotation error: {}", error));
      return ExitCode.IO_ERROR;
    }
    return ExitCode.SUCCESS;
  }
}
