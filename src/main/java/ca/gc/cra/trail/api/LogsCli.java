package ca.gc.cra.trail.api;

import ca.gc.cra.trail.api.CliSupport.CliAbort;
import ca.gc.cra.trail.config.TrailConfig;
import ca.gc.cra.trail.infrastructure.persistence.LogFileCatalog;
import ca.gc.cra.trail.infrastructure.persistence.LogFileCatalog.LogFileInfo;
import ca.gc.cra.trail.infrastructure.persistence.LogFileCatalog.LogStats;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the session logs in the configured log directory, newest first, followed by directory totals.
 *
 * @since 0.1.0
 */
public final class LogsCli {
  private static final Logger log = LoggerFactory.getLogger(LogsCli.class);
  private static final String SUMMARY_USAGE = "usage: trail logs [logDir=PATH] [config=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      List session log files

      Usage:
        trail logs [logDir=PATH]

      Prints one line per file (session, part, size, compression, last write) and the directory totals.
      Only files named session_<timestamp>.jsonl[.gz] are listed.
      """;

  private LogsCli() {}

  static ExitCode run(CliInput input) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    TrailConfig config;
    try {
      config = CliSupport.loadConfig(CliSupport.parseSettings(input, SUMMARY_USAGE), SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    LogFileCatalog catalog = new LogFileCatalog(config.logDir());
    List<LogFileInfo> files;
    LogStats stats;
    try {
      files = catalog.list();
      stats = catalog.stats();
    } catch (IOException ex) {
      log.error("Unable to list {}: {}", config.logDir(), ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    if (files.isEmpty()) {
      CliPrinter.printf("No session logs in %s", config.logDir().toAbsolutePath());
      return ExitCode.SUCCESS;
    }
    for (LogFileInfo file : files) {
      CliPrinter.printf("%-32s part %-3d %10s  %-4s  %s",
          file.sessionId(),
          file.part(),
          CliSupport.humanBytes(file.sizeBytes()),
          file.compressed() ? "gz" : "-",
          file.lastModified());
    }
    CliPrinter.printf("%d file(s), %s in %s", stats.totalFiles(), CliSupport.humanBytes(stats.totalSizeBytes()),
        config.logDir().toAbsolutePath());
    CliPrinter.printf("oldest %s, newest %s", stats.oldestSession(), stats.newestSession());
    return ExitCode.SUCCESS;
  }
}
