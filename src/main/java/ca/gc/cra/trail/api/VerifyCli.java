package ca.gc.cra.trail.api;

import ca.gc.cra.trail.api.CliSupport.CliAbort;
import ca.gc.cra.trail.application.schema.EventSchemaRegistry;
import ca.gc.cra.trail.config.TrailConfig;
import ca.gc.cra.trail.infrastructure.persistence.EventJsonCodec;
import ca.gc.cra.trail.infrastructure.persistence.LogFileCatalog;
import ca.gc.cra.trail.infrastructure.persistence.LogFileCatalog.LogFileInfo;
import ca.gc.cra.trail.infrastructure.persistence.SessionLogVerifier;
import ca.gc.cra.trail.infrastructure.persistence.SessionLogVerifier.Problem;
import ca.gc.cra.trail.infrastructure.persistence.SessionLogVerifier.Report;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a persisted session log: schema conformance, unique and gapless event ids, one session id, and resolvable
 * parents.
 *
 * @since 0.1.0
 */
public final class VerifyCli {
  private static final Logger log = LoggerFactory.getLogger(VerifyCli.class);
  private static final String SUMMARY_USAGE =
      "usage: trail verify <file=PATH|session=ID> [logDir=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      Verify a session log

      Usage:
        trail verify file=PATH
        trail verify session=ID [logDir=PATH]

      Options:
        file=PATH         One log file (.jsonl or .jsonl.gz)
        session=ID        All parts of a session found in the log directory

      Exit status is 0 when the log is sound and 1 when problems were found.
      """;

  private VerifyCli() {}

  static ExitCode run(CliInput input) {
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    String file;
    String session;
    TrailConfig config;
    try {
      Map<String, String> settings = CliSupport.parseSettings(input, SUMMARY_USAGE);
      file = settings.remove("file");
      session = settings.remove("session");
      if ((file == null || file.isBlank()) == (session == null || session.isBlank())) {
        log.error("Exactly one of file= or session= is required");
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      config = CliSupport.loadConfig(settings, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    List<Path> files;
    try {
      files = file != null && !file.isBlank()
          ? List.of(Path.of(file.trim()))
          : sessionFiles(new LogFileCatalog(config.logDir()), session.trim());
    } catch (IOException ex) {
      log.error("Unable to list {}: {}", config.logDir(), ex.getMessage());
      return ExitCode.IO_ERROR;
    }
    if (files.isEmpty()) {
      log.error("No log files for session {} in {}", session, config.logDir());
      return ExitCode.INVALID_ARGS;
    }
    for (Path path : files) {
      if (!Files.isRegularFile(path)) {
        log.error("Log file not found: {}", path);
        return ExitCode.INVALID_ARGS;
      }
    }

    Report report;
    try {
      report = new SessionLogVerifier(EventSchemaRegistry.standard(), new EventJsonCodec()).verify(files);
    } catch (IOException ex) {
      log.error("Unable to read session log: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    for (Problem problem : report.problems()) {
      CliPrinter.println(problem.toString());
    }
    if (report.truncated()) {
      CliPrinter.println("... further problems not shown");
    }
    CliPrinter.printf("%s: %d line(s), %d valid event(s), highest sequence %d, %d problem(s)",
        report.sessionId() == null ? "unknown session" : report.sessionId(),
        report.lines(), report.validEvents(), report.highestSequence(), report.problems().size());
    return report.ok() ? ExitCode.SUCCESS : ExitCode.VERIFY_FAILED;
  }

  private static List<Path> sessionFiles(LogFileCatalog catalog, String sessionId) throws IOException {
    return catalog.list().stream()
        .filter(info -> info.sessionId().equals(sessionId))
        .sorted(Comparator.comparingInt(LogFileInfo::part))
        .map(LogFileInfo::path)
        .toList();
  }
}
