package ca.gc.cra.trail.infrastructure.persistence;

import ca.gc.cra.trail.infrastructure.persistence.SessionLogFiles.LogFileName;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Lists, summarizes, and prunes session log files in a log directory.
 * <p><strong>Why:</strong> Every session leaves a file behind; without retention the directory grows forever.</p>
 * <p><strong>Role:</strong> Infrastructure helper used by startup retention and by the {@code logs} and {@code rotate}
 * CLI commands.</p>
 * <p>Only names of the form {@code session_<digits...>.jsonl[.gz]} (and their rolled parts) are considered, so files
 * written under custom session ids are never touched. Sessions are ordered by their most recent modification time,
 * newest first.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the directory; concurrent rotations may race on deletes, which
 * are reported as errors.</p>
 *
 * @since 0.1.0
 */
public final class LogFileCatalog {
  private static final Logger log = LoggerFactory.getLogger(LogFileCatalog.class);
  private static final String SESSION_PREFIX = "session_";

  private final Path directory;

  /**
   * Creates a catalog over one directory.
   *
   * @param directory log directory; need not exist
   */
  public LogFileCatalog(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  /**
   * One log file on disk.
   *
   * @param path file path
   * @param sessionId owning session
   * @param part part index; zero for the first file
   * @param sizeBytes size on disk
   * @param lastModified last modification time
   * @param compressed whether the file is gzip-compressed
   */
  public record LogFileInfo(
      Path path, String sessionId, int part, long sizeBytes, Instant lastModified, boolean compressed) {}

  /**
   * Directory totals.
   *
   * @param totalFiles number of log files
   * @param totalSizeBytes combined size
   * @param oldestSession least recently written session, or {@code null} when empty
   * @param newestSession most recently written session, or {@code null} when empty
   */
  public record LogStats(long totalFiles, long totalSizeBytes, String oldestSession, String newestSession) {}

  /**
   * Outcome of a retention pass.
   *
   * @param filesDeleted number of deleted files
   * @param filesKept number of files left in place
   * @param bytesFreed combined size of deleted files
   * @param sessionsDeleted deleted session ids, newest first
   * @param errors one message per file that could not be deleted
   */
  public record RotationResult(
      int filesDeleted, int filesKept, long bytesFreed, List<String> sessionsDeleted, List<String> errors) {
    public RotationResult {
      sessionsDeleted = List.copyOf(sessionsDeleted);
      errors = List.copyOf(errors);
    }
  }

  /**
   * Returns the directory this catalog covers.
   *
   * @return log directory
   */
  public Path directory() {
    return directory;
  }

  /**
   * Lists session log files, newest first.
   *
   * @return files; empty when the directory does not exist
   * @throws IOException when the directory cannot be read
   */
  public List<LogFileInfo> list() throws IOException {
    if (!Files.isDirectory(directory)) {
      return List.of();
    }
    List<LogFileInfo> files = new ArrayList<>();
    try (Stream<Path> stream = Files.list(directory)) {
      for (Path path : (Iterable<Path>) stream::iterator) {
        describe(path).ifPresent(files::add);
      }
    }
    files.sort(Comparator.comparing(LogFileInfo::lastModified)
        .thenComparing(LogFileInfo::sessionId)
        .thenComparingInt(LogFileInfo::part)
        .reversed());
    return files;
  }

  /**
   * Summarizes the directory.
   *
   * @return totals
   * @throws IOException when the directory cannot be read
   */
  public LogStats stats() throws IOException {
    List<LogFileInfo> files = list();
    if (files.isEmpty()) {
      return new LogStats(0, 0, null, null);
    }
    long total = files.stream().mapToLong(LogFileInfo::sizeBytes).sum();
    return new LogStats(
        files.size(), total, files.get(files.size() - 1).sessionId(), files.get(0).sessionId());
  }

  /**
   * Deletes the files of all but the {@code keep} most recent sessions. The current session is never deleted and
   * occupies one of the {@code keep} slots.
   *
   * @param keep sessions to keep, including the current one; zero deletes every session except the current one
   * @param currentSessionId session being written, or {@code null}
   * @return what was deleted
   * @throws IOException when the directory cannot be read
   * @throws IllegalArgumentException when {@code keep} is negative
   */
  public RotationResult rotate(int keep, String currentSessionId) throws IOException {
    if (keep < 0) {
      throw new IllegalArgumentException("keep must be >= 0");
    }
    Map<String, List<LogFileInfo>> bySession = new LinkedHashMap<>();
    for (LogFileInfo file : list()) {
      bySession.computeIfAbsent(file.sessionId(), id -> new ArrayList<>()).add(file);
    }

    int previousToKeep = currentSessionId == null ? keep : Math.max(0, keep - 1);
    int kept = 0;
    int filesKept = 0;
    int filesDeleted = 0;
    long bytesFreed = 0;
    List<String> sessionsDeleted = new ArrayList<>();
    List<String> errors = new ArrayList<>();

    for (Map.Entry<String, List<LogFileInfo>> entry : bySession.entrySet()) {
      String sessionId = entry.getKey();
      List<LogFileInfo> files = entry.getValue();
      if (sessionId.equals(currentSessionId) || kept < previousToKeep) {
        if (!sessionId.equals(currentSessionId)) {
          kept++;
        }
        filesKept += files.size();
        continue;
      }
      boolean anyDeleted = false;
      for (LogFileInfo file : files) {
        try {
          Files.deleteIfExists(file.path());
          filesDeleted++;
          bytesFreed += file.sizeBytes();
          anyDeleted = true;
        } catch (IOException ex) {
          filesKept++;
          String message = "Failed to delete " + file.path() + ": " + ex.getMessage();
          errors.add(message);
          log.warn("Log retention: {}", message);
        }
      }
      if (anyDeleted) {
        sessionsDeleted.add(sessionId);
      }
    }
    if (filesDeleted > 0) {
      log.info("Log retention removed {} file(s) from {} session(s), {} bytes freed",
          filesDeleted, sessionsDeleted.size(), bytesFreed);
    }
    return new RotationResult(filesDeleted, filesKept, bytesFreed, sessionsDeleted, errors);
  }

  private Optional<LogFileInfo> describe(Path path) {
    Path name = path.getFileName();
    if (name == null) {
      return Optional.empty();
    }
    Optional<LogFileName> parsed = SessionLogFiles.parse(name.toString())
        .filter(n -> isSessionLog(n.sessionId()));
    if (parsed.isEmpty()) {
      return Optional.empty();
    }
    try {
      BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
      if (!attrs.isRegularFile()) {
        return Optional.empty();
      }
      LogFileName n = parsed.get();
      return Optional.of(new LogFileInfo(
          path, n.sessionId(), n.part(), attrs.size(), attrs.lastModifiedTime().toInstant(), n.compressed()));
    } catch (IOException ex) {
      log.debug("Skipping unreadable log file {}", path, ex);
      return Optional.empty();
    }
  }

  private static boolean isSessionLog(String sessionId) {
    if (!sessionId.startsWith(SESSION_PREFIX) || sessionId.length() == SESSION_PREFIX.length()) {
      return false;
    }
    return sessionId.substring(SESSION_PREFIX.length()).chars().anyMatch(Character::isDigit);
  }
}
