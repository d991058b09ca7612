package ca.gc.cra.trail.infrastructure.persistence;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

/**
 * Naming and reading helpers for session log files.
 *
 * <p>The first part of a session is {@code <sessionId>.jsonl}; rolled parts are {@code <sessionId>.<n>.jsonl}. With
 * compression on, every name gains a {@code .gz} suffix.</p>
 *
 * @since 0.1.0
 */
public final class SessionLogFiles {
  public static final String EXTENSION = ".jsonl";
  public static final String GZIP_SUFFIX = ".gz";

  private static final Pattern LOG_FILE = Pattern.compile("^(.+?)(?:\\.(\\d+))?\\.jsonl(\\.gz)?$");
  private static final int MAX_SUFFIX = 10_000;

  // Session paths handed out by this JVM; covers sessions that have not written their first file yet.
  private static final Set<Path> CLAIMED = ConcurrentHashMap.newKeySet();

  private SessionLogFiles() {}

  /**
   * Parsed components of a log file name.
   *
   * @param sessionId owning session
   * @param part zero for the first file, then 1, 2, ... for rolled parts
   * @param compressed whether the file is gzip-compressed
   */
  public record LogFileName(String sessionId, int part, boolean compressed) {}

  /**
   * Builds the file name of one session part.
   *
   * @param sessionId session id
   * @param part part index; zero for the first file
   * @param compressed gzip suffix wanted
   * @return file name without directory
   */
  public static String fileName(String sessionId, int part, boolean compressed) {
    Objects.requireNonNull(sessionId, "sessionId");
    if (part < 0) {
      throw new IllegalArgumentException("part must be >= 0");
    }
    String base = part == 0 ? sessionId : sessionId + "." + part;
    return base + EXTENSION + (compressed ? GZIP_SUFFIX : "");
  }

  /**
   * Claims a session id in {@code directory}. The candidate is returned when no first part exists for it, in either
   * plain or compressed form, and no other session of this JVM claimed it; otherwise {@code _2}, {@code _3}, ... is
   * appended until a free id is found.
   *
   * @param directory log directory
   * @param candidate preferred session id
   * @return the claimed id
   * @throws IllegalStateException when no free suffix is found
   */
  public static String claimSessionId(Path directory, String candidate) {
    Objects.requireNonNull(directory, "directory");
    Objects.requireNonNull(candidate, "candidate");
    Path dir = directory.toAbsolutePath().normalize();
    for (int n = 1; n <= MAX_SUFFIX; n++) {
      String sessionId = n == 1 ? candidate : candidate + "_" + n;
      if (Files.exists(dir.resolve(fileName(sessionId, 0, false)))
          || Files.exists(dir.resolve(fileName(sessionId, 0, true)))) {
        continue;
      }
      if (CLAIMED.add(dir.resolve(sessionId))) {
        return sessionId;
      }
    }
    throw new IllegalStateException("No free session id for " + candidate + " in " + dir);
  }

  /**
   * Parses a log file name.
   *
   * @param fileName bare file name
   * @return components, or empty when the name is not a session log
   */
  public static Optional<LogFileName> parse(String fileName) {
    if (fileName == null) {
      return Optional.empty();
    }
    Matcher m = LOG_FILE.matcher(fileName);
    if (!m.matches()) {
      return Optional.empty();
    }
    int part = m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
    return Optional.of(new LogFileName(m.group(1), part, m.group(3) != null));
  }

  /**
   * Opens a log file for reading, decompressing {@code .gz} files. Concatenated gzip members (as produced by
   * appending to an existing file) are read as one stream.
   *
   * @param file log file
   * @return UTF-8 reader; caller closes
   * @throws IOException when the file cannot be opened
   */
  public static BufferedReader newReader(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    InputStream in = Files.newInputStream(file);
    try {
      if (file.toString().endsWith(GZIP_SUFFIX)) {
        in = new GZIPInputStream(in, 64 * 1024);
      }
    } catch (IOException ex) {
      in.close();
      throw ex;
    }
    return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
  }
}
