package ca.gc.cra.trail.infrastructure.persistence;

import ca.gc.cra.trail.application.schema.EventSchemaRegistry;
import ca.gc.cra.trail.application.schema.SchemaValidationResult;
import ca.gc.cra.trail.domain.events.EventIds;
import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Replays session log files and checks what was persisted.
 *
 * <p>Every line must decode as a JSON object and satisfy its kind's schema. Across the files of one session, event ids
 * must be unique and gapless from {@code evt_001}, every line must carry the same {@code session_id}, and every
 * {@code parent_event_id} must name an event present in the log. Lines are not required to be in id order: tool usage
 * scopes write their event after their children.</p>
 *
 * @since 0.1.0
 */
public final class SessionLogVerifier {
  private static final int MAX_REPORTED_PROBLEMS = 1_000;

  private final EventSchemaRegistry registry;
  private final EventJsonCodec codec;

  public SessionLogVerifier(EventSchemaRegistry registry, EventJsonCodec codec) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  /**
   * One problem found while verifying.
   *
   * @param file file containing the problem
   * @param line one-based line number, or zero for problems spanning the session
   * @param message description
   */
  public record Problem(Path file, long line, String message) {
    @Override
    public String toString() {
      return line > 0 ? file.getFileName() + ":" + line + ": " + message : file.getFileName() + ": " + message;
    }
  }

  /**
   * Verification outcome.
   *
   * @param lines non-blank lines read
   * @param validEvents lines that decoded and passed schema validation
   * @param sessionId session id found in the first readable line, or {@code null}
   * @param highestSequence largest event sequence seen
   * @param problems problems found, capped at a fixed number
   * @param truncated whether problems beyond the cap were dropped
   */
  public record Report(
      long lines, long validEvents, String sessionId, long highestSequence, List<Problem> problems,
      boolean truncated) {
    public Report {
      problems = List.copyOf(problems);
    }

    public boolean ok() {
      return problems.isEmpty();
    }
  }

  /**
   * Verifies one session spread over one or more files, given in part order.
   *
   * @param files log files of one session
   * @return report
   * @throws IOException when a file cannot be opened
   */
  public Report verify(List<Path> files) throws IOException {
    Objects.requireNonNull(files, "files");
    if (files.isEmpty()) {
      throw new IllegalArgumentException("No log files to verify");
    }
    State state = new State();
    for (Path file : files) {
      verifyFile(file, state);
    }

    Path summaryFile = files.get(0);
    for (long seq = 1; seq <= state.highestSequence && !state.truncated; seq++) {
      if (!state.sequences.contains(seq)) {
        state.problem(summaryFile, 0, "missing event " + EventIds.format(seq, EventIds.DEFAULT_WIDTH));
      }
    }
    for (String parent : state.parents) {
      if (!state.ids.contains(parent)) {
        state.problem(summaryFile, 0, "parent_event_id " + parent + " does not name an event in this session");
      }
    }
    return new Report(
        state.lines, state.valid, state.sessionId, state.highestSequence, state.problems, state.truncated);
  }

  private void verifyFile(Path file, State state) throws IOException {
    try (BufferedReader reader = SessionLogFiles.newReader(file)) {
      long lineNumber = 0;
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        state.lines++;
        verifyLine(file, lineNumber, line, state);
      }
    } catch (EOFException ex) {
      state.problem(file, 0, "compressed stream ends early; the writer was not shut down cleanly");
    }
  }

  private void verifyLine(Path file, long lineNumber, String line, State state) {
    Map<String, Object> fields;
    try {
      fields = codec.decode(line);
    } catch (IllegalArgumentException ex) {
      state.problem(file, lineNumber, "not a JSON object: " + ex.getMessage());
      return;
    }

    SchemaValidationResult result = registry.validate(fields);
    for (String message : result.messages()) {
      state.problem(file, lineNumber, message);
    }
    if (result.valid()) {
      state.valid++;
    }

    if (fields.get("session_id") instanceof String sessionId) {
      if (state.sessionId == null) {
        state.sessionId = sessionId;
      } else if (!state.sessionId.equals(sessionId)) {
        state.problem(file, lineNumber, "session_id " + sessionId + " differs from " + state.sessionId);
      }
    }
    if (fields.get("event_id") instanceof String eventId && EventIds.isWellFormed(eventId)) {
      long sequence = EventIds.sequenceOf(eventId);
      if (!state.sequences.add(sequence)) {
        state.problem(file, lineNumber, "duplicate event_id " + eventId);
      }
      state.ids.add(eventId);
      state.highestSequence = Math.max(state.highestSequence, sequence);
    }
    if (fields.get("parent_event_id") instanceof String parent) {
      state.parents.add(parent);
    }
  }

  private static final class State {
    private final Set<Long> sequences = new HashSet<>();
    private final Set<String> ids = new HashSet<>();
    private final Set<String> parents = new TreeSet<>();
    private final List<Problem> problems = new ArrayList<>();
    private long lines;
    private long valid;
    private long highestSequence;
    private String sessionId;
    private boolean truncated;

    private void problem(Path file, long line, String message) {
      if (problems.size() >= MAX_REPORTED_PROBLEMS) {
        truncated = true;
        return;
      }
      problems.add(new Problem(file, line, message));
    }
  }
}
