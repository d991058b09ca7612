package ca.gc.cra.trail.domain.events;

import java.util.Map;

/**
 * Payload recording a file created, modified, deleted, renamed, or read by an agent.
 *
 * @param agent agent performing the operation
 * @param operation kind of operation
 * @param filePath affected path
 * @param fileSizeBytes size of the file after the operation
 * @param linesChanged number of changed lines
 * @param diff unified diff of the change
 * @param gitHashBefore repository revision before the change
 * @param gitHashAfter repository revision after the change
 * @param language programming language of the file
 * @since 0.1.0
 */
public record FileOperation(
    String agent,
    FileOperationType operation,
    String filePath,
    Long fileSizeBytes,
    Integer linesChanged,
    String diff,
    String gitHashBefore,
    String gitHashAfter,
    String language) implements EventPayload {

  public static FileOperation of(String agent, FileOperationType operation, String filePath) {
    return new FileOperation(agent, operation, filePath, null, null, null, null, null, null);
  }

  public FileOperation withSize(Long newFileSizeBytes, Integer newLinesChanged) {
    return new FileOperation(
        agent, operation, filePath, newFileSizeBytes, newLinesChanged, diff, gitHashBefore, gitHashAfter, language);
  }

  public FileOperation withDiff(String newDiff) {
    return new FileOperation(
        agent, operation, filePath, fileSizeBytes, linesChanged, newDiff, gitHashBefore, gitHashAfter, language);
  }

  public FileOperation withGitHashes(String before, String after) {
    return new FileOperation(
        agent, operation, filePath, fileSizeBytes, linesChanged, diff, before, after, language);
  }

  public FileOperation withLanguage(String newLanguage) {
    return new FileOperation(
        agent, operation, filePath, fileSizeBytes, linesChanged, diff, gitHashBefore, gitHashAfter, newLanguage);
  }

  @Override
  public EventType type() {
    return EventType.FILE_OPERATION;
  }

  @Override
  public Map<String, Object> fields() {
    return new PayloadFields()
        .put("agent", agent)
        .put("operation", operation == null ? null : operation.wireName())
        .put("file_path", filePath)
        .put("file_size_bytes", fileSizeBytes)
        .put("lines_changed", linesChanged)
        .put("diff", diff)
        .put("git_hash_before", gitHashBefore)
        .put("git_hash_after", gitHashAfter)
        .put("language", language)
        .build();
  }
}
