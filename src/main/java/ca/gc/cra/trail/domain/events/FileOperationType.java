package ca.gc.cra.trail.domain.events;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of filesystem change recorded by file operation events.
 *
 * @since 0.1.0
 */
public enum FileOperationType {
  CREATE("create"),
  MODIFY("modify"),
  DELETE("delete"),
  RENAME("rename"),
  READ("read");

  private final String wireName;

  FileOperationType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public static Optional<FileOperationType> fromWire(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (FileOperationType type : values()) {
      if (type.wireName.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
