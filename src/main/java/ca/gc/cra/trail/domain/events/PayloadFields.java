package ca.gc.cra.trail.domain.events;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered field collector used by payload records. Absent ({@code null}) values are skipped so the
 * persisted object never carries {@code "field": null} for optional data.
 */
final class PayloadFields {
  private final Map<String, Object> fields = new LinkedHashMap<>();

  PayloadFields put(String name, Object value) {
    if (value != null) {
      fields.put(name, value);
    }
    return this;
  }

  Map<String, Object> build() {
    return Collections.unmodifiableMap(fields);
  }

  @SuppressWarnings("unchecked")
  static <T> List<T> copyList(List<T> source) {
    if (source == null) {
      return null;
    }
    return (List<T>) freeze(source);
  }

  @SuppressWarnings("unchecked")
  static <V> Map<String, V> copyMap(Map<String, V> source) {
    if (source == null) {
      return null;
    }
    return (Map<String, V>) freeze(source);
  }

  /**
   * Copies nested maps, collections and arrays into unmodifiable structures so a payload never shares mutable state
   * with its caller. Arrays become lists. Leaf values are kept as given.
   */
  private static Object freeze(Object value) {
    if (value instanceof Map<?, ?> map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      map.forEach((key, nested) -> copy.put(key, freeze(nested)));
      return Collections.unmodifiableMap(copy);
    }
    if (value instanceof Collection<?> collection) {
      List<Object> copy = new ArrayList<>(collection.size());
      for (Object nested : collection) {
        copy.add(freeze(nested));
      }
      return Collections.unmodifiableList(copy);
    }
    if (value != null && value.getClass().isArray()) {
      int length = Array.getLength(value);
      List<Object> copy = new ArrayList<>(length);
      for (int i = 0; i < length; i++) {
        copy.add(freeze(Array.get(value, i)));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }
}
