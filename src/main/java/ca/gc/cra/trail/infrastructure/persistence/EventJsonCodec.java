package ca.gc.cra.trail.infrastructure.persistence;

import ca.gc.cra.trail.domain.events.ActivityEvent;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Streaming JSON codec for activity events: one flat JSON object per event, no line breaks.
 *
 * <p>Encoding walks {@link ActivityEvent#toFields()} with a {@link JsonGenerator}, so field order on disk matches the
 * event's field order. Decoding reads one line back into an ordered map of maps, lists, and primitives.</p>
 *
 * <p>Thread-safe; the underlying {@link JsonFactory} is shared.</p>
 *
 * @since 0.1.0
 */
public final class EventJsonCodec {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Encodes an event as a single-line JSON object.
   *
   * @param event event to encode
   * @return JSON text without a trailing newline
   * @throws IllegalArgumentException when a payload value cannot be encoded
   */
  public String encode(ActivityEvent event) {
    Objects.requireNonNull(event, "event");
    return encode(event.toFields());
  }

  /**
   * Encodes an ordered field map as a single-line JSON object.
   *
   * @param fields field map; {@code null} values are written as JSON {@code null}
   * @return JSON text without a trailing newline
   */
  public String encode(Map<String, ?> fields) {
    Objects.requireNonNull(fields, "fields");
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      writeObject(gen, fields);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Unable to encode event fields", ex);
    }
    return out.toString();
  }

  /**
   * Decodes one persisted line.
   *
   * @param line JSON text of one event
   * @return ordered field map
   * @throws IllegalArgumentException when the line is not a single JSON object
   */
  public Map<String, Object> decode(String line) {
    Objects.requireNonNull(line, "line");
    try (JsonParser parser = factory.createParser(line)) {
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("Expected a JSON object but found " + token);
      }
      Map<String, Object> value = readObject(parser);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON line contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON line", ex);
    }
  }

  private void writeObject(JsonGenerator gen, Map<?, ?> map) throws IOException {
    gen.writeStartObject();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      gen.writeFieldName(String.valueOf(entry.getKey()));
      writeValue(gen, entry.getValue());
    }
    gen.writeEndObject();
  }

  private void writeValue(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof String s) {
      gen.writeString(s);
    } else if (value instanceof Boolean b) {
      gen.writeBoolean(b);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof Double d) {
      writeFloating(gen, d);
    } else if (value instanceof Float f) {
      writeFloating(gen, f.doubleValue());
    } else if (value instanceof BigInteger bi) {
      gen.writeNumber(bi);
    } else if (value instanceof BigDecimal bd) {
      gen.writeNumber(bd);
    } else if (value instanceof Map<?, ?> map) {
      writeObject(gen, map);
    } else if (value instanceof Iterable<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else if (value instanceof Object[] array) {
      gen.writeStartArray();
      for (Object item : array) {
        writeValue(gen, item);
      }
      gen.writeEndArray();
    } else if (value instanceof Enum<?> e) {
      gen.writeString(e.name().toLowerCase(Locale.ROOT));
    } else {
      // Instants, paths and other host objects are recorded by their string form.
      gen.writeString(String.valueOf(value));
    }
  }

  private static void writeFloating(JsonGenerator gen, double value) throws IOException {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      gen.writeNull();
    } else {
      gen.writeNumber(value);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT -> parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER
          ? parser.getBigIntegerValue()
          : parser.getLongValue();
      case VALUE_NUMBER_FLOAT -> parser.getDoubleValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
