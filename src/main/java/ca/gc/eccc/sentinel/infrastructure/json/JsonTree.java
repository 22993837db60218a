package ca.gc.eccc.sentinel.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Streams a JSON document into plain {@link Map}/{@link List} structures and reads values by dotted path.
 *
 * <p>Used for observation snapshots and audit log lines; both are small documents.</p>
 *
 * @since 0.1.0
 */
public final class JsonTree {
  private final JsonFactory factory;

  public JsonTree(JsonFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  public JsonTree() {
    this(new JsonFactory());
  }

  /**
   * Parses one JSON document.
   *
   * @param json document text
   * @return parsed value (map, list, string, number, boolean or {@code null})
   * @throws IllegalArgumentException when the text is not a single valid JSON document
   */
  public Object parse(String json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new IllegalArgumentException("empty JSON document");
      }
      Object value = readValue(parser, token);
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("invalid JSON: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new IllegalArgumentException("unreadable JSON: " + ex.getMessage(), ex);
    }
  }

  /**
   * Parses a document that must be a JSON object.
   *
   * @param json document text
   * @return top-level object
   */
  @SuppressWarnings("unchecked")
  public Map<String, Object> parseObject(String json) {
    Object value = parse(json);
    if (!(value instanceof Map)) {
      throw new IllegalArgumentException("expected a JSON object");
    }
    return (Map<String, Object>) value;
  }

  /**
   * Reads a value by dotted path; a numeric segment indexes into an array.
   *
   * @param root parsed document
   * @param path dotted path such as {@code weather.0.description}
   * @return value when present and not {@code null}
   */
  public static Optional<Object> read(Object root, String path) {
    Object current = root;
    for (String segment : path.split("\\.")) {
      if (current instanceof Map<?, ?> map) {
        current = map.get(segment);
      } else if (current instanceof List<?> list) {
        int index;
        try {
          index = Integer.parseInt(segment);
        } catch (NumberFormatException ex) {
          return Optional.empty();
        }
        current = index >= 0 && index < list.size() ? list.get(index) : null;
      } else {
        return Optional.empty();
      }
      if (current == null) {
        return Optional.empty();
      }
    }
    return Optional.of(current);
  }

  /**
   * Reads a number by dotted path.
   *
   * @param root parsed document
   * @param path dotted path
   * @return numeric value, or {@link Double#NaN} when absent or not numeric
   */
  public static double readDouble(Object root, String path) {
    Optional<Object> value = read(root, path);
    if (value.isPresent() && value.get() instanceof Number number) {
      return number.doubleValue();
    }
    if (value.isPresent() && value.get() instanceof String text) {
      try {
        return Double.parseDouble(text.trim());
      } catch (NumberFormatException ex) {
        return Double.NaN;
      }
    }
    return Double.NaN;
  }

  /**
   * Reads a value by dotted path as text.
   *
   * @param root parsed document
   * @param path dotted path
   * @return text form of scalar values
   */
  public static Optional<String> readText(Object root, String path) {
    return read(root, path)
        .filter(v -> !(v instanceof Map) && !(v instanceof List))
        .map(String::valueOf);
  }

  /**
   * Flattens scalar leaves into dotted keys.
   *
   * @param root parsed document
   * @return flattened map in document order
   */
  public static Map<String, String> flatten(Object root) {
    Map<String, String> out = new LinkedHashMap<>();
    flatten("", root, out);
    return out;
  }

  private static void flatten(String prefix, Object node, Map<String, String> out) {
    if (node instanceof Map<?, ?> map) {
      map.forEach((k, v) -> flatten(prefix.isEmpty() ? String.valueOf(k) : prefix + "." + k, v, out));
    } else if (node instanceof List<?> list) {
      for (int i = 0; i < list.size(); i++) {
        flatten(prefix.isEmpty() ? Integer.toString(i) : prefix + "." + i, list.get(i), out);
      }
    } else if (node != null && !prefix.isEmpty()) {
      out.put(prefix, String.valueOf(node));
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("expected field name but found " + token);
      }
      String fieldName = parser.currentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }
}
