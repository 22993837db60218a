package ca.gc.eccc.sentinel.validation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * String validation helpers for names, topics and comma-separated lists.
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern TOPIC_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");

  private Strings() {
    // Utility
  }

  /**
   * Trims and rejects blank or control-character values.
   *
   * @param name key used in error messages
   * @param value candidate value
   * @return trimmed value
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    // trim() strips leading and trailing control characters, so check the raw value
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a Kafka topic name.
   *
   * @param name key used in error messages
   * @param topic candidate topic
   * @return sanitized topic
   */
  public static String sanitizeTopic(String name, String topic) {
    String sanitized = requireNonBlank(name, topic);
    if (!TOPIC_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Validates an identifier that is also used as a file name (approval request ids, incident ids).
   *
   * @param name key used in error messages
   * @param value candidate identifier
   * @return sanitized identifier
   */
  public static String requireIdentifier(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!IDENTIFIER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must start with a letter or digit and contain only letters, digits, dot, underscore, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Splits a comma-separated list, trimming entries and dropping blanks and duplicates.
   *
   * @param name key used in error messages
   * @param value comma-separated text; may be {@code null}
   * @return distinct entries in input order; empty when {@code value} is {@code null} or blank
   */
  public static List<String> splitList(String name, String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    Set<String> entries = new LinkedHashSet<>();
    for (String part : value.split(",")) {
      String trimmed = part.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      if (containsControl(trimmed)) {
        throw new IllegalArgumentException(message(name, "must not contain control characters"));
      }
      entries.add(trimmed);
    }
    return List.copyOf(new ArrayList<>(entries));
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
