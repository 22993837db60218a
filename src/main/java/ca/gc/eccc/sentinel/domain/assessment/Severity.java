package ca.gc.eccc.sentinel.domain.assessment;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity levels a classifier may assign to an observation, most severe first.
 *
 * @since 0.1.0
 */
public enum Severity {
  CRITICAL("Critical"),
  HIGH("High"),
  MEDIUM("Medium"),
  LOW("Low");

  private final String label;

  Severity(String label) {
    this.label = label;
  }

  /**
   * Returns the human-readable label used in alerts (e.g. {@code High}).
   *
   * @return display label
   */
  public String label() {
    return label;
  }

  /**
   * Parses a classifier label, ignoring case and surrounding whitespace or punctuation.
   *
   * @param raw label as emitted by the classifier; may be {@code null}
   * @return matching severity, or empty when the label is not one of the four levels
   */
  public static Optional<Severity> parse(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    while (!normalized.isEmpty() && !Character.isLetter(normalized.charAt(normalized.length() - 1))) {
      normalized = normalized.substring(0, normalized.length() - 1);
    }
    for (Severity severity : values()) {
      if (severity.label.toLowerCase(Locale.ROOT).equals(normalized)) {
        return Optional.of(severity);
      }
    }
    return Optional.empty();
  }
}
