package ca.gc.eccc.sentinel.logging;

/**
 * Formatting helpers for free text that ends up in log lines (rationales, plans, operator input).
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Collapses line breaks and truncates to at most {@code maxChars} characters.
   *
   * @param value text to format; may be {@code null}
   * @param maxChars maximum characters kept; must be positive
   * @return single-line text with a truncation marker when shortened
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    String oneLine = oneLine(value);
    if (oneLine.length() <= maxChars) {
      return oneLine;
    }
    int cut = maxChars;
    if (Character.isHighSurrogate(oneLine.charAt(cut - 1))) {
      cut--;
    }
    return oneLine.substring(0, cut) + "... (truncated, " + cut + " of " + oneLine.length() + ")";
  }

  /**
   * Replaces CR/LF runs with a single space so log lines cannot be forged.
   *
   * @param value text; may be {@code null}
   * @return single-line text
   */
  public static String oneLine(String value) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    StringBuilder sb = new StringBuilder(value.length());
    boolean lastBreak = false;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c == '\r' || c == '\n') {
        if (!lastBreak) {
          sb.append(' ');
        }
        lastBreak = true;
      } else {
        sb.append(c);
        lastBreak = false;
      }
    }
    return sb.toString().trim();
  }
}
