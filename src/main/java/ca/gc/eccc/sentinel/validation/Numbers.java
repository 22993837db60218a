package ca.gc.eccc.sentinel.validation;

/**
 * Numeric parsing and range checks for configuration values.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  public static double requireRange(String name, double value, double min, double max) {
    if (Double.isNaN(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a long and checks its range.
   *
   * @param name key used in error messages
   * @param raw text value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return parsed value
   */
  public static long parseLong(String name, String raw, long min, long max) {
    try {
      return requireRange(name, Long.parseLong(raw.trim()), min, max);
    } catch (NumberFormatException | NullPointerException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + raw + ")", ex);
    }
  }

  /**
   * Parses a double and checks its range.
   *
   * @param name key used in error messages
   * @param raw text value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return parsed value
   */
  public static double parseDouble(String name, String raw, double min, double max) {
    try {
      return requireRange(name, Double.parseDouble(raw.trim()), min, max);
    } catch (NumberFormatException | NullPointerException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was " + raw + ")", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
