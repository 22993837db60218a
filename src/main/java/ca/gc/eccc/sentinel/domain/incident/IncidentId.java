package ca.gc.eccc.sentinel.domain.incident;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Identifier of one incident: one monitored location in one polling cycle.
 *
 * <p>The value is filesystem and Kafka-key safe: {@code <location-slug>-<cycle>-<epochMillis>}.</p>
 *
 * @param value canonical identifier text; never blank
 * @since 0.1.0
 */
public record IncidentId(String value) {

  /**
   * Validates the identifier text.
   */
  public IncidentId {
    value = Objects.requireNonNull(value, "value").trim();
    if (value.isEmpty()) {
      throw new IllegalArgumentException("incident id must not be blank");
    }
  }

  /**
   * Derives the identifier for a location within a polling cycle.
   *
   * @param location monitored location name
   * @param cycle polling cycle number (starting at 1)
   * @param cycleStartedAt instant the cycle started
   * @return incident identifier
   */
  public static IncidentId of(String location, long cycle, Instant cycleStartedAt) {
    Objects.requireNonNull(location, "location");
    Objects.requireNonNull(cycleStartedAt, "cycleStartedAt");
    return new IncidentId(slug(location) + "-" + cycle + "-" + cycleStartedAt.toEpochMilli());
  }

  /**
   * Converts a location name into a lower-case, dash-separated token.
   *
   * @param location location name
   * @return slug; {@code location} when nothing usable remains
   */
  public static String slug(String location) {
    String lower = location.trim().toLowerCase(Locale.ROOT);
    StringBuilder sb = new StringBuilder(lower.length());
    boolean lastDash = false;
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
        sb.append(c);
        lastDash = false;
      } else if (!lastDash && sb.length() > 0) {
        sb.append('-');
        lastDash = true;
      }
    }
    if (lastDash) {
      sb.setLength(sb.length() - 1);
    }
    return sb.length() == 0 ? "location" : sb.toString();
  }

  @Override
  public String toString() {
    return value;
  }
}
