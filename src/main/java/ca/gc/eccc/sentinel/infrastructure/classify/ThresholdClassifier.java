package ca.gc.eccc.sentinel.infrastructure.classify;

import ca.gc.eccc.sentinel.application.port.ClassificationException;
import ca.gc.eccc.sentinel.application.port.Classifier;
import ca.gc.eccc.sentinel.domain.assessment.Assessment;
import ca.gc.eccc.sentinel.domain.assessment.Severity;
import ca.gc.eccc.sentinel.domain.observation.Observation;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Rule-based {@link Classifier} using fixed meteorological thresholds.
 *
 * <p>Every rule that fires proposes a disaster type and severity; the most severe proposal wins, ties
 * going to the earlier rule. Rule order: Hurricane, Flood, Severe Storm, Winter Storm, Heatwave. When
 * nothing fires the result is {@code No Immediate Threat} at Low severity.</p>
 *
 * <table>
 *   <caption>Thresholds</caption>
 *   <tr><th>Type</th><th>Critical</th><th>High</th><th>Medium</th><th>Low</th></tr>
 *   <tr><td>Hurricane</td><td>wind &ge; 33 m/s, or wind &ge; 28 m/s below 980 hPa</td><td></td><td></td><td></td></tr>
 *   <tr><td>Flood</td><td>&ge; 50 mm/h</td><td>&ge; 30 mm/h</td><td>&ge; 15 mm/h</td><td>&ge; 7.5 mm/h</td></tr>
 *   <tr><td>Severe Storm</td><td>wind &ge; 28 m/s</td><td>wind &ge; 20 m/s</td><td>wind &ge; 17 m/s, or &ge; 14 m/s
 *   with humidity &ge; 85% below 1005 hPa</td><td>wind &ge; 11 m/s</td></tr>
 *   <tr><td>Winter Storm</td><td></td><td>&le; 0 &deg;C with wind &ge; 17 m/s and precipitation &ge; 5 mm/h</td>
 *   <td>&le; 0 &deg;C with precipitation &ge; 5 mm/h or wind &ge; 14 m/s</td><td></td></tr>
 *   <tr><td>Heatwave</td><td>&ge; 45 &deg;C</td><td>&ge; 40 &deg;C</td><td>&ge; 35 &deg;C</td><td>&ge; 32 &deg;C</td></tr>
 * </table>
 *
 * @since 0.1.0
 */
public final class ThresholdClassifier implements Classifier {
  static final String HURRICANE = "Hurricane";
  static final String FLOOD = "Flood";
  static final String SEVERE_STORM = "Severe Storm";
  static final String WINTER_STORM = "Winter Storm";
  static final String HEATWAVE = "Heatwave";
  static final String NO_THREAT = "No Immediate Threat";

  private record Proposal(String type, Severity severity, String rationale) {}

  @Override
  public Assessment classify(Observation observation, Duration timeout) throws ClassificationException {
    double wind = observation.windSpeedMetersPerSecond();
    double rain = observation.precipitationMillimetres();
    double temp = observation.temperatureCelsius();
    double pressure = observation.pressureHectopascals();
    double humidity = observation.humidityPercent();
    if (!Observation.reported(wind) && !Observation.reported(rain) && !Observation.reported(temp)) {
      throw new ClassificationException(ClassificationException.Reason.MALFORMED_OUTPUT,
          "observation for " + observation.location() + " carries no wind, precipitation or temperature reading");
    }

    List<Proposal> proposals = new ArrayList<>();
    hurricane(wind, pressure, proposals);
    flood(rain, proposals);
    severeStorm(wind, humidity, pressure, proposals);
    winterStorm(temp, wind, rain, proposals);
    heatwave(temp, proposals);

    Proposal winner = proposals.stream()
        .min(Comparator.comparingInt(p -> p.severity().ordinal()))
        .orElseGet(() -> new Proposal(NO_THREAT, Severity.LOW,
            "Readings are within normal ranges (" + summary(observation) + ")."));
    return Assessment.fromLabel(winner.type(), winner.severity().label(), winner.rationale(), observation);
  }

  private static void hurricane(double wind, double pressure, List<Proposal> out) {
    if (wind >= 33d || (wind >= 28d && pressure < 980d)) {
      out.add(new Proposal(HURRICANE, Severity.CRITICAL,
          "Sustained wind " + fmt(wind) + " m/s" + (pressure < 980d ? " with central pressure " + fmt(pressure) + " hPa" : "")
              + " reaches hurricane force."));
    }
  }

  private static void flood(double rain, List<Proposal> out) {
    Severity severity = rain >= 50d ? Severity.CRITICAL
        : rain >= 30d ? Severity.HIGH
        : rain >= 15d ? Severity.MEDIUM
        : rain >= 7.5d ? Severity.LOW
        : null;
    if (severity != null) {
      out.add(new Proposal(FLOOD, severity,
          "Precipitation of " + fmt(rain) + " mm in the last hour risks flooding."));
    }
  }

  private static void severeStorm(double wind, double humidity, double pressure, List<Proposal> out) {
    boolean moistLow = humidity >= 85d && pressure < 1005d;
    Severity severity = wind >= 28d ? Severity.CRITICAL
        : wind >= 20d ? Severity.HIGH
        : wind >= 17d || (wind >= 14d && moistLow) ? Severity.MEDIUM
        : wind >= 11d ? Severity.LOW
        : null;
    if (severity != null) {
      StringBuilder rationale = new StringBuilder("Sustained wind ").append(fmt(wind)).append(" m/s");
      if (Observation.reported(humidity)) {
        rationale.append(" with humidity ").append(fmt(humidity)).append('%');
      }
      if (Observation.reported(pressure)) {
        rationale.append(" and pressure ").append(fmt(pressure)).append(" hPa");
      }
      rationale.append(" indicates a severe storm.");
      out.add(new Proposal(SEVERE_STORM, severity, rationale.toString()));
    }
  }

  private static void winterStorm(double temp, double wind, double rain, List<Proposal> out) {
    if (!(temp <= 0d)) {
      return;
    }
    boolean heavy = rain >= 5d;
    Severity severity = heavy && wind >= 17d ? Severity.HIGH
        : heavy || wind >= 14d ? Severity.MEDIUM
        : null;
    if (severity != null) {
      out.add(new Proposal(WINTER_STORM, severity,
          "Temperature " + fmt(temp) + " °C with wind " + fmt(wind) + " m/s and precipitation "
              + fmt(rain) + " mm indicates a winter storm."));
    }
  }

  private static void heatwave(double temp, List<Proposal> out) {
    Severity severity = temp >= 45d ? Severity.CRITICAL
        : temp >= 40d ? Severity.HIGH
        : temp >= 35d ? Severity.MEDIUM
        : temp >= 32d ? Severity.LOW
        : null;
    if (severity != null) {
      out.add(new Proposal(HEATWAVE, severity, "Temperature of " + fmt(temp) + " °C indicates extreme heat."));
    }
  }

  private static String summary(Observation o) {
    return "wind " + fmt(o.windSpeedMetersPerSecond()) + " m/s, temperature " + fmt(o.temperatureCelsius())
        + " °C, precipitation " + fmt(o.precipitationMillimetres()) + " mm";
  }

  private static String fmt(double value) {
    if (!Observation.reported(value)) {
      return "N/A";
    }
    return value == Math.rint(value) ? Long.toString((long) value) : String.format(Locale.ROOT, "%.1f", value);
  }
}
