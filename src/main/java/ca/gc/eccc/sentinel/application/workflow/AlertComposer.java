package ca.gc.eccc.sentinel.application.workflow;

import ca.gc.eccc.sentinel.domain.alert.AlertMessage;
import ca.gc.eccc.sentinel.domain.alert.ResponsePlan;
import ca.gc.eccc.sentinel.domain.approval.ApprovalResolution;
import ca.gc.eccc.sentinel.domain.assessment.Assessment;
import ca.gc.eccc.sentinel.domain.assessment.Severity;
import ca.gc.eccc.sentinel.domain.incident.Incident;
import ca.gc.eccc.sentinel.domain.observation.Observation;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Formats the rationale-enriched alert dispatched for a classified incident.
 *
 * @since 0.1.0
 */
public final class AlertComposer {
  static final String NOT_AVAILABLE = "N/A";
  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'", Locale.ROOT).withZone(ZoneOffset.UTC);

  private final List<String> recipients;

  public AlertComposer(List<String> recipients) {
    this.recipients = List.copyOf(Objects.requireNonNull(recipients, "recipients"));
  }

  /**
   * Builds the alert for a classified incident.
   *
   * @param incident incident with observation and assessment set
   * @param generatedAt instant quoted in the footer
   * @return alert message
   * @throws IllegalStateException when the incident has not been classified
   */
  public AlertMessage compose(Incident incident, Instant generatedAt) {
    Assessment assessment = incident.assessment();
    if (assessment == null) {
      throw new IllegalStateException("incident " + incident.id() + " has no assessment");
    }
    return new AlertMessage(
        incident.id().value(), recipients, subject(assessment.severity(), incident.location()),
        body(incident, assessment, generatedAt));
  }

  static String subject(Severity severity, String location) {
    return "Weather Alert: " + severity.label() + " severity weather event in " + location;
  }

  private static String body(Incident incident, Assessment assessment, Instant generatedAt) {
    Observation obs = assessment.observation();
    StringBuilder sb = new StringBuilder(512);
    sb.append("Weather Report for ").append(incident.location()).append("\n\n");
    sb.append("Current Weather Conditions:\n");
    sb.append("- Weather Description: ")
        .append(obs.conditions().isEmpty() ? NOT_AVAILABLE : obs.conditions()).append('\n');
    sb.append("- Temperature: ").append(format(obs.temperatureCelsius())).append("°C\n");
    sb.append("- Wind Speed: ").append(format(obs.windSpeedMetersPerSecond())).append(" m/s\n");
    sb.append("- Humidity: ").append(format(obs.humidityPercent())).append("%\n");
    sb.append("- Pressure: ").append(format(obs.pressureHectopascals())).append(" hPa\n");
    sb.append("- Precipitation: ").append(format(obs.precipitationMillimetres())).append(" mm\n");
    sb.append("- Cloud Cover: ").append(format(obs.cloudCoverPercent())).append("%\n\n");

    sb.append("Disaster Type: ").append(assessment.disasterType()).append('\n');
    sb.append("Severity Level: ").append(assessment.severity().label()).append('\n');
    if (!assessment.rationale().isEmpty()) {
      sb.append("Rationale: ").append(assessment.rationale()).append('\n');
    }
    if (incident.department() != null) {
      sb.append("Responsible Department: ").append(incident.department().displayName()).append('\n');
    }
    ResponsePlan plan = incident.plan();
    sb.append("\nResponse Plan:\n")
        .append(plan == null ? ResponsePlan.UNAVAILABLE_TEXT : plan.text()).append("\n\n");

    sb.append("This is an automated weather report generated at ")
        .append(TIMESTAMP.format(generatedAt));
    Severity severity = assessment.severity();
    boolean approved = incident.approvalRequest()
        .map(r -> r.resolution() == ApprovalResolution.APPROVED).orElse(false);
    if (approved && (severity == Severity.MEDIUM || severity == Severity.LOW)) {
      sb.append("\nNote: This low/medium severity alert has been verified by a human operator.");
    }
    return sb.toString();
  }

  static String format(double value) {
    if (!Observation.reported(value)) {
      return NOT_AVAILABLE;
    }
    if (value == Math.rint(value)) {
      return Long.toString((long) value);
    }
    return String.format(Locale.ROOT, "%.1f", value);
  }
}
