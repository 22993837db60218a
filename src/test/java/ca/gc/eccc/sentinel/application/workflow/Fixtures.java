package ca.gc.eccc.sentinel.application.workflow;

import ca.gc.eccc.sentinel.domain.assessment.Assessment;
import ca.gc.eccc.sentinel.domain.incident.Incident;
import ca.gc.eccc.sentinel.domain.incident.IncidentId;
import ca.gc.eccc.sentinel.domain.observation.Observation;
import java.time.Instant;
import java.util.Map;

final class Fixtures {
  static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

  private Fixtures() {}

  /** Stormy reading: 20 m/s wind, 88% humidity, 1006 hPa. */
  static Observation stormObservation(String location) {
    return new Observation(location, T0, 12.5, 20.0, 88.0, 1006.0, 4.2, 90.0, "heavy rain", Map.of());
  }

  static Assessment assessment(String disasterType, String severityLabel, String location) {
    return Assessment.fromLabel(disasterType, severityLabel, "test rationale", stormObservation(location));
  }

  static Incident incident(String location) {
    return Incident.start(IncidentId.of(location, 1, T0), location, 1, T0);
  }
}
