package ca.gc.eccc.sentinel.application.workflow;

import ca.gc.eccc.sentinel.domain.incident.IncidentState;
import java.util.Map;

/**
 * Totals reported when a monitoring run ends.
 *
 * @param cyclesRun polling cycles started
 * @param incidentsStarted incidents started across all cycles
 * @param finalStates incident count per state observed when the run ended
 * @param stoppedEarly {@code true} when the run was cancelled before its cycle budget was spent
 * @since 0.1.0
 */
public record MonitoringSummary(
    long cyclesRun, long incidentsStarted, Map<IncidentState, Long> finalStates, boolean stoppedEarly) {

  public MonitoringSummary {
    finalStates = Map.copyOf(finalStates);
  }

  public long count(IncidentState state) {
    return finalStates.getOrDefault(state, 0L);
  }
}
