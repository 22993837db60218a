package ca.gc.eccc.sentinel.infrastructure.observation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.eccc.sentinel.application.port.ObservationException;
import ca.gc.eccc.sentinel.domain.observation.Observation;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileObservationSourceTest {
  private static final long NOW = Instant.parse("2026-03-01T12:00:00Z").toEpochMilli();

  @TempDir Path dir;

  @Test
  void readsProviderDocumentBySlug() throws Exception {
    Files.writeString(dir.resolve("new-york.json"), """
        {"dt": 1772366400,
         "weather": [{"description": "heavy intensity rain"}],
         "main": {"temp": 14.2, "humidity": 88, "pressure": 1006},
         "wind": {"speed": 20.0},
         "clouds": {"all": 90},
         "rain": {"1h": 12.5},
         "snow": {"1h": 0.5}}
        """, StandardCharsets.UTF_8);
    FileObservationSource source = new FileObservationSource(dir, () -> NOW);

    Observation observation = source.fetch("New York", Duration.ofSeconds(1));

    assertEquals("New York", observation.location());
    assertEquals(Instant.ofEpochSecond(1772366400L), observation.observedAt());
    assertEquals(14.2, observation.temperatureCelsius(), 1e-9);
    assertEquals(20.0, observation.windSpeedMetersPerSecond(), 1e-9);
    assertEquals(88.0, observation.humidityPercent(), 1e-9);
    assertEquals(1006.0, observation.pressureHectopascals(), 1e-9);
    assertEquals(13.0, observation.precipitationMillimetres(), 1e-9);
    assertEquals(90.0, observation.cloudCoverPercent(), 1e-9);
    assertEquals("heavy intensity rain", observation.conditions());
    assertEquals("20.0", observation.rawPayload().get("wind.speed"));
  }

  @Test
  void missingReadingsBecomeNaNAndTimestampFallsBackToClock() throws Exception {
    Files.writeString(dir.resolve("toronto.json"), "{\"main\": {\"temp\": 3}}", StandardCharsets.UTF_8);
    FileObservationSource source = new FileObservationSource(dir, () -> NOW);

    Observation observation = source.fetch("Toronto", Duration.ofSeconds(1));

    assertEquals(Instant.ofEpochMilli(NOW), observation.observedAt());
    assertTrue(Double.isNaN(observation.windSpeedMetersPerSecond()));
    assertTrue(Double.isNaN(observation.precipitationMillimetres()));
    assertEquals("", observation.conditions());
  }

  @Test
  void missingFileIsTerminalNotFound() {
    FileObservationSource source = new FileObservationSource(dir, () -> NOW);

    ObservationException ex =
        assertThrows(ObservationException.class, () -> source.fetch("Atlantis", Duration.ofSeconds(1)));
    assertEquals(ObservationException.Reason.NOT_FOUND, ex.reason());
    assertFalse(ex.isTransient());
  }

  @Test
  void malformedDocumentIsTransientProviderError() throws Exception {
    Files.writeString(dir.resolve("ottawa.json"), "{not json", StandardCharsets.UTF_8);
    FileObservationSource source = new FileObservationSource(dir, () -> NOW);

    ObservationException ex =
        assertThrows(ObservationException.class, () -> source.fetch("Ottawa", Duration.ofSeconds(1)));
    assertEquals(ObservationException.Reason.PROVIDER_ERROR, ex.reason());
    assertTrue(ex.isTransient());
  }
}
