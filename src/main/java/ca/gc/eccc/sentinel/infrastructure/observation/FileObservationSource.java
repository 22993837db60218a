package ca.gc.eccc.sentinel.infrastructure.observation;

import ca.gc.eccc.sentinel.application.port.ClockPort;
import ca.gc.eccc.sentinel.application.port.ObservationException;
import ca.gc.eccc.sentinel.application.port.ObservationSource;
import ca.gc.eccc.sentinel.domain.incident.IncidentId;
import ca.gc.eccc.sentinel.domain.observation.Observation;
import ca.gc.eccc.sentinel.infrastructure.json.JsonTree;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ObservationSource} reading the latest weather snapshot per location from a
 * directory of JSON files.
 * <p><strong>Why:</strong> Decouples the engine from any live provider; an external fetcher (or an operator)
 * drops provider responses into the directory.</p>
 * <p><strong>Format:</strong> current-weather documents shaped like
 * {@code {"dt":..., "weather":[{"description":...}], "main":{"temp","humidity","pressure"},
 * "wind":{"speed"}, "clouds":{"all"}, "rain":{"1h"}}} in metric units. Missing readings become
 * {@link Double#NaN}. The file is {@code <slug>.json} (e.g. {@code new-york.json}), falling back to
 * {@code <location>.json}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable configuration.</p>
 *
 * @since 0.1.0
 */
public final class FileObservationSource implements ObservationSource {
  private static final Logger log = LoggerFactory.getLogger(FileObservationSource.class);

  private final Path directory;
  private final JsonTree json;
  private final ClockPort clock;

  public FileObservationSource(Path directory, ClockPort clock) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.json = new JsonTree();
  }

  @Override
  public Observation fetch(String location, Duration timeout) throws ObservationException {
    Path file = resolve(location);
    String text;
    try {
      text = Files.readString(file, StandardCharsets.UTF_8);
    } catch (NoSuchFileException ex) {
      throw new ObservationException(ObservationException.Reason.NOT_FOUND,
          "no observation for " + location + " (" + file.getFileName() + ")", ex);
    } catch (IOException ex) {
      throw new ObservationException(ObservationException.Reason.PROVIDER_ERROR,
          "unable to read " + file + ": " + ex.getMessage(), ex);
    }
    try {
      Observation observation = toObservation(location, json.parseObject(text));
      log.debug("Loaded observation for {} from {}", location, file);
      return observation;
    } catch (IllegalArgumentException ex) {
      throw new ObservationException(ObservationException.Reason.PROVIDER_ERROR,
          "malformed observation in " + file.getFileName() + ": " + ex.getMessage(), ex);
    }
  }

  Path resolve(String location) {
    Path bySlug = directory.resolve(IncidentId.slug(location) + ".json");
    if (Files.exists(bySlug)) {
      return bySlug;
    }
    return directory.resolve(location.trim() + ".json");
  }

  private Observation toObservation(String location, Map<String, Object> doc) {
    double dt = JsonTree.readDouble(doc, "dt");
    Instant observedAt = Double.isNaN(dt) ? clock.now() : Instant.ofEpochSecond((long) dt);
    return new Observation(
        location,
        observedAt,
        JsonTree.readDouble(doc, "main.temp"),
        JsonTree.readDouble(doc, "wind.speed"),
        JsonTree.readDouble(doc, "main.humidity"),
        JsonTree.readDouble(doc, "main.pressure"),
        precipitation(doc),
        JsonTree.readDouble(doc, "clouds.all"),
        JsonTree.readText(doc, "weather.0.description").orElse(""),
        JsonTree.flatten(doc));
  }

  private static double precipitation(Map<String, Object> doc) {
    double rain = JsonTree.readDouble(doc, "rain.1h");
    double snow = JsonTree.readDouble(doc, "snow.1h");
    if (Double.isNaN(rain) && Double.isNaN(snow)) {
      return Double.NaN;
    }
    return (Double.isNaN(rain) ? 0d : rain) + (Double.isNaN(snow) ? 0d : snow);
  }
}
