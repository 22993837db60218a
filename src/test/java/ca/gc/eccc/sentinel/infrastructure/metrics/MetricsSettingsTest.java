package ca.gc.eccc.sentinel.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class MetricsSettingsTest {

  @Test
  void exporterParsingIsCaseInsensitiveAndDefaultsToOtlp() {
    assertEquals(MetricsSettings.Exporter.OTLP, MetricsSettings.Exporter.parse(""));
    assertEquals(MetricsSettings.Exporter.NONE, MetricsSettings.Exporter.parse(" NONE "));
    assertThrows(IllegalArgumentException.class, () -> MetricsSettings.Exporter.parse("prometheus"));
  }

  @Test
  void blankValuesFallBackToDefaults() {
    MetricsSettings settings = new MetricsSettings(MetricsSettings.Exporter.OTLP, " ", null, null);

    assertEquals(MetricsSettings.DEFAULT_ENDPOINT, settings.endpoint());
    assertEquals("", settings.resourceAttributes());
    assertEquals(Duration.ofSeconds(30), settings.exportInterval());
  }
}
