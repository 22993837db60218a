package ca.gc.eccc.sentinel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEqualsAndKeepsDottedKeys() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "locations=Ottawa,Halifax", " retry.maxRetries = 5 ", "otelResourceAttributes=env=test", ""});

    assertEquals(List.of("locations", "retry.maxRetries", "otelResourceAttributes"), List.copyOf(map.keySet()));
    assertEquals("5", map.get("retry.maxRetries"));
    assertEquals("env=test", map.get("otelResourceAttributes"));
  }

  @Test
  void repeatedKeyKeepsLastValue() {
    assertEquals("2", CliArgsParser.toMap(new String[] {"cycles=1", "cycles=2"}).get("cycles"));
  }

  @Test
  void nullArgsGiveEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMissingValueOrBadKey() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"cycles="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"cycles"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"cy cles=1"}));
  }
}
