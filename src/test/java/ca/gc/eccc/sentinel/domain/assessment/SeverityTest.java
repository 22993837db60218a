package ca.gc.eccc.sentinel.domain.assessment;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class SeverityTest {

  @Test
  void parseIgnoresCaseWhitespaceAndTrailingPunctuation() {
    assertEquals(Optional.of(Severity.HIGH), Severity.parse("  high. "));
    assertEquals(Optional.of(Severity.CRITICAL), Severity.parse("CRITICAL"));
    assertEquals(Optional.of(Severity.LOW), Severity.parse("Low!"));
  }

  @Test
  void unknownLabelsAreEmpty() {
    assertEquals(Optional.empty(), Severity.parse("Severe"));
    assertEquals(Optional.empty(), Severity.parse(""));
    assertEquals(Optional.empty(), Severity.parse(null));
  }

  @Test
  void labelsAreTitleCase() {
    assertEquals("Medium", Severity.MEDIUM.label());
  }
}
