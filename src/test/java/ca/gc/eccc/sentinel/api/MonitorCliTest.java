package ca.gc.eccc.sentinel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MonitorCliTest {
  @TempDir Path observations;
  @TempDir Path inbox;
  private StringWriter out;

  @BeforeEach
  void captureOutput() throws Exception {
    out = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(out, true));
    Files.writeString(observations.resolve("ottawa.json"), """
        {"weather": [{"description": "hurricane force winds"}],
         "main": {"temp": 24.0, "humidity": 90, "pressure": 975},
         "wind": {"speed": 35.0},
         "rain": {"1h": 0.0}}
        """, StandardCharsets.UTF_8);
    Files.writeString(observations.resolve("halifax.json"), """
        {"weather": [{"description": "gusty"}],
         "main": {"temp": 15.0, "humidity": 50, "pressure": 1015},
         "wind": {"speed": 18.0},
         "rain": {"1h": 0.0}}
        """, StandardCharsets.UTF_8);
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void dryRunDispatchesCriticalIncident() {
    ExitCode exit = MonitorCli.run(args("locations=Ottawa"), false);

    assertEquals(ExitCode.SUCCESS, exit);
    String text = out.toString();
    assertTrue(text.contains("Monitoring finished"), text);
    assertTrue(text.contains("Cycles run       : 1"), text);
    assertTrue(text.contains("Incidents        : 1"), text);
    assertTrue(text.contains("DISPATCHED=1"), text);
  }

  @Test
  void mediumIncidentParksAtApprovalGate() {
    ExitCode exit = MonitorCli.run(args("locations=Halifax"), false);

    assertEquals(ExitCode.SUCCESS, exit);
    assertTrue(out.toString().contains("AWAITING_APPROVAL=1"), out.toString());
  }

  @Test
  void missingObservationDirIsAConfigError() {
    ExitCode exit = MonitorCli.run(new String[] {
        "--dry-run", "cycles=1", "metricsExporter=none", "recipients=ops@example.org", "locations=Ottawa",
        "observationDir=" + observations.resolve("absent"), "approvalInbox=" + inbox}, false);

    assertEquals(ExitCode.CONFIG_ERROR, exit);
  }

  @Test
  void missingRecipientsIsInvalid() {
    ExitCode exit = MonitorCli.run(new String[] {"locations=Ottawa", "observationDir=" + observations}, false);

    assertEquals(ExitCode.INVALID_ARGS, exit);
    assertTrue(out.toString().contains("usage: monitor"));
  }

  @Test
  void malformedArgumentIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, MonitorCli.run(new String[] {"cycles"}, false));
  }

  private String[] args(String locations) {
    return new String[] {
        "--dry-run",
        "cycles=1",
        "metricsExporter=none",
        "awaitApprovalsOnExit=false",
        "recipients=ops@example.org",
        locations,
        "observationDir=" + observations,
        "approvalInbox=" + inbox,
        "approvalPollMillis=100"};
  }
}
