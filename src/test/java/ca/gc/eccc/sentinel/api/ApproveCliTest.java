package ca.gc.eccc.sentinel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
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

class ApproveCliTest {
  @TempDir Path inbox;
  private StringWriter out;

  @BeforeEach
  void captureOutput() {
    out = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(out, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void writesDecisionFileForRequest() throws Exception {
    ExitCode exit = ApproveCli.run(new String[] {
        "inbox=" + inbox, "request=apr-ottawa-1-1000", "decision=approve", "operator=duty-officer"});

    assertEquals(ExitCode.SUCCESS, exit);
    Path decision = inbox.resolve("apr-ottawa-1-1000.decision");
    String content = Files.readString(decision, StandardCharsets.UTF_8);
    assertTrue(content.startsWith("approve\n"));
    assertTrue(content.contains("operator=duty-officer"));
    assertTrue(out.toString().contains("Decision approve for apr-ottawa-1-1000"));
  }

  @Test
  void rejectDecisionIsAccepted() throws Exception {
    assertEquals(ExitCode.SUCCESS, ApproveCli.run(new String[] {
        "inbox=" + inbox, "request=apr-halifax-2-5", "decision=rejected"}));

    assertTrue(Files.readString(inbox.resolve("apr-halifax-2-5.decision")).startsWith("reject"));
  }

  @Test
  void unknownDecisionIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, ApproveCli.run(new String[] {
        "inbox=" + inbox, "request=apr-ottawa-1-1000", "decision=maybe"}));
    assertFalse(Files.exists(inbox.resolve("apr-ottawa-1-1000.decision")));
  }

  @Test
  void requestIdMustBeFileSafe() {
    assertEquals(ExitCode.INVALID_ARGS, ApproveCli.run(new String[] {
        "inbox=" + inbox, "request=../escape", "decision=approve"}));
  }

  @Test
  void missingRequestIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, ApproveCli.run(new String[] {"inbox=" + inbox, "decision=approve"}));
  }
}
