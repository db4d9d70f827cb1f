package ca.gc.cra.tether.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryCliTest {
  private StringWriter output;

  @BeforeEach
  void captureOutput() {
    output = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void sendsEveryMessage() {
    ExitCode code = TelemetryCli.run(new String[] {
        "deviceId=dev-1", "idScope=0ne001", "sasToken=SharedAccessSignature sr=x",
        "message={\"temp\":21}", "prop.zone=b", "count=3", "timeoutMs=10000"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(output.toString().contains("sent=3 failed=0"), output.toString());
  }

  @Test
  void missingTokenIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, TelemetryCli.run(new String[] {"deviceId=dev-1", "idScope=0ne001"}));
  }

  @Test
  void emptyPropertyNameIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, TelemetryCli.run(new String[] {
        "deviceId=dev-1", "idScope=0ne001", "sasToken=SharedAccessSignature sr=x", "prop.=v"}));
  }

  @Test
  void countOutsideRangeIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, TelemetryCli.run(new String[] {
        "deviceId=dev-1", "idScope=0ne001", "sasToken=SharedAccessSignature sr=x", "count=0"}));
  }

  @Test
  void helpSucceedsWithoutArguments() {
    assertEquals(ExitCode.SUCCESS, TelemetryCli.run(new String[] {"-h"}));
    assertTrue(output.toString().contains("deviceId"));
  }
}
