package ca.gc.cra.tether.application.stage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.tether.domain.provisioning.RegistrationResult;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class RegistrationJsonTest {
  private final RegistrationJson json = new RegistrationJson();

  @Test
  void requestEscapesTheRegistrationId() {
    byte[] body = json.writeRequest("reg \"quoted\"", null);

    assertEquals("{\"registrationId\":\"reg \\\"quoted\\\"\"}", new String(body, StandardCharsets.UTF_8));
  }

  @Test
  void requestRejectsPayloadWithTrailingContent() {
    assertThrows(IllegalArgumentException.class, () -> json.writeRequest("reg-1", "{} {}"));
  }

  @Test
  void resultIgnoresUnknownMembers() {
    String body = "{\"operationId\":\"4.abc\",\"status\":\"assigning\",\"extra\":[1,2,{\"n\":3}],"
        + "\"registrationState\":{\"registrationId\":\"reg-1\",\"createdDateTimeUtc\":\"2024-01-01T00:00:00Z\"}}";

    RegistrationResult result = json.readResult(body.getBytes(StandardCharsets.UTF_8));

    assertEquals("4.abc", result.operationId());
    assertEquals("assigning", result.status());
    assertFalse(result.assigned());
    assertNull(result.assignedHub());
    assertNull(result.deviceId());
  }

  @Test
  void resultWithoutStatusIsRejected() {
    byte[] body = "{\"operationId\":\"4.abc\"}".getBytes(StandardCharsets.UTF_8);

    assertThrows(IllegalArgumentException.class, () -> json.readResult(body));
  }

  @Test
  void malformedBodyIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> json.readResult("[]".getBytes(StandardCharsets.UTF_8)));
    assertThrows(IllegalArgumentException.class, () -> json.readResult("{\"status\":".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void operationIdIsRequiredForPolling() {
    byte[] body = "{\"status\":\"assigning\"}".getBytes(StandardCharsets.UTF_8);

    assertThrows(IllegalArgumentException.class, () -> json.readOperationId(body));
  }
}
