package ca.gc.cra.tether.application.stage;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.tether.domain.message.TelemetryMessage;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TopicsTest {

  @Test
  void telemetryTopicWithoutMetadataEndsWithTheEventsSegment() {
    TelemetryMessage message = TelemetryMessage.of(new byte[] {1});

    assertEquals("devices/dev-1/messages/events/", Topics.telemetry("dev-1", message));
  }

  @Test
  void telemetryPropertiesAreEncodedAndSorted() {
    TelemetryMessage message = new TelemetryMessage("x".getBytes(StandardCharsets.UTF_8), "text/plain", null,
        Map.of("b", "2", "a&b", "x=y"));

    assertEquals("devices/dev%2F1/messages/events/$.ct=text%2Fplain&a%26b=x%3Dy&b=2",
        Topics.telemetry("dev/1", message));
  }

  @Test
  void methodResponseCarriesStatusAndRequestId() {
    assertEquals("$iothub/methods/res/404/?$rid=abc", Topics.methodResponse("abc", 404));
  }

  @Test
  void blobTopicNamesTheBlob() {
    assertEquals("$iothub/blobs/logs/today.txt", Topics.blob("logs/today.txt"));
  }
}
