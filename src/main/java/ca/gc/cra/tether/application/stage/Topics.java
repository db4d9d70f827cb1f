package ca.gc.cra.tether.application.stage;

import ca.gc.cra.tether.domain.message.TelemetryMessage;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Publish topic layouts for hub traffic.
 */
final class Topics {
  private Topics() {}

  /**
   * {@code devices/{deviceId}/messages/events/} followed by the URL-encoded property bag. System properties
   * ({@code $.ct}, {@code $.ce}) come first, then custom properties in key order.
   */
  static String telemetry(String deviceId, TelemetryMessage message) {
    StringJoiner properties = new StringJoiner("&");
    if (message.contentType() != null) {
      properties.add("$.ct=" + encode(message.contentType()));
    }
    if (message.contentEncoding() != null) {
      properties.add("$.ce=" + encode(message.contentEncoding()));
    }
    for (Map.Entry<String, String> entry : new TreeMap<>(message.customProperties()).entrySet()) {
      properties.add(encode(entry.getKey()) + "=" + encode(entry.getValue()));
    }
    return "devices/" + encode(deviceId) + "/messages/events/" + properties;
  }

  static String methodResponse(String requestId, int status) {
    return "$iothub/methods/res/" + status + "/?$rid=" + encode(requestId);
  }

  static String blob(String blobName) {
    return "$iothub/blobs/" + blobName;
  }

  private static String encode(String value) {
    return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
  }
}
