package ca.gc.cra.tether.domain.message;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Device-to-cloud telemetry payload plus its system and application properties.
 * <p><strong>Thread-safety:</strong> Immutable; payload is copied on the way in and on the way out.</p>
 *
 * @param payload message body
 * @param contentType optional MIME type such as {@code application/json}; may be {@code null}
 * @param contentEncoding optional charset such as {@code utf-8}; may be {@code null}
 * @param customProperties application properties appended to the publish topic; never {@code null}
 * @since 0.1.0
 */
public record TelemetryMessage(
    byte[] payload, String contentType, String contentEncoding, Map<String, String> customProperties) {

  /**
   * Copies the payload and properties.
   *
   * @throws NullPointerException if {@code payload} is {@code null}
   */
  public TelemetryMessage {
    payload = Objects.requireNonNull(payload, "payload").clone();
    customProperties = customProperties == null ? Map.of() : Map.copyOf(customProperties);
  }

  /**
   * Creates a message with no content metadata and no custom properties.
   *
   * @param payload message body
   * @return telemetry message
   */
  public static TelemetryMessage of(byte[] payload) {
    return new TelemetryMessage(payload, null, null, Map.of());
  }

  /**
   * Creates a UTF-8 JSON message.
   *
   * @param json JSON document
   * @return telemetry message with JSON content type and UTF-8 encoding
   */
  public static TelemetryMessage json(String json) {
    Objects.requireNonNull(json, "json");
    return new TelemetryMessage(
        json.getBytes(StandardCharsets.UTF_8), "application/json", "utf-8", Map.of());
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof TelemetryMessage that
        && Arrays.equals(payload, that.payload)
        && Objects.equals(contentType, that.contentType)
        && Objects.equals(contentEncoding, that.contentEncoding)
        && customProperties.equals(that.customProperties);
  }

  @Override
  public int hashCode() {
    return Objects.hash(Arrays.hashCode(payload), contentType, contentEncoding, customProperties);
  }

  @Override
  public String toString() {
    return "TelemetryMessage[payload=" + payload.length + " bytes, contentType=" + contentType
        + ", contentEncoding=" + contentEncoding + ", customProperties=" + customProperties + "]";
  }
}
