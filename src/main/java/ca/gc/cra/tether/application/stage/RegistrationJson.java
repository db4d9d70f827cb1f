package ca.gc.cra.tether.application.stage;

import ca.gc.cra.tether.domain.provisioning.RegistrationResult;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;

/**
 * Streaming JSON codec for provisioning request and response bodies.
 */
final class RegistrationJson {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Writes {@code {"registrationId": ..., "payload": ...}}.
   *
   * @param registrationId registration id
   * @param customPayloadJson optional JSON value embedded as {@code payload}; may be {@code null}
   * @return UTF-8 request body
   * @throws IllegalArgumentException when the custom payload is not a single well-formed JSON value
   */
  byte[] writeRequest(String registrationId, String customPayloadJson) {
    Objects.requireNonNull(registrationId, "registrationId");
    if (customPayloadJson != null) {
      requireWellFormed(customPayloadJson);
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream(128);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("registrationId", registrationId);
      if (customPayloadJson != null) {
        gen.writeFieldName("payload");
        gen.writeRawValue(customPayloadJson);
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to write registration request", ex);
    }
    return out.toByteArray();
  }

  /**
   * Reads the registration outcome from a response body.
   *
   * @param body UTF-8 response body
   * @return parsed result
   * @throws IllegalArgumentException when the body is not a JSON object with a {@code status}
   */
  RegistrationResult readResult(byte[] body) {
    String operationId = null;
    String status = null;
    String assignedHub = null;
    String deviceId = null;
    String substatus = null;
    try (JsonParser parser = factory.createParser(body)) {
      expect(parser.nextToken(), JsonToken.START_OBJECT);
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        switch (field) {
          case "operationId" -> operationId = textOrNull(parser, value);
          case "status" -> status = textOrNull(parser, value);
          case "registrationState" -> {
            if (value != JsonToken.START_OBJECT) {
              parser.skipChildren();
            } else {
              while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String inner = parser.getCurrentName();
                JsonToken innerValue = parser.nextToken();
                switch (inner) {
                  case "assignedHub" -> assignedHub = textOrNull(parser, innerValue);
                  case "deviceId" -> deviceId = textOrNull(parser, innerValue);
                  case "substatus" -> substatus = textOrNull(parser, innerValue);
                  default -> parser.skipChildren();
                }
              }
            }
          }
          default -> parser.skipChildren();
        }
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("Malformed registration response", ex);
    }
    if (status == null) {
      throw new IllegalArgumentException("Registration response has no status");
    }
    return new RegistrationResult(operationId, status, assignedHub, deviceId, substatus);
  }

  /**
   * Reads the top-level {@code operationId} of an "assigning" response.
   *
   * @param body UTF-8 response body
   * @return operation id
   * @throws IllegalArgumentException when absent
   */
  String readOperationId(byte[] body) {
    String operationId = readResult(body).operationId();
    if (operationId == null || operationId.isBlank()) {
      throw new IllegalArgumentException("Registration response has no operationId");
    }
    return operationId;
  }

  private void requireWellFormed(String json) {
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken first = parser.nextToken();
      if (first == null) {
        throw new IllegalArgumentException("Custom payload is empty");
      }
      parser.skipChildren();
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("Custom payload contains trailing content");
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("Custom payload is not valid JSON", ex);
    }
  }

  private static void expect(JsonToken actual, JsonToken expected) {
    if (actual != expected) {
      throw new IllegalArgumentException("Expected " + expected + " but found " + actual);
    }
  }

  private static String textOrNull(JsonParser parser, JsonToken token) throws IOException {
    if (token == JsonToken.VALUE_NULL) {
      return null;
    }
    if (token == JsonToken.START_OBJECT || token == JsonToken.START_ARRAY) {
      parser.skipChildren();
      return null;
    }
    return parser.getText();
  }
}
