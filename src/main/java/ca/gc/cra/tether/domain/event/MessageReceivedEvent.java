package ca.gc.cra.tether.domain.event;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Raised when a message arrives on a subscribed topic.
 *
 * @param occurredAt event timestamp
 * @param topic topic the message was published on
 * @param payload message bytes; copied
 * @since 0.1.0
 */
public record MessageReceivedEvent(Instant occurredAt, String topic, byte[] payload) implements PipelineEvent {
  public MessageReceivedEvent {
    Objects.requireNonNull(occurredAt, "occurredAt");
    Objects.requireNonNull(topic, "topic");
    payload = Objects.requireNonNull(payload, "payload").clone();
  }

  @Override
  public EventKind kind() {
    return EventKind.MESSAGE_RECEIVED;
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof MessageReceivedEvent that
        && occurredAt.equals(that.occurredAt)
        && topic.equals(that.topic)
        && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    return Objects.hash(occurredAt, topic, Arrays.hashCode(payload));
  }

  @Override
  public String toString() {
    return "MessageReceivedEvent[topic=" + topic + ", payload=" + payload.length + " bytes]";
  }
}
