package ca.gc.cra.tether.domain.op;

import ca.gc.cra.tether.validation.Strings;
import java.util.Objects;

/**
 * Transport-level publish of raw bytes on a topic.
 *
 * @since 0.1.0
 */
public final class SendOperation extends PipelineOperation {
  private final String topic;
  private final byte[] payload;

  /**
   * Creates the operation.
   *
   * @param topic publish topic without wildcards
   * @param payload bytes to publish; copied
   * @param callback completion callback; may be {@code null}
   */
  public SendOperation(String topic, byte[] payload, OperationCallback callback) {
    super(callback);
    this.topic = Strings.requireTopicName("topic", topic);
    this.payload = Objects.requireNonNull(payload, "payload").clone();
  }

  @Override
  public OperationKind kind() {
    return OperationKind.SEND;
  }

  public String topic() {
    return topic;
  }

  public byte[] payload() {
    return payload.clone();
  }
}
