package ca.gc.cra.tether.domain.op;

import ca.gc.cra.tether.validation.Numbers;
import ca.gc.cra.tether.validation.Strings;
import java.util.Objects;

/**
 * Answers a direct method request received from the cloud.
 *
 * @since 0.1.0
 */
public final class SendMethodResponseOperation extends PipelineOperation {
  private final String requestId;
  private final int status;
  private final byte[] payload;

  /**
   * Creates the operation.
   *
   * @param requestId id of the method request being answered
   * @param status HTTP-style status code between 100 and 599
   * @param payload response body; copied
   * @param callback completion callback; may be {@code null}
   */
  public SendMethodResponseOperation(
      String requestId, int status, byte[] payload, OperationCallback callback) {
    super(callback);
    this.requestId = Strings.requirePrintableAscii("requestId", requestId, 128);
    this.status = (int) Numbers.requireRange("status", status, 100, 599);
    this.payload = Objects.requireNonNull(payload, "payload").clone();
  }

  @Override
  public OperationKind kind() {
    return OperationKind.SEND_METHOD_RESPONSE;
  }

  public String requestId() {
    return requestId;
  }

  public int status() {
    return status;
  }

  public byte[] payload() {
    return payload.clone();
  }

  @Override
  public PipelineOperation copyForRetry(OperationCallback replacementCallback) {
    return new SendMethodResponseOperation(requestId, status, payload, replacementCallback);
  }
}
