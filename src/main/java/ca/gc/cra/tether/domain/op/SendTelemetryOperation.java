package ca.gc.cra.tether.domain.op;

import ca.gc.cra.tether.domain.message.TelemetryMessage;
import ca.gc.cra.tether.validation.Strings;
import java.util.Objects;

/**
 * Sends a device-to-cloud telemetry message.
 *
 * @since 0.1.0
 */
public final class SendTelemetryOperation extends PipelineOperation {
  private final String deviceId;
  private final TelemetryMessage message;

  /**
   * Creates the operation.
   *
   * @param deviceId device identity the message is sent as
   * @param message telemetry payload
   * @param callback completion callback; may be {@code null}
   */
  public SendTelemetryOperation(String deviceId, TelemetryMessage message, OperationCallback callback) {
    super(callback);
    this.deviceId = Strings.requirePrintableAscii("deviceId", deviceId, 128);
    this.message = Objects.requireNonNull(message, "message");
  }

  @Override
  public OperationKind kind() {
    return OperationKind.SEND_TELEMETRY;
  }

  public String deviceId() {
    return deviceId;
  }

  public TelemetryMessage message() {
    return message;
  }

  @Override
  public PipelineOperation copyForRetry(OperationCallback replacementCallback) {
    return new SendTelemetryOperation(deviceId, message, replacementCallback);
  }
}
