package ca.gc.cra.tether.domain.op;

import ca.gc.cra.tether.domain.provisioning.RegistrationResult;
import ca.gc.cra.tether.validation.Strings;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Registers the device with the provisioning service.
 * <p><strong>Result:</strong> On success the registration stage records a {@link RegistrationResult} before
 * completing the operation, so callbacks can read {@link #result()}.</p>
 *
 * @since 0.1.0
 */
public final class RegisterDeviceOperation extends PipelineOperation {
  private final String registrationId;
  private final String customPayloadJson;
  private volatile RegistrationResult result;

  /**
   * Creates the operation.
   *
   * @param registrationId registration id sent in the request body
   * @param customPayloadJson optional JSON object forwarded as the {@code payload} member; may be {@code null}
   * @param callback completion callback; may be {@code null}
   */
  public RegisterDeviceOperation(
      String registrationId, String customPayloadJson, OperationCallback callback) {
    super(callback);
    this.registrationId = Strings.requirePrintableAscii("registrationId", registrationId, 128);
    this.customPayloadJson =
        customPayloadJson == null ? null : Strings.requireNonBlank("customPayloadJson", customPayloadJson);
  }

  @Override
  public OperationKind kind() {
    return OperationKind.REGISTER_DEVICE;
  }

  public String registrationId() {
    return registrationId;
  }

  public Optional<String> customPayloadJson() {
    return Optional.ofNullable(customPayloadJson);
  }

  /**
   * Returns the registration result recorded before successful completion.
   *
   * @return result; empty while pending or after failure
   */
  public Optional<RegistrationResult> result() {
    return Optional.ofNullable(result);
  }

  /**
   * Records the registration result. Must be called before the operation is completed.
   *
   * @param registrationResult parsed service response
   * @throws IllegalStateException if the operation already completed
   */
  public void recordResult(RegistrationResult registrationResult) {
    Objects.requireNonNull(registrationResult, "registrationResult");
    if (isCompleted()) {
      throw new IllegalStateException("operation " + id() + " already completed");
    }
    this.result = registrationResult;
  }

  @Override
  public void inheritResult(PipelineOperation replacement) {
    if (replacement instanceof RegisterDeviceOperation register && register.result != null) {
      recordResult(register.result);
    }
  }

  @Override
  public PipelineOperation copyForRetry(OperationCallback replacementCallback) {
    return new RegisterDeviceOperation(registrationId, customPayloadJson, replacementCallback);
  }
}
