package ca.gc.cra.tether.domain.provisioning;

import java.util.Objects;

/**
 * Outcome of a device registration as reported by the provisioning service.
 *
 * @param operationId provisioning operation id; may be {@code null}
 * @param status registration status, for example {@code assigned}
 * @param assignedHub hub the device was assigned to; may be {@code null} until assigned
 * @param deviceId device id on the assigned hub; may be {@code null} until assigned
 * @param substatus optional substatus such as {@code initialAssignment}
 * @since 0.1.0
 */
public record RegistrationResult(
    String operationId, String status, String assignedHub, String deviceId, String substatus) {

  /** Status reported once the device has been assigned to a hub. */
  public static final String STATUS_ASSIGNED = "assigned";

  /**
   * Validates the mandatory status.
   */
  public RegistrationResult {
    Objects.requireNonNull(status, "status");
  }

  /**
   * Indicates whether the device was assigned to a hub.
   *
   * @return {@code true} when {@link #status()} is {@code assigned}
   */
  public boolean assigned() {
    return STATUS_ASSIGNED.equalsIgnoreCase(status);
  }
}
