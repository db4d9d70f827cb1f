package ca.gc.cra.tether.domain.op;

/**
 * <strong>What:</strong> Closed set of operation kinds understood by TETHER pipelines.
 * <p><strong>Why:</strong> Stages dispatch with exhaustive {@code switch} expressions over this enum, so a new
 * kind surfaces as a compile error in every stage that switches without a {@code default} branch.</p>
 * <p><strong>Role:</strong> Domain discriminator paired with {@link PipelineOperation#kind()}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum OperationKind {
  /** Open the transport connection. Also part of the transport vocabulary. */
  CONNECT(true),
  /** Close the transport connection. Also part of the transport vocabulary. */
  DISCONNECT(true),
  /** Authenticate with a shared-access-key security client. */
  SET_SYMMETRIC_KEY_SECURITY_CLIENT(false),
  /** Authenticate with an X.509 certificate security client. */
  SET_X509_SECURITY_CLIENT(false),
  /** Authenticate with a security client that renders tokens on demand. */
  SET_AUTHENTICATION_PROVIDER(false),
  /** Send a device-to-cloud telemetry message. */
  SEND_TELEMETRY(false),
  /** Upload a named blob. */
  UPLOAD_BLOB(false),
  /** Answer a direct method request. */
  SEND_METHOD_RESPONSE(false),
  /** Register the device with the provisioning service. */
  REGISTER_DEVICE(false),
  /** Publish raw bytes on a topic. */
  SEND(true),
  /** Subscribe to a topic filter. */
  SUBSCRIBE(true),
  /** Hand resolved connection arguments to the transport. */
  SET_CONNECTION_ARGS(true),
  /** Replace the credential token used by the transport. */
  SET_CREDENTIAL_TOKEN(true),
  /** Replace the client certificate used by the transport. */
  SET_CLIENT_CERTIFICATE(true);

  private final boolean transportLevel;

  OperationKind(boolean transportLevel) {
    this.transportLevel = transportLevel;
  }

  /**
   * Indicates whether the transport stage accepts this kind directly.
   *
   * @return {@code true} for the low-level transport vocabulary
   */
  public boolean transportLevel() {
    return transportLevel;
  }
}
