package ca.gc.cra.tether.domain.op;

import ca.gc.cra.tether.domain.security.ClientCertificate;
import java.util.Objects;

/**
 * Transport-level replacement of the client certificate.
 *
 * @since 0.1.0
 */
public final class SetClientCertificateOperation extends PipelineOperation {
  private final ClientCertificate certificate;

  /**
   * Creates the operation.
   *
   * @param certificate certificate material
   * @param callback completion callback; may be {@code null}
   */
  public SetClientCertificateOperation(ClientCertificate certificate, OperationCallback callback) {
    super(callback);
    this.certificate = Objects.requireNonNull(certificate, "certificate");
  }

  @Override
  public OperationKind kind() {
    return OperationKind.SET_CLIENT_CERTIFICATE;
  }

  public ClientCertificate certificate() {
    return certificate;
  }
}
