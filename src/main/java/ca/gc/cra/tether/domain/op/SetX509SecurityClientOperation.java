package ca.gc.cra.tether.domain.op;

import ca.gc.cra.tether.domain.security.X509SecurityClient;
import ca.gc.cra.tether.validation.Strings;
import java.util.Objects;

/**
 * Asks the pipeline to authenticate with an X.509 certificate security client. The client's identity fields
 * are validated at construction; the certificate itself is read when the security client stage runs.
 *
 * @since 0.1.0
 */
public final class SetX509SecurityClientOperation extends PipelineOperation {
  private final X509SecurityClient securityClient;

  /**
   * Creates the operation.
   *
   * @param securityClient credential source; must not be {@code null}
   * @param callback completion callback; may be {@code null}
   * @throws NullPointerException if {@code securityClient} or one of its identity fields is {@code null}
   * @throws IllegalArgumentException if an identity field is blank
   */
  public SetX509SecurityClientOperation(X509SecurityClient securityClient, OperationCallback callback) {
    super(callback);
    this.securityClient = Objects.requireNonNull(securityClient, "securityClient");
    Strings.requireNonBlank("provisioningHost", securityClient.provisioningHost());
    Strings.requireNonBlank("registrationId", securityClient.registrationId());
    Strings.requireNonBlank("idScope", securityClient.idScope());
  }

  @Override
  public OperationKind kind() {
    return OperationKind.SET_X509_SECURITY_CLIENT;
  }

  /**
   * Returns the credential source.
   *
   * @return security client
   */
  public X509SecurityClient securityClient() {
    return securityClient;
  }
}
