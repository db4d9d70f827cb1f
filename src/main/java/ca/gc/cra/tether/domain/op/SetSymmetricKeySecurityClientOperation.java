package ca.gc.cra.tether.domain.op;

import ca.gc.cra.tether.domain.security.SymmetricKeySecurityClient;
import ca.gc.cra.tether.validation.Strings;
import java.util.Objects;

/**
 * <strong>What:</strong> Asks the pipeline to authenticate with a shared-access-key security client.
 * <p><strong>Role:</strong> Caller-facing operation translated by the security client stage into transport
 * connection arguments carrying the current SAS token.</p>
 * <p><strong>Validation:</strong> The client's host, registration id and id scope are read once at construction
 * so an incomplete credential source is rejected at the caller.</p>
 *
 * @since 0.1.0
 */
public final class SetSymmetricKeySecurityClientOperation extends PipelineOperation {
  private final SymmetricKeySecurityClient securityClient;

  /**
   * Creates the operation.
   *
   * @param securityClient credential source; must not be {@code null}
   * @param callback completion callback; may be {@code null}
   * @throws NullPointerException if {@code securityClient} or one of its identity fields is {@code null}
   * @throws IllegalArgumentException if an identity field is blank
   */
  public SetSymmetricKeySecurityClientOperation(
      SymmetricKeySecurityClient securityClient, OperationCallback callback) {
    super(callback);
    this.securityClient = Objects.requireNonNull(securityClient, "securityClient");
    Strings.requireNonBlank("provisioningHost", securityClient.provisioningHost());
    Strings.requireNonBlank("registrationId", securityClient.registrationId());
    Strings.requireNonBlank("idScope", securityClient.idScope());
  }

  @Override
  public OperationKind kind() {
    return OperationKind.SET_SYMMETRIC_KEY_SECURITY_CLIENT;
  }

  /**
   * Returns the credential source.
   *
   * @return security client
   */
  public SymmetricKeySecurityClient securityClient() {
    return securityClient;
  }
}
