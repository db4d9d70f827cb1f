package ca.gc.cra.tether.domain.op;

import ca.gc.cra.tether.domain.security.TokenProviderSecurityClient;
import ca.gc.cra.tether.validation.Strings;
import java.util.Objects;

/**
 * Asks the pipeline to authenticate with a security client that renders tokens on demand.
 *
 * @since 0.1.0
 */
public final class SetAuthenticationProviderOperation extends PipelineOperation {
  private final TokenProviderSecurityClient securityClient;

  /**
   * Creates the operation.
   *
   * @param securityClient credential source; must not be {@code null}
   * @param callback completion callback; may be {@code null}
   * @throws NullPointerException if {@code securityClient} or one of its identity fields is {@code null}
   * @throws IllegalArgumentException if an identity field is blank
   */
  public SetAuthenticationProviderOperation(
      TokenProviderSecurityClient securityClient, OperationCallback callback) {
    super(callback);
    this.securityClient = Objects.requireNonNull(securityClient, "securityClient");
    Strings.requireNonBlank("provisioningHost", securityClient.provisioningHost());
    Strings.requireNonBlank("registrationId", securityClient.registrationId());
    Strings.requireNonBlank("idScope", securityClient.idScope());
  }

  @Override
  public OperationKind kind() {
    return OperationKind.SET_AUTHENTICATION_PROVIDER;
  }

  /**
   * Returns the credential source.
   *
   * @return security client
   */
  public TokenProviderSecurityClient securityClient() {
    return securityClient;
  }
}
