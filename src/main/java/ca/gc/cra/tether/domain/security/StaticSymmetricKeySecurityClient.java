package ca.gc.cra.tether.domain.security;

import ca.gc.cra.tether.validation.Strings;

/**
 * Symmetric-key security client holding a token that was signed ahead of time.
 *
 * @param provisioningHost provisioning host
 * @param registrationId registration id
 * @param idScope id scope
 * @param sasToken pre-computed SAS token
 * @since 0.1.0
 */
public record StaticSymmetricKeySecurityClient(
    String provisioningHost, String registrationId, String idScope, String sasToken)
    implements SymmetricKeySecurityClient {

  /**
   * Validates all fields.
   */
  public StaticSymmetricKeySecurityClient {
    provisioningHost = Strings.requireNonBlank("provisioningHost", provisioningHost);
    registrationId = Strings.requireNonBlank("registrationId", registrationId);
    idScope = Strings.requireNonBlank("idScope", idScope);
    sasToken = Strings.requireNonBlank("sasToken", sasToken);
  }

  @Override
  public String currentSasToken() {
    return sasToken;
  }

  @Override
  public String toString() {
    return "StaticSymmetricKeySecurityClient[provisioningHost=" + provisioningHost
        + ", registrationId=" + registrationId + ", idScope=" + idScope + ", sasToken=[REDACTED]]";
  }
}
