package ca.gc.cra.tether.domain.security;

/**
 * Security client authenticating with a shared-access-signature token.
 *
 * @since 0.1.0
 */
public interface SymmetricKeySecurityClient extends SecurityClient {
  /**
   * Returns the currently valid SAS token.
   *
   * @return opaque token string
   */
  String currentSasToken();
}
