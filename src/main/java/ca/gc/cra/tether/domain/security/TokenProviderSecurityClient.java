package ca.gc.cra.tether.domain.security;

/**
 * Security client that renders a fresh token every time one is requested, for example from a
 * hardware security module.
 *
 * @since 0.1.0
 */
public interface TokenProviderSecurityClient extends SecurityClient {
  /**
   * Produces a token valid from now.
   *
   * @return opaque token string
   */
  String token();
}
