package ca.gc.cra.tether.domain.security;

/**
 * Security client authenticating with a client certificate.
 *
 * @since 0.1.0
 */
public interface X509SecurityClient extends SecurityClient {
  /**
   * Returns the certificate presented during the TLS handshake.
   *
   * @return opaque certificate material
   */
  ClientCertificate certificate();
}
