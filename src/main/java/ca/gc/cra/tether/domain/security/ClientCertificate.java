package ca.gc.cra.tether.domain.security;

import ca.gc.cra.tether.validation.Strings;

/**
 * <strong>What:</strong> Opaque client certificate material handed to the transport.
 * <p><strong>Security:</strong> {@link #toString()} never renders key material.</p>
 *
 * @param certificatePem PEM encoded certificate chain
 * @param privateKeyPem PEM encoded private key
 * @param passPhrase optional pass phrase protecting the key; may be {@code null}
 * @since 0.1.0
 */
public record ClientCertificate(String certificatePem, String privateKeyPem, String passPhrase) {
  /**
   * Validates the mandatory PEM blocks.
   *
   * @throws NullPointerException if a PEM block is {@code null}
   * @throws IllegalArgumentException if a PEM block is blank
   */
  public ClientCertificate {
    certificatePem = Strings.requireNonBlank("certificatePem", certificatePem);
    privateKeyPem = Strings.requireNonBlank("privateKeyPem", privateKeyPem);
  }

  @Override
  public String toString() {
    return "ClientCertificate[certificatePem=" + certificatePem.length() + " chars, privateKeyPem=[REDACTED]]";
  }
}
