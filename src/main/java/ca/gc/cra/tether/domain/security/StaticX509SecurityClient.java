package ca.gc.cra.tether.domain.security;

import ca.gc.cra.tether.validation.Strings;
import java.util.Objects;

/**
 * X.509 security client holding certificate material loaded up front.
 *
 * @param provisioningHost provisioning host
 * @param registrationId registration id, normally the certificate's common name
 * @param idScope id scope
 * @param certificate client certificate and key
 * @since 0.1.0
 */
public record StaticX509SecurityClient(
    String provisioningHost, String registrationId, String idScope, ClientCertificate certificate)
    implements X509SecurityClient {

  public StaticX509SecurityClient {
    provisioningHost = Strings.requireNonBlank("provisioningHost", provisioningHost);
    registrationId = Strings.requireNonBlank("registrationId", registrationId);
    idScope = Strings.requireNonBlank("idScope", idScope);
    Objects.requireNonNull(certificate, "certificate");
  }
}
