package ca.gc.cra.tether.domain.security;

/**
 * <strong>What:</strong> Credential source describing where and as whom a device connects.
 * <p><strong>Why:</strong> The pipeline only carries credential material between stages; computing tokens or
 * loading certificates belongs to implementations of this contract.</p>
 * <p><strong>Role:</strong> External collaborator consumed by the security client stage.</p>
 * <p><strong>Thread-safety:</strong> Implementations are read from the pipeline thread only.</p>
 *
 * @since 0.1.0
 * @see SymmetricKeySecurityClient
 * @see X509SecurityClient
 * @see TokenProviderSecurityClient
 */
public interface SecurityClient {
  /**
   * Returns the provisioning or hub host name.
   *
   * @return host name such as {@code global.azure-devices-provisioning.net}
   */
  String provisioningHost();

  /**
   * Returns the device registration identifier.
   *
   * @return registration id
   */
  String registrationId();

  /**
   * Returns the id scope of the provisioning service instance.
   *
   * @return id scope
   */
  String idScope();
}
