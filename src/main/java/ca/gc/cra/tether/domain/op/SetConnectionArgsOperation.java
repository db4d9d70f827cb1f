package ca.gc.cra.tether.domain.op;

import ca.gc.cra.tether.domain.security.ClientCertificate;
import ca.gc.cra.tether.validation.Strings;
import java.util.Optional;

/**
 * <strong>What:</strong> Transport-level operation carrying resolved connection arguments.
 * <p><strong>Role:</strong> Synthesized by the security client stage from a caller's credential operation; the
 * transport stage folds it into the arguments used by the next connect.</p>
 * <p><strong>Invariant:</strong> Carries at most one credential, a SAS token or a client certificate. Neither is
 * allowed when the credential follows in a separate {@link SetCredentialTokenOperation}.</p>
 *
 * @since 0.1.0
 */
public final class SetConnectionArgsOperation extends PipelineOperation {
  private final String provisioningHost;
  private final String registrationId;
  private final String idScope;
  private final String sasToken;
  private final ClientCertificate clientCertificate;

  private SetConnectionArgsOperation(
      String provisioningHost,
      String registrationId,
      String idScope,
      String sasToken,
      ClientCertificate clientCertificate,
      OperationCallback callback) {
    super(callback);
    this.provisioningHost = Strings.requireNonBlank("provisioningHost", provisioningHost);
    this.registrationId = Strings.requireNonBlank("registrationId", registrationId);
    this.idScope = Strings.requireNonBlank("idScope", idScope);
    if (sasToken != null && clientCertificate != null) {
      throw new IllegalArgumentException("connection args carry either a SAS token or a client certificate");
    }
    this.sasToken = sasToken == null ? null : Strings.requireNonBlank("sasToken", sasToken);
    this.clientCertificate = clientCertificate;
  }

  /**
   * Creates connection arguments authenticated by a SAS token.
   *
   * @param provisioningHost host name
   * @param registrationId registration id
   * @param idScope id scope
   * @param sasToken SAS token; must not be {@code null}
   * @param callback completion callback; may be {@code null}
   * @return operation
   */
  public static SetConnectionArgsOperation withSasToken(
      String provisioningHost,
      String registrationId,
      String idScope,
      String sasToken,
      OperationCallback callback) {
    return new SetConnectionArgsOperation(
        provisioningHost,
        registrationId,
        idScope,
        Strings.requireNonBlank("sasToken", sasToken),
        null,
        callback);
  }

  /**
   * Creates connection arguments authenticated by a client certificate.
   *
   * @param provisioningHost host name
   * @param registrationId registration id
   * @param idScope id scope
   * @param clientCertificate certificate; must not be {@code null}
   * @param callback completion callback; may be {@code null}
   * @return operation
   */
  public static SetConnectionArgsOperation withClientCertificate(
      String provisioningHost,
      String registrationId,
      String idScope,
      ClientCertificate clientCertificate,
      OperationCallback callback) {
    if (clientCertificate == null) {
      throw new NullPointerException("clientCertificate");
    }
    return new SetConnectionArgsOperation(
        provisioningHost, registrationId, idScope, null, clientCertificate, callback);
  }

  /**
   * Creates connection arguments whose credential is supplied by a later operation.
   *
   * @param provisioningHost host name
   * @param registrationId registration id
   * @param idScope id scope
   * @param callback completion callback; may be {@code null}
   * @return operation
   */
  public static SetConnectionArgsOperation withoutCredential(
      String provisioningHost, String registrationId, String idScope, OperationCallback callback) {
    return new SetConnectionArgsOperation(provisioningHost, registrationId, idScope, null, null, callback);
  }

  @Override
  public OperationKind kind() {
    return OperationKind.SET_CONNECTION_ARGS;
  }

  public String provisioningHost() {
    return provisioningHost;
  }

  public String registrationId() {
    return registrationId;
  }

  public String idScope() {
    return idScope;
  }

  public Optional<String> sasToken() {
    return Optional.ofNullable(sasToken);
  }

  public Optional<ClientCertificate> clientCertificate() {
    return Optional.ofNullable(clientCertificate);
  }
}
