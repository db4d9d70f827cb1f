package ca.gc.cra.tether.application.port;

import ca.gc.cra.tether.domain.security.ClientCertificate;
import ca.gc.cra.tether.logging.Logs;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection arguments handed to {@link TransportPort#connect}.
 *
 * @param host host to connect to
 * @param clientId MQTT-style client identifier (the registration id)
 * @param username user name derived from id scope and registration id
 * @param sasToken SAS token used as password; may be {@code null}
 * @param clientCertificate certificate presented during TLS; may be {@code null}
 * @since 0.1.0
 */
public record ConnectionArgs(
    String host, String clientId, String username, String sasToken, ClientCertificate clientCertificate) {

  public ConnectionArgs {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(clientId, "clientId");
    Objects.requireNonNull(username, "username");
  }

  public Optional<String> password() {
    return Optional.ofNullable(sasToken);
  }

  public Optional<ClientCertificate> certificate() {
    return Optional.ofNullable(clientCertificate);
  }

  @Override
  public String toString() {
    return "ConnectionArgs[host=" + host + ", clientId=" + clientId + ", username=" + username
        + ", sasToken=" + Logs.redact(sasToken)
        + ", clientCertificate=" + Logs.redact(clientCertificate) + "]";
  }
}
