package ca.gc.cra.tether.application.stage;

import ca.gc.cra.tether.application.pipeline.OperationFlow;
import ca.gc.cra.tether.application.pipeline.OperationFlow.Replacement;
import ca.gc.cra.tether.application.pipeline.PipelineStage;
import ca.gc.cra.tether.domain.op.PipelineOperation;
import ca.gc.cra.tether.domain.op.SetAuthenticationProviderOperation;
import ca.gc.cra.tether.domain.op.SetConnectionArgsOperation;
import ca.gc.cra.tether.domain.op.SetCredentialTokenOperation;
import ca.gc.cra.tether.domain.op.SetSymmetricKeySecurityClientOperation;
import ca.gc.cra.tether.domain.op.SetX509SecurityClientOperation;
import ca.gc.cra.tether.domain.security.SymmetricKeySecurityClient;
import ca.gc.cra.tether.domain.security.TokenProviderSecurityClient;
import ca.gc.cra.tether.domain.security.X509SecurityClient;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns "use this security client" requests into transport connection arguments.
 * <p><strong>Why:</strong> Callers hand over a credential source; the transport only understands host, ids and
 * a SAS token or client certificate.</p>
 * <p><strong>Role:</strong> Head stage of the default chain. Holds no state.</p>
 * <ul>
 *   <li>Symmetric key: one {@link SetConnectionArgsOperation} carrying the current SAS token.</li>
 *   <li>X.509: one {@link SetConnectionArgsOperation} carrying the client certificate.</li>
 *   <li>Token provider: credential-less connection arguments, then a {@link SetCredentialTokenOperation}.</li>
 *   <li>Everything else passes through untouched.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class UseSecurityClientStage extends PipelineStage {
  private static final Logger log = LoggerFactory.getLogger(UseSecurityClientStage.class);

  public UseSecurityClientStage() {
    super("security-client");
  }

  @Override
  protected void runOperation(PipelineOperation op) {
    switch (op.kind()) {
      case SET_SYMMETRIC_KEY_SECURITY_CLIENT -> useSymmetricKey((SetSymmetricKeySecurityClientOperation) op);
      case SET_X509_SECURITY_CLIENT -> useX509((SetX509SecurityClientOperation) op);
      case SET_AUTHENTICATION_PROVIDER -> useTokenProvider((SetAuthenticationProviderOperation) op);
      default -> OperationFlow.passToNext(this, op);
    }
  }

  private void useSymmetricKey(SetSymmetricKeySecurityClientOperation op) {
    SymmetricKeySecurityClient client = op.securityClient();
    log.debug("Using symmetric key credentials for registration {}", client.registrationId());
    OperationFlow.delegate(this, op, callback -> SetConnectionArgsOperation.withSasToken(
        client.provisioningHost(),
        client.registrationId(),
        client.idScope(),
        client.currentSasToken(),
        callback));
  }

  private void useX509(SetX509SecurityClientOperation op) {
    X509SecurityClient client = op.securityClient();
    log.debug("Using X.509 credentials for registration {}", client.registrationId());
    OperationFlow.delegate(this, op, callback -> SetConnectionArgsOperation.withClientCertificate(
        client.provisioningHost(),
        client.registrationId(),
        client.idScope(),
        client.certificate(),
        callback));
  }

  private void useTokenProvider(SetAuthenticationProviderOperation op) {
    TokenProviderSecurityClient client = op.securityClient();
    log.debug("Using token provider credentials for registration {}", client.registrationId());
    List<Replacement<? extends PipelineOperation>> steps = List.of(
        callback -> SetConnectionArgsOperation.withoutCredential(
            client.provisioningHost(), client.registrationId(), client.idScope(), callback),
        // Token is rendered only once the connection arguments were accepted.
        callback -> new SetCredentialTokenOperation(client.token(), callback));
    OperationFlow.delegateInSequence(this, op, steps);
  }
}
