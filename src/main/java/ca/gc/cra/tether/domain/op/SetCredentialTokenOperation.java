package ca.gc.cra.tether.domain.op;

import ca.gc.cra.tether.validation.Strings;

/**
 * Transport-level replacement of the credential token.
 *
 * @since 0.1.0
 */
public final class SetCredentialTokenOperation extends PipelineOperation {
  private final String token;

  /**
   * Creates the operation.
   *
   * @param token opaque credential token
   * @param callback completion callback; may be {@code null}
   */
  public SetCredentialTokenOperation(String token, OperationCallback callback) {
    super(callback);
    this.token = Strings.requireNonBlank("token", token);
  }

  @Override
  public OperationKind kind() {
    return OperationKind.SET_CREDENTIAL_TOKEN;
  }

  public String token() {
    return token;
  }
}
