package ca.gc.cra.tether.domain.op;

/**
 * Requests that the transport connection be opened.
 *
 * @since 0.1.0
 */
public final class ConnectOperation extends PipelineOperation {
  /**
   * Creates a connect request.
   *
   * @param callback completion callback; may be {@code null}
   */
  public ConnectOperation(OperationCallback callback) {
    super(callback);
  }

  @Override
  public OperationKind kind() {
    return OperationKind.CONNECT;
  }

  @Override
  public PipelineOperation copyForRetry(OperationCallback replacementCallback) {
    return new ConnectOperation(replacementCallback);
  }
}
