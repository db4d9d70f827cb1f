package ca.gc.cra.tether.domain.op;

/**
 * Requests that the transport connection be closed.
 *
 * @since 0.1.0
 */
public final class DisconnectOperation extends PipelineOperation {
  /**
   * Creates a disconnect request.
   *
   * @param callback completion callback; may be {@code null}
   */
  public DisconnectOperation(OperationCallback callback) {
    super(callback);
  }

  @Override
  public OperationKind kind() {
    return OperationKind.DISCONNECT;
  }
}
