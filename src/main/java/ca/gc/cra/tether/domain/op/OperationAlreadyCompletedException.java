package ca.gc.cra.tether.domain.op;

/**
 * Raised when an operation is completed a second time.
 *
 * @since 0.1.0
 */
public final class OperationAlreadyCompletedException extends PipelineDefectException {
  private static final long serialVersionUID = 1L;

  private final long operationId;

  /**
   * Creates the defect for the given operation.
   *
   * @param operation operation that was already complete
   */
  public OperationAlreadyCompletedException(PipelineOperation operation) {
    super("Operation " + operation + " completed more than once");
    this.operationId = operation.id();
  }

  /**
   * Returns the identifier of the operation that was completed twice.
   *
   * @return operation id
   */
  public long operationId() {
    return operationId;
  }
}
