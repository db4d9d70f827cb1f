package ca.gc.cra.tether.domain.op;

/**
 * Receives the outcome of a {@link PipelineOperation}.
 *
 * <p>Invoked exactly once per operation, either on the pipeline thread or on the callback executor the
 * pipeline installed at submission time.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface OperationCallback {
  /** Callback that ignores the outcome; callers relying on {@link PipelineOperation#completion()} use it. */
  OperationCallback NONE = (operation, error) -> {};

  /**
   * Handles completion of an operation.
   *
   * @param operation the completed operation
   * @param error failure cause, or {@code null} on success
   */
  void onComplete(PipelineOperation operation, Throwable error);
}
