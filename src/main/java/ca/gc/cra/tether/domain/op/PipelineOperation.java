package ca.gc.cra.tether.domain.op;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> A single requested unit of work travelling down a TETHER pipeline.
 * <p><strong>Why:</strong> Gives every stage one uniform shape to inspect, pass along, replace or complete,
 * regardless of whether the work originated from a caller or from another stage.</p>
 * <p><strong>Role:</strong> Domain object owned by whichever stage currently holds it.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose a closed {@link OperationKind} discriminator and a process-wide monotonic id for tracing.</li>
 *   <li>Guarantee the completion callback runs exactly once.</li>
 *   <li>Mirror the outcome into a {@link CompletableFuture} for callers that prefer futures.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Payload fields are final. Completion state is atomic so a racing second
 * completion is detected rather than lost.</p>
 *
 * @since 0.1.0
 */
public abstract sealed class PipelineOperation
    permits ConnectOperation,
        DisconnectOperation,
        SetSymmetricKeySecurityClientOperation,
        SetX509SecurityClientOperation,
        SetAuthenticationProviderOperation,
        SendTelemetryOperation,
        UploadBlobOperation,
        SendMethodResponseOperation,
        RegisterDeviceOperation,
        SendOperation,
        SubscribeOperation,
        SetConnectionArgsOperation,
        SetCredentialTokenOperation,
        SetClientCertificateOperation {

  private static final AtomicLong NEXT_ID = new AtomicLong(1);

  private final long id;
  private final OperationCallback callback;
  private final AtomicBoolean completed = new AtomicBoolean();
  private final CompletableFuture<Void> completion = new CompletableFuture<>();
  private volatile Throwable error;
  private volatile Executor callbackExecutor;

  /**
   * Assigns the next operation id and captures the callback.
   *
   * @param callback completion callback; {@code null} selects {@link OperationCallback#NONE}
   */
  protected PipelineOperation(OperationCallback callback) {
    this.id = NEXT_ID.getAndIncrement();
    this.callback = callback == null ? OperationCallback.NONE : callback;
  }

  /**
   * Returns the discriminator for this operation.
   *
   * @return operation kind; never {@code null}
   */
  public abstract OperationKind kind();

  /**
   * Returns the monotonically assigned identifier.
   *
   * @return operation id
   */
  public final long id() {
    return id;
  }

  /**
   * Indicates whether the operation has been completed.
   *
   * @return {@code true} once {@link #complete(Throwable)} has run
   */
  public final boolean isCompleted() {
    return completed.get();
  }

  /**
   * Returns the failure the operation completed with.
   *
   * @return failure cause; empty while pending or after success
   */
  public final Optional<Throwable> error() {
    return Optional.ofNullable(error);
  }

  /**
   * Returns a future that settles when the callback has run.
   *
   * @return dependent copy of the internal completion future
   */
  public final CompletableFuture<Void> completion() {
    return completion.copy();
  }

  /**
   * Routes the completion callback through {@code executor} instead of running it inline.
   * Pipeline roots call this at submission so caller code never runs on the pipeline thread.
   *
   * @param executor callback executor; must not be {@code null}
   * @throws IllegalStateException if the operation already completed
   */
  public final void dispatchCallbackOn(Executor executor) {
    Objects.requireNonNull(executor, "executor");
    if (completed.get()) {
      throw new IllegalStateException("operation " + id + " already completed");
    }
    this.callbackExecutor = executor;
  }

  /**
   * Completes the operation and invokes its callback.
   *
   * @param failure failure cause, or {@code null} for success
   * @throws OperationAlreadyCompletedException if the operation was completed before
   */
  public final void complete(Throwable failure) {
    if (!completed.compareAndSet(false, true)) {
      throw new OperationAlreadyCompletedException(this);
    }
    this.error = failure;
    Executor executor = callbackExecutor;
    if (executor == null) {
      deliver(failure);
    } else {
      executor.execute(() -> deliver(failure));
    }
  }

  /**
   * Copies the result payload of a completed replacement of the same kind into this operation.
   * Operations without a result ignore the call.
   *
   * @param replacement completed replacement operation
   */
  public void inheritResult(PipelineOperation replacement) {}

  /**
   * Creates a fresh, pending copy of this operation carrying the same payload.
   *
   * @param replacementCallback callback for the copy
   * @return pending copy with a new id
   * @throws UnsupportedOperationException if this kind cannot be re-issued
   */
  public PipelineOperation copyForRetry(OperationCallback replacementCallback) {
    throw new UnsupportedOperationException(kind() + " operations cannot be re-issued");
  }

  private void deliver(Throwable failure) {
    try {
      callback.onComplete(this, failure);
    } finally {
      if (failure == null) {
        completion.complete(null);
      } else {
        completion.completeExceptionally(failure);
      }
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[id=" + id + ", kind=" + kind() + "]";
  }
}
