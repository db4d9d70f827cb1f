package ca.gc.cra.tether.api;

import ca.gc.cra.tether.application.pipeline.Pipeline;
import ca.gc.cra.tether.application.port.TransportException;
import ca.gc.cra.tether.domain.op.PipelineOperation;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Blocking submit helpers for the commands. Pipelines are asynchronous; a command waits on each step.
 */
final class CliOperations {
  private CliOperations() {}

  /**
   * Submits {@code op} and waits for it to complete.
   *
   * @throws OperationFailedException if the operation completed with an error or timed out
   * @throws InterruptedException if the caller was interrupted while waiting
   */
  static void submitAndAwait(Pipeline pipeline, PipelineOperation op, Duration timeout)
      throws InterruptedException {
    CompletableFuture<Void> completion = op.completion();
    pipeline.submit(op);
    await(op, completion, timeout);
  }

  static void await(PipelineOperation op, CompletableFuture<Void> completion, Duration timeout)
      throws InterruptedException {
    try {
      completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException ex) {
      throw new OperationFailedException(op, ex.getCause());
    } catch (TimeoutException ex) {
      throw new OperationFailedException(op, ex);
    }
  }

  static String describe(Throwable error) {
    if (error instanceof TimeoutException) {
      return "timed out";
    }
    if (error instanceof TransportException transport) {
      return (transport.isTransient() ? "transient transport failure: " : "transport failure: ")
          + transport.getMessage();
    }
    return error.getClass().getSimpleName() + ": " + error.getMessage();
  }

  /** Unchecked wrapper naming the operation that did not succeed. */
  static final class OperationFailedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    OperationFailedException(PipelineOperation op, Throwable cause) {
      super(op.kind() + " failed: " + describe(cause), cause);
    }
  }
}
