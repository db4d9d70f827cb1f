package ca.gc.cra.tether.testutil;

import ca.gc.cra.tether.domain.op.PipelineOperation;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/** Blocking helpers for operation outcomes. */
public final class Completions {
  private static final long TIMEOUT_SECONDS = 10;

  private Completions() {}

  /**
   * Waits for {@code op} and returns its failure.
   *
   * @return failure cause, or {@code null} when the operation succeeded
   * @throws AssertionError if the operation does not complete in time
   */
  public static Throwable outcome(PipelineOperation op) throws InterruptedException {
    return outcome(op.completion());
  }

  public static Throwable outcome(CompletableFuture<Void> completion) throws InterruptedException {
    try {
      completion.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
      return null;
    } catch (ExecutionException ex) {
      return ex.getCause();
    } catch (TimeoutException ex) {
      throw new AssertionError("operation did not complete within " + TIMEOUT_SECONDS + "s", ex);
    }
  }

  /** Waits for {@code op} and fails the test if it completed with an error. */
  public static void assertSucceeded(PipelineOperation op) throws InterruptedException {
    Throwable error = outcome(op);
    if (error != null) {
      throw new AssertionError("expected " + op + " to succeed", error);
    }
  }

  /** Waits for {@code op} and returns its failure, failing the test if it succeeded. */
  public static Throwable assertFailed(PipelineOperation op) throws InterruptedException {
    Throwable error = outcome(op);
    if (error == null) {
      throw new AssertionError("expected " + op + " to fail");
    }
    return error;
  }
}
