package ca.gc.cra.tether.application.pipeline;

import ca.gc.cra.tether.domain.op.PipelineDefectException;

/**
 * Raised when stage logic is entered from a thread other than the pipeline thread.
 *
 * @since 0.1.0
 */
public final class PipelineThreadViolationException extends PipelineDefectException {
  private static final long serialVersionUID = 1L;

  private final String offendingThread;

  /**
   * Creates the exception.
   *
   * @param where entry point that was called, e.g. {@code retry.run}
   * @param expectedThread name of the pipeline thread, or {@code null} before it started
   * @param offendingThread name of the calling thread
   */
  public PipelineThreadViolationException(String where, String expectedThread, String offendingThread) {
    super(where + " must run on pipeline thread "
        + (expectedThread == null ? "<not started>" : expectedThread)
        + " but was called from " + offendingThread);
    this.offendingThread = offendingThread;
  }

  public String offendingThread() {
    return offendingThread;
  }
}
