package ca.gc.cra.tether.application.pipeline;

/**
 * Completes operations that were still pending when their pipeline shut down, and operations submitted after it.
 *
 * @since 0.1.0
 */
public final class PipelineShutdownException extends PipelineException {
  private static final long serialVersionUID = 1L;

  public PipelineShutdownException(String pipelineName) {
    super("pipeline " + pipelineName + " is shut down");
  }
}
