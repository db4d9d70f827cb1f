package ca.gc.cra.tether.application.pipeline;

/**
 * Base type for pipeline failures surfaced to callers through operation completions.
 *
 * @since 0.1.0
 */
public class PipelineException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public PipelineException(String message) {
    super(message);
  }

  public PipelineException(String message, Throwable cause) {
    super(message, cause);
  }
}
