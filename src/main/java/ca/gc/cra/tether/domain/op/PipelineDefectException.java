package ca.gc.cra.tether.domain.op;

/**
 * <strong>What:</strong> Base type for programming errors detected inside a pipeline.
 * <p><strong>Why:</strong> Defects (double completion, off-thread stage access) must fail loudly. Stages never
 * convert them into operation failures; they escape to the pipeline task boundary, which logs and reports them.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 */
public abstract class PipelineDefectException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  protected PipelineDefectException(String message) {
    super(message);
  }
}
