package ca.gc.cra.tether.application.pipeline;

import ca.gc.cra.tether.domain.op.OperationKind;
import java.util.Objects;

/**
 * Raised when an operation reaches the tail of a pipeline without any stage having handled it. This is a wiring
 * error in the stage chain, not a runtime condition.
 *
 * @since 0.1.0
 */
public final class PipelineConfigurationException extends PipelineException {
  private static final long serialVersionUID = 1L;

  private final OperationKind kind;

  /**
   * Creates the exception for an unhandled operation kind.
   *
   * @param kind operation kind nobody handled
   * @param tailStage name of the stage the operation fell off
   */
  public PipelineConfigurationException(OperationKind kind, String tailStage) {
    super("pipeline misconfigured: no stage handles operation kind "
        + Objects.requireNonNull(kind, "kind")
        + " (fell off after " + tailStage + ")");
    this.kind = kind;
  }

  /**
   * Returns the unhandled kind.
   *
   * @return operation kind
   */
  public OperationKind kind() {
    return kind;
  }
}
