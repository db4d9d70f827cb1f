package ca.gc.cra.tether.application.pipeline;

import ca.gc.cra.tether.domain.event.PipelineEvent;
import ca.gc.cra.tether.domain.op.OperationCallback;
import ca.gc.cra.tether.domain.op.PipelineDefectException;
import ca.gc.cra.tether.domain.op.PipelineOperation;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Helpers every stage uses to move operations and events through the chain.
 * <p><strong>Why:</strong> Forwarding, completion and delegation each have one correct shape; keeping them here
 * means stages cannot forget to wire a replacement back to its original.</p>
 * <p><strong>Thread-safety:</strong> Stateless. Callers are stages running on the pipeline thread.</p>
 *
 * @since 0.1.0
 */
public final class OperationFlow {
  private static final Logger log = LoggerFactory.getLogger(OperationFlow.class);

  private OperationFlow() {}

  /**
   * Builds a replacement operation wired to the callback it is given.
   *
   * @param <T> replacement type
   */
  @FunctionalInterface
  public interface Replacement<T extends PipelineOperation> extends Function<OperationCallback, T> {}

  /**
   * Hands {@code op} to the stage after {@code stage}.
   *
   * @param stage current stage
   * @param op operation to forward
   * @throws PipelineConfigurationException when {@code stage} is the tail
   */
  public static void passToNext(PipelineStage stage, PipelineOperation op) {
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(op, "op");
    PipelineStage next = stage.nextStage();
    if (next == null) {
      throw new PipelineConfigurationException(op.kind(), stage.name());
    }
    next.run(op);
  }

  /**
   * Completes {@code op}.
   *
   * @param op operation to complete
   * @param error failure, or {@code null} for success
   * @throws ca.gc.cra.tether.domain.op.OperationAlreadyCompletedException if {@code op} was completed before
   */
  public static void complete(PipelineOperation op, Throwable error) {
    Objects.requireNonNull(op, "op");
    if (log.isTraceEnabled()) {
      log.trace("Completing {} {}", op, error == null ? "ok" : error.toString());
    }
    op.complete(error);
  }

  /**
   * Replaces {@code original} with a single new operation sent to the next stage. The replacement's outcome
   * completes the original; when both have the same kind the original also takes over the replacement's result.
   *
   * @param stage current stage
   * @param original operation being replaced
   * @param replacement factory receiving the callback the replacement must carry
   */
  public static void delegate(
      PipelineStage stage, PipelineOperation original, Replacement<? extends PipelineOperation> replacement) {
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(original, "original");
    Objects.requireNonNull(replacement, "replacement");
    PipelineOperation built = replacement.apply((done, error) -> {
      if (error == null && done.kind() == original.kind()) {
        original.inheritResult(done);
      }
      complete(original, error);
    });
    passToNext(stage, Objects.requireNonNull(built, "replacement produced null"));
  }

  /**
   * Replaces {@code original} with several operations run one after another. Each step is built only after the
   * previous one succeeded. The first failure completes the original and stops the chain; success of the last
   * step completes it successfully.
   *
   * @param stage current stage
   * @param original operation being replaced
   * @param steps factories for each step, in order; must not be empty
   */
  public static void delegateInSequence(
      PipelineStage stage, PipelineOperation original, List<Replacement<? extends PipelineOperation>> steps) {
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(original, "original");
    List<Replacement<? extends PipelineOperation>> copy = List.copyOf(steps);
    if (copy.isEmpty()) {
      throw new IllegalArgumentException("steps must not be empty");
    }
    runStep(stage, original, copy, 0);
  }

  /**
   * Hands {@code event} to the stage before {@code stage}, or to the pipeline's event sink at the head.
   *
   * @param stage current stage
   * @param event event to forward
   */
  public static void passEventUp(PipelineStage stage, PipelineEvent event) {
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(event, "event");
    PipelineStage previous = stage.previousStage();
    if (previous == null) {
      stage.context().deliverEvent(event);
    } else {
      previous.handleEvent(event);
    }
  }

  private static void runStep(
      PipelineStage stage,
      PipelineOperation original,
      List<Replacement<? extends PipelineOperation>> steps,
      int index) {
    if (index == steps.size()) {
      complete(original, null);
      return;
    }
    PipelineOperation step = steps.get(index).apply((done, error) -> {
      if (error != null) {
        complete(original, error);
      } else {
        continueSequence(stage, original, steps, index + 1);
      }
    });
    passToNext(stage, Objects.requireNonNull(step, "step produced null"));
  }

  // Later steps start from the previous step's callback, outside the stage's own failure handling.
  private static void continueSequence(
      PipelineStage stage,
      PipelineOperation original,
      List<Replacement<? extends PipelineOperation>> steps,
      int index) {
    try {
      runStep(stage, original, steps, index);
    } catch (PipelineDefectException defect) {
      throw defect;
    } catch (RuntimeException ex) {
      if (original.isCompleted()) {
        stage.context().reportBackgroundException(ex);
      } else {
        complete(original, ex);
      }
    }
  }
}
