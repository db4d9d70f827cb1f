package ca.gc.cra.tether.application.pipeline;

import ca.gc.cra.tether.domain.event.PipelineEvent;
import ca.gc.cra.tether.domain.op.PipelineDefectException;
import ca.gc.cra.tether.domain.op.PipelineOperation;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> One link in a pipeline's processing chain.
 * <p><strong>Why:</strong> Stages see operations on their way down and events on their way up. Each stage handles
 * the kinds it understands and forwards the rest, so concerns (credentials, retries, connection state, transport)
 * stay separate.</p>
 * <p><strong>Role:</strong> Subclasses override {@link #runOperation(PipelineOperation)} and
 * {@link #handlePipelineEvent(PipelineEvent)}; the defaults forward unchanged.</p>
 * <p><strong>Thread-safety:</strong> Every entry point asserts it runs on the pipeline thread; subclass state needs
 * no further synchronization.</p>
 * <p><strong>Error handling:</strong> A runtime failure in {@code runOperation} completes the operation with that
 * failure while it is still pending, otherwise it is reported as a background exception. Pipeline defects are
 * rethrown untouched.</p>
 *
 * @since 0.1.0
 */
public abstract class PipelineStage {
  private static final Logger log = LoggerFactory.getLogger(PipelineStage.class);

  private final String name;
  private StageContext context;
  private PipelineStage previous;
  private PipelineStage next;

  /**
   * Creates a stage.
   *
   * @param name short name used in logs and diagnostics
   */
  protected PipelineStage(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public final String name() {
    return name;
  }

  /**
   * Accepts an operation travelling down the chain.
   *
   * @param op operation; must not be {@code null}
   * @throws PipelineThreadViolationException when called off the pipeline thread
   */
  public final void run(PipelineOperation op) {
    Objects.requireNonNull(op, "op");
    requireContext().pipelineThread().assertOnPipelineThread(name + ".run");
    try {
      runOperation(op);
    } catch (PipelineDefectException defect) {
      throw defect;
    } catch (RuntimeException ex) {
      if (op.isCompleted()) {
        context.reportBackgroundException(ex);
      } else {
        if (ex instanceof PipelineConfigurationException) {
          log.error("{} failed {}", name, op, ex);
        } else {
          log.debug("{} failed {}: {}", name, op, ex.toString());
        }
        OperationFlow.complete(op, ex);
      }
    }
  }

  /**
   * Accepts an event travelling up the chain.
   *
   * @param event event; must not be {@code null}
   * @throws PipelineThreadViolationException when called off the pipeline thread
   */
  public final void handleEvent(PipelineEvent event) {
    Objects.requireNonNull(event, "event");
    requireContext().pipelineThread().assertOnPipelineThread(name + ".handleEvent");
    try {
      handlePipelineEvent(event);
    } catch (PipelineDefectException defect) {
      throw defect;
    } catch (RuntimeException ex) {
      context.reportBackgroundException(ex);
    }
  }

  /**
   * Stage-specific operation handling. The default forwards to the next stage.
   *
   * @param op operation to handle
   */
  protected void runOperation(PipelineOperation op) {
    OperationFlow.passToNext(this, op);
  }

  /**
   * Stage-specific event handling. The default forwards to the previous stage.
   *
   * @param event event to handle
   */
  protected void handlePipelineEvent(PipelineEvent event) {
    OperationFlow.passEventUp(this, event);
  }

  /**
   * Called once on the pipeline thread when the pipeline shuts down. Stages holding pending operations complete
   * them with {@code cause}.
   *
   * @param cause failure to complete pending operations with
   */
  protected void onShutdown(PipelineShutdownException cause) {}

  /**
   * Called once on the pipeline thread after the chain is linked.
   */
  protected void onAttach() {}

  /**
   * Shared pipeline context.
   *
   * @return context
   * @throws IllegalStateException before the stage joined a pipeline
   */
  protected final StageContext context() {
    return requireContext();
  }

  final PipelineStage nextStage() {
    return next;
  }

  final PipelineStage previousStage() {
    return previous;
  }

  final void link(StageContext context, PipelineStage previous, PipelineStage next) {
    if (this.context != null) {
      throw new IllegalStateException("stage " + name + " already belongs to pipeline " + this.context.pipelineName());
    }
    this.context = Objects.requireNonNull(context, "context");
    this.previous = previous;
    this.next = next;
  }

  final void attach() {
    requireContext().pipelineThread().assertOnPipelineThread(name + ".attach");
    onAttach();
  }

  final void shutdown(PipelineShutdownException cause) {
    requireContext().pipelineThread().assertOnPipelineThread(name + ".shutdown");
    onShutdown(cause);
  }

  private StageContext requireContext() {
    StageContext current = context;
    if (current == null) {
      throw new IllegalStateException("stage " + name + " is not linked into a pipeline");
    }
    return current;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + name + "]";
  }
}
