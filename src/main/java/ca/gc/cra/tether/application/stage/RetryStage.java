package ca.gc.cra.tether.application.stage;

import ca.gc.cra.tether.application.pipeline.OperationFlow;
import ca.gc.cra.tether.application.pipeline.PipelineShutdownException;
import ca.gc.cra.tether.application.pipeline.PipelineStage;
import ca.gc.cra.tether.application.port.TransportException;
import ca.gc.cra.tether.domain.op.OperationKind;
import ca.gc.cra.tether.domain.op.PipelineDefectException;
import ca.gc.cra.tether.domain.op.PipelineOperation;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Re-issues operations that failed with a transient transport error.
 * <p><strong>Why:</strong> Links drop and brokers throttle; callers should see one outcome per operation, not the
 * noise of individual attempts.</p>
 * <p><strong>Role:</strong> Sends a fresh copy of each retryable operation downstream per attempt. The original
 * stays pending until an attempt succeeds, a non-transient failure arrives or attempts run out.</p>
 * <p><strong>Thread-safety:</strong> Pipeline thread only. Timers fire on the pipeline timer and re-enter the
 * pipeline thread.</p>
 * <p><strong>Observability:</strong> {@code pipeline.retry.scheduled}, {@code pipeline.retry.exhausted}.</p>
 *
 * @since 0.1.0
 */
public final class RetryStage extends PipelineStage {
  private static final Logger log = LoggerFactory.getLogger(RetryStage.class);

  static final Set<OperationKind> RETRYABLE = EnumSet.of(
      OperationKind.CONNECT,
      OperationKind.SEND_TELEMETRY,
      OperationKind.SEND_METHOD_RESPONSE,
      OperationKind.UPLOAD_BLOB,
      OperationKind.REGISTER_DEVICE);

  private final RetryPolicy policy;
  // Keyed by original operation id; insertion order keeps shutdown completions in scheduling order.
  private final Map<Long, WaitingRetry> waiting = new LinkedHashMap<>();

  public RetryStage(RetryPolicy policy) {
    super("retry");
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  @Override
  protected void runOperation(PipelineOperation op) {
    if (RETRYABLE.contains(op.kind())) {
      attempt(op, 1);
    } else {
      OperationFlow.passToNext(this, op);
    }
  }

  @Override
  protected void onShutdown(PipelineShutdownException cause) {
    for (WaitingRetry retry : new ArrayList<>(waiting.values())) {
      retry.timer().cancel(false);
      if (!retry.original().isCompleted()) {
        OperationFlow.complete(retry.original(), cause);
      }
    }
    waiting.clear();
  }

  /**
   * Number of operations currently waiting for a retry timer.
   *
   * @return waiting count
   */
  int waitingCount() {
    return waiting.size();
  }

  private void attempt(PipelineOperation original, int attemptNumber) {
    PipelineOperation copy = original.copyForRetry(
        (done, error) -> onAttemptCompleted(original, done, error, attemptNumber));
    OperationFlow.passToNext(this, copy);
  }

  private void onAttemptCompleted(
      PipelineOperation original, PipelineOperation attempt, Throwable error, int attemptNumber) {
    if (error == null) {
      original.inheritResult(attempt);
      OperationFlow.complete(original, null);
      return;
    }
    if (!isTransient(error) || context().shutdownCause().isPresent()) {
      OperationFlow.complete(original, error);
      return;
    }
    if (!policy.allowsAnotherAttempt(attemptNumber)) {
      context().metrics().increment("pipeline.retry.exhausted");
      log.warn("Giving up on {} after {} attempts: {}", original, attemptNumber, error.getMessage());
      OperationFlow.complete(original, error);
      return;
    }
    Duration delay = policy.backoffAfter(attemptNumber);
    context().metrics().increment("pipeline.retry.scheduled");
    log.info("Attempt {} of {} failed ({}); retrying in {}", attemptNumber, original, error.getMessage(), delay);
    long key = original.id();
    ScheduledFuture<?> timer;
    try {
      timer = context().schedule(() -> fire(key), delay);
    } catch (RejectedExecutionException ex) {
      log.debug("Retry timer stopped; failing {}", original);
      OperationFlow.complete(original, context().shutdownCause()
          .orElseGet(() -> new PipelineShutdownException(context().pipelineName())));
      return;
    }
    waiting.put(key, new WaitingRetry(original, attemptNumber + 1, timer));
  }

  private void fire(long key) {
    WaitingRetry retry = waiting.remove(key);
    if (retry == null) {
      return;
    }
    try {
      attempt(retry.original(), retry.nextAttempt());
    } catch (PipelineDefectException defect) {
      throw defect;
    } catch (RuntimeException ex) {
      if (retry.original().isCompleted()) {
        context().reportBackgroundException(ex);
      } else {
        OperationFlow.complete(retry.original(), ex);
      }
    }
  }

  private static boolean isTransient(Throwable error) {
    return error instanceof TransportException transport && transport.isTransient();
  }

  private record WaitingRetry(PipelineOperation original, int nextAttempt, ScheduledFuture<?> timer) {}
}
