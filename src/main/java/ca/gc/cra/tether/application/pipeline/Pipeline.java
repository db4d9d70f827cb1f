package ca.gc.cra.tether.application.pipeline;

import ca.gc.cra.tether.application.port.ClockPort;
import ca.gc.cra.tether.application.port.MetricsPort;
import ca.gc.cra.tether.domain.event.BackgroundExceptionEvent;
import ca.gc.cra.tether.domain.op.PipelineDefectException;
import ca.gc.cra.tether.domain.op.PipelineOperation;
import ca.gc.cra.tether.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Root of a TETHER stage chain and its only public entry point.
 * <p><strong>Why:</strong> Callers submit from arbitrary threads; the pipeline marshals every submission onto its
 * single pipeline thread in arrival order and runs caller callbacks on a separate callback thread.</p>
 * <p><strong>Role:</strong> Owns the pipeline thread, the callback thread and the timer. Built by
 * {@code CompositionRoot} or directly in tests.</p>
 * <p><strong>Thread-safety:</strong> All public methods may be called from any thread.</p>
 * <p><strong>Error handling:</strong> Defects escaping a stage are logged at ERROR, counted as
 * {@code pipeline.defect} and raised to the event sink as {@link BackgroundExceptionEvent}. After
 * {@link #shutdown()} every pending and later operation completes with {@link PipelineShutdownException}.</p>
 * <p><strong>Observability:</strong> Metrics {@code pipeline.op.submitted}, {@code pipeline.op.completed},
 * {@code pipeline.op.failed}, {@code pipeline.op.latencyNanos}; MDC key {@code pipeline} on pipeline threads.</p>
 *
 * @since 0.1.0
 */
public final class Pipeline implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

  private final String name;
  private final List<PipelineStage> stages;
  private final PipelineStage head;
  private final MetricsPort metrics;
  private final Duration shutdownTimeout;
  private final PipelineThread pipelineThread;
  private final ExecutorService callbackExecutor;
  private final Executor callbackDispatch;
  private final ScheduledThreadPoolExecutor timer;
  private final StageContext context;
  private final AtomicBoolean shutdownRequested = new AtomicBoolean();
  private volatile Thread callbackThread;
  // Pipeline thread only.
  private boolean terminated;

  /**
   * Links {@code stages} head first and starts the pipeline threads.
   *
   * @param name pipeline name used in thread names, logs and MDC
   * @param stages stage chain, head first; must be non-empty and free of duplicates
   * @param metrics metrics sink
   * @param clock clock stamping events
   * @param shutdownTimeout how long {@link #shutdown()} waits for queued work
   */
  public Pipeline(
      String name, List<? extends PipelineStage> stages, MetricsPort metrics, ClockPort clock, Duration shutdownTimeout) {
    this.name = Objects.requireNonNull(name, "name");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    this.stages = validateChain(stages);
    this.head = this.stages.get(0);
    this.pipelineThread = new PipelineThread(name, this::onTaskFailure);
    this.callbackExecutor =
        ExecutorFactories.newSerialExecutor(
            "tether-callback-" + name, name, (t, ex) -> log.error("Callback thread {} died", t.getName(), ex),
            created -> this.callbackThread = created);
    this.callbackDispatch = task -> {
      try {
        callbackExecutor.execute(task);
      } catch (RejectedExecutionException ex) {
        task.run();
      }
    };
    this.timer = ExecutorFactories.newTimer("tether-timer-" + name, name);
    this.context = new StageContext(name, pipelineThread, callbackDispatch, timer, metrics, clock);
    for (int i = 0; i < this.stages.size(); i++) {
      PipelineStage previous = i == 0 ? null : this.stages.get(i - 1);
      PipelineStage next = i + 1 < this.stages.size() ? this.stages.get(i + 1) : null;
      this.stages.get(i).link(context, previous, next);
    }
    pipelineThread.enqueue(() -> this.stages.forEach(PipelineStage::attach));
    log.info("Pipeline {} started with stages {}", name, this.stages);
  }

  public String name() {
    return name;
  }

  /**
   * Returns the linked stages, head first.
   *
   * @return immutable stage list
   */
  public List<PipelineStage> stages() {
    return stages;
  }

  /**
   * Queues {@code op} for the head stage. Operations submitted from one thread reach the head in submission order.
   * The operation's callback later runs on the callback thread.
   *
   * @param op operation to run; must be pending
   */
  public void submit(PipelineOperation op) {
    Objects.requireNonNull(op, "op");
    metrics.increment("pipeline.op.submitted");
    long startNanos = System.nanoTime();
    op.completion().whenComplete((ignored, error) -> {
      metrics.increment(error == null ? "pipeline.op.completed" : "pipeline.op.failed");
      metrics.observe("pipeline.op.latencyNanos", System.nanoTime() - startNanos);
    });
    if (shutdownRequested.get()) {
      op.complete(new PipelineShutdownException(name));
      return;
    }
    op.dispatchCallbackOn(callbackDispatch);
    try {
      pipelineThread.enqueue(() -> {
        if (terminated) {
          OperationFlow.complete(op, new PipelineShutdownException(name));
        } else {
          head.run(op);
        }
      });
    } catch (RejectedExecutionException ex) {
      op.complete(new PipelineShutdownException(name));
    }
  }

  /**
   * Replaces the sink receiving events that pass the head stage.
   *
   * @param sink new sink
   */
  public void registerEventSink(PipelineEventSink sink) {
    context.setEventSink(sink);
  }

  /**
   * Snapshot of the shared connection state.
   *
   * @return {@code true} while the transport is connected
   */
  public boolean isConnected() {
    return context.isConnected();
  }

  /**
   * Completes every pending operation with {@link PipelineShutdownException}, then stops the pipeline threads.
   * Later submissions complete with the same failure. Idempotent.
   */
  public void shutdown() {
    if (!shutdownRequested.compareAndSet(false, true)) {
      return;
    }
    log.info("Shutting down pipeline {}", name);
    CompletableFuture<Void> drained = new CompletableFuture<>();
    // The timer stays up until teardown has run; failures queued ahead of it may still schedule retries.
    Runnable teardownTask = () -> {
      try {
        teardown();
      } finally {
        timer.shutdownNow();
        drained.complete(null);
      }
    };
    try {
      pipelineThread.invokeOnPipelineThread(teardownTask);
    } catch (RejectedExecutionException ex) {
      timer.shutdownNow();
      drained.complete(null);
    }
    try {
      if (!pipelineThread.isPipelineThread()) {
        drained.get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
      }
      pipelineThread.stop(shutdownTimeout);
      callbackExecutor.shutdown();
      if (Thread.currentThread() != callbackThread
          && !callbackExecutor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Callbacks of pipeline {} still running after {}", name, shutdownTimeout);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while shutting down pipeline {}", name);
    } catch (ExecutionException | TimeoutException ex) {
      log.warn("Pipeline {} teardown did not finish within {}", name, shutdownTimeout, ex);
    } finally {
      timer.shutdownNow();
    }
    log.info("Pipeline {} stopped", name);
  }

  @Override
  public void close() {
    shutdown();
  }

  private void teardown() {
    terminated = true;
    PipelineShutdownException cause = new PipelineShutdownException(name);
    context.markShutdown(cause);
    // Tail first so in-flight transport work resolves before the stages above settle their originals.
    List<PipelineStage> reversed = new ArrayList<>(stages);
    Collections.reverse(reversed);
    for (PipelineStage stage : reversed) {
      try {
        stage.shutdown(cause);
      } catch (RuntimeException ex) {
        onTaskFailure(ex);
      }
    }
  }

  private void onTaskFailure(RuntimeException ex) {
    if (ex instanceof PipelineDefectException) {
      metrics.increment("pipeline.defect");
      log.error("Pipeline {} defect", name, ex);
    } else {
      metrics.increment("pipeline.background.error");
      log.error("Pipeline {} task failed", name, ex);
    }
    context.deliverEvent(new BackgroundExceptionEvent(context.clock().now(), ex));
  }

  private static List<PipelineStage> validateChain(List<? extends PipelineStage> stages) {
    Objects.requireNonNull(stages, "stages");
    if (stages.isEmpty()) {
      throw new IllegalArgumentException("pipeline needs at least one stage");
    }
    Map<PipelineStage, Boolean> seen = new IdentityHashMap<>();
    for (PipelineStage stage : stages) {
      Objects.requireNonNull(stage, "stage");
      if (seen.put(stage, Boolean.TRUE) != null) {
        throw new IllegalArgumentException("stage " + stage.name() + " appears twice");
      }
    }
    return List.copyOf(stages);
  }
}
