package ca.gc.cra.tether.application.pipeline;

import ca.gc.cra.tether.application.port.ClockPort;
import ca.gc.cra.tether.application.port.MetricsPort;
import ca.gc.cra.tether.domain.event.BackgroundExceptionEvent;
import ca.gc.cra.tether.domain.event.PipelineEvent;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> State and services shared by every stage of one pipeline.
 * <p><strong>Role:</strong> Created by {@link Pipeline} and handed to each stage when the chain is linked.</p>
 * <p><strong>Thread-safety:</strong> The connection flag is written on the pipeline thread and readable anywhere.
 * Event delivery and timer scheduling may be called from any thread.</p>
 *
 * @since 0.1.0
 */
public final class StageContext {
  private static final Logger log = LoggerFactory.getLogger(StageContext.class);

  private final String pipelineName;
  private final PipelineThread pipelineThread;
  private final Executor callbackExecutor;
  private final ScheduledExecutorService timer;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private volatile PipelineEventSink eventSink = new LoggingEventSink();
  private volatile boolean connected;
  private volatile PipelineShutdownException shutdownCause;

  StageContext(
      String pipelineName,
      PipelineThread pipelineThread,
      Executor callbackExecutor,
      ScheduledExecutorService timer,
      MetricsPort metrics,
      ClockPort clock) {
    this.pipelineName = Objects.requireNonNull(pipelineName, "pipelineName");
    this.pipelineThread = Objects.requireNonNull(pipelineThread, "pipelineThread");
    this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
    this.timer = Objects.requireNonNull(timer, "timer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public String pipelineName() {
    return pipelineName;
  }

  public PipelineThread pipelineThread() {
    return pipelineThread;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  /**
   * Current connection state as last observed by the connection stage.
   *
   * @return {@code true} while connected
   */
  public boolean isConnected() {
    return connected;
  }

  /**
   * Records a connection state change. Pipeline thread only.
   *
   * @param connected new state
   */
  public void setConnected(boolean connected) {
    pipelineThread.assertOnPipelineThread("context.setConnected");
    this.connected = connected;
  }

  /**
   * Runs {@code task} on the pipeline thread after {@code delay}. Timers firing after shutdown are dropped.
   *
   * @param task task to run
   * @param delay delay before the task is queued
   * @return handle used to cancel the timer
   */
  public ScheduledFuture<?> schedule(Runnable task, Duration delay) {
    Objects.requireNonNull(task, "task");
    return timer.schedule(
        () -> {
          try {
            pipelineThread.enqueue(task);
          } catch (RejectedExecutionException ex) {
            log.debug("Dropping timer for stopped pipeline {}", pipelineName);
          }
        },
        delay.toNanos(),
        TimeUnit.NANOSECONDS);
  }

  /**
   * Hands an event that left the head stage to the registered sink on the callback thread.
   *
   * @param event event to deliver
   */
  public void deliverEvent(PipelineEvent event) {
    Objects.requireNonNull(event, "event");
    PipelineEventSink sink = eventSink;
    metrics.increment("pipeline.event.delivered");
    Runnable delivery = () -> {
      try {
        sink.onEvent(event);
      } catch (RuntimeException ex) {
        metrics.increment("pipeline.sink.error");
        log.error("Event sink failed on {}", event.kind(), ex);
      }
    };
    try {
      callbackExecutor.execute(delivery);
    } catch (RejectedExecutionException ex) {
      delivery.run();
    }
  }

  /**
   * Reports a failure that has no pending operation to complete.
   *
   * @param error failure to report
   */
  public void reportBackgroundException(Throwable error) {
    Objects.requireNonNull(error, "error");
    metrics.increment("pipeline.background.error");
    log.warn("Background exception in pipeline {}", pipelineName, error);
    deliverEvent(new BackgroundExceptionEvent(clock.now(), error));
  }

  /**
   * Failure pending work is completed with once the pipeline started shutting down.
   *
   * @return shutdown cause; empty while the pipeline is running
   */
  public Optional<PipelineShutdownException> shutdownCause() {
    return Optional.ofNullable(shutdownCause);
  }

  void markShutdown(PipelineShutdownException cause) {
    this.shutdownCause = cause;
  }

  void setEventSink(PipelineEventSink sink) {
    this.eventSink = Objects.requireNonNull(sink, "sink");
  }
}
