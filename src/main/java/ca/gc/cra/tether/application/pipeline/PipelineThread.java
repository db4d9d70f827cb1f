package ca.gc.cra.tether.application.pipeline;

import ca.gc.cra.tether.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> The single serialization context of one pipeline.
 * <p><strong>Why:</strong> Stage state is unsynchronized. Every stage entry point asserts it runs here, so state
 * races show up as {@link PipelineThreadViolationException} instead of silent corruption.</p>
 * <p><strong>Role:</strong> Owned by {@link Pipeline}; shared with stages through {@link StageContext}.</p>
 * <p><strong>Thread-safety:</strong> {@link #enqueue(Runnable)} and {@link #invokeOnPipelineThread(Runnable)} may be
 * called from any thread. Tasks run in FIFO order.</p>
 * <p><strong>Error handling:</strong> Runtime exceptions escaping a task are handed to the task failure handler so
 * the thread survives them.</p>
 *
 * @since 0.1.0
 */
public final class PipelineThread {
  private static final Logger log = LoggerFactory.getLogger(PipelineThread.class);

  private final String threadName;
  private final ExecutorService executor;
  private final Consumer<RuntimeException> taskFailureHandler;
  private volatile Thread thread;

  /**
   * Starts a pipeline thread.
   *
   * @param pipelineName pipeline name used for the thread name and MDC
   * @param taskFailureHandler receives runtime exceptions escaping a task
   */
  public PipelineThread(String pipelineName, Consumer<RuntimeException> taskFailureHandler) {
    Objects.requireNonNull(pipelineName, "pipelineName");
    this.taskFailureHandler = Objects.requireNonNull(taskFailureHandler, "taskFailureHandler");
    this.threadName = "tether-pipeline-" + pipelineName;
    this.executor = ExecutorFactories.newSerialExecutor(
        threadName,
        pipelineName,
        (t, ex) -> log.error("Pipeline thread {} died", t.getName(), ex),
        created -> this.thread = created);
  }

  /**
   * Name given to the pipeline thread.
   *
   * @return thread name
   */
  public String threadName() {
    return threadName;
  }

  /**
   * Tells whether the caller is running on this pipeline thread.
   *
   * @return {@code true} on the pipeline thread
   */
  public boolean isPipelineThread() {
    return Thread.currentThread() == thread;
  }

  /**
   * Fails when the caller is not on the pipeline thread.
   *
   * @param where description of the entry point being guarded
   * @throws PipelineThreadViolationException when called from another thread
   */
  public void assertOnPipelineThread(String where) {
    if (!isPipelineThread()) {
      Thread current = thread;
      throw new PipelineThreadViolationException(
          where, current == null ? null : current.getName(), Thread.currentThread().getName());
    }
  }

  /**
   * Queues a task behind everything already submitted.
   *
   * @param task task to run on the pipeline thread
   * @throws RejectedExecutionException after {@link #stop(Duration)}
   */
  public void enqueue(Runnable task) {
    Objects.requireNonNull(task, "task");
    executor.execute(() -> runGuarded(task));
  }

  /**
   * Runs the task inline when already on the pipeline thread, otherwise queues it.
   *
   * @param task task to run on the pipeline thread
   * @throws RejectedExecutionException after {@link #stop(Duration)} when called from another thread
   */
  public void invokeOnPipelineThread(Runnable task) {
    Objects.requireNonNull(task, "task");
    if (isPipelineThread()) {
      task.run();
    } else {
      enqueue(task);
    }
  }

  /**
   * Lets queued tasks finish, then stops the thread.
   *
   * @param timeout how long to wait for queued tasks
   * @return {@code true} when the thread finished within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  boolean stop(Duration timeout) throws InterruptedException {
    executor.shutdown();
    if (isPipelineThread()) {
      return false;
    }
    boolean finished = executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    if (!finished) {
      log.warn("Pipeline thread {} did not drain within {}", threadName, timeout);
      executor.shutdownNow();
    }
    return finished;
  }

  private void runGuarded(Runnable task) {
    try {
      task.run();
    } catch (RuntimeException ex) {
      taskFailureHandler.accept(ex);
    }
  }
}
