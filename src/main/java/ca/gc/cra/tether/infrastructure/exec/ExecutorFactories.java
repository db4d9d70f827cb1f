package ca.gc.cra.tether.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.MDC;

/**
 * Factory helpers for the executors backing a TETHER pipeline: the serial pipeline thread, the callback
 * thread and the retry timer.
 */
public final class ExecutorFactories {
  private static final UncaughtExceptionHandler NO_OP_HANDLER = (t, ex) -> {};

  private ExecutorFactories() {}

  /**
   * Builds a single-thread executor whose queue is unbounded and FIFO, so tasks run strictly in submission
   * order on one thread.
   *
   * @param threadName name given to the worker thread
   * @param mdcPipeline value installed under the {@code pipeline} MDC key on the worker thread
   * @param handler uncaught exception handler installed on the worker thread
   * @param onThreadCreated observer notified with every worker thread the executor creates
   * @return configured executor service
   */
  public static ExecutorService newSerialExecutor(
      String threadName,
      String mdcPipeline,
      UncaughtExceptionHandler handler,
      Consumer<Thread> onThreadCreated) {
    String name = (threadName == null || threadName.isBlank()) ? "tether-serial" : threadName;
    Consumer<Thread> observer = Objects.requireNonNullElse(onThreadCreated, thread -> {});
    ThreadFactory factory =
        namedFactory(name, mdcPipeline, Objects.requireNonNullElse(handler, NO_OP_HANDLER), observer);
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a single-thread scheduler for timers. Cancelled tasks are removed from the queue immediately.
   *
   * @param threadName name given to the timer thread
   * @param mdcPipeline value installed under the {@code pipeline} MDC key on the timer thread
   * @return scheduler
   */
  public static ScheduledThreadPoolExecutor newTimer(String threadName, String mdcPipeline) {
    String name = (threadName == null || threadName.isBlank()) ? "tether-timer" : threadName;
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(1, namedFactory(name, mdcPipeline, NO_OP_HANDLER, thread -> {}));
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return scheduler;
  }

  private static ThreadFactory namedFactory(
      String name, String mdcPipeline, UncaughtExceptionHandler handler, Consumer<Thread> observer) {
    return runnable -> {
      Runnable withMdc = () -> {
        if (mdcPipeline != null) {
          MDC.put("pipeline", mdcPipeline);
        }
        runnable.run();
      };
      Thread thread = new Thread(withMdc, name);
      // Daemon threads; Pipeline.shutdown() is the orderly stop.
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(handler);
      observer.accept(thread);
      return thread;
    };
  }
}
