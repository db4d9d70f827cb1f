package ca.gc.cra.tether.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class ExecutorFactoriesTest {

  @Test
  void serialExecutorRunsTasksInOrderOnOneNamedDaemonThread() throws Exception {
    List<Thread> created = new CopyOnWriteArrayList<>();
    ExecutorService executor = ExecutorFactories.newSerialExecutor("serial-test", "p1", null, created::add);
    List<String> seen = new CopyOnWriteArrayList<>();
    try {
      for (int i = 0; i < 5; i++) {
        int index = i;
        executor.execute(() -> seen.add(index + ":" + Thread.currentThread().getName() + ":" + MDC.get("pipeline")));
      }
    } finally {
      executor.shutdown();
    }
    assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

    assertEquals(List.of("0:serial-test:p1", "1:serial-test:p1", "2:serial-test:p1", "3:serial-test:p1",
        "4:serial-test:p1"), seen);
    assertEquals(1, created.size());
    assertTrue(created.get(0).isDaemon());
  }

  @Test
  void blankNameFallsBackToDefault() throws Exception {
    ExecutorService executor = ExecutorFactories.newSerialExecutor(" ", null, null, null);
    try {
      assertEquals("tether-serial", executor.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void serialExecutorRejectsAfterShutdown() {
    ExecutorService executor = ExecutorFactories.newSerialExecutor("serial-test", null, null, null);
    executor.shutdown();

    assertThrows(RejectedExecutionException.class, () -> executor.execute(() -> {}));
  }

  @Test
  void timerDropsCancelledTasks() {
    ScheduledThreadPoolExecutor timer = ExecutorFactories.newTimer("timer-test", "p1");
    try {
      timer.schedule(() -> {}, 1, TimeUnit.HOURS).cancel(false);

      assertTrue(timer.getQueue().isEmpty());
    } finally {
      timer.shutdownNow();
    }
  }
}
