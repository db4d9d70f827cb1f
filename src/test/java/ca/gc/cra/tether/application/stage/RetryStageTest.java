package ca.gc.cra.tether.application.stage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.tether.application.pipeline.Pipeline;
import ca.gc.cra.tether.application.pipeline.PipelineShutdownException;
import ca.gc.cra.tether.application.port.ClockPort;
import ca.gc.cra.tether.application.port.TransportException;
import ca.gc.cra.tether.domain.message.TelemetryMessage;
import ca.gc.cra.tether.domain.op.ConnectOperation;
import ca.gc.cra.tether.domain.op.PipelineOperation;
import ca.gc.cra.tether.domain.op.SendTelemetryOperation;
import ca.gc.cra.tether.domain.op.SubscribeOperation;
import ca.gc.cra.tether.testutil.Completions;
import ca.gc.cra.tether.testutil.RecordingMetrics;
import ca.gc.cra.tether.testutil.ScriptedTailStage;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RetryStageTest {
  private static final RetryPolicy FAST = new RetryPolicy(3, Duration.ofMillis(5), Duration.ofMillis(20));

  private final RecordingMetrics metrics = new RecordingMetrics();
  private final ScriptedTailStage tail = new ScriptedTailStage();
  private Pipeline pipeline;

  @AfterEach
  void tearDown() {
    if (pipeline != null) {
      pipeline.shutdown();
    }
  }

  @Test
  void transientFailureIsRetriedUntilSuccess() throws Exception {
    AtomicInteger attempts = new AtomicInteger();
    tail.script((stage, op) -> stage.complete(op,
        attempts.incrementAndGet() < 3 ? new TransportException("broker busy", true) : null));
    pipeline = newPipeline(FAST);
    SendTelemetryOperation op = telemetry();

    pipeline.submit(op);

    Completions.assertSucceeded(op);
    List<PipelineOperation> received = tail.received();
    assertEquals(3, received.size());
    received.forEach(copy -> assertNotSame(op, copy));
    assertSame(op.message(), ((SendTelemetryOperation) received.get(2)).message());
    assertEquals(2, metrics.count("pipeline.retry.scheduled"));
    assertEquals(0, metrics.count("pipeline.retry.exhausted"));
  }

  @Test
  void nonTransientFailureIsNotRetried() throws Exception {
    TransportException fatal = new TransportException("not authorized", false);
    tail.script((stage, op) -> stage.complete(op, fatal));
    pipeline = newPipeline(FAST);
    ConnectOperation op = new ConnectOperation(null);

    pipeline.submit(op);

    assertSame(fatal, Completions.assertFailed(op));
    assertEquals(1, tail.received().size());
    assertEquals(0, metrics.count("pipeline.retry.scheduled"));
  }

  @Test
  void lastErrorIsReportedOnceAttemptsAreExhausted() throws Exception {
    AtomicInteger attempts = new AtomicInteger();
    tail.script((stage, op) -> stage.complete(op,
        new TransportException("timeout " + attempts.incrementAndGet(), true)));
    pipeline = newPipeline(FAST);
    SendTelemetryOperation op = telemetry();

    pipeline.submit(op);

    Throwable error = Completions.assertFailed(op);
    assertEquals("timeout 3", error.getMessage());
    assertEquals(3, tail.received().size());
    assertEquals(2, metrics.count("pipeline.retry.scheduled"));
    assertEquals(1, metrics.count("pipeline.retry.exhausted"));
  }

  @Test
  void kindsOutsideTheRetrySetPassThroughUntouched() throws Exception {
    tail.script((stage, op) -> stage.complete(op, new TransportException("lost", true)));
    pipeline = newPipeline(FAST);
    SubscribeOperation op = new SubscribeOperation("$dps/registrations/res/#", null);

    pipeline.submit(op);

    Completions.assertFailed(op);
    assertEquals(List.of(op), tail.received());
  }

  @Test
  void shutdownFailsOperationsWaitingForTheirNextAttempt() throws Exception {
    tail.script((stage, op) -> stage.complete(op, new TransportException("offline", true)));
    RetryPolicy slow = new RetryPolicy(5, Duration.ofMinutes(1), Duration.ofMinutes(1));
    pipeline = newPipeline(slow);
    SendTelemetryOperation op = telemetry();

    pipeline.submit(op);
    waitForScheduledRetry();
    pipeline.shutdown();

    assertInstanceOf(PipelineShutdownException.class, Completions.assertFailed(op));
    assertEquals(1, tail.received().size());
  }

  @Test
  void transientFailureQueuedAheadOfShutdownStillCompletes() throws Exception {
    CountDownLatch gate = new CountDownLatch(1);
    tail.script((stage, op) -> {
      if (op instanceof ConnectOperation) {
        stage.hold(op);
        return;
      }
      try {
        gate.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
      stage.complete(op, null);
    });
    RetryPolicy slow = new RetryPolicy(5, Duration.ofMinutes(1), Duration.ofMinutes(1));
    pipeline = newPipeline(slow);
    ConnectOperation connect = new ConnectOperation(null);

    pipeline.submit(connect);
    awaitReceived(1);
    pipeline.submit(new SubscribeOperation("$dps/registrations/res/#", null));
    awaitReceived(2);
    tail.releaseHeld(new TransportException("busy", true));
    Thread stopper = new Thread(pipeline::shutdown, "retry-test-shutdown");
    stopper.start();
    awaitWaiting(stopper);
    gate.countDown();

    assertInstanceOf(PipelineShutdownException.class, Completions.assertFailed(connect));
    stopper.join(TimeUnit.SECONDS.toMillis(5));
    assertEquals(1, tail.received(ConnectOperation.class).size());
  }

  private void awaitReceived(int count) throws InterruptedException {
    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (tail.received().size() < count) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("tail received " + tail.received().size() + " of " + count);
      }
      Thread.sleep(5);
    }
  }

  private static void awaitWaiting(Thread thread) throws InterruptedException {
    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (thread.getState() != Thread.State.TIMED_WAITING) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError(thread.getName() + " never started waiting");
      }
      Thread.sleep(5);
    }
  }

  private void waitForScheduledRetry() throws InterruptedException {
    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (metrics.count("pipeline.retry.scheduled") == 0) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("retry was never scheduled");
      }
      Thread.sleep(5);
    }
  }

  private Pipeline newPipeline(RetryPolicy policy) {
    return new Pipeline("retry", List.of(new RetryStage(policy), tail), metrics, ClockPort.SYSTEM,
        Duration.ofSeconds(5));
  }

  private static SendTelemetryOperation telemetry() {
    return new SendTelemetryOperation("dev-1", TelemetryMessage.json("{\"temp\":4}"), null);
  }
}
