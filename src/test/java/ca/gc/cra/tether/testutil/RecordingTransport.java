package ca.gc.cra.tether.testutil;

import ca.gc.cra.tether.application.port.ConnectionArgs;
import ca.gc.cra.tether.application.port.TransportListener;
import ca.gc.cra.tether.application.port.TransportPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Transport double that records calls and completes them from its own thread. Failures can be queued per call type
 * and completions can be held back to keep operations in flight.
 */
public final class RecordingTransport implements TransportPort {
  private final ExecutorService completer = Executors.newSingleThreadExecutor(r -> {
    Thread thread = new Thread(r, "recording-transport");
    thread.setDaemon(true);
    return thread;
  });
  private final List<String> calls = new CopyOnWriteArrayList<>();
  private final Map<String, byte[]> payloads = new ConcurrentHashMap<>();
  private final Queue<Throwable> connectFailures = new ConcurrentLinkedQueue<>();
  private final Queue<Throwable> publishFailures = new ConcurrentLinkedQueue<>();
  private final Queue<Completion> heldCompletions = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile boolean holdCompletions;
  private volatile TransportListener listener;
  private volatile ConnectionArgs lastConnectionArgs;

  @Override
  public void setListener(TransportListener listener) {
    this.listener = listener;
  }

  @Override
  public void connect(ConnectionArgs args, Completion completion) {
    lastConnectionArgs = args;
    calls.add("connect");
    finish(completion, connectFailures.poll(), true);
  }

  @Override
  public void disconnect(Completion completion) {
    calls.add("disconnect");
    finish(completion, null, false);
  }

  @Override
  public void publish(String topic, byte[] payload, Completion completion) {
    calls.add("publish:" + topic);
    payloads.put(topic, payload.clone());
    finish(completion, publishFailures.poll(), false);
  }

  @Override
  public void subscribe(String topicFilter, Completion completion) {
    calls.add("subscribe:" + topicFilter);
    finish(completion, null, false);
  }

  @Override
  public void close() {
    closed.set(true);
    completer.shutdown();
  }

  public void failNextConnect(Throwable error) {
    connectFailures.add(error);
  }

  public void failNextPublish(Throwable error) {
    publishFailures.add(error);
  }

  public void holdCompletions(boolean hold) {
    this.holdCompletions = hold;
  }

  /** Completes every held call with {@code error}. */
  public void releaseHeld(Throwable error) {
    List<Completion> pending = new ArrayList<>();
    Completion next;
    while ((next = heldCompletions.poll()) != null) {
      pending.add(next);
    }
    pending.forEach(completion -> completer.execute(() -> completion.complete(error)));
  }

  public int heldCount() {
    return heldCompletions.size();
  }

  public List<String> calls() {
    return List.copyOf(calls);
  }

  public byte[] payload(String topic) {
    return payloads.get(topic);
  }

  public TransportListener listener() {
    return listener;
  }

  public ConnectionArgs lastConnectionArgs() {
    return lastConnectionArgs;
  }

  public boolean isClosed() {
    return closed.get();
  }

  private void finish(Completion completion, Throwable error, boolean connect) {
    if (holdCompletions) {
      heldCompletions.add(completion);
      return;
    }
    completer.execute(() -> {
      completion.complete(error);
      TransportListener current = listener;
      if (connect && error == null && current != null) {
        current.onConnected();
      }
    });
  }
}
