package ca.gc.cra.tether.application.stage;

import ca.gc.cra.tether.application.pipeline.OperationFlow;
import ca.gc.cra.tether.application.pipeline.PipelineShutdownException;
import ca.gc.cra.tether.application.pipeline.PipelineStage;
import ca.gc.cra.tether.application.port.TransportException;
import ca.gc.cra.tether.domain.event.EventKind;
import ca.gc.cra.tether.domain.event.MessageReceivedEvent;
import ca.gc.cra.tether.domain.event.PipelineEvent;
import ca.gc.cra.tether.domain.op.PipelineDefectException;
import ca.gc.cra.tether.domain.op.PipelineOperation;
import ca.gc.cra.tether.domain.op.RegisterDeviceOperation;
import ca.gc.cra.tether.domain.op.SendOperation;
import ca.gc.cra.tether.domain.op.SubscribeOperation;
import ca.gc.cra.tether.domain.provisioning.RegistrationResult;
import ca.gc.cra.tether.logging.Logs;
import ca.gc.cra.tether.validation.Numbers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs device registrations as request/response exchanges with the provisioning service.
 * <p><strong>Why:</strong> Registration is a single caller operation but several topic messages on the wire:
 * a subscription to the response topic, the request, optional status polls, and the correlated response.</p>
 * <p><strong>Role:</strong> Consumes {@code REGISTER_DEVICE} operations and the {@code MESSAGE_RECEIVED} events that
 * answer them; everything else passes through.</p>
 * <p><strong>Thread-safety:</strong> Pipeline thread only.</p>
 * <p><strong>Wire format:</strong>
 * <ul>
 *   <li>Request: {@code $dps/registrations/PUT/iotdps-register/?$rid={id}}, body
 *   {@code {"registrationId": ..., "payload": ...}}.</li>
 *   <li>Status poll: {@code $dps/registrations/GET/iotdps-get-operationstatus/?$rid={id}&operationId={op}}.</li>
 *   <li>Response: {@code $dps/registrations/res/{status}/?$rid={id}[&retry-after={seconds}]}.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class RegistrationStage extends PipelineStage {
  private static final Logger log = LoggerFactory.getLogger(RegistrationStage.class);

  static final String RESPONSE_FILTER = "$dps/registrations/res/#";
  static final String RESPONSE_PREFIX = "$dps/registrations/res/";
  static final String REGISTER_TOPIC_PREFIX = "$dps/registrations/PUT/iotdps-register/?$rid=";
  static final String POLL_TOPIC_PREFIX = "$dps/registrations/GET/iotdps-get-operationstatus/?$rid=";

  private static final int STATUS_OK = 200;
  private static final int STATUS_ASSIGNING = 202;
  private static final long MAX_RETRY_AFTER_SECONDS = 3600;

  private final RegistrationJson json = new RegistrationJson();
  private final Duration defaultPollInterval;
  private final Map<String, RegisterDeviceOperation> pending = new LinkedHashMap<>();
  private final Map<String, ScheduledFuture<?>> pollTimers = new LinkedHashMap<>();
  private final List<RegisterDeviceOperation> awaitingSubscription = new ArrayList<>();
  private SubscriptionState subscription = SubscriptionState.NONE;
  private long nextRequestId = 1;

  /**
   * Creates the stage.
   *
   * @param defaultPollInterval delay between status polls when the service sends no {@code retry-after}
   */
  public RegistrationStage(Duration defaultPollInterval) {
    super("registration");
    this.defaultPollInterval = Numbers.requirePositive("defaultPollInterval", defaultPollInterval);
  }

  @Override
  protected void runOperation(PipelineOperation op) {
    if (op instanceof RegisterDeviceOperation register) {
      register(register);
    } else {
      OperationFlow.passToNext(this, op);
    }
  }

  @Override
  protected void handlePipelineEvent(PipelineEvent event) {
    if (event.kind() == EventKind.DISCONNECTED) {
      onConnectionLost();
    } else if (event instanceof MessageReceivedEvent message && message.topic().startsWith(RESPONSE_PREFIX)) {
      Optional<ResponseTopic> topic = ResponseTopic.parse(message.topic());
      if (topic.isPresent()) {
        RegisterDeviceOperation op = pending.remove(topic.get().requestId());
        if (op != null) {
          onResponse(op, topic.get(), message.payload());
          return;
        }
      }
    }
    OperationFlow.passEventUp(this, event);
  }

  @Override
  protected void onShutdown(PipelineShutdownException cause) {
    pollTimers.values().forEach(timer -> timer.cancel(false));
    pollTimers.clear();
    List<RegisterDeviceOperation> outstanding = new ArrayList<>(awaitingSubscription);
    outstanding.addAll(pending.values());
    awaitingSubscription.clear();
    pending.clear();
    for (RegisterDeviceOperation op : outstanding) {
      if (!op.isCompleted()) {
        OperationFlow.complete(op, cause);
      }
    }
  }

  int pendingCount() {
    return pending.size() + awaitingSubscription.size();
  }

  private void register(RegisterDeviceOperation op) {
    if (subscription == SubscriptionState.SUBSCRIBED) {
      sendRequest(op);
      return;
    }
    awaitingSubscription.add(op);
    if (subscription == SubscriptionState.NONE) {
      subscription = SubscriptionState.SUBSCRIBING;
      log.debug("Subscribing to {}", RESPONSE_FILTER);
      OperationFlow.passToNext(this, new SubscribeOperation(RESPONSE_FILTER, (done, error) -> onSubscribed(error)));
    }
  }

  private void onSubscribed(Throwable error) {
    List<RegisterDeviceOperation> waiting = new ArrayList<>(awaitingSubscription);
    awaitingSubscription.clear();
    if (error != null) {
      subscription = SubscriptionState.NONE;
      log.warn("Subscription to {} failed: {}", RESPONSE_FILTER, error.getMessage());
      waiting.forEach(op -> OperationFlow.complete(op, error));
      return;
    }
    subscription = SubscriptionState.SUBSCRIBED;
    waiting.forEach(this::sendRequest);
  }

  private void sendRequest(RegisterDeviceOperation op) {
    byte[] body;
    try {
      body = json.writeRequest(op.registrationId(), op.customPayloadJson().orElse(null));
    } catch (IllegalArgumentException ex) {
      OperationFlow.complete(op, ex);
      return;
    }
    String requestId = nextRequestId();
    log.debug("Registering {} as request {}", op.registrationId(), requestId);
    publish(op, requestId, REGISTER_TOPIC_PREFIX + requestId, body);
  }

  private void sendPoll(RegisterDeviceOperation op, String requestId, String operationId) {
    pollTimers.remove(requestId);
    if (pending.get(requestId) != op) {
      return;
    }
    publish(op, requestId, POLL_TOPIC_PREFIX + requestId + "&operationId=" + operationId, new byte[0]);
  }

  // A failed publish completes the registration unless its response already arrived.
  private void publish(RegisterDeviceOperation op, String requestId, String topic, byte[] body) {
    pending.put(requestId, op);
    try {
      OperationFlow.passToNext(this, new SendOperation(topic, body, (done, error) -> {
        if (error != null && pending.remove(requestId, op)) {
          OperationFlow.complete(op, error);
        }
      }));
    } catch (PipelineDefectException defect) {
      throw defect;
    } catch (RuntimeException ex) {
      if (pending.remove(requestId, op)) {
        OperationFlow.complete(op, ex);
      }
    }
  }

  private void onResponse(RegisterDeviceOperation op, ResponseTopic topic, byte[] payload) {
    int status = topic.status();
    if (status == STATUS_OK) {
      RegistrationResult result;
      try {
        result = json.readResult(payload);
      } catch (IllegalArgumentException ex) {
        OperationFlow.complete(op, ex);
        return;
      }
      log.info("Registration {} finished with status {} on hub {}", op.registrationId(), result.status(),
          result.assignedHub());
      op.recordResult(result);
      OperationFlow.complete(op, null);
    } else if (status == STATUS_ASSIGNING) {
      schedulePoll(op, topic, payload);
    } else {
      String body = Logs.truncate(Logs.scrub(new String(payload, StandardCharsets.UTF_8)), 512);
      log.warn("Registration {} rejected with status {}", op.registrationId(), status);
      OperationFlow.complete(op, new RegistrationFailedException(status, body));
    }
  }

  private void schedulePoll(RegisterDeviceOperation op, ResponseTopic topic, byte[] payload) {
    String operationId;
    try {
      operationId = json.readOperationId(payload);
    } catch (IllegalArgumentException ex) {
      OperationFlow.complete(op, ex);
      return;
    }
    Duration delay = topic.retryAfter().orElse(defaultPollInterval);
    String requestId = nextRequestId();
    pending.put(requestId, op);
    log.debug("Registration {} is assigning; polling operation {} in {}", op.registrationId(), operationId, delay);
    pollTimers.put(requestId, context().schedule(() -> sendPoll(op, requestId, operationId), delay));
  }

  // Subscriptions do not survive a lost connection; outstanding requests will never be answered.
  private void onConnectionLost() {
    subscription = SubscriptionState.NONE;
    if (pending.isEmpty()) {
      return;
    }
    pollTimers.values().forEach(timer -> timer.cancel(false));
    pollTimers.clear();
    List<RegisterDeviceOperation> lost = new ArrayList<>(pending.values());
    pending.clear();
    TransportException failure = new TransportException("connection lost before registration response", true);
    for (RegisterDeviceOperation op : lost) {
      if (!op.isCompleted()) {
        OperationFlow.complete(op, failure);
      }
    }
  }

  private String nextRequestId() {
    return Long.toString(nextRequestId++);
  }

  private enum SubscriptionState {
    NONE,
    SUBSCRIBING,
    SUBSCRIBED
  }

  /**
   * Parsed response topic.
   *
   * @param status status code
   * @param requestId value of {@code $rid}
   * @param retryAfter value of {@code retry-after}, when present
   */
  record ResponseTopic(int status, String requestId, Optional<Duration> retryAfter) {
    ResponseTopic {
      Objects.requireNonNull(requestId, "requestId");
      Objects.requireNonNull(retryAfter, "retryAfter");
    }

    static Optional<ResponseTopic> parse(String topic) {
      if (topic == null || !topic.startsWith(RESPONSE_PREFIX)) {
        return Optional.empty();
      }
      String rest = topic.substring(RESPONSE_PREFIX.length());
      int slash = rest.indexOf('/');
      int query = rest.indexOf('?');
      if (slash <= 0 || query < 0) {
        return Optional.empty();
      }
      int status;
      try {
        status = Integer.parseInt(rest.substring(0, slash));
      } catch (NumberFormatException ex) {
        return Optional.empty();
      }
      String requestId = null;
      Duration retryAfter = null;
      for (String pair : rest.substring(query + 1).split("&")) {
        int eq = pair.indexOf('=');
        if (eq <= 0) {
          continue;
        }
        String key = pair.substring(0, eq);
        String value = pair.substring(eq + 1);
        if ("$rid".equals(key)) {
          requestId = value;
        } else if ("retry-after".equals(key)) {
          retryAfter = parseRetryAfter(value);
        }
      }
      if (requestId == null || requestId.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(new ResponseTopic(status, requestId, Optional.ofNullable(retryAfter)));
    }

    private static Duration parseRetryAfter(String value) {
      try {
        long seconds = Long.parseLong(value);
        return seconds > 0 && seconds <= MAX_RETRY_AFTER_SECONDS ? Duration.ofSeconds(seconds) : null;
      } catch (NumberFormatException ex) {
        return null;
      }
    }
  }
}
