package ca.gc.cra.tether.infrastructure.transport;

import ca.gc.cra.tether.application.port.ConnectionArgs;
import ca.gc.cra.tether.application.port.TransportException;
import ca.gc.cra.tether.application.port.TransportListener;
import ca.gc.cra.tether.application.port.TransportPort;
import ca.gc.cra.tether.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.tether.validation.Strings;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> In-memory transport that behaves like a provisioning endpoint and a hub.
 * <p><strong>Why:</strong> Lets the CLI and integration tests drive a full pipeline without a broker.</p>
 * <p><strong>Behavior:</strong>
 * <ul>
 *   <li>Connect succeeds when the arguments carry a SAS token or a client certificate.</li>
 *   <li>Publishes and subscribes fail with a transient {@link TransportException} while disconnected.</li>
 *   <li>Registration requests are answered on {@code $dps/registrations/res/...}; the first
 *   {@code assigningPolls} answers report {@code 202 assigning}.</li>
 *   <li>Every other publish is recorded and acknowledged.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Requests are handled on a private worker thread, so completions and listener
 * callbacks always arrive off the caller's thread.</p>
 *
 * @since 0.1.0
 */
public final class LoopbackTransportAdapter implements TransportPort {
  private static final Logger log = LoggerFactory.getLogger(LoopbackTransportAdapter.class);

  private static final String REGISTER_PREFIX = "$dps/registrations/PUT/iotdps-register/?$rid=";
  private static final String POLL_PREFIX = "$dps/registrations/GET/iotdps-get-operationstatus/?$rid=";
  private static final String RESPONSE_FILTER = "$dps/registrations/res/#";

  private final String assignedHub;
  private final int assigningPolls;
  private final ExecutorService worker;
  private final JsonFactory json = new JsonFactory();
  private final List<PublishedMessage> published = new CopyOnWriteArrayList<>();
  private volatile TransportListener listener;
  // Worker thread only.
  private final Set<String> subscriptions = new HashSet<>();
  private boolean connected;
  private int answersUntilAssigned;
  private String lastRegistrationId;

  /**
   * Creates a loopback transport.
   *
   * @param assignedHub hub name reported in registration results
   * @param assigningPolls number of {@code 202 assigning} answers sent before a registration is assigned
   */
  public LoopbackTransportAdapter(String assignedHub, int assigningPolls) {
    this.assignedHub = Strings.requireNonBlank("assignedHub", assignedHub);
    if (assigningPolls < 0) {
      throw new IllegalArgumentException("assigningPolls must be >= 0");
    }
    this.assigningPolls = assigningPolls;
    this.worker = ExecutorFactories.newSerialExecutor(
        "tether-loopback", null, (t, ex) -> log.error("Loopback worker died", ex), null);
  }

  @Override
  public void setListener(TransportListener listener) {
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  @Override
  public void connect(ConnectionArgs args, Completion completion) {
    submit(completion, () -> {
      if (args.password().isEmpty() && args.certificate().isEmpty()) {
        throw new TransportException("not authorized: no credential for " + args.clientId(), false);
      }
      boolean wasConnected = connected;
      connected = true;
      completion.complete(null);
      if (!wasConnected) {
        log.info("Loopback connected as {}", args.clientId());
        notifyListener(TransportListener::onConnected);
      }
    });
  }

  @Override
  public void disconnect(Completion completion) {
    submit(completion, () -> {
      boolean wasConnected = connected;
      connected = false;
      subscriptions.clear();
      completion.complete(null);
      if (wasConnected) {
        notifyListener(l -> l.onDisconnected(null));
      }
    });
  }

  @Override
  public void subscribe(String topicFilter, Completion completion) {
    submit(completion, () -> {
      requireConnected();
      subscriptions.add(topicFilter);
      completion.complete(null);
    });
  }

  @Override
  public void publish(String topic, byte[] payload, Completion completion) {
    byte[] body = payload.clone();
    submit(completion, () -> {
      requireConnected();
      if (topic.startsWith(REGISTER_PREFIX)) {
        lastRegistrationId = readRegistrationId(body);
        answersUntilAssigned = assigningPolls;
        completion.complete(null);
        answerRegistration(topic.substring(REGISTER_PREFIX.length()));
      } else if (topic.startsWith(POLL_PREFIX)) {
        completion.complete(null);
        String query = topic.substring(POLL_PREFIX.length());
        int amp = query.indexOf('&');
        answerRegistration(amp < 0 ? query : query.substring(0, amp));
      } else {
        published.add(new PublishedMessage(topic, body));
        log.debug("Loopback accepted {} bytes on {}", body.length, topic);
        completion.complete(null);
      }
    });
  }

  /**
   * Drops the connection as if the network failed.
   *
   * @param cause failure reported to the listener
   */
  public void simulateConnectionLoss(Throwable cause) {
    worker.execute(() -> {
      if (connected) {
        connected = false;
        subscriptions.clear();
        notifyListener(l -> l.onDisconnected(cause));
      }
    });
  }

  /**
   * Returns the hub messages accepted so far.
   *
   * @return snapshot of published messages in arrival order
   */
  public List<PublishedMessage> published() {
    return new ArrayList<>(published);
  }

  @Override
  public void close() {
    worker.shutdown();
  }

  private void answerRegistration(String requestId) {
    if (!subscriptions.contains(RESPONSE_FILTER)) {
      log.debug("No subscriber for registration response {}", requestId);
      return;
    }
    String operationId =
        "loopback-" + UUID.nameUUIDFromBytes(String.valueOf(lastRegistrationId).getBytes(StandardCharsets.UTF_8));
    if (answersUntilAssigned > 0) {
      answersUntilAssigned--;
      byte[] body = writeResponse(operationId, "assigning", false);
      String topic = "$dps/registrations/res/202/?$rid=" + requestId + "&retry-after=1";
      notifyListener(l -> l.onMessage(topic, body));
      return;
    }
    byte[] body = writeResponse(operationId, "assigned", true);
    String topic = "$dps/registrations/res/200/?$rid=" + requestId;
    notifyListener(l -> l.onMessage(topic, body));
  }

  private byte[] writeResponse(String operationId, String status, boolean withState) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(256);
    try (JsonGenerator gen = json.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("operationId", operationId);
      gen.writeStringField("status", status);
      if (withState) {
        gen.writeObjectFieldStart("registrationState");
        gen.writeStringField("registrationId", lastRegistrationId);
        gen.writeStringField("assignedHub", assignedHub);
        gen.writeStringField("deviceId", lastRegistrationId);
        gen.writeStringField("status", status);
        gen.writeStringField("substatus", "initialAssignment");
        gen.writeEndObject();
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to write loopback registration response", ex);
    }
    return out.toByteArray();
  }

  private String readRegistrationId(byte[] body) {
    try (JsonParser parser = json.createParser(body)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new TransportException("registration request is not a JSON object", false);
      }
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        parser.nextToken();
        if ("registrationId".equals(field)) {
          return parser.getText();
        }
        parser.skipChildren();
      }
    } catch (IOException ex) {
      throw new TransportException("malformed registration request", ex, false);
    }
    throw new TransportException("registration request has no registrationId", false);
  }

  private void requireConnected() {
    if (!connected) {
      throw new TransportException("not connected", true);
    }
  }

  private void submit(Completion completion, Runnable request) {
    Objects.requireNonNull(completion, "completion");
    try {
      worker.execute(() -> {
        try {
          request.run();
        } catch (TransportException ex) {
          completion.complete(ex);
        } catch (RuntimeException ex) {
          log.warn("Loopback request failed", ex);
          completion.complete(new TransportException("loopback request failed", ex, false));
        }
      });
    } catch (RejectedExecutionException ex) {
      completion.complete(new TransportException("transport closed", ex, false));
    }
  }

  private void notifyListener(Consumer<TransportListener> call) {
    TransportListener current = listener;
    if (current != null) {
      call.accept(current);
    }
  }

  /**
   * Message accepted by the loopback hub.
   *
   * @param topic publish topic
   * @param payload message bytes
   */
  public record PublishedMessage(String topic, byte[] payload) {
    public PublishedMessage {
      Objects.requireNonNull(topic, "topic");
      payload = Objects.requireNonNull(payload, "payload").clone();
    }

    @Override
    public byte[] payload() {
      return payload.clone();
    }
  }
}
