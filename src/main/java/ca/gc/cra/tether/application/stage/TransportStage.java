package ca.gc.cra.tether.application.stage;

import ca.gc.cra.tether.application.pipeline.OperationFlow;
import ca.gc.cra.tether.application.pipeline.PipelineShutdownException;
import ca.gc.cra.tether.application.pipeline.PipelineStage;
import ca.gc.cra.tether.application.port.ConnectionArgs;
import ca.gc.cra.tether.application.port.TransportException;
import ca.gc.cra.tether.application.port.TransportListener;
import ca.gc.cra.tether.application.port.TransportPort;
import ca.gc.cra.tether.domain.event.ConnectedEvent;
import ca.gc.cra.tether.domain.event.DisconnectedEvent;
import ca.gc.cra.tether.domain.event.MessageReceivedEvent;
import ca.gc.cra.tether.domain.event.PipelineEvent;
import ca.gc.cra.tether.domain.op.PipelineOperation;
import ca.gc.cra.tether.domain.op.SendOperation;
import ca.gc.cra.tether.domain.op.SetClientCertificateOperation;
import ca.gc.cra.tether.domain.op.SetConnectionArgsOperation;
import ca.gc.cra.tether.domain.op.SetCredentialTokenOperation;
import ca.gc.cra.tether.domain.op.SubscribeOperation;
import ca.gc.cra.tether.domain.security.ClientCertificate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Tail stage adapting the transport vocabulary to a {@link TransportPort}.
 * <p><strong>Why:</strong> Transport libraries call back on their own threads; this stage is the one place where
 * those callbacks are marshalled back onto the pipeline thread.</p>
 * <p><strong>Role:</strong>
 * <ul>
 *   <li>Accumulates {@link ConnectionArgs} from the {@code SET_*} operations.</li>
 *   <li>Issues connect, disconnect, publish and subscribe requests and completes their operations when the
 *   transport reports back.</li>
 *   <li>Raises {@code CONNECTED}, {@code DISCONNECTED} and {@code MESSAGE_RECEIVED} events from listener
 *   callbacks.</li>
 * </ul>
 * Operations of any other kind fall off the end of the chain and fail with a configuration error.</p>
 * <p><strong>Thread-safety:</strong> Stage state is pipeline-thread only; transport callbacks may arrive on any
 * thread.</p>
 *
 * @since 0.1.0
 */
public final class TransportStage extends PipelineStage {
  private static final Logger log = LoggerFactory.getLogger(TransportStage.class);

  static final String API_VERSION = "2019-03-31";

  private final TransportPort transport;
  private final Map<Long, PipelineOperation> inFlight = new LinkedHashMap<>();
  private String host;
  private String clientId;
  private String username;
  private String sasToken;
  private ClientCertificate clientCertificate;

  public TransportStage(TransportPort transport) {
    super("transport");
    this.transport = Objects.requireNonNull(transport, "transport");
  }

  @Override
  protected void onAttach() {
    transport.setListener(new MarshallingListener());
  }

  @Override
  protected void runOperation(PipelineOperation op) {
    Optional<PipelineShutdownException> stopped = context().shutdownCause();
    if (stopped.isPresent()) {
      OperationFlow.complete(op, stopped.get());
      return;
    }
    switch (op.kind()) {
      case SET_CONNECTION_ARGS -> {
        SetConnectionArgsOperation args = (SetConnectionArgsOperation) op;
        host = args.provisioningHost();
        clientId = args.registrationId();
        username = args.idScope() + "/registrations/" + args.registrationId() + "/api-version=" + API_VERSION;
        sasToken = args.sasToken().orElse(null);
        clientCertificate = args.clientCertificate().orElse(null);
        log.debug("Connection arguments set for {} on {}", clientId, host);
        OperationFlow.complete(op, null);
      }
      case SET_CREDENTIAL_TOKEN -> {
        sasToken = ((SetCredentialTokenOperation) op).token();
        OperationFlow.complete(op, null);
      }
      case SET_CLIENT_CERTIFICATE -> {
        clientCertificate = ((SetClientCertificateOperation) op).certificate();
        OperationFlow.complete(op, null);
      }
      case CONNECT -> {
        if (host == null) {
          OperationFlow.complete(op, new TransportException("connection arguments have not been set", false));
          return;
        }
        ConnectionArgs args = new ConnectionArgs(host, clientId, username, sasToken, clientCertificate);
        log.info("Connecting {}", args);
        issue(op, completion -> transport.connect(args, completion));
      }
      case DISCONNECT -> issue(op, transport::disconnect);
      case SEND -> {
        SendOperation send = (SendOperation) op;
        issue(op, completion -> transport.publish(send.topic(), send.payload(), completion));
      }
      case SUBSCRIBE -> {
        SubscribeOperation subscribe = (SubscribeOperation) op;
        issue(op, completion -> transport.subscribe(subscribe.topicFilter(), completion));
      }
      default -> OperationFlow.passToNext(this, op);
    }
  }

  @Override
  protected void onShutdown(PipelineShutdownException cause) {
    List<PipelineOperation> outstanding = new ArrayList<>(inFlight.values());
    inFlight.clear();
    for (PipelineOperation op : outstanding) {
      if (!op.isCompleted()) {
        OperationFlow.complete(op, cause);
      }
    }
    try {
      transport.close();
    } catch (RuntimeException ex) {
      context().reportBackgroundException(ex);
    }
  }

  int inFlightCount() {
    return inFlight.size();
  }

  private void issue(PipelineOperation op, TransportCall call) {
    inFlight.put(op.id(), op);
    try {
      call.start(error -> marshal(() -> finish(op, error)));
    } catch (RuntimeException ex) {
      inFlight.remove(op.id());
      throw ex;
    }
  }

  private void finish(PipelineOperation op, Throwable error) {
    if (inFlight.remove(op.id()) == null) {
      log.debug("Ignoring late transport completion for {}", op);
      return;
    }
    OperationFlow.complete(op, error);
  }

  private void raise(PipelineEvent event) {
    marshal(() -> handleEvent(event));
  }

  private void marshal(Runnable task) {
    try {
      context().pipelineThread().enqueue(task);
    } catch (RejectedExecutionException ex) {
      log.debug("Pipeline {} stopped; dropping transport callback", context().pipelineName());
    }
  }

  @FunctionalInterface
  private interface TransportCall {
    void start(TransportPort.Completion completion);
  }

  private final class MarshallingListener implements TransportListener {
    @Override
    public void onConnected() {
      raise(new ConnectedEvent(context().clock().now()));
    }

    @Override
    public void onDisconnected(Throwable cause) {
      raise(new DisconnectedEvent(context().clock().now(), cause));
    }

    @Override
    public void onMessage(String topic, byte[] payload) {
      raise(new MessageReceivedEvent(context().clock().now(), topic, payload));
    }
  }
}
