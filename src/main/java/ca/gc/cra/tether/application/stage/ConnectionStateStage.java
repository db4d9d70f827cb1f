package ca.gc.cra.tether.application.stage;

import ca.gc.cra.tether.application.pipeline.OperationFlow;
import ca.gc.cra.tether.application.pipeline.OperationFlow.Replacement;
import ca.gc.cra.tether.application.pipeline.PipelineShutdownException;
import ca.gc.cra.tether.application.pipeline.PipelineStage;
import ca.gc.cra.tether.domain.event.PipelineEvent;
import ca.gc.cra.tether.domain.op.ConnectOperation;
import ca.gc.cra.tether.domain.op.DisconnectOperation;
import ca.gc.cra.tether.domain.op.OperationCallback;
import ca.gc.cra.tether.domain.op.OperationKind;
import ca.gc.cra.tether.domain.op.PipelineDefectException;
import ca.gc.cra.tether.domain.op.PipelineOperation;
import ca.gc.cra.tether.domain.op.SendMethodResponseOperation;
import ca.gc.cra.tether.domain.op.SendOperation;
import ca.gc.cra.tether.domain.op.SendTelemetryOperation;
import ca.gc.cra.tether.domain.op.SubscribeOperation;
import ca.gc.cra.tether.domain.op.UploadBlobOperation;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns the connection state of a pipeline and translates hub-level sends into topic
 * publishes.
 * <p><strong>Why:</strong> Callers should be able to send without managing the connection, and the transport must
 * never see overlapping connect and disconnect requests.</p>
 * <p><strong>Role:</strong>
 * <ul>
 *   <li>Tracks {@code CONNECTED}/{@code DISCONNECTED} in the shared stage context.</li>
 *   <li>Maps telemetry, method responses and blob uploads to {@code SEND} operations.</li>
 *   <li>Connects first when a send or subscribe arrives while disconnected.</li>
 *   <li>Holds later operations in a FIFO while a connection change is in flight.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Pipeline thread only.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionStateStage extends PipelineStage {
  private static final Logger log = LoggerFactory.getLogger(ConnectionStateStage.class);

  private static final Set<OperationKind> NEEDS_CONNECTION = EnumSet.of(
      OperationKind.SEND_TELEMETRY,
      OperationKind.SEND_METHOD_RESPONSE,
      OperationKind.UPLOAD_BLOB,
      OperationKind.SEND,
      OperationKind.SUBSCRIBE);

  private final Deque<PipelineOperation> blocked = new ArrayDeque<>();
  private PipelineOperation changeInFlight;

  public ConnectionStateStage() {
    super("connection-state");
  }

  @Override
  protected void runOperation(PipelineOperation op) {
    if (changeInFlight != null) {
      log.debug("Holding {} behind {}", op, changeInFlight);
      blocked.addLast(op);
      return;
    }
    dispatch(op);
  }

  @Override
  protected void handlePipelineEvent(PipelineEvent event) {
    switch (event.kind()) {
      case CONNECTED -> context().setConnected(true);
      case DISCONNECTED -> context().setConnected(false);
      default -> {
        // not a connection event
      }
    }
    OperationFlow.passEventUp(this, event);
  }

  @Override
  protected void onShutdown(PipelineShutdownException cause) {
    List<PipelineOperation> waiting = new ArrayList<>(blocked);
    blocked.clear();
    for (PipelineOperation op : waiting) {
      if (!op.isCompleted()) {
        OperationFlow.complete(op, cause);
      }
    }
  }

  int blockedCount() {
    return blocked.size();
  }

  private void dispatch(PipelineOperation op) {
    switch (op.kind()) {
      case CONNECT -> {
        if (context().isConnected()) {
          OperationFlow.complete(op, null);
        } else {
          startChange(new ConnectOperation(completingChange(OperationKind.CONNECT, op)));
        }
      }
      case DISCONNECT -> {
        if (context().isConnected()) {
          startChange(new DisconnectOperation(completingChange(OperationKind.DISCONNECT, op)));
        } else {
          OperationFlow.complete(op, null);
        }
      }
      case SEND_TELEMETRY -> {
        SendTelemetryOperation telemetry = (SendTelemetryOperation) op;
        String topic = Topics.telemetry(telemetry.deviceId(), telemetry.message());
        byte[] payload = telemetry.message().payload();
        sendWhenConnected(op, callback -> new SendOperation(topic, payload, callback));
      }
      case SEND_METHOD_RESPONSE -> {
        SendMethodResponseOperation response = (SendMethodResponseOperation) op;
        String topic = Topics.methodResponse(response.requestId(), response.status());
        byte[] payload = response.payload();
        sendWhenConnected(op, callback -> new SendOperation(topic, payload, callback));
      }
      case UPLOAD_BLOB -> {
        UploadBlobOperation upload = (UploadBlobOperation) op;
        String topic = Topics.blob(upload.blobName());
        byte[] content = upload.content();
        sendWhenConnected(op, callback -> new SendOperation(topic, content, callback));
      }
      case SEND -> {
        SendOperation send = (SendOperation) op;
        sendWhenConnected(op, callback -> new SendOperation(send.topic(), send.payload(), callback));
      }
      case SUBSCRIBE -> {
        SubscribeOperation subscribe = (SubscribeOperation) op;
        sendWhenConnected(op, callback -> new SubscribeOperation(subscribe.topicFilter(), callback));
      }
      default -> OperationFlow.passToNext(this, op);
    }
  }

  private void sendWhenConnected(PipelineOperation original, Replacement<? extends PipelineOperation> send) {
    if (context().isConnected()) {
      OperationFlow.delegate(this, original, send);
      return;
    }
    log.debug("Connecting before {}", original);
    List<Replacement<? extends PipelineOperation>> steps = List.of(
        callback -> {
          ConnectOperation connect = new ConnectOperation(changeCallback(OperationKind.CONNECT, callback));
          changeInFlight = connect;
          return connect;
        },
        send);
    try {
      OperationFlow.delegateInSequence(this, original, steps);
    } catch (RuntimeException ex) {
      changeInFlight = null;
      throw ex;
    }
  }

  private void startChange(PipelineOperation change) {
    changeInFlight = change;
    try {
      OperationFlow.passToNext(this, change);
    } catch (RuntimeException ex) {
      changeInFlight = null;
      throw ex;
    }
  }

  private OperationCallback completingChange(OperationKind kind, PipelineOperation original) {
    return changeCallback(kind, (done, error) -> OperationFlow.complete(original, error));
  }

  private OperationCallback changeCallback(OperationKind kind, OperationCallback downstream) {
    return (done, error) -> {
      if (changeInFlight == done) {
        changeInFlight = null;
      }
      if (error == null) {
        context().setConnected(kind == OperationKind.CONNECT);
      } else {
        log.debug("{} failed: {}", kind, error.toString());
      }
      downstream.onComplete(done, error);
      release(kind == OperationKind.CONNECT ? error : null);
    };
  }

  // After a failed connect, held operations that need the connection fail with the same error.
  private void release(Throwable connectFailure) {
    while (changeInFlight == null && !blocked.isEmpty()) {
      PipelineOperation op = blocked.pollFirst();
      if (connectFailure != null && NEEDS_CONNECTION.contains(op.kind())) {
        OperationFlow.complete(op, connectFailure);
        continue;
      }
      try {
        dispatch(op);
      } catch (PipelineDefectException defect) {
        throw defect;
      } catch (RuntimeException ex) {
        if (op.isCompleted()) {
          context().reportBackgroundException(ex);
        } else {
          OperationFlow.complete(op, ex);
        }
      }
    }
  }
}
