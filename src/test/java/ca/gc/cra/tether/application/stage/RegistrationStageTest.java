package ca.gc.cra.tether.application.stage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tether.application.pipeline.Pipeline;
import ca.gc.cra.tether.application.port.ClockPort;
import ca.gc.cra.tether.application.port.MetricsPort;
import ca.gc.cra.tether.application.port.TransportException;
import ca.gc.cra.tether.application.stage.RegistrationStage.ResponseTopic;
import ca.gc.cra.tether.domain.event.DisconnectedEvent;
import ca.gc.cra.tether.domain.event.EventKind;
import ca.gc.cra.tether.domain.event.MessageReceivedEvent;
import ca.gc.cra.tether.domain.op.PipelineOperation;
import ca.gc.cra.tether.domain.op.RegisterDeviceOperation;
import ca.gc.cra.tether.domain.op.SendOperation;
import ca.gc.cra.tether.domain.op.SubscribeOperation;
import ca.gc.cra.tether.domain.provisioning.RegistrationResult;
import ca.gc.cra.tether.testutil.Completions;
import ca.gc.cra.tether.testutil.RecordingEventSink;
import ca.gc.cra.tether.testutil.ScriptedTailStage;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RegistrationStageTest {
  private static final String ASSIGNED_BODY = "{\"operationId\":\"op-1\",\"status\":\"assigned\","
      + "\"registrationState\":{\"assignedHub\":\"hub-a.azure-devices.net\",\"deviceId\":\"dev-9\","
      + "\"substatus\":\"initialAssignment\"}}";
  private static final String ASSIGNING_BODY = "{\"operationId\":\"op-1\",\"status\":\"assigning\"}";

  private final ScriptedTailStage tail = new ScriptedTailStage();
  private final RecordingEventSink sink = new RecordingEventSink();
  private Pipeline pipeline;

  @AfterEach
  void tearDown() {
    if (pipeline != null) {
      pipeline.shutdown();
    }
  }

  @Test
  void assignedResponseCompletesWithResult() throws Exception {
    answerRequests(requestId -> response(200, requestId, ASSIGNED_BODY));
    pipeline = newPipeline();
    RegisterDeviceOperation op = new RegisterDeviceOperation("reg-1", null, null);

    pipeline.submit(op);

    Completions.assertSucceeded(op);
    RegistrationResult result = op.result().orElseThrow();
    assertTrue(result.assigned());
    assertEquals("hub-a.azure-devices.net", result.assignedHub());
    assertEquals("dev-9", result.deviceId());
    assertEquals("initialAssignment", result.substatus());

    List<PipelineOperation> received = tail.received();
    assertEquals(RegistrationStage.RESPONSE_FILTER, ((SubscribeOperation) received.get(0)).topicFilter());
    SendOperation request = (SendOperation) received.get(1);
    assertEquals(RegistrationStage.REGISTER_TOPIC_PREFIX + "1", request.topic());
    assertEquals("{\"registrationId\":\"reg-1\"}", new String(request.payload(), StandardCharsets.UTF_8));
  }

  @Test
  void customPayloadIsEmbeddedInTheRequest() throws Exception {
    answerRequests(requestId -> response(200, requestId, ASSIGNED_BODY));
    pipeline = newPipeline();
    RegisterDeviceOperation op = new RegisterDeviceOperation("reg-1", "{\"model\":\"m1\"}", null);

    pipeline.submit(op);

    Completions.assertSucceeded(op);
    SendOperation request = tail.received(SendOperation.class).get(0);
    assertEquals("{\"registrationId\":\"reg-1\",\"payload\":{\"model\":\"m1\"}}",
        new String(request.payload(), StandardCharsets.UTF_8));
  }

  @Test
  void malformedCustomPayloadFailsWithoutPublishing() throws Exception {
    pipeline = newPipeline();
    RegisterDeviceOperation op = new RegisterDeviceOperation("reg-1", "{\"model\":", null);

    pipeline.submit(op);

    assertInstanceOf(IllegalArgumentException.class, Completions.assertFailed(op));
    assertTrue(tail.received(SendOperation.class).isEmpty());
  }

  @Test
  void assigningResponseIsPolledUntilAssigned() throws Exception {
    answerRequests(requestId -> response(requestId.equals("1") ? 202 : 200, requestId,
        requestId.equals("1") ? ASSIGNING_BODY : ASSIGNED_BODY));
    pipeline = newPipeline();
    RegisterDeviceOperation op = new RegisterDeviceOperation("reg-1", null, null);

    pipeline.submit(op);

    Completions.assertSucceeded(op);
    assertTrue(op.result().orElseThrow().assigned());
    List<SendOperation> sends = tail.received(SendOperation.class);
    assertEquals(2, sends.size());
    assertEquals(RegistrationStage.POLL_TOPIC_PREFIX + "2&operationId=op-1", sends.get(1).topic());
    assertEquals(0, sends.get(1).payload().length);
    assertEquals(1, tail.received(SubscribeOperation.class).size());
  }

  @Test
  void errorStatusFailsWithRegistrationFailure() throws Exception {
    answerRequests(requestId -> response(401, requestId, "{\"errorCode\":401002}"));
    pipeline = newPipeline();
    RegisterDeviceOperation op = new RegisterDeviceOperation("reg-1", null, null);

    pipeline.submit(op);

    RegistrationFailedException failure = assertInstanceOf(RegistrationFailedException.class,
        Completions.assertFailed(op));
    assertEquals(401, failure.status());
    assertFalse(failure.isTransient());
    assertTrue(failure.responseBody().contains("401002"));
  }

  @Test
  void throttledStatusIsTransient() {
    assertTrue(new RegistrationFailedException(429, "").isTransient());
    assertTrue(new RegistrationFailedException(503, "").isTransient());
    assertFalse(new RegistrationFailedException(404, "").isTransient());
  }

  @Test
  void failedSubscriptionFailsTheRegistration() throws Exception {
    TransportException refused = new TransportException("subscribe refused", false);
    tail.script((stage, op) -> stage.complete(op, op instanceof SubscribeOperation ? refused : null));
    pipeline = newPipeline();
    RegisterDeviceOperation op = new RegisterDeviceOperation("reg-1", null, null);

    pipeline.submit(op);

    assertEquals(refused, Completions.assertFailed(op));
    assertTrue(tail.received(SendOperation.class).isEmpty());
  }

  @Test
  void responsesForUnknownRequestsContinueUpward() throws Exception {
    pipeline = newPipeline();
    MessageReceivedEvent stray = response(200, "77", ASSIGNED_BODY);

    tail.raise(stray);

    assertEquals(stray, sink.await(EventKind.MESSAGE_RECEIVED, Duration.ofSeconds(5)));
  }

  @Test
  void lostConnectionFailsOutstandingRegistrationsAsTransient() throws Exception {
    tail.script((stage, op) -> {
      if (op instanceof SendOperation) {
        stage.complete(op, null);
        stage.raiseNow(new DisconnectedEvent(Instant.now(), new TransportException("socket reset", true)));
      } else {
        stage.complete(op, null);
      }
    });
    pipeline = newPipeline();
    RegisterDeviceOperation op = new RegisterDeviceOperation("reg-1", null, null);

    pipeline.submit(op);

    TransportException failure = assertInstanceOf(TransportException.class, Completions.assertFailed(op));
    assertTrue(failure.isTransient());
    sink.await(EventKind.DISCONNECTED, Duration.ofSeconds(5));
  }

  @Test
  void shutdownFailsPendingRegistrations() throws Exception {
    pipeline = newPipeline();
    RegisterDeviceOperation op = new RegisterDeviceOperation("reg-1", null, null);

    pipeline.submit(op);
    pipeline.shutdown();

    Completions.assertFailed(op);
  }

  @Test
  void responseTopicCarriesStatusRequestIdAndRetryAfter() {
    ResponseTopic topic = ResponseTopic.parse("$dps/registrations/res/202/?$rid=5&retry-after=3").orElseThrow();

    assertEquals(202, topic.status());
    assertEquals("5", topic.requestId());
    assertEquals(Optional.of(Duration.ofSeconds(3)), topic.retryAfter());
  }

  @Test
  void responseTopicIgnoresUnusableRetryAfter() {
    assertEquals(Optional.empty(),
        ResponseTopic.parse("$dps/registrations/res/202/?$rid=5&retry-after=soon").orElseThrow().retryAfter());
    assertEquals(Optional.empty(),
        ResponseTopic.parse("$dps/registrations/res/202/?$rid=5&retry-after=0").orElseThrow().retryAfter());
  }

  @Test
  void malformedResponseTopicsAreRejected() {
    assertTrue(ResponseTopic.parse("devices/dev-1/messages/devicebound/").isEmpty());
    assertTrue(ResponseTopic.parse("$dps/registrations/res/abc/?$rid=1").isEmpty());
    assertTrue(ResponseTopic.parse("$dps/registrations/res/200/?retry-after=1").isEmpty());
    assertTrue(ResponseTopic.parse("$dps/registrations/res/200").isEmpty());
  }

  private void answerRequests(Function<String, MessageReceivedEvent> responder) {
    tail.script((stage, op) -> {
      stage.complete(op, null);
      if (op instanceof SendOperation send) {
        String topic = send.topic();
        int rid = topic.indexOf("$rid=") + "$rid=".length();
        int end = topic.indexOf('&', rid);
        stage.raise(responder.apply(end < 0 ? topic.substring(rid) : topic.substring(rid, end)));
      }
    });
  }

  private static MessageReceivedEvent response(int status, String requestId, String body) {
    return new MessageReceivedEvent(Instant.now(), RegistrationStage.RESPONSE_PREFIX + status + "/?$rid=" + requestId,
        body.getBytes(StandardCharsets.UTF_8));
  }

  private Pipeline newPipeline() {
    Pipeline created = new Pipeline("registration", List.of(new RegistrationStage(Duration.ofMillis(10)), tail),
        MetricsPort.NO_OP, ClockPort.SYSTEM, Duration.ofSeconds(5));
    created.registerEventSink(sink);
    return created;
  }
}
