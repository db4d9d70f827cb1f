package ca.gc.cra.tether.domain.event;

import java.time.Instant;

/**
 * <strong>What:</strong> An unsolicited occurrence travelling up a TETHER pipeline.
 * <p><strong>Why:</strong> Transport notifications reach the caller through the same chain that carries
 * operations down, so stages can consume events they understand (for example provisioning responses).</p>
 * <p><strong>Contract:</strong> Events are never completed. They propagate upward until a stage consumes them or
 * they reach the pipeline's event sink.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface PipelineEvent
    permits ConnectedEvent, DisconnectedEvent, MessageReceivedEvent, BackgroundExceptionEvent {

  /**
   * Returns the discriminator for this event.
   *
   * @return event kind
   */
  EventKind kind();

  /**
   * Returns when the event was raised.
   *
   * @return event timestamp
   */
  Instant occurredAt();
}
