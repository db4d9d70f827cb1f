package ca.gc.cra.tether.domain.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Raised when the transport connection is established.
 *
 * @param occurredAt event timestamp
 * @since 0.1.0
 */
public record ConnectedEvent(Instant occurredAt) implements PipelineEvent {
  public ConnectedEvent {
    Objects.requireNonNull(occurredAt, "occurredAt");
  }

  @Override
  public EventKind kind() {
    return EventKind.CONNECTED;
  }
}
