package ca.gc.cra.tether.domain.event;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Raised when the transport connection drops or is closed on request.
 *
 * @param occurredAt event timestamp
 * @param cause failure that dropped the connection; {@code null} for a requested disconnect
 * @since 0.1.0
 */
public record DisconnectedEvent(Instant occurredAt, Throwable cause) implements PipelineEvent {
  public DisconnectedEvent {
    Objects.requireNonNull(occurredAt, "occurredAt");
  }

  @Override
  public EventKind kind() {
    return EventKind.DISCONNECTED;
  }

  /**
   * Returns the failure that dropped the connection.
   *
   * @return cause; empty when the disconnect was requested
   */
  public Optional<Throwable> failure() {
    return Optional.ofNullable(cause);
  }
}
