package ca.gc.cra.tether.domain.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Raised when a failure cannot be attributed to a pending operation, including detected pipeline defects.
 *
 * @param occurredAt event timestamp
 * @param error the failure
 * @since 0.1.0
 */
public record BackgroundExceptionEvent(Instant occurredAt, Throwable error) implements PipelineEvent {
  public BackgroundExceptionEvent {
    Objects.requireNonNull(occurredAt, "occurredAt");
    Objects.requireNonNull(error, "error");
  }

  @Override
  public EventKind kind() {
    return EventKind.BACKGROUND_EXCEPTION;
  }
}
