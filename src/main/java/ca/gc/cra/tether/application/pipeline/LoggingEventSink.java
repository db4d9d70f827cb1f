package ca.gc.cra.tether.application.pipeline;

import ca.gc.cra.tether.domain.event.BackgroundExceptionEvent;
import ca.gc.cra.tether.domain.event.PipelineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink used until a caller registers its own. Background exceptions log at WARN, everything else at INFO.
 */
final class LoggingEventSink implements PipelineEventSink {
  private static final Logger log = LoggerFactory.getLogger(LoggingEventSink.class);

  @Override
  public void onEvent(PipelineEvent event) {
    if (event instanceof BackgroundExceptionEvent background) {
      log.warn("Unhandled background exception at {}", background.occurredAt(), background.error());
    } else {
      log.info("Unhandled pipeline event {}", event);
    }
  }
}
