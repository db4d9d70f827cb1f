package ca.gc.cra.tether.application.pipeline;

import ca.gc.cra.tether.domain.event.PipelineEvent;

/**
 * Receives events that travelled past the head stage of a pipeline. Sinks run on the pipeline's callback thread.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PipelineEventSink {
  /**
   * Handles an event.
   *
   * @param event event raised by a stage; never {@code null}
   */
  void onEvent(PipelineEvent event);
}
