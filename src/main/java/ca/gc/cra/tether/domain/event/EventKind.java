package ca.gc.cra.tether.domain.event;

/**
 * Closed set of event kinds raised inside TETHER pipelines.
 *
 * @since 0.1.0
 */
public enum EventKind {
  /** The transport connection was established. */
  CONNECTED,
  /** The transport connection was lost or closed. */
  DISCONNECTED,
  /** A message arrived on a subscribed topic. */
  MESSAGE_RECEIVED,
  /** A failure that no pending operation could be completed with. */
  BACKGROUND_EXCEPTION
}
