package ca.gc.cra.tether.application.port;

/**
 * Receives unsolicited notifications from a {@link TransportPort}. Callbacks may arrive on any transport thread;
 * the transport stage marshals them onto the pipeline thread.
 *
 * @since 0.1.0
 */
public interface TransportListener {
  /** Called when the connection has been established. */
  void onConnected();

  /**
   * Called when the connection dropped or was closed.
   *
   * @param cause failure that dropped the connection; {@code null} after a requested disconnect
   */
  void onDisconnected(Throwable cause);

  /**
   * Called for every message received on a subscribed topic.
   *
   * @param topic message topic
   * @param payload message bytes
   */
  void onMessage(String topic, byte[] payload);
}
