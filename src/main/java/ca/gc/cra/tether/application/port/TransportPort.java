package ca.gc.cra.tether.application.port;

/**
 * <strong>What:</strong> Port abstracting the concrete transport protocol (MQTT, AMQP, HTTP).
 * <p><strong>Why:</strong> The pipeline core only speaks a fixed low-level vocabulary; socket I/O and protocol
 * framing live behind this interface.</p>
 * <p><strong>Role:</strong> Driven by the tail {@code TransportStage}.</p>
 * <p><strong>Contract:</strong>
 * <ul>
 *   <li>Every request completes its {@link Completion} exactly once, on any thread.</li>
 *   <li>Requests must not block the caller; the caller is the pipeline thread.</li>
 *   <li>Failures are reported as {@link TransportException} where possible.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public interface TransportPort extends AutoCloseable {
  /**
   * Registers the listener receiving connection-state changes and inbound messages.
   *
   * @param listener listener; replaces any previous one
   */
  void setListener(TransportListener listener);

  /**
   * Opens the connection.
   *
   * @param args resolved connection arguments
   * @param completion completion handle
   */
  void connect(ConnectionArgs args, Completion completion);

  /**
   * Closes the connection.
   *
   * @param completion completion handle
   */
  void disconnect(Completion completion);

  /**
   * Publishes a message.
   *
   * @param topic publish topic
   * @param payload message bytes
   * @param completion completion handle
   */
  void publish(String topic, byte[] payload, Completion completion);

  /**
   * Subscribes to a topic filter.
   *
   * @param topicFilter filter, wildcards allowed
   * @param completion completion handle
   */
  void subscribe(String topicFilter, Completion completion);

  /**
   * Releases transport resources. Outstanding requests may be abandoned; the pipeline completes their
   * operations itself when it shuts down.
   */
  @Override
  default void close() {}

  /**
   * Single-shot completion handle for transport requests.
   */
  @FunctionalInterface
  interface Completion {
    /**
     * Reports the request outcome.
     *
     * @param error failure, or {@code null} on success
     */
    void complete(Throwable error);
  }
}
