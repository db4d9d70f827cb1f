package ca.gc.cra.tether.application.port;

/**
 * <strong>What:</strong> Failure reported by a {@link TransportPort} implementation.
 * <p><strong>Why:</strong> Transport errors are opaque to the pipeline core and are carried to the operation that
 * triggered them unchanged. The {@linkplain #isTransient() transient} flag is the only detail the retry stage
 * looks at.</p>
 *
 * @since 0.1.0
 */
public class TransportException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final boolean transientFailure;

  /**
   * Creates a transport failure.
   *
   * @param message description
   * @param transientFailure {@code true} when re-issuing the same request may succeed
   */
  public TransportException(String message, boolean transientFailure) {
    super(message);
    this.transientFailure = transientFailure;
  }

  /**
   * Creates a transport failure wrapping a lower-level cause.
   *
   * @param message description
   * @param cause underlying failure
   * @param transientFailure {@code true} when re-issuing the same request may succeed
   */
  public TransportException(String message, Throwable cause, boolean transientFailure) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }

  /**
   * Indicates whether the failure is worth retrying.
   *
   * @return {@code true} for timeouts, throttling and dropped connections
   */
  public boolean isTransient() {
    return transientFailure;
  }
}
