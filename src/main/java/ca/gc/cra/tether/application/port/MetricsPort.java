package ca.gc.cra.tether.application.port;

/**
 * <strong>What:</strong> Port abstracting TETHER metrics emission.
 * <p><strong>Why:</strong> Lets pipelines count submissions, completions, retries and defects without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from caller threads, the
 * pipeline thread and transport callback threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code pipeline.op.completed}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code pipeline.retry.scheduled}); must not be
   *     {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, bytes); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
