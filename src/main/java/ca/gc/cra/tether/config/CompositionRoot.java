package ca.gc.cra.tether.config;

import ca.gc.cra.tether.application.pipeline.Pipeline;
import ca.gc.cra.tether.application.pipeline.PipelineStage;
import ca.gc.cra.tether.application.port.ClockPort;
import ca.gc.cra.tether.application.port.MetricsPort;
import ca.gc.cra.tether.application.port.TransportPort;
import ca.gc.cra.tether.application.stage.ConnectionStateStage;
import ca.gc.cra.tether.application.stage.RegistrationStage;
import ca.gc.cra.tether.application.stage.RetryStage;
import ca.gc.cra.tether.application.stage.TransportStage;
import ca.gc.cra.tether.application.stage.UseSecurityClientStage;
import ca.gc.cra.tether.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires device client pipelines from configuration.
 * <p><strong>Role:</strong> The only place that knows the default stage order:
 * security client, retry, registration, connection state, transport.</p>
 * <p><strong>Thread-safety:</strong> Not synchronized; used during startup.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final PipelineConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final OpenTelemetryMetricsAdapter ownedMetrics;

  /**
   * Creates a root that exports metrics according to {@link PipelineConfig#metricsExporter()}.
   *
   * @param config pipeline settings
   */
  public CompositionRoot(PipelineConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(Objects.requireNonNull(config, "config").metricsExporter()));
  }

  private CompositionRoot(PipelineConfig config, OpenTelemetryMetricsAdapter metrics) {
    this(config, metrics, ClockPort.SYSTEM, metrics);
  }

  /**
   * Creates a root with explicit metrics and clock.
   *
   * @param config pipeline settings
   * @param metrics metrics sink
   * @param clock clock stamping events
   */
  public CompositionRoot(PipelineConfig config, MetricsPort metrics, ClockPort clock) {
    this(config, metrics, clock, null);
  }

  private CompositionRoot(
      PipelineConfig config, MetricsPort metrics, ClockPort clock, OpenTelemetryMetricsAdapter ownedMetrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.ownedMetrics = ownedMetrics;
  }

  public PipelineConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds the default stage chain, head first.
   *
   * @param transport transport driven by the tail stage
   * @return new, unlinked stages
   */
  public List<PipelineStage> defaultStages(TransportPort transport) {
    return List.of(
        new UseSecurityClientStage(),
        new RetryStage(config.retryPolicy()),
        new RegistrationStage(config.registrationPollInterval()),
        new ConnectionStateStage(),
        new TransportStage(transport));
  }

  /**
   * Builds and starts a pipeline over {@code transport}.
   *
   * @param transport transport adapter; closed when the pipeline shuts down
   * @return running pipeline
   */
  public Pipeline newPipeline(TransportPort transport) {
    Objects.requireNonNull(transport, "transport");
    return new Pipeline(
        config.pipelineName(), defaultStages(transport), metrics, clock, config.shutdownTimeout());
  }

  /** Releases the metrics exporter this root created, if any. */
  @Override
  public void close() {
    if (ownedMetrics != null) {
      ownedMetrics.close();
    }
  }
}
