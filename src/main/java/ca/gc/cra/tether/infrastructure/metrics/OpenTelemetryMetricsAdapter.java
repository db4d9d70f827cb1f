package ca.gc.cra.tether.infrastructure.metrics;

import ca.gc.cra.tether.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards pipeline counters and histograms to OpenTelemetry. Instruments are created
 * lazily per metric key and cached.
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("tether.metric.key");
  private static final String FALLBACK_METRIC_NAME = "tether.metric";

  private final MeterBootstrap.Meters meters;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter for the given exporter setting.
   *
   * @param exporter {@code otlp}, {@code none}, or {@code null} to fall back to the OpenTelemetry environment
   */
  public OpenTelemetryMetricsAdapter(String exporter) {
    this(MeterBootstrap.initialize(exporter));
  }

  OpenTelemetryMetricsAdapter(MeterBootstrap.Meters meters) {
    this.meters = Objects.requireNonNull(meters, "meters");
    if (meters.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Counter counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newCounter);
    counter.counter().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram histogram = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newHistogram);
    histogram.histogram().record(value, histogram.attributes());
  }

  void forceFlush() {
    meters.forceFlush();
  }

  @Override
  public void close() {
    meters.close();
  }

  private Counter newCounter(String key) {
    Meter meter = meters.meter();
    LongCounter counter = meter.counterBuilder(metricName(key))
        .setUnit("1")
        .setDescription("TETHER counter for " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Histogram newHistogram(String key) {
    Meter meter = meters.meter();
    LongHistogram histogram = meter.histogramBuilder(metricName(key))
        .ofLongs()
        .setDescription("TETHER observation for " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String metricName(String key) {
    String trimmed = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return FALLBACK_METRIC_NAME;
    }
    StringBuilder name = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    if (!name.toString().equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, name);
    }
    return name.toString();
  }

  private record Counter(LongCounter counter, Attributes attributes) {}

  private record Histogram(LongHistogram histogram, Attributes attributes) {}
}
