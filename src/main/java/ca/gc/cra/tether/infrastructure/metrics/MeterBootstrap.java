package ca.gc.cra.tether.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for TETHER. Exporter selection, in order of precedence: the explicit
 * setting passed in, the {@code otel.metrics.exporter} system property, {@code OTEL_METRICS_EXPORTER}, then
 * {@code none}.
 */
final class MeterBootstrap {
  private static final Logger log = LoggerFactory.getLogger(MeterBootstrap.class);
  private static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.tether";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private MeterBootstrap() {}

  static Meters initialize(String configuredExporter) {
    String raw = firstNonBlank(
        configuredExporter,
        System.getProperty("otel.metrics.exporter"),
        System.getenv("OTEL_METRICS_EXPORTER"));
    Exporter exporter = Exporter.from(raw);
    if (exporter == Exporter.NONE) {
      log.info("OpenTelemetry metrics export disabled");
      return Meters.noop();
    }
    try {
      String endpoint = Objects.requireNonNullElse(
          firstNonBlank(System.getProperty("otel.exporter.otlp.endpoint"), System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT")),
          DEFAULT_ENDPOINT);
      OtlpGrpcMetricExporter otlp = OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build();
      MetricReader reader = PeriodicMetricReader.builder(otlp).setInterval(EXPORT_INTERVAL).build();
      log.info("OpenTelemetry metrics exporting to {}", endpoint);
      return build(reader);
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; continuing without export", ex);
      return Meters.noop();
    }
  }

  static Meters forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"));
  }

  private static Meters build(MetricReader reader) {
    String version = serviceVersion();
    AttributesBuilder attributes = Attributes.builder()
        .put(SERVICE_NAME, "tether")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version);
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(Resource.getDefault().merge(Resource.create(attributes.build())))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new Meters(meter, provider);
  }

  private static String serviceVersion() {
    Package pkg = MeterBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "0.0.0-dev" : version;
  }

  private static String firstNonBlank(String... values) {
    for (String value : values) {
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  enum Exporter {
    OTLP,
    NONE;

    static Exporter from(String raw) {
      if (raw == null) {
        return NONE;
      }
      return switch (raw.toLowerCase(Locale.ROOT)) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> {
          log.warn("Unknown metrics exporter '{}'; metrics export disabled", raw);
          yield NONE;
        }
      };
    }
  }

  /** Meter plus the provider that owns it; the provider is {@code null} in noop mode. */
  static final class Meters implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private Meters(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static Meters noop() {
      return new Meters(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
        if (!result.isSuccess()) {
          log.warn("OpenTelemetry metrics flush did not complete within timeout");
        }
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.shutdown().join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
      }
    }
  }
}
