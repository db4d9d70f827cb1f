package ca.gc.cra.tether.config;

import ca.gc.cra.tether.application.stage.RetryPolicy;
import ca.gc.cra.tether.validation.Numbers;
import ca.gc.cra.tether.validation.Strings;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Runtime settings for one device client pipeline.
 * <p><strong>Role:</strong> Built from defaults, YAML and CLI settings; consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param pipelineName name used in thread names, logs and the {@code pipeline} MDC key
 * @param retryMaxAttempts attempts per retryable operation, including the first
 * @param retryInitialBackoff delay before the second attempt
 * @param retryMaxBackoff cap for any single retry delay
 * @param registrationPollInterval delay between registration status polls when the service gives none
 * @param shutdownTimeout how long shutdown waits for queued work
 * @param metricsExporter {@code otlp} or {@code none}
 * @since 0.1.0
 */
public record PipelineConfig(
    String pipelineName,
    int retryMaxAttempts,
    Duration retryInitialBackoff,
    Duration retryMaxBackoff,
    Duration registrationPollInterval,
    Duration shutdownTimeout,
    String metricsExporter) {

  static final String KEY_PIPELINE_NAME = "pipelineName";
  static final String KEY_RETRY_MAX_ATTEMPTS = "retry.maxAttempts";
  static final String KEY_RETRY_INITIAL_BACKOFF_MS = "retry.initialBackoffMs";
  static final String KEY_RETRY_MAX_BACKOFF_MS = "retry.maxBackoffMs";
  static final String KEY_REGISTRATION_POLL_MS = "registration.pollIntervalMs";
  static final String KEY_SHUTDOWN_TIMEOUT_MS = "shutdownTimeoutMs";
  static final String KEY_METRICS_EXPORTER = "metricsExporter";

  /**
   * Validates the settings.
   *
   * @throws IllegalArgumentException when a value is out of range
   */
  public PipelineConfig {
    pipelineName = Strings.requirePrintableAscii(KEY_PIPELINE_NAME, pipelineName, 64);
    Numbers.requirePositive(KEY_REGISTRATION_POLL_MS, registrationPollInterval);
    Numbers.requirePositive(KEY_SHUTDOWN_TIMEOUT_MS, shutdownTimeout);
    metricsExporter = Objects.requireNonNullElse(metricsExporter, "none").trim().toLowerCase(Locale.ROOT);
    if (!metricsExporter.equals("otlp") && !metricsExporter.equals("none")) {
      throw new IllegalArgumentException(KEY_METRICS_EXPORTER + " must be otlp or none");
    }
    // RetryPolicy owns the retry range checks.
    new RetryPolicy(retryMaxAttempts, retryInitialBackoff, retryMaxBackoff);
  }

  /**
   * Default settings used when neither YAML nor CLI supply a value.
   *
   * @return defaults
   */
  public static PipelineConfig defaults() {
    return new PipelineConfig(
        "device",
        5,
        Duration.ofMillis(500),
        Duration.ofSeconds(30),
        Duration.ofSeconds(2),
        Duration.ofSeconds(10),
        "none");
  }

  /**
   * Applies a flat settings map over {@link #defaults()}. Unknown keys are ignored.
   *
   * @param values settings keyed as in the YAML {@code pipeline} section
   * @return configuration
   * @throws IllegalArgumentException when a value cannot be parsed or is out of range
   */
  public static PipelineConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    PipelineConfig base = defaults();
    return new PipelineConfig(
        text(values, KEY_PIPELINE_NAME, base.pipelineName()),
        (int) number(values, KEY_RETRY_MAX_ATTEMPTS, base.retryMaxAttempts(), 1, 100),
        millis(values, KEY_RETRY_INITIAL_BACKOFF_MS, base.retryInitialBackoff()),
        millis(values, KEY_RETRY_MAX_BACKOFF_MS, base.retryMaxBackoff()),
        millis(values, KEY_REGISTRATION_POLL_MS, base.registrationPollInterval()),
        millis(values, KEY_SHUTDOWN_TIMEOUT_MS, base.shutdownTimeout()),
        text(values, KEY_METRICS_EXPORTER, base.metricsExporter()));
  }

  /**
   * Renders the settings as a flat map, the shape {@link ConfigMerger} merges.
   *
   * @return settings keyed as in {@link #fromMap(Map)}
   */
  public Map<String, String> asFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(KEY_PIPELINE_NAME, pipelineName);
    map.put(KEY_RETRY_MAX_ATTEMPTS, Integer.toString(retryMaxAttempts));
    map.put(KEY_RETRY_INITIAL_BACKOFF_MS, Long.toString(retryInitialBackoff.toMillis()));
    map.put(KEY_RETRY_MAX_BACKOFF_MS, Long.toString(retryMaxBackoff.toMillis()));
    map.put(KEY_REGISTRATION_POLL_MS, Long.toString(registrationPollInterval.toMillis()));
    map.put(KEY_SHUTDOWN_TIMEOUT_MS, Long.toString(shutdownTimeout.toMillis()));
    map.put(KEY_METRICS_EXPORTER, metricsExporter);
    return Map.copyOf(map);
  }

  /**
   * Retry settings for the retry stage.
   *
   * @return retry policy
   */
  public RetryPolicy retryPolicy() {
    return new RetryPolicy(retryMaxAttempts, retryInitialBackoff, retryMaxBackoff);
  }

  private static String text(Map<String, String> values, String key, String fallback) {
    String value = values.get(key);
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  private static long number(Map<String, String> values, String key, long fallback, long min, long max) {
    String value = values.get(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Numbers.requireRange(key, Long.parseLong(value.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a whole number (was '" + value + "')", ex);
    }
  }

  private static Duration millis(Map<String, String> values, String key, Duration fallback) {
    return Duration.ofMillis(number(values, key, fallback.toMillis(), 1, Duration.ofHours(1).toMillis()));
  }
}
