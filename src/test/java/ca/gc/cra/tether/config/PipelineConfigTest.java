package ca.gc.cra.tether.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PipelineConfigTest {

  @Test
  void defaultsRoundTripThroughTheFlatMap() {
    PipelineConfig defaults = PipelineConfig.defaults();

    assertEquals(defaults, PipelineConfig.fromMap(defaults.asFlatMap()));
    assertEquals("none", defaults.metricsExporter());
    assertEquals(5, defaults.retryPolicy().maxAttempts());
  }

  @Test
  void fromMapReadsEveryKey() {
    PipelineConfig config = PipelineConfig.fromMap(Map.of(
        "pipelineName", "plant-3",
        "retry.maxAttempts", "2",
        "retry.initialBackoffMs", "100",
        "retry.maxBackoffMs", "400",
        "registration.pollIntervalMs", "750",
        "shutdownTimeoutMs", "3000",
        "metricsExporter", "OTLP"));

    assertEquals("plant-3", config.pipelineName());
    assertEquals(2, config.retryMaxAttempts());
    assertEquals(Duration.ofMillis(100), config.retryInitialBackoff());
    assertEquals(Duration.ofMillis(400), config.retryMaxBackoff());
    assertEquals(Duration.ofMillis(750), config.registrationPollInterval());
    assertEquals(Duration.ofSeconds(3), config.shutdownTimeout());
    assertEquals("otlp", config.metricsExporter());
  }

  @Test
  void blankValuesFallBackToDefaults() {
    PipelineConfig config = PipelineConfig.fromMap(Map.of("pipelineName", " ", "retry.maxAttempts", ""));

    assertEquals("device", config.pipelineName());
    assertEquals(5, config.retryMaxAttempts());
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("retry.maxAttempts", "many")));
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("retry.maxAttempts", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("shutdownTimeoutMs", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("retry.initialBackoffMs", "5000", "retry.maxBackoffMs", "1000")));
    assertThrows(IllegalArgumentException.class,
        () -> PipelineConfig.fromMap(Map.of("metricsExporter", "prometheus")));
  }
}
