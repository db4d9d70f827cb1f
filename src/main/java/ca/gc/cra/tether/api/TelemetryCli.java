package ca.gc.cra.tether.api;

import ca.gc.cra.tether.application.pipeline.Pipeline;
import ca.gc.cra.tether.config.CompositionRoot;
import ca.gc.cra.tether.config.PipelineConfig;
import ca.gc.cra.tether.domain.message.TelemetryMessage;
import ca.gc.cra.tether.domain.op.DisconnectOperation;
import ca.gc.cra.tether.domain.op.SendTelemetryOperation;
import ca.gc.cra.tether.domain.op.SetSymmetricKeySecurityClientOperation;
import ca.gc.cra.tether.domain.security.StaticSymmetricKeySecurityClient;
import ca.gc.cra.tether.infrastructure.transport.LoopbackTransportAdapter;
import ca.gc.cra.tether.logging.LoggingConfigurator;
import ca.gc.cra.tether.logging.Logs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends one or more telemetry messages through a pipeline and disconnects.
 *
 * @since 0.1.0
 */
public final class TelemetryCli {
  private static final Logger log = LoggerFactory.getLogger(TelemetryCli.class);
  private static final String PROPERTY_PREFIX = "prop.";
  private static final String SUMMARY_USAGE =
      "usage: telemetry deviceId=ID idScope=SCOPE sasToken=TOKEN [host=HOST] [message=TEXT] [count=N] "
          + "[contentType=TYPE] [contentEncoding=ENC] [prop.NAME=VALUE ...] [timeoutMs=N] [config=PATH]";
  private static final String HELP_TEXT = """
      TETHER telemetry sender

      Usage:
        telemetry deviceId=ID idScope=SCOPE sasToken=TOKEN [options]

      Required:
        deviceId=ID               Device id used in the telemetry topic
        idScope=SCOPE             Id scope of the device's credentials
        sasToken=TOKEN            Shared access signature

      Optional:
        host=HOST                 Hub host name (default loopback-hub.azure-devices.net)
        message=TEXT              Message body (default {})
        count=N                   Number of messages to send, 1-10000 (default 1)
        contentType=TYPE          Content type property (default application/json)
        contentEncoding=ENC       Content encoding property (default utf-8)
        prop.NAME=VALUE           Custom application property; may be repeated with different names
        timeoutMs=N               Time to wait for the batch (default 30000)
        config=PATH               YAML file; the common and pipeline sections apply
        metricsExporter=otlp|none Metrics exporter (default none)
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private TelemetryCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Sends the requested messages and prints how many were accepted.
   *
   * @param args raw CLI arguments
   * @return {@link ExitCode#SUCCESS} only when every message was sent
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for telemetry CLI");
    }

    Map<String, String> kv;
    StaticSymmetricKeySecurityClient credentials;
    String deviceId;
    TelemetryMessage message;
    int count;
    Duration timeout;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      deviceId = ConfigCliUtils.required(kv, "deviceId");
      credentials = new StaticSymmetricKeySecurityClient(
          kv.getOrDefault("host", ProvisionCli.DEFAULT_LOOPBACK_HUB),
          deviceId,
          ConfigCliUtils.required(kv, "idScope"),
          ConfigCliUtils.required(kv, "sasToken"));
      message = new TelemetryMessage(
          kv.getOrDefault("message", "{}").getBytes(StandardCharsets.UTF_8),
          kv.getOrDefault("contentType", "application/json"),
          kv.getOrDefault("contentEncoding", "utf-8"),
          customProperties(kv));
      count = (int) ConfigCliUtils.longValue(kv, "count", 1L, 1L, 10_000L);
      timeout = Duration.ofMillis(ConfigCliUtils.longValue(kv, "timeoutMs", 30_000L, 1L, 3_600_000L));
    } catch (IllegalArgumentException | NullPointerException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    PipelineConfig config;
    try {
      config = ConfigCliUtils.loadPipelineConfig(configPath, kv, log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid pipeline configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", configPath, ex);
      return ExitCode.IO_ERROR;
    }

    LoopbackTransportAdapter transport = new LoopbackTransportAdapter(credentials.provisioningHost(), 0);
    try (CompositionRoot root = new CompositionRoot(config);
        Pipeline pipeline = root.newPipeline(transport)) {
      CliOperations.submitAndAwait(
          pipeline, new SetSymmetricKeySecurityClientOperation(credentials, null), timeout);

      List<SendTelemetryOperation> sends = new ArrayList<>(count);
      List<CompletableFuture<Void>> completions = new ArrayList<>(count);
      for (int i = 0; i < count; i++) {
        SendTelemetryOperation send = new SendTelemetryOperation(deviceId, message, null);
        sends.add(send);
        completions.add(send.completion());
        pipeline.submit(send);
      }
      int failed = 0;
      for (int i = 0; i < count; i++) {
        try {
          CliOperations.await(sends.get(i), completions.get(i), timeout);
        } catch (CliOperations.OperationFailedException ex) {
          failed++;
          log.warn("Message {} of {} not sent: {}", i + 1, count, ex.getMessage());
        }
      }
      CliOperations.submitAndAwait(pipeline, new DisconnectOperation(null), timeout);

      CliPrinter.println("sent=" + (count - failed) + " failed=" + failed);
      if (log.isDebugEnabled()) {
        transport.published().forEach(p -> log.debug("Published {} ({})", p.topic(),
            Logs.truncate(new String(p.payload(), StandardCharsets.UTF_8), 256)));
      }
      return failed == 0 ? ExitCode.SUCCESS : ExitCode.RUNTIME_FAILURE;
    } catch (CliOperations.OperationFailedException ex) {
      log.error("Telemetry run failed: {}", ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Telemetry run interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while sending telemetry", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Map<String, String> customProperties(Map<String, String> kv) {
    Map<String, String> properties = new LinkedHashMap<>();
    kv.forEach((key, value) -> {
      if (key.startsWith(PROPERTY_PREFIX)) {
        String name = key.substring(PROPERTY_PREFIX.length());
        if (name.isEmpty()) {
          throw new IllegalArgumentException("custom property name must not be empty");
        }
        properties.put(name, value);
      }
    });
    return properties;
  }
}
