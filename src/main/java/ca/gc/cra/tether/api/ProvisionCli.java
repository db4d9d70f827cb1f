package ca.gc.cra.tether.api;

import ca.gc.cra.tether.application.pipeline.Pipeline;
import ca.gc.cra.tether.config.CompositionRoot;
import ca.gc.cra.tether.config.PipelineConfig;
import ca.gc.cra.tether.domain.op.PipelineOperation;
import ca.gc.cra.tether.domain.op.RegisterDeviceOperation;
import ca.gc.cra.tether.domain.op.SetSymmetricKeySecurityClientOperation;
import ca.gc.cra.tether.domain.op.SetX509SecurityClientOperation;
import ca.gc.cra.tether.domain.provisioning.RegistrationResult;
import ca.gc.cra.tether.domain.security.ClientCertificate;
import ca.gc.cra.tether.domain.security.StaticSymmetricKeySecurityClient;
import ca.gc.cra.tether.domain.security.StaticX509SecurityClient;
import ca.gc.cra.tether.infrastructure.transport.LoopbackTransportAdapter;
import ca.gc.cra.tether.logging.LoggingConfigurator;
import ca.gc.cra.tether.validation.Strings;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers a device with the provisioning service through a full pipeline.
 *
 * @since 0.1.0
 */
public final class ProvisionCli {
  private static final Logger log = LoggerFactory.getLogger(ProvisionCli.class);
  static final String DEFAULT_HOST = "global.azure-devices-provisioning.net";
  static final String DEFAULT_LOOPBACK_HUB = "loopback-hub.azure-devices.net";
  private static final String SUMMARY_USAGE =
      "usage: provision registrationId=ID idScope=SCOPE (sasToken=TOKEN | certFile=PATH keyFile=PATH) "
          + "[host=HOST] [payload=JSON] [timeoutMs=N] [config=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      TETHER device provisioning

      Usage:
        provision registrationId=ID idScope=SCOPE sasToken=TOKEN [options]
        provision registrationId=ID idScope=SCOPE certFile=PATH keyFile=PATH [options]

      Required:
        registrationId=ID          Registration id sent to the provisioning service
        idScope=SCOPE              Provisioning id scope
        sasToken=TOKEN             Shared access signature (symmetric key attestation)
        certFile=PATH keyFile=PATH PEM certificate and key (X.509 attestation)

      Optional:
        host=HOST                  Provisioning host (default global.azure-devices-provisioning.net)
        keyPassphrase=TEXT         Pass phrase protecting keyFile
        payload=JSON               Custom JSON object forwarded with the registration
        timeoutMs=N                Time to wait for each step (default 30000)
        config=PATH                YAML file; the common and pipeline sections apply
        retry.maxAttempts=N        Attempts per retryable operation (default 5)
        registration.pollIntervalMs=N  Status poll interval when the service gives none
        metricsExporter=otlp|none  Metrics exporter (default none)
        loopback.hub=HOST          Hub the loopback transport assigns devices to
        loopback.assigningPolls=N  Status polls the loopback transport answers before assigning
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private ProvisionCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs a registration and reports the assignment.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for provision CLI");
    }

    Map<String, String> kv;
    Request request;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      request = Request.from(kv);
    } catch (IllegalArgumentException ex) {
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

    PipelineOperation securityOp;
    try {
      securityOp = request.securityOperation();
    } catch (IOException ex) {
      log.error("Unable to read certificate material: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid certificate material: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    }

    LoopbackTransportAdapter transport = new LoopbackTransportAdapter(request.loopbackHub, request.assigningPolls);
    try (CompositionRoot root = new CompositionRoot(config);
        Pipeline pipeline = root.newPipeline(transport)) {
      log.info("Provisioning {} against {} (scope {})", request.registrationId, request.host, request.idScope);
      CliOperations.submitAndAwait(pipeline, securityOp, request.timeout);
      RegisterDeviceOperation register =
          new RegisterDeviceOperation(request.registrationId, request.payload, null);
      CliOperations.submitAndAwait(pipeline, register, request.timeout);
      RegistrationResult result = register.result().orElseThrow(
          () -> new IllegalStateException("registration completed without a result"));
      CliPrinter.println("status=" + result.status());
      CliPrinter.println("assignedHub=" + nullToDash(result.assignedHub()));
      CliPrinter.println("deviceId=" + nullToDash(result.deviceId()));
      CliPrinter.println("operationId=" + nullToDash(result.operationId()));
      if (!result.assigned()) {
        log.warn("Registration {} finished with status {}", request.registrationId, result.status());
        return ExitCode.RUNTIME_FAILURE;
      }
      return ExitCode.SUCCESS;
    } catch (CliOperations.OperationFailedException ex) {
      log.error("Provisioning failed: {}", ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Provisioning interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while provisioning", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static String nullToDash(String value) {
    return value == null ? "-" : value;
  }

  private static final class Request {
    private String registrationId;
    private String idScope;
    private String host;
    private String sasToken;
    private Path certFile;
    private Path keyFile;
    private String keyPassphrase;
    private String payload;
    private Duration timeout;
    private String loopbackHub;
    private int assigningPolls;

    static Request from(Map<String, String> kv) {
      Request request = new Request();
      request.registrationId =
          Strings.requirePrintableAscii("registrationId", ConfigCliUtils.required(kv, "registrationId"), 128);
      request.idScope = ConfigCliUtils.required(kv, "idScope");
      request.host = kv.getOrDefault("host", DEFAULT_HOST);
      request.sasToken = kv.get("sasToken");
      String cert = kv.get("certFile");
      String key = kv.get("keyFile");
      if (request.sasToken != null && (cert != null || key != null)) {
        throw new IllegalArgumentException("give either sasToken or certFile/keyFile, not both");
      }
      if (request.sasToken == null) {
        if (cert == null || key == null) {
          throw new IllegalArgumentException("sasToken or both certFile and keyFile are required");
        }
        request.certFile = Path.of(cert);
        request.keyFile = Path.of(key);
        request.keyPassphrase = kv.get("keyPassphrase");
      }
      request.payload = kv.get("payload");
      request.timeout = Duration.ofMillis(ConfigCliUtils.longValue(kv, "timeoutMs", 30_000L, 1L, 3_600_000L));
      request.loopbackHub = kv.getOrDefault("loopback.hub", DEFAULT_LOOPBACK_HUB);
      request.assigningPolls = (int) ConfigCliUtils.longValue(kv, "loopback.assigningPolls", 1L, 0L, 100L);
      return request;
    }

    PipelineOperation securityOperation() throws IOException {
      if (sasToken != null) {
        return new SetSymmetricKeySecurityClientOperation(
            new StaticSymmetricKeySecurityClient(host, registrationId, idScope, sasToken), null);
      }
      ClientCertificate certificate = new ClientCertificate(
          Files.readString(certFile, StandardCharsets.UTF_8),
          Files.readString(keyFile, StandardCharsets.UTF_8),
          keyPassphrase);
      return new SetX509SecurityClientOperation(
          new StaticX509SecurityClient(host, registrationId, idScope, certificate), null);
    }
  }
}
