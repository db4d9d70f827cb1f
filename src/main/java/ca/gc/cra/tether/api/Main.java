package ca.gc.cra.tether.api;

import ca.gc.cra.tether.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TETHER CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: tether <provision|telemetry> [key=value ...]";
  private static final String HELP_TEXT = """
      TETHER device client

      Usage:
        tether <command> [key=value ...]

      Commands:
        provision   Register a device with the provisioning service (provision --help for details)
        telemetry   Send telemetry messages through a device pipeline (telemetry --help for details)

      Both commands run against the in-process loopback transport.

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first bare word names the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safeArgs.length; i++) {
      String arg = safeArgs[i] == null ? "" : safeArgs[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-")) {
        commandIndex = i;
        break;
      }
    }

    CliInput globals =
        CliInput.parse(commandIndex < 0 ? safeArgs : Arrays.copyOfRange(safeArgs, 0, commandIndex));
    if (globals.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (globals.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (commandIndex < 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length);
    return switch (command) {
      case "provision" -> ProvisionCli.run(delegateArgs);
      case "telemetry" -> TelemetryCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
