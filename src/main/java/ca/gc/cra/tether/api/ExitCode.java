package ca.gc.cra.tether.api;

/**
 * Process exit codes shared by the TETHER commands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** The command finished and every operation succeeded. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A file named on the command line could not be read. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** An operation failed, timed out, or the pipeline hit an unexpected error. */
  RUNTIME_FAILURE(5),
  /** The process was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Numeric value handed to {@link System#exit(int)}.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
