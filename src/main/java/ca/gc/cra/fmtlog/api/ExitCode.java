package ca.gc.cra.fmtlog.api;

/**
 * <strong>What:</strong> Process exit codes of the {@code fmtlog} command.
 * <p><strong>Role:</strong> Returned by every subcommand's {@code run} method and passed to
 * {@link System#exit(int)} by {@link Main}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while reading configuration. */
  IO_ERROR(3),
  /** Configuration was malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** A template or pattern failed to render. */
  FORMAT_ERROR(6),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
