package ca.gc.eccc.sentinel.api;

/**
 * <strong>What:</strong> Process exit codes shared by the SENTINEL commands.
 * <p><strong>Why:</strong> Lets operators and schedulers tell a bad invocation from an unreadable file or a
 * capability that could not start.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution, including a clean shutdown after a stop request. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A file or directory could not be read or written. */
  IO_ERROR(3),
  /** Configuration was valid syntactically but a capability could not be initialized. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
