package ca.gc.cra.lazypull.api;

/**
 * <strong>What:</strong> Exit codes shared by the lazypull command-line tools.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Template, settings or supplement input was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value reported to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
