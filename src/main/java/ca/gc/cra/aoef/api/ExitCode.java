package ca.gc.cra.aoef.api;

/**
 * <strong>What:</strong> Process exit codes of the {@code aoef} command line.
 * <p><strong>Why:</strong> Lets scripts tell a bad argument from an unreadable file from a broken document.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A file could not be read or written. */
  IO_ERROR(3),
  /** The YAML configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** The file is not a usable AOEF document (shape, version, type or dangling reference). */
  INVALID_DOCUMENT(6);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value passed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
