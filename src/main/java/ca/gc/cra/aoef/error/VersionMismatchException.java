package ca.gc.cra.aoef.error;

/**
 * Raised when a document's {@code version} differs from the version this engine writes.
 *
 * @since 0.1.0
 */
public final class VersionMismatchException extends AoefException {
  private final String found;
  private final String expected;

  public VersionMismatchException(String found, String expected) {
    super("Unsupported AOEF version " + found + " (expected " + expected + ")");
    this.found = found;
    this.expected = expected;
  }

  public String found() {
    return found;
  }

  public String expected() {
    return expected;
  }
}
