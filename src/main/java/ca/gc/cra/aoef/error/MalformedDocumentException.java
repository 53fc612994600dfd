package ca.gc.cra.aoef.error;

/**
 * Raised when JSON input does not have the shape of an AOEF document.
 *
 * @since 0.1.0
 */
public final class MalformedDocumentException extends AoefException {
  private final String location;

  /**
   * Creates the exception.
   *
   * @param location JSON path of the offending value (for example {@code data.clips[2].recording})
   * @param problem short description of what is wrong at that location
   */
  public MalformedDocumentException(String location, String problem) {
    super("Malformed AOEF document at " + location + ": " + problem);
    this.location = location;
  }

  public MalformedDocumentException(String location, String problem, Throwable cause) {
    super("Malformed AOEF document at " + location + ": " + problem, cause);
    this.location = location;
  }

  public String location() {
    return location;
  }
}
