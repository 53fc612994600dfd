package ca.gc.cra.aoef.error;

/**
 * Raised when a collection type has no registered adapter, either on export (runtime type) or on
 * import ({@code collection_type} tag), or when a loaded document is not of the expected type.
 *
 * @since 0.1.0
 */
public final class UnsupportedTypeException extends AoefException {
  private final String type;

  public UnsupportedTypeException(String type, String message) {
    super(message);
    this.type = type;
  }

  /**
   * Returns the offending type name or tag.
   *
   * @return type name or tag
   */
  public String type() {
    return type;
  }
}
