package ca.gc.cra.aoef.error;

/**
 * Raised during import when a record references an id that no record in the same document defines.
 *
 * @since 0.1.0
 */
public final class MissingReferenceException extends AoefException {
  private final String entity;
  private final Object missingId;
  private final String referencedBy;

  /**
   * Creates the exception.
   *
   * @param entity entity type of the missing record (for example {@code recording})
   * @param missingId id that failed to resolve
   * @param referencedBy description of the referencing record
   */
  public MissingReferenceException(String entity, Object missingId, String referencedBy) {
    super(entity + " " + missingId + " referenced by " + referencedBy + " is not defined in the document");
    this.entity = entity;
    this.missingId = missingId;
    this.referencedBy = referencedBy;
  }

  public String entity() {
    return entity;
  }

  public Object missingId() {
    return missingId;
  }

  public String referencedBy() {
    return referencedBy;
  }
}
