package ca.gc.cra.aoef.application.exchange.record;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Exchange form of an annotation project.
 *
 * @param uuid project uuid
 * @param createdOn creation time
 * @param tables entity tables
 * @param name project name
 * @param description description; may be {@code null}
 * @param instructions annotator instructions; may be {@code null}
 * @param projectTags tag ids annotators may use
 * @param tasks embedded annotation tasks
 */
public record AnnotationProjectRecord(
    UUID uuid,
    LocalDateTime createdOn,
    EntityTables tables,
    String name,
    String description,
    String instructions,
    List<Integer> projectTags,
    List<AnnotationTaskRecord> tasks) implements CollectionRecord {

  public AnnotationProjectRecord {
    projectTags = projectTags == null ? List.of() : List.copyOf(projectTags);
    tasks = tasks == null ? List.of() : List.copyOf(tasks);
  }

  @Override
  public CollectionKind kind() {
    return CollectionKind.ANNOTATION_PROJECT;
  }
}
