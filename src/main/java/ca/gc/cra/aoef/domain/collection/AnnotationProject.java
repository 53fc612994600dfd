package ca.gc.cra.aoef.domain.collection;

import ca.gc.cra.aoef.domain.AnnotationTask;
import ca.gc.cra.aoef.domain.ClipAnnotation;
import ca.gc.cra.aoef.domain.Tag;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Annotation set organised as a project: instructions, the tags annotators may use, and the tasks
 * handed out to them.
 *
 * @since 0.1.0
 */
public final class AnnotationProject extends AnnotationSet {
  private final String name;
  private final String description;
  private final String instructions;
  private final List<Tag> projectTags;
  private final List<AnnotationTask> tasks;

  public AnnotationProject(
      UUID uuid,
      List<ClipAnnotation> clipAnnotations,
      LocalDateTime createdOn,
      String name,
      String description,
      String instructions,
      List<Tag> projectTags,
      List<AnnotationTask> tasks) {
    super(uuid, clipAnnotations, createdOn);
    this.name = Objects.requireNonNull(name, "name");
    this.description = description;
    this.instructions = instructions;
    this.projectTags = projectTags == null ? List.of() : List.copyOf(projectTags);
    this.tasks = tasks == null ? List.of() : List.copyOf(tasks);
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public String instructions() {
    return instructions;
  }

  public List<Tag> projectTags() {
    return projectTags;
  }

  public List<AnnotationTask> tasks() {
    return tasks;
  }

  @Override
  public boolean equals(Object o) {
    if (!super.equals(o)) {
      return false;
    }
    AnnotationProject that = (AnnotationProject) o;
    return name.equals(that.name)
        && Objects.equals(description, that.description)
        && Objects.equals(instructions, that.instructions)
        && projectTags.equals(that.projectTags)
        && tasks.equals(that.tasks);
  }

  @Override
  public int hashCode() {
    return Objects.hash(super.hashCode(), name, description, instructions, projectTags, tasks);
  }
}
