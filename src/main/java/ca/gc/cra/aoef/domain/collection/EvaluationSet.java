package ca.gc.cra.aoef.domain.collection;

import ca.gc.cra.aoef.domain.ClipAnnotation;
import ca.gc.cra.aoef.domain.Tag;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Annotation set used as ground truth when evaluating models, restricted to a set of evaluation tags.
 *
 * @since 0.1.0
 */
public final class EvaluationSet extends AnnotationSet {
  private final String name;
  private final String description;
  private final List<Tag> evaluationTags;

  public EvaluationSet(
      UUID uuid,
      List<ClipAnnotation> clipAnnotations,
      LocalDateTime createdOn,
      String name,
      String description,
      List<Tag> evaluationTags) {
    super(uuid, clipAnnotations, createdOn);
    this.name = Objects.requireNonNull(name, "name");
    this.description = description;
    this.evaluationTags = evaluationTags == null ? List.of() : List.copyOf(evaluationTags);
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public List<Tag> evaluationTags() {
    return evaluationTags;
  }

  @Override
  public boolean equals(Object o) {
    if (!super.equals(o)) {
      return false;
    }
    EvaluationSet that = (EvaluationSet) o;
    return name.equals(that.name)
        && Objects.equals(description, that.description)
        && evaluationTags.equals(that.evaluationTags);
  }

  @Override
  public int hashCode() {
    return Objects.hash(super.hashCode(), name, description, evaluationTags);
  }
}
