package ca.gc.cra.aoef.domain.collection;

import ca.gc.cra.aoef.domain.ClipAnnotation;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * <strong>What:</strong> Set of clip annotations.
 * <p><strong>Role:</strong> Base of {@link AnnotationProject} and {@link EvaluationSet}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public class AnnotationSet implements DataCollection {
  private final UUID uuid;
  private final List<ClipAnnotation> clipAnnotations;
  private final LocalDateTime createdOn;

  public AnnotationSet(UUID uuid, List<ClipAnnotation> clipAnnotations, LocalDateTime createdOn) {
    this.uuid = Objects.requireNonNull(uuid, "uuid");
    this.clipAnnotations = clipAnnotations == null ? List.of() : List.copyOf(clipAnnotations);
    this.createdOn = Objects.requireNonNull(createdOn, "createdOn");
  }

  @Override
  public UUID uuid() {
    return uuid;
  }

  public List<ClipAnnotation> clipAnnotations() {
    return clipAnnotations;
  }

  @Override
  public LocalDateTime createdOn() {
    return createdOn;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AnnotationSet that = (AnnotationSet) o;
    return uuid.equals(that.uuid)
        && clipAnnotations.equals(that.clipAnnotations)
        && createdOn.equals(that.createdOn);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uuid, clipAnnotations, createdOn);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{uuid=" + uuid + ", clipAnnotations=" + clipAnnotations.size() + "}";
  }
}
