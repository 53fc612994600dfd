package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.domain.collection.AnnotationProject;
import ca.gc.cra.aoef.domain.collection.AnnotationSet;
import ca.gc.cra.aoef.domain.collection.DataCollection;
import ca.gc.cra.aoef.domain.collection.Dataset;
import ca.gc.cra.aoef.domain.collection.Evaluation;
import ca.gc.cra.aoef.domain.collection.EvaluationSet;
import ca.gc.cra.aoef.domain.collection.ModelRun;
import ca.gc.cra.aoef.domain.collection.PredictionSet;
import ca.gc.cra.aoef.domain.collection.RecordingSet;
import ca.gc.cra.aoef.error.UnsupportedTypeException;
import java.util.Objects;

/**
 * <strong>What:</strong> The eight document variants, in dispatch priority order.
 * <p><strong>Why:</strong> A {@link Dataset} is also a {@link RecordingSet}; subclass kinds are declared before
 * their base kinds so that export picks the most specific one. The declaration order is part of the
 * format contract.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum CollectionKind {
  EVALUATION("evaluation", Evaluation.class),
  DATASET("dataset", Dataset.class),
  ANNOTATION_PROJECT("annotation_project", AnnotationProject.class),
  EVALUATION_SET("evaluation_set", EvaluationSet.class),
  MODEL_RUN("model_run", ModelRun.class),
  ANNOTATION_SET("annotation_set", AnnotationSet.class),
  PREDICTION_SET("prediction_set", PredictionSet.class),
  RECORDING_SET("recording_set", RecordingSet.class);

  private final String tag;
  private final Class<? extends DataCollection> domainType;

  CollectionKind(String tag, Class<? extends DataCollection> domainType) {
    this.tag = tag;
    this.domainType = domainType;
  }

  /** @return value written as {@code collection_type} */
  public String tag() {
    return tag;
  }

  /** @return domain class of this kind */
  public Class<? extends DataCollection> domainType() {
    return domainType;
  }

  /**
   * Selects the most specific kind for a collection instance.
   *
   * @param collection collection to export
   * @return first kind, in declaration order, whose domain type accepts the instance
   * @throws UnsupportedTypeException if no kind accepts it
   */
  public static CollectionKind of(DataCollection collection) {
    Objects.requireNonNull(collection, "collection");
    for (CollectionKind kind : values()) {
      if (kind.domainType.isInstance(collection)) {
        return kind;
      }
    }
    String type = collection.getClass().getName();
    throw new UnsupportedTypeException(type, "No AOEF collection adapter for type " + type);
  }

  /**
   * Resolves a {@code collection_type} tag.
   *
   * @param tag tag read from a document
   * @return matching kind
   * @throws UnsupportedTypeException if the tag is unknown
   */
  public static CollectionKind fromTag(String tag) {
    for (CollectionKind kind : values()) {
      if (kind.tag.equals(tag)) {
        return kind;
      }
    }
    throw new UnsupportedTypeException(tag, "Unsupported AOEF collection_type: " + tag);
  }
}
