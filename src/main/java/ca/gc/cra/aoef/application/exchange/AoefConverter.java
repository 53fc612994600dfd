package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.collection.AnnotationProjectAdapter;
import ca.gc.cra.aoef.application.exchange.collection.AnnotationSetAdapter;
import ca.gc.cra.aoef.application.exchange.collection.DatasetAdapter;
import ca.gc.cra.aoef.application.exchange.collection.EvaluationAdapter;
import ca.gc.cra.aoef.application.exchange.collection.EvaluationSetAdapter;
import ca.gc.cra.aoef.application.exchange.collection.ModelRunAdapter;
import ca.gc.cra.aoef.application.exchange.collection.PredictionSetAdapter;
import ca.gc.cra.aoef.application.exchange.collection.RecordingSetAdapter;
import ca.gc.cra.aoef.application.exchange.record.AnnotationProjectRecord;
import ca.gc.cra.aoef.application.exchange.record.AnnotationSetRecord;
import ca.gc.cra.aoef.application.exchange.record.AoefDocument;
import ca.gc.cra.aoef.application.exchange.record.CollectionRecord;
import ca.gc.cra.aoef.application.exchange.record.DatasetRecord;
import ca.gc.cra.aoef.application.exchange.record.EvaluationRecord;
import ca.gc.cra.aoef.application.exchange.record.EvaluationSetRecord;
import ca.gc.cra.aoef.application.exchange.record.ModelRunRecord;
import ca.gc.cra.aoef.application.exchange.record.PredictionSetRecord;
import ca.gc.cra.aoef.application.exchange.record.RecordingSetRecord;
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
import ca.gc.cra.aoef.error.VersionMismatchException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Converts collections to AOEF documents and back.
 * <p><strong>Why:</strong> Owns the envelope contract: the version stamp, the strict version gate, and
 * dispatch to the collection adapter for each {@link CollectionKind}.</p>
 * <p><strong>Role:</strong> Pure in-memory step between the domain model and the JSON codec.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the immutable audio directory; every call builds
 * its own {@link AdapterTree}, so concurrent calls need no locking.</p>
 * <p><strong>Observability:</strong> Logs collection kind and table sizes at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class AoefConverter {
  private static final Logger log = LoggerFactory.getLogger(AoefConverter.class);

  private final Path audioDir;

  /** Creates a converter that keeps recording paths as given. */
  public AoefConverter() {
    this(null);
  }

  /**
   * Creates a converter that stores recording paths relative to {@code audioDir}.
   *
   * @param audioDir audio directory; may be {@code null}
   */
  public AoefConverter(Path audioDir) {
    this.audioDir = audioDir;
  }

  /**
   * Exports {@code collection} into a document stamped with the current version.
   *
   * @param collection collection to export
   * @param createdOn document creation time
   * @return document
   * @throws UnsupportedTypeException if the collection type has no adapter
   * @throws IllegalArgumentException if a recording lies outside the audio directory
   */
  public AoefDocument toDocument(DataCollection collection, LocalDateTime createdOn) {
    Objects.requireNonNull(collection, "collection");
    CollectionKind kind = CollectionKind.of(collection);
    AdapterTree tree = newTree();
    CollectionRecord data = switch (kind) {
      case EVALUATION -> new EvaluationAdapter(tree).toRecord((Evaluation) collection);
      case DATASET -> new DatasetAdapter(tree).toRecord((Dataset) collection);
      case ANNOTATION_PROJECT -> new AnnotationProjectAdapter(tree).toRecord((AnnotationProject) collection);
      case EVALUATION_SET -> new EvaluationSetAdapter(tree).toRecord((EvaluationSet) collection);
      case MODEL_RUN -> new ModelRunAdapter(tree).toRecord((ModelRun) collection);
      case ANNOTATION_SET -> new AnnotationSetAdapter(tree).toRecord((AnnotationSet) collection);
      case PREDICTION_SET -> new PredictionSetAdapter(tree).toRecord((PredictionSet) collection);
      case RECORDING_SET -> new RecordingSetAdapter(tree).toRecord((RecordingSet) collection);
    };
    if (log.isDebugEnabled()) {
      log.debug("Exported {} {} with tables {}", kind.tag(), collection.uuid(), data.tables().counts());
    }
    return new AoefDocument(AoefDocument.CURRENT_VERSION, createdOn, data);
  }

  /**
   * Imports a document.
   *
   * @param document parsed document
   * @param expected kind the caller expects; {@code null} accepts any kind
   * @return rebuilt collection
   * @throws VersionMismatchException if the document version is not the current version
   * @throws UnsupportedTypeException if the document kind differs from {@code expected}
   * @throws ca.gc.cra.aoef.error.MissingReferenceException if a record references an undefined id
   */
  public DataCollection fromDocument(AoefDocument document, CollectionKind expected) {
    Objects.requireNonNull(document, "document");
    requireSupportedVersion(document.version());
    CollectionRecord data = document.data();
    requireKind(data.kind(), expected);
    AdapterTree tree = newTree();
    DataCollection collection = switch (data.kind()) {
      case EVALUATION -> new EvaluationAdapter(tree).toCollection((EvaluationRecord) data);
      case DATASET -> new DatasetAdapter(tree).toCollection((DatasetRecord) data);
      case ANNOTATION_PROJECT -> new AnnotationProjectAdapter(tree).toCollection((AnnotationProjectRecord) data);
      case EVALUATION_SET -> new EvaluationSetAdapter(tree).toCollection((EvaluationSetRecord) data);
      case MODEL_RUN -> new ModelRunAdapter(tree).toCollection((ModelRunRecord) data);
      case ANNOTATION_SET -> new AnnotationSetAdapter(tree).toCollection((AnnotationSetRecord) data);
      case PREDICTION_SET -> new PredictionSetAdapter(tree).toCollection((PredictionSetRecord) data);
      case RECORDING_SET -> new RecordingSetAdapter(tree).toCollection((RecordingSetRecord) data);
    };
    log.debug("Imported {} {}", data.kind().tag(), data.uuid());
    return collection;
  }

  /**
   * Rejects any version other than {@link AoefDocument#CURRENT_VERSION}. No semver leniency applies.
   *
   * @param version version read from a document; may be {@code null}
   * @throws VersionMismatchException on any mismatch
   */
  public static void requireSupportedVersion(String version) {
    if (!AoefDocument.CURRENT_VERSION.equals(version)) {
      throw new VersionMismatchException(version, AoefDocument.CURRENT_VERSION);
    }
  }

  /**
   * Rejects a document whose kind differs from the expected one.
   *
   * @param actual kind of the document
   * @param expected expected kind; {@code null} accepts any kind
   * @throws UnsupportedTypeException on mismatch
   */
  public static void requireKind(CollectionKind actual, CollectionKind expected) {
    if (expected != null && actual != expected) {
      throw new UnsupportedTypeException(actual.tag(),
          "Expected collection_type " + expected.tag() + " but document contains " + actual.tag());
    }
  }

  private AdapterTree newTree() {
    return AdapterTree.builder().audioDir(audioDir).build();
  }
}
