package ca.gc.cra.aoef.application.exchange.record;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * <strong>What:</strong> The {@code data} payload of an AOEF document, discriminated by collection kind.
 * <p><strong>Role:</strong> Closed union of the eight collection record shapes; the JSON codec writes
 * {@link #kind()} as {@code collection_type}.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface CollectionRecord
    permits RecordingSetRecord,
        DatasetRecord,
        AnnotationSetRecord,
        AnnotationProjectRecord,
        EvaluationSetRecord,
        PredictionSetRecord,
        ModelRunRecord,
        EvaluationRecord {

  /** @return collection kind written as {@code collection_type} */
  CollectionKind kind();

  /** @return collection uuid */
  UUID uuid();

  /** @return collection creation time; may be {@code null} in hand-written documents */
  LocalDateTime createdOn();

  /** @return entity tables of the document */
  EntityTables tables();
}
