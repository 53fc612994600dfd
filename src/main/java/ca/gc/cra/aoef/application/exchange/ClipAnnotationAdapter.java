package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.ClipAnnotationRecord;
import ca.gc.cra.aoef.domain.ClipAnnotation;
import java.util.Objects;
import java.util.UUID;

/**
 * Converts clip annotations. Sound event annotations are listed under {@code annotations} and sequence
 * annotations under {@code sequences}.
 *
 * @since 0.1.0
 */
public final class ClipAnnotationAdapter extends UuidExchangeAdapter<ClipAnnotation, ClipAnnotationRecord> {
  private final ClipAdapter clips;
  private final SoundEventAnnotationAdapter soundEventAnnotations;
  private final SequenceAnnotationAdapter sequenceAnnotations;
  private final TagAdapter tags;
  private final NoteAdapter notes;

  public ClipAnnotationAdapter(
      ClipAdapter clips,
      SoundEventAnnotationAdapter soundEventAnnotations,
      SequenceAnnotationAdapter sequenceAnnotations,
      TagAdapter tags,
      NoteAdapter notes) {
    super("clip_annotation");
    this.clips = Objects.requireNonNull(clips, "clips");
    this.soundEventAnnotations = Objects.requireNonNull(soundEventAnnotations, "soundEventAnnotations");
    this.sequenceAnnotations = Objects.requireNonNull(sequenceAnnotations, "sequenceAnnotations");
    this.tags = Objects.requireNonNull(tags, "tags");
    this.notes = Objects.requireNonNull(notes, "notes");
  }

  @Override
  protected UUID recordId(ClipAnnotationRecord record) {
    return record.uuid();
  }

  @Override
  protected ClipAnnotationRecord assembleExchange(ClipAnnotation obj, UUID id) {
    return new ClipAnnotationRecord(
        id,
        clips.toExchange(obj.clip()).uuid(),
        tags.toIds(obj.tags()),
        soundEventAnnotations.toUuids(obj.soundEvents()),
        sequenceAnnotations.toUuids(obj.sequences()),
        notes.toExchange(obj.notes()),
        obj.createdOn());
  }

  @Override
  protected ClipAnnotation assembleDomain(ClipAnnotationRecord record) {
    String owner = describe(record.uuid());
    return new ClipAnnotation(
        record.uuid(),
        clips.require(record.clip(), owner),
        soundEventAnnotations.fromUuids(record.annotations(), owner),
        sequenceAnnotations.fromUuids(record.sequences(), owner),
        tags.fromIds(record.tags(), owner),
        notes.toDomain(record.notes(), owner),
        record.createdOn());
  }
}
