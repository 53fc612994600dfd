package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.SequenceAnnotationRecord;
import ca.gc.cra.aoef.domain.SequenceAnnotation;
import java.util.Objects;
import java.util.UUID;

/** Converts sequence annotations. */
public final class SequenceAnnotationAdapter
    extends UuidExchangeAdapter<SequenceAnnotation, SequenceAnnotationRecord> {
  private final SequenceAdapter sequences;
  private final TagAdapter tags;
  private final UserAdapter users;
  private final NoteAdapter notes;

  public SequenceAnnotationAdapter(SequenceAdapter sequences, TagAdapter tags, UserAdapter users, NoteAdapter notes) {
    super("sequence_annotation");
    this.sequences = Objects.requireNonNull(sequences, "sequences");
    this.tags = Objects.requireNonNull(tags, "tags");
    this.users = Objects.requireNonNull(users, "users");
    this.notes = Objects.requireNonNull(notes, "notes");
  }

  @Override
  protected UUID recordId(SequenceAnnotationRecord record) {
    return record.uuid();
  }

  @Override
  protected SequenceAnnotationRecord assembleExchange(SequenceAnnotation obj, UUID id) {
    return new SequenceAnnotationRecord(
        id,
        sequences.toExchange(obj.sequence()).uuid(),
        notes.toExchange(obj.notes()),
        tags.toIds(obj.tags()),
        users.toOptionalId(obj.createdBy()),
        obj.createdOn());
  }

  @Override
  protected SequenceAnnotation assembleDomain(SequenceAnnotationRecord record) {
    String owner = describe(record.uuid());
    return new SequenceAnnotation(
        record.uuid(),
        sequences.require(record.sequence(), owner),
        tags.fromIds(record.tags(), owner),
        notes.toDomain(record.notes(), owner),
        users.fromOptionalId(record.createdBy(), owner),
        record.createdOn());
  }
}
