package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.SoundEventAnnotationRecord;
import ca.gc.cra.aoef.domain.SoundEventAnnotation;
import java.util.Objects;
import java.util.UUID;

/** Converts sound event annotations. */
public final class SoundEventAnnotationAdapter
    extends UuidExchangeAdapter<SoundEventAnnotation, SoundEventAnnotationRecord> {
  private final SoundEventAdapter soundEvents;
  private final TagAdapter tags;
  private final UserAdapter users;
  private final NoteAdapter notes;

  public SoundEventAnnotationAdapter(
      SoundEventAdapter soundEvents, TagAdapter tags, UserAdapter users, NoteAdapter notes) {
    super("sound_event_annotation");
    this.soundEvents = Objects.requireNonNull(soundEvents, "soundEvents");
    this.tags = Objects.requireNonNull(tags, "tags");
    this.users = Objects.requireNonNull(users, "users");
    this.notes = Objects.requireNonNull(notes, "notes");
  }

  @Override
  protected UUID recordId(SoundEventAnnotationRecord record) {
    return record.uuid();
  }

  @Override
  protected SoundEventAnnotationRecord assembleExchange(SoundEventAnnotation obj, UUID id) {
    return new SoundEventAnnotationRecord(
        id,
        soundEvents.toExchange(obj.soundEvent()).uuid(),
        notes.toExchange(obj.notes()),
        tags.toIds(obj.tags()),
        users.toOptionalId(obj.createdBy()),
        obj.createdOn());
  }

  @Override
  protected SoundEventAnnotation assembleDomain(SoundEventAnnotationRecord record) {
    String owner = describe(record.uuid());
    return new SoundEventAnnotation(
        record.uuid(),
        soundEvents.require(record.soundEvent(), owner),
        tags.fromIds(record.tags(), owner),
        notes.toDomain(record.notes(), owner),
        users.fromOptionalId(record.createdBy(), owner),
        record.createdOn());
  }
}
