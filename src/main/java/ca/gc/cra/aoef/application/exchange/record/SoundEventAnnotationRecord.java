package ca.gc.cra.aoef.application.exchange.record;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/** Exchange form of a sound event annotation. */
public record SoundEventAnnotationRecord(
    UUID uuid,
    UUID soundEvent,
    List<NoteRecord> notes,
    List<Integer> tags,
    Integer createdBy,
    LocalDateTime createdOn) {}
