package ca.gc.cra.aoef.application.exchange.record;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/** Exchange form of a sequence annotation. */
public record SequenceAnnotationRecord(
    UUID uuid,
    UUID sequence,
    List<NoteRecord> notes,
    List<Integer> tags,
    Integer createdBy,
    LocalDateTime createdOn) {}
