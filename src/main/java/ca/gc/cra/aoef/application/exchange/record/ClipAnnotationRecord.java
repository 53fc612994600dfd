package ca.gc.cra.aoef.application.exchange.record;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Exchange form of a clip annotation.
 *
 * @param uuid identifier
 * @param clip clip uuid
 * @param tags tag ids
 * @param annotations sound event annotation uuids
 * @param sequences sequence annotation uuids
 * @param notes embedded notes
 * @param createdOn creation time; may be {@code null}
 */
public record ClipAnnotationRecord(
    UUID uuid,
    UUID clip,
    List<Integer> tags,
    List<UUID> annotations,
    List<UUID> sequences,
    List<NoteRecord> notes,
    LocalDateTime createdOn) {}
