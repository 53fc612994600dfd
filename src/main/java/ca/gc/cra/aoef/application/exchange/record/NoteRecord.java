package ca.gc.cra.aoef.application.exchange.record;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Exchange form of a note. Notes are embedded in their owner rather than kept in a table.
 *
 * @param uuid note identifier
 * @param message note body
 * @param createdBy user id of the author; may be {@code null}
 * @param issue whether the note flags a problem
 * @param createdOn creation time; may be {@code null}
 */
public record NoteRecord(UUID uuid, String message, Integer createdBy, boolean issue, LocalDateTime createdOn) {}
