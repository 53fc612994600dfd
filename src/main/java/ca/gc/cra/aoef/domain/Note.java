package ca.gc.cra.aoef.domain;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.UUID;

/**
 * Free-text remark attached to a recording or an annotation.
 *
 * @param uuid note identifier; never {@code null}
 * @param message note body; never {@code null}
 * @param createdBy author; may be {@code null}
 * @param issue whether the note flags a problem that needs attention
 * @param createdOn creation time; may be {@code null}
 * @since 0.1.0
 */
public record Note(UUID uuid, String message, User createdBy, boolean issue, LocalDateTime createdOn)
    implements Identified {
  public Note {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(message, "message");
  }
}
