package ca.gc.cra.aoef.domain;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Human labels attached to a single sound event.
 *
 * @param uuid annotation identifier; never {@code null}
 * @param soundEvent annotated sound event; never {@code null}
 * @param tags labels
 * @param notes attached notes
 * @param createdBy annotator; may be {@code null}
 * @param createdOn creation time; may be {@code null}
 * @since 0.1.0
 */
public record SoundEventAnnotation(
    UUID uuid,
    SoundEvent soundEvent,
    List<Tag> tags,
    List<Note> notes,
    User createdBy,
    LocalDateTime createdOn) implements Identified {
  public SoundEventAnnotation {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(soundEvent, "soundEvent");
    tags = tags == null ? List.of() : List.copyOf(tags);
    notes = notes == null ? List.of() : List.copyOf(notes);
  }
}
