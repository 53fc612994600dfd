package ca.gc.cra.aoef.domain;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * <strong>What:</strong> All human annotations made on one clip.
 * <p><strong>Role:</strong> Root object of annotation sets; the annotation side of a clip evaluation.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param uuid identifier; never {@code null}
 * @param clip annotated clip; never {@code null}
 * @param soundEvents sound event annotations inside the clip
 * @param sequences sequence annotations inside the clip
 * @param tags clip-level labels
 * @param notes attached notes
 * @param createdOn creation time; may be {@code null}
 * @since 0.1.0
 */
public record ClipAnnotation(
    UUID uuid,
    Clip clip,
    List<SoundEventAnnotation> soundEvents,
    List<SequenceAnnotation> sequences,
    List<Tag> tags,
    List<Note> notes,
    LocalDateTime createdOn) implements Identified {
  public ClipAnnotation {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(clip, "clip");
    soundEvents = soundEvents == null ? List.of() : List.copyOf(soundEvents);
    sequences = sequences == null ? List.of() : List.copyOf(sequences);
    tags = tags == null ? List.of() : List.copyOf(tags);
    notes = notes == null ? List.of() : List.copyOf(notes);
  }
}
