package ca.gc.cra.aoef.domain;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Human labels attached to a sequence.
 *
 * @param uuid annotation identifier; never {@code null}
 * @param sequence annotated sequence; never {@code null}
 * @param tags labels
 * @param notes attached notes
 * @param createdBy annotator; may be {@code null}
 * @param createdOn creation time; may be {@code null}
 * @since 0.1.0
 */
public record SequenceAnnotation(
    UUID uuid,
    Sequence sequence,
    List<Tag> tags,
    List<Note> notes,
    User createdBy,
    LocalDateTime createdOn) implements Identified {
  public SequenceAnnotation {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(sequence, "sequence");
    tags = tags == null ? List.of() : List.copyOf(tags);
    notes = notes == null ? List.of() : List.copyOf(notes);
  }
}
