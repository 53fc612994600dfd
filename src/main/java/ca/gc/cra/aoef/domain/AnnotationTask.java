package ca.gc.cra.aoef.domain;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Unit of annotation work: one clip and the history of its status badges.
 *
 * @param uuid task identifier; never {@code null}
 * @param clip clip to annotate; never {@code null}
 * @param statusBadges status history in chronological order
 * @param createdOn creation time; may be {@code null}
 * @since 0.1.0
 */
public record AnnotationTask(UUID uuid, Clip clip, List<StatusBadge> statusBadges, LocalDateTime createdOn)
    implements Identified {
  public AnnotationTask {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(clip, "clip");
    statusBadges = statusBadges == null ? List.of() : List.copyOf(statusBadges);
  }
}
