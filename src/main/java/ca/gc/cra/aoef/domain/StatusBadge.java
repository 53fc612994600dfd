package ca.gc.cra.aoef.domain;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * State change recorded on an annotation task.
 *
 * @param state new state; never {@code null}
 * @param owner user who made the change; may be {@code null}
 * @param createdOn time of the change; may be {@code null}
 * @since 0.1.0
 */
public record StatusBadge(AnnotationState state, User owner, LocalDateTime createdOn) {
  public StatusBadge {
    Objects.requireNonNull(state, "state");
  }
}
