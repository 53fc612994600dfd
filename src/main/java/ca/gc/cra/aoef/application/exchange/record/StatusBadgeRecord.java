package ca.gc.cra.aoef.application.exchange.record;

import ca.gc.cra.aoef.domain.AnnotationState;
import java.time.LocalDateTime;

/** Exchange form of a status badge; {@code owner} is a user id. */
public record StatusBadgeRecord(AnnotationState state, Integer owner, LocalDateTime createdOn) {}
