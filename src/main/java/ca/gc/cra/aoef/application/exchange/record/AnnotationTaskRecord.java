package ca.gc.cra.aoef.application.exchange.record;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/** Exchange form of an annotation task with its embedded status badges. */
public record AnnotationTaskRecord(
    UUID uuid, UUID clip, List<StatusBadgeRecord> statusBadges, LocalDateTime createdOn) {}
