package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.AnnotationTaskRecord;
import ca.gc.cra.aoef.application.exchange.record.StatusBadgeRecord;
import ca.gc.cra.aoef.domain.AnnotationTask;
import ca.gc.cra.aoef.domain.StatusBadge;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/** Converts annotation tasks and their embedded status badges. */
public final class AnnotationTaskAdapter extends UuidExchangeAdapter<AnnotationTask, AnnotationTaskRecord> {
  private final ClipAdapter clips;
  private final UserAdapter users;

  public AnnotationTaskAdapter(ClipAdapter clips, UserAdapter users) {
    super("annotation_task");
    this.clips = Objects.requireNonNull(clips, "clips");
    this.users = Objects.requireNonNull(users, "users");
  }

  @Override
  protected UUID recordId(AnnotationTaskRecord record) {
    return record.uuid();
  }

  @Override
  protected AnnotationTaskRecord assembleExchange(AnnotationTask obj, UUID id) {
    UUID clip = clips.toExchange(obj.clip()).uuid();
    List<StatusBadgeRecord> badges = new ArrayList<>(obj.statusBadges().size());
    for (StatusBadge badge : obj.statusBadges()) {
      badges.add(new StatusBadgeRecord(badge.state(), users.toOptionalId(badge.owner()), badge.createdOn()));
    }
    return new AnnotationTaskRecord(id, clip, badges, obj.createdOn());
  }

  @Override
  protected AnnotationTask assembleDomain(AnnotationTaskRecord record) {
    String owner = describe(record.uuid());
    List<StatusBadge> badges = new ArrayList<>(record.statusBadges().size());
    for (StatusBadgeRecord badge : record.statusBadges()) {
      badges.add(new StatusBadge(badge.state(), users.fromOptionalId(badge.owner(), owner), badge.createdOn()));
    }
    return new AnnotationTask(record.uuid(), clips.require(record.clip(), owner), badges, record.createdOn());
  }
}
