package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.ClipRecord;
import ca.gc.cra.aoef.domain.Clip;
import java.util.Objects;
import java.util.UUID;

/** Converts clips; the recording is referenced by uuid. */
public final class ClipAdapter extends UuidExchangeAdapter<Clip, ClipRecord> {
  private final RecordingAdapter recordings;

  public ClipAdapter(RecordingAdapter recordings) {
    super("clip");
    this.recordings = Objects.requireNonNull(recordings, "recordings");
  }

  @Override
  protected UUID recordId(ClipRecord record) {
    return record.uuid();
  }

  @Override
  protected ClipRecord assembleExchange(Clip obj, UUID id) {
    UUID recording = recordings.toExchange(obj.recording()).uuid();
    return new ClipRecord(id, recording, obj.startTime(), obj.endTime(), Features.toMap(obj.features()));
  }

  @Override
  protected Clip assembleDomain(ClipRecord record) {
    return new Clip(
        record.uuid(),
        recordings.require(record.recording(), describe(record.uuid())),
        record.startTime(),
        record.endTime(),
        Features.fromMap(record.features()));
  }
}
