package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.SoundEventRecord;
import ca.gc.cra.aoef.domain.SoundEvent;
import java.util.Objects;
import java.util.UUID;

/** Converts sound events; geometries are copied without interpretation. */
public final class SoundEventAdapter extends UuidExchangeAdapter<SoundEvent, SoundEventRecord> {
  private final RecordingAdapter recordings;

  public SoundEventAdapter(RecordingAdapter recordings) {
    super("sound_event");
    this.recordings = Objects.requireNonNull(recordings, "recordings");
  }

  @Override
  protected UUID recordId(SoundEventRecord record) {
    return record.uuid();
  }

  @Override
  protected SoundEventRecord assembleExchange(SoundEvent obj, UUID id) {
    UUID recording = recordings.toExchange(obj.recording()).uuid();
    return new SoundEventRecord(id, recording, obj.geometry(), Features.toMap(obj.features()));
  }

  @Override
  protected SoundEvent assembleDomain(SoundEventRecord record) {
    return new SoundEvent(
        record.uuid(),
        recordings.require(record.recording(), describe(record.uuid())),
        record.geometry(),
        Features.fromMap(record.features()));
  }
}
