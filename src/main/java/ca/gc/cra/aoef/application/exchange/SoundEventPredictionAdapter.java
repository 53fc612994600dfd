package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.SoundEventPredictionRecord;
import ca.gc.cra.aoef.domain.SoundEventPrediction;
import java.util.Objects;
import java.util.UUID;

/** Converts sound event predictions; predicted tags become {@code [tagId, score]} pairs. */
public final class SoundEventPredictionAdapter
    extends UuidExchangeAdapter<SoundEventPrediction, SoundEventPredictionRecord> {
  private final SoundEventAdapter soundEvents;
  private final TagAdapter tags;

  public SoundEventPredictionAdapter(SoundEventAdapter soundEvents, TagAdapter tags) {
    super("sound_event_prediction");
    this.soundEvents = Objects.requireNonNull(soundEvents, "soundEvents");
    this.tags = Objects.requireNonNull(tags, "tags");
  }

  @Override
  protected UUID recordId(SoundEventPredictionRecord record) {
    return record.uuid();
  }

  @Override
  protected SoundEventPredictionRecord assembleExchange(SoundEventPrediction obj, UUID id) {
    return new SoundEventPredictionRecord(
        id, soundEvents.toExchange(obj.soundEvent()).uuid(), obj.score(), tags.toPredicted(obj.tags()));
  }

  @Override
  protected SoundEventPrediction assembleDomain(SoundEventPredictionRecord record) {
    String owner = describe(record.uuid());
    return new SoundEventPrediction(
        record.uuid(),
        soundEvents.require(record.soundEvent(), owner),
        record.score(),
        tags.fromPredicted(record.tags(), owner));
  }
}
