package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.ClipPredictionRecord;
import ca.gc.cra.aoef.domain.ClipPrediction;
import java.util.Objects;
import java.util.UUID;

/** Converts clip predictions. */
public final class ClipPredictionAdapter extends UuidExchangeAdapter<ClipPrediction, ClipPredictionRecord> {
  private final ClipAdapter clips;
  private final SoundEventPredictionAdapter soundEventPredictions;
  private final SequencePredictionAdapter sequencePredictions;
  private final TagAdapter tags;

  public ClipPredictionAdapter(
      ClipAdapter clips,
      SoundEventPredictionAdapter soundEventPredictions,
      SequencePredictionAdapter sequencePredictions,
      TagAdapter tags) {
    super("clip_prediction");
    this.clips = Objects.requireNonNull(clips, "clips");
    this.soundEventPredictions = Objects.requireNonNull(soundEventPredictions, "soundEventPredictions");
    this.sequencePredictions = Objects.requireNonNull(sequencePredictions, "sequencePredictions");
    this.tags = Objects.requireNonNull(tags, "tags");
  }

  @Override
  protected UUID recordId(ClipPredictionRecord record) {
    return record.uuid();
  }

  @Override
  protected ClipPredictionRecord assembleExchange(ClipPrediction obj, UUID id) {
    return new ClipPredictionRecord(
        id,
        clips.toExchange(obj.clip()).uuid(),
        soundEventPredictions.toUuids(obj.soundEvents()),
        sequencePredictions.toUuids(obj.sequences()),
        tags.toPredicted(obj.tags()),
        Features.toMap(obj.features()));
  }

  @Override
  protected ClipPrediction assembleDomain(ClipPredictionRecord record) {
    String owner = describe(record.uuid());
    return new ClipPrediction(
        record.uuid(),
        clips.require(record.clip(), owner),
        soundEventPredictions.fromUuids(record.soundEvents(), owner),
        sequencePredictions.fromUuids(record.sequences(), owner),
        tags.fromPredicted(record.tags(), owner),
        Features.fromMap(record.features()));
  }
}
