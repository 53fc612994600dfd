package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.MatchRecord;
import ca.gc.cra.aoef.domain.Match;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * Converts matches. Matches are deduplicated by their {@code (source, target)} pair rather than by
 * uuid, so two matches pairing the same prediction with the same annotation share one record.
 *
 * @since 0.1.0
 */
public final class MatchAdapter extends ExchangeAdapter<Match, MatchRecord, UUID> {
  private final SoundEventPredictionAdapter predictions;
  private final SoundEventAnnotationAdapter annotations;

  public MatchAdapter(SoundEventPredictionAdapter predictions, SoundEventAnnotationAdapter annotations) {
    super("match", match -> Arrays.asList(
        match.source() == null ? null : match.source().uuid(),
        match.target() == null ? null : match.target().uuid()));
    this.predictions = Objects.requireNonNull(predictions, "predictions");
    this.annotations = Objects.requireNonNull(annotations, "annotations");
  }

  @Override
  protected UUID newId(Match obj) {
    return obj.uuid();
  }

  @Override
  protected UUID recordId(MatchRecord record) {
    return record.uuid();
  }

  @Override
  protected MatchRecord assembleExchange(Match obj, UUID id) {
    UUID source = obj.source() == null ? null : predictions.toExchange(obj.source()).uuid();
    UUID target = obj.target() == null ? null : annotations.toExchange(obj.target()).uuid();
    return new MatchRecord(id, source, target, obj.affinity(), obj.score(), Features.toMap(obj.metrics()));
  }

  @Override
  protected Match assembleDomain(MatchRecord record) {
    String owner = "match " + record.uuid();
    return new Match(
        record.uuid(),
        record.source() == null ? null : predictions.require(record.source(), owner),
        record.target() == null ? null : annotations.require(record.target(), owner),
        record.affinity(),
        record.score(),
        Features.fromMap(record.metrics()));
  }
}
