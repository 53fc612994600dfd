package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.SequencePredictionRecord;
import ca.gc.cra.aoef.domain.SequencePrediction;
import java.util.Objects;
import java.util.UUID;

/** Converts sequence predictions. */
public final class SequencePredictionAdapter
    extends UuidExchangeAdapter<SequencePrediction, SequencePredictionRecord> {
  private final SequenceAdapter sequences;
  private final TagAdapter tags;

  public SequencePredictionAdapter(SequenceAdapter sequences, TagAdapter tags) {
    super("sequence_prediction");
    this.sequences = Objects.requireNonNull(sequences, "sequences");
    this.tags = Objects.requireNonNull(tags, "tags");
  }

  @Override
  protected UUID recordId(SequencePredictionRecord record) {
    return record.uuid();
  }

  @Override
  protected SequencePredictionRecord assembleExchange(SequencePrediction obj, UUID id) {
    return new SequencePredictionRecord(
        id, sequences.toExchange(obj.sequence()).uuid(), obj.score(), tags.toPredicted(obj.tags()));
  }

  @Override
  protected SequencePrediction assembleDomain(SequencePredictionRecord record) {
    String owner = describe(record.uuid());
    return new SequencePrediction(
        record.uuid(),
        sequences.require(record.sequence(), owner),
        record.score(),
        tags.fromPredicted(record.tags(), owner));
  }
}
