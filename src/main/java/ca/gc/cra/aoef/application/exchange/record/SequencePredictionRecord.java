package ca.gc.cra.aoef.application.exchange.record;

import java.util.List;
import java.util.UUID;

/** Exchange form of a sequence prediction. */
public record SequencePredictionRecord(UUID uuid, UUID sequence, double score, List<PredictedTagRecord> tags) {}
