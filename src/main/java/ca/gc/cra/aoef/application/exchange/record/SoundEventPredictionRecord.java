package ca.gc.cra.aoef.application.exchange.record;

import java.util.List;
import java.util.UUID;

/** Exchange form of a sound event prediction. */
public record SoundEventPredictionRecord(
    UUID uuid, UUID soundEvent, double score, List<PredictedTagRecord> tags) {}
