package ca.gc.cra.aoef.application.exchange.record;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Exchange form of a clip prediction.
 *
 * @param uuid identifier
 * @param clip clip uuid
 * @param soundEvents sound event prediction uuids
 * @param sequences sequence prediction uuids
 * @param tags clip-level predicted tags
 * @param features clip-level features
 */
public record ClipPredictionRecord(
    UUID uuid,
    UUID clip,
    List<UUID> soundEvents,
    List<UUID> sequences,
    List<PredictedTagRecord> tags,
    Map<String, Double> features) {}
