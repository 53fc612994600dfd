package ca.gc.cra.aoef.application.exchange.record;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Exchange form of a clip evaluation.
 *
 * @param uuid identifier
 * @param annotations clip annotation uuid
 * @param predictions clip prediction uuid
 * @param matches match uuids
 * @param metrics metrics keyed by name
 * @param score clip score; may be {@code null}
 */
public record ClipEvaluationRecord(
    UUID uuid, UUID annotations, UUID predictions, List<UUID> matches, Map<String, Double> metrics, Double score) {}
