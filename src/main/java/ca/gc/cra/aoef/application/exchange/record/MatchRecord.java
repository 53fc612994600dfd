package ca.gc.cra.aoef.application.exchange.record;

import java.util.Map;
import java.util.UUID;

/**
 * Exchange form of a match.
 *
 * @param uuid match identifier
 * @param source sound event prediction uuid; may be {@code null}
 * @param target sound event annotation uuid; may be {@code null}
 * @param affinity affinity between both sides
 * @param score match score; may be {@code null}
 * @param metrics metrics keyed by name
 */
public record MatchRecord(
    UUID uuid, UUID source, UUID target, double affinity, Double score, Map<String, Double> metrics) {}
