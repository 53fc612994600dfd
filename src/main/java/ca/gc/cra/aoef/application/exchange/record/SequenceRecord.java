package ca.gc.cra.aoef.application.exchange.record;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Exchange form of a sequence; {@code parent} is the parent sequence uuid or {@code null}. */
public record SequenceRecord(UUID uuid, List<UUID> soundEvents, Map<String, Double> features, UUID parent) {}
