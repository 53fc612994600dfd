package ca.gc.cra.aoef.application.exchange.record;

import ca.gc.cra.aoef.domain.Geometry;
import java.util.Map;
import java.util.UUID;

/** Exchange form of a sound event; the geometry is copied as is. */
public record SoundEventRecord(UUID uuid, UUID recording, Geometry geometry, Map<String, Double> features) {}
