package ca.gc.cra.aoef.application.exchange.record;

import java.util.Map;
import java.util.UUID;

/** Exchange form of a clip; {@code recording} is the recording uuid. */
public record ClipRecord(
    UUID uuid, UUID recording, double startTime, double endTime, Map<String, Double> features) {}
