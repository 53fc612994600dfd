package ca.gc.cra.aoef.application.exchange.record;

/**
 * Exchange form of a tag.
 *
 * @param id document-local integer id
 * @param key tag key
 * @param value tag value
 */
public record TagRecord(int id, String key, String value) {}
