package ca.gc.cra.aoef.application.exchange.record;

/**
 * Exchange form of a predicted tag, written as the pair {@code [tag, score]}.
 *
 * @param tag tag id
 * @param score confidence
 */
public record PredictedTagRecord(int tag, double score) {}
