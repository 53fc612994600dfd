package ca.gc.cra.aoef.application.exchange.record;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/** Exchange form of an evaluation. */
public record EvaluationRecord(
    UUID uuid,
    LocalDateTime createdOn,
    EntityTables tables,
    String evaluationTask,
    Map<String, Double> metrics,
    Double score) implements CollectionRecord {
  @Override
  public CollectionKind kind() {
    return CollectionKind.EVALUATION;
  }
}
