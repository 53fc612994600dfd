package ca.gc.cra.aoef.application.exchange.record;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/** Exchange form of an evaluation set; {@code evaluationTags} holds tag ids. */
public record EvaluationSetRecord(
    UUID uuid,
    LocalDateTime createdOn,
    EntityTables tables,
    String name,
    String description,
    List<Integer> evaluationTags) implements CollectionRecord {

  public EvaluationSetRecord {
    evaluationTags = evaluationTags == null ? List.of() : List.copyOf(evaluationTags);
  }

  @Override
  public CollectionKind kind() {
    return CollectionKind.EVALUATION_SET;
  }
}
