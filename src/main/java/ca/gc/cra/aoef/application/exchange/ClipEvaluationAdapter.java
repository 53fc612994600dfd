package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.ClipEvaluationRecord;
import ca.gc.cra.aoef.domain.ClipEvaluation;
import ca.gc.cra.aoef.domain.Match;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/** Converts clip evaluations, pairing one clip annotation with one clip prediction. */
public final class ClipEvaluationAdapter extends UuidExchangeAdapter<ClipEvaluation, ClipEvaluationRecord> {
  private final ClipAnnotationAdapter clipAnnotations;
  private final ClipPredictionAdapter clipPredictions;
  private final MatchAdapter matches;

  public ClipEvaluationAdapter(
      ClipAnnotationAdapter clipAnnotations, ClipPredictionAdapter clipPredictions, MatchAdapter matches) {
    super("clip_evaluation");
    this.clipAnnotations = Objects.requireNonNull(clipAnnotations, "clipAnnotations");
    this.clipPredictions = Objects.requireNonNull(clipPredictions, "clipPredictions");
    this.matches = Objects.requireNonNull(matches, "matches");
  }

  @Override
  protected UUID recordId(ClipEvaluationRecord record) {
    return record.uuid();
  }

  @Override
  protected ClipEvaluationRecord assembleExchange(ClipEvaluation obj, UUID id) {
    UUID annotations = clipAnnotations.toExchange(obj.annotations()).uuid();
    UUID predictions = clipPredictions.toExchange(obj.predictions()).uuid();
    List<UUID> matchIds = new ArrayList<>(obj.matches().size());
    for (Match match : obj.matches()) {
      matchIds.add(matches.toExchange(match).uuid());
    }
    return new ClipEvaluationRecord(
        id, annotations, predictions, matchIds, Features.toMap(obj.metrics()), obj.score());
  }

  @Override
  protected ClipEvaluation assembleDomain(ClipEvaluationRecord record) {
    String owner = describe(record.uuid());
    List<Match> resolved = new ArrayList<>(record.matches().size());
    for (UUID matchId : record.matches()) {
      resolved.add(matches.require(matchId, owner));
    }
    return new ClipEvaluation(
        record.uuid(),
        clipAnnotations.require(record.annotations(), owner),
        clipPredictions.require(record.predictions(), owner),
        resolved,
        Features.fromMap(record.metrics()),
        record.score());
  }
}
