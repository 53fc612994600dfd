package ca.gc.cra.aoef.application.exchange.collection;

import ca.gc.cra.aoef.application.exchange.AdapterTree;
import ca.gc.cra.aoef.application.exchange.Features;
import ca.gc.cra.aoef.application.exchange.record.ClipEvaluationRecord;
import ca.gc.cra.aoef.application.exchange.record.EvaluationRecord;
import ca.gc.cra.aoef.domain.ClipEvaluation;
import ca.gc.cra.aoef.domain.collection.Evaluation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Exports and imports evaluations. An evaluation document carries every entity table, from users
 * up to clip evaluations and matches.
 *
 * @since 0.1.0
 */
public final class EvaluationAdapter {
  private final AdapterTree tree;

  public EvaluationAdapter(AdapterTree tree) {
    this.tree = Objects.requireNonNull(tree, "tree");
  }

  public EvaluationRecord toRecord(Evaluation evaluation) {
    for (ClipEvaluation clipEvaluation : evaluation.clipEvaluations()) {
      tree.clipEvaluations().toExchange(clipEvaluation);
    }
    return new EvaluationRecord(
        evaluation.uuid(),
        evaluation.createdOn(),
        tree.snapshot(),
        evaluation.evaluationTask(),
        Features.toMap(evaluation.metrics()),
        evaluation.score());
  }

  public Evaluation toCollection(EvaluationRecord record) {
    tree.hydrate(record.tables());
    String owner = record.kind().tag() + " " + record.uuid();
    List<ClipEvaluation> clipEvaluations = new ArrayList<>();
    for (ClipEvaluationRecord clipEvaluation : record.tables().clipEvaluations()) {
      clipEvaluations.add(tree.clipEvaluations().require(clipEvaluation.uuid(), owner));
    }
    return new Evaluation(
        record.uuid(),
        record.createdOn(),
        record.evaluationTask(),
        clipEvaluations,
        Features.fromMap(record.metrics()),
        record.score());
  }
}
