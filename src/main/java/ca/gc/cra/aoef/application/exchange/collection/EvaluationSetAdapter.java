package ca.gc.cra.aoef.application.exchange.collection;

import ca.gc.cra.aoef.application.exchange.AdapterTree;
import ca.gc.cra.aoef.application.exchange.record.EvaluationSetRecord;
import ca.gc.cra.aoef.domain.ClipAnnotation;
import ca.gc.cra.aoef.domain.collection.EvaluationSet;
import java.util.List;

/** Exports and imports evaluation sets. */
public final class EvaluationSetAdapter extends AnnotationSetAdapter {

  public EvaluationSetAdapter(AdapterTree tree) {
    super(tree);
  }

  public EvaluationSetRecord toRecord(EvaluationSet set) {
    collectClipAnnotations(set);
    List<Integer> evaluationTags = tree.tags().toIds(set.evaluationTags());
    return new EvaluationSetRecord(
        set.uuid(), set.createdOn(), tree.snapshot(), set.name(), set.description(), evaluationTags);
  }

  public EvaluationSet toCollection(EvaluationSetRecord record) {
    List<ClipAnnotation> clipAnnotations = hydrateClipAnnotations(record);
    String owner = record.kind().tag() + " " + record.uuid();
    return new EvaluationSet(
        record.uuid(),
        clipAnnotations,
        record.createdOn(),
        record.name(),
        record.description(),
        tree.tags().fromIds(record.evaluationTags(), owner));
  }
}
