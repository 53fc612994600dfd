package ca.gc.cra.aoef.application.exchange.collection;

import ca.gc.cra.aoef.application.exchange.AdapterTree;
import ca.gc.cra.aoef.application.exchange.record.AnnotationSetRecord;
import ca.gc.cra.aoef.application.exchange.record.ClipAnnotationRecord;
import ca.gc.cra.aoef.application.exchange.record.CollectionRecord;
import ca.gc.cra.aoef.domain.ClipAnnotation;
import ca.gc.cra.aoef.domain.collection.AnnotationSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Exports and imports annotation sets. Base of the annotation project and evaluation set adapters.
 *
 * @since 0.1.0
 */
public class AnnotationSetAdapter {
  protected final AdapterTree tree;

  public AnnotationSetAdapter(AdapterTree tree) {
    this.tree = Objects.requireNonNull(tree, "tree");
  }

  public AnnotationSetRecord toRecord(AnnotationSet set) {
    collectClipAnnotations(set);
    return new AnnotationSetRecord(set.uuid(), set.createdOn(), tree.snapshot());
  }

  public AnnotationSet toCollection(AnnotationSetRecord record) {
    return new AnnotationSet(record.uuid(), hydrateClipAnnotations(record), record.createdOn());
  }

  /** Routes every clip annotation of {@code set} through the tree. */
  protected void collectClipAnnotations(AnnotationSet set) {
    for (ClipAnnotation clipAnnotation : set.clipAnnotations()) {
      tree.clipAnnotations().toExchange(clipAnnotation);
    }
  }

  /** Hydrates the tree and returns the clip annotations in table order. */
  protected List<ClipAnnotation> hydrateClipAnnotations(CollectionRecord record) {
    tree.hydrate(record.tables());
    String owner = record.kind().tag() + " " + record.uuid();
    List<ClipAnnotation> clipAnnotations = new ArrayList<>();
    for (ClipAnnotationRecord clipAnnotation : record.tables().clipAnnotations()) {
      clipAnnotations.add(tree.clipAnnotations().require(clipAnnotation.uuid(), owner));
    }
    return clipAnnotations;
  }
}
