package ca.gc.cra.aoef.application.exchange.collection;

import ca.gc.cra.aoef.application.exchange.AdapterTree;
import ca.gc.cra.aoef.application.exchange.record.ClipPredictionRecord;
import ca.gc.cra.aoef.application.exchange.record.CollectionRecord;
import ca.gc.cra.aoef.application.exchange.record.PredictionSetRecord;
import ca.gc.cra.aoef.domain.ClipPrediction;
import ca.gc.cra.aoef.domain.collection.PredictionSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Exports and imports prediction sets. Base of the model run adapter.
 *
 * @since 0.1.0
 */
public class PredictionSetAdapter {
  protected final AdapterTree tree;

  public PredictionSetAdapter(AdapterTree tree) {
    this.tree = Objects.requireNonNull(tree, "tree");
  }

  public PredictionSetRecord toRecord(PredictionSet set) {
    collectClipPredictions(set);
    return new PredictionSetRecord(set.uuid(), set.createdOn(), tree.snapshot());
  }

  public PredictionSet toCollection(PredictionSetRecord record) {
    return new PredictionSet(record.uuid(), hydrateClipPredictions(record), record.createdOn());
  }

  /** Routes every clip prediction of {@code set} through the tree. */
  protected void collectClipPredictions(PredictionSet set) {
    for (ClipPrediction clipPrediction : set.clipPredictions()) {
      tree.clipPredictions().toExchange(clipPrediction);
    }
  }

  /** Hydrates the tree and returns the clip predictions in table order. */
  protected List<ClipPrediction> hydrateClipPredictions(CollectionRecord record) {
    tree.hydrate(record.tables());
    String owner = record.kind().tag() + " " + record.uuid();
    List<ClipPrediction> clipPredictions = new ArrayList<>();
    for (ClipPredictionRecord clipPrediction : record.tables().clipPredictions()) {
      clipPredictions.add(tree.clipPredictions().require(clipPrediction.uuid(), owner));
    }
    return clipPredictions;
  }
}
