package ca.gc.cra.aoef.application.exchange.collection;

import ca.gc.cra.aoef.application.exchange.AdapterTree;
import ca.gc.cra.aoef.application.exchange.record.ModelRunRecord;
import ca.gc.cra.aoef.domain.collection.ModelRun;

/** Exports and imports model runs. */
public final class ModelRunAdapter extends PredictionSetAdapter {

  public ModelRunAdapter(AdapterTree tree) {
    super(tree);
  }

  public ModelRunRecord toRecord(ModelRun run) {
    collectClipPredictions(run);
    return new ModelRunRecord(
        run.uuid(), run.createdOn(), tree.snapshot(), run.name(), run.version(), run.description());
  }

  public ModelRun toCollection(ModelRunRecord record) {
    return new ModelRun(
        record.uuid(),
        hydrateClipPredictions(record),
        record.createdOn(),
        record.name(),
        record.version(),
        record.description());
  }
}
