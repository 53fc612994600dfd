package ca.gc.cra.aoef.application.exchange.collection;

import ca.gc.cra.aoef.application.exchange.AdapterTree;
import ca.gc.cra.aoef.application.exchange.record.DatasetRecord;
import ca.gc.cra.aoef.domain.collection.Dataset;

/** Exports and imports datasets: a recording set plus name and description. */
public final class DatasetAdapter extends RecordingSetAdapter {

  public DatasetAdapter(AdapterTree tree) {
    super(tree);
  }

  public DatasetRecord toRecord(Dataset dataset) {
    collectRecordings(dataset);
    return new DatasetRecord(
        dataset.uuid(), dataset.createdOn(), tree.snapshot(), dataset.name(), dataset.description());
  }

  public Dataset toCollection(DatasetRecord record) {
    return new Dataset(
        record.uuid(), hydrateRecordings(record), record.createdOn(), record.name(), record.description());
  }
}
