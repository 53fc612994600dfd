package ca.gc.cra.aoef.application.exchange.collection;

import ca.gc.cra.aoef.application.exchange.AdapterTree;
import ca.gc.cra.aoef.application.exchange.record.CollectionRecord;
import ca.gc.cra.aoef.application.exchange.record.RecordingRecord;
import ca.gc.cra.aoef.application.exchange.record.RecordingSetRecord;
import ca.gc.cra.aoef.domain.Recording;
import ca.gc.cra.aoef.domain.collection.RecordingSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Exports and imports recording sets.
 *
 * @since 0.1.0
 */
public class RecordingSetAdapter {
  protected final AdapterTree tree;

  public RecordingSetAdapter(AdapterTree tree) {
    this.tree = Objects.requireNonNull(tree, "tree");
  }

  public RecordingSetRecord toRecord(RecordingSet set) {
    collectRecordings(set);
    return new RecordingSetRecord(set.uuid(), set.createdOn(), tree.snapshot());
  }

  public RecordingSet toCollection(RecordingSetRecord record) {
    return new RecordingSet(record.uuid(), hydrateRecordings(record), record.createdOn());
  }

  /** Routes every recording of {@code set} through the tree. */
  protected void collectRecordings(RecordingSet set) {
    for (Recording recording : set.recordings()) {
      tree.recordings().toExchange(recording);
    }
  }

  /** Hydrates the tree and returns the recordings in table order. */
  protected List<Recording> hydrateRecordings(CollectionRecord record) {
    tree.hydrate(record.tables());
    String owner = record.kind().tag() + " " + record.uuid();
    List<Recording> recordings = new ArrayList<>();
    for (RecordingRecord recording : record.tables().recordings()) {
      recordings.add(tree.recordings().require(recording.uuid(), owner));
    }
    return recordings;
  }
}
