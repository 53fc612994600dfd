package ca.gc.cra.aoef.application.exchange.record;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import java.time.LocalDateTime;
import java.util.UUID;

/** Exchange form of a dataset. */
public record DatasetRecord(
    UUID uuid, LocalDateTime createdOn, EntityTables tables, String name, String description)
    implements CollectionRecord {
  @Override
  public CollectionKind kind() {
    return CollectionKind.DATASET;
  }
}
