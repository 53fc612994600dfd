package ca.gc.cra.aoef.application.exchange.record;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import java.time.LocalDateTime;
import java.util.UUID;

/** Exchange form of a recording set. */
public record RecordingSetRecord(UUID uuid, LocalDateTime createdOn, EntityTables tables)
    implements CollectionRecord {
  @Override
  public CollectionKind kind() {
    return CollectionKind.RECORDING_SET;
  }
}
