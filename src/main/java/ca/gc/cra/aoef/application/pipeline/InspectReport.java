package ca.gc.cra.aoef.application.pipeline;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Summary of one AOEF file.
 *
 * @param version envelope version
 * @param kind collection type
 * @param uuid collection uuid
 * @param createdOn envelope {@code created_on}
 * @param tableCounts record count per non-empty table, in document order
 * @param verified whether the collection was rebuilt and all references resolved
 * @since 0.1.0
 */
public record InspectReport(
    String version,
    CollectionKind kind,
    UUID uuid,
    LocalDateTime createdOn,
    Map<String, Integer> tableCounts,
    boolean verified) {

  public InspectReport {
    tableCounts = Collections.unmodifiableMap(new LinkedHashMap<>(tableCounts));
  }
}
