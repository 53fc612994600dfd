package ca.gc.cra.aoef.application.exchange.record;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * <strong>What:</strong> The AOEF envelope {@code {version, created_on, data}}.
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param version format version string
 * @param createdOn time the document was written
 * @param data collection payload
 * @since 0.1.0
 */
public record AoefDocument(String version, LocalDateTime createdOn, CollectionRecord data) {
  /** Version this engine writes and the only version it accepts on load. */
  public static final String CURRENT_VERSION = "1.1.0";

  public AoefDocument {
    Objects.requireNonNull(version, "version");
    Objects.requireNonNull(createdOn, "createdOn");
    Objects.requireNonNull(data, "data");
  }
}
