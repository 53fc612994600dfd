package ca.gc.cra.aoef.application.pipeline;

import ca.gc.cra.aoef.application.exchange.record.AoefDocument;
import ca.gc.cra.aoef.application.port.CollectionStore;
import ca.gc.cra.aoef.config.ConvertConfig;
import ca.gc.cra.aoef.domain.collection.DataCollection;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads an AOEF file into domain objects and saves it again.
 * <p><strong>Why:</strong> Normalizes hand-edited or older-tool output: ids are reassigned in first-seen order,
 * shared entities are deduplicated and recording paths are rebased onto the output audio directory.</p>
 * <p><strong>Role:</strong> Reads through one {@link CollectionStore} and writes through another so the two sides
 * may use different audio directories and formatting.</p>
 *
 * @since 0.1.0
 */
public final class ConvertUseCase {
  private static final Logger log = LoggerFactory.getLogger(ConvertUseCase.class);

  private final CollectionStore source;
  private final CollectionStore target;

  /**
   * Creates the use case.
   *
   * @param source store used to load the input
   * @param target store used to save the output
   */
  public ConvertUseCase(CollectionStore source, CollectionStore target) {
    this.source = Objects.requireNonNull(source, "source");
    this.target = Objects.requireNonNull(target, "target");
  }

  /**
   * Converts the configured file.
   *
   * @param config convert settings
   * @return the document that was written
   * @throws IOException if either file cannot be accessed
   */
  public AoefDocument convert(ConvertConfig config) throws IOException {
    DataCollection collection = source.load(config.input(), config.expected().orElse(null));
    AoefDocument written = target.save(collection, config.output());
    log.debug("Converted {} -> {} with tables {}", config.input(), config.output(), written.data().tables().counts());
    return written;
  }
}
