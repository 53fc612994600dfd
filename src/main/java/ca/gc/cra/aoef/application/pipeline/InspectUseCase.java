package ca.gc.cra.aoef.application.pipeline;

import ca.gc.cra.aoef.application.exchange.AoefConverter;
import ca.gc.cra.aoef.application.exchange.record.AoefDocument;
import ca.gc.cra.aoef.application.port.CollectionStore;
import ca.gc.cra.aoef.config.InspectConfig;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads an AOEF file and summarizes its envelope and tables.
 * <p><strong>Verification:</strong> With {@code verify} on, the collection is also rebuilt so that dangling
 * references and sequence cycles are reported; otherwise only the JSON shape, version and type are checked.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected store.</p>
 *
 * @since 0.1.0
 */
public final class InspectUseCase {
  private static final Logger log = LoggerFactory.getLogger(InspectUseCase.class);

  private final CollectionStore store;

  /**
   * Creates the use case.
   *
   * @param store store used to read the file
   */
  public InspectUseCase(CollectionStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Inspects the configured file.
   *
   * @param config inspect settings
   * @return report describing the file
   * @throws IOException if the file cannot be read
   */
  public InspectReport inspect(InspectConfig config) throws IOException {
    AoefDocument document = store.read(config.input());
    config.expected().ifPresent(expected -> AoefConverter.requireKind(document.data().kind(), expected));
    if (config.verify()) {
      new AoefConverter().fromDocument(document, config.expected().orElse(null));
      log.debug("Verified references of {}", config.input());
    }
    return new InspectReport(
        document.version(),
        document.data().kind(),
        document.data().uuid(),
        document.createdOn(),
        document.data().tables().counts(),
        config.verify());
  }
}
