package ca.gc.cra.aoef.config;

import ca.gc.cra.aoef.application.pipeline.ConvertUseCase;
import ca.gc.cra.aoef.application.pipeline.InspectUseCase;
import ca.gc.cra.aoef.application.port.ClockPort;
import ca.gc.cra.aoef.application.port.CollectionStore;
import ca.gc.cra.aoef.application.port.MetricsPort;
import ca.gc.cra.aoef.infrastructure.json.JsonDocumentCodec;
import ca.gc.cra.aoef.infrastructure.persistence.AoefFileStore;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Wires stores and use cases for the CLI commands.
 *
 * <p>Each call builds fresh objects; nothing is cached between commands.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a composition root.
   *
   * @param metrics metrics sink shared by all stores
   * @param clock clock used for {@code created_on} stamps
   */
  public CompositionRoot(MetricsPort metrics, ClockPort clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds a file store.
   *
   * @param audioDir base directory for recording paths, or {@code null}
   * @param pretty whether saved files are indented
   * @return new store
   */
  public CollectionStore collectionStore(Path audioDir, boolean pretty) {
    return new AoefFileStore(new JsonDocumentCodec(pretty), audioDir, metrics, clock);
  }

  public InspectUseCase inspectUseCase() {
    return new InspectUseCase(collectionStore(null, false));
  }

  /**
   * Builds the convert use case for {@code config}.
   *
   * @param config convert settings
   * @return use case reading with {@code audioDir} and writing with {@code outAudioDir}
   */
  public ConvertUseCase convertUseCase(ConvertConfig config) {
    CollectionStore source = collectionStore(config.audioDir().orElse(null), false);
    CollectionStore target = collectionStore(config.outAudioDir().orElse(null), config.pretty());
    return new ConvertUseCase(source, target);
  }
}
