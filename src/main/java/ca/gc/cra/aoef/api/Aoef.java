package ca.gc.cra.aoef.api;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import ca.gc.cra.aoef.application.port.ClockPort;
import ca.gc.cra.aoef.application.port.MetricsPort;
import ca.gc.cra.aoef.domain.collection.DataCollection;
import ca.gc.cra.aoef.infrastructure.json.JsonDocumentCodec;
import ca.gc.cra.aoef.infrastructure.persistence.AoefFileStore;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Library entry point for saving and loading AOEF files.
 * <p><strong>Usage:</strong></p>
 * <pre>{@code
 * Aoef.save(dataset, Path.of("out/dataset.json"), audioDir);
 * Dataset loaded = (Dataset) Aoef.load(Path.of("out/dataset.json"), CollectionKind.DATASET, audioDir);
 * }</pre>
 * <p><strong>Thread-safety:</strong> Each call builds its own store and adapter tree; calls may run in
 * parallel.</p>
 *
 * @since 0.1.0
 */
public final class Aoef {
  private Aoef() {}

  /**
   * Saves {@code collection} with recording paths kept as given.
   *
   * @param collection collection to save
   * @param path destination {@code .json} file
   * @throws IOException if the file cannot be written
   * @throws ca.gc.cra.aoef.error.UnsupportedTypeException if the collection type has no AOEF representation
   */
  public static void save(DataCollection collection, Path path) throws IOException {
    save(collection, path, null);
  }

  /**
   * Saves {@code collection}, writing recording paths relative to {@code audioDir}.
   *
   * @param collection collection to save
   * @param path destination {@code .json} file
   * @param audioDir base directory for recording paths; {@code null} keeps paths as given
   * @throws IOException if the file cannot be written
   */
  public static void save(DataCollection collection, Path path, Path audioDir) throws IOException {
    store(audioDir).save(collection, path);
  }

  /**
   * Loads a collection of any kind.
   *
   * @param path source {@code .json} file
   * @return rebuilt collection
   * @throws IOException if the file cannot be read
   */
  public static DataCollection load(Path path) throws IOException {
    return load(path, null, null);
  }

  /**
   * Loads a collection.
   *
   * @param path source {@code .json} file
   * @param expected required collection kind; {@code null} accepts any
   * @param audioDir base directory for relative recording paths; {@code null} keeps paths as stored
   * @return rebuilt collection
   * @throws IOException if the file cannot be read
   */
  public static DataCollection load(Path path, CollectionKind expected, Path audioDir) throws IOException {
    return store(audioDir).load(path, expected);
  }

  private static AoefFileStore store(Path audioDir) {
    return new AoefFileStore(new JsonDocumentCodec(), audioDir, MetricsPort.NO_OP, ClockPort.SYSTEM);
  }
}
