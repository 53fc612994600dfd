package ca.gc.cra.aoef.application.port;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import ca.gc.cra.aoef.application.exchange.record.AoefDocument;
import ca.gc.cra.aoef.domain.collection.DataCollection;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port saving and loading whole collections as AOEF files.
 * <p><strong>Why:</strong> Keeps file I/O at a single boundary; everything behind it is in-memory work.</p>
 * <p><strong>Role:</strong> Implemented by {@code AoefFileStore}.</p>
 * <p><strong>Thread-safety:</strong> Independent calls may run in parallel; each builds its own adapter tree.</p>
 *
 * @since 0.1.0
 */
public interface CollectionStore {
  /**
   * Saves {@code collection} to {@code path}, creating parent directories as needed.
   *
   * @param collection collection to save
   * @param path destination file; must end in {@code .json}
   * @return the document that was written
   * @throws IOException if the file cannot be written
   */
  AoefDocument save(DataCollection collection, Path path) throws IOException;

  /**
   * Loads the collection stored at {@code path}.
   *
   * @param path source file; must end in {@code .json}
   * @param expected kind the caller expects; {@code null} accepts any kind
   * @return rebuilt collection
   * @throws IOException if the file cannot be read, including {@link java.nio.file.NoSuchFileException}
   */
  DataCollection load(Path path, CollectionKind expected) throws IOException;

  /**
   * Reads and validates the document at {@code path} without rebuilding the collection.
   *
   * @param path source file; must end in {@code .json}
   * @return parsed document
   * @throws IOException if the file cannot be read
   */
  AoefDocument read(Path path) throws IOException;
}
