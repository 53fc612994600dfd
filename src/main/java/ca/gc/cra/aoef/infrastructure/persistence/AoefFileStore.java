package ca.gc.cra.aoef.infrastructure.persistence;

import ca.gc.cra.aoef.application.exchange.AoefConverter;
import ca.gc.cra.aoef.application.exchange.CollectionKind;
import ca.gc.cra.aoef.application.exchange.record.AoefDocument;
import ca.gc.cra.aoef.application.port.ClockPort;
import ca.gc.cra.aoef.application.port.CollectionStore;
import ca.gc.cra.aoef.application.port.DocumentCodec;
import ca.gc.cra.aoef.application.port.MetricsPort;
import ca.gc.cra.aoef.domain.collection.DataCollection;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CollectionStore} that keeps each collection in one {@code .json} file.
 * <p><strong>Why:</strong> The single I/O boundary of the engine: read-all on load and write-all on save.</p>
 * <p><strong>Role:</strong> Adapter on the persistence side; delegates mapping to {@link AoefConverter} and
 * serialization to a {@link DocumentCodec}.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; each call builds a fresh converter and adapter tree.</p>
 * <p><strong>Observability:</strong> Emits {@code aoef.save.success}, {@code aoef.save.failure},
 * {@code aoef.save.latencyNanos} and the matching {@code aoef.load.*} metrics; logs each file at INFO.</p>
 *
 * @since 0.1.0
 */
public final class AoefFileStore implements CollectionStore {
  private static final Logger log = LoggerFactory.getLogger(AoefFileStore.class);
  private static final String SUFFIX = ".json";

  private final DocumentCodec codec;
  private final Path audioDir;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a store.
   *
   * @param codec document codec
   * @param audioDir base directory for recording paths; {@code null} keeps paths as given
   * @param metrics metrics sink
   * @param clock clock used for {@code created_on} stamps
   */
  public AoefFileStore(DocumentCodec codec, Path audioDir, MetricsPort metrics, ClockPort clock) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.audioDir = audioDir;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public AoefDocument save(DataCollection collection, Path path) throws IOException {
    Objects.requireNonNull(collection, "collection");
    requireJsonSuffix(path);
    long start = System.nanoTime();
    try {
      AoefDocument document = newConverter().toDocument(collection, clock.localNow());
      writeReplacing(document, path);
      metrics.increment("aoef.save.success");
      log.info("Saved {} {} to {}", document.data().kind().tag(), collection.uuid(), path);
      return document;
    } catch (IOException | RuntimeException ex) {
      metrics.increment("aoef.save.failure");
      throw ex;
    } finally {
      metrics.observe("aoef.save.latencyNanos", System.nanoTime() - start);
    }
  }

  @Override
  public DataCollection load(Path path, CollectionKind expected) throws IOException {
    long start = System.nanoTime();
    try {
      AoefDocument document = readDocument(path, expected);
      DataCollection collection = newConverter().fromDocument(document, expected);
      metrics.increment("aoef.load.success");
      log.info("Loaded {} {} from {}", document.data().kind().tag(), collection.uuid(), path);
      return collection;
    } catch (IOException | RuntimeException ex) {
      metrics.increment("aoef.load.failure");
      throw ex;
    } finally {
      metrics.observe("aoef.load.latencyNanos", System.nanoTime() - start);
    }
  }

  @Override
  public AoefDocument read(Path path) throws IOException {
    return readDocument(path, null);
  }

  private AoefDocument readDocument(Path path, CollectionKind expected) throws IOException {
    requireJsonSuffix(path);
    if (!Files.isRegularFile(path)) {
      throw new NoSuchFileException(path.toString(), null, "AOEF file does not exist");
    }
    try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
      return codec.read(in, expected);
    }
  }

  /**
   * Writes to a sibling temp file and moves it over {@code path} once the document is complete, so a
   * failed write leaves any existing file untouched.
   */
  private void writeReplacing(AoefDocument document, Path path) throws IOException {
    Path target = path.toAbsolutePath();
    Path parent = target.getParent();
    Files.createDirectories(parent);
    Path tmp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
    try {
      try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp))) {
        codec.write(document, out);
      }
      moveIntoPlace(tmp, target);
    } catch (IOException | RuntimeException ex) {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
      }
      throw ex;
    }
  }

  private static void moveIntoPlace(Path tmp, Path target) throws IOException {
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; replacing in place", target);
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private AoefConverter newConverter() {
    return audioDir == null ? new AoefConverter() : new AoefConverter(audioDir);
  }

  private static void requireJsonSuffix(Path path) {
    Objects.requireNonNull(path, "path");
    Path name = path.getFileName();
    if (name == null || !name.toString().toLowerCase(Locale.ROOT).endsWith(SUFFIX)) {
      throw new IllegalArgumentException("AOEF files must use the " + SUFFIX + " suffix: " + path);
    }
  }
}
