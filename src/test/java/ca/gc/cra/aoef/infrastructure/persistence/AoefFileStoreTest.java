package ca.gc.cra.aoef.infrastructure.persistence;

import static ca.gc.cra.aoef.testutil.AoefFixtures.AUDIO_DIR;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import ca.gc.cra.aoef.application.exchange.record.AoefDocument;
import ca.gc.cra.aoef.application.port.ClockPort;
import ca.gc.cra.aoef.application.port.DocumentCodec;
import ca.gc.cra.aoef.domain.Feature;
import ca.gc.cra.aoef.domain.Recording;
import ca.gc.cra.aoef.domain.collection.DataCollection;
import ca.gc.cra.aoef.domain.collection.RecordingSet;
import ca.gc.cra.aoef.error.UnsupportedTypeException;
import ca.gc.cra.aoef.infrastructure.json.JsonDocumentCodec;
import ca.gc.cra.aoef.testutil.AoefFixtures;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AoefFileStoreTest {
  private static final LocalDateTime SAVED_AT = LocalDateTime.of(2024, 6, 2, 8, 0, 0);

  @TempDir Path tempDir;

  private RecordingMetricsPort metrics;
  private AoefFileStore store;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    ClockPort clock = () -> SAVED_AT.atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
    store = new AoefFileStore(new JsonDocumentCodec(), AUDIO_DIR, metrics, clock);
  }

  @Test
  void savesIntoMissingDirectoriesAndLoadsBack() throws IOException {
    Path target = tempDir.resolve("nested/out/project.json");

    AoefDocument written = store.save(AoefFixtures.annotationProject(), target);
    DataCollection loaded = store.load(target, CollectionKind.ANNOTATION_PROJECT);

    assertTrue(Files.isRegularFile(target));
    assertEquals(SAVED_AT, written.createdOn());
    assertEquals(AoefFixtures.annotationProject(), loaded);
    assertEquals(1, metrics.count("aoef.save.success"));
    assertEquals(1, metrics.count("aoef.load.success"));
    assertEquals(1, metrics.observed("aoef.save.latencyNanos").size());
    assertEquals(1, metrics.observed("aoef.load.latencyNanos").size());
  }

  @Test
  void recordingPathsAreStoredRelativeToAudioDirectory() throws IOException {
    Path target = tempDir.resolve("recordings.json");

    store.save(AoefFixtures.recordingSet(), target);

    String json = Files.readString(target, StandardCharsets.UTF_8);
    assertTrue(json.contains("\"path\":\"site1/a.wav\""), json);
    assertFalse(json.contains(AUDIO_DIR.toString()), json);
  }

  @Test
  void readReturnsDocumentWithoutRebuilding() throws IOException {
    Path target = tempDir.resolve("eval.json");
    store.save(AoefFixtures.evaluation(), target);

    AoefDocument document = store.read(target);

    assertEquals(CollectionKind.EVALUATION, document.data().kind());
    assertEquals(1, document.data().tables().clipEvaluations().size());
  }

  @Test
  void rejectsNonJsonSuffix() {
    Path target = tempDir.resolve("recordings.txt");

    assertThrows(IllegalArgumentException.class, () -> store.save(AoefFixtures.recordingSet(), target));
    assertFalse(Files.exists(target));
  }

  @Test
  void suffixCheckIgnoresCase() throws IOException {
    Path target = tempDir.resolve("RECORDINGS.JSON");

    store.save(AoefFixtures.recordingSet(), target);

    assertTrue(Files.isRegularFile(target));
  }

  @Test
  void missingFileIsReportedAsNoSuchFile() {
    Path missing = tempDir.resolve("absent.json");

    NoSuchFileException ex = assertThrows(NoSuchFileException.class, () -> store.load(missing, null));

    assertEquals(missing.toString(), ex.getFile());
    assertEquals(1, metrics.count("aoef.load.failure"));
    assertEquals(1, metrics.observed("aoef.load.latencyNanos").size());
  }

  @Test
  void kindMismatchCountsAsLoadFailure() throws IOException {
    Path target = tempDir.resolve("dataset.json");
    store.save(AoefFixtures.dataset(), target);

    assertThrows(UnsupportedTypeException.class, () -> store.load(target, CollectionKind.RECORDING_SET));
    assertEquals(1, metrics.count("aoef.load.failure"));
    assertEquals(0, metrics.count("aoef.load.success"));
  }

  @Test
  void recordingOutsideAudioDirectoryFailsSave() {
    AoefFileStore rebased =
        new AoefFileStore(new JsonDocumentCodec(), tempDir.resolve("elsewhere"), metrics, ClockPort.SYSTEM);

    assertThrows(IllegalArgumentException.class,
        () -> rebased.save(AoefFixtures.recordingSet(), tempDir.resolve("r.json")));
    assertEquals(1, metrics.count("aoef.save.failure"));
  }

  @Test
  void failedSaveLeavesExistingFileUntouched() throws IOException {
    Path target = tempDir.resolve("recordings.json");
    store.save(AoefFixtures.recordingSet(), target);
    byte[] before = Files.readAllBytes(target);
    AoefFileStore failing = new AoefFileStore(new TruncatingCodec(), AUDIO_DIR, metrics, ClockPort.SYSTEM);

    IOException ex = assertThrows(IOException.class, () -> failing.save(AoefFixtures.dataset(), target));

    assertEquals("disk full", ex.getMessage());
    assertArrayEquals(before, Files.readAllBytes(target));
    try (Stream<Path> files = Files.list(tempDir)) {
      assertEquals(List.of(target), files.collect(Collectors.toList()));
    }
    assertEquals(1, metrics.count("aoef.save.failure"));
  }

  @Test
  void nonFiniteFeatureValuesSurviveAFileRoundTrip() throws IOException {
    Path target = tempDir.resolve("features.json");
    Recording noisy = Recording.builder(AoefFixtures.uuid(500), AUDIO_DIR.resolve("noisy.wav"))
        .duration(3.0)
        .samplerate(16000)
        .features(List.of(new Feature("snr", Double.NaN), new Feature("peak", Double.POSITIVE_INFINITY)))
        .build();
    RecordingSet collection = new RecordingSet(AoefFixtures.uuid(501), List.of(noisy), SAVED_AT);

    store.save(collection, target);

    String json = Files.readString(target, StandardCharsets.UTF_8);
    assertTrue(json.contains("\"snr\":NaN"), json);
    assertTrue(json.contains("\"peak\":Infinity"), json);
    assertEquals(collection, store.load(target, CollectionKind.RECORDING_SET));
  }

  /** Emits half a document, then fails the way a full disk would. */
  private static final class TruncatingCodec implements DocumentCodec {
    @Override
    public void write(AoefDocument document, OutputStream out) throws IOException {
      out.write("{\"version\":\"1.1.0\",\"data\":{".getBytes(StandardCharsets.UTF_8));
      out.flush();
      throw new IOException("disk full");
    }

    @Override
    public AoefDocument read(InputStream in, CollectionKind expected) {
      throw new UnsupportedOperationException("write-only");
    }
  }
}
