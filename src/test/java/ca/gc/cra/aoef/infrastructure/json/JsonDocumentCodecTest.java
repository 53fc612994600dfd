package ca.gc.cra.aoef.infrastructure.json;

import static ca.gc.cra.aoef.testutil.AoefFixtures.CREATED;
import static ca.gc.cra.aoef.testutil.AoefFixtures.uuid;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.aoef.application.exchange.AoefConverter;
import ca.gc.cra.aoef.application.exchange.CollectionKind;
import ca.gc.cra.aoef.application.exchange.record.AoefDocument;
import ca.gc.cra.aoef.domain.Recording;
import ca.gc.cra.aoef.domain.Tag;
import ca.gc.cra.aoef.domain.collection.DataCollection;
import ca.gc.cra.aoef.domain.collection.RecordingSet;
import ca.gc.cra.aoef.error.MalformedDocumentException;
import ca.gc.cra.aoef.error.MissingReferenceException;
import ca.gc.cra.aoef.error.UnsupportedTypeException;
import ca.gc.cra.aoef.error.VersionMismatchException;
import ca.gc.cra.aoef.testutil.AoefFixtures;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonDocumentCodecTest {
  private static final String CLIP_DOCUMENT = "{\"version\":\"1.1.0\",\"created_on\":\"2024-05-01T12:30:15\","
      + "\"data\":{\"collection_type\":\"annotation_set\",\"uuid\":\"00000000-0000-1234-0000-000000000063\","
      + "\"recordings\":[{\"uuid\":\"00000000-0000-1234-0000-000000000001\",\"path\":\"a.wav\","
      + "\"duration\":1.0,\"channels\":1,\"samplerate\":8000}],"
      + "\"clips\":[{\"uuid\":\"00000000-0000-1234-0000-000000000002\",\"recording\":\"%s\","
      + "\"start_time\":0.0,\"end_time\":1.0}],"
      + "\"clip_annotations\":[{\"uuid\":\"00000000-0000-1234-0000-000000000005\","
      + "\"clip\":\"00000000-0000-1234-0000-000000000002\",\"created_on\":\"2024-05-01T12:30:15\"}]}}";

  private final JsonDocumentCodec codec = new JsonDocumentCodec();
  private final AoefConverter converter = new AoefConverter();

  @Test
  void everyKindSurvivesAFileRoundTrip() throws IOException {
    for (DataCollection collection : AoefFixtures.everyKind()) {
      String json = write(collection);

      AoefDocument parsed = codec.read(input(json), null);
      DataCollection restored = converter.fromDocument(parsed, null);

      assertEquals(collection, restored, "round trip of " + CollectionKind.of(collection).tag());
    }
  }

  @Test
  void sharedTagIsWrittenOnceAndReferencedByIntegerId() throws IOException {
    Tag dog = new Tag("species", "dog");
    Recording first = Recording.builder(uuid(1), Path.of("first.wav"))
        .duration(1.0).samplerate(8000).tags(List.of(dog)).build();
    Recording second = Recording.builder(uuid(2), Path.of("second.wav"))
        .duration(2.0).samplerate(8000).tags(List.of(new Tag("species", "dog"))).build();

    String json = write(new RecordingSet(uuid(3), List.of(first, second), CREATED));

    assertTrue(json.contains("\"tags\":[{\"id\":0,\"key\":\"species\",\"value\":\"dog\"}]"), json);
    assertEquals(2, occurrences(json, "\"tags\":[0]"), json);
  }

  @Test
  void envelopeStartsWithVersionAndCollectionType() throws IOException {
    String json = write(AoefFixtures.dataset());

    assertTrue(json.startsWith("{\"version\":\"1.1.0\",\"created_on\":\"2024-05-01T12:30:15\",\"data\":"
        + "{\"collection_type\":\"dataset\""), json);
  }

  @Test
  void defaultTimeExpansionIsOmitted() throws IOException {
    String json = write(AoefFixtures.recordingSet());

    assertEquals(1, occurrences(json, "\"time_expansion\""), json);
    assertTrue(json.contains("\"time_expansion\":10.0"), json);
  }

  @Test
  void prettyOutputParsesToTheSameDocument() throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    AoefDocument document = converter.toDocument(AoefFixtures.modelRun(), CREATED);
    new JsonDocumentCodec(true).write(document, out);

    String json = out.toString(StandardCharsets.UTF_8);
    assertTrue(json.contains(System.lineSeparator()) || json.contains("\n"));
    assertEquals(document, codec.read(input(json), CollectionKind.MODEL_RUN));
  }

  @Test
  void olderVersionIsRejected() throws IOException {
    String json = write(AoefFixtures.recordingSet()).replace("\"version\":\"1.1.0\"", "\"version\":\"0.0.1\"");

    VersionMismatchException ex = assertThrows(VersionMismatchException.class, () -> codec.read(input(json), null));

    assertEquals("0.0.1", ex.found());
    assertEquals("1.1.0", ex.expected());
    assertTrue(ex.getMessage().contains("0.0.1"));
  }

  @Test
  void missingVersionIsMalformed() {
    MalformedDocumentException ex = assertThrows(MalformedDocumentException.class,
        () -> codec.read(input("{\"created_on\":\"2024-05-01T12:30:15\",\"data\":{}}"), null));

    assertEquals("version", ex.location());
  }

  @Test
  void unknownCollectionTypeIsUnsupported() throws IOException {
    String json = write(AoefFixtures.recordingSet())
        .replace("\"collection_type\":\"recording_set\"", "\"collection_type\":\"playlist\"");

    UnsupportedTypeException ex = assertThrows(UnsupportedTypeException.class, () -> codec.read(input(json), null));

    assertEquals("playlist", ex.type());
  }

  @Test
  void unexpectedCollectionTypeIsRejected() throws IOException {
    String json = write(AoefFixtures.dataset());

    UnsupportedTypeException ex = assertThrows(UnsupportedTypeException.class,
        () -> codec.read(input(json), CollectionKind.RECORDING_SET));

    assertEquals("dataset", ex.type());
  }

  @Test
  void invalidJsonIsMalformedAtRoot() {
    MalformedDocumentException ex = assertThrows(MalformedDocumentException.class,
        () -> codec.read(input("{\"version\": \"1.1.0\", "), null));

    assertEquals("$", ex.location());
  }

  @Test
  void badUuidReportsItsJsonPath() {
    String json = String.format(CLIP_DOCUMENT, "not-a-uuid");

    MalformedDocumentException ex = assertThrows(MalformedDocumentException.class, () -> codec.read(input(json), null));

    assertEquals("data.clips[0].recording", ex.location());
    assertTrue(ex.getMessage().contains("not-a-uuid"));
  }

  @Test
  void recordingSetWithoutRecordingsIsMalformed() {
    String json = "{\"version\":\"1.1.0\",\"created_on\":\"2024-05-01T12:30:15\","
        + "\"data\":{\"collection_type\":\"recording_set\",\"uuid\":\"00000000-0000-1234-0000-000000000063\"}}";

    MalformedDocumentException ex = assertThrows(MalformedDocumentException.class, () -> codec.read(input(json), null));

    assertEquals("data.recordings", ex.location());
  }

  @Test
  void clipReferencingUndefinedRecordingFailsOnImport() throws IOException {
    String ghost = "00000000-0000-1234-0000-000000000404";
    AoefDocument document = codec.read(input(String.format(CLIP_DOCUMENT, ghost)), null);

    MissingReferenceException ex = assertThrows(MissingReferenceException.class,
        () -> converter.fromDocument(document, null));

    assertEquals(ghost, ex.missingId().toString());
    assertTrue(ex.getMessage().contains(ghost));
  }

  @Test
  void collectionCreatedOnFallsBackToEnvelope() throws IOException {
    AoefDocument document =
        codec.read(input(String.format(CLIP_DOCUMENT, "00000000-0000-1234-0000-000000000001")), null);

    assertEquals(CREATED, document.data().createdOn());
    assertNull(document.data().tables().recordings().get(0).timeExpansion());
    assertFalse(document.data().tables().clipAnnotations().isEmpty());
  }

  @Test
  void bareNonFiniteNumbersAreRead() throws IOException {
    String json = String.format(CLIP_DOCUMENT, "00000000-0000-1234-0000-000000000001")
        .replace("\"samplerate\":8000}", "\"samplerate\":8000,\"features\":{\"snr\":NaN,\"floor\":-Infinity}}");

    AoefDocument document = codec.read(input(json), null);

    Map<String, Double> features = document.data().tables().recordings().get(0).features();
    assertTrue(Double.isNaN(features.get("snr")));
    assertEquals(Double.NEGATIVE_INFINITY, features.get("floor"));
  }

  @Test
  void offsetDateTimesAreNormalisedToUtc() throws IOException {
    String json = String.format(CLIP_DOCUMENT, "00000000-0000-1234-0000-000000000001")
        .replace("\"created_on\":\"2024-05-01T12:30:15\"}", "\"created_on\":\"2024-01-01T10:00:00+05:00\"}");

    AoefDocument document = codec.read(input(json), null);

    assertEquals(LocalDateTime.of(2024, 1, 1, 5, 0), document.data().tables().clipAnnotations().get(0).createdOn());
    assertEquals(CREATED, document.createdOn());
  }

  private String write(DataCollection collection) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    codec.write(converter.toDocument(collection, CREATED), out);
    return out.toString(StandardCharsets.UTF_8);
  }

  private static ByteArrayInputStream input(String json) {
    return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
  }

  private static int occurrences(String text, String needle) {
    int count = 0;
    for (int index = text.indexOf(needle); index >= 0; index = text.indexOf(needle, index + needle.length())) {
      count++;
    }
    return count;
  }
}
