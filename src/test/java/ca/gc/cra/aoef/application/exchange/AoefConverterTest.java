package ca.gc.cra.aoef.application.exchange;

import static ca.gc.cra.aoef.testutil.AoefFixtures.AUDIO_DIR;
import static ca.gc.cra.aoef.testutil.AoefFixtures.CLIP_1;
import static ca.gc.cra.aoef.testutil.AoefFixtures.CLIP_2;
import static ca.gc.cra.aoef.testutil.AoefFixtures.CREATED;
import static ca.gc.cra.aoef.testutil.AoefFixtures.RECORDING_A;
import static ca.gc.cra.aoef.testutil.AoefFixtures.uuid;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.aoef.application.exchange.record.AoefDocument;
import ca.gc.cra.aoef.application.exchange.record.EntityTables;
import ca.gc.cra.aoef.application.exchange.record.RecordingRecord;
import ca.gc.cra.aoef.application.exchange.record.TagRecord;
import ca.gc.cra.aoef.domain.Clip;
import ca.gc.cra.aoef.domain.ClipAnnotation;
import ca.gc.cra.aoef.domain.ClipEvaluation;
import ca.gc.cra.aoef.domain.Match;
import ca.gc.cra.aoef.domain.Note;
import ca.gc.cra.aoef.domain.Recording;
import ca.gc.cra.aoef.domain.Tag;
import ca.gc.cra.aoef.domain.User;
import ca.gc.cra.aoef.domain.collection.AnnotationSet;
import ca.gc.cra.aoef.domain.collection.DataCollection;
import ca.gc.cra.aoef.domain.collection.Dataset;
import ca.gc.cra.aoef.domain.collection.Evaluation;
import ca.gc.cra.aoef.domain.collection.RecordingSet;
import ca.gc.cra.aoef.error.UnsupportedTypeException;
import ca.gc.cra.aoef.error.VersionMismatchException;
import ca.gc.cra.aoef.testutil.AoefFixtures;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class AoefConverterTest {

  private final AoefConverter converter = new AoefConverter();

  @Test
  void everyCollectionKindSurvivesExportAndImport() {
    for (DataCollection collection : AoefFixtures.everyKind()) {
      AoefDocument document = converter.toDocument(collection, CREATED);
      DataCollection restored = converter.fromDocument(document, null);

      assertEquals(collection.getClass(), restored.getClass());
      assertEquals(collection, restored, "round trip of " + document.data().kind().tag());
    }
  }

  @Test
  void documentIsStampedWithCurrentVersion() {
    AoefDocument document = converter.toDocument(AoefFixtures.recordingSet(), CREATED);

    assertEquals("1.1.0", document.version());
    assertEquals(CREATED, document.createdOn());
  }

  @Test
  void datasetExportsAsDatasetNotRecordingSet() {
    AoefDocument document = converter.toDocument(AoefFixtures.dataset(), CREATED);

    assertEquals(CollectionKind.DATASET, document.data().kind());
    assertEquals("dataset", document.data().kind().tag());
    assertInstanceOf(Dataset.class, converter.fromDocument(document, CollectionKind.DATASET));
  }

  @Test
  void sharedRecordingIsExportedOnceAndReferencedByBothClips() {
    AnnotationSet set = new AnnotationSet(uuid(2000), List.of(
        new ClipAnnotation(uuid(2001), CLIP_1, List.of(), List.of(), List.of(), List.of(), CREATED),
        new ClipAnnotation(uuid(2002), CLIP_2, List.of(), List.of(), List.of(), List.of(), CREATED)), CREATED);

    EntityTables tables = converter.toDocument(set, CREATED).data().tables();

    assertEquals(1, tables.recordings().size());
    assertEquals(RECORDING_A.uuid(), tables.recordings().get(0).uuid());
    assertEquals(2, tables.clips().size());
    assertTrue(tables.clips().stream().allMatch(clip -> clip.recording().equals(RECORDING_A.uuid())));
  }

  @Test
  void equalTagsCollapseIntoOneRecordReferencedById() {
    Recording first = Recording.builder(uuid(1), Path.of("a.wav")).duration(1.0).samplerate(8000)
        .tags(List.of(new Tag("species", "dog"))).build();
    Recording second = Recording.builder(uuid(2), Path.of("b.wav")).duration(1.0).samplerate(8000)
        .tags(List.of(new Tag("species", "dog"))).build();

    EntityTables tables =
        converter.toDocument(new RecordingSet(uuid(3), List.of(first, second), CREATED), CREATED).data().tables();

    assertEquals(List.of(new TagRecord(0, "species", "dog")), tables.tags());
    for (RecordingRecord recording : tables.recordings()) {
      assertEquals(List.of(0), recording.tags());
    }
  }

  @Test
  void repeatedExportAssignsIdenticalIds() {
    for (DataCollection collection : AoefFixtures.everyKind()) {
      assertEquals(converter.toDocument(collection, CREATED), converter.toDocument(collection, CREATED));
    }
  }

  @Test
  void evaluationSetTagsJoinTheTagTable() {
    EntityTables tables = converter.toDocument(AoefFixtures.evaluationSet(), CREATED).data().tables();

    assertTrue(tables.tags().stream().anyMatch(tag -> tag.value().equals("fox")));
  }

  @Test
  void unknownCollectionTypeIsRejectedOnExport() {
    DataCollection custom = new DataCollection() {
      @Override
      public UUID uuid() {
        return AoefFixtures.uuid(9);
      }

      @Override
      public LocalDateTime createdOn() {
        return CREATED;
      }
    };

    UnsupportedTypeException ex =
        assertThrows(UnsupportedTypeException.class, () -> converter.toDocument(custom, CREATED));
    assertEquals(custom.getClass().getName(), ex.type());
  }

  @Test
  void importRejectsAnyOtherVersion() {
    AoefDocument current = converter.toDocument(AoefFixtures.recordingSet(), CREATED);
    AoefDocument old = new AoefDocument("0.0.1", current.createdOn(), current.data());

    VersionMismatchException ex =
        assertThrows(VersionMismatchException.class, () -> converter.fromDocument(old, null));
    assertTrue(ex.getMessage().contains("0.0.1"));
  }

  @Test
  void importRejectsUnexpectedKind() {
    AoefDocument document = converter.toDocument(AoefFixtures.dataset(), CREATED);

    assertThrows(UnsupportedTypeException.class,
        () -> converter.fromDocument(document, CollectionKind.RECORDING_SET));
  }

  @Test
  void audioDirectoryMakesPathsRelativeOnExportAndAbsoluteOnImport() {
    AoefConverter withAudio = new AoefConverter(AUDIO_DIR);
    AoefDocument document = withAudio.toDocument(AoefFixtures.recordingSet(), CREATED);

    assertEquals(Path.of("site1", "a.wav").toString(), document.data().tables().recordings().get(0).path());
    assertEquals(AoefFixtures.recordingSet(), withAudio.fromDocument(document, null));
  }

  @Test
  void recordingOutsideAudioDirectoryIsRejected() {
    Recording outside = Recording.builder(uuid(5), Path.of("/elsewhere/c.wav")).duration(1.0).build();
    RecordingSet set = new RecordingSet(uuid(6), List.of(outside), CREATED);

    assertThrows(IllegalArgumentException.class, () -> new AoefConverter(AUDIO_DIR).toDocument(set, CREATED));
  }

  @Test
  void clipsShareOneRestoredRecordingInstance() {
    AoefDocument document = converter.toDocument(AoefFixtures.annotationSet(), CREATED);
    AnnotationSet restored = (AnnotationSet) converter.fromDocument(document, CollectionKind.ANNOTATION_SET);

    Clip clip = restored.clipAnnotations().get(0).clip();
    Recording viaEvent = restored.clipAnnotations().get(0).soundEvents().get(0).soundEvent().recording();
    assertTrue(clip.recording() == viaEvent, "recording should be hydrated once and shared");
  }

  @Test
  void matchesPairingTheSameSourceAndTargetShareOneRecord() {
    Match first = new Match(uuid(610), AoefFixtures.EVENT_PREDICTION, AoefFixtures.EVENT_ANNOTATION_1, 0.75, 1.0,
        List.of());
    Match second = new Match(uuid(611), AoefFixtures.EVENT_PREDICTION, AoefFixtures.EVENT_ANNOTATION_1, 0.5, null,
        List.of());
    ClipEvaluation morning = new ClipEvaluation(uuid(600), AoefFixtures.CLIP_ANNOTATION_1,
        AoefFixtures.CLIP_PREDICTION_1, List.of(first), List.of(), null);
    ClipEvaluation evening = new ClipEvaluation(uuid(601), AoefFixtures.CLIP_ANNOTATION_1,
        AoefFixtures.CLIP_PREDICTION_1, List.of(second), List.of(), null);
    Evaluation evaluation =
        new Evaluation(uuid(602), CREATED, "sound_event_detection", List.of(morning, evening), List.of(), null);

    EntityTables tables = converter.toDocument(evaluation, CREATED).data().tables();

    assertEquals(1, tables.matches().size());
    assertEquals(uuid(610), tables.matches().get(0).uuid());
    assertEquals(List.of(uuid(610)), tables.clipEvaluations().get(0).matches());
    assertEquals(List.of(uuid(610)), tables.clipEvaluations().get(1).matches());
  }

  @Test
  void equalUsersShareOneIntegerId() {
    User carol = new User(uuid(700), "carol", "carol@example.org", "Carol", "CRA");
    User carolAgain = new User(uuid(700), "carol", "carol@example.org", "Carol", "CRA");
    User dave = new User(uuid(701), "dave", null, null, null);
    Recording first = Recording.builder(uuid(710), Path.of("first.wav")).duration(1.0)
        .notes(List.of(new Note(uuid(720), "wind", carol, false, CREATED))).build();
    Recording second = Recording.builder(uuid(711), Path.of("second.wav")).duration(1.0)
        .notes(List.of(new Note(uuid(721), "rain", carolAgain, false, CREATED),
            new Note(uuid(722), "clipped", dave, true, CREATED)))
        .build();

    EntityTables tables =
        converter.toDocument(new RecordingSet(uuid(712), List.of(first, second), CREATED), CREATED).data().tables();

    assertEquals(2, tables.users().size());
    assertEquals("carol", tables.users().get(0).username());
    List<RecordingRecord> recordings = tables.recordings();
    assertEquals(0, recordings.get(0).notes().get(0).createdBy());
    assertEquals(0, recordings.get(1).notes().get(0).createdBy());
    assertEquals(1, recordings.get(1).notes().get(1).createdBy());
  }
}
