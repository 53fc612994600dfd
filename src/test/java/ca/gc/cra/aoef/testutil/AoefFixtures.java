package ca.gc.cra.aoef.testutil;

import ca.gc.cra.aoef.domain.AnnotationState;
import ca.gc.cra.aoef.domain.AnnotationTask;
import ca.gc.cra.aoef.domain.Clip;
import ca.gc.cra.aoef.domain.ClipAnnotation;
import ca.gc.cra.aoef.domain.ClipEvaluation;
import ca.gc.cra.aoef.domain.ClipPrediction;
import ca.gc.cra.aoef.domain.Feature;
import ca.gc.cra.aoef.domain.Geometry;
import ca.gc.cra.aoef.domain.Match;
import ca.gc.cra.aoef.domain.Note;
import ca.gc.cra.aoef.domain.PredictedTag;
import ca.gc.cra.aoef.domain.Recording;
import ca.gc.cra.aoef.domain.Sequence;
import ca.gc.cra.aoef.domain.SequenceAnnotation;
import ca.gc.cra.aoef.domain.SequencePrediction;
import ca.gc.cra.aoef.domain.SoundEvent;
import ca.gc.cra.aoef.domain.SoundEventAnnotation;
import ca.gc.cra.aoef.domain.SoundEventPrediction;
import ca.gc.cra.aoef.domain.StatusBadge;
import ca.gc.cra.aoef.domain.Tag;
import ca.gc.cra.aoef.domain.User;
import ca.gc.cra.aoef.domain.collection.AnnotationProject;
import ca.gc.cra.aoef.domain.collection.AnnotationSet;
import ca.gc.cra.aoef.domain.collection.DataCollection;
import ca.gc.cra.aoef.domain.collection.Dataset;
import ca.gc.cra.aoef.domain.collection.Evaluation;
import ca.gc.cra.aoef.domain.collection.EvaluationSet;
import ca.gc.cra.aoef.domain.collection.ModelRun;
import ca.gc.cra.aoef.domain.collection.PredictionSet;
import ca.gc.cra.aoef.domain.collection.RecordingSet;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

/**
 * Shared object graph covering every entity type, with shared recordings, shared tags and a sequence parent chain.
 */
public final class AoefFixtures {
  public static final LocalDateTime CREATED = LocalDateTime.of(2024, 5, 1, 12, 30, 15);
  public static final Path AUDIO_DIR = Path.of("/data/audio");

  public static final User ALICE = new User(uuid(1), "alice", "alice@example.org", "Alice Tremblay", "CRA");
  public static final User BOB = new User(uuid(2), "bob", null, null, null);

  public static final Tag DOG = new Tag("species", "dog");
  public static final Tag CALL = new Tag("vocalization", "call");

  public static final Recording RECORDING_A = Recording.builder(uuid(10), AUDIO_DIR.resolve("site1/a.wav"))
      .duration(10.0)
      .channels(2)
      .samplerate(48_000)
      .timeExpansion(10.0)
      .hash("5d41402abc4b2a76b9719d911017c592")
      .date(LocalDate.of(2024, 4, 30))
      .time(LocalTime.of(5, 45, 0))
      .location(45.42, -75.69)
      .tags(List.of(DOG))
      .features(List.of(new Feature("snr", 12.5)))
      .notes(List.of(new Note(uuid(90), "wind noise after 8s", ALICE, true, CREATED)))
      .owners(List.of(ALICE))
      .rights("CC-BY-4.0")
      .build();
  public static final Recording RECORDING_B = Recording.builder(uuid(11), AUDIO_DIR.resolve("site2/b.wav"))
      .duration(3.0)
      .samplerate(22_050)
      .tags(List.of(DOG))
      .build();

  public static final Clip CLIP_1 = new Clip(uuid(20), RECORDING_A, 0.0, 5.0, List.of());
  public static final Clip CLIP_2 = new Clip(uuid(21), RECORDING_A, 5.0, 10.0, List.of(new Feature("rms", 0.25)));
  public static final Clip CLIP_3 = new Clip(uuid(22), RECORDING_B, 0.0, 3.0, List.of());

  public static final SoundEvent EVENT_1 =
      new SoundEvent(uuid(30), RECORDING_A, new Geometry("TimeInterval", List.of(0.5, 1.5)), List.of());
  public static final SoundEvent EVENT_2 = new SoundEvent(
      uuid(31), RECORDING_A, new Geometry("BoundingBox", List.of(2.25, 1000.5, 3.75, 2000.5)),
      List.of(new Feature("duration", 1.5)));

  public static final Sequence SEQUENCE_ROOT = new Sequence(uuid(40), List.of(EVENT_1), List.of(), null);
  public static final Sequence SEQUENCE_CHILD =
      new Sequence(uuid(41), List.of(EVENT_2), List.of(new Feature("gap", 0.75)), SEQUENCE_ROOT);

  public static final SoundEventAnnotation EVENT_ANNOTATION_1 = new SoundEventAnnotation(
      uuid(50), EVENT_1, List.of(DOG), List.of(new Note(uuid(91), "clear bark", BOB, false, CREATED)), BOB, CREATED);
  public static final SoundEventAnnotation EVENT_ANNOTATION_2 =
      new SoundEventAnnotation(uuid(51), EVENT_2, List.of(CALL), List.of(), null, null);
  public static final SequenceAnnotation SEQUENCE_ANNOTATION =
      new SequenceAnnotation(uuid(52), SEQUENCE_CHILD, List.of(CALL), List.of(), ALICE, CREATED);

  public static final ClipAnnotation CLIP_ANNOTATION_1 = new ClipAnnotation(
      uuid(60), CLIP_1, List.of(EVENT_ANNOTATION_1, EVENT_ANNOTATION_2), List.of(SEQUENCE_ANNOTATION),
      List.of(DOG), List.of(new Note(uuid(92), "check the second event", ALICE, true, CREATED)), CREATED);
  public static final ClipAnnotation CLIP_ANNOTATION_2 =
      new ClipAnnotation(uuid(61), CLIP_3, List.of(), List.of(), List.of(), List.of(), CREATED);

  public static final AnnotationTask TASK = new AnnotationTask(uuid(70), CLIP_1, List.of(
      new StatusBadge(AnnotationState.ASSIGNED, BOB, CREATED),
      new StatusBadge(AnnotationState.COMPLETED, ALICE, CREATED.plusHours(2))), CREATED);

  public static final SoundEventPrediction EVENT_PREDICTION =
      new SoundEventPrediction(uuid(80), EVENT_1, 0.9, List.of(new PredictedTag(DOG, 0.8)));
  public static final SequencePrediction SEQUENCE_PREDICTION =
      new SequencePrediction(uuid(81), SEQUENCE_CHILD, 0.7, List.of(new PredictedTag(CALL, 0.6)));
  public static final ClipPrediction CLIP_PREDICTION_1 = new ClipPrediction(
      uuid(82), CLIP_1, List.of(EVENT_PREDICTION), List.of(SEQUENCE_PREDICTION),
      List.of(new PredictedTag(DOG, 0.95)), List.of(new Feature("entropy", 0.125)));
  public static final ClipPrediction CLIP_PREDICTION_2 =
      new ClipPrediction(uuid(83), CLIP_3, List.of(), List.of(), List.of(), List.of());

  public static final Match MATCH_1 =
      new Match(uuid(100), EVENT_PREDICTION, EVENT_ANNOTATION_1, 0.75, 1.0, List.of(new Feature("iou", 0.75)));
  public static final Match MATCH_2 = new Match(uuid(101), null, EVENT_ANNOTATION_2, 0.0, null, List.of());
  public static final ClipEvaluation CLIP_EVALUATION = new ClipEvaluation(
      uuid(110), CLIP_ANNOTATION_1, CLIP_PREDICTION_1, List.of(MATCH_1, MATCH_2),
      List.of(new Feature("precision", 1.0), new Feature("recall", 0.5)), 0.5);

  private AoefFixtures() {}

  public static UUID uuid(long n) {
    return new UUID(0x1234L, n);
  }

  public static RecordingSet recordingSet() {
    return new RecordingSet(uuid(1000), List.of(RECORDING_A, RECORDING_B), CREATED);
  }

  public static Dataset dataset() {
    return new Dataset(uuid(1001), List.of(RECORDING_A, RECORDING_B), CREATED, "Spring survey", "Dawn chorus");
  }

  public static AnnotationSet annotationSet() {
    return new AnnotationSet(uuid(1002), List.of(CLIP_ANNOTATION_1, CLIP_ANNOTATION_2), CREATED);
  }

  public static AnnotationProject annotationProject() {
    return new AnnotationProject(uuid(1003), List.of(CLIP_ANNOTATION_1, CLIP_ANNOTATION_2), CREATED,
        "Dog barks", "Label every bark", "Use species tags only", List.of(DOG, CALL), List.of(TASK));
  }

  public static EvaluationSet evaluationSet() {
    return new EvaluationSet(uuid(1004), List.of(CLIP_ANNOTATION_1), CREATED, "Held-out", null,
        List.of(DOG, new Tag("species", "fox")));
  }

  public static PredictionSet predictionSet() {
    return new PredictionSet(uuid(1005), List.of(CLIP_PREDICTION_1, CLIP_PREDICTION_2), CREATED);
  }

  public static ModelRun modelRun() {
    return new ModelRun(uuid(1006), List.of(CLIP_PREDICTION_1, CLIP_PREDICTION_2), CREATED,
        "BarkNet", "2.4.1", "nightly run");
  }

  public static Evaluation evaluation() {
    return new Evaluation(uuid(1007), CREATED, "sound_event_detection", List.of(CLIP_EVALUATION),
        List.of(new Feature("mAP", 0.625)), 0.625);
  }

  public static List<DataCollection> everyKind() {
    return List.of(recordingSet(), dataset(), annotationSet(), annotationProject(), evaluationSet(),
        predictionSet(), modelRun(), evaluation());
  }
}
