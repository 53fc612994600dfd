package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.EntityTables;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Fully wired set of entity adapters for one conversion call.
 * <p><strong>Why:</strong> Every adapter that references another entity type must share that type's
 * adapter instance, otherwise identity maps split and documents stop being deduplicated.</p>
 * <p><strong>Role:</strong> Built fresh by {@link #builder()} for each save or load and discarded after it.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; never share a tree between calls.</p>
 *
 * @since 0.1.0
 */
public final class AdapterTree {
  private final TagAdapter tags;
  private final UserAdapter users;
  private final NoteAdapter notes;
  private final RecordingAdapter recordings;
  private final ClipAdapter clips;
  private final SoundEventAdapter soundEvents;
  private final SequenceAdapter sequences;
  private final SoundEventAnnotationAdapter soundEventAnnotations;
  private final SequenceAnnotationAdapter sequenceAnnotations;
  private final ClipAnnotationAdapter clipAnnotations;
  private final AnnotationTaskAdapter annotationTasks;
  private final SoundEventPredictionAdapter soundEventPredictions;
  private final SequencePredictionAdapter sequencePredictions;
  private final ClipPredictionAdapter clipPredictions;
  private final MatchAdapter matches;
  private final ClipEvaluationAdapter clipEvaluations;

  private AdapterTree(Path audioDir) {
    tags = new TagAdapter();
    users = new UserAdapter();
    notes = new NoteAdapter(users);
    recordings = new RecordingAdapter(tags, users, notes, audioDir);
    clips = new ClipAdapter(recordings);
    soundEvents = new SoundEventAdapter(recordings);
    sequences = new SequenceAdapter(soundEvents);
    soundEventAnnotations = new SoundEventAnnotationAdapter(soundEvents, tags, users, notes);
    sequenceAnnotations = new SequenceAnnotationAdapter(sequences, tags, users, notes);
    clipAnnotations = new ClipAnnotationAdapter(clips, soundEventAnnotations, sequenceAnnotations, tags, notes);
    annotationTasks = new AnnotationTaskAdapter(clips, users);
    soundEventPredictions = new SoundEventPredictionAdapter(soundEvents, tags);
    sequencePredictions = new SequencePredictionAdapter(sequences, tags);
    clipPredictions = new ClipPredictionAdapter(clips, soundEventPredictions, sequencePredictions, tags);
    matches = new MatchAdapter(soundEventPredictions, soundEventAnnotations);
    clipEvaluations = new ClipEvaluationAdapter(clipAnnotations, clipPredictions, matches);
  }

  /** @return a builder for a new tree */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Snapshots every table in first-seen order.
   *
   * @return tables holding every record exported so far
   */
  public EntityTables snapshot() {
    return new EntityTables(
        users.values(),
        tags.values(),
        recordings.values(),
        clips.values(),
        soundEvents.values(),
        sequences.values(),
        soundEventAnnotations.values(),
        sequenceAnnotations.values(),
        clipAnnotations.values(),
        soundEventPredictions.values(),
        sequencePredictions.values(),
        clipPredictions.values(),
        matches.values(),
        clipEvaluations.values());
  }

  /**
   * Hydrates all tables in dependency order: users and tags, recordings, clips and sound events,
   * sequences, sound event and sequence annotations and predictions, clip-level aggregates, matches,
   * and finally clip evaluations.
   *
   * @param tables document tables
   */
  public void hydrate(EntityTables tables) {
    tables.users().forEach(users::toDomain);
    tables.tags().forEach(tags::toDomain);
    tables.recordings().forEach(recordings::toDomain);
    tables.clips().forEach(clips::toDomain);
    tables.soundEvents().forEach(soundEvents::toDomain);
    sequences.hydrateAll(tables.sequences());
    tables.soundEventAnnotations().forEach(soundEventAnnotations::toDomain);
    tables.sequenceAnnotations().forEach(sequenceAnnotations::toDomain);
    tables.soundEventPredictions().forEach(soundEventPredictions::toDomain);
    tables.sequencePredictions().forEach(sequencePredictions::toDomain);
    tables.clipAnnotations().forEach(clipAnnotations::toDomain);
    tables.clipPredictions().forEach(clipPredictions::toDomain);
    tables.matches().forEach(matches::toDomain);
    tables.clipEvaluations().forEach(clipEvaluations::toDomain);
  }

  public TagAdapter tags() {
    return tags;
  }

  public UserAdapter users() {
    return users;
  }

  public RecordingAdapter recordings() {
    return recordings;
  }

  public ClipAdapter clips() {
    return clips;
  }

  public SequenceAdapter sequences() {
    return sequences;
  }

  public ClipAnnotationAdapter clipAnnotations() {
    return clipAnnotations;
  }

  public AnnotationTaskAdapter annotationTasks() {
    return annotationTasks;
  }

  public ClipPredictionAdapter clipPredictions() {
    return clipPredictions;
  }

  public ClipEvaluationAdapter clipEvaluations() {
    return clipEvaluations;
  }

  /** Builder for {@link AdapterTree}. */
  public static final class Builder {
    private Path audioDir;

    private Builder() {}

    /**
     * Sets the directory recording paths are stored relative to.
     *
     * @param audioDir audio directory; {@code null} keeps paths as given
     * @return this builder
     */
    public Builder audioDir(Path audioDir) {
      this.audioDir = audioDir;
      return this;
    }

    public AdapterTree build() {
      return new AdapterTree(audioDir);
    }
  }
}
