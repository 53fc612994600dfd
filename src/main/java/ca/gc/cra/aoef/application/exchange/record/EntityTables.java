package ca.gc.cra.aoef.application.exchange.record;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> The flat, per-entity record tables of one AOEF document.
 * <p><strong>Why:</strong> Every collection kind shares the same table vocabulary; a kind simply leaves the
 * tables it does not use empty.</p>
 * <p><strong>Thread-safety:</strong> Immutable; lists are copied on construction.</p>
 *
 * @since 0.1.0
 */
public record EntityTables(
    List<UserRecord> users,
    List<TagRecord> tags,
    List<RecordingRecord> recordings,
    List<ClipRecord> clips,
    List<SoundEventRecord> soundEvents,
    List<SequenceRecord> sequences,
    List<SoundEventAnnotationRecord> soundEventAnnotations,
    List<SequenceAnnotationRecord> sequenceAnnotations,
    List<ClipAnnotationRecord> clipAnnotations,
    List<SoundEventPredictionRecord> soundEventPredictions,
    List<SequencePredictionRecord> sequencePredictions,
    List<ClipPredictionRecord> clipPredictions,
    List<MatchRecord> matches,
    List<ClipEvaluationRecord> clipEvaluations) {

  public EntityTables {
    users = copy(users);
    tags = copy(tags);
    recordings = copy(recordings);
    clips = copy(clips);
    soundEvents = copy(soundEvents);
    sequences = copy(sequences);
    soundEventAnnotations = copy(soundEventAnnotations);
    sequenceAnnotations = copy(sequenceAnnotations);
    clipAnnotations = copy(clipAnnotations);
    soundEventPredictions = copy(soundEventPredictions);
    sequencePredictions = copy(sequencePredictions);
    clipPredictions = copy(clipPredictions);
    matches = copy(matches);
    clipEvaluations = copy(clipEvaluations);
  }

  /**
   * Returns the number of records per non-empty table, keyed by document table name.
   *
   * @return ordered table counts
   */
  public Map<String, Integer> counts() {
    Map<String, Integer> counts = new LinkedHashMap<>();
    put(counts, "users", users);
    put(counts, "tags", tags);
    put(counts, "recordings", recordings);
    put(counts, "clips", clips);
    put(counts, "sound_events", soundEvents);
    put(counts, "sequences", sequences);
    put(counts, "sound_event_annotations", soundEventAnnotations);
    put(counts, "sequence_annotations", sequenceAnnotations);
    put(counts, "clip_annotations", clipAnnotations);
    put(counts, "sound_event_predictions", soundEventPredictions);
    put(counts, "sequence_predictions", sequencePredictions);
    put(counts, "clip_predictions", clipPredictions);
    put(counts, "matches", matches);
    put(counts, "clip_evaluations", clipEvaluations);
    return counts;
  }

  private static void put(Map<String, Integer> counts, String table, List<?> records) {
    if (!records.isEmpty()) {
      counts.put(table, records.size());
    }
  }

  private static <T> List<T> copy(List<T> list) {
    return list == null ? List.of() : List.copyOf(list);
  }
}
