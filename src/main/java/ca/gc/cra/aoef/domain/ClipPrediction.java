package ca.gc.cra.aoef.domain;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * <strong>What:</strong> Everything a model predicted for one clip.
 * <p><strong>Role:</strong> Root object of prediction sets; the prediction side of a clip evaluation.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param uuid identifier; never {@code null}
 * @param clip processed clip; never {@code null}
 * @param soundEvents sound event predictions
 * @param sequences sequence predictions
 * @param tags clip-level predicted tags
 * @param features clip-level features computed by the model
 * @since 0.1.0
 */
public record ClipPrediction(
    UUID uuid,
    Clip clip,
    List<SoundEventPrediction> soundEvents,
    List<SequencePrediction> sequences,
    List<PredictedTag> tags,
    List<Feature> features) implements Identified {
  public ClipPrediction {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(clip, "clip");
    soundEvents = soundEvents == null ? List.of() : List.copyOf(soundEvents);
    sequences = sequences == null ? List.of() : List.copyOf(sequences);
    tags = tags == null ? List.of() : List.copyOf(tags);
    features = features == null ? List.of() : List.copyOf(features);
  }
}
