package ca.gc.cra.aoef.domain;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Model output for one detected sound event.
 *
 * @param uuid prediction identifier; never {@code null}
 * @param soundEvent predicted sound event; never {@code null}
 * @param score detection confidence
 * @param tags predicted tags with scores
 * @since 0.1.0
 */
public record SoundEventPrediction(UUID uuid, SoundEvent soundEvent, double score, List<PredictedTag> tags)
    implements Identified {
  public SoundEventPrediction {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(soundEvent, "soundEvent");
    tags = tags == null ? List.of() : List.copyOf(tags);
  }
}
