package ca.gc.cra.aoef.domain;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Model output for one detected sequence.
 *
 * @param uuid prediction identifier; never {@code null}
 * @param sequence predicted sequence; never {@code null}
 * @param score detection confidence
 * @param tags predicted tags with scores
 * @since 0.1.0
 */
public record SequencePrediction(UUID uuid, Sequence sequence, double score, List<PredictedTag> tags)
    implements Identified {
  public SequencePrediction {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(sequence, "sequence");
    tags = tags == null ? List.of() : List.copyOf(tags);
  }
}
