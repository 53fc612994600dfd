package ca.gc.cra.aoef.domain;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Pairing between a predicted sound event and an annotated one.
 *
 * <p>Either side may be absent: an unmatched prediction is a false positive, an unmatched
 * annotation a false negative.</p>
 *
 * @param uuid match identifier; never {@code null}
 * @param source prediction side; may be {@code null}
 * @param target annotation side; may be {@code null}
 * @param affinity geometric affinity between the two sides
 * @param score match score; may be {@code null}
 * @param metrics per-match metrics
 * @since 0.1.0
 */
public record Match(
    UUID uuid,
    SoundEventPrediction source,
    SoundEventAnnotation target,
    double affinity,
    Double score,
    List<Feature> metrics) implements Identified {
  public Match {
    Objects.requireNonNull(uuid, "uuid");
    metrics = metrics == null ? List.of() : List.copyOf(metrics);
  }
}
