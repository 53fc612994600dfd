package ca.gc.cra.aoef.domain;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Evaluation of the predictions made for one clip against its annotations.
 *
 * @param uuid identifier; never {@code null}
 * @param annotations ground truth for the clip; never {@code null}
 * @param predictions model output for the clip; never {@code null}
 * @param matches pairings between predicted and annotated sound events
 * @param metrics clip-level metrics
 * @param score overall clip score; may be {@code null}
 * @since 0.1.0
 */
public record ClipEvaluation(
    UUID uuid,
    ClipAnnotation annotations,
    ClipPrediction predictions,
    List<Match> matches,
    List<Feature> metrics,
    Double score) implements Identified {
  public ClipEvaluation {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(annotations, "annotations");
    Objects.requireNonNull(predictions, "predictions");
    matches = matches == null ? List.of() : List.copyOf(matches);
    metrics = metrics == null ? List.of() : List.copyOf(metrics);
  }
}
