package ca.gc.cra.aoef.domain.collection;

import ca.gc.cra.aoef.domain.ClipEvaluation;
import ca.gc.cra.aoef.domain.Feature;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * <strong>What:</strong> Result of evaluating a model on an evaluation set.
 * <p><strong>Role:</strong> The richest collection; its documents carry every entity table.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class Evaluation implements DataCollection {
  private final UUID uuid;
  private final LocalDateTime createdOn;
  private final String evaluationTask;
  private final List<ClipEvaluation> clipEvaluations;
  private final List<Feature> metrics;
  private final Double score;

  /**
   * Creates an evaluation.
   *
   * @param uuid identifier; never {@code null}
   * @param createdOn creation time; never {@code null}
   * @param evaluationTask name of the evaluation task (for example {@code sound_event_detection})
   * @param clipEvaluations per-clip evaluations
   * @param metrics overall metrics
   * @param score overall score; may be {@code null}
   */
  public Evaluation(
      UUID uuid,
      LocalDateTime createdOn,
      String evaluationTask,
      List<ClipEvaluation> clipEvaluations,
      List<Feature> metrics,
      Double score) {
    this.uuid = Objects.requireNonNull(uuid, "uuid");
    this.createdOn = Objects.requireNonNull(createdOn, "createdOn");
    this.evaluationTask = Objects.requireNonNull(evaluationTask, "evaluationTask");
    this.clipEvaluations = clipEvaluations == null ? List.of() : List.copyOf(clipEvaluations);
    this.metrics = metrics == null ? List.of() : List.copyOf(metrics);
    this.score = score;
  }

  @Override
  public UUID uuid() {
    return uuid;
  }

  @Override
  public LocalDateTime createdOn() {
    return createdOn;
  }

  public String evaluationTask() {
    return evaluationTask;
  }

  public List<ClipEvaluation> clipEvaluations() {
    return clipEvaluations;
  }

  public List<Feature> metrics() {
    return metrics;
  }

  public Double score() {
    return score;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Evaluation that)) {
      return false;
    }
    return uuid.equals(that.uuid)
        && createdOn.equals(that.createdOn)
        && evaluationTask.equals(that.evaluationTask)
        && clipEvaluations.equals(that.clipEvaluations)
        && metrics.equals(that.metrics)
        && Objects.equals(score, that.score);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uuid, createdOn, evaluationTask, clipEvaluations, metrics, score);
  }

  @Override
  public String toString() {
    return "Evaluation{uuid=" + uuid + ", task=" + evaluationTask + ", clipEvaluations=" + clipEvaluations.size() + "}";
  }
}
