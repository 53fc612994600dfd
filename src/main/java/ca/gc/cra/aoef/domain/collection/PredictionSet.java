package ca.gc.cra.aoef.domain.collection;

import ca.gc.cra.aoef.domain.ClipPrediction;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * <strong>What:</strong> Set of clip predictions.
 * <p><strong>Role:</strong> Base of {@link ModelRun}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public class PredictionSet implements DataCollection {
  private final UUID uuid;
  private final List<ClipPrediction> clipPredictions;
  private final LocalDateTime createdOn;

  public PredictionSet(UUID uuid, List<ClipPrediction> clipPredictions, LocalDateTime createdOn) {
    this.uuid = Objects.requireNonNull(uuid, "uuid");
    this.clipPredictions = clipPredictions == null ? List.of() : List.copyOf(clipPredictions);
    this.createdOn = Objects.requireNonNull(createdOn, "createdOn");
  }

  @Override
  public UUID uuid() {
    return uuid;
  }

  public List<ClipPrediction> clipPredictions() {
    return clipPredictions;
  }

  @Override
  public LocalDateTime createdOn() {
    return createdOn;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    PredictionSet that = (PredictionSet) o;
    return uuid.equals(that.uuid)
        && clipPredictions.equals(that.clipPredictions)
        && createdOn.equals(that.createdOn);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uuid, clipPredictions, createdOn);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{uuid=" + uuid + ", clipPredictions=" + clipPredictions.size() + "}";
  }
}
