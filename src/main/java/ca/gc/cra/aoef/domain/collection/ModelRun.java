package ca.gc.cra.aoef.domain.collection;

import ca.gc.cra.aoef.domain.ClipPrediction;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Prediction set produced by one named, versioned model.
 *
 * @since 0.1.0
 */
public final class ModelRun extends PredictionSet {
  private final String name;
  private final String version;
  private final String description;

  public ModelRun(
      UUID uuid,
      List<ClipPrediction> clipPredictions,
      LocalDateTime createdOn,
      String name,
      String version,
      String description) {
    super(uuid, clipPredictions, createdOn);
    this.name = Objects.requireNonNull(name, "name");
    this.version = version;
    this.description = description;
  }

  public String name() {
    return name;
  }

  public String version() {
    return version;
  }

  public String description() {
    return description;
  }

  @Override
  public boolean equals(Object o) {
    if (!super.equals(o)) {
      return false;
    }
    ModelRun that = (ModelRun) o;
    return name.equals(that.name)
        && Objects.equals(version, that.version)
        && Objects.equals(description, that.description);
  }

  @Override
  public int hashCode() {
    return Objects.hash(super.hashCode(), name, version, description);
  }
}
