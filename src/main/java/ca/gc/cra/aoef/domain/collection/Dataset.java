package ca.gc.cra.aoef.domain.collection;

import ca.gc.cra.aoef.domain.Recording;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Named, described recording set.
 *
 * @since 0.1.0
 */
public final class Dataset extends RecordingSet {
  private final String name;
  private final String description;

  public Dataset(UUID uuid, List<Recording> recordings, LocalDateTime createdOn, String name, String description) {
    super(uuid, recordings, createdOn);
    this.name = Objects.requireNonNull(name, "name");
    this.description = description;
  }

  public String name() {
    return name;
  }

  /** @return free-text description; may be {@code null} */
  public String description() {
    return description;
  }

  @Override
  public boolean equals(Object o) {
    if (!super.equals(o)) {
      return false;
    }
    Dataset that = (Dataset) o;
    return name.equals(that.name) && Objects.equals(description, that.description);
  }

  @Override
  public int hashCode() {
    return Objects.hash(super.hashCode(), name, description);
  }
}
