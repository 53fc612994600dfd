package ca.gc.cra.aoef.domain.collection;

import ca.gc.cra.aoef.domain.Recording;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * <strong>What:</strong> Plain set of recordings.
 * <p><strong>Role:</strong> Base of {@link Dataset}. Equality requires the same runtime class, so a
 * dataset never equals a recording set with the same recordings.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public class RecordingSet implements DataCollection {
  private final UUID uuid;
  private final List<Recording> recordings;
  private final LocalDateTime createdOn;

  /**
   * Creates a recording set.
   *
   * @param uuid collection identifier; never {@code null}
   * @param recordings member recordings; copied
   * @param createdOn creation time; never {@code null}
   */
  public RecordingSet(UUID uuid, List<Recording> recordings, LocalDateTime createdOn) {
    this.uuid = Objects.requireNonNull(uuid, "uuid");
    this.recordings = recordings == null ? List.of() : List.copyOf(recordings);
    this.createdOn = Objects.requireNonNull(createdOn, "createdOn");
  }

  @Override
  public UUID uuid() {
    return uuid;
  }

  public List<Recording> recordings() {
    return recordings;
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
    RecordingSet that = (RecordingSet) o;
    return uuid.equals(that.uuid)
        && recordings.equals(that.recordings)
        && createdOn.equals(that.createdOn);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uuid, recordings, createdOn);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{uuid=" + uuid + ", recordings=" + recordings.size() + "}";
  }
}
