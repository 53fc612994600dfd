package ca.gc.cra.aoef.domain;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Region of a recording that contains a sound of interest.
 *
 * @param uuid sound event identifier; never {@code null}
 * @param recording recording the event belongs to; never {@code null}
 * @param geometry location of the event; may be {@code null}
 * @param features event-level features
 * @since 0.1.0
 */
public record SoundEvent(UUID uuid, Recording recording, Geometry geometry, List<Feature> features)
    implements Identified {
  public SoundEvent {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(recording, "recording");
    features = features == null ? List.of() : List.copyOf(features);
  }
}
