package ca.gc.cra.aoef.domain;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Time window of a recording.
 *
 * @param uuid clip identifier; never {@code null}
 * @param recording source recording; never {@code null}
 * @param startTime window start in seconds
 * @param endTime window end in seconds
 * @param features clip-level features
 * @since 0.1.0
 */
public record Clip(UUID uuid, Recording recording, double startTime, double endTime, List<Feature> features)
    implements Identified {
  public Clip {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(recording, "recording");
    features = features == null ? List.of() : List.copyOf(features);
  }
}
