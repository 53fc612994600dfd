package ca.gc.cra.aoef.domain;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Ordered group of sound events, optionally nested inside a parent sequence.
 *
 * <p>Because the record is immutable, a parent chain built in memory is always finite and acyclic.</p>
 *
 * @param uuid sequence identifier; never {@code null}
 * @param soundEvents member sound events
 * @param features sequence-level features
 * @param parent enclosing sequence; may be {@code null}
 * @since 0.1.0
 */
public record Sequence(UUID uuid, List<SoundEvent> soundEvents, List<Feature> features, Sequence parent)
    implements Identified {
  public Sequence {
    Objects.requireNonNull(uuid, "uuid");
    soundEvents = soundEvents == null ? List.of() : List.copyOf(soundEvents);
    features = features == null ? List.of() : List.copyOf(features);
  }
}
