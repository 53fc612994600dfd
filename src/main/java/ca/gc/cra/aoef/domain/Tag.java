package ca.gc.cra.aoef.domain;

import java.util.Objects;

/**
 * <strong>What:</strong> Key/value label attached to recordings, annotations, and predictions.
 * <p><strong>Why:</strong> Tags carry no identifier; two tags with the same key and value are the same tag.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param key tag key (for example {@code species}); never {@code null}
 * @param value tag value (for example {@code dog}); never {@code null}
 * @since 0.1.0
 */
public record Tag(String key, String value) {
  public Tag {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
  }
}
