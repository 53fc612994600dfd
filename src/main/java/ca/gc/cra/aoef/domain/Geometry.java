package ca.gc.cra.aoef.domain;

import java.util.Objects;

/**
 * <strong>What:</strong> Opaque geometry of a sound event in time/frequency space.
 * <p><strong>Why:</strong> The exchange engine copies geometries verbatim and never interprets coordinates.</p>
 * <p><strong>Thread-safety:</strong> Immutable when {@code coordinates} is built from immutable lists.</p>
 *
 * @param type geometry type name (for example {@code BoundingBox}); never {@code null}
 * @param coordinates JSON-shaped coordinates: a number or nested lists of numbers; never {@code null}
 * @since 0.1.0
 */
public record Geometry(String type, Object coordinates) {
  public Geometry {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(coordinates, "coordinates");
  }
}
