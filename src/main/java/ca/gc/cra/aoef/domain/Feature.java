package ca.gc.cra.aoef.domain;

import java.util.Objects;

/**
 * Named numeric measurement. Also used for evaluation metrics.
 *
 * @param name feature name; never {@code null}
 * @param value numeric value
 * @since 0.1.0
 */
public record Feature(String name, double value) {
  public Feature {
    Objects.requireNonNull(name, "name");
  }
}
