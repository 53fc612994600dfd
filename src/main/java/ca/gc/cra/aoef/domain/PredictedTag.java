package ca.gc.cra.aoef.domain;

import java.util.Objects;

/**
 * Tag emitted by a model together with its confidence.
 *
 * @param tag predicted tag; never {@code null}
 * @param score confidence score
 * @since 0.1.0
 */
public record PredictedTag(Tag tag, double score) {
  public PredictedTag {
    Objects.requireNonNull(tag, "tag");
  }
}
