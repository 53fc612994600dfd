package ca.gc.cra.aoef.domain;

import java.util.Locale;

/**
 * Progress states an annotation task moves through.
 *
 * @since 0.1.0
 */
public enum AnnotationState {
  ASSIGNED,
  COMPLETED,
  VERIFIED,
  REJECTED;

  /**
   * Returns the lower-case name used in exchange documents.
   *
   * @return wire name such as {@code completed}
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves a wire name back to a state.
   *
   * @param wireName lower-case state name
   * @return matching state
   * @throws IllegalArgumentException if the name is unknown
   */
  public static AnnotationState fromWireName(String wireName) {
    for (AnnotationState state : values()) {
      if (state.wireName().equals(wireName)) {
        return state;
      }
    }
    throw new IllegalArgumentException("Unknown annotation state: " + wireName);
  }
}
