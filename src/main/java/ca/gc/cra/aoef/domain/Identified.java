package ca.gc.cra.aoef.domain;

import java.util.UUID;

/**
 * Domain types identified by a stable UUID rather than by their content.
 *
 * @since 0.1.0
 */
public interface Identified {
  /**
   * Returns the stable identifier of this object.
   *
   * @return uuid; never {@code null}
   */
  UUID uuid();
}
