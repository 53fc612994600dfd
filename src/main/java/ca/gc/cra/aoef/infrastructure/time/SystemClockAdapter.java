package ca.gc.cra.aoef.infrastructure.time;

import ca.gc.cra.aoef.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /** Creates a system clock adapter. */
  public SystemClockAdapter() {}

  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   * @implNote Delegates to {@link System#currentTimeMillis()}; {@code created_on} stamps derive from it.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
