package ca.gc.cra.aoef.application.port;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * <strong>What:</strong> Port supplying wall-clock time to document stamping and latency measurement.
 * <p><strong>Why:</strong> Lets tests pin {@code created_on} to a fixed instant.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.aoef.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the current local date-time in the system time zone, as written to {@code created_on}.
   *
   * @return local date-time derived from {@link #nowMillis()}
   */
  default LocalDateTime localNow() {
    return LocalDateTime.ofInstant(Instant.ofEpochMilli(nowMillis()), ZoneId.systemDefault());
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
