package ca.gc.cra.aoef.infrastructure.metrics;

import ca.gc.cra.aoef.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations. Selected when the CLI runs with {@code metrics=none}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  /** Creates a no-op metrics adapter. */
  public NoOpMetricsAdapter() {}

  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
