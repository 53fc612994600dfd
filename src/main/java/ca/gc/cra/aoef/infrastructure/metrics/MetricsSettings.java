package ca.gc.cra.aoef.infrastructure.metrics;

import java.util.Locale;

/**
 * Exporter settings resolved from CLI or YAML configuration.
 *
 * @param exporter {@code otlp} or {@code none}; blank falls back to {@code OTEL_METRICS_EXPORTER}
 * @param endpoint OTLP endpoint; blank falls back to {@code OTEL_EXPORTER_OTLP_ENDPOINT}
 * @param resourceAttributes comma-separated {@code key=value} pairs added to the resource
 * @since 0.1.0
 */
public record MetricsSettings(String exporter, String endpoint, String resourceAttributes) {
  /** Settings that defer entirely to system properties and the environment. */
  public static final MetricsSettings FROM_ENVIRONMENT = new MetricsSettings(null, null, null);

  /**
   * Returns whether the exporter is explicitly disabled.
   *
   * @return {@code true} when {@code exporter} is {@code none}
   */
  public boolean disabled() {
    return exporter != null && "none".equals(exporter.trim().toLowerCase(Locale.ROOT));
  }
}
