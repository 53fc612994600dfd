/**
 * Metrics adapters.
 *
 * <p>{@link ca.gc.cra.aoef.infrastructure.metrics.OpenTelemetryMetricsAdapter} exports save and load counters
 * over OTLP; {@link ca.gc.cra.aoef.infrastructure.metrics.NoOpMetricsAdapter} is used when metrics are off.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoef.infrastructure.metrics;
