package ca.gc.cra.aoef.api;

import ca.gc.cra.aoef.application.port.MetricsPort;
import ca.gc.cra.aoef.infrastructure.metrics.MetricsSettings;
import ca.gc.cra.aoef.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.aoef.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.aoef.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the metrics adapter from the {@code metricsExporter}, {@code otelEndpoint} and
 * {@code otelResourceAttributes} settings.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static MetricsSettings settings(Map<String, String> effective) {
    String exporter = blankToNull(effective.get("metricsExporter"));
    if (exporter != null) {
      exporter = exporter.toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
    }
    String endpoint = blankToNull(effective.get("otelEndpoint"));
    if (endpoint != null) {
      validateEndpoint(endpoint);
    }
    String attributes = blankToNull(effective.get("otelResourceAttributes"));
    if (attributes != null) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }
    return new MetricsSettings(exporter, endpoint, attributes);
  }

  static MetricsPort createMetrics(MetricsSettings settings) {
    if (settings.disabled()) {
      return new NoOpMetricsAdapter();
    }
    log.debug("Configuring OpenTelemetry metrics exporter with endpoint {}", settings.endpoint());
    return new OpenTelemetryMetricsAdapter(settings);
  }

  static void shutdown(MetricsPort metrics) {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
