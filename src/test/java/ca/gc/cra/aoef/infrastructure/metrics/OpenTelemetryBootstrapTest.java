package ca.gc.cra.aoef.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize(MetricsSettings.FROM_ENVIRONMENT);
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void explicitSettingWinsOverSystemProperty() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "otlp");

    OpenTelemetryBootstrap.BootstrapResult result =
        OpenTelemetryBootstrap.initialize(new MetricsSettings("none", null, null));
    assertTrue(result.isNoop());
    result.close();
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("team=acoustics, broken,=x, env = test");

    assertEquals(2, attributes.size());
    assertEquals("acoustics", attributes.get(AttributeKey.stringKey("team")));
    assertEquals("test", attributes.get(AttributeKey.stringKey("env")));
  }
}
