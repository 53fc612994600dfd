package ca.gc.cra.aoef.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("convert");
    Map<String, String> yaml = Map.of("pretty", "true", "audioDir", "/data/audio");
    Map<String, String> cli = Map.of("pretty", "false", "in", "a.json", "out", "b.json");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "convert",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("false", merged.get("pretty"));
    assertEquals("/data/audio", merged.get("audioDir"));
    assertEquals("a.json", merged.get("in"));
    assertEquals("false", merged.get("allowOverwrite"));
    assertEquals(List.of("CLI overrides YAML for key: pretty"), warnings);
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "inspect",
        Optional.of(Map.of("verify", "false")),
        Map.of(),
        DefaultsForMode.asFlatMap("inspect"),
        warnings::add);

    assertEquals("false", merged.get("verify"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void unknownExporterIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "inspect",
            Optional.empty(),
            Map.of("metricsExporter", "prometheus"),
            DefaultsForMode.asFlatMap("inspect"),
            msg -> {}));
  }

  @Test
  void convertRequiresDistinctInputAndOutput() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "convert",
            Optional.empty(),
            Map.of("in", "same.json", "out", "same.json"),
            DefaultsForMode.asFlatMap("convert"),
            msg -> {}));
    assertTrue(ex.getMessage().contains("different"));
  }
}
