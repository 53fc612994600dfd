package ca.gc.cra.aoef.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {
  private static final Set<String> EXPORTERS = Set.of("otlp", "none");

  private ConfigMerger() {}

  /**
   * Builds the effective settings for one command.
   *
   * @param mode command name
   * @param yaml optional YAML settings for the command
   * @param cli CLI {@code key=value} overrides
   * @param defaults embedded defaults for the command
   * @param warn receives a message whenever a CLI key overrides a YAML key
   * @return immutable merged settings
   * @throws IllegalArgumentException when the merged settings are inconsistent
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          continue;
        }
        if (yamlCopy.containsKey(entry.getKey()) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + entry.getKey());
        }
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    String exporter = trim(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !EXPORTERS.contains(exporter)) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    if ("convert".equalsIgnoreCase(mode)) {
      String in = trim(effective.get("in"));
      String out = trim(effective.get("out"));
      if (!in.isEmpty() && in.equals(out)) {
        throw new IllegalArgumentException("convert in and out must name different files");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
