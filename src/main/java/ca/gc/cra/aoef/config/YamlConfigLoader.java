package ca.gc.cra.aoef.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads CLI settings from YAML, layering the command's own section over {@code common}.
 *
 * <pre>{@code
 * common:
 *   metricsExporter: none
 * convert:
 *   pretty: true
 *   audioDir: /data/audio
 * }</pre>
 *
 * <p>Only the {@code common}, {@code inspect} and {@code convert} sections are recognised, and each may only
 * set the keys its command reads (see {@link DefaultsForMode}). Every section is checked, not just the one
 * being loaded, so a typo in either command's section is reported. Values must be scalars.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON = "common";
  private static final List<String> MODES = List.of("inspect", "convert");

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} for one command.
   *
   * @param path location of the YAML file
   * @param mode command name ({@code inspect} or {@code convert})
   * @return settings for {@code mode}, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed, names an unknown section or key, or holds a
   *     non-scalar value
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    String command = Objects.requireNonNull(mode, "mode").trim().toLowerCase(Locale.ROOT);
    if (!MODES.contains(command)) {
      throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Map<String, String>> sections = sections(document);
    Map<String, String> settings = new LinkedHashMap<>(sections.getOrDefault(COMMON, Map.of()));
    settings.putAll(sections.getOrDefault(command, Map.of()));
    return Optional.of(Map.copyOf(settings));
  }

  private static Map<String, Map<String, String>> sections(Object document) {
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("Configuration root must be a mapping of sections");
    }
    Map<String, Map<String, String>> sections = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      String name = String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT);
      Set<String> accepted;
      if (name.equals(COMMON)) {
        accepted = DefaultsForMode.commonKeys();
      } else if (MODES.contains(name)) {
        accepted = DefaultsForMode.acceptedKeys(name);
      } else {
        throw new IllegalArgumentException(
            "Unknown configuration section '" + entry.getKey() + "'; expected common, inspect or convert");
      }
      if (sections.containsKey(name)) {
        throw new IllegalArgumentException("Section '" + name + "' is defined more than once");
      }
      sections.put(name, section(name, entry.getValue(), accepted));
    }
    return sections;
  }

  private static Map<String, String> section(String name, Object node, Set<String> accepted) {
    if (node == null) {
      return Map.of();
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(name + " section must be a mapping");
    }
    Map<String, String> values = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      String key = String.valueOf(entry.getKey());
      if (!accepted.contains(key)) {
        throw new IllegalArgumentException("Unknown key '" + key + "' in " + name + " section");
      }
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
        throw new IllegalArgumentException(name + "." + key + " must be a single value");
      }
      values.put(key, value == null ? "" : value.toString());
    }
    return values;
  }
}
