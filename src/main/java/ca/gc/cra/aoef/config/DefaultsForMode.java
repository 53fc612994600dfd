package ca.gc.cra.aoef.config;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Flattened default settings for each CLI command. Keys absent here are still accepted if a command reads them.
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = Map.of(
      "metricsExporter", "none",
      "otelEndpoint", "",
      "otelResourceAttributes", "",
      "logLevel", "INFO");

  private DefaultsForMode() {}

  /**
   * Keys a configuration file may set in its {@code common} section.
   *
   * @return unmodifiable key set
   */
  public static Set<String> commonKeys() {
    return COMMON_DEFAULTS.keySet();
  }

  /**
   * Keys a configuration file may set for {@code mode}: its defaults plus the file arguments it takes.
   *
   * @param mode {@code inspect} or {@code convert}
   * @return unmodifiable key set
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Set<String> acceptedKeys(String mode) {
    Set<String> keys = new LinkedHashSet<>(asFlatMap(mode).keySet());
    keys.add("in");
    if (mode.trim().toLowerCase(Locale.ROOT).equals("convert")) {
      keys.add("out");
    }
    return Set.copyOf(keys);
  }

  /**
   * Returns the defaults for {@code mode} merged over the common defaults.
   *
   * @param mode {@code inspect} or {@code convert}
   * @return unmodifiable defaults
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "inspect" -> Map.of("expect", "", "verify", "true");
      case "convert" -> Map.of(
          "expect", "",
          "audioDir", "",
          "outAudioDir", "",
          "pretty", "false",
          "allowOverwrite", "false");
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }
}
