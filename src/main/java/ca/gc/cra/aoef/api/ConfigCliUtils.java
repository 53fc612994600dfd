package ca.gc.cra.aoef.api;

import ca.gc.cra.aoef.config.ConfigMerger;
import ca.gc.cra.aoef.config.DefaultsForMode;
import ca.gc.cra.aoef.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared steps for turning CLI arguments plus an optional YAML file into effective settings.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Merges defaults, the YAML named by {@code config=}, and CLI pairs for {@code mode}.
   *
   * @throws ConfigFileException if the YAML file is missing or malformed
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if the merged settings are inconsistent
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cliArgs, Logger log)
      throws IOException {
    Map<String, String> kv = new LinkedHashMap<>(cliArgs);
    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new ConfigFileException("Configuration file does not exist: " + yamlPath, null);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        throw new ConfigFileException("Invalid YAML configuration: " + ex.getMessage(), ex);
      }
      log.debug("Loaded {} settings from {}", mode, yamlPath);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
  }

  /** Raised when the YAML configuration file cannot be used. */
  static final class ConfigFileException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    ConfigFileException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
