package ca.gc.cra.aoef.config;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import ca.gc.cra.aoef.error.UnsupportedTypeException;
import ca.gc.cra.aoef.validation.Paths;
import ca.gc.cra.aoef.validation.Strings;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Typed accessors over flattened settings maps. */
final class ConfigValues {
  private ConfigValues() {}

  static String required(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return Strings.requireNonBlank(key, value);
  }

  static Optional<Path> path(String key, String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(Paths.parse(key, raw));
  }

  static Optional<CollectionKind> kind(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(CollectionKind.fromTag(raw.trim().toLowerCase(Locale.ROOT)));
    } catch (UnsupportedTypeException ex) {
      throw new IllegalArgumentException("expect must name a collection type: " + ex.getMessage(), ex);
    }
  }

  static boolean bool(String raw, boolean defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException("expected true or false but was '" + raw + "'");
    };
  }
}
