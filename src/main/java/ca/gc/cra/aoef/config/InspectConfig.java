package ca.gc.cra.aoef.config;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import ca.gc.cra.aoef.validation.Paths;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for {@code aoef inspect}.
 *
 * @param input AOEF file to inspect
 * @param expected collection type the file must have, if any
 * @param verify whether to rebuild the collection so that every reference is checked
 * @since 0.1.0
 */
public record InspectConfig(Path input, Optional<CollectionKind> expected, boolean verify) {

  public InspectConfig {
    Objects.requireNonNull(input, "input");
    expected = expected == null ? Optional.empty() : expected;
  }

  /**
   * Binds merged settings.
   *
   * @param options merged settings
   * @return inspect configuration
   * @throws IllegalArgumentException if {@code in} is missing or a value is invalid
   */
  public static InspectConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String in = ConfigValues.required(options, "in");
    return new InspectConfig(
        Paths.parse("in", in),
        ConfigValues.kind(options.get("expect")),
        ConfigValues.bool(options.get("verify"), true));
  }
}
