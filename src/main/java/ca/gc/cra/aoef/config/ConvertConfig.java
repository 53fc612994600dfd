package ca.gc.cra.aoef.config;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import ca.gc.cra.aoef.validation.Paths;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Settings for {@code aoef convert}, which loads one AOEF file and saves it again.
 * <p><strong>Audio directories:</strong> {@code audioDir} resolves recording paths on load; {@code outAudioDir}
 * (default: {@code audioDir}) relativizes them on save. Setting only {@code outAudioDir} turns absolute recording
 * paths into paths relative to that directory.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param input source AOEF file
 * @param output destination AOEF file
 * @param expected collection type the source must have, if any
 * @param audioDir base directory for recording paths in the source
 * @param outAudioDir base directory for recording paths in the output
 * @param pretty whether to indent the output
 * @param allowOverwrite whether an existing output file may be replaced
 * @since 0.1.0
 */
public record ConvertConfig(
    Path input,
    Path output,
    Optional<CollectionKind> expected,
    Optional<Path> audioDir,
    Optional<Path> outAudioDir,
    boolean pretty,
    boolean allowOverwrite) {

  public ConvertConfig {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(output, "output");
    expected = expected == null ? Optional.empty() : expected;
    audioDir = audioDir == null ? Optional.empty() : audioDir;
    outAudioDir = outAudioDir == null || outAudioDir.isEmpty() ? audioDir : outAudioDir;
  }

  /**
   * Binds merged settings.
   *
   * @param options merged settings
   * @return convert configuration
   * @throws IllegalArgumentException if {@code in} or {@code out} is missing or a value is invalid
   */
  public static ConvertConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new ConvertConfig(
        Paths.parse("in", ConfigValues.required(options, "in")),
        Paths.parse("out", ConfigValues.required(options, "out")),
        ConfigValues.kind(options.get("expect")),
        ConfigValues.path("audioDir", options.get("audioDir")),
        ConfigValues.path("outAudioDir", options.get("outAudioDir")),
        ConfigValues.bool(options.get("pretty"), false),
        ConfigValues.bool(options.get("allowOverwrite"), false));
  }
}
