package ca.gc.cra.aoef.validation;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Locale;

/**
 * <strong>What:</strong> File-system checks for AOEF input files, output files and audio directories.
 * <p><strong>Role:</strong> Runs in the CLI before the file store opens anything, so bad paths surface as argument
 * errors instead of I/O failures.</p>
 * <p><strong>Thread-safety:</strong> Stateless; file-system state may change between a check and the later open.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private static final String JSON_SUFFIX = ".json";

  private Paths() {}

  /**
   * Parses a raw CLI value into a normalized absolute path.
   *
   * @param name parameter name used in messages
   * @param raw raw path text
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the value is blank, contains control characters or is not a valid path
   */
  public static Path parse(String name, String raw) {
    String value = Strings.requireNonBlank(name, raw);
    try {
      return Path.of(value).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  /**
   * Validates an existing, readable {@code .json} file.
   *
   * @param name parameter name used in messages
   * @param path candidate file
   * @return the same path
   * @throws IllegalArgumentException if the suffix is wrong or the file is missing or unreadable
   */
  public static Path validateReadableJson(String name, Path path) {
    requireJsonSuffix(name, path);
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException(name + " file does not exist: " + path);
    }
    if (!Files.isReadable(path)) {
      throw new IllegalArgumentException(name + " file is not readable: " + path);
    }
    return path;
  }

  /**
   * Validates a {@code .json} output location.
   *
   * @param name parameter name used in messages
   * @param path candidate file; parent directories are created later by the store
   * @param allowOverwrite whether an existing file may be replaced
   * @return the same path
   * @throws IllegalArgumentException if the suffix is wrong, the path is a directory, or the file exists and
   *     overwriting is not allowed
   */
  public static Path validateWritableJson(String name, Path path, boolean allowOverwrite) {
    requireJsonSuffix(name, path);
    if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException(name + " must be a file, not a directory: " + path);
    }
    if (Files.exists(path, LinkOption.NOFOLLOW_LINKS) && !allowOverwrite) {
      throw new IllegalArgumentException(name + " already exists (pass --allow-overwrite to replace): " + path);
    }
    return path;
  }

  /**
   * Validates an existing directory.
   *
   * @param name parameter name used in messages
   * @param path candidate directory
   * @return the same path
   * @throws IllegalArgumentException if {@code path} is not a directory
   */
  public static Path validateDirectory(String name, Path path) {
    if (!Files.isDirectory(path)) {
      throw new IllegalArgumentException(name + " must be an existing directory: " + path);
    }
    return path;
  }

  private static void requireJsonSuffix(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    Path fileName = path.getFileName();
    if (fileName == null || !fileName.toString().toLowerCase(Locale.ROOT).endsWith(JSON_SUFFIX)) {
      throw new IllegalArgumentException(name + " must end in " + JSON_SUFFIX + ": " + path);
    }
  }
}
