package ca.gc.cra.aoef.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void parseNormalizesToAbsolutePath() {
    Path parsed = Paths.parse("in", "  data/../collection.json ");

    assertTrue(parsed.isAbsolute());
    assertEquals(Path.of("collection.json").toAbsolutePath().normalize(), parsed);
  }

  @Test
  void parseRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Paths.parse("in", "bad\0.json"));
  }

  @Test
  void readableJsonRequiresExistingFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("doc.json"), "{}");

    assertEquals(file, Paths.validateReadableJson("in", file));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateReadableJson("in", tempDir.resolve("absent.json")));
    assertTrue(ex.getMessage().startsWith("in file does not exist"));
  }

  @Test
  void readableJsonRequiresJsonSuffix() throws IOException {
    Path file = Files.writeString(tempDir.resolve("doc.yaml"), "{}");

    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableJson("in", file));
  }

  @Test
  void writableJsonRefusesExistingFileUnlessOverwriteAllowed() throws IOException {
    Path file = Files.writeString(tempDir.resolve("out.json"), "{}");

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableJson("out", file, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
    assertEquals(file, Paths.validateWritableJson("out", file, true));
  }

  @Test
  void writableJsonRejectsDirectory() throws IOException {
    Path dir = Files.createDirectories(tempDir.resolve("dir.json"));

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableJson("out", dir, true));
  }

  @Test
  void directoryMustExist() {
    assertEquals(tempDir, Paths.validateDirectory("audioDir", tempDir));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateDirectory("audioDir", tempDir.resolve("missing")));
  }
}
