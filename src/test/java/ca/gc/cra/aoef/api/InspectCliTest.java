package ca.gc.cra.aoef.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.aoef.testutil.AoefFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class InspectCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(InspectCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
      appender.stop();
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void printsEnvelopeAndTableCounts() throws IOException {
    Path file = tempDir.resolve("dataset.json");
    Aoef.save(AoefFixtures.dataset(), file);

    ExitCode code = InspectCli.run(new String[] {"in=" + file});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains(" Version     : 1.1.0"), output);
    assertTrue(output.contains(" Type        : dataset"), output);
    assertTrue(output.contains(" Verified    : yes"), output);
    assertTrue(output.contains(String.format("   %-24s %d", "recordings", 2)), output);
  }

  @Test
  void missingInputReturnsUsageAndInvalidArgs() {
    ExitCode code = InspectCli.run(new String[0]);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: inspect"));
    assertTrue(logged(Level.ERROR, "in is required"));
  }

  @Test
  void absentFileIsAnArgumentError() {
    ExitCode code = InspectCli.run(new String[] {"in=" + tempDir.resolve("absent.json")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(logged(Level.ERROR, "in file does not exist"));
  }

  @Test
  void danglingReferenceReturnsInvalidDocument() throws IOException {
    Path file = tempDir.resolve("annotations.json");
    Aoef.save(AoefFixtures.annotationSet(), file);
    String recording = AoefFixtures.RECORDING_A.uuid().toString();
    String ghost = AoefFixtures.uuid(404).toString();
    String json = Files.readString(file, StandardCharsets.UTF_8);
    Files.writeString(file, json.replace("\"recording\":\"" + recording + "\"", "\"recording\":\"" + ghost + "\""),
        StandardCharsets.UTF_8);

    ExitCode code = InspectCli.run(new String[] {"in=" + file});

    assertEquals(ExitCode.INVALID_DOCUMENT, code);
    assertTrue(logged(Level.ERROR, "dangling recording reference " + ghost));
  }

  @Test
  void versionMismatchReturnsInvalidDocument() throws IOException {
    Path file = tempDir.resolve("old.json");
    Aoef.save(AoefFixtures.recordingSet(), file);
    String json = Files.readString(file, StandardCharsets.UTF_8);
    Files.writeString(file, json.replace("\"1.1.0\"", "\"0.0.1\""), StandardCharsets.UTF_8);

    ExitCode code = InspectCli.run(new String[] {"in=" + file, "verify=false"});

    assertEquals(ExitCode.INVALID_DOCUMENT, code);
    assertTrue(logged(Level.ERROR, "0.0.1"));
  }

  @Test
  void missingConfigFileReturnsConfigError() throws IOException {
    Path file = tempDir.resolve("set.json");
    Aoef.save(AoefFixtures.recordingSet(), file);

    ExitCode code = InspectCli.run(new String[] {"in=" + file, "config=" + tempDir.resolve("none.yaml")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void helpPrintsDetailedUsage() {
    ExitCode code = InspectCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("AOEF inspect"));
  }

  private boolean logged(Level level, String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == level && event.getFormattedMessage().contains(fragment));
  }
}
