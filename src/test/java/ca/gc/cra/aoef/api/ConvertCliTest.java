package ca.gc.cra.aoef.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
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

class ConvertCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ConvertCli.class);
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
  void convertsAndReportsWrittenCollection() throws IOException {
    Path in = tempDir.resolve("in.json");
    Path out = tempDir.resolve("nested/out.json");
    Aoef.save(AoefFixtures.predictionSet(), in);

    ExitCode code = ConvertCli.run(new String[] {"in=" + in, "out=" + out, "expect=prediction_set"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Wrote prediction_set " + AoefFixtures.predictionSet().uuid()));
    assertEquals(AoefFixtures.predictionSet(), Aoef.load(out, CollectionKind.PREDICTION_SET, null));
  }

  @Test
  void existingOutputRequiresAllowOverwrite() throws IOException {
    Path in = tempDir.resolve("in.json");
    Path out = Files.writeString(tempDir.resolve("out.json"), "{}");
    Aoef.save(AoefFixtures.recordingSet(), in);

    ExitCode refused = ConvertCli.run(new String[] {"in=" + in, "out=" + out});

    assertEquals(ExitCode.INVALID_ARGS, refused);
    assertTrue(buffer.toString().contains("usage: convert"));
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR
        && event.getFormattedMessage().contains("--allow-overwrite")));
    assertEquals("{}", Files.readString(out, StandardCharsets.UTF_8));

    ExitCode replaced = ConvertCli.run(new String[] {"in=" + in, "out=" + out, "--allow-overwrite"});

    assertEquals(ExitCode.SUCCESS, replaced);
    assertTrue(Files.readString(out, StandardCharsets.UTF_8).contains("\"recording_set\""));
  }

  @Test
  void yamlConfigSuppliesPrettyOutput() throws IOException {
    Path in = tempDir.resolve("in.json");
    Path out = tempDir.resolve("out.json");
    Aoef.save(AoefFixtures.evaluationSet(), in);
    Path yaml = Files.writeString(tempDir.resolve("aoef.yaml"), """
        convert:
          pretty: true
        """);

    ExitCode code = ConvertCli.run(new String[] {"in=" + in, "out=" + out, "config=" + yaml});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(Files.readString(out, StandardCharsets.UTF_8).contains("\n"));
  }

  @Test
  void kindMismatchReturnsInvalidDocument() throws IOException {
    Path in = tempDir.resolve("in.json");
    Path out = tempDir.resolve("out.json");
    Aoef.save(AoefFixtures.modelRun(), in);

    ExitCode code = ConvertCli.run(new String[] {"in=" + in, "out=" + out, "expect=prediction_set"});

    assertEquals(ExitCode.INVALID_DOCUMENT, code);
    assertFalse(Files.exists(out));
  }

  @Test
  void sameInputAndOutputIsRejected() throws IOException {
    Path in = tempDir.resolve("in.json");
    Aoef.save(AoefFixtures.recordingSet(), in);

    ExitCode code = ConvertCli.run(new String[] {"in=" + in, "out=" + in, "--allow-overwrite"});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void missingAudioDirectoryIsRejected() throws IOException {
    Path in = tempDir.resolve("in.json");
    Aoef.save(AoefFixtures.recordingSet(), in);

    ExitCode code = ConvertCli.run(new String[] {
        "in=" + in, "out=" + tempDir.resolve("out.json"), "audioDir=" + tempDir.resolve("missing")});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }
}
