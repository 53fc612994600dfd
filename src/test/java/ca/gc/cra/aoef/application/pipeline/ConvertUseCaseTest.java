package ca.gc.cra.aoef.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import ca.gc.cra.aoef.application.exchange.record.AoefDocument;
import ca.gc.cra.aoef.application.port.ClockPort;
import ca.gc.cra.aoef.application.port.MetricsPort;
import ca.gc.cra.aoef.config.CompositionRoot;
import ca.gc.cra.aoef.config.ConvertConfig;
import ca.gc.cra.aoef.domain.collection.DataCollection;
import ca.gc.cra.aoef.domain.collection.RecordingSet;
import ca.gc.cra.aoef.testutil.AoefFixtures;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConvertUseCaseTest {
  @TempDir Path tempDir;

  private CompositionRoot root;

  @BeforeEach
  void setUp() {
    root = new CompositionRoot(MetricsPort.NO_OP, ClockPort.SYSTEM);
  }

  @Test
  void rewritesDocumentPreservingTheCollection() throws IOException {
    Path in = tempDir.resolve("in.json");
    Path out = tempDir.resolve("out/pretty.json");
    root.collectionStore(null, false).save(AoefFixtures.evaluation(), in);
    ConvertConfig config = new ConvertConfig(in, out, Optional.of(CollectionKind.EVALUATION),
        Optional.empty(), Optional.empty(), true, false);

    AoefDocument written = root.convertUseCase(config).convert(config);

    assertEquals(CollectionKind.EVALUATION, written.data().kind());
    DataCollection reloaded = root.collectionStore(null, false).load(out, null);
    assertEquals(AoefFixtures.evaluation(), reloaded);
    assertTrue(Files.readString(out, StandardCharsets.UTF_8).contains("\n"));
  }

  @Test
  void relativizesAbsoluteRecordingPathsAgainstOutputAudioDirectory() throws IOException {
    Path in = tempDir.resolve("in.json");
    Path out = tempDir.resolve("out.json");
    Path audio = AoefFixtures.AUDIO_DIR;
    root.collectionStore(null, false).save(AoefFixtures.recordingSet(), in);
    assertTrue(Files.readString(in, StandardCharsets.UTF_8).contains(audio.resolve("site1/a.wav").toString()));
    ConvertConfig config = new ConvertConfig(in, out, Optional.empty(),
        Optional.empty(), Optional.of(audio), false, false);

    root.convertUseCase(config).convert(config);

    String json = Files.readString(out, StandardCharsets.UTF_8);
    assertTrue(json.contains("\"path\":\"site1/a.wav\""), json);
    Path mirror = tempDir.resolve("mirror");
    RecordingSet rebased = (RecordingSet) root.collectionStore(mirror, false).load(out, null);
    assertEquals(mirror.resolve("site1/a.wav"), rebased.recordings().get(0).path());
  }
}
