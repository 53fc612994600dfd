package ca.gc.cra.aoef.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"in=a.json", "out = b.json ", "--config=x.yaml"});
    assertEquals("a.json", map.get("in"));
    assertEquals("b.json", map.get("out"));
    assertEquals("x.yaml", map.get("--config"));
  }

  @Test
  void valueMayContainEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=team=acoustics"});
    assertEquals("team=acoustics", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsBareWordsAndEmptyValues() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"in="}));
  }

  @Test
  void rejectsKeysWithSpacesInside() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"bad key=value"}));
    assertTrue(ex.getMessage().contains("bad key"));
  }
}
