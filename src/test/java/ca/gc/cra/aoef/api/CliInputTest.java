package ca.gc.cra.aoef.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromKeyValueArguments() {
    CliInput input = CliInput.parse(new String[] {"in=a.json", "-V", "--Allow-Overwrite", "--config=c.yaml"});

    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--allow-overwrite"));
    assertArrayEquals(new String[] {"in=a.json", "--config=c.yaml"}, input.keyValueArgs());
  }

  @Test
  void helpWordIsAFlag() {
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
  }
}
