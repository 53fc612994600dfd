package ca.gc.cra.aoef.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("field", "  value  "));
  }

  @Test
  void requireNonBlankRejectsBlankAndNull() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("field", "   "));
    assertEquals("field must not be blank", ex.getMessage());
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("field", null));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("attr", "équipe=son", 64));
  }

  @Test
  void requirePrintableAsciiEnforcesLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attr", "abcdef", 5));
    assertEquals("abcde", Strings.requirePrintableAscii("attr", "abcde", 5));
  }

  @Test
  void containsControlDetectsTabsAndNewlines() {
    assertTrue(Strings.containsControl("a\tb"));
    assertFalse(Strings.containsControl("plain"));
  }
}
