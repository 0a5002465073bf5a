package ca.gc.cra.lazypull.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("name", "  value  "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\u0000b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void trimToNullCollapsesBlankValues() {
    assertNull(Strings.trimToNull(null));
    assertNull(Strings.trimToNull("  "));
    assertEquals("x", Strings.trimToNull(" x "));
  }
}
