package ca.gc.cra.harvest.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void sanitizeIdentifierAllowsSectionNames() {
    assertEquals("db-primary_1.eu", Strings.sanitizeIdentifier("sectionName", " db-primary_1.eu "));
  }

  @Test
  void sanitizeIdentifierRejectsSpaces() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Strings.sanitizeIdentifier("sectionName", "db primary"));
    assertEquals("sectionName must only contain letters, digits, dot, underscore, or hyphen", ex.getMessage());
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("apiKey", "k☃y", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("apiKey", "abc", 2));
  }
}
