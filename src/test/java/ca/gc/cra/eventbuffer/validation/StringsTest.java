package ca.gc.cra.eventbuffer.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("orders", Strings.requireNonBlank("channel", "  orders  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("channel", "orders\n"));
  }

  @Test
  void requireNonBlankRejectsBlankAndNull() {
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("channel", "   "));
    assertEquals("channel must not be blank", blank.getMessage());
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("channel", null));
  }

  @Test
  void orDefaultFallsBackOnlyWhenAbsent() {
    assertEquals("eventBuffer", Strings.orDefault(null, "eventBuffer"));
    assertEquals("eventBuffer", Strings.orDefault("  ", "eventBuffer"));
    assertEquals("orders", Strings.orDefault(" orders ", "eventBuffer"));
  }
}
