package ca.gc.cra.eventbuffer.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesPassThrough() {
    assertEquals("order #7", Logs.truncate("order #7", 64));
  }

  @Test
  void longValuesAreCutWithLengthSuffix() {
    assertEquals("abc... (truncated, 3 of 6 bytes)", Logs.truncate("abcdef", 3));
  }

  @Test
  void cutInsideMultiByteCharacterDropsPartialCodepoint() {
    assertEquals("é... (truncated, 3 of 6 bytes)", Logs.truncate("ééé", 3));
  }

  @Test
  void nullRendersPlaceholder() {
    assertEquals("<null>", Logs.truncate(null, 8));
  }

  @Test
  void nonPositiveLimitIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
