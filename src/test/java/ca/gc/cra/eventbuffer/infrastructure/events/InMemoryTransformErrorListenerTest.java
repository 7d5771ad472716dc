package ca.gc.cra.eventbuffer.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.eventbuffer.application.buffer.TransformException;
import org.junit.jupiter.api.Test;

class InMemoryTransformErrorListenerTest {

  @Test
  void snapshotIsImmutableAndClearable() {
    InMemoryTransformErrorListener listener = new InMemoryTransformErrorListener();
    TransformException error = new TransformException("orders", 3L, "raw", "bad payload", null);

    listener.onTransformError(error);

    assertEquals(1, listener.snapshot().size());
    assertEquals(3L, listener.snapshot().get(0).sequence());
    assertThrows(UnsupportedOperationException.class, () -> listener.snapshot().clear());

    listener.clear();
    assertTrue(listener.snapshot().isEmpty());
  }

  @Test
  void rejectsNullErrors() {
    InMemoryTransformErrorListener listener = new InMemoryTransformErrorListener();

    assertThrows(NullPointerException.class, () -> listener.onTransformError(null));
  }
}
