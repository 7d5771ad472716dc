package ca.gc.cra.eventbuffer.application.buffer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.eventbuffer.application.port.MetricsPort;
import ca.gc.cra.eventbuffer.application.port.TransformErrorListener;
import ca.gc.cra.eventbuffer.infrastructure.source.InMemoryNotificationSource;
import org.junit.jupiter.api.Test;

class EventBufferOptionsTest {

  @Test
  void defaultsMatchDocumentedValues() {
    EventBufferOptions<String, String> options = EventBufferOptions.defaults();

    assertEquals(1_000_000, options.capacity());
    assertFalse(options.hasTransform());
    assertNull(options.transformLabel());
    assertSame(TransformErrorListener.NO_OP, options.errorListener());
    assertSame(MetricsPort.NO_OP, options.metrics());
    assertEquals("eventBuffer", options.metricPrefix());
  }

  @Test
  void nonPositiveCapacityIsRejected() {
    InvalidCapacityException zero = assertThrows(InvalidCapacityException.class,
        () -> EventBufferOptions.<String>builder().capacity(0).build());
    assertEquals(0L, zero.capacity());
    assertThrows(InvalidCapacityException.class,
        () -> EventBufferOptions.<String>builder().capacity(-5).build());
  }

  @Test
  void invalidCapacityPreventsSubscription() {
    InMemoryNotificationSource<String> source = InMemoryNotificationSource.of("src", "ticks");

    assertThrows(InvalidCapacityException.class, () -> new EventBuffer<>(source, "ticks",
        EventBufferOptions.<String>builder().capacity(0).build()));

    assertEquals(0, source.subscriberCount("ticks"));
  }

  @Test
  void transformKeepsEarlierSettings() {
    MetricsPort metrics = MetricsPort.NO_OP;
    EventBufferOptions<String, Integer> options = EventBufferOptions.<String>builder()
        .capacity(7)
        .metricPrefix("lengths")
        .metrics(metrics)
        .transform("length", String::length)
        .build();

    assertEquals(7, options.capacity());
    assertEquals("lengths", options.metricPrefix());
    assertTrue(options.hasTransform());
    assertEquals("length", options.transformLabel());
    assertEquals(5, options.transform().apply("hello"));
  }

  @Test
  void nullCollaboratorsFallBackToNoOps() {
    EventBufferOptions<String, String> options = EventBufferOptions.<String>builder()
        .errorListener(null)
        .metrics(null)
        .metricPrefix(" ")
        .build();

    assertSame(TransformErrorListener.NO_OP, options.errorListener());
    assertSame(MetricsPort.NO_OP, options.metrics());
    assertEquals("eventBuffer", options.metricPrefix());
  }

  @Test
  void nullTransformIsRejected() {
    assertThrows(NullPointerException.class, () -> EventBufferOptions.<String>builder().transform(null));
  }
}
