package ca.gc.cra.eventbuffer.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.eventbuffer.application.buffer.EventBuffer;
import ca.gc.cra.eventbuffer.application.buffer.EventBufferOptions;
import ca.gc.cra.eventbuffer.infrastructure.source.InMemoryNotificationSource;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY_ATTRIBUTE = AttributeKey.stringKey("eventbuffer.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("orders.accepted");
    adapter.increment("orders.accepted");
    adapter.increment("orders.accepted");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "orders.accepted").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("orders.accepted", point.getAttributes().get(KEY_ATTRIBUTE));
    assertEquals("event-buffer", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  @Test
  void observeRecordsHistogramUnderSanitizedName() {
    adapter.observe("eventBuffer.size", 1L);
    adapter.observe("eventBuffer.size", 2L);
    adapter.observe("eventBuffer.size", 3L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "eventbuffer.size").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(3L, point.getCount());
    assertEquals(6.0, point.getSum());
    assertEquals("eventBuffer.size", point.getAttributes().get(KEY_ATTRIBUTE));
  }

  @Test
  void bufferMetricsFlowThroughAdapter() {
    InMemoryNotificationSource<String> source = InMemoryNotificationSource.of("src", "ticks");
    EventBuffer<String, String> buffer = new EventBuffer<>(source, "ticks",
        EventBufferOptions.<String>builder().capacity(1).metrics(adapter).build());

    source.publish("ticks", "a");
    source.publish("ticks", "b");

    Collection<MetricData> metrics = reader.collectAllMetrics();
    assertEquals(2L, find(metrics, "eventbuffer.accepted").orElseThrow()
        .getLongSumData().getPoints().iterator().next().getValue());
    assertEquals(1L, find(metrics, "eventbuffer.evicted").orElseThrow()
        .getLongSumData().getPoints().iterator().next().getValue());
    assertEquals(1, buffer.count());
  }

  @Test
  void sanitizeNameNormalizesUnsupportedCharacters() {
    assertEquals("eventbuffer.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
    assertEquals("m1st.metric", OpenTelemetryMetricsAdapter.sanitizeName("1st.metric"));
    assertEquals("orders_dropped", OpenTelemetryMetricsAdapter.sanitizeName("Orders dropped"));
  }

  @Test
  void adapterReportsActiveMode() {
    assertFalse(adapter.isNoop());
  }

  @Test
  void disabledExporterYieldsNoopAdapterThatStillAcceptsBufferMetrics() {
    String previous = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");
    try (OpenTelemetryMetricsAdapter disabled = new OpenTelemetryMetricsAdapter()) {
      InMemoryNotificationSource<String> source = InMemoryNotificationSource.of("src", "ticks");
      EventBuffer<String, String> buffer = new EventBuffer<>(source, "ticks",
          EventBufferOptions.<String>builder().metrics(disabled).build());

      source.publish("ticks", "a");

      assertTrue(disabled.isNoop());
      assertEquals(1, buffer.count());
    } finally {
      if (previous == null) {
        System.clearProperty("otel.metrics.exporter");
      } else {
        System.setProperty("otel.metrics.exporter", previous);
      }
    }
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
