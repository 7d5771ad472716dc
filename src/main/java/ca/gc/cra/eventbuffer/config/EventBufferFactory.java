package ca.gc.cra.eventbuffer.config;

import ca.gc.cra.eventbuffer.application.buffer.EventBuffer;
import ca.gc.cra.eventbuffer.application.buffer.EventBufferOptions;
import ca.gc.cra.eventbuffer.application.port.MetricsPort;
import ca.gc.cra.eventbuffer.application.port.NotificationSource;
import ca.gc.cra.eventbuffer.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.eventbuffer.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root that wires configured buffers to a shared metrics adapter.
 * <p><strong>Role:</strong> Bootstrap helper; owns the metrics adapter it creates and closes it on {@link #close()}.
 * Buffers it creates are owned by the caller.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use once constructed.</p>
 *
 * @since 0.1.0
 */
public final class EventBufferFactory implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(EventBufferFactory.class);

  private final MetricsPort metrics;
  private final AutoCloseable ownedMetrics;

  /**
   * Creates a factory that reports through {@code metrics}; the caller keeps ownership of the adapter.
   *
   * @param metrics metrics adapter shared by all buffers
   */
  public EventBufferFactory(MetricsPort metrics) {
    this(Objects.requireNonNull(metrics, "metrics"), null);
  }

  private EventBufferFactory(MetricsPort metrics, AutoCloseable ownedMetrics) {
    this.metrics = metrics;
    this.ownedMetrics = ownedMetrics;
  }

  /**
   * Creates a factory whose metrics backend follows {@code mode}.
   *
   * @param mode metrics selection from configuration
   * @return factory owning the created adapter
   */
  public static EventBufferFactory forMode(BufferConfig.MetricsMode mode) {
    if (mode == BufferConfig.MetricsMode.OTEL) {
      OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter();
      return new EventBufferFactory(adapter, adapter);
    }
    return new EventBufferFactory(new NoOpMetricsAdapter(), null);
  }

  /**
   * Attaches a buffer without a transform.
   *
   * @param source observable to watch
   * @param config buffer settings
   * @param <R> notification type
   * @return running buffer
   */
  public <R> EventBuffer<R, R> attach(NotificationSource<? extends R> source, BufferConfig config) {
    return attach(source, config, EventBufferOptions.<R>builder());
  }

  /**
   * Attaches a buffer using {@code builder} for code-only settings (transform, error listener); configuration
   * supplies capacity and metric prefix, and the factory supplies metrics.
   *
   * @param source observable to watch
   * @param config buffer settings
   * @param builder options builder carrying code-only settings
   * @param <R> raw notification type
   * @param <S> stored type
   * @return running buffer
   */
  public <R, S> EventBuffer<R, S> attach(
      NotificationSource<? extends R> source, BufferConfig config, EventBufferOptions.Builder<R, S> builder) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(builder, "builder");
    EventBufferOptions<R, S> options = config.applyTo(builder).metrics(metrics).build();
    return new EventBuffer<>(source, config.channel(), options);
  }

  MetricsPort metrics() {
    return metrics;
  }

  @Override
  public void close() {
    if (ownedMetrics == null) {
      return;
    }
    try {
      ownedMetrics.close();
    } catch (Exception ex) {
      log.warn("Failed to close metrics adapter", ex);
    }
  }
}
