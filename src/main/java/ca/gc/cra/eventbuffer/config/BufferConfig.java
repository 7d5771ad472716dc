package ca.gc.cra.eventbuffer.config;

import ca.gc.cra.eventbuffer.application.buffer.EventBufferOptions;
import ca.gc.cra.eventbuffer.application.buffer.InvalidCapacityException;
import ca.gc.cra.eventbuffer.validation.Strings;
import java.util.Locale;

/**
 * <strong>What:</strong> Immutable externally supplied settings for one event buffer.
 * <p><strong>Why:</strong> Lets operators choose the observed channel, retention limit, and metrics wiring without code
 * changes; transforms remain code-only and are applied through {@link EventBufferOptions.Builder}.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param channel channel identifier to observe
 * @param capacity positive retained-notification limit
 * @param metricPrefix prefix for buffer metrics
 * @param metrics metrics backend selection
 * @since 0.1.0
 */
public record BufferConfig(String channel, int capacity, String metricPrefix, MetricsMode metrics) {

  /**
   * Validates components.
   *
   * @throws InvalidCapacityException if {@code capacity} is not positive
   * @throws IllegalArgumentException if {@code channel} is blank
   */
  public BufferConfig {
    channel = Strings.requireNonBlank("channel", channel);
    if (capacity <= 0) {
      throw new InvalidCapacityException(capacity);
    }
    metricPrefix = Strings.orDefault(metricPrefix, EventBufferOptions.DEFAULT_METRIC_PREFIX);
    metrics = metrics == null ? MetricsMode.NONE : metrics;
  }

  /**
   * Default settings for {@code channel}: capacity {@value EventBufferOptions#DEFAULT_CAPACITY}, metrics disabled.
   *
   * @param channel channel identifier to observe
   * @return default configuration
   */
  public static BufferConfig defaults(String channel) {
    return new BufferConfig(
        channel, EventBufferOptions.DEFAULT_CAPACITY, EventBufferOptions.DEFAULT_METRIC_PREFIX, MetricsMode.NONE);
  }

  /**
   * Copies capacity and metric prefix onto {@code builder}.
   *
   * @param builder options builder, possibly already carrying a transform
   * @param <R> raw notification type
   * @param <S> stored type
   * @return the same builder
   */
  public <R, S> EventBufferOptions.Builder<R, S> applyTo(EventBufferOptions.Builder<R, S> builder) {
    return builder.capacity(capacity).metricPrefix(metricPrefix);
  }

  /**
   * Metrics backend for buffers built from configuration.
   */
  public enum MetricsMode {
    /** Discard metrics. */
    NONE,
    /** Forward metrics to OpenTelemetry. */
    OTEL;

    /**
     * Parses a configuration value; blank means {@link #NONE}.
     *
     * @param raw value such as {@code none} or {@code otel}
     * @return parsed mode
     * @throws IllegalArgumentException for unknown values
     */
    public static MetricsMode parse(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none", "off", "false" -> NONE;
        case "otel", "opentelemetry", "otlp" -> OTEL;
        default -> throw new IllegalArgumentException("metrics must be one of none|otel (was " + raw + ")");
      };
    }
  }
}
