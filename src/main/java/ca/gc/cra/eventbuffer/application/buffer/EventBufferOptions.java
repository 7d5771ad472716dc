package ca.gc.cra.eventbuffer.application.buffer;

import ca.gc.cra.eventbuffer.application.port.MetricsPort;
import ca.gc.cra.eventbuffer.application.port.TransformErrorListener;
import java.util.Objects;
import java.util.function.Function;

/**
 * <strong>What:</strong> Immutable construction parameters for an {@link EventBuffer}.
 * <p><strong>Why:</strong> Groups capacity, the optional transform, and the error/metrics collaborators so invalid
 * settings are rejected before any subscription is made.</p>
 * <p><strong>Thread-safety:</strong> Instances are immutable; builders are not thread-safe.</p>
 *
 * @param <R> raw notification type delivered by the source
 * @param <S> stored type retained by the buffer; equals {@code R} when no transform is configured
 * @since 0.1.0
 */
public final class EventBufferOptions<R, S> {
  /** Default retained-notification limit. */
  public static final int DEFAULT_CAPACITY = 1_000_000;
  /** Default prefix for buffer metrics. */
  public static final String DEFAULT_METRIC_PREFIX = "eventBuffer";

  private final int capacity;
  private final Function<? super R, ? extends S> transform;
  private final boolean transformed;
  private final String transformLabel;
  private final TransformErrorListener errorListener;
  private final MetricsPort metrics;
  private final String metricPrefix;

  private EventBufferOptions(Builder<R, S> builder) {
    this.capacity = builder.capacity;
    this.transform = builder.transform;
    this.transformed = builder.transformed;
    this.transformLabel = builder.transformLabel;
    this.errorListener = builder.errorListener;
    this.metrics = builder.metrics;
    this.metricPrefix = builder.metricPrefix;
  }

  /**
   * Starts a builder without a transform; notifications are retained as delivered.
   *
   * @param <R> raw notification type
   * @return builder seeded with defaults
   */
  public static <R> Builder<R, R> builder() {
    return new Builder<R, R>(Function.<R>identity());
  }

  /**
   * Options with every default applied.
   *
   * @param <R> raw notification type
   * @return default options
   */
  public static <R> EventBufferOptions<R, R> defaults() {
    return EventBufferOptions.<R>builder().build();
  }

  public int capacity() {
    return capacity;
  }

  /**
   * @return transform applied to accepted notifications; the identity when values are stored as delivered
   */
  public Function<? super R, ? extends S> transform() {
    return transform;
  }

  public boolean hasTransform() {
    return transformed;
  }

  /**
   * @return description of the transform for status output, or {@code null} without a transform
   */
  public String transformLabel() {
    return transformLabel;
  }

  public TransformErrorListener errorListener() {
    return errorListener;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public String metricPrefix() {
    return metricPrefix;
  }

  /**
   * Fluent builder. {@link #transform(Function)} changes the stored type parameter.
   *
   * @param <R> raw notification type
   * @param <S> stored type
   */
  public static final class Builder<R, S> {
    private int capacity = DEFAULT_CAPACITY;
    private final Function<? super R, ? extends S> transform;
    private final boolean transformed;
    private final String transformLabel;
    private TransformErrorListener errorListener = TransformErrorListener.NO_OP;
    private MetricsPort metrics = MetricsPort.NO_OP;
    private String metricPrefix = DEFAULT_METRIC_PREFIX;

    private Builder(Function<? super R, ? extends S> identity) {
      this.transform = identity;
      this.transformed = false;
      this.transformLabel = null;
    }

    private Builder(Builder<R, ?> other, Function<? super R, ? extends S> transform, String label) {
      this.capacity = other.capacity;
      this.errorListener = other.errorListener;
      this.metrics = other.metrics;
      this.metricPrefix = other.metricPrefix;
      this.transform = transform;
      this.transformed = true;
      this.transformLabel = label;
    }

    /**
     * Sets the maximum number of retained notifications. Validated by {@link #build()}.
     *
     * @param capacity positive limit
     * @return this builder
     */
    public Builder<R, S> capacity(int capacity) {
      this.capacity = capacity;
      return this;
    }

    /**
     * Applies {@code transform} to every accepted notification before it is stored.
     *
     * @param transform function mapping raw notifications to stored values; must not be {@code null}
     * @param <T> new stored type
     * @return builder for the transformed stored type
     */
    public <T> Builder<R, T> transform(Function<? super R, ? extends T> transform) {
      Objects.requireNonNull(transform, "transform");
      return new Builder<>(this, transform, String.valueOf(transform));
    }

    /**
     * Applies {@code transform} and describes it with {@code label} in status output.
     *
     * @param label description such as {@code "message text"}
     * @param transform function mapping raw notifications to stored values; must not be {@code null}
     * @param <T> new stored type
     * @return builder for the transformed stored type
     */
    public <T> Builder<R, T> transform(String label, Function<? super R, ? extends T> transform) {
      Objects.requireNonNull(transform, "transform");
      String effective = label == null || label.isBlank() ? String.valueOf(transform) : label.trim();
      return new Builder<>(this, transform, effective);
    }

    /**
     * @param errorListener receives transform failures; {@code null} restores {@link TransformErrorListener#NO_OP}
     * @return this builder
     */
    public Builder<R, S> errorListener(TransformErrorListener errorListener) {
      this.errorListener = errorListener == null ? TransformErrorListener.NO_OP : errorListener;
      return this;
    }

    /**
     * @param metrics metrics adapter; {@code null} restores {@link MetricsPort#NO_OP}
     * @return this builder
     */
    public Builder<R, S> metrics(MetricsPort metrics) {
      this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
      return this;
    }

    /**
     * @param metricPrefix prefix for emitted metrics; blank restores {@value #DEFAULT_METRIC_PREFIX}
     * @return this builder
     */
    public Builder<R, S> metricPrefix(String metricPrefix) {
      this.metricPrefix =
          metricPrefix == null || metricPrefix.isBlank() ? DEFAULT_METRIC_PREFIX : metricPrefix.trim();
      return this;
    }

    /**
     * Validates and freezes the options.
     *
     * @return immutable options
     * @throws InvalidCapacityException if the capacity is not positive
     */
    public EventBufferOptions<R, S> build() {
      if (capacity <= 0) {
        throw new InvalidCapacityException(capacity);
      }
      return new EventBufferOptions<>(this);
    }
  }
}
