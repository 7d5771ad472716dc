package ca.gc.cra.eventbuffer.application.buffer;

import ca.gc.cra.eventbuffer.application.port.MetricsPort;
import ca.gc.cra.eventbuffer.application.port.NotificationSource;
import ca.gc.cra.eventbuffer.application.port.SubscriptionHandle;
import ca.gc.cra.eventbuffer.application.port.TransformErrorListener;
import ca.gc.cra.eventbuffer.logging.Logs;
import ca.gc.cra.eventbuffer.validation.Strings;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Captures notifications from one channel of a {@link NotificationSource} and retains the most
 * recent {@code capacity} of them, oldest first.
 * <p><strong>Why:</strong> Lets callers inspect, pop, or clear recent notification history and pause capture without
 * tearing down the subscription.</p>
 * <p><strong>Role:</strong> Application component; the source, the payload, and any formatting stay outside.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own exactly one subscription, registered on construction and released once by {@link #close()}.</li>
 *   <li>Gate incoming notifications on the running flag; stopped buffers discard silently.</li>
 *   <li>Apply the optional transform and report its failures without disturbing delivery.</li>
 *   <li>Evict the oldest element whenever an append exceeds the capacity.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All store and state access is serialized on a per-instance lock, so sources may
 * deliver from several threads. The lock is never held while calling the subscription handle or the error
 * listener.</p>
 * <p><strong>Performance:</strong> Appends, eviction, {@link #last()}, and {@link #pop()} are O(1);
 * {@link #all()} copies the store and is O(count).</p>
 * <p><strong>Observability:</strong> Emits {@code <prefix>.accepted}, {@code <prefix>.evicted},
 * {@code <prefix>.discarded.paused}, {@code <prefix>.discarded.closed}, {@code <prefix>.transform.failed},
 * {@code <prefix>.rejected.null} counters and a {@code <prefix>.size} observation.</p>
 *
 * @param <R> raw notification type delivered by the source
 * @param <S> stored type; equals {@code R} without a transform
 * @since 0.1.0
 */
public final class EventBuffer<R, S> implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(EventBuffer.class);
  private static final int LOG_PAYLOAD_BYTES = 256;
  private static final int INITIAL_STORE_SIZE = 16;

  private final String channelId;
  private final String sourceDescription;
  private final int capacity;
  private final Function<? super R, ? extends S> transform;
  private final boolean transformed;
  private final String transformLabel;
  private final TransformErrorListener errorListener;
  private final MetricsPort metrics;
  private final String metricPrefix;

  private final ReentrantLock lock = new ReentrantLock();
  private final ArrayDeque<S> store;
  private final SubscriptionHandle subscription;

  private volatile BufferState state;
  private long delivered;
  private long accepted;
  private long evicted;
  private long discardedWhilePaused;
  private long transformFailures;

  /**
   * Attaches a buffer to {@code channelId} on {@code source} and starts capturing immediately.
   *
   * @param source observable to watch; not owned by the buffer
   * @param channelId channel to observe; must be exposed by {@code source}
   * @param options validated construction parameters
   * @throws InvalidChannelException if {@code channelId} is blank or not exposed by {@code source}
   * @throws NullPointerException if {@code source} or {@code options} is {@code null}
   */
  public EventBuffer(NotificationSource<? extends R> source, String channelId, EventBufferOptions<R, S> options) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(options, "options");
    this.sourceDescription = source.describe();
    this.channelId = requireChannel(source, channelId, sourceDescription);
    this.capacity = options.capacity();
    this.transform = options.transform();
    this.transformed = options.hasTransform();
    this.transformLabel = options.transformLabel();
    this.errorListener = options.errorListener();
    this.metrics = options.metrics();
    this.metricPrefix = options.metricPrefix();
    this.store = new ArrayDeque<>(Math.min(capacity, INITIAL_STORE_SIZE));
    this.state = BufferState.ACTIVE;
    this.subscription = Objects.requireNonNull(
        source.subscribe(this.channelId, this::receive), "source returned null subscription");
    log.info("Event buffer attached to channel {} of {} (capacity={}, transform={})",
        this.channelId, sourceDescription, capacity, transformLabel == null ? "none" : transformLabel);
  }

  /**
   * Attaches a buffer with default options: capacity {@value EventBufferOptions#DEFAULT_CAPACITY}, no transform.
   *
   * @param source observable to watch
   * @param channelId channel to observe
   * @param <R> notification type
   * @return running buffer
   * @throws InvalidChannelException if {@code channelId} is not exposed by {@code source}
   */
  public static <R> EventBuffer<R, R> attach(NotificationSource<? extends R> source, String channelId) {
    return new EventBuffer<>(source, channelId, EventBufferOptions.<R>defaults());
  }

  private static String requireChannel(NotificationSource<?> source, String channelId, String description) {
    String normalized;
    try {
      normalized = Strings.requireNonBlank("channelId", channelId);
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new InvalidChannelException(channelId, ex);
    }
    if (!source.hasChannel(normalized)) {
      throw new InvalidChannelException(normalized, description);
    }
    return normalized;
  }

  /**
   * Resumes retention of incoming notifications. Idempotent.
   *
   * @throws IllegalStateException if the buffer has been closed
   */
  public void start() {
    lock.lock();
    try {
      if (state == BufferState.CLOSED) {
        throw new IllegalStateException("event buffer for channel " + channelId + " is closed");
      }
      if (state == BufferState.PAUSED) {
        state = BufferState.ACTIVE;
        log.debug("Event buffer for channel {} resumed", channelId);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Pauses retention; the subscription stays live and incoming notifications are discarded. Idempotent, and a no-op
   * once closed.
   */
  public void stop() {
    lock.lock();
    try {
      if (state == BufferState.ACTIVE) {
        state = BufferState.PAUSED;
        log.debug("Event buffer for channel {} paused", channelId);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Subscription callback. Retains {@code notification} when running, otherwise discards it.
   */
  void receive(R notification) {
    TransformException failure = null;
    boolean rejectedNull = false;
    lock.lock();
    try {
      if (state != BufferState.ACTIVE) {
        discard();
        return;
      }
      long sequence = ++delivered;
      // null never reaches the transform, with or without one configured
      if (notification == null) {
        rejectedNull = true;
      } else {
        Result<S> result = applyTransform(notification, sequence);
        if (result.failure() == null) {
          append(result.value());
        } else {
          failure = result.failure();
          transformFailures++;
        }
      }
    } finally {
      lock.unlock();
    }

    if (rejectedNull) {
      metrics.increment(metricPrefix + ".rejected.null");
      log.warn("Event buffer for channel {} dropped a null notification", channelId);
    }
    if (failure != null) {
      report(failure);
    }
  }

  private void discard() {
    if (state == BufferState.PAUSED) {
      discardedWhilePaused++;
      metrics.increment(metricPrefix + ".discarded.paused");
    } else {
      metrics.increment(metricPrefix + ".discarded.closed");
      log.debug("Event buffer for channel {} ignored a notification after close", channelId);
    }
  }

  private Result<S> applyTransform(R notification, long sequence) {
    S value;
    try {
      value = transform.apply(notification);
    } catch (RuntimeException ex) {
      return Result.failed(new TransformException(channelId, sequence, notification,
          "transform " + transformLabel + " failed on notification #" + sequence + ": " + ex.getMessage(), ex));
    }
    if (value == null) {
      return Result.failed(new TransformException(channelId, sequence, notification,
          "transform " + transformLabel + " returned null for notification #" + sequence, null));
    }
    return Result.of(value);
  }

  private void append(S value) {
    store.addLast(value);
    accepted++;
    metrics.increment(metricPrefix + ".accepted");
    if (store.size() > capacity) {
      store.removeFirst();
      evicted++;
      metrics.increment(metricPrefix + ".evicted");
    }
    metrics.observe(metricPrefix + ".size", store.size());
  }

  private void report(TransformException failure) {
    metrics.increment(metricPrefix + ".transform.failed");
    log.warn("Event buffer for channel {} dropped notification #{} ({}): {}",
        channelId,
        failure.sequence(),
        Logs.truncate(String.valueOf(failure.notification()), LOG_PAYLOAD_BYTES),
        failure.getMessage());
    try {
      errorListener.onTransformError(failure);
    } catch (RuntimeException ex) {
      log.error("Transform error listener failed for channel {}", channelId, ex);
    }
  }

  /**
   * @return number of retained notifications
   */
  public int count() {
    lock.lock();
    try {
      return store.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the most recently retained value without removing it.
   *
   * @return last value, or {@link Optional#empty()} when nothing is retained
   */
  public Optional<S> last() {
    lock.lock();
    try {
      return Optional.ofNullable(store.peekLast());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns the most recently retained value. An empty store is left unchanged.
   *
   * @return removed value, or {@link Optional#empty()} when nothing is retained
   */
  public Optional<S> pop() {
    lock.lock();
    try {
      return Optional.ofNullable(store.pollLast());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns every retained value, oldest first.
   *
   * @return immutable snapshot; later captures do not affect it
   */
  public List<S> all() {
    lock.lock();
    try {
      return List.copyOf(store);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Discards all retained values. Running state and subscription are unaffected.
   */
  public void clear() {
    lock.lock();
    try {
      store.clear();
    } finally {
      lock.unlock();
    }
  }

  public boolean isRunning() {
    return state.isRunning();
  }

  public BufferState state() {
    return state;
  }

  public String channelId() {
    return channelId;
  }

  public int capacity() {
    return capacity;
  }

  public boolean hasTransform() {
    return transformed;
  }

  /**
   * Captures counters and state for display.
   *
   * @return consistent snapshot
   */
  public EventBufferStatus status() {
    lock.lock();
    try {
      return new EventBufferStatus(
          channelId,
          sourceDescription,
          state,
          transformLabel,
          store.size(),
          capacity,
          accepted,
          evicted,
          discardedWhilePaused,
          transformFailures);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Releases the subscription and stops capture permanently. Retained values stay readable. Repeated calls are
   * no-ops, and release failures from the source are logged rather than thrown.
   */
  @Override
  public void close() {
    int retained;
    lock.lock();
    try {
      if (state == BufferState.CLOSED) {
        return;
      }
      state = BufferState.CLOSED;
      retained = store.size();
    } finally {
      lock.unlock();
    }
    try {
      subscription.release();
    } catch (RuntimeException ex) {
      log.warn("Releasing subscription for channel {} of {} failed", channelId, sourceDescription, ex);
    }
    log.info("Event buffer detached from channel {} of {} ({} retained)", channelId, sourceDescription, retained);
  }

  @Override
  public String toString() {
    return status().toString();
  }

  private record Result<V>(V value, TransformException failure) {
    static <V> Result<V> of(V value) {
      return new Result<>(value, null);
    }

    static <V> Result<V> failed(TransformException failure) {
      return new Result<>(null, failure);
    }
  }
}
