package ca.gc.cra.eventbuffer.infrastructure.source;

import ca.gc.cra.eventbuffer.application.port.NotificationHandler;
import ca.gc.cra.eventbuffer.application.port.NotificationSource;
import ca.gc.cra.eventbuffer.application.port.SubscriptionHandle;
import ca.gc.cra.eventbuffer.validation.Strings;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notification source with a fixed set of channels and in-process delivery.
 *
 * <p>Subscribers on a channel are notified in registration order. Without an executor, {@link #publish} delivers on
 * the calling thread; with one, each publish becomes a single task, so a single-threaded executor preserves publish
 * order. A handler that throws is logged and does not prevent delivery to the remaining subscribers.</p>
 *
 * @param <T> notification type
 * @since 0.1.0
 */
public final class InMemoryNotificationSource<T> implements NotificationSource<T> {
  private static final Logger log = LoggerFactory.getLogger(InMemoryNotificationSource.class);

  private final String description;
  private final Map<String, CopyOnWriteArrayList<Registration<T>>> subscribers;
  private final Executor executor;

  /**
   * Creates a source that delivers on the publishing thread.
   *
   * @param description name used in status output
   * @param channels channel identifiers; at least one
   */
  public InMemoryNotificationSource(String description, Collection<String> channels) {
    this(description, channels, Runnable::run);
  }

  /**
   * Creates a source that hands each publish to {@code executor}.
   *
   * @param description name used in status output
   * @param channels channel identifiers; at least one
   * @param executor delivery executor
   */
  public InMemoryNotificationSource(String description, Collection<String> channels, Executor executor) {
    this.description = Strings.requireNonBlank("description", description);
    Objects.requireNonNull(channels, "channels");
    if (channels.isEmpty()) {
      throw new IllegalArgumentException("channels must not be empty");
    }
    Map<String, CopyOnWriteArrayList<Registration<T>>> map = new LinkedHashMap<>();
    for (String channel : channels) {
      map.put(Strings.requireNonBlank("channel", channel), new CopyOnWriteArrayList<>());
    }
    this.subscribers = Map.copyOf(map);
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /**
   * Convenience factory delivering on the publishing thread.
   *
   * @param description name used in status output
   * @param channels channel identifiers
   * @param <T> notification type
   * @return new source
   */
  public static <T> InMemoryNotificationSource<T> of(String description, String... channels) {
    return new InMemoryNotificationSource<>(description, List.of(channels));
  }

  @Override
  public boolean hasChannel(String channelId) {
    return channelId != null && subscribers.containsKey(channelId);
  }

  @Override
  public Set<String> channels() {
    return subscribers.keySet();
  }

  @Override
  public SubscriptionHandle subscribe(String channelId, NotificationHandler<? super T> handler) {
    Objects.requireNonNull(handler, "handler");
    CopyOnWriteArrayList<Registration<T>> registrations = registrations(channelId);
    Registration<T> registration = new Registration<>(channelId, handler, registrations);
    registrations.add(registration);
    log.debug("Subscribed handler to channel {} of {} ({} subscribers)", channelId, description, registrations.size());
    return registration;
  }

  /**
   * Emits {@code notification} to every live subscriber of {@code channelId}.
   *
   * @param channelId channel to emit on
   * @param notification payload; may be {@code null}
   * @throws IllegalArgumentException if the channel is not exposed by this source
   */
  public void publish(String channelId, T notification) {
    List<Registration<T>> snapshot = List.copyOf(registrations(channelId));
    if (snapshot.isEmpty()) {
      return;
    }
    executor.execute(() -> deliver(channelId, snapshot, notification));
  }

  /**
   * @param channelId channel to inspect
   * @return number of live subscriptions on the channel
   * @throws IllegalArgumentException if the channel is not exposed by this source
   */
  public int subscriberCount(String channelId) {
    return registrations(channelId).size();
  }

  @Override
  public String describe() {
    return description;
  }

  private void deliver(String channelId, List<Registration<T>> snapshot, T notification) {
    for (Registration<T> registration : snapshot) {
      if (!registration.isActive()) {
        continue;
      }
      try {
        registration.handler.onNotification(notification);
      } catch (RuntimeException ex) {
        log.warn("Subscriber on channel {} of {} failed", channelId, description, ex);
      }
    }
  }

  private CopyOnWriteArrayList<Registration<T>> registrations(String channelId) {
    CopyOnWriteArrayList<Registration<T>> registrations = channelId == null ? null : subscribers.get(channelId);
    if (registrations == null) {
      throw new IllegalArgumentException("channel '" + channelId + "' is not exposed by " + description);
    }
    return registrations;
  }

  private static final class Registration<T> implements SubscriptionHandle {
    private final String channelId;
    private final NotificationHandler<? super T> handler;
    private final CopyOnWriteArrayList<Registration<T>> owner;
    private final AtomicBoolean active = new AtomicBoolean(true);

    private Registration(
        String channelId, NotificationHandler<? super T> handler, CopyOnWriteArrayList<Registration<T>> owner) {
      this.channelId = channelId;
      this.handler = handler;
      this.owner = owner;
    }

    @Override
    public void release() {
      if (active.compareAndSet(true, false)) {
        owner.remove(this);
        log.debug("Released subscription on channel {}", channelId);
      }
    }

    @Override
    public boolean isActive() {
      return active.get();
    }
  }
}
