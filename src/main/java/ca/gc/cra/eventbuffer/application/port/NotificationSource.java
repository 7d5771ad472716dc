package ca.gc.cra.eventbuffer.application.port;

import java.util.Set;

/**
 * <strong>What:</strong> Outbound port describing an observable object that emits notifications on named channels.
 * <p><strong>Why:</strong> Keeps the capture buffer independent of whatever service, bus, or listener registry
 * actually produces the notifications.</p>
 * <p><strong>Role:</strong> Domain port implemented by adapters such as
 * {@code ca.gc.cra.eventbuffer.infrastructure.source.InMemoryNotificationSource}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Advertise which channels exist so callers can reject unknown identifiers up front.</li>
 *   <li>Register a handler for one channel and hand back a revocable {@link SubscriptionHandle}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations decide the delivery thread; handlers must tolerate being
 * invoked from it. Several independent subscriptions on the same channel are permitted.</p>
 * <p><strong>Performance:</strong> {@link #hasChannel(String)} is expected to be O(1).</p>
 * <p><strong>Observability:</strong> {@link #describe()} names the source in buffer status and log lines.</p>
 *
 * @param <T> notification payload type; opaque to subscribers beyond its type
 * @since 0.1.0
 */
public interface NotificationSource<T> {
  /**
   * Reports whether the source exposes the given channel.
   *
   * @param channelId candidate channel identifier; may be {@code null}, which is never a channel
   * @return {@code true} when notifications may be emitted on {@code channelId}
   */
  boolean hasChannel(String channelId);

  /**
   * Lists the channels this source exposes.
   *
   * @return immutable set of channel identifiers
   */
  Set<String> channels();

  /**
   * Registers {@code handler} so that every notification on {@code channelId} invokes it.
   *
   * @param channelId channel to observe; must satisfy {@link #hasChannel(String)}
   * @param handler callback invoked once per notification; never {@code null}
   * @return live handle owning the registration; releasing it stops delivery
   * @throws IllegalArgumentException if {@code channelId} is not exposed by this source
   * @throws NullPointerException if {@code handler} is {@code null}
   */
  SubscriptionHandle subscribe(String channelId, NotificationHandler<? super T> handler);

  /**
   * Human-readable description of the source used for status output.
   *
   * @return short description; defaults to the implementation class name
   */
  default String describe() {
    return getClass().getName();
  }
}
