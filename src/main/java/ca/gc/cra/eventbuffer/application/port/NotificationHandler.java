package ca.gc.cra.eventbuffer.application.port;

/**
 * Callback registered with a {@link NotificationSource} for a single channel.
 *
 * @param <T> notification payload type
 * @since 0.1.0
 */
@FunctionalInterface
public interface NotificationHandler<T> {
  /**
   * Receives one notification emitted on the subscribed channel.
   *
   * @param notification payload as emitted by the source; may be {@code null} if the source allows it
   */
  void onNotification(T notification);
}
