package ca.gc.cra.eventbuffer.application.port;

/**
 * <strong>What:</strong> Revocable registration token linking a handler to a source channel.
 * <p><strong>Why:</strong> Gives the subscriber exclusive ownership of its registration so teardown can revoke it
 * without touching the source itself.</p>
 * <p><strong>Thread-safety:</strong> {@link #release()} must be idempotent and safe to call from any thread,
 * including concurrently with an in-flight delivery.</p>
 *
 * @since 0.1.0
 */
public interface SubscriptionHandle extends AutoCloseable {
  /**
   * Revokes the registration. Subsequent calls have no effect.
   */
  void release();

  /**
   * Reports whether the registration is still live.
   *
   * @return {@code false} once {@link #release()} has been called
   */
  boolean isActive();

  /**
   * Equivalent to {@link #release()} for try-with-resources usage.
   */
  @Override
  default void close() {
    release();
  }
}
