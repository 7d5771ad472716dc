package ca.gc.cra.eventbuffer.application.buffer;

/**
 * Lifecycle state of an {@link EventBuffer}.
 *
 * <p>{@code ACTIVE <-> PAUSED} via {@code start}/{@code stop}; either moves to {@code CLOSED} on teardown, which is
 * terminal.</p>
 *
 * @since 0.1.0
 */
public enum BufferState {
  /** Subscription live, notifications retained. */
  ACTIVE,
  /** Subscription live, notifications silently discarded. */
  PAUSED,
  /** Subscription released. */
  CLOSED;

  /**
   * @return {@code true} when incoming notifications are retained
   */
  public boolean isRunning() {
    return this == ACTIVE;
  }

  /**
   * Label used in status output, matching the running/stopped wording operators see.
   *
   * @return {@code running}, {@code stopped}, or {@code closed}
   */
  public String label() {
    return switch (this) {
      case ACTIVE -> "running";
      case PAUSED -> "stopped";
      case CLOSED -> "closed";
    };
  }
}
