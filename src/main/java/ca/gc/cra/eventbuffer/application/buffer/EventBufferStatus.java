package ca.gc.cra.eventbuffer.application.buffer;

import java.util.StringJoiner;

/**
 * Point-in-time view of an {@link EventBuffer} for display or logging.
 *
 * @param channelId observed channel
 * @param source description of the observed source
 * @param state lifecycle state at the time of the snapshot
 * @param transformLabel description of the transform, or {@code null} when values are stored as delivered
 * @param count number of retained notifications
 * @param capacity retained-notification limit
 * @param accepted notifications appended over the buffer's lifetime
 * @param evicted notifications removed to honour the capacity
 * @param discardedWhilePaused notifications ignored because the buffer was stopped
 * @param transformFailures notifications dropped because the transform failed
 * @since 0.1.0
 */
public record EventBufferStatus(
    String channelId,
    String source,
    BufferState state,
    String transformLabel,
    int count,
    int capacity,
    long accepted,
    long evicted,
    long discardedWhilePaused,
    long transformFailures) {

  public boolean running() {
    return state.isRunning();
  }

  public boolean hasTransform() {
    return transformLabel != null;
  }

  @Override
  public String toString() {
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("listeningTo=" + channelId + " of " + source);
    if (transformLabel != null) {
      joiner.add("parsedBy=" + transformLabel);
    }
    joiner.add("status=" + state.label());
    joiner.add("events=" + count + "/" + capacity);
    return joiner.toString();
  }
}
