package ca.gc.cra.eventbuffer.application.buffer;

/**
 * Describes a transform failure for one notification. The notification is dropped and the buffer keeps running;
 * instances are handed to the configured
 * {@link ca.gc.cra.eventbuffer.application.port.TransformErrorListener} rather than thrown into the source.
 *
 * @since 0.1.0
 */
public final class TransformException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String channelId;
  private final long sequence;
  private final transient Object notification;

  /**
   * Creates a failure report.
   *
   * @param channelId channel the notification arrived on
   * @param sequence 1-based delivery sequence number of the notification within the buffer's lifetime
   * @param notification raw notification the transform rejected; may be {@code null}
   * @param message human-readable summary
   * @param cause exception raised by the transform, or {@code null} when the transform produced no value
   */
  public TransformException(
      String channelId, long sequence, Object notification, String message, Throwable cause) {
    super(message, cause);
    this.channelId = channelId;
    this.sequence = sequence;
    this.notification = notification;
  }

  /**
   * @return channel the failed notification arrived on
   */
  public String channelId() {
    return channelId;
  }

  /**
   * @return 1-based sequence number counting every notification delivered while running
   */
  public long sequence() {
    return sequence;
  }

  /**
   * @return raw notification that could not be transformed; may be {@code null}
   */
  public Object notification() {
    return notification;
  }
}
