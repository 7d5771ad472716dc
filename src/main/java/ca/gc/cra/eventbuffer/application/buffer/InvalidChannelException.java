package ca.gc.cra.eventbuffer.application.buffer;

/**
 * Thrown when a buffer is attached to a channel its source does not expose.
 *
 * @since 0.1.0
 */
public final class InvalidChannelException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String channelId;

  /**
   * Creates an exception naming the rejected channel and the source it was looked up on.
   *
   * @param channelId rejected channel identifier; may be {@code null}
   * @param sourceDescription description of the source that lacks the channel
   */
  public InvalidChannelException(String channelId, String sourceDescription) {
    super("channel '" + channelId + "' is not exposed by " + sourceDescription);
    this.channelId = channelId;
  }

  /**
   * Creates an exception for a malformed channel identifier.
   *
   * @param channelId rejected channel identifier; may be {@code null}
   * @param cause validation failure
   */
  public InvalidChannelException(String channelId, Throwable cause) {
    super("channel '" + channelId + "' is not a valid identifier: " + cause.getMessage(), cause);
    this.channelId = channelId;
  }

  /**
   * @return the rejected channel identifier
   */
  public String channelId() {
    return channelId;
  }
}
