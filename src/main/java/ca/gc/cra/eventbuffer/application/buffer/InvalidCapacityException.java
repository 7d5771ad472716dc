package ca.gc.cra.eventbuffer.application.buffer;

/**
 * Thrown when a buffer capacity is not a positive integer.
 *
 * @since 0.1.0
 */
public final class InvalidCapacityException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final long capacity;

  /**
   * @param capacity rejected capacity value
   */
  public InvalidCapacityException(long capacity) {
    super("capacity must be positive (was " + capacity + ")");
    this.capacity = capacity;
  }

  public long capacity() {
    return capacity;
  }
}
