package ca.gc.cra.eventbuffer.infrastructure.events;

import ca.gc.cra.eventbuffer.application.buffer.TransformException;
import ca.gc.cra.eventbuffer.application.port.TransformErrorListener;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory transform error listener used for tests and diagnostics.
 *
 * @since 0.1.0
 */
public final class InMemoryTransformErrorListener implements TransformErrorListener {
  private final CopyOnWriteArrayList<TransformException> errors = new CopyOnWriteArrayList<>();

  @Override
  public void onTransformError(TransformException error) {
    errors.add(Objects.requireNonNull(error, "error"));
  }

  /**
   * Returns a snapshot of reported failures.
   *
   * @return immutable list of failures in report order
   */
  public List<TransformException> snapshot() {
    return List.copyOf(errors);
  }

  /**
   * Clears the captured failures.
   */
  public void clear() {
    errors.clear();
  }
}
