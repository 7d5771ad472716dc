package ca.gc.cra.eventbuffer.application.port;

import ca.gc.cra.eventbuffer.application.buffer.TransformException;

/**
 * <strong>What:</strong> Caller-visible channel for transform failures raised while a buffer handles a notification.
 * <p><strong>Why:</strong> A failing transform drops exactly one notification; reporting it here keeps that loss
 * observable without letting the failure escape into the source's delivery path.</p>
 * <p><strong>Thread-safety:</strong> Invoked on the delivery thread; implementations must tolerate concurrent calls
 * when the source delivers from several threads.</p>
 * <p><strong>Performance:</strong> Should return promptly; it runs inline with delivery.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.eventbuffer.infrastructure.events.InMemoryTransformErrorListener
 */
@FunctionalInterface
public interface TransformErrorListener {
  /**
   * Receives a failure for a single notification.
   *
   * @param error failure describing the channel, sequence number, and raw notification; never {@code null}
   */
  void onTransformError(TransformException error);

  /**
   * Listener that ignores failures; the buffer still counts them in its status and metrics.
   */
  TransformErrorListener NO_OP = error -> {};
}
