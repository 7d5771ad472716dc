/**
 * <strong>Purpose:</strong> Bounded, pausable capture of notifications from a single source channel.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.eventbuffer.application.buffer.EventBuffer} serializes all access
 * on a per-instance lock; no process-wide state is shared between buffers.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.eventbuffer.application.buffer;
