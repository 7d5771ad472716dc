/**
 * <strong>Purpose:</strong> Collaborator contracts for the capture buffer: notification sources, subscription
 * handles, error reporting, and metrics.
 * <p><strong>Pipeline role:</strong> Domain layer; adapters implement these interfaces to integrate external
 * notifiers and observability backends.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.eventbuffer.application.port;
