/**
 * Metrics adapters that bridge the buffer's {@code MetricsPort} to OpenTelemetry or no-op implementations.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent metric updates.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code eventBuffer.*} namespace unless a buffer is configured with
 * another prefix.</p>
 */
package ca.gc.cra.eventbuffer.infrastructure.metrics;
