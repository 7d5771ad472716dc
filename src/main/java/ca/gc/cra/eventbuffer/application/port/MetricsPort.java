package ca.gc.cra.eventbuffer.application.port;

/**
 * <strong>What:</strong> Domain port abstracting buffer metrics emission.
 * <p><strong>Why:</strong> Allows the capture buffer to record counters and size observations without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Domain port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like accepted, evicted, or dropped notifications.</li>
 *   <li>Record numeric observations such as the retained count after each append.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from delivery threads.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1); they run on the delivery path.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code eventBuffer.evicted}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code eventBuffer.accepted}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram/gauge style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
