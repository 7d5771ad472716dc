package ca.gc.cra.eventbuffer.infrastructure.metrics;

import ca.gc.cra.eventbuffer.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations.
 * <p>Thread-safe and stateless; selected when buffer metrics are disabled in configuration.</p>
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
