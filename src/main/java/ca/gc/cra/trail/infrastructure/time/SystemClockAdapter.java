package ca.gc.cra.trail.infrastructure.time;

import ca.gc.cra.trail.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by the JVM wall clock.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  public SystemClockAdapter() {}

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
