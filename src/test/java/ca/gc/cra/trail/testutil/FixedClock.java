package ca.gc.cra.trail.testutil;

import ca.gc.cra.trail.application.port.ClockPort;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/** Manually advanced clock. */
public final class FixedClock implements ClockPort {
  private final AtomicLong millis;

  public FixedClock(Instant start) {
    this.millis = new AtomicLong(start.toEpochMilli());
  }

  public void advanceMillis(long delta) {
    millis.addAndGet(delta);
  }

  @Override
  public long nowMillis() {
    return millis.get();
  }
}
