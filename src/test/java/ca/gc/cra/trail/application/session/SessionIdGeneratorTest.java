package ca.gc.cra.trail.application.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.trail.testutil.FixedClock;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class SessionIdGeneratorTest {

  @Test
  void defaultPatternUsesUtcSeconds() {
    FixedClock clock = new FixedClock(Instant.parse("2025-03-14T09:26:53.999Z"));
    SessionIdGenerator generator = new SessionIdGenerator(SessionIdGenerator.DEFAULT_PATTERN, clock);

    assertEquals("session_20250314_092653", generator.newSessionId());
    clock.advanceMillis(1);
    assertEquals("session_20250314_092654", generator.newSessionId());
  }

  @Test
  void customPatternIsHonoured() {
    FixedClock clock = new FixedClock(Instant.parse("2025-03-14T09:26:53Z"));
    SessionIdGenerator generator = new SessionIdGenerator("'run-'yyyyMMddHHmm", clock);

    assertEquals("run-202503140926", generator.newSessionId());
  }

  @Test
  void invalidPatternIsRejected() {
    FixedClock clock = new FixedClock(Instant.EPOCH);

    assertThrows(IllegalArgumentException.class, () -> new SessionIdGenerator("yyyy{{", clock));
    assertThrows(IllegalArgumentException.class, () -> new SessionIdGenerator("' '", clock));
  }
}
