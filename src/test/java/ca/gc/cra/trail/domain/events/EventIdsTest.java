package ca.gc.cra.trail.domain.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class EventIdsTest {

  @Test
  void formatPadsToWidth() {
    assertEquals("evt_001", EventIds.format(1, EventIds.DEFAULT_WIDTH));
    assertEquals("evt_042", EventIds.format(42, EventIds.DEFAULT_WIDTH));
    assertEquals("evt_999", EventIds.format(999, EventIds.DEFAULT_WIDTH));
  }

  @Test
  void formatWidensPastNineHundredNinetyNine() {
    assertEquals("evt_001000", EventIds.format(1000, EventIds.DEFAULT_WIDTH));
    assertEquals("evt_1234567", EventIds.format(1_234_567, EventIds.DEFAULT_WIDTH));
  }

  @Test
  void sequenceOrdersIdsAcrossTheWideningBoundary() {
    String last = EventIds.format(999, EventIds.DEFAULT_WIDTH);
    String widened = EventIds.format(1000, EventIds.DEFAULT_WIDTH);

    assertTrue(widened.compareTo(last) < 0, "text order breaks when the width grows");
    assertTrue(EventIds.sequenceOf(last) < EventIds.sequenceOf(widened));
    assertTrue(EventIds.format(1000, 3).compareTo(EventIds.format(1001, 3)) < 0);
  }

  @Test
  void formatRejectsNonPositiveSequence() {
    assertThrows(IllegalArgumentException.class, () -> EventIds.format(0, 3));
    assertThrows(IllegalArgumentException.class, () -> EventIds.format(5, 0));
  }

  @Test
  void sequenceOfParsesDigits() {
    assertEquals(7L, EventIds.sequenceOf("evt_007"));
    assertEquals(1000L, EventIds.sequenceOf("evt_001000"));
    assertThrows(IllegalArgumentException.class, () -> EventIds.sequenceOf("event_1"));
    assertThrows(IllegalArgumentException.class, () -> EventIds.sequenceOf(null));
  }

  @Test
  void isWellFormedChecksShape() {
    assertTrue(EventIds.isWellFormed("evt_001"));
    assertFalse(EventIds.isWellFormed("evt_"));
    assertFalse(EventIds.isWellFormed("EVT_001"));
    assertFalse(EventIds.isWellFormed(null));
  }
}
