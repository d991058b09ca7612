package ca.gc.cra.trail.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueInBounds() {
    assertEquals(1, Numbers.requireRange("width", 1, 1, 18));
    assertEquals(18, Numbers.requireRange("width", 18, 1, 18));
  }

  @Test
  void requireRangeNamesParameter() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("width", 19, 1, 18));
    assertEquals("width must be between 1 and 18 (was 19)", ex.getMessage());

    IllegalArgumentException unnamed = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange(" ", -1, 0, 5));
    assertEquals("value must be between 0 and 5 (was -1)", unnamed.getMessage());
  }

  @Test
  void parseRangeTrimsAndValidates() {
    assertEquals(42, Numbers.parseRange("queueCapacity", " 42 ", 1, 100));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseRange("queueCapacity", "4x", 1, 100));
    assertEquals("queueCapacity must be numeric (was 4x)", ex.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRange("queueCapacity", "", 1, 100));
  }
}
