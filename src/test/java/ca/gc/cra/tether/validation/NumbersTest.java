package ca.gc.cra.tether.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("maxAttempts", 10, 1, 100));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("maxAttempts", 0, 1, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("maxAttempts", 101, 1, 100));
  }

  @Test
  void requirePositiveRejectsZeroAndNegativeDurations() {
    assertEquals(Duration.ofMillis(1), Numbers.requirePositive("backoff", Duration.ofMillis(1)));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("backoff", Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requirePositive("backoff", Duration.ofMillis(-5)));
    assertThrows(NullPointerException.class, () -> Numbers.requirePositive("backoff", null));
  }
}
