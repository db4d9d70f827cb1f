package ca.gc.cra.tether.application.stage;

import ca.gc.cra.tether.validation.Numbers;
import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff settings for {@link RetryStage}.
 *
 * @param maxAttempts total attempts including the first, at least 1
 * @param initialBackoff delay before the second attempt
 * @param maxBackoff upper bound for any single delay
 * @since 0.1.0
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
  private static final int MAX_ATTEMPTS_LIMIT = 100;

  public RetryPolicy {
    Numbers.requireRange("maxAttempts", maxAttempts, 1, MAX_ATTEMPTS_LIMIT);
    Numbers.requirePositive("initialBackoff", initialBackoff);
    Numbers.requirePositive("maxBackoff", maxBackoff);
    if (maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException("maxBackoff must not be shorter than initialBackoff");
    }
  }

  /**
   * Policy that never retries.
   *
   * @return single-attempt policy
   */
  public static RetryPolicy noRetries() {
    return new RetryPolicy(1, Duration.ofMillis(1), Duration.ofMillis(1));
  }

  /**
   * Delay to wait after the given failed attempt.
   *
   * @param failedAttempt 1-based number of the attempt that just failed
   * @return {@code initialBackoff * 2^(failedAttempt - 1)} capped at {@code maxBackoff}
   */
  public Duration backoffAfter(int failedAttempt) {
    if (failedAttempt < 1) {
      throw new IllegalArgumentException("failedAttempt must be >= 1");
    }
    int shift = Math.min(failedAttempt - 1, 30);
    long nanos = initialBackoff.toNanos();
    long scaled = nanos > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : nanos << shift;
    Duration delay = Duration.ofNanos(scaled);
    return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
  }

  /**
   * Tells whether another attempt is allowed after {@code failedAttempt}.
   *
   * @param failedAttempt 1-based number of the attempt that just failed
   * @return {@code true} while attempts remain
   */
  public boolean allowsAnotherAttempt(int failedAttempt) {
    return failedAttempt < maxAttempts;
  }

  @Override
  public String toString() {
    return "RetryPolicy[maxAttempts=" + maxAttempts
        + ", initialBackoff=" + Objects.toString(initialBackoff)
        + ", maxBackoff=" + Objects.toString(maxBackoff) + "]";
  }
}
