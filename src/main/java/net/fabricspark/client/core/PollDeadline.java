package net.fabricspark.client.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import net.fabricspark.client.jdbc.ErrorCode;

/** Bounds a poll loop. A zero or negative timeout never expires. */
final class PollDeadline {
  private final Clock clock;
  private final Duration timeout;
  private final Instant start;

  private PollDeadline(Clock clock, Duration timeout) {
    this.clock = clock;
    this.timeout = timeout;
    this.start = clock.instant();
  }

  static PollDeadline start(Clock clock, Duration timeout) {
    return new PollDeadline(clock, timeout);
  }

  void check(String activity) throws LivyException {
    if (timeout.isZero() || timeout.isNegative()) {
      return;
    }
    if (Duration.between(start, clock.instant()).compareTo(timeout) >= 0) {
      throw new LivyException(
          ErrorCode.POLL_TIMEOUT, String.valueOf(timeout.toMillis()), activity);
    }
  }

  /**
   * Sleeps, turning an interrupt into a {@link LivyException} while keeping the thread's interrupt
   * flag set.
   */
  static void sleep(Sleeper sleeper, Duration duration, String activity) throws LivyException {
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new LivyException(ex, ErrorCode.INTERRUPTED, activity);
    }
  }
}
