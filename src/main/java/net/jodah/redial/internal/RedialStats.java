package net.jodah.redial.internal;

import net.jodah.redial.config.RedialPolicy;
import net.jodah.redial.util.Duration;

/**
 * Tracks the redial attempt counter of a connection and derives the backoff from it. Only the
 * connection's active redial loop mutates the counter.
 *
 * @author Jonathan Halterman
 */
final class RedialStats {
  private final Duration interval;
  private final int maxAttempts;
  private volatile int attempts;

  RedialStats(RedialPolicy policy) {
    interval = policy.getInterval();
    maxAttempts = policy.getMaxAttempts();
  }

  /**
   * Rolls the counter over to zero if it exceeds the max attempts, then returns the time to wait
   * before the next attempt.
   */
  Duration beforeAttempt() {
    if (attempts > maxAttempts)
      attempts = 0;
    return interval.multipliedBy(attempts);
  }

  void attemptFailed() {
    attempts++;
  }

  int getAttempts() {
    return attempts;
  }

  void reset() {
    attempts = 0;
  }

  void setAttempts(int attempts) {
    this.attempts = attempts;
  }
}
