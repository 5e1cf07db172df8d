package net.jodah.redial.config;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;

import net.jodah.redial.event.RedialListener;
import net.jodah.redial.internal.util.Assert;
import net.jodah.redial.util.Duration;

/**
 * Policy that defines how a closed connection is redialed. Before each attempt the redial waits
 * {@code attempts * interval}, where {@code attempts} counts the failed attempts so far and rolls
 * over to zero once it exceeds {@link #getMaxAttempts() maxAttempts}. Redials are attempted
 * forever.
 *
 * <p>
 * Changes to a policy are not reflected in connections that were already dialed with it.
 *
 * @author Jonathan Halterman
 */
public class RedialPolicy {
  public static final Duration DEFAULT_INTERVAL = Duration.seconds(1);
  public static final int DEFAULT_MAX_ATTEMPTS = 60;

  private Duration interval = DEFAULT_INTERVAL;
  private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
  private ErrorReporting errorReporting = ErrorReporting.ORIGINAL;
  private boolean resetAttemptsOnRedial;
  private Collection<RedialListener> redialListeners = Collections.emptyList();

  public RedialPolicy() {
  }

  private RedialPolicy(RedialPolicy policy) {
    interval = policy.interval;
    maxAttempts = policy.maxAttempts;
    errorReporting = policy.errorReporting;
    resetAttemptsOnRedial = policy.resetAttemptsOnRedial;
    redialListeners = policy.redialListeners;
  }

  /**
   * Returns a new copy of the policy.
   */
  public RedialPolicy copy() {
    return new RedialPolicy(this);
  }

  /**
   * Returns the error published before each attempt.
   *
   * @see #withErrorReporting(ErrorReporting)
   */
  public ErrorReporting getErrorReporting() {
    return errorReporting;
  }

  /**
   * Returns the unit of backoff between attempts.
   *
   * @see #withInterval(Duration)
   */
  public Duration getInterval() {
    return interval;
  }

  /**
   * Returns the attempt count above which the attempt counter is reset to zero.
   *
   * @see #withMaxAttempts(int)
   */
  public int getMaxAttempts() {
    return maxAttempts;
  }

  public Collection<RedialListener> getRedialListeners() {
    return redialListeners;
  }

  /**
   * Returns whether the attempt counter starts over from zero after each successful redial.
   *
   * @see #withResetAttemptsOnRedial(boolean)
   */
  public boolean isResetAttemptsOnRedial() {
    return resetAttemptsOnRedial;
  }

  /**
   * Sets the error published before each attempt. Defaults to {@link ErrorReporting#ORIGINAL}.
   *
   * @throws NullPointerException if {@code errorReporting} is null
   */
  public RedialPolicy withErrorReporting(ErrorReporting errorReporting) {
    this.errorReporting = Assert.notNull(errorReporting, "errorReporting");
    return this;
  }

  /**
   * Sets the unit of backoff between attempts. Defaults to 1 second.
   *
   * @throws NullPointerException if {@code interval} is null
   */
  public RedialPolicy withInterval(Duration interval) {
    this.interval = Assert.notNull(interval, "interval");
    return this;
  }

  /**
   * Sets the attempt count above which the attempt counter is reset to zero, bounding the backoff
   * to {@code maxAttempts * interval}. Defaults to 60.
   *
   * @throws IllegalArgumentException if {@code maxAttempts} is negative
   */
  public RedialPolicy withMaxAttempts(int maxAttempts) {
    Assert.isTrue(maxAttempts >= 0, "The maxAttempts must not be negative");
    this.maxAttempts = maxAttempts;
    return this;
  }

  /**
   * Sets the {@code redialListeners} to be notified of redial events.
   *
   * @throws NullPointerException if {@code redialListeners} is null
   */
  public RedialPolicy withRedialListeners(RedialListener... redialListeners) {
    this.redialListeners = Arrays.asList(Assert.notNull(redialListeners, "redialListeners"));
    return this;
  }

  /**
   * Sets whether the attempt counter starts over from zero after each successful redial. Defaults
   * to false, in which case failed attempts accumulate across redial cycles until the counter rolls
   * over.
   */
  public RedialPolicy withResetAttemptsOnRedial(boolean resetAttemptsOnRedial) {
    this.resetAttemptsOnRedial = resetAttemptsOnRedial;
    return this;
  }

  @Override
  public String toString() {
    return String.format("RedialPolicy[interval=%s, maxAttempts=%s, errorReporting=%s]", interval,
        maxAttempts, errorReporting);
  }
}
