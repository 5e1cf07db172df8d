package net.jodah.redial.event;

import net.jodah.redial.AmqpConnection;
import net.jodah.redial.AmqpError;
import net.jodah.redial.util.Duration;

/**
 * Listens for redial related events of an {@link AmqpConnection}. Callbacks run on the redial
 * thread; failures thrown from them are logged and ignored.
 * 
 * @author Jonathan Halterman
 */
public interface RedialListener {
  /**
   * Called when the {@code connection} was closed unexpectedly because of {@code cause} and redial
   * attempts are about to start.
   */
  void onRedialStarted(AmqpConnection connection, AmqpError cause);

  /**
   * Called before each redial attempt, after the attempt counter was rolled over if necessary.
   * 
   * @param attempts the value of the attempt counter
   * @param wait the backoff that precedes this attempt
   */
  void onRedialAttempt(AmqpConnection connection, int attempts, Duration wait);

  /**
   * Called when a redial attempt fails.
   */
  void onRedialFailure(AmqpConnection connection, Throwable failure);

  /**
   * Called when the {@code connection} was redialed and is being watched for the next closure.
   */
  void onRedial(AmqpConnection connection);
}
