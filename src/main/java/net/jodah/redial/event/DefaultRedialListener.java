package net.jodah.redial.event;

import net.jodah.redial.AmqpConnection;
import net.jodah.redial.AmqpError;
import net.jodah.redial.util.Duration;

/**
 * No-op redial listener for sub-classing.
 * 
 * @author Jonathan Halterman
 */
public abstract class DefaultRedialListener implements RedialListener {
  @Override
  public void onRedialStarted(AmqpConnection connection, AmqpError cause) {
  }

  @Override
  public void onRedialAttempt(AmqpConnection connection, int attempts, Duration wait) {
  }

  @Override
  public void onRedialFailure(AmqpConnection connection, Throwable failure) {
  }

  @Override
  public void onRedial(AmqpConnection connection) {
  }
}
