package net.jodah.redial.internal;

import net.jodah.redial.AmqpError;
import net.jodah.redial.CloseEvent;
import net.jodah.redial.config.ErrorReporting;
import net.jodah.redial.config.RedialPolicy;
import net.jodah.redial.event.RedialListener;
import net.jodah.redial.internal.util.Exceptions;
import net.jodah.redial.util.Duration;
import net.jodah.redial.util.Pipe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redials a connection each time it is closed unexpectedly, until it is closed gracefully. Each
 * cycle watches one subscription to the connection's closure, retries the dial with a backoff
 * until it succeeds, re-arms the watch on the new underlying connection and then signals
 * {@code done}.
 *
 * @author Jonathan Halterman
 */
final class RedialLoop implements Runnable {
  private static final Logger LOG = LoggerFactory.getLogger(RedialLoop.class);

  private final ConnectionHandler connection;
  private final RedialPolicy policy;
  private final RedialStats stats;
  private final Pipe<AmqpError> errors;
  private final Pipe<Boolean> done;

  RedialLoop(ConnectionHandler connection, Pipe<AmqpError> errors, Pipe<Boolean> done) {
    this.connection = connection;
    this.policy = connection.policy;
    this.stats = connection.stats;
    this.errors = errors;
    this.done = done;
  }

  @Override
  public void run() {
    try {
      Pipe<CloseEvent> closeEvents = connection.notifyClose(new Pipe<CloseEvent>());
      while (true) {
        CloseEvent event = closeEvents.receive();
        if (event == null || event.isGraceful()) {
          LOG.debug("Connection {} was closed gracefully", connection);
          return;
        }

        closeEvents = redial(event.getError());
        if (closeEvents == null)
          return;
        signalDone();
      }
    } catch (InterruptedException e) {
      LOG.debug("Redialing of {} was interrupted", connection);
      Thread.currentThread().interrupt();
    } catch (IllegalStateException e) {
      LOG.debug("Redialing of {} ended since its errors pipe was closed", connection);
    } finally {
      connection.redialEnded();
    }
  }

  /**
   * Signals a completed redial without holding up the watch on the redialed connection, which is
   * already armed.
   */
  private void signalDone() {
    ConnectionHandler.REDIAL_EXECUTORS.execute(new Runnable() {
      @Override
      public void run() {
        try {
          done.send(Boolean.TRUE);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        } catch (IllegalStateException e) {
          LOG.debug("Redial of {} not signalled since {} was already closed", connection, done);
        }
      }
    });
  }

  /**
   * Performs redial attempts until one succeeds.
   *
   * @return the watch on the redialed connection's closure, else null if the connection was closed
   *         while redialing
   */
  private Pipe<CloseEvent> redial(AmqpError cause) throws InterruptedException {
    LOG.error("Connection {} was closed unexpectedly: {}", connection, cause);
    for (RedialListener listener : policy.getRedialListeners())
      try {
        listener.onRedialStarted(connection, cause);
      } catch (Exception e) {
        LOG.warn("Redial listener {} failed", listener, e);
      }

    AmqpError error = cause;
    while (true) {
      errors.send(error);

      Duration wait = stats.beforeAttempt();
      for (RedialListener listener : policy.getRedialListeners())
        try {
          listener.onRedialAttempt(connection, stats.getAttempts(), wait);
        } catch (Exception e) {
          LOG.warn("Redial listener {} failed", listener, e);
        }

      LOG.debug("Redialing {} in {}", connection, wait);
      connection.retryWaiter.await(wait);
      if (connection.isClosed())
        return null;

      try {
        Pipe<CloseEvent> closeEvents = connection.redial();
        if (closeEvents == null)
          return null;

        if (policy.isResetAttemptsOnRedial())
          stats.reset();
        for (RedialListener listener : policy.getRedialListeners())
          try {
            listener.onRedial(connection);
          } catch (Exception e) {
            LOG.warn("Redial listener {} failed", listener, e);
          }
        return closeEvents;
      } catch (Exception e) {
        stats.attemptFailed();
        LOG.info("Failed to redial {}", connection, e);
        if (policy.getErrorReporting() == ErrorReporting.LATEST)
          error = Exceptions.translateFailure(e);
        for (RedialListener listener : policy.getRedialListeners())
          try {
            listener.onRedialFailure(connection, e);
          } catch (Exception le) {
            LOG.warn("Redial listener {} failed", listener, le);
          }
      }
    }
  }
}
