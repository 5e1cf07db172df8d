package net.jodah.redial.internal;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import net.jodah.redial.CloseEvent;
import net.jodah.redial.internal.util.Exceptions;
import net.jodah.redial.internal.util.concurrent.NamedThreadFactory;
import net.jodah.redial.util.Pipe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Bridges the shutdown of an amqp-client connection to a pipe of {@link CloseEvent}s.
 *
 * @author Jonathan Halterman
 */
final class CloseNotifier {
  private static final Logger LOG = LoggerFactory.getLogger(CloseNotifier.class);
  static final ExecutorService NOTIFY_EXECUTORS =
      Executors.newCachedThreadPool(new NamedThreadFactory("redial-notify-%s"));

  private CloseNotifier() {
  }

  /**
   * Watches {@code connection} for its shutdown. Shutdown signals are handed to a bridge pipe with
   * the same capacity as {@code closeEvents}, translated by a background task and sent to
   * {@code closeEvents}, which is closed once the bridge is drained. Returns immediately.
   */
  static Pipe<CloseEvent> watch(Connection connection, final Pipe<CloseEvent> closeEvents) {
    final Pipe<ShutdownSignalException> signals =
        new Pipe<ShutdownSignalException>(closeEvents.capacity());

    NOTIFY_EXECUTORS.execute(new Runnable() {
      @Override
      public void run() {
        try {
          ShutdownSignalException sse;
          while ((sse = signals.receive()) != null)
            closeEvents.send(Exceptions.translate(sse));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        } catch (IllegalStateException e) {
          LOG.debug("Close event dropped since {} was already closed", closeEvents);
        } finally {
          closeEvents.close();
        }
      }
    });

    connection.addShutdownListener(new ShutdownListener() {
      @Override
      public void shutdownCompleted(ShutdownSignalException cause) {
        try {
          signals.send(cause);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        } finally {
          // A connection shuts down once
          signals.close();
        }
      }
    });

    return closeEvents;
  }
}
