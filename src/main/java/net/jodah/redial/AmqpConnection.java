package net.jodah.redial;

import java.io.IOException;

import net.jodah.redial.util.Pipe;

/**
 * A connection to an AMQP broker that can redial itself after an unexpected closure. Created via
 * {@link Connections}.
 * 
 * @author Jonathan Halterman
 */
public interface AmqpConnection {
  /**
   * Returns the connection's name, used for logging.
   */
  String getName();

  /**
   * Opens a new channel on the current underlying connection.
   * 
   * @throws IOException if the channel could not be opened
   */
  AmqpChannel channel() throws IOException;

  /**
   * Sends the closure of the current underlying connection to {@code closeEvents}, then closes
   * {@code closeEvents}. A close initiated via {@link #close()} is sent as
   * {@link CloseEvent#GRACEFUL}. Returns immediately.
   * 
   * @return {@code closeEvents}
   */
  Pipe<CloseEvent> notifyClose(Pipe<CloseEvent> closeEvents);

  /**
   * Starts redialing the connection whenever it is closed unexpectedly. Each redial cycle sends the
   * error that closed the connection to {@code errors} before every attempt, waits
   * {@code attempts * interval}, then dials again. After a successful dial the next closure is
   * watched for and {@code true} is sent to {@code done}. A {@link #close() graceful close} ends
   * redialing without sending to either pipe.
   * 
   * <p>
   * {@code errors} should be unbuffered and must be received from concurrently with this
   * connection: redialing does not proceed past an error until it is received.
   * 
   * @throws IllegalStateException if redialing was already started and has not ended
   */
  void autoRedial(Pipe<AmqpError> errors, Pipe<Boolean> done);

  /**
   * Returns the number of failed redial attempts counted toward the backoff.
   */
  int getRedialAttempts();

  boolean isOpen();

  /**
   * Closes the connection, ending any redialing.
   */
  void close() throws IOException;
}
