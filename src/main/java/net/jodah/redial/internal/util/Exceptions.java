package net.jodah.redial.internal.util;

import net.jodah.redial.AmqpError;
import net.jodah.redial.CloseEvent;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.PossibleAuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Translates amqp-client failures into {@link AmqpError}s and {@link CloseEvent}s.
 *
 * @author Jonathan Halterman
 */
public final class Exceptions {
  /** Reply code used for closures that carry no close method, such as socket failures. */
  public static final int FRAME_ERROR = AMQP.FRAME_ERROR;

  private Exceptions() {
  }

  @SuppressWarnings("unchecked")
  public static <T extends Throwable> T extractCause(Throwable t, Class<T> type) {
    Throwable cause = t;
    while (cause != null) {
      if (type.isAssignableFrom(cause.getClass()))
        return (T) cause;
      cause = cause.getCause();
    }

    return null;
  }

  /**
   * Returns the close event for the shutdown signal {@code sse}: {@link CloseEvent#GRACEFUL} when
   * {@code sse} is null or the shutdown was initiated by the application, else an event carrying
   * the translated error.
   */
  public static CloseEvent translate(ShutdownSignalException sse) {
    if (sse == null || sse.isInitiatedByApplication())
      return CloseEvent.GRACEFUL;
    return CloseEvent.of(toError(sse));
  }

  /**
   * Translates a failed connection attempt into an error.
   */
  public static AmqpError translateFailure(Exception e) {
    ShutdownSignalException sse = extractCause(e, ShutdownSignalException.class);
    if (sse != null)
      return toError(sse);
    if (extractCause(e, PossibleAuthenticationFailureException.class) != null)
      return new AmqpError(AMQP.ACCESS_REFUSED, messageOf(e), true, isSoftError(AMQP.ACCESS_REFUSED));
    return new AmqpError(FRAME_ERROR, messageOf(e), false, false);
  }

  /**
   * Returns whether the {@code replyCode} is an AMQP soft error, which closes a channel rather
   * than the connection and may succeed when retried.
   */
  public static boolean isSoftError(int replyCode) {
    switch (replyCode) {
      case AMQP.CONTENT_TOO_LARGE:
      case AMQP.NO_ROUTE:
      case AMQP.NO_CONSUMERS:
      case AMQP.ACCESS_REFUSED:
      case AMQP.NOT_FOUND:
      case AMQP.RESOURCE_LOCKED:
      case AMQP.PRECONDITION_FAILED:
        return true;
      default:
        return false;
    }
  }

  private static AmqpError toError(ShutdownSignalException sse) {
    Method method = sse.getReason();
    if (method instanceof AMQP.Connection.Close) {
      AMQP.Connection.Close close = (AMQP.Connection.Close) method;
      return new AmqpError(close.getReplyCode(), close.getReplyText(), true,
          isSoftError(close.getReplyCode()));
    }
    if (method instanceof AMQP.Channel.Close) {
      AMQP.Channel.Close close = (AMQP.Channel.Close) method;
      return new AmqpError(close.getReplyCode(), close.getReplyText(), true,
          isSoftError(close.getReplyCode()));
    }

    return new AmqpError(FRAME_ERROR, messageOf(sse), false, false);
  }

  private static String messageOf(Throwable t) {
    Throwable root = t;
    while (root.getCause() != null && root.getCause() != root)
      root = root.getCause();
    String message = root.getMessage();
    return message == null ? root.getClass().getName() : message;
  }
}
