package net.jodah.redial;

import net.jodah.redial.internal.util.Assert;

/**
 * A connection closure as published by {@link AmqpConnection#notifyClose(net.jodah.redial.util.Pipe)}:
 * either the {@link #GRACEFUL} marker for a close initiated by the application, or an unexpected
 * closure carrying its {@link AmqpError}.
 * 
 * @author Jonathan Halterman
 */
public final class CloseEvent {
  /** Marks a close initiated by the application. Carries no error. */
  public static final CloseEvent GRACEFUL = new CloseEvent(null);

  private final AmqpError error;

  private CloseEvent(AmqpError error) {
    this.error = error;
  }

  /**
   * Returns an event for an unexpected closure caused by {@code error}.
   * 
   * @throws NullPointerException if {@code error} is null
   */
  public static CloseEvent of(AmqpError error) {
    return new CloseEvent(Assert.notNull(error, "error"));
  }

  /**
   * Returns the error that caused the closure, else null for a graceful close.
   */
  public AmqpError getError() {
    return error;
  }

  public boolean isGraceful() {
    return error == null;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof CloseEvent))
      return false;
    CloseEvent other = (CloseEvent) obj;
    return error == null ? other.error == null : error.equals(other.error);
  }

  @Override
  public int hashCode() {
    return error == null ? 0 : error.hashCode();
  }

  @Override
  public String toString() {
    return isGraceful() ? "CloseEvent[graceful]" : "CloseEvent[" + error + "]";
  }
}
