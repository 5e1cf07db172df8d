package net.jodah.redial;

import java.io.Serializable;

/**
 * The cause of an unexpected connection closure, independent of the underlying client's exception
 * types.
 * 
 * @author Jonathan Halterman
 */
public final class AmqpError implements Serializable {
  private static final long serialVersionUID = -2294518733316098027L;

  private final int code;
  private final String reason;
  private final boolean server;
  private final boolean recover;

  public AmqpError(int code, String reason, boolean server, boolean recover) {
    this.code = code;
    this.reason = reason;
    this.server = server;
    this.recover = recover;
  }

  /**
   * Returns the AMQP reply code, such as 320 for a forced connection closure.
   */
  public int getCode() {
    return code;
  }

  public String getReason() {
    return reason;
  }

  /**
   * Returns whether the closure was initiated by the broker rather than by this client.
   */
  public boolean isServer() {
    return server;
  }

  /**
   * Returns whether the condition may clear when the operation is retried later.
   */
  public boolean isRecover() {
    return recover;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof AmqpError))
      return false;
    AmqpError other = (AmqpError) obj;
    return code == other.code && server == other.server && recover == other.recover
        && (reason == null ? other.reason == null : reason.equals(other.reason));
  }

  @Override
  public int hashCode() {
    int result = code;
    result = 31 * result + (reason == null ? 0 : reason.hashCode());
    result = 31 * result + (server ? 1 : 0);
    return 31 * result + (recover ? 1 : 0);
  }

  @Override
  public String toString() {
    return String.format("Exception (%s) Reason: %s", code, reason);
  }
}
