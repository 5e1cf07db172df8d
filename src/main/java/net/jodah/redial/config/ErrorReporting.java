package net.jodah.redial.config;

/**
 * Selects which error is published before each redial attempt.
 * 
 * @author Jonathan Halterman
 */
public enum ErrorReporting {
  /** Publish the error that closed the connection before every attempt of a redial cycle. */
  ORIGINAL,
  /**
   * Publish the error that closed the connection before the first attempt, then the failure of the
   * preceding attempt.
   */
  LATEST
}
