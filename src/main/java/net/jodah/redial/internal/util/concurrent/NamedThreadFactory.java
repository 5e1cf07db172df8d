package net.jodah.redial.internal.util.concurrent;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates daemon threads named with increasing numbers. Uncaught failures are logged.
 * 
 * @author Jonathan Halterman
 */
public class NamedThreadFactory implements ThreadFactory {
  private static final Logger LOG = LoggerFactory.getLogger(NamedThreadFactory.class);
  private static final Thread.UncaughtExceptionHandler LOGGING_HANDLER =
      new Thread.UncaughtExceptionHandler() {
        @Override
        public void uncaughtException(Thread thread, Throwable failure) {
          LOG.error("Uncaught failure in {}", thread.getName(), failure);
        }
      };

  private final AtomicInteger threadNumber = new AtomicInteger(1);
  private final String nameFormat;

  /**
   * @param nameFormat format for thread names, given the thread number as its single argument,
   *          such as {@code "redial-%s"}
   */
  public NamedThreadFactory(String nameFormat) {
    this.nameFormat = nameFormat;
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, String.format(nameFormat, threadNumber.getAndIncrement()));
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
    return thread;
  }
}
