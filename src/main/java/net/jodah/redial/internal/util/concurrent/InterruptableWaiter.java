package net.jodah.redial.internal.util.concurrent;

import java.util.concurrent.locks.AbstractQueuedSynchronizer;

import net.jodah.redial.util.Duration;

/**
 * A waiter for backoff pauses that can be cancelled when the owning resource is closed. Once
 * cancelled, current and future waits return immediately.
 * 
 * @author Jonathan Halterman
 */
public class InterruptableWaiter {
  private final Sync sync = new Sync();

  private static final class Sync extends AbstractQueuedSynchronizer {
    private static final long serialVersionUID = -6409421736593853287L;

    @Override
    protected int tryAcquireShared(int acquires) {
      return getState() == 1 ? 1 : -1;
    }

    @Override
    protected boolean tryReleaseShared(int releases) {
      setState(1);
      return true;
    }

    int state() {
      return getState();
    }
  }

  /**
   * Waits for the {@code waitDuration}, returning immediately for a zero duration or once
   * cancelled.
   * 
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public void await(Duration waitDuration) throws InterruptedException {
    if (waitDuration.isZero()) {
      if (Thread.interrupted())
        throw new InterruptedException();
      return;
    }

    sync.tryAcquireSharedNanos(0, waitDuration.toNanos());
  }

  /**
   * Releases waiting threads and makes later waits return immediately.
   */
  public void cancel() {
    sync.releaseShared(1);
  }

  public boolean isCancelled() {
    return sync.state() == 1;
  }
}
