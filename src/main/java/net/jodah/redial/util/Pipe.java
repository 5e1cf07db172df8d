package net.jodah.redial.util;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import net.jodah.redial.internal.util.Assert;

/**
 * A closable, bounded hand-off between threads. A pipe with a capacity of zero is unbuffered: a
 * {@link #send(Object) send} does not return until a receiver has taken the element, so a sender
 * stalls for as long as nobody receives.
 *
 * <p>
 * Once a pipe is {@link #close() closed}, receivers drain any remaining elements and then receive
 * {@code null}.
 *
 * @param <T> element type
 */
public class Pipe<T> {
  private final int capacity;
  private final ArrayDeque<T> elements = new ArrayDeque<T>();
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private long sent;
  private long received;
  private boolean closed;

  /**
   * Creates an unbuffered pipe.
   */
  public Pipe() {
    this(0);
  }

  /**
   * @throws IllegalArgumentException if {@code capacity} is negative
   */
  public Pipe(int capacity) {
    Assert.isTrue(capacity >= 0, "The capacity must not be negative: %s", capacity);
    this.capacity = capacity;
  }

  public int capacity() {
    return capacity;
  }

  /**
   * Sends the {@code element}, waiting for buffer space, or for a receiver when the pipe is
   * unbuffered.
   *
   * @throws NullPointerException if {@code element} is null
   * @throws IllegalStateException if the pipe is closed
   * @throws InterruptedException if interrupted while waiting
   */
  public void send(T element) throws InterruptedException {
    Assert.notNull(element, "element");
    lock.lockInterruptibly();
    try {
      while (!closed && elements.size() >= Math.max(capacity, 1))
        changed.await();
      Assert.state(!closed, "Pipe is closed");
      elements.add(element);
      long ticket = ++sent;
      changed.signalAll();

      if (capacity == 0)
        while (received < ticket && !closed)
          changed.await();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Receives the next element, waiting until one is sent or the pipe is closed.
   *
   * @return the next element, or null if the pipe is closed and drained
   * @throws InterruptedException if interrupted while waiting
   */
  public T receive() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (elements.isEmpty() && !closed)
        changed.await();
      return take();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Receives the next element, waiting up to {@code timeout}.
   *
   * @return the next element, or null if the timeout elapsed or the pipe is closed and drained
   * @throws InterruptedException if interrupted while waiting
   */
  public T receive(long timeout, TimeUnit unit) throws InterruptedException {
    long remaining = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (elements.isEmpty() && !closed) {
        if (remaining <= 0)
          return null;
        remaining = changed.awaitNanos(remaining);
      }
      return take();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Closes the pipe. Elements already sent can still be received. Idempotent.
   */
  public void close() {
    lock.lock();
    try {
      closed = true;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "Pipe[capacity=" + capacity + "]";
  }

  private T take() {
    T element = elements.poll();
    if (element != null) {
      received++;
      changed.signalAll();
    }
    return element;
  }
}
