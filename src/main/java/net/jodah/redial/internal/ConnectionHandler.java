package net.jodah.redial.internal;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import net.jodah.redial.AmqpChannel;
import net.jodah.redial.AmqpConnection;
import net.jodah.redial.AmqpError;
import net.jodah.redial.CloseEvent;
import net.jodah.redial.config.RedialPolicy;
import net.jodah.redial.internal.util.Assert;
import net.jodah.redial.internal.util.concurrent.InterruptableWaiter;
import net.jodah.redial.internal.util.concurrent.NamedThreadFactory;
import net.jodah.redial.util.Pipe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

/**
 * Owns the underlying amqp-client connection, replacing it in place each time it is redialed.
 *
 * @author Jonathan Halterman
 */
public class ConnectionHandler implements AmqpConnection {
  private static final Logger LOG = LoggerFactory.getLogger(ConnectionHandler.class);
  private static final AtomicInteger CONNECTION_COUNTER = new AtomicInteger();
  static final ExecutorService REDIAL_EXECUTORS =
      Executors.newCachedThreadPool(new NamedThreadFactory("redial-%s"));

  final RedialPolicy policy;
  final RedialStats stats;
  final InterruptableWaiter retryWaiter = new InterruptableWaiter();
  private final DialTarget target;
  private final String name;
  private final AtomicBoolean redialing = new AtomicBoolean();
  private volatile Connection delegate;
  private volatile boolean closed;

  static {
    Runtime.getRuntime().addShutdownHook(new Thread() {
      @Override
      public void run() {
        REDIAL_EXECUTORS.shutdownNow();
        CloseNotifier.NOTIFY_EXECUTORS.shutdownNow();
      }
    });
  }

  public ConnectionHandler(DialTarget target, RedialPolicy policy) {
    this.target = Assert.notNull(target, "target");
    this.policy = Assert.notNull(policy, "policy").copy();
    this.stats = new RedialStats(this.policy);
    String configuredName = target.getConfig() == null ? null : target.getConfig().getName();
    this.name = configuredName == null ? String.format("cxn-%s",
        CONNECTION_COUNTER.incrementAndGet()) : configuredName;
  }

  /**
   * Performs the initial dial. Failures are not retried.
   *
   * @throws IOException if the connection could not be opened
   * @throws TimeoutException if the connection attempt timed out
   */
  public void dial() throws IOException, TimeoutException {
    LOG.info("Creating connection {} to {}", name, target);
    try {
      delegate = target.dial();
    } catch (IOException e) {
      LOG.error("Failed to create connection {}", name, e);
      throw e;
    }
    LOG.info("Created connection {} to {}", name, target);
  }

  @Override
  public AmqpChannel channel() throws IOException {
    Channel channel = delegate.createChannel();
    if (channel == null)
      throw new IOException("No channel numbers are available on connection " + name);
    ChannelHandler channelHandler = new ChannelHandler(this, channel);
    LOG.debug("Created {}", channelHandler);
    return channelHandler;
  }

  @Override
  public Pipe<CloseEvent> notifyClose(Pipe<CloseEvent> closeEvents) {
    Assert.notNull(closeEvents, "closeEvents");
    return CloseNotifier.watch(delegate, closeEvents);
  }

  @Override
  public void autoRedial(Pipe<AmqpError> errors, Pipe<Boolean> done) {
    Assert.notNull(errors, "errors");
    Assert.notNull(done, "done");
    Assert.state(delegate != null, "Connection %s was never dialed", name);
    Assert.state(redialing.compareAndSet(false, true), "Connection %s is already redialing", name);
    if (errors.capacity() != 0)
      LOG.warn("Errors for {} are buffered; redial attempts will not wait for them to be received",
          name);

    try {
      REDIAL_EXECUTORS.execute(new RedialLoop(this, errors, done));
    } catch (RuntimeException e) {
      redialing.set(false);
      throw e;
    }
  }

  @Override
  public int getRedialAttempts() {
    return stats.getAttempts();
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public boolean isOpen() {
    return !closed && delegate != null && delegate.isOpen();
  }

  @Override
  public void close() throws IOException {
    closed = true;
    retryWaiter.cancel();
    Connection connection = delegate;
    if (connection != null && connection.isOpen()) {
      try {
        connection.close();
      } catch (AlreadyClosedException e) {
        LOG.debug("Connection {} was already closed", name);
      }
    }
    LOG.info("Closed connection {}", name);
  }

  @Override
  public String toString() {
    return name;
  }

  boolean isClosed() {
    return closed;
  }

  boolean isRedialing() {
    return redialing.get();
  }

  Connection getDelegate() {
    return delegate;
  }

  /**
   * Dials a replacement for the underlying connection and watches it for its closure.
   *
   * @return the watch on the new connection's closure, else null if this connection was closed
   *         while dialing
   */
  synchronized Pipe<CloseEvent> redial() throws IOException, TimeoutException {
    LOG.info("Redialing connection {} to {}", name, target);
    Connection connection = target.dial();
    delegate = connection;
    if (closed) {
      LOG.info("Closing redialed connection {} since it was closed while redialing", name);
      connection.abort();
      return null;
    }

    LOG.info("Redialed connection {} to {}", name, target);
    return notifyClose(new Pipe<CloseEvent>());
  }

  void redialEnded() {
    redialing.set(false);
  }
}
