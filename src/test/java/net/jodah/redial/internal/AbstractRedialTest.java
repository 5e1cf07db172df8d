package net.jodah.redial.internal;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import net.jodah.redial.AmqpConnection;
import net.jodah.redial.AmqpError;
import net.jodah.redial.config.RedialPolicy;
import net.jodah.redial.event.DefaultRedialListener;
import net.jodah.redial.util.Duration;
import net.jodah.redial.util.Pipe;

import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;
import org.testng.annotations.BeforeMethod;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;

public abstract class AbstractRedialTest {
  protected static final Duration INTERVAL = Duration.millis(10);

  protected ConnectionFactory connectionFactory;
  protected Queue<Object> dialResults;
  protected RedialPolicy policy;
  protected ConnectionHandler connectionHandler;
  protected List<Duration> waits;
  protected Pipe<AmqpError> errors;
  protected Pipe<Boolean> done;

  /**
   * A mocked amqp-client connection whose shutdown listeners can be triggered. Like amqp-client, a
   * listener added after shutdown is called immediately.
   */
  protected static class MockConnection {
    final Connection delegate = mock(Connection.class);
    final List<ShutdownListener> listeners = new CopyOnWriteArrayList<ShutdownListener>();
    final AtomicReference<ShutdownSignalException> shutdownSignal =
        new AtomicReference<ShutdownSignalException>();

    MockConnection() throws IOException {
      doAnswer(new Answer<Void>() {
        @Override
        public Void answer(InvocationOnMock invocation) throws Throwable {
          ShutdownListener listener = invocation.getArgument(0);
          synchronized (MockConnection.this) {
            if (shutdownSignal.get() == null) {
              listeners.add(listener);
              return null;
            }
          }
          listener.shutdownCompleted(shutdownSignal.get());
          return null;
        }
      }).when(delegate).addShutdownListener(any(ShutdownListener.class));

      when(delegate.isOpen()).thenAnswer(new Answer<Boolean>() {
        @Override
        public Boolean answer(InvocationOnMock invocation) {
          return shutdownSignal.get() == null;
        }
      });

      doAnswer(new Answer<Void>() {
        @Override
        public Void answer(InvocationOnMock invocation) {
          shutdown(gracefulShutdownSignal());
          return null;
        }
      }).when(delegate).close();

      doAnswer(new Answer<Void>() {
        @Override
        public Void answer(InvocationOnMock invocation) {
          shutdown(gracefulShutdownSignal());
          return null;
        }
      }).when(delegate).abort();

      when(delegate.createChannel()).thenAnswer(new Answer<Channel>() {
        @Override
        public Channel answer(InvocationOnMock invocation) {
          Channel channel = mock(Channel.class);
          when(channel.getChannelNumber()).thenReturn(1);
          return channel;
        }
      });
    }

    void shutdown(ShutdownSignalException sse) {
      List<ShutdownListener> toNotify;
      synchronized (this) {
        if (!shutdownSignal.compareAndSet(null, sse))
          return;
        toNotify = new ArrayList<ShutdownListener>(listeners);
        listeners.clear();
      }
      for (ShutdownListener listener : toNotify)
        listener.shutdownCompleted(sse);
    }
  }

  @BeforeMethod
  protected void beforeMethod() throws Exception {
    connectionFactory = mock(ConnectionFactory.class);
    dialResults = new ConcurrentLinkedQueue<Object>();
    waits = new CopyOnWriteArrayList<Duration>();
    errors = new Pipe<AmqpError>();
    done = new Pipe<Boolean>();
    policy = new RedialPolicy().withInterval(INTERVAL).withRedialListeners(
        new DefaultRedialListener() {
          @Override
          public void onRedialAttempt(AmqpConnection connection, int attempts, Duration wait) {
            waits.add(wait);
          }
        });
    connectionHandler = null;

    when(connectionFactory.newConnection()).thenAnswer(new Answer<Connection>() {
      @Override
      public Connection answer(InvocationOnMock invocation) throws Throwable {
        Object result = dialResults.poll();
        if (result == null)
          throw new IOException("No dial result was mocked");
        if (result instanceof Exception)
          throw (Exception) result;
        return ((MockConnection) result).delegate;
      }
    });
  }

  /**
   * Queues the outcomes of successive dials: MockConnections to return or Exceptions to throw.
   */
  protected void mockDials(Object... results) {
    for (Object result : results)
      dialResults.add(result);
  }

  /**
   * Dials a connection handler through the mocked ConnectionFactory.
   */
  protected ConnectionHandler dial() throws IOException, TimeoutException {
    connectionHandler = new ConnectionHandler(DialTarget.uri("amqp://test-host", connectionFactory),
        policy);
    connectionHandler.dial();
    return connectionHandler;
  }

  protected AmqpError receiveError() throws InterruptedException {
    return errors.receive(5, TimeUnit.SECONDS);
  }

  protected Boolean receiveDone() throws InterruptedException {
    return done.receive(5, TimeUnit.SECONDS);
  }

  /**
   * Waits up to 5 seconds for the redial loop of the connection handler to end.
   */
  protected boolean awaitRedialEnded() throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (connectionHandler.isRedialing()) {
      if (System.nanoTime() > deadline)
        return false;
      Thread.sleep(10);
    }
    return true;
  }

  protected static ShutdownSignalException connectionForcedSignal() {
    Method m = new AMQP.Connection.Close.Builder().replyCode(320)
        .replyText("CONNECTION_FORCED - broker forced connection closure with reason 'shutdown'")
        .build();
    return new ShutdownSignalException(true, false, m, null);
  }

  protected static AmqpError connectionForcedError() {
    return new AmqpError(320,
        "CONNECTION_FORCED - broker forced connection closure with reason 'shutdown'", true, false);
  }

  protected static ShutdownSignalException gracefulShutdownSignal() {
    Method m = new AMQP.Connection.Close.Builder().replyCode(200).replyText("OK").build();
    return new ShutdownSignalException(true, true, m, null);
  }
}
