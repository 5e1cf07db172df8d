package net.jodah.redial.internal;

import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

import java.io.IOException;
import java.net.ConnectException;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

import net.jodah.redial.AmqpConnection;
import net.jodah.redial.AmqpError;
import net.jodah.redial.config.ErrorReporting;
import net.jodah.redial.event.DefaultRedialListener;
import net.jodah.redial.util.Duration;

import org.testng.annotations.Test;

/**
 * Tests the redial loop against mocked connections. Each test dials a connection, closes it with a
 * shutdown signal, then asserts what was published to the errors and done pipes.
 */
@Test
public class AutoRedialTest extends AbstractRedialTest {
  public void shouldNotRedialOnGracefulClose() throws Throwable {
    mockDials(new MockConnection());
    dial().autoRedial(errors, done);

    connectionHandler.close();

    assertTrue(awaitRedialEnded());
    assertNull(errors.receive(100, TimeUnit.MILLISECONDS));
    assertNull(done.receive(100, TimeUnit.MILLISECONDS));
    verify(connectionFactory, times(1)).newConnection();
  }

  public void shouldPublishCloseErrorBeforeFirstAttempt() throws Throwable {
    MockConnection initial = new MockConnection();
    MockConnection redialed = new MockConnection();
    mockDials(initial, redialed);
    dial().autoRedial(errors, done);

    initial.shutdown(connectionForcedSignal());

    AmqpError error = receiveError();
    assertEquals(error.getCode(), 320);
    assertTrue(error.getReason().startsWith("CONNECTION_FORCED"));
    assertTrue(error.isServer());
    assertEquals(receiveDone(), Boolean.TRUE);
    assertEquals(waits, Arrays.asList(Duration.ZERO));
    assertSame(connectionHandler.getDelegate(), redialed.delegate);
    assertEquals(connectionHandler.getRedialAttempts(), 0);
  }

  public void shouldRepublishOriginalErrorForEachAttempt() throws Throwable {
    MockConnection initial = new MockConnection();
    mockDials(initial, new ConnectException("Connection refused"),
        new ConnectException("Connection refused"), new ConnectException("Connection refused"),
        new MockConnection());
    dial().autoRedial(errors, done);

    initial.shutdown(connectionForcedSignal());

    for (int i = 0; i < 4; i++)
      assertEquals(receiveError(), connectionForcedError());
    assertEquals(receiveDone(), Boolean.TRUE);
    assertEquals(waits, Arrays.asList(Duration.ZERO, INTERVAL.multipliedBy(1),
        INTERVAL.multipliedBy(2), INTERVAL.multipliedBy(3)));
    assertEquals(connectionHandler.getRedialAttempts(), 3);
    assertNull(errors.receive(100, TimeUnit.MILLISECONDS));
    verify(connectionFactory, times(5)).newConnection();
  }

  public void shouldPublishLatestFailureWhenConfigured() throws Throwable {
    policy.withErrorReporting(ErrorReporting.LATEST);
    MockConnection initial = new MockConnection();
    mockDials(initial, new ConnectException("Connection refused"),
        new ConnectException("Connection refused"), new MockConnection());
    dial().autoRedial(errors, done);

    initial.shutdown(connectionForcedSignal());

    AmqpError refused = new AmqpError(501, "Connection refused", false, false);
    assertEquals(receiveError(), connectionForcedError());
    assertEquals(receiveError(), refused);
    assertEquals(receiveError(), refused);
    assertEquals(receiveDone(), Boolean.TRUE);
  }

  public void shouldRearmAfterEachRedial() throws Throwable {
    MockConnection first = new MockConnection();
    MockConnection second = new MockConnection();
    MockConnection third = new MockConnection();
    mockDials(first, second, third);
    dial().autoRedial(errors, done);

    first.shutdown(connectionForcedSignal());
    assertEquals(receiveError(), connectionForcedError());
    assertEquals(receiveDone(), Boolean.TRUE);

    second.shutdown(connectionForcedSignal());
    assertEquals(receiveError(), connectionForcedError());
    assertEquals(receiveDone(), Boolean.TRUE);

    assertSame(connectionHandler.getDelegate(), third.delegate);
    assertTrue(connectionHandler.isRedialing());
    verify(connectionFactory, times(3)).newConnection();
  }

  public void shouldEndRedialingOnGracefulCloseAfterRedial() throws Throwable {
    MockConnection initial = new MockConnection();
    mockDials(initial, new MockConnection());
    dial().autoRedial(errors, done);

    initial.shutdown(connectionForcedSignal());
    receiveError();
    assertEquals(receiveDone(), Boolean.TRUE);

    connectionHandler.close();

    assertTrue(awaitRedialEnded());
    assertNull(errors.receive(100, TimeUnit.MILLISECONDS));
    assertNull(done.receive(100, TimeUnit.MILLISECONDS));
  }

  public void shouldCarryAttemptsAcrossRedialCycles() throws Throwable {
    MockConnection first = new MockConnection();
    MockConnection second = new MockConnection();
    mockDials(first, new ConnectException("Connection refused"), second,
        new ConnectException("Connection refused"), new MockConnection());
    dial().autoRedial(errors, done);

    first.shutdown(connectionForcedSignal());
    receiveError();
    receiveError();
    assertEquals(receiveDone(), Boolean.TRUE);
    assertEquals(connectionHandler.getRedialAttempts(), 1);

    second.shutdown(connectionForcedSignal());
    receiveError();
    receiveError();
    assertEquals(receiveDone(), Boolean.TRUE);

    assertEquals(waits, Arrays.asList(Duration.ZERO, INTERVAL.multipliedBy(1),
        INTERVAL.multipliedBy(1), INTERVAL.multipliedBy(2)));
    assertEquals(connectionHandler.getRedialAttempts(), 2);
  }

  public void shouldResetAttemptsAfterRedialWhenConfigured() throws Throwable {
    policy.withResetAttemptsOnRedial(true);
    MockConnection first = new MockConnection();
    MockConnection second = new MockConnection();
    mockDials(first, new ConnectException("Connection refused"), second,
        new ConnectException("Connection refused"), new MockConnection());
    dial().autoRedial(errors, done);

    first.shutdown(connectionForcedSignal());
    receiveError();
    receiveError();
    assertEquals(receiveDone(), Boolean.TRUE);
    assertEquals(connectionHandler.getRedialAttempts(), 0);

    second.shutdown(connectionForcedSignal());
    receiveError();
    receiveError();
    assertEquals(receiveDone(), Boolean.TRUE);

    assertEquals(waits, Arrays.asList(Duration.ZERO, INTERVAL.multipliedBy(1), Duration.ZERO,
        INTERVAL.multipliedBy(1)));
  }

  public void shouldNotRedialUntilErrorIsReceived() throws Throwable {
    MockConnection initial = new MockConnection();
    mockDials(initial, new MockConnection());
    dial().autoRedial(errors, done);

    initial.shutdown(connectionForcedSignal());
    Thread.sleep(200);
    verify(connectionFactory, times(1)).newConnection();

    assertEquals(receiveError(), connectionForcedError());
    assertEquals(receiveDone(), Boolean.TRUE);
    verify(connectionFactory, times(2)).newConnection();
  }

  public void shouldStopRedialingWhenClosedDuringBackoff() throws Throwable {
    policy.withInterval(Duration.seconds(30));
    MockConnection initial = new MockConnection();
    mockDials(initial, new ConnectException("Connection refused"));
    dial().autoRedial(errors, done);

    initial.shutdown(connectionForcedSignal());
    receiveError();
    receiveError();
    Thread.sleep(100);

    connectionHandler.close();

    assertTrue(awaitRedialEnded());
    assertNull(done.receive(100, TimeUnit.MILLISECONDS));
    verify(connectionFactory, times(2)).newConnection();
  }

  public void shouldDetectNextClosureWhileDoneIsUndrained() throws Throwable {
    MockConnection first = new MockConnection();
    MockConnection second = new MockConnection();
    MockConnection third = new MockConnection();
    mockDials(first, second, third);
    dial().autoRedial(errors, done);

    first.shutdown(connectionForcedSignal());
    assertEquals(receiveError(), connectionForcedError());

    second.shutdown(connectionForcedSignal());
    assertEquals(receiveError(), connectionForcedError());

    assertEquals(receiveDone(), Boolean.TRUE);
    assertEquals(receiveDone(), Boolean.TRUE);
    assertSame(connectionHandler.getDelegate(), third.delegate);
  }

  public void shouldStopRedialingWhenClosedBeforeBackoffStarts() throws Throwable {
    policy.withInterval(Duration.seconds(30)).withRedialListeners(new DefaultRedialListener() {
      @Override
      public void onRedialAttempt(AmqpConnection connection, int attempts, Duration wait) {
        if (attempts == 1)
          try {
            connection.close();
          } catch (IOException e) {
            throw new IllegalStateException(e);
          }
      }
    });
    MockConnection initial = new MockConnection();
    mockDials(initial, new ConnectException("Connection refused"));
    dial().autoRedial(errors, done);

    initial.shutdown(connectionForcedSignal());
    receiveError();
    receiveError();

    assertTrue(awaitRedialEnded());
    assertNull(done.receive(100, TimeUnit.MILLISECONDS));
    verify(connectionFactory, times(2)).newConnection();
  }

  public void shouldEndRedialingWhenErrorsPipeIsClosed() throws Throwable {
    MockConnection initial = new MockConnection();
    mockDials(initial, new MockConnection());
    dial().autoRedial(errors, done);
    errors.close();

    initial.shutdown(connectionForcedSignal());

    assertTrue(awaitRedialEnded());
    assertNull(done.receive(100, TimeUnit.MILLISECONDS));
    verify(connectionFactory, times(1)).newConnection();
  }

  @Test(expectedExceptions = IllegalStateException.class)
  public void shouldRejectSecondRedialLoop() throws Throwable {
    mockDials(new MockConnection());
    dial().autoRedial(errors, done);
    connectionHandler.autoRedial(errors, done);
  }

  public void shouldAllowRedialAgainAfterLoopEnded() throws Throwable {
    MockConnection initial = new MockConnection();
    mockDials(initial);
    dial().autoRedial(errors, done);
    initial.shutdown(gracefulShutdownSignal());
    assertTrue(awaitRedialEnded());

    connectionHandler.autoRedial(errors, done);
    assertTrue(awaitRedialEnded());
    assertFalse(connectionHandler.isRedialing());
  }
}
