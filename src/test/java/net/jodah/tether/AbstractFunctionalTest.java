package net.jodah.tether;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import net.jodah.tether.config.Config;
import net.jodah.tether.config.RecoveryPolicies;
import net.jodah.tether.util.Duration;

import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;

public abstract class AbstractFunctionalTest {
  private static final AtomicInteger CHANNEL_NUMBERS = new AtomicInteger();

  protected Config config;
  protected ConnectionPool connectionPool;
  protected Connection connection;
  protected ChannelManager channelManager;
  private Map<Channel, List<ShutdownListener>> shutdownListeners;

  @BeforeMethod
  protected void beforeMethod() throws Exception {
    shutdownListeners = new ConcurrentHashMap<Channel, List<ShutdownListener>>();
    connection = mock(Connection.class, "test-connection");
    connectionPool = mock(ConnectionPool.class);
    when(connectionPool.checkoutConnection()).thenReturn(connection);
    config = new Config().withRecoveryPolicy(RecoveryPolicies.recoverEvery(Duration.millis(10)));
    channelManager = null;
  }

  @AfterMethod
  protected void afterMethod() throws Exception {
    if (channelManager != null)
      channelManager.close();
  }

  protected ChannelManager createChannelManager() throws IOException {
    channelManager = new ChannelManager(connectionPool, config);
    return channelManager;
  }

  /**
   * Returns a mock channel whose shutdown listeners can be completed via
   * {@link #shutdown(Channel, ShutdownSignalException)}.
   */
  protected Channel mockChannel() {
    final Channel channel = mock(Channel.class, "channel-" + CHANNEL_NUMBERS.incrementAndGet());
    final List<ShutdownListener> listeners = new CopyOnWriteArrayList<ShutdownListener>();
    shutdownListeners.put(channel, listeners);
    doAnswer(new Answer<Void>() {
      @Override
      public Void answer(InvocationOnMock invocation) {
        listeners.add(invocation.<ShutdownListener>getArgument(0));
        return null;
      }
    }).when(channel).addShutdownListener(any(ShutdownListener.class));
    doAnswer(new Answer<Void>() {
      @Override
      public Void answer(InvocationOnMock invocation) {
        listeners.remove(invocation.<ShutdownListener>getArgument(0));
        return null;
      }
    }).when(channel).removeShutdownListener(any(ShutdownListener.class));
    return channel;
  }

  /**
   * Mocks the connection to create the {@code channels} in order, repeating the last one.
   */
  protected void mockChannels(Channel first, Channel... rest) throws IOException {
    when(connection.createChannel()).thenReturn(first, rest);
  }

  protected int shutdownListenerCount(Channel channel) {
    return shutdownListeners.get(channel).size();
  }

  /** Completes the {@code channel}'s shutdown listeners with the {@code e}. */
  protected void shutdown(Channel channel, ShutdownSignalException e) {
    for (ShutdownListener listener : shutdownListeners.get(channel))
      listener.shutdownCompleted(e);
  }

  protected ShutdownSignalException channelShutdownSignal() {
    Method m = new AMQP.Channel.Close.Builder().replyCode(311).build();
    return new ShutdownSignalException(false, false, m, null);
  }

  protected ShutdownSignalException connectionShutdownSignal() {
    Method m = new AMQP.Connection.Close.Builder().replyCode(320).build();
    return new ShutdownSignalException(true, false, m, null);
  }

  protected ShutdownSignalException applicationShutdownSignal() {
    Method m = new AMQP.Channel.Close.Builder().replyCode(200).build();
    return new ShutdownSignalException(false, true, m, null);
  }

  /**
   * Waits up to {@code timeoutMillis} for the manager to complete the {@code expected} number of
   * recoveries.
   */
  protected void awaitReconnections(long expected, long timeoutMillis) throws Exception {
    long deadline = System.currentTimeMillis() + timeoutMillis;
    while (channelManager.getReconnectionCount() < expected) {
      if (System.currentTimeMillis() > deadline)
        throw new TimeoutException(String.format("Expected %s reconnections but was %s", expected,
            channelManager.getReconnectionCount()));
      Thread.sleep(2);
    }
  }

  /**
   * Waits up to {@code timeoutMillis} for the manager to reach the {@code expected} state.
   */
  protected void awaitState(ChannelManager.State expected, long timeoutMillis) throws Exception {
    long deadline = System.currentTimeMillis() + timeoutMillis;
    while (channelManager.getState() != expected) {
      if (System.currentTimeMillis() > deadline)
        throw new TimeoutException(String.format("Expected %s but was %s", expected,
            channelManager.getState()));
      Thread.sleep(2);
    }
  }
}
