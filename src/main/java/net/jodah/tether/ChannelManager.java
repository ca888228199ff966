package net.jodah.tether;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import net.jodah.tether.config.Config;
import net.jodah.tether.config.RecoveryPolicies;
import net.jodah.tether.event.ChannelListener;
import net.jodah.tether.event.Dispatcher;
import net.jodah.tether.event.Subscription;
import net.jodah.tether.internal.ChannelWatch;
import net.jodah.tether.internal.LifecycleSignal;
import net.jodah.tether.internal.RecoveryStats;
import net.jodah.tether.internal.util.Assert;
import net.jodah.tether.internal.util.Exceptions;
import net.jodah.tether.internal.util.concurrent.InterruptableWaiter;
import net.jodah.tether.internal.util.concurrent.NamedThreadFactory;
import net.jodah.tether.util.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

/**
 * Owns a channel obtained from a {@link ConnectionPool} and keeps it usable. When the channel is
 * closed unexpectedly or one of its consumers is cancelled by the broker, the manager replaces the
 * channel, retrying at the configured {@link Config#getRecoveryPolicy() recovery policy} until it
 * succeeds or the manager is closed. Each completed recovery is announced to
 * {@link #subscribe() subscribers} with the exception that caused it, after which consumers
 * should re-register against the new channel.
 *
 * <p>
 * A channel closed by the application is not recovered and leaves the manager {@link State#CLOSED
 * closed}.
 *
 * @author Jonathan Halterman
 */
public class ChannelManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ChannelManager.class);
  private static final AtomicInteger MANAGER_COUNTER = new AtomicInteger();

  /** Lifecycle state of a manager. */
  public enum State {
    /** The current channel is in use. */
    ACTIVE,
    /** The channel failed and is being replaced. */
    RECOVERING,
    /** The channel was closed for good. */
    CLOSED
  }

  private final String name;
  private final ConnectionPool connectionPool;
  private final Config config;
  private final Dispatcher<Exception> dispatcher;
  private final ReadWriteLock channelLock = new ReentrantReadWriteLock();
  private final AtomicLong reconnectionCount = new AtomicLong();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final InterruptableWaiter retryWaiter = new InterruptableWaiter();
  private final ExecutorService executor;
  private volatile ChannelWatch watch;
  private volatile State state = State.ACTIVE;
  private volatile Thread watchThread;

  /**
   * Creates a manager that recovers its channel every {@code retryInterval}.
   *
   * @throws NullPointerException if {@code connectionPool} or {@code retryInterval} are null
   * @throws ChannelAcquisitionException if the initial channel could not be obtained
   */
  public ChannelManager(ConnectionPool connectionPool, Duration retryInterval)
      throws ChannelAcquisitionException {
    this(connectionPool, new Config().withRecoveryPolicy(RecoveryPolicies.recoverEvery(Assert
        .notNull(retryInterval, "retryInterval"))));
  }

  /**
   * Creates a manager for the {@code config}. The initial channel is obtained immediately and is not
   * retried.
   *
   * @throws NullPointerException if {@code connectionPool} or {@code config} are null
   * @throws ChannelAcquisitionException if the initial channel could not be obtained
   */
  public ChannelManager(ConnectionPool connectionPool, Config config)
      throws ChannelAcquisitionException {
    this.connectionPool = Assert.notNull(connectionPool, "connectionPool");
    this.config = new Config(Assert.notNull(config, "config"));
    name = String.format("channel-manager-%s", MANAGER_COUNTER.incrementAndGet());
    dispatcher = new Dispatcher<Exception>(this.config.getSubscriberBufferSize());

    Channel channel = acquireChannel();
    watch = new ChannelWatch(channel);
    executor = Executors.newSingleThreadExecutor(new NamedThreadFactory(name + "-watch-%s"));
    log.info("Created {} with {}", this, channel);
    for (ChannelListener listener : this.config.getChannelListeners())
      try {
        listener.onCreate(channel);
      } catch (Exception e) {
        log.warn("Channel listener {} failed on create", listener, e);
      }

    startWatching(watch);
  }

  /**
   * Returns the current channel. A caller holding a channel that is later replaced is not
   * interrupted; its own next invocation fails, after which it should obtain the current channel
   * again.
   */
  public Channel getChannel() {
    channelLock.readLock().lock();
    try {
      return watch.getChannel();
    } finally {
      channelLock.readLock().unlock();
    }
  }

  /**
   * Returns the number of completed recoveries.
   */
  public long getReconnectionCount() {
    return reconnectionCount.get();
  }

  public State getState() {
    return state;
  }

  /**
   * Handles the broker's cancellation of the consumer with the {@code consumerTag} on the
   * {@code channel}, triggering recovery if {@code channel} is still the current channel.
   */
  public void handleCancel(Channel channel, String consumerTag) {
    ChannelWatch current = watch;
    if (current.getChannel() == channel) {
      log.warn("Consumer {} on {} was cancelled by the server", consumerTag, channel);
      current.cancelled(consumerTag);
    } else
      log.debug("Ignoring cancellation of consumer {} on replaced {}", consumerTag, channel);
  }

  /**
   * Returns a new subscription to recovery events. Each event is the exception that caused the
   * recovery, and is delivered after the replacement channel is installed.
   */
  public Subscription<Exception> subscribe() {
    return dispatcher.addSubscriber();
  }

  /**
   * Calls the {@code callable} with the current channel, preventing recovery from replacing the
   * channel until the call completes.
   *
   * @throws NullPointerException if {@code callable} is null
   * @throws IllegalStateException if the manager is closed
   * @throws IOException if the {@code callable} fails
   */
  public <T> T withChannel(ChannelCallable<T> callable) throws IOException {
    Assert.notNull(callable, "callable");
    channelLock.readLock().lock();
    try {
      Assert.state(state != State.CLOSED, "%s is closed", this);
      return callable.call(watch.getChannel());
    } finally {
      channelLock.readLock().unlock();
    }
  }

  /**
   * Closes the manager, stopping any recovery in progress, then closes the current channel.
   * Subsequent calls have no effect.
   *
   * @throws IOException if the channel could not be closed
   * @throws TimeoutException if closing the channel timed out
   */
  @Override
  public void close() throws IOException, TimeoutException {
    if (!closed.compareAndSet(false, true)) {
      log.debug("{} is already closed", this);
      return;
    }

    log.info("Closing {}", this);
    executor.shutdownNow();
    retryWaiter.interruptWaiters();
    if (Thread.currentThread() != watchThread)
      awaitWatchTermination();

    Channel channel = null;
    boolean wasClosed = true;
    channelLock.writeLock().lock();
    try {
      ChannelWatch current = watch;
      current.detach();
      channel = current.getChannel();
      wasClosed = state == State.CLOSED;
      state = State.CLOSED;
      try {
        channel.close();
      } catch (AlreadyClosedException e) {
        log.debug("{} was already closed", channel);
      }
      log.info("Closed {}", this);
    } finally {
      channelLock.writeLock().unlock();
      dispatcher.close();
      if (!wasClosed)
        notifyClose(channel);
    }
  }

  @Override
  public String toString() {
    return name;
  }

  /**
   * Returns a new channel from a checked out connection.
   */
  private Channel acquireChannel() throws ChannelAcquisitionException {
    Connection connection;
    try {
      connection = connectionPool.checkoutConnection();
    } catch (Exception e) {
      throw new ChannelAcquisitionException(String.format(
          "Failed to check out a connection for %s", this), e);
    }

    Channel channel;
    try {
      channel = connection.createChannel();
    } catch (Exception e) {
      throw new ChannelAcquisitionException(String.format("Failed to create a channel on %s",
          connection), e);
    } finally {
      connectionPool.checkinConnection();
    }

    // Channel numbers are exhausted
    if (channel == null)
      throw new ChannelAcquisitionException(String.format("No channel available on %s",
          connection));
    return channel;
  }

  private void awaitWatchTermination() {
    Duration closeTimeout = config.getCloseTimeout();
    try {
      if (!executor.awaitTermination(closeTimeout.toNanos(), TimeUnit.NANOSECONDS))
        log.warn("Timed out after {} waiting for {} to stop watching", closeTimeout, this);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private void closeGracefully(ChannelWatch closedWatch) {
    log.info("{} of {} was closed gracefully", closedWatch.getChannel(), this);
    state = State.CLOSED;
    executor.shutdown();
    dispatcher.close();
    notifyClose(closedWatch.getChannel());
  }

  /**
   * Recovers the channel, pausing between attempts per the recovery policy, until an attempt
   * succeeds or the manager is closed.
   *
   * @return whether the channel was recovered
   */
  private boolean recover(ChannelWatch failedWatch, Exception cause) {
    state = State.RECOVERING;
    notifyRecoveryStarted(failedWatch.getChannel(), cause);
    RecoveryStats stats = new RecoveryStats(config.getRecoveryPolicy());

    while (!closed.get()) {
      Duration waitTime = stats.getWaitTime();
      log.info("Waiting {} to recover {}", waitTime, this);
      try {
        retryWaiter.await(waitTime);
      } catch (InterruptedException e) {
        log.debug("Recovery of {} was interrupted", this);
        Thread.currentThread().interrupt();
        return false;
      }

      ChannelWatch recoveredWatch;
      try {
        recoveredWatch = reconnect();
      } catch (ChannelAcquisitionException e) {
        stats.incrementAttempts();
        log.error("Failed to recover {} after {} attempts over {}", this, stats.getAttempts(),
            stats.getElapsedTime(), e);
        notifyRecoveryFailure(failedWatch.getChannel(), e);
        continue;
      }

      if (recoveredWatch == null)
        return false;

      reconnectionCount.incrementAndGet();
      state = State.ACTIVE;
      startWatching(recoveredWatch);
      notifyRecovery(recoveredWatch.getChannel());
      return true;
    }

    return false;
  }

  /**
   * Replaces the current channel with a new one, closing the replaced channel on a best effort
   * basis.
   *
   * @return the watch of the new channel, else null if the manager was closed
   */
  private ChannelWatch reconnect() throws ChannelAcquisitionException {
    channelLock.writeLock().lock();
    try {
      if (closed.get())
        return null;

      Channel channel = acquireChannel();
      ChannelWatch staleWatch = watch;
      staleWatch.detach();
      try {
        staleWatch.getChannel().close();
      } catch (Exception e) {
        log.warn("Failed to close {} while recovering {}", staleWatch.getChannel(), this, e);
      }

      watch = new ChannelWatch(channel);
      log.info("Replaced {} with {} for {}", staleWatch.getChannel(), channel, this);
      return watch;
    } finally {
      channelLock.writeLock().unlock();
    }
  }

  private void startWatching(final ChannelWatch channelWatch) {
    try {
      executor.execute(new Runnable() {
        @Override
        public void run() {
          watch(channelWatch);
        }
      });
    } catch (RejectedExecutionException e) {
      log.debug("Not watching {} since {} is closed", channelWatch.getChannel(), this);
    }
  }

  /**
   * Waits for the {@code channelWatch} to signal, then either closes the manager or recovers the
   * channel and notifies subscribers.
   */
  private void watch(ChannelWatch channelWatch) {
    watchThread = Thread.currentThread();
    LifecycleSignal signal;
    try {
      signal = channelWatch.awaitSignal();
    } catch (InterruptedException e) {
      log.debug("Stopped watching {} of {}", channelWatch.getChannel(), this);
      return;
    }

    if (closed.get())
      return;

    if (signal.isGraceful()) {
      closeGracefully(channelWatch);
      return;
    }

    Exception cause = signal.getCause();
    if (Exceptions.isCausedByConnectionClosure(cause))
      log.error("The connection of {} was closed unexpectedly, recovering {}",
          channelWatch.getChannel(), this, cause);
    else
      log.error("{} of {} failed, recovering", channelWatch.getChannel(), this, cause);

    if (recover(channelWatch, cause)) {
      log.info("Recovered {} after {}", this, signal);
      int notified = dispatcher.dispatch(cause);
      log.debug("Notified {} subscribers of the recovery of {}", notified, this);
    }
  }

  private void notifyClose(Channel channel) {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onClose(channel);
      } catch (Exception e) {
        log.warn("Channel listener {} failed on close", listener, e);
      }
  }

  private void notifyRecovery(Channel channel) {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onRecovery(channel);
      } catch (Exception e) {
        log.warn("Channel listener {} failed on recovery", listener, e);
      }
  }

  private void notifyRecoveryFailure(Channel channel, Exception failure) {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onRecoveryFailure(channel, failure);
      } catch (Exception e) {
        log.warn("Channel listener {} failed on recovery failure", listener, e);
      }
  }

  private void notifyRecoveryStarted(Channel channel, Exception cause) {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onRecoveryStarted(channel, cause);
      } catch (Exception e) {
        log.warn("Channel listener {} failed on recovery start", listener, e);
      }
  }
}
