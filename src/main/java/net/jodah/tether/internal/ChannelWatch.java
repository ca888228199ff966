package net.jodah.tether.internal;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Collects the lifecycle signals of one channel so that a single watcher can wait on both shutdowns
 * and consumer cancellations.
 * 
 * @author Jonathan Halterman
 */
public final class ChannelWatch implements ShutdownListener {
  private final Channel channel;
  private final BlockingQueue<LifecycleSignal> signals = new LinkedBlockingQueue<LifecycleSignal>();

  /**
   * Creates a watch on the {@code channel}, registering for its shutdown. A channel that is already
   * shut down signals immediately.
   */
  public ChannelWatch(Channel channel) {
    this.channel = channel;
    channel.addShutdownListener(this);
  }

  /**
   * Waits for and returns the next signal.
   * 
   * @throws InterruptedException if interrupted while waiting
   */
  public LifecycleSignal awaitSignal() throws InterruptedException {
    return signals.take();
  }

  /**
   * Records the broker cancelling a consumer on the channel.
   */
  public void cancelled(String consumerTag) {
    signals.offer(LifecycleSignal.cancelled(consumerTag));
  }

  /**
   * Stops listening for shutdowns of the channel.
   */
  public void detach() {
    channel.removeShutdownListener(this);
  }

  public Channel getChannel() {
    return channel;
  }

  @Override
  public void shutdownCompleted(ShutdownSignalException cause) {
    signals.offer(LifecycleSignal.closed(cause));
  }

  @Override
  public String toString() {
    return "watch of " + channel;
  }
}
