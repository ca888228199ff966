package net.jodah.tether.internal;

import net.jodah.tether.ChannelCancelledException;

import com.rabbitmq.client.ShutdownSignalException;

/**
 * A close or cancel event observed for a channel.
 * 
 * @author Jonathan Halterman
 */
public final class LifecycleSignal {
  private final Exception cause;
  private final boolean graceful;

  private LifecycleSignal(Exception cause, boolean graceful) {
    this.cause = cause;
    this.graceful = graceful;
  }

  /**
   * Returns a signal for a channel shutdown. Shutdowns initiated by the application are graceful.
   */
  public static LifecycleSignal closed(ShutdownSignalException shutdownSignal) {
    return new LifecycleSignal(shutdownSignal, shutdownSignal.isInitiatedByApplication());
  }

  /**
   * Returns a signal for the broker cancelling the consumer with the {@code consumerTag}.
   */
  public static LifecycleSignal cancelled(String consumerTag) {
    return new LifecycleSignal(new ChannelCancelledException(consumerTag), false);
  }

  /**
   * Returns the exception describing the event.
   */
  public Exception getCause() {
    return cause;
  }

  /**
   * Returns whether the channel was closed intentionally and should not be recovered.
   */
  public boolean isGraceful() {
    return graceful;
  }

  @Override
  public String toString() {
    return graceful ? "graceful close" : cause.toString();
  }
}
