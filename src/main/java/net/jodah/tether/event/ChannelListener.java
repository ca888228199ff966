package net.jodah.tether.event;

import com.rabbitmq.client.Channel;

/**
 * Listens for lifecycle events of a managed {@link Channel}. Callbacks run on the manager's
 * background thread and must not block.
 * 
 * @author Jonathan Halterman
 */
public interface ChannelListener {
  /**
   * Called when the manager acquires its initial {@code channel}.
   */
  void onCreate(Channel channel);

  /**
   * Called when recovery of the {@code channel} is started because of the {@code cause}.
   */
  void onRecoveryStarted(Channel channel, Throwable cause);

  /**
   * Called each time an attempt to replace the {@code channel} fails. Recovery will be attempted
   * again.
   */
  void onRecoveryFailure(Channel channel, Throwable failure);

  /**
   * Called when the {@code channel} has been installed in place of a failed channel, before
   * subscribers are notified.
   */
  void onRecovery(Channel channel);

  /**
   * Called when the {@code channel} is closed for good, either gracefully or via the manager.
   */
  void onClose(Channel channel);
}
