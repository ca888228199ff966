package net.jodah.tether.config;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;

import net.jodah.tether.event.ChannelListener;
import net.jodah.tether.internal.util.Assert;
import net.jodah.tether.util.Duration;

/**
 * Channel manager configuration. Changes are reflected in the managers created with this
 * configuration, and in any {@link #Config(Config) child} configuration that does not override
 * them.
 *
 * @author Jonathan Halterman
 */
public class Config {
  /** Subscriber buffer size used when none is configured. */
  public static final int DEFAULT_SUBSCRIBER_BUFFER_SIZE = 1;
  /** Close timeout used when none is configured. */
  public static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.seconds(5);

  private final Config parent;
  private RecoveryPolicy recoveryPolicy;
  private Collection<ChannelListener> channelListeners;
  private Integer subscriberBufferSize;
  private Duration closeTimeout;

  public Config() {
    parent = null;
  }

  /**
   * Creates a new Config object that inherits configuration from the {@code parent}.
   *
   * @throws NullPointerException if {@code parent} is null
   */
  public Config(Config parent) {
    this.parent = Assert.notNull(parent, "parent");
  }

  /**
   * Returns the channel listeners, else an empty collection if none are configured.
   */
  public Collection<ChannelListener> getChannelListeners() {
    return channelListeners != null ? channelListeners : parent != null ? parent
        .getChannelListeners() : Collections.<ChannelListener>emptyList();
  }

  /**
   * Returns how long {@code close()} waits for background recovery work to stop.
   *
   * @see #withCloseTimeout(Duration)
   */
  public Duration getCloseTimeout() {
    return closeTimeout != null ? closeTimeout : parent != null ? parent.getCloseTimeout()
        : DEFAULT_CLOSE_TIMEOUT;
  }

  /**
   * Returns the recovery policy, defaulting to {@link RecoveryPolicies#recoverAlways()}.
   *
   * @see #withRecoveryPolicy(RecoveryPolicy)
   */
  public RecoveryPolicy getRecoveryPolicy() {
    if (recoveryPolicy != null)
      return recoveryPolicy;
    if (parent != null)
      return parent.getRecoveryPolicy();
    recoveryPolicy = RecoveryPolicies.recoverAlways();
    return recoveryPolicy;
  }

  /**
   * Returns the number of undelivered recovery events each subscription buffers before further
   * events are dropped for it.
   *
   * @see #withSubscriberBufferSize(int)
   */
  public int getSubscriberBufferSize() {
    return subscriberBufferSize != null ? subscriberBufferSize.intValue() : parent != null ? parent
        .getSubscriberBufferSize() : DEFAULT_SUBSCRIBER_BUFFER_SIZE;
  }

  /**
   * Sets the listeners to notify of channel lifecycle events.
   */
  public Config withChannelListeners(ChannelListener... channelListeners) {
    this.channelListeners = Arrays.asList(channelListeners);
    return this;
  }

  /**
   * Sets how long {@code close()} waits for background recovery work to stop before closing the
   * channel anyway.
   *
   * @throws NullPointerException if {@code closeTimeout} is null
   */
  public Config withCloseTimeout(Duration closeTimeout) {
    this.closeTimeout = Assert.notNull(closeTimeout, "closeTimeout");
    return this;
  }

  /**
   * Sets the policy that paces recovery attempts after an unexpected channel closure or consumer
   * cancellation.
   *
   * @throws NullPointerException if {@code recoveryPolicy} is null
   */
  public Config withRecoveryPolicy(RecoveryPolicy recoveryPolicy) {
    this.recoveryPolicy = Assert.notNull(recoveryPolicy, "recoveryPolicy");
    return this;
  }

  /**
   * Sets the number of recovery events each subscription buffers.
   *
   * @throws IllegalArgumentException if {@code subscriberBufferSize} is < 1
   */
  public Config withSubscriberBufferSize(int subscriberBufferSize) {
    Assert.isTrue(subscriberBufferSize > 0, "The subscriberBufferSize must be greater than 0");
    this.subscriberBufferSize = Integer.valueOf(subscriberBufferSize);
    return this;
  }
}
