package net.jodah.tether.messaging;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import net.jodah.tether.internal.util.Assert;

/**
 * Options for a {@link ManagedConsumer}.
 * 
 * @author Jonathan Halterman
 */
public class ConsumerOptions {
  private boolean autoAck;
  private boolean exclusive;
  private int prefetchCount;
  private String consumerTag = "";
  private Map<String, Object> arguments = new HashMap<String, Object>();

  /**
   * Returns the consumer arguments.
   */
  public Map<String, Object> getArguments() {
    return Collections.unmodifiableMap(arguments);
  }

  /**
   * Returns the requested consumer tag, else an empty string to let the broker generate one.
   */
  public String getConsumerTag() {
    return consumerTag;
  }

  /**
   * Returns the max number of unacknowledged deliveries, where 0 means unlimited.
   */
  public int getPrefetchCount() {
    return prefetchCount;
  }

  public boolean isAutoAck() {
    return autoAck;
  }

  public boolean isExclusive() {
    return exclusive;
  }

  /**
   * Sets a consumer argument.
   * 
   * @throws NullPointerException if {@code key} is null
   */
  public ConsumerOptions withArgument(String key, Object value) {
    arguments.put(Assert.notNull(key, "key"), value);
    return this;
  }

  /**
   * Sets whether deliveries are acknowledged by the broker as soon as they are sent.
   */
  public ConsumerOptions withAutoAck(boolean autoAck) {
    this.autoAck = autoAck;
    return this;
  }

  /**
   * Sets the consumer tag to request.
   * 
   * @throws NullPointerException if {@code consumerTag} is null
   */
  public ConsumerOptions withConsumerTag(String consumerTag) {
    this.consumerTag = Assert.notNull(consumerTag, "consumerTag");
    return this;
  }

  public ConsumerOptions withExclusive(boolean exclusive) {
    this.exclusive = exclusive;
    return this;
  }

  /**
   * Sets the max number of unacknowledged deliveries per consumer, applied each time the consumer is
   * registered.
   * 
   * @throws IllegalArgumentException if {@code prefetchCount} is negative
   */
  public ConsumerOptions withPrefetchCount(int prefetchCount) {
    Assert.isTrue(prefetchCount >= 0, "The prefetchCount must be >= 0");
    this.prefetchCount = prefetchCount;
    return this;
  }
}
