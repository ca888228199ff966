package net.jodah.tether;

import java.io.IOException;

/**
 * Describes the broker cancelling a consumer, for example because its queue was deleted. Delivered
 * to recovery subscribers when a cancellation caused the channel to be replaced.
 * 
 * @author Jonathan Halterman
 */
public class ChannelCancelledException extends IOException {
  private static final long serialVersionUID = -2707284125408957381L;

  private final String consumerTag;

  public ChannelCancelledException(String consumerTag) {
    super(String.format("Consumer %s was cancelled by the server", consumerTag));
    this.consumerTag = consumerTag;
  }

  /**
   * Returns the tag of the cancelled consumer.
   */
  public String getConsumerTag() {
    return consumerTag;
  }
}
