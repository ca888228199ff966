package net.jodah.tether.messaging;

import java.io.IOException;

import net.jodah.tether.ChannelCallable;
import net.jodah.tether.ChannelManager;
import net.jodah.tether.internal.util.Assert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Channel;

/**
 * Publishes through the current channel of a {@link ChannelManager}. A publish that fails because
 * the channel is being recovered is not retried; the caller may publish again once recovery
 * completes.
 * 
 * @author Jonathan Halterman
 */
public class ManagedPublisher {
  private static final Logger log = LoggerFactory.getLogger(ManagedPublisher.class);

  private final ChannelManager channelManager;

  /**
   * @throws NullPointerException if {@code channelManager} is null
   */
  public ManagedPublisher(ChannelManager channelManager) {
    this.channelManager = Assert.notNull(channelManager, "channelManager");
  }

  public void publish(String exchange, String routingKey, byte[] body) throws IOException {
    publish(exchange, routingKey, null, body);
  }

  /**
   * Publishes the {@code body} to the {@code exchange} with the {@code routingKey}.
   * 
   * @throws NullPointerException if {@code exchange}, {@code routingKey} or {@code body} are null
   * @throws IOException if the publish fails
   */
  public void publish(final String exchange, final String routingKey,
      final BasicProperties properties, final byte[] body) throws IOException {
    Assert.notNull(exchange, "exchange");
    Assert.notNull(routingKey, "routingKey");
    Assert.notNull(body, "body");
    channelManager.withChannel(new ChannelCallable<Void>() {
      @Override
      public Void call(Channel channel) throws IOException {
        channel.basicPublish(exchange, routingKey, properties, body);
        log.debug("Published {} bytes to {} with routing key {} via {}", body.length, exchange,
            routingKey, channel);
        return null;
      }
    });
  }
}
