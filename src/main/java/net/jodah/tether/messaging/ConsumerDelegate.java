package net.jodah.tether.messaging;

import java.io.IOException;

import net.jodah.tether.ChannelManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * Consumer registered with a channel on behalf of a {@link ManagedConsumer}. Passes deliveries to
 * the handler, acknowledges them on the channel they arrived on, and reports broker cancellations
 * to the channel manager.
 * 
 * @author Jonathan Halterman
 */
class ConsumerDelegate implements Consumer {
  private static final Logger log = LoggerFactory.getLogger(ConsumerDelegate.class);

  private final ChannelManager channelManager;
  private final Channel channel;
  private final DeliveryHandler handler;
  private final boolean autoAck;

  ConsumerDelegate(ChannelManager channelManager, Channel channel, DeliveryHandler handler,
      boolean autoAck) {
    this.channelManager = channelManager;
    this.channel = channel;
    this.handler = handler;
    this.autoAck = autoAck;
  }

  @Override
  public void handleCancel(String consumerTag) throws IOException {
    channelManager.handleCancel(channel, consumerTag);
  }

  @Override
  public void handleCancelOk(String consumerTag) {
    log.debug("Cancelled consumer-{} on {}", consumerTag, channel);
  }

  @Override
  public void handleConsumeOk(String consumerTag) {
    log.debug("Registered consumer-{} on {}", consumerTag, channel);
  }

  @Override
  public void handleDelivery(String consumerTag, Envelope envelope, BasicProperties properties,
      byte[] body) throws IOException {
    Action action;
    try {
      action = handler.handle(new Delivery(envelope, properties, body));
    } catch (Exception e) {
      log.error("Failed to handle delivery {} to consumer-{}", envelope.getDeliveryTag(),
          consumerTag, e);
      action = null;
    }

    if (autoAck)
      return;

    long deliveryTag = envelope.getDeliveryTag();
    if (action == null)
      action = Action.NACK_REQUEUE;
    switch (action) {
      case ACK:
        channel.basicAck(deliveryTag, false);
        break;
      case NACK_DISCARD:
        channel.basicNack(deliveryTag, false, false);
        break;
      case NACK_REQUEUE:
        channel.basicNack(deliveryTag, false, true);
        break;
    }
  }

  @Override
  public void handleRecoverOk(String consumerTag) {
  }

  @Override
  public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
    log.debug("Consumer-{} on {} was shut down", consumerTag, channel);
  }

  Channel getChannel() {
    return channel;
  }
}
