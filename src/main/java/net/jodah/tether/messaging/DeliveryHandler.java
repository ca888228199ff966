package net.jodah.tether.messaging;

import com.rabbitmq.client.Delivery;

/**
 * Handles deliveries to a {@link ManagedConsumer}.
 * 
 * @author Jonathan Halterman
 */
public interface DeliveryHandler {
  /**
   * Handles the {@code delivery}, returning how it should be acknowledged. The result is ignored for
   * auto-acknowledged consumers. A failure or a null result requeues the delivery.
   */
  Action handle(Delivery delivery) throws Exception;
}
