package net.jodah.tether.messaging;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.io.IOException;

import net.jodah.tether.AbstractFunctionalTest;

import org.testng.annotations.Test;

import com.rabbitmq.client.AMQP.BasicProperties;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.MessageProperties;

@Test
public class ManagedPublisherTest extends AbstractFunctionalTest {
  private static final byte[] BODY = new byte[] { 1, 2, 3 };

  public void shouldPublishOnCurrentChannel() throws Throwable {
    Channel c1 = mockChannel();
    mockChannels(c1);
    ManagedPublisher publisher = new ManagedPublisher(createChannelManager());

    publisher.publish("exchange", "orders", BODY);
    publisher.publish("exchange", "orders", MessageProperties.PERSISTENT_BASIC, BODY);

    verify(c1).basicPublish("exchange", "orders", null, BODY);
    verify(c1).basicPublish("exchange", "orders", MessageProperties.PERSISTENT_BASIC, BODY);
  }

  public void shouldPublishOnRecoveredChannel() throws Throwable {
    Channel c1 = mockChannel();
    Channel c2 = mockChannel();
    mockChannels(c1, c2);
    ManagedPublisher publisher = new ManagedPublisher(createChannelManager());

    shutdown(c1, channelShutdownSignal());
    awaitReconnections(1, 1000);
    publisher.publish("exchange", "orders", BODY);

    verify(c2).basicPublish("exchange", "orders", null, BODY);
    verify(c1, never()).basicPublish(anyString(), anyString(), any(BasicProperties.class),
        any(byte[].class));
  }

  @Test(expectedExceptions = IOException.class)
  public void shouldPropagatePublishFailure() throws Throwable {
    Channel c1 = mockChannel();
    mockChannels(c1);
    doThrow(new IOException("publish failed")).when(c1).basicPublish("exchange", "orders", null,
        BODY);
    new ManagedPublisher(createChannelManager()).publish("exchange", "orders", BODY);
  }

  @Test(expectedExceptions = IllegalStateException.class)
  public void shouldFailWhenManagerIsClosed() throws Throwable {
    mockChannels(mockChannel());
    ManagedPublisher publisher = new ManagedPublisher(createChannelManager());
    channelManager.close();
    publisher.publish("exchange", "orders", BODY);
  }
}
