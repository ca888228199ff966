package net.jodah.tether;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;

import org.testng.annotations.Test;

import com.rabbitmq.client.Address;
import com.rabbitmq.client.ConnectionFactory;

@Test
public class ConnectionOptionsTest {
  public void shouldDefaultToFactoryAddress() {
    ConnectionFactory factory = mock(ConnectionFactory.class);
    when(factory.getHost()).thenReturn("localhost");
    when(factory.getPort()).thenReturn(5672);

    Address[] addresses = new ConnectionOptions(factory).getAddresses();
    assertEquals(addresses, new Address[] { new Address("localhost", 5672) });
    assertNull(new ConnectionOptions(factory).getName());
  }

  public void shouldUseHostsWithFactoryPort() {
    ConnectionFactory factory = mock(ConnectionFactory.class);
    when(factory.getPort()).thenReturn(5673);

    Address[] addresses = new ConnectionOptions(factory).withHosts("a", "b").getAddresses();
    assertEquals(addresses, new Address[] { new Address("a", 5673), new Address("b", 5673) });
  }

  public void addressesShouldTakePrecedenceOverHosts() {
    ConnectionOptions options = new ConnectionOptions().withHost("ignored").withAddresses(
        "rabbit1:5672,rabbit2:5673");
    assertEquals(options.getAddresses(), new Address[] { new Address("rabbit1", 5672),
        new Address("rabbit2", 5673) });
  }

  public void shouldConfigureFactory() {
    ConnectionFactory factory = mock(ConnectionFactory.class);
    new ConnectionOptions(factory).withUsername("guest").withPassword("secret").withPort(5671)
        .withVirtualHost("/orders");

    verify(factory).setUsername("guest");
    verify(factory).setPassword("secret");
    verify(factory).setPort(5671);
    verify(factory).setVirtualHost("/orders");
  }

  @Test(expectedExceptions = NullPointerException.class)
  public void shouldRejectNullHost() {
    new ConnectionOptions().withHost(null);
  }
}
