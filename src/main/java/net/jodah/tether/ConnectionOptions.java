package net.jodah.tether;

import net.jodah.tether.internal.util.Assert;

import com.rabbitmq.client.Address;
import com.rabbitmq.client.ConnectionFactory;

/**
 * Connection options for a {@link DefaultConnectionPool}. Changes will not affect connections that
 * have already been created.
 *
 * @author Jonathan Halterman
 */
public class ConnectionOptions {
  private final ConnectionFactory factory;
  private String[] hosts;
  private Address[] addresses;
  private String name;

  public ConnectionOptions() {
    factory = new ConnectionFactory();
  }

  /**
   * Creates a new Options object for the {@code connectionFactory}.
   *
   * @throws NullPointerException if {@code connectionFactory} is null
   */
  public ConnectionOptions(ConnectionFactory connectionFactory) {
    this.factory = Assert.notNull(connectionFactory, "connectionFactory");
  }

  /**
   * Returns the addresses to attempt connections to, in round-robin order.
   *
   * @see #withAddresses(Address...)
   * @see #withAddresses(String)
   * @see #withHost(String)
   * @see #withHosts(String...)
   */
  public Address[] getAddresses() {
    if (addresses != null)
      return addresses;

    if (hosts != null) {
      Address[] hostAddresses = new Address[hosts.length];
      for (int i = 0; i < hosts.length; i++)
        hostAddresses[i] = new Address(hosts[i], factory.getPort());
      return hostAddresses;
    }

    return new Address[] { new Address(factory.getHost(), factory.getPort()) };
  }

  /**
   * Returns the ConnectionFactory for the options.
   */
  public ConnectionFactory getConnectionFactory() {
    return factory;
  }

  /**
   * Returns the client-provided connection name, else null.
   */
  public String getName() {
    return name;
  }

  /**
   * Sets the {@code addresses} to attempt connections to, in round-robin order.
   *
   * @throws NullPointerException if {@code addresses} is null
   */
  public ConnectionOptions withAddresses(Address... addresses) {
    this.addresses = Assert.notNull(addresses, "addresses");
    return this;
  }

  /**
   * Sets the {@code addresses}, formatted as {@code host1[:port],host2[:port]}.
   *
   * @throws NullPointerException if {@code addresses} is null
   */
  public ConnectionOptions withAddresses(String addresses) {
    this.addresses = Address.parseAddresses(Assert.notNull(addresses, "addresses"));
    return this;
  }

  /**
   * Sets the client-provided connection name shown by the broker.
   */
  public ConnectionOptions withName(String name) {
    this.name = name;
    return this;
  }

  /**
   * Sets the {@code host} to connect to.
   *
   * @throws NullPointerException if {@code host} is null
   */
  public ConnectionOptions withHost(String host) {
    this.hosts = new String[] { Assert.notNull(host, "host") };
    return this;
  }

  /**
   * Sets the {@code hosts} to attempt connections to, in round-robin order.
   *
   * @throws NullPointerException if {@code hosts} is null
   */
  public ConnectionOptions withHosts(String... hosts) {
    this.hosts = Assert.notNull(hosts, "hosts");
    return this;
  }

  public ConnectionOptions withPassword(String password) {
    factory.setPassword(Assert.notNull(password, "password"));
    return this;
  }

  public ConnectionOptions withPort(int port) {
    factory.setPort(port);
    return this;
  }

  public ConnectionOptions withUsername(String username) {
    factory.setUsername(Assert.notNull(username, "username"));
    return this;
  }

  public ConnectionOptions withVirtualHost(String virtualHost) {
    factory.setVirtualHost(Assert.notNull(virtualHost, "virtualHost"));
    return this;
  }
}
