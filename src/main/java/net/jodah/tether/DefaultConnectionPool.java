package net.jodah.tether;

import java.io.Closeable;
import java.io.IOException;
import java.util.Arrays;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

import net.jodah.tether.internal.util.Assert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Connection;

/**
 * A pool of one connection, guarded by a lock. The connection is created eagerly, and reopened on
 * checkout if it has been closed.
 *
 * @author Jonathan Halterman
 */
public class DefaultConnectionPool implements ConnectionPool, Closeable {
  private static final Logger log = LoggerFactory.getLogger(DefaultConnectionPool.class);

  private final ConnectionOptions options;
  private final ReentrantLock lock = new ReentrantLock();
  private Connection connection;
  private boolean closed;

  /**
   * Creates a pool and opens its connection.
   *
   * @throws NullPointerException if {@code options} is null
   * @throws IOException if the connection could not be created
   * @throws TimeoutException if creating the connection timed out
   */
  public DefaultConnectionPool(ConnectionOptions options) throws IOException, TimeoutException {
    this.options = Assert.notNull(options, "options");
    lock.lock();
    try {
      connection = connect(false);
    } finally {
      lock.unlock();
    }
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalStateException if the pool is closed
   */
  @Override
  public Connection checkoutConnection() throws IOException, TimeoutException {
    lock.lock();
    boolean checkedOut = false;
    try {
      Assert.state(!closed, "The connection pool is closed");
      if (!connection.isOpen()) {
        log.warn("Connection {} is closed, reconnecting", connection);
        connection = connect(true);
      }

      checkedOut = true;
      return connection;
    } finally {
      if (!checkedOut)
        lock.unlock();
    }
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalMonitorStateException if the current thread did not check out the connection
   */
  @Override
  public void checkinConnection() {
    lock.unlock();
  }

  /**
   * Closes the pooled connection. Subsequent checkouts fail.
   */
  @Override
  public void close() throws IOException {
    lock.lock();
    try {
      if (closed)
        return;
      closed = true;
      if (connection.isOpen()) {
        log.info("Closing connection {}", connection);
        connection.close();
      }
    } finally {
      lock.unlock();
    }
  }

  private Connection connect(boolean recovery) throws IOException, TimeoutException {
    log.info("{} connection to {}", recovery ? "Recovering" : "Creating",
        Arrays.toString(options.getAddresses()));
    Connection result = options.getConnectionFactory().newConnection(options.getAddresses(),
        options.getName());
    log.info("{} connection {}", recovery ? "Recovered" : "Created", result);
    return result;
  }
}
