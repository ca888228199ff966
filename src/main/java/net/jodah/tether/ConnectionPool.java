package net.jodah.tether;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import com.rabbitmq.client.Connection;

/**
 * Grants exclusive, temporary access to a broker connection. A thread that checks out a connection
 * must check it back in once it is done with it. Implementations are responsible for keeping the
 * connection itself usable.
 * 
 * @author Jonathan Halterman
 */
public interface ConnectionPool {
  /**
   * Checks out the connection, blocking until it is available.
   * 
   * @throws IOException if an unusable connection could not be reopened
   * @throws TimeoutException if reopening the connection timed out
   */
  Connection checkoutConnection() throws IOException, TimeoutException;

  /**
   * Checks the connection back in, making it available to other threads.
   */
  void checkinConnection();
}
