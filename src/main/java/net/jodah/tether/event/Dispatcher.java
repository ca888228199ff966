package net.jodah.tether.event;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import net.jodah.tether.config.Config;
import net.jodah.tether.internal.util.Assert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Broadcasts events to a dynamic set of {@link Subscription subscriptions}. Delivery never blocks:
 * a subscription whose buffer is full is skipped without delaying delivery to the others.
 * Subscribing, unsubscribing and dispatching are safe to perform concurrently.
 * 
 * @param <E> event type
 * @author Jonathan Halterman
 */
public class Dispatcher<E> {
  private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

  private final Set<Subscription<E>> subscriptions = new LinkedHashSet<Subscription<E>>();
  private final int bufferSize;
  private boolean closed;

  /**
   * Creates a dispatcher whose subscriptions buffer {@link Config#DEFAULT_SUBSCRIBER_BUFFER_SIZE}
   * events.
   */
  public Dispatcher() {
    this(Config.DEFAULT_SUBSCRIBER_BUFFER_SIZE);
  }

  /**
   * Creates a dispatcher whose subscriptions buffer {@code bufferSize} events.
   * 
   * @throws IllegalArgumentException if {@code bufferSize} is < 1
   */
  public Dispatcher(int bufferSize) {
    Assert.isTrue(bufferSize > 0, "The bufferSize must be greater than 0");
    this.bufferSize = bufferSize;
  }

  /**
   * Registers and returns a new subscription. If the dispatcher is closed, the returned
   * subscription is already closed.
   */
  public Subscription<E> addSubscriber() {
    Subscription<E> subscription = new Subscription<E>(this, bufferSize);
    synchronized (subscriptions) {
      if (closed)
        subscription.markClosed();
      else
        subscriptions.add(subscription);
    }

    return subscription;
  }

  /**
   * Offers the {@code event} to every registered subscription, returning the number of
   * subscriptions that accepted it.
   * 
   * @throws NullPointerException if {@code event} is null
   */
  public int dispatch(E event) {
    Assert.notNull(event, "event");
    int delivered = 0;
    synchronized (subscriptions) {
      for (Subscription<E> subscription : subscriptions) {
        if (subscription.offer(event))
          delivered++;
        else
          log.debug("Dropped {} for full {}", event, subscription);
      }
    }

    return delivered;
  }

  /**
   * Returns the number of registered subscriptions.
   */
  public int getSubscriberCount() {
    synchronized (subscriptions) {
      return subscriptions.size();
    }
  }

  public boolean isClosed() {
    synchronized (subscriptions) {
      return closed;
    }
  }

  /**
   * Closes every registered subscription. Subscriptions added afterwards are closed immediately.
   */
  public void close() {
    List<Subscription<E>> closing;
    synchronized (subscriptions) {
      if (closed)
        return;
      closed = true;
      closing = new ArrayList<Subscription<E>>(subscriptions);
      subscriptions.clear();
      for (Subscription<E> subscription : closing)
        subscription.markClosed();
    }

    log.debug("Closed dispatcher with {} subscriptions", closing.size());
  }

  void remove(Subscription<E> subscription) {
    synchronized (subscriptions) {
      subscriptions.remove(subscription);
      subscription.markClosed();
    }
  }
}
