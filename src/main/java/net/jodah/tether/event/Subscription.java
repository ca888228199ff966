package net.jodah.tether.event;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A {@link Dispatcher} registration that buffers up to a fixed number of undelivered events. Events
 * arriving while the buffer is full are dropped for this subscription only.
 * 
 * <p>
 * Once {@link #unsubscribe() unsubscribed} no further events are buffered. Events buffered before
 * then can still be read, after which the read methods return {@code null} without blocking.
 * 
 * @param <E> event type
 * @author Jonathan Halterman
 */
public final class Subscription<E> implements AutoCloseable {
  private static final Object CLOSED = new Object();

  private final Dispatcher<E> dispatcher;
  private final int bufferSize;
  // Holds events plus a trailing CLOSED marker
  private final BlockingQueue<Object> events;
  private volatile boolean closed;

  Subscription(Dispatcher<E> dispatcher, int bufferSize) {
    this.dispatcher = dispatcher;
    this.bufferSize = bufferSize;
    this.events = new LinkedBlockingQueue<Object>(bufferSize + 1);
  }

  /**
   * Returns whether the subscription has been unsubscribed, either directly or by the closure of
   * its dispatcher.
   */
  public boolean isClosed() {
    return closed;
  }

  /**
   * Returns the next buffered event without waiting, else {@code null} if none is buffered.
   */
  public E poll() {
    return unwrap(events.poll());
  }

  /**
   * Returns the next buffered event, waiting up to the {@code timeout} for one to arrive. Returns
   * {@code null} if the timeout elapses or the subscription is closed and drained.
   * 
   * @throws InterruptedException if interrupted while waiting
   */
  public E poll(long timeout, TimeUnit unit) throws InterruptedException {
    return unwrap(events.poll(timeout, unit));
  }

  /**
   * Returns the next event, waiting for one to arrive. Returns {@code null} once the subscription is
   * closed and drained.
   * 
   * @throws InterruptedException if interrupted while waiting
   */
  public E take() throws InterruptedException {
    return unwrap(events.take());
  }

  /**
   * Removes the subscription from its dispatcher. No event is delivered to this subscription after
   * this method returns. Subsequent calls have no effect.
   */
  public void unsubscribe() {
    dispatcher.remove(this);
  }

  /**
   * Equivalent to {@link #unsubscribe()}.
   */
  @Override
  public void close() {
    unsubscribe();
  }

  @Override
  public String toString() {
    return String.format("subscription[buffered=%s, closed=%s]", closed ? events.size() - 1
        : events.size(), closed);
  }

  /**
   * Buffers the {@code event} if there is room for it. Called with the dispatcher's registry lock
   * held, so it never races with {@link #markClosed()}.
   */
  boolean offer(E event) {
    if (closed || events.size() >= bufferSize)
      return false;
    return events.offer(event);
  }

  /** Called with the dispatcher's registry lock held. */
  void markClosed() {
    if (!closed) {
      closed = true;
      events.offer(CLOSED);
    }
  }

  @SuppressWarnings("unchecked")
  private E unwrap(Object event) {
    if (event == CLOSED) {
      // Leave the marker for subsequent readers
      events.offer(CLOSED);
      return null;
    }

    return (E) event;
  }
}
