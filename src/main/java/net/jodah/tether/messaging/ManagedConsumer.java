package net.jodah.tether.messaging;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import net.jodah.tether.ChannelCallable;
import net.jodah.tether.ChannelManager;
import net.jodah.tether.event.Subscription;
import net.jodah.tether.internal.util.Assert;
import net.jodah.tether.internal.util.concurrent.NamedThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;

/**
 * Consumes a queue through a {@link ChannelManager}, registering again on the replacement channel
 * after each recovery.
 * 
 * @author Jonathan Halterman
 */
public class ManagedConsumer implements Closeable {
  private static final Logger log = LoggerFactory.getLogger(ManagedConsumer.class);
  private static final AtomicInteger CONSUMER_COUNTER = new AtomicInteger();

  private final ChannelManager channelManager;
  private final String queue;
  private final DeliveryHandler handler;
  private final ConsumerOptions options;
  private final ExecutorService recoveryExecutor;
  private Subscription<Exception> subscription;
  private volatile ConsumerDelegate delegate;
  private volatile String consumerTag;
  private volatile boolean closed;

  public ManagedConsumer(ChannelManager channelManager, String queue, DeliveryHandler handler) {
    this(channelManager, queue, handler, new ConsumerOptions());
  }

  /**
   * @throws NullPointerException if any argument is null
   */
  public ManagedConsumer(ChannelManager channelManager, String queue, DeliveryHandler handler,
      ConsumerOptions options) {
    this.channelManager = Assert.notNull(channelManager, "channelManager");
    this.queue = Assert.notNull(queue, "queue");
    this.handler = Assert.notNull(handler, "handler");
    this.options = Assert.notNull(options, "options");
    recoveryExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory(String.format(
        "consumer-%s-recovery-%%s", CONSUMER_COUNTER.incrementAndGet())));
  }

  /**
   * Returns the tag of the current registration, else null if not started.
   */
  public String getConsumerTag() {
    return consumerTag;
  }

  /**
   * Registers the consumer and starts re-registering it after each recovery of the channel.
   * 
   * @throws IllegalStateException if the consumer was already started or is closed
   * @throws IOException if the consumer could not be registered
   */
  public synchronized void start() throws IOException {
    Assert.state(!closed, "%s is closed", this);
    Assert.state(subscription == null, "%s was already started", this);
    // Subscribe first so that a recovery during registration is not missed
    final Subscription<Exception> recoveries = channelManager.subscribe();
    boolean registered = false;
    try {
      register();
      registered = true;
    } finally {
      if (!registered)
        recoveries.unsubscribe();
    }

    subscription = recoveries;
    recoveryExecutor.execute(new Runnable() {
      @Override
      public void run() {
        try {
          Exception cause;
          while ((cause = recoveries.take()) != null) {
            log.info("Re-registering {} after recovery from {}", ManagedConsumer.this,
                cause.toString());
            try {
              register();
            } catch (Exception e) {
              log.error("Failed to re-register {}", ManagedConsumer.this, e);
            }
          }
        } catch (InterruptedException e) {
          log.debug("Stopped awaiting recoveries for {}", ManagedConsumer.this);
        }
      }
    });
  }

  /**
   * Stops re-registering the consumer and cancels the current registration.
   * 
   * @throws IOException if the registration could not be cancelled
   */
  @Override
  public synchronized void close() throws IOException {
    if (closed)
      return;
    closed = true;
    if (subscription != null)
      subscription.unsubscribe();
    recoveryExecutor.shutdownNow();

    ConsumerDelegate current = delegate;
    if (current != null && consumerTag != null) {
      try {
        current.getChannel().basicCancel(consumerTag);
        log.info("Cancelled {}", this);
      } catch (AlreadyClosedException e) {
        log.debug("Channel of {} was already closed", this);
      }
    }
  }

  @Override
  public String toString() {
    return consumerTag == null ? String.format("consumer of %s", queue) : String.format(
        "consumer-%s of %s", consumerTag, queue);
  }

  private void register() throws IOException {
    if (closed)
      return;

    consumerTag = channelManager.withChannel(new ChannelCallable<String>() {
      @Override
      public String call(Channel channel) throws IOException {
        if (options.getPrefetchCount() > 0)
          channel.basicQos(options.getPrefetchCount());
        ConsumerDelegate consumer = new ConsumerDelegate(channelManager, channel, handler,
            options.isAutoAck());
        String tag = channel.basicConsume(queue, options.isAutoAck(), options.getConsumerTag(),
            false, options.isExclusive(), options.getArguments(), consumer);
        delegate = consumer;
        return tag;
      }
    });

    log.info("Created {} via {}", this, channelManager);
  }
}
