package net.jodah.tether;

import java.io.IOException;

import com.rabbitmq.client.Channel;

/**
 * Work performed against a manager's current channel.
 * 
 * @param <T> result type
 * @see ChannelManager#withChannel(ChannelCallable)
 */
public interface ChannelCallable<T> {
  T call(Channel channel) throws IOException;
}
