package net.jodah.tether.internal.util;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;

public final class Exceptions {
  private Exceptions() {
  }

  @SuppressWarnings("unchecked")
  public static <T extends Throwable> T extractCause(Throwable t, Class<T> type) {
    Throwable cause = t;
    while (cause != null) {
      if (type.isAssignableFrom(cause.getClass()))
        return (T) cause;
      cause = cause.getCause();
    }

    return null;
  }

  /**
   * Returns whether the {@code t} or any of its causes is a shutdown signal for a connection
   * closure.
   */
  public static boolean isCausedByConnectionClosure(Throwable t) {
    ShutdownSignalException sse = extractCause(t, ShutdownSignalException.class);
    return sse != null && isConnectionClosure(sse);
  }

  /**
   * Reliably returns whether the shutdown signal represents a connection closure.
   */
  public static boolean isConnectionClosure(ShutdownSignalException e) {
    return e instanceof AlreadyClosedException ? e.getReference() instanceof Connection : e
        .isHardError();
  }
}
