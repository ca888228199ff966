package net.jodah.tether.internal.util.concurrent;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates daemon threads named with increasing numbers, logging anything that escapes a task.
 * 
 * @author Jonathan Halterman
 */
public class NamedThreadFactory implements ThreadFactory {
  private static final Logger log = LoggerFactory.getLogger(NamedThreadFactory.class);
  private static final UncaughtExceptionHandler LOGGING_HANDLER = new UncaughtExceptionHandler() {
    @Override
    public void uncaughtException(Thread thread, Throwable failure) {
      log.error("Uncaught failure on {}", thread.getName(), failure);
    }
  };

  private final AtomicInteger threadNumber = new AtomicInteger(1);
  private final String nameFormat;

  /**
   * Creates a thread factory that names threads according to the {@code nameFormat} by supplying a
   * single argument to the format representing the thread number.
   */
  public NamedThreadFactory(String nameFormat) {
    this.nameFormat = nameFormat;
  }

  @Override
  public Thread newThread(Runnable runnable) {
    Thread thread = new Thread(runnable, String.format(nameFormat, threadNumber.getAndIncrement()));
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
    return thread;
  }
}
