package net.jodah.tether.internal.util.concurrent;

import java.util.concurrent.locks.AbstractQueuedSynchronizer;

import net.jodah.tether.util.Duration;

/**
 * A waiter where waiting threads can be interrupted (as opposed to awakened). Used to pause between
 * recovery attempts while still allowing a closing manager to cut the pause short.
 * 
 * @author Jonathan Halterman
 */
public class InterruptableWaiter {
  private final Sync sync = new Sync();

  private static final class Sync extends AbstractQueuedSynchronizer {
    private static final long serialVersionUID = 4016766900138538852L;

    @Override
    protected int tryAcquireShared(int acquires) {
      // Disallow acquisition
      return -1;
    }
  }

  /**
   * Waits for the {@code waitDuration}, aborting if interrupted.
   * 
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public void await(Duration waitDuration) throws InterruptedException {
    sync.tryAcquireSharedNanos(0, waitDuration.toNanos());
  }

  /**
   * Interrupts waiting threads.
   */
  public void interruptWaiters() {
    for (Thread t : sync.getSharedQueuedThreads())
      t.interrupt();
  }
}
