package net.jodah.tether.internal;

import net.jodah.tether.config.RecoveryPolicy;
import net.jodah.tether.util.Duration;

/**
 * Tracks the attempts of one recovery cycle and the pause before the next attempt.
 * 
 * @author Jonathan Halterman
 */
public final class RecoveryStats {
  private final long startTime = System.nanoTime();
  private final long maxInterval;
  private final int intervalMultiplier;
  private long waitTime;
  private int attempts;

  public RecoveryStats(RecoveryPolicy recoveryPolicy) {
    waitTime = recoveryPolicy.getInterval().toNanos();
    if (recoveryPolicy.isBackoff()) {
      maxInterval = recoveryPolicy.getMaxInterval().toNanos();
      intervalMultiplier = recoveryPolicy.getIntervalMultiplier();
    } else {
      maxInterval = -1;
      intervalMultiplier = -1;
    }
  }

  /**
   * Returns the number of failed attempts.
   */
  public int getAttempts() {
    return attempts;
  }

  /**
   * Returns the time elapsed since recovery started.
   */
  public Duration getElapsedTime() {
    return Duration.nanos(System.nanoTime() - startTime);
  }

  /**
   * Returns how long to pause before the next attempt.
   */
  public Duration getWaitTime() {
    return Duration.nanos(waitTime);
  }

  /**
   * Records a failed attempt, growing the wait time when backing off.
   */
  public void incrementAttempts() {
    attempts++;
    if (intervalMultiplier != -1)
      waitTime = waitTime > maxInterval / intervalMultiplier ? maxInterval : Math.min(maxInterval,
          waitTime * intervalMultiplier);
  }
}
