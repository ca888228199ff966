package net.jodah.tether.config;

import net.jodah.tether.internal.util.Assert;
import net.jodah.tether.util.Duration;

/**
 * Policy that defines how long to pause between channel recovery attempts. Recovery is always
 * attempted until it succeeds or the manager is closed, so the policy only shapes the pauses: a
 * fixed interval by default, or an exponential backoff up to a max interval.
 * 
 * @author Jonathan Halterman
 */
public class RecoveryPolicy {
  /** Interval used when none is configured. */
  public static final Duration DEFAULT_INTERVAL = Duration.seconds(5);

  private Duration interval = DEFAULT_INTERVAL;
  private Duration maxInterval;
  private int intervalMultiplier;

  /**
   * Creates a recovery policy that pauses for the {@link #DEFAULT_INTERVAL} between attempts.
   */
  public RecoveryPolicy() {
  }

  /**
   * Returns the interval between attempts, or the initial interval when backing off.
   * 
   * @see #withInterval(Duration)
   * @see #withBackoff(Duration, Duration)
   */
  public Duration getInterval() {
    return interval;
  }

  /**
   * Returns the interval multiplier for backoff attempts.
   * 
   * @see #withBackoff(Duration, Duration, int)
   */
  public int getIntervalMultiplier() {
    return intervalMultiplier;
  }

  /**
   * Returns the max interval between backoff attempts, else null if the policy does not back off.
   * 
   * @see #withBackoff(Duration, Duration)
   */
  public Duration getMaxInterval() {
    return maxInterval;
  }

  /**
   * Returns whether successive pauses grow towards the {@link #getMaxInterval() max interval}.
   */
  public boolean isBackoff() {
    return maxInterval != null;
  }

  /**
   * Sets the {@code interval} to pause for between attempts, exponentially backing off to the
   * {@code maxInterval} multiplying successive intervals by a factor of 2.
   * 
   * @throws NullPointerException if {@code interval} or {@code maxInterval} are null
   * @throws IllegalArgumentException if {@code interval} is <= 0 or {@code interval} is >=
   *           {@code maxInterval}
   */
  public RecoveryPolicy withBackoff(Duration interval, Duration maxInterval) {
    return withBackoff(interval, maxInterval, 2);
  }

  /**
   * Sets the {@code interval} to pause for between attempts, exponentially backing off to the
   * {@code maxInterval} multiplying successive intervals by the {@code intervalMultiplier}.
   * 
   * @throws NullPointerException if {@code interval} or {@code maxInterval} are null
   * @throws IllegalArgumentException if {@code interval} is <= 0, {@code interval} is >=
   *           {@code maxInterval} or the {@code intervalMultiplier} is <= 1
   */
  public RecoveryPolicy withBackoff(Duration interval, Duration maxInterval, int intervalMultiplier) {
    Assert.notNull(interval, "interval");
    Assert.notNull(maxInterval, "maxInterval");
    Assert.isTrue(interval.length > 0, "The interval must be greater than 0");
    Assert.isTrue(interval.compareTo(maxInterval) < 0,
        "The interval must be less than the maxInterval");
    Assert.isTrue(intervalMultiplier > 1, "The intervalMultiplier must be greater than 1");
    this.interval = interval;
    this.maxInterval = maxInterval;
    this.intervalMultiplier = intervalMultiplier;
    return this;
  }

  /**
   * Sets the fixed {@code interval} to pause for between attempts.
   * 
   * @throws NullPointerException if {@code interval} is null
   * @throws IllegalArgumentException if {@code interval} is <= 0
   * @throws IllegalStateException if backoff intervals have already been set via
   *           {@link #withBackoff(Duration, Duration)} or
   *           {@link #withBackoff(Duration, Duration, int)}
   */
  public RecoveryPolicy withInterval(Duration interval) {
    Assert.notNull(interval, "interval");
    Assert.isTrue(interval.length > 0, "The interval must be greater than 0");
    Assert.state(maxInterval == null, "Backoff intervals have already been set");
    this.interval = interval;
    return this;
  }

  @Override
  public String toString() {
    return isBackoff() ? String.format("RecoveryPolicy[backoff %s to %s x%s]", interval,
        maxInterval, intervalMultiplier) : String.format("RecoveryPolicy[every %s]", interval);
  }
}
