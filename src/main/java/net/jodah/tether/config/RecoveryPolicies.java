package net.jodah.tether.config;

import net.jodah.tether.util.Duration;

/**
 * Factory methods for recovery policies.
 * 
 * @author Jonathan Halterman
 */
public final class RecoveryPolicies {
  private RecoveryPolicies() {
  }

  /**
   * Returns a RecoveryPolicy that recovers every {@link RecoveryPolicy#DEFAULT_INTERVAL}.
   */
  public static RecoveryPolicy recoverAlways() {
    return new RecoveryPolicy();
  }

  /**
   * Returns a RecoveryPolicy that recovers at the fixed {@code interval}.
   */
  public static RecoveryPolicy recoverEvery(Duration interval) {
    return new RecoveryPolicy().withInterval(interval);
  }

  /**
   * Returns a RecoveryPolicy that recovers starting at {@code interval}, doubling the pause after
   * each failed attempt up to {@code maxInterval}.
   */
  public static RecoveryPolicy recoverWithBackoff(Duration interval, Duration maxInterval) {
    return new RecoveryPolicy().withBackoff(interval, maxInterval);
  }
}
