package net.jodah.tether.config;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;
import net.jodah.tether.util.Duration;

import org.testng.annotations.Test;

@Test
public class RecoveryPolicyTest {
  public void shouldDefaultToFixedInterval() {
    RecoveryPolicy policy = RecoveryPolicies.recoverAlways();
    assertEquals(policy.getInterval(), Duration.seconds(5));
    assertFalse(policy.isBackoff());
    assertNull(policy.getMaxInterval());
  }

  public void shouldRecoverEveryInterval() {
    RecoveryPolicy policy = RecoveryPolicies.recoverEvery(Duration.millis(10));
    assertEquals(policy.getInterval(), Duration.millis(10));
    assertFalse(policy.isBackoff());
  }

  public void shouldRecoverWithBackoff() {
    RecoveryPolicy policy = RecoveryPolicies.recoverWithBackoff(Duration.seconds(1),
        Duration.seconds(30));
    assertTrue(policy.isBackoff());
    assertEquals(policy.getInterval(), Duration.seconds(1));
    assertEquals(policy.getMaxInterval(), Duration.seconds(30));
    assertEquals(policy.getIntervalMultiplier(), 2);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void shouldRejectZeroInterval() {
    new RecoveryPolicy().withInterval(Duration.millis(0));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void shouldRejectIntervalNotLessThanMaxInterval() {
    new RecoveryPolicy().withBackoff(Duration.seconds(5), Duration.seconds(5));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void shouldRejectMultiplierOfOne() {
    new RecoveryPolicy().withBackoff(Duration.seconds(1), Duration.seconds(5), 1);
  }

  @Test(expectedExceptions = IllegalStateException.class)
  public void shouldNotSetIntervalAfterBackoff() {
    new RecoveryPolicy().withBackoff(Duration.seconds(1), Duration.seconds(5)).withInterval(
        Duration.seconds(2));
  }
}
