package net.jodah.tether.util;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

import java.util.concurrent.TimeUnit;

import org.testng.annotations.Test;

@Test
public class DurationTest {
  public void testValidDurationStrings() {
    assertEquals(Duration.of("5ns"), Duration.nanos(5));
    assertEquals(Duration.of("5microsecond"), Duration.of(5, TimeUnit.MICROSECONDS));
    assertEquals(Duration.of("5milliseconds"), Duration.millis(5));
    assertEquals(Duration.of("5 seconds"), Duration.seconds(5));
    assertEquals(Duration.of("5 Secs"), Duration.seconds(5));
    assertEquals(Duration.of("5 minutes"), Duration.minutes(5));
    assertEquals(Duration.of("5 hours"), Duration.hours(5));
    assertEquals(Duration.of(" 5 days "), Duration.of(5, TimeUnit.DAYS));

    // Interesting value but legal nevertheless
    assertEquals(Duration.of("0s"), Duration.seconds(0));
  }

  private void testInvalidDurationString(String duration) {
    try {
      Duration.of(duration);
      fail("Duration string '" + duration + "' should not parse correctly.");
    } catch (IllegalArgumentException expected) {
    }
  }

  public void testInvalidDurationStrings() {
    testInvalidDurationString("foobar");
    testInvalidDurationString("ms3");
    testInvalidDurationString("34 lightyears");
    testInvalidDurationString("34 seconds a day");
    testInvalidDurationString("");
    testInvalidDurationString("2");
    testInvalidDurationString("ns");
    testInvalidDurationString("-5s");
  }

  public void shouldCompareAcrossUnits() {
    assertEquals(Duration.seconds(1), Duration.millis(1000));
    assertEquals(Duration.seconds(1).hashCode(), Duration.millis(1000).hashCode());
    assertTrue(Duration.millis(999).compareTo(Duration.seconds(1)) < 0);
    assertTrue(Duration.minutes(1).compareTo(Duration.seconds(59)) > 0);
  }

  public void shouldFormat() {
    assertEquals(Duration.seconds(5).toString(), "5 seconds");
    assertEquals(Duration.seconds(1).toString(), "1 second");
    assertEquals(Duration.millis(10).toString(), "10 milliseconds");
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void shouldRejectNegativeLength() {
    Duration.millis(-1);
  }
}
