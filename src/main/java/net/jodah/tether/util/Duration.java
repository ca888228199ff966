package net.jodah.tether.util;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import net.jodah.tether.internal.util.Assert;

/**
 * Duration unit, consisting of length and time unit.
 *
 * @author Jonathan Halterman
 */
public final class Duration implements Comparable<Duration>, Serializable {
  private static final long serialVersionUID = -3183487415409226519L;
  private static final Pattern PATTERN = Pattern.compile("(\\d+)\\s*([a-zA-Z]+)");
  private static final Map<String, TimeUnit> SUFFIXES = new HashMap<String, TimeUnit>();

  public final long length;
  public final TimeUnit timeUnit;

  static {
    register(TimeUnit.NANOSECONDS, "ns", "nanosecond", "nanoseconds");
    register(TimeUnit.MICROSECONDS, "us", "microsecond", "microseconds");
    register(TimeUnit.MILLISECONDS, "ms", "millisecond", "milliseconds");
    register(TimeUnit.SECONDS, "s", "sec", "secs", "second", "seconds");
    register(TimeUnit.MINUTES, "m", "min", "mins", "minute", "minutes");
    register(TimeUnit.HOURS, "h", "hour", "hours");
    register(TimeUnit.DAYS, "d", "day", "days");
  }

  private static void register(TimeUnit timeUnit, String... suffixes) {
    for (String suffix : suffixes)
      SUFFIXES.put(suffix, timeUnit);
  }

  private Duration(long length, TimeUnit timeUnit) {
    Assert.isTrue(length >= 0, "The length must be >= 0: %s", length);
    this.length = length;
    this.timeUnit = Assert.notNull(timeUnit, "timeUnit");
  }

  /**
   * Returns a Duration of {@code count} {@code unit}s.
   *
   * @throws NullPointerException if {@code unit} is null
   * @throws IllegalArgumentException if {@code count} is negative
   */
  public static Duration of(long count, TimeUnit unit) {
    return new Duration(count, unit);
  }

  /**
   * Returns a Duration parsed from {@code duration}, such as {@code "5 seconds"}, {@code "10ms"} or
   * {@code "2 min"}.
   *
   * @throws IllegalArgumentException if {@code duration} cannot be parsed
   */
  public static Duration of(String duration) {
    Assert.notNull(duration, "duration");
    Matcher matcher = PATTERN.matcher(duration.trim());
    Assert.isTrue(matcher.matches(), "Invalid duration: %s", duration);
    TimeUnit unit = SUFFIXES.get(matcher.group(2).toLowerCase(Locale.ENGLISH));
    Assert.isTrue(unit != null, "Invalid duration unit: %s", duration);
    return new Duration(Long.parseLong(matcher.group(1)), unit);
  }

  public static Duration nanos(long count) {
    return new Duration(count, TimeUnit.NANOSECONDS);
  }

  public static Duration millis(long count) {
    return new Duration(count, TimeUnit.MILLISECONDS);
  }

  public static Duration seconds(long count) {
    return new Duration(count, TimeUnit.SECONDS);
  }

  public static Duration minutes(long count) {
    return new Duration(count, TimeUnit.MINUTES);
  }

  public static Duration hours(long count) {
    return new Duration(count, TimeUnit.HOURS);
  }

  public long toNanos() {
    return timeUnit.toNanos(length);
  }

  public long toMillis() {
    return timeUnit.toMillis(length);
  }

  public long toSeconds() {
    return timeUnit.toSeconds(length);
  }

  @Override
  public int compareTo(Duration other) {
    long nanos = toNanos();
    long otherNanos = other.toNanos();
    return nanos < otherNanos ? -1 : nanos == otherNanos ? 0 : 1;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Duration))
      return false;
    return toNanos() == ((Duration) obj).toNanos();
  }

  @Override
  public int hashCode() {
    long nanos = toNanos();
    return (int) (nanos ^ (nanos >>> 32));
  }

  @Override
  public String toString() {
    String units = timeUnit.toString().toLowerCase(Locale.ENGLISH);
    if (length == 1)
      units = units.substring(0, units.length() - 1);
    return Long.toString(length) + ' ' + units;
  }
}
