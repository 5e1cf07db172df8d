package net.jodah.redial.util;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import net.jodah.redial.internal.util.Assert;

/**
 * Duration unit, consisting of length and time unit. Used for redial intervals and connection
 * timeouts.
 */
public final class Duration implements Serializable {
  private static final long serialVersionUID = 3815672049412637104L;
  public static final Duration ZERO = new Duration(0, TimeUnit.NANOSECONDS);
  private static final Pattern PATTERN = Pattern.compile("(\\d+)\\s*([a-zA-Z]+)");
  private static final Map<String, TimeUnit> SUFFIXES = new HashMap<String, TimeUnit>();

  public final long length;
  public final TimeUnit timeUnit;

  static {
    suffixes(TimeUnit.NANOSECONDS, "ns", "nanosecond", "nanoseconds");
    suffixes(TimeUnit.MICROSECONDS, "us", "microsecond", "microseconds");
    suffixes(TimeUnit.MILLISECONDS, "ms", "millisecond", "milliseconds");
    suffixes(TimeUnit.SECONDS, "s", "sec", "secs", "second", "seconds");
    suffixes(TimeUnit.MINUTES, "m", "min", "mins", "minute", "minutes");
    suffixes(TimeUnit.HOURS, "h", "hour", "hours");
    suffixes(TimeUnit.DAYS, "d", "day", "days");
  }

  private static void suffixes(TimeUnit unit, String... names) {
    for (String name : names)
      SUFFIXES.put(name, unit);
  }

  private Duration(long length, TimeUnit timeUnit) {
    Assert.isTrue(length >= 0, "The length must not be negative: %s", length);
    this.length = length;
    this.timeUnit = Assert.notNull(timeUnit, "timeUnit");
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

  public boolean isZero() {
    return length == 0;
  }

  /**
   * Returns a new Duration of this duration's length multiplied by {@code factor}, in the same
   * unit. Saturates at {@code Long.MAX_VALUE}.
   * 
   * @throws IllegalArgumentException if {@code factor} is negative
   */
  public Duration multipliedBy(long factor) {
    Assert.isTrue(factor >= 0, "The factor must not be negative: %s", factor);
    if (factor != 0 && length > Long.MAX_VALUE / factor)
      return new Duration(Long.MAX_VALUE, timeUnit);
    return new Duration(length * factor, timeUnit);
  }

  public long toMillis() {
    return timeUnit.toMillis(length);
  }

  public long toNanos() {
    return timeUnit.toNanos(length);
  }

  public long toSeconds() {
    return timeUnit.toSeconds(length);
  }

  @Override
  public String toString() {
    String units = timeUnit.toString().toLowerCase(Locale.ROOT);
    if (length == 1)
      units = units.substring(0, units.length() - 1);
    return length + " " + units;
  }

  public static Duration millis(long count) {
    return new Duration(count, TimeUnit.MILLISECONDS);
  }

  public static Duration nanos(long count) {
    return new Duration(count, TimeUnit.NANOSECONDS);
  }

  public static Duration seconds(long count) {
    return new Duration(count, TimeUnit.SECONDS);
  }

  public static Duration minutes(long count) {
    return new Duration(count, TimeUnit.MINUTES);
  }

  public static Duration of(long count, TimeUnit unit) {
    return new Duration(count, unit);
  }

  /**
   * Returns a Duration from the parsed {@code duration}. Example:
   * 
   * <pre>
   * 5 s
   * 5 seconds
   * 10ms
   * </pre>
   * 
   * @throws IllegalArgumentException if {@code duration} cannot be parsed
   */
  public static Duration of(String duration) {
    Matcher matcher = PATTERN.matcher(Assert.notNull(duration, "duration").trim());
    Assert.isTrue(matcher.matches(), "Invalid duration: %s", duration);
    TimeUnit unit = SUFFIXES.get(matcher.group(2).toLowerCase(Locale.ROOT));
    Assert.isTrue(unit != null, "Invalid duration unit: %s", duration);
    return new Duration(Long.parseLong(matcher.group(1)), unit);
  }
}
