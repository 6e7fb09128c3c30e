package com.chauhraj.kdbtick.datatypes;

import java.time.Duration;

/**
 * kdb+ timespan (type -16 / 16): a signed duration in nanoseconds.
 */
public final class Timespan implements Comparable<Timespan> {
  /** Null timespan, i.e. 0Nn. */
  public static final Timespan NULL = new Timespan(Long.MIN_VALUE);

  private static final long NANOS_IN_DAY = 86_400_000_000_000L;
  private static final long NANOS_IN_HOUR = 3_600_000_000_000L;
  private static final long NANOS_IN_MINUTE = 60_000_000_000L;
  private static final long NANOS_IN_SECOND = 1_000_000_000L;

  /** Number of nanoseconds. */
  public final long j;

  public Timespan(long x) {
    j = x;
  }

  public static Timespan of(Duration d) {
    return new Timespan(d.toNanos());
  }

  public Duration toDuration() {
    return Duration.ofNanos(j);
  }

  public boolean isNull() {
    return j == Long.MIN_VALUE;
  }

  @Override
  public String toString() {
    if (isNull())
      return "";
    StringBuilder sb = new StringBuilder();
    if (j < 0)
      sb.append('-');
    long jj = Math.abs(j);
    long d = jj / NANOS_IN_DAY;
    if (d != 0)
      sb.append(d).append('D');
    return sb.append(String.format("%02d:%02d:%02d.%09d",
        (jj % NANOS_IN_DAY) / NANOS_IN_HOUR,
        (jj % NANOS_IN_HOUR) / NANOS_IN_MINUTE,
        (jj % NANOS_IN_MINUTE) / NANOS_IN_SECOND,
        jj % NANOS_IN_SECOND)).toString();
  }

  @Override
  public int compareTo(Timespan t) {
    return Long.compare(j, t.j);
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof Timespan && ((Timespan) o).j == j;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(j);
  }
}
