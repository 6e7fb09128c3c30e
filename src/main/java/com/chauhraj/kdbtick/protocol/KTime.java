package com.chauhraj.kdbtick.protocol;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;

import com.chauhraj.kdbtick.datatypes.Nulls;

/**
 * Conversions between java.time values and their kdb+ wire encodings. kdb+ counts from 2000.01.01
 * and has no time zones; all values are treated as UTC.
 */
final class KTime {

  static final int DAYS_BETWEEN_1970_2000 = 10957;
  static final long MILLIS_IN_DAY = 86_400_000L;
  static final long MILLIS_BETWEEN_1970_2000 = MILLIS_IN_DAY * DAYS_BETWEEN_1970_2000;
  static final long SECONDS_BETWEEN_1970_2000 = MILLIS_BETWEEN_1970_2000 / 1000;
  static final long NANOS_IN_SEC = 1_000_000_000L;

  /** 0wz and -0wz */
  static final LocalDateTime DATETIME_INF = LocalDateTime.MAX;
  static final LocalDateTime DATETIME_NINF = LocalDateTime.MIN.plusNanos(1);
  // roughly 270,000 years either side of 2000, well inside the epoch millisecond range
  private static final double MAX_DATETIME_DAYS = 1e8;

  private KTime() {
  }

  /** Date as days since 2000.01.01. */
  static int toDays(LocalDate d) {
    if (d == null || d.equals(LocalDate.MIN))
      return Nulls.NULL_INT;
    long daysSince2000 = d.toEpochDay() - DAYS_BETWEEN_1970_2000;
    if (daysSince2000 <= Integer.MIN_VALUE || daysSince2000 > Integer.MAX_VALUE)
      throw new IllegalArgumentException("Date out of kdb+ range: " + d);
    return (int) daysSince2000;
  }

  static LocalDate fromDays(int days) {
    return days == Nulls.NULL_INT ? LocalDate.MIN : LocalDate.ofEpochDay(DAYS_BETWEEN_1970_2000 + (long) days);
  }

  /**
   * Time of day as milliseconds since midnight; sub-millisecond precision is dropped.
   * {@link Nulls#NULL_TIME} is itself a valid time, 1ns after midnight, and is always sent as 0Nt.
   */
  static int toMillis(LocalTime t) {
    if (t == null || t.equals(Nulls.NULL_TIME))
      return Nulls.NULL_INT;
    return (int) (t.toNanoOfDay() / 1_000_000L);
  }

  static LocalTime fromMillis(int millis) {
    if (millis == Nulls.NULL_INT)
      return Nulls.NULL_TIME;
    return LocalTime.ofNanoOfDay(Math.floorMod(millis, MILLIS_IN_DAY) * 1_000_000L);
  }

  /** Datetime as fractional days since 2000.01.01, millisecond precision. */
  static double toDatetime(LocalDateTime z) {
    if (z == null || z.equals(LocalDateTime.MIN))
      return Nulls.NULL_FLOAT;
    if (z.equals(DATETIME_INF))
      return Double.POSITIVE_INFINITY;
    if (z.equals(DATETIME_NINF))
      return Double.NEGATIVE_INFINITY;
    return (z.toInstant(ZoneOffset.UTC).toEpochMilli() - MILLIS_BETWEEN_1970_2000) / 8.64e7;
  }

  static LocalDateTime fromDatetime(double f) {
    if (Double.isNaN(f))
      return LocalDateTime.MIN;
    if (f == Double.POSITIVE_INFINITY)
      return DATETIME_INF;
    if (f == Double.NEGATIVE_INFINITY)
      return DATETIME_NINF;
    if (Math.abs(f) >= MAX_DATETIME_DAYS)
      throw new IpcProtocolException("Datetime out of range: " + f);
    return LocalDateTime.ofInstant(Instant.ofEpochMilli(MILLIS_BETWEEN_1970_2000 + Math.round(8.64e7 * f)), ZoneOffset.UTC);
  }

  /** Timestamp as nanoseconds since 2000.01.01. */
  static long toNanos(Instant p) {
    if (p == null || p.equals(Instant.MIN))
      return Nulls.NULL_LONG;
    return Math.addExact(Math.multiplyExact(p.getEpochSecond() - SECONDS_BETWEEN_1970_2000, NANOS_IN_SEC), p.getNano());
  }

  static Instant fromNanos(long nanos) {
    if (nanos == Nulls.NULL_LONG)
      return Instant.MIN;
    return Instant.ofEpochSecond(SECONDS_BETWEEN_1970_2000 + Math.floorDiv(nanos, NANOS_IN_SEC), Math.floorMod(nanos, NANOS_IN_SEC));
  }
}
