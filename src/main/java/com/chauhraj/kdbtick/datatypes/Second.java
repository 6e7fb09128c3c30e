package com.chauhraj.kdbtick.datatypes;

/**
 * kdb+ second (type -18 / 18): seconds since midnight.
 */
public final class Second implements Comparable<Second> {
  /** Null second, i.e. 0Nv. */
  public static final Second NULL = new Second(Integer.MIN_VALUE);

  /** Number of seconds since midnight. */
  public final int i;

  public Second(int x) {
    i = x;
  }

  public boolean isNull() {
    return i == Integer.MIN_VALUE;
  }

  @Override
  public String toString() {
    return isNull() ? "" : new Minute(i / 60) + String.format(":%02d", i % 60);
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof Second && ((Second) o).i == i;
  }

  @Override
  public int hashCode() {
    return i;
  }

  @Override
  public int compareTo(Second s) {
    return Integer.compare(i, s.i);
  }
}
