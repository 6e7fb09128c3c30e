package com.chauhraj.kdbtick.datatypes;

/**
 * kdb+ minute (type -17 / 17): minutes since midnight.
 */
public final class Minute implements Comparable<Minute> {
  /** Null minute, i.e. 0Nu. */
  public static final Minute NULL = new Minute(Integer.MIN_VALUE);

  /** Number of minutes since midnight. */
  public final int i;

  public Minute(int x) {
    i = x;
  }

  public boolean isNull() {
    return i == Integer.MIN_VALUE;
  }

  @Override
  public String toString() {
    return isNull() ? "" : String.format("%02d:%02d", i / 60, i % 60);
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof Minute && ((Minute) o).i == i;
  }

  @Override
  public int hashCode() {
    return i;
  }

  @Override
  public int compareTo(Minute m) {
    return Integer.compare(i, m.i);
  }
}
