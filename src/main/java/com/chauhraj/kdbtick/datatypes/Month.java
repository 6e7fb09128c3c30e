package com.chauhraj.kdbtick.datatypes;

/**
 * kdb+ month (type -13 / 13): the count of months since January 2000.
 * Months before the millennium are negative.
 */
public final class Month implements Comparable<Month> {
  /** Null month, i.e. 0Nm. */
  public static final Month NULL = new Month(Integer.MIN_VALUE);

  /** Number of months since Jan 2000. */
  public final int i;

  /**
   * @param x number of months from the millennium
   */
  public Month(int x) {
    i = x;
  }

  public boolean isNull() {
    return i == Integer.MIN_VALUE;
  }

  @Override
  public String toString() {
    if (isNull())
      return "";
    int m = i + 24000;
    return String.format("%04d-%02d", m / 12, 1 + m % 12);
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof Month && ((Month) o).i == i;
  }

  @Override
  public int hashCode() {
    return i;
  }

  @Override
  public int compareTo(Month m) {
    return Integer.compare(i, m.i);
  }
}
