package com.chauhraj.kdbtick.datatypes;

import java.lang.reflect.Array;
import java.util.Arrays;

/**
 * Represents a kdb+ table (98): an array of column names and an array of column vectors of equal length.
 * q tables are column-oriented, in contrast to the row-oriented tables in relational databases.
 * An introduction can be found at <a href="https://code.kx.com/q4m3/8_Tables/">https://code.kx.com/q4m3/8_Tables/</a>
 */
public final class Flip {
  /** Column names. */
  public final String[] x;
  /** Column vectors, index aligned with {@link #x}. */
  public final Object[] y;

  /**
   * Create a table from a dictionary of column names (a symbol vector) to column vectors (a general list).
   * @param dict the column dictionary
   * @throws IllegalArgumentException if the dictionary does not have that shape
   */
  public Flip(Dict dict) {
    this(columnNames(dict), columnValues(dict));
  }

  /**
   * @param x column names
   * @param y column vectors
   */
  public Flip(String[] x, Object[] y) {
    if (x.length != y.length)
      throw new IllegalArgumentException("Table has " + x.length + " column names but " + y.length + " columns");
    this.x = x;
    this.y = y;
  }

  /**
   * Returns the column vector for a column name.
   * @param s the column name
   * @return the column vector
   * @throws IllegalArgumentException if there is no such column
   */
  public Object at(String s) {
    for (int i = 0; i < x.length; i++)
      if (x[i].equals(s))
        return y[i];
    throw new IllegalArgumentException("No such column: " + s);
  }

  /** Number of rows, taken from the first column. */
  public int rowCount() {
    if (y.length == 0)
      return 0;
    Object column = y[0] instanceof Attributed ? ((Attributed) y[0]).value : y[0];
    return column instanceof CharVector ? ((CharVector) column).length() : Array.getLength(column);
  }

  /**
   * Removes the key from a keyed table.
   * <p>
   * A keyed table is a dictionary whose keys and values are both tables. The result has the key columns
   * followed by the value columns, in order.
   * </p>
   * @param tbl a table or keyed table
   * @return a simple table
   * @throws IllegalArgumentException if {@code tbl} is neither
   */
  public static Flip unkey(Object tbl) {
    if (tbl instanceof Flip)
      return (Flip) tbl;
    if (!(tbl instanceof Dict) || !(((Dict) tbl).x instanceof Flip) || !(((Dict) tbl).y instanceof Flip))
      throw new IllegalArgumentException("Not a table or keyed table: " + tbl);
    Flip a = (Flip) ((Dict) tbl).x;
    Flip b = (Flip) ((Dict) tbl).y;
    int m = a.x.length;
    int n = b.x.length;
    String[] x = new String[m + n];
    System.arraycopy(a.x, 0, x, 0, m);
    System.arraycopy(b.x, 0, x, m, n);
    Object[] y = new Object[m + n];
    System.arraycopy(a.y, 0, y, 0, m);
    System.arraycopy(b.y, 0, y, m, n);
    return new Flip(x, y);
  }

  private static String[] columnNames(Dict dict) {
    if (!(dict.x instanceof String[]))
      throw new IllegalArgumentException("Table column names must be a symbol vector");
    return (String[]) dict.x;
  }

  private static Object[] columnValues(Dict dict) {
    if (!(dict.y instanceof Object[]))
      throw new IllegalArgumentException("Table columns must be a general list");
    return (Object[]) dict.y;
  }

  @Override
  public String toString() {
    return "Flip{x=" + Arrays.toString(x) + ", y=" + Arrays.deepToString(y) + '}';
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof Flip)) return false;
    Flip flip = (Flip) o;
    return Arrays.equals(x, flip.x) && Arrays.deepEquals(y, flip.y);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(x) + Arrays.deepHashCode(y);
  }
}
