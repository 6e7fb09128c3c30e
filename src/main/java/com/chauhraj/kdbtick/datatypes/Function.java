package com.chauhraj.kdbtick.datatypes;

import java.util.Objects;

/**
 * Opaque placeholder for a kdb+ function value (types 100 to 112). The codec consumes function bodies
 * from the wire without reconstructing them; only a lambda keeps its source text.
 */
public final class Function {
  private final KType type;
  private final String source;

  public Function(KType type, String source) {
    if (!type.isFunction())
      throw new IllegalArgumentException("Not a function type: " + type);
    this.type = type;
    this.source = source;
  }

  public Function(KType type) {
    this(type, null);
  }

  public KType type() {
    return type;
  }

  /** Lambda source text, or {@code null} for every other function kind. */
  public String source() {
    return source;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Function && ((Function) o).type == type && Objects.equals(((Function) o).source, source);
  }

  @Override
  public int hashCode() {
    return 31 * type.hashCode() + Objects.hashCode(source);
  }

  @Override
  public String toString() {
    return source != null ? source : "func";
  }
}
