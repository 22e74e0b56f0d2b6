package org.obligato.logic;

import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/** A solver variable: a program binding or an abstracted term, named by its canonical text. */
@Immutable
public final class Var implements Comparable<Var> {

  /** Where a variable comes from. */
  public enum Origin {
    /** A local binding of the program. */
    BINDING,
    /** An uninterpreted application, such as {@code len(xs)} or {@code p.x}. */
    ATOM,
    /** A nonlinear term replaced by a fresh variable. */
    NONLINEAR
  }

  private final String name;
  private final Sort sort;
  private final Origin origin;

  public Var(String name, Sort sort, Origin origin) {
    this.name = name;
    this.sort = sort;
    this.origin = origin;
  }

  public String name() {
    return name;
  }

  public Sort sort() {
    return sort;
  }

  public Origin origin() {
    return origin;
  }

  @Override
  public int compareTo(Var o) {
    return name.compareTo(o.name);
  }

  @Override
  public String toString() {
    return name;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj instanceof Var && name.equals(((Var) obj).name);
  }
}
