package org.obligato.logic;

import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;

/** An atomic linear constraint {@code term rel 0}. */
@Immutable
public final class Constraint {

  /** The relation of a constraint's term to zero. */
  public enum Relation {
    LE("<="),
    LT("<"),
    EQ("=="),
    NE("!=");

    private final String symbol;

    Relation(String symbol) {
      this.symbol = symbol;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  public static Constraint of(LinearTerm term, Relation relation) {
    return new Constraint(term, relation);
  }

  private final LinearTerm term;
  private final Relation relation;

  private Constraint(LinearTerm term, Relation relation) {
    this.term = term;
    this.relation = relation;
  }

  public LinearTerm term() {
    return term;
  }

  public Relation relation() {
    return relation;
  }

  /** The complementary constraint. */
  public Constraint negate() {
    switch (relation) {
      case LE:
        return of(term.negate(), Relation.LT);
      case LT:
        return of(term.negate(), Relation.LE);
      case EQ:
        return of(term, Relation.NE);
      case NE:
        return of(term, Relation.EQ);
    }
    throw new AssertionError(relation);
  }

  /** Decides a constraint without variables. */
  public boolean holdsTrivially() {
    int sign = term.constant().signum();
    switch (relation) {
      case LE:
        return sign <= 0;
      case LT:
        return sign < 0;
      case EQ:
        return sign == 0;
      case NE:
        return sign != 0;
    }
    throw new AssertionError(relation);
  }

  @Override
  public String toString() {
    return term + " " + relation + " 0";
  }

  @Override
  public int hashCode() {
    return 31 * term.hashCode() + relation.hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof Constraint)) {
      return false;
    }
    Constraint that = (Constraint) obj;
    return term.equals(that.term) && relation == that.relation;
  }
}
