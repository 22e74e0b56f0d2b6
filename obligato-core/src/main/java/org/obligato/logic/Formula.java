package org.obligato.logic;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.errorprone.annotations.Immutable;
import java.util.ArrayList;
import java.util.List;

/** A boolean combination of linear constraints. */
@Immutable
public abstract class Formula {

  /** Formula kinds. */
  public enum Kind {
    TRUE,
    FALSE,
    CONSTRAINT,
    NOT,
    AND,
    OR
  }

  public static final Formula TRUE = new Constant(true);
  public static final Formula FALSE = new Constant(false);

  public abstract Kind kind();

  public static Formula of(boolean value) {
    return value ? TRUE : FALSE;
  }

  public static Formula atom(Constraint constraint) {
    if (constraint.term().isConstant()) {
      return of(constraint.holdsTrivially());
    }
    return new Atom(constraint);
  }

  public static Formula not(Formula f) {
    switch (f.kind()) {
      case TRUE:
        return FALSE;
      case FALSE:
        return TRUE;
      case NOT:
        return ((Not) f).operand();
      default:
        return new Not(f);
    }
  }

  public static Formula and(Formula... fs) {
    return and(ImmutableList.copyOf(fs));
  }

  public static Formula and(List<Formula> fs) {
    List<Formula> operands = new ArrayList<>();
    for (Formula f : fs) {
      if (f.kind() == Kind.FALSE) {
        return FALSE;
      }
      if (f.kind() == Kind.AND) {
        operands.addAll(((Junction) f).operands());
      } else if (f.kind() != Kind.TRUE) {
        operands.add(f);
      }
    }
    if (operands.isEmpty()) {
      return TRUE;
    }
    return operands.size() == 1 ? operands.get(0) : new Junction(Kind.AND, operands);
  }

  public static Formula or(Formula... fs) {
    return or(ImmutableList.copyOf(fs));
  }

  public static Formula or(List<Formula> fs) {
    List<Formula> operands = new ArrayList<>();
    for (Formula f : fs) {
      if (f.kind() == Kind.TRUE) {
        return TRUE;
      }
      if (f.kind() == Kind.OR) {
        operands.addAll(((Junction) f).operands());
      } else if (f.kind() != Kind.FALSE) {
        operands.add(f);
      }
    }
    if (operands.isEmpty()) {
      return FALSE;
    }
    return operands.size() == 1 ? operands.get(0) : new Junction(Kind.OR, operands);
  }

  /** The variables the formula mentions, ordered by name. */
  public ImmutableSortedSet<Var> vars() {
    ImmutableSortedSet.Builder<Var> result = ImmutableSortedSet.naturalOrder();
    collectVars(result);
    return result.build();
  }

  abstract void collectVars(ImmutableSortedSet.Builder<Var> result);

  /** {@code true} or {@code false}. */
  static final class Constant extends Formula {
    private final boolean value;

    Constant(boolean value) {
      this.value = value;
    }

    @Override
    public Kind kind() {
      return value ? Kind.TRUE : Kind.FALSE;
    }

    @Override
    void collectVars(ImmutableSortedSet.Builder<Var> result) {}

    @Override
    public String toString() {
      return String.valueOf(value);
    }
  }

  /** A single constraint. */
  public static final class Atom extends Formula {
    private final Constraint constraint;

    Atom(Constraint constraint) {
      this.constraint = constraint;
    }

    @Override
    public Kind kind() {
      return Kind.CONSTRAINT;
    }

    public Constraint constraint() {
      return constraint;
    }

    @Override
    void collectVars(ImmutableSortedSet.Builder<Var> result) {
      result.addAll(constraint.term().coefficients().keySet());
    }

    @Override
    public String toString() {
      return constraint.toString();
    }
  }

  /** A negation. */
  public static final class Not extends Formula {
    private final Formula operand;

    Not(Formula operand) {
      this.operand = operand;
    }

    @Override
    public Kind kind() {
      return Kind.NOT;
    }

    public Formula operand() {
      return operand;
    }

    @Override
    void collectVars(ImmutableSortedSet.Builder<Var> result) {
      operand.collectVars(result);
    }

    @Override
    public String toString() {
      return "!(" + operand + ")";
    }
  }

  /** A conjunction or disjunction of at least two operands. */
  public static final class Junction extends Formula {
    private final Kind kind;
    private final ImmutableList<Formula> operands;

    Junction(Kind kind, List<Formula> operands) {
      this.kind = kind;
      this.operands = ImmutableList.copyOf(operands);
    }

    @Override
    public Kind kind() {
      return kind;
    }

    public ImmutableList<Formula> operands() {
      return operands;
    }

    @Override
    void collectVars(ImmutableSortedSet.Builder<Var> result) {
      for (Formula f : operands) {
        f.collectVars(result);
      }
    }

    @Override
    public String toString() {
      return "(" + Joiner.on(kind == Kind.AND ? " && " : " || ").join(operands) + ")";
    }
  }
}
