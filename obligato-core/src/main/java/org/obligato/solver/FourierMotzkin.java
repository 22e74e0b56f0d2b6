package org.obligato.solver;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;
import org.obligato.logic.Constraint;
import org.obligato.logic.Constraint.Relation;
import org.obligato.logic.LinearTerm;
import org.obligato.logic.Rational;
import org.obligato.logic.Var;

/**
 * Decides a conjunction of linear constraints by Fourier-Motzkin elimination over the rationals.
 * Rows whose variables are all integral are tightened after every step (denominators cleared,
 * coefficients divided by their gcd with the constant rounded up, strict rows made non-strict).
 * Equalities are eliminated first by substitution.
 *
 * <p>Infeasibility is exact for the rationals, so it refutes the conjunction for any sort. A
 * model is built by back-substitution and checked against every input constraint; if integer
 * rounding leaves no value the result is {@link Status#ROUNDING_FAILED}.
 */
final class FourierMotzkin {

  enum Status {
    INFEASIBLE,
    MODEL,
    ROUNDING_FAILED
  }

  static final class Result {
    private final Status status;
    private final ImmutableMap<Var, Rational> model;

    private Result(Status status, ImmutableMap<Var, Rational> model) {
      this.status = status;
      this.model = model;
    }

    Status status() {
      return status;
    }

    ImmutableMap<Var, Rational> model() {
      return model;
    }
  }

  private static final Result INFEASIBLE = new Result(Status.INFEASIBLE, ImmutableMap.of());
  private static final Result ROUNDING_FAILED =
      new Result(Status.ROUNDING_FAILED, ImmutableMap.of());

  /** A variable eliminated by Fourier-Motzkin, with the rows that bounded it. */
  private static final class Elimination {
    final Var var;
    final List<Constraint> rows;

    Elimination(Var var, List<Constraint> rows) {
      this.var = var;
      this.rows = rows;
    }
  }

  private final int maxConstraints;
  private final Stopwatch stopwatch;
  private final Duration timeout;

  FourierMotzkin(int maxConstraints, Stopwatch stopwatch, Duration timeout) {
    this.maxConstraints = maxConstraints;
    this.stopwatch = stopwatch;
    this.timeout = timeout;
  }

  Result solve(List<Constraint> conjunct) {
    Set<Constraint> rows = new LinkedHashSet<>();
    for (Constraint c : conjunct) {
      if (!add(rows, c)) {
        return INFEASIBLE;
      }
    }

    List<Map.Entry<Var, LinearTerm>> definitions = new ArrayList<>();
    for (Optional<Constraint> eq = firstEquality(rows); eq.isPresent(); eq = firstEquality(rows)) {
      checkDeadline();
      Constraint row = eq.get();
      rows.remove(row);
      Var var = pivot(row.term());
      Rational a = row.term().coefficient(var);
      // a*v + rest == 0, so v == -rest/a
      LinearTerm rest = row.term().minus(LinearTerm.var(var).times(a));
      LinearTerm definition = rest.times(Rational.ONE.divide(a).negate());
      definitions.add(Map.entry(var, definition));
      Set<Constraint> next = new LinkedHashSet<>();
      for (Constraint c : rows) {
        if (!add(next, Constraint.of(c.term().substitute(var, definition), c.relation()))) {
          return INFEASIBLE;
        }
      }
      rows = next;
    }

    List<Elimination> eliminations = new ArrayList<>();
    for (Var var = choose(rows); var != null; var = choose(rows)) {
      checkDeadline();
      List<Constraint> lower = new ArrayList<>();
      List<Constraint> upper = new ArrayList<>();
      Set<Constraint> next = new LinkedHashSet<>();
      for (Constraint c : rows) {
        int sign = c.term().coefficient(var).signum();
        if (sign > 0) {
          upper.add(c);
        } else if (sign < 0) {
          lower.add(c);
        } else {
          next.add(c);
        }
      }
      for (Constraint up : upper) {
        for (Constraint lo : lower) {
          if (!add(next, combine(var, up, lo))) {
            return INFEASIBLE;
          }
        }
      }
      if (next.size() > maxConstraints) {
        throw new BudgetExceeded("more than " + maxConstraints + " constraints");
      }
      List<Constraint> bounds = new ArrayList<>(upper);
      bounds.addAll(lower);
      eliminations.add(new Elimination(var, bounds));
      rows = next;
    }

    Map<Var, Rational> model = new HashMap<>();
    for (Elimination elimination : Lists.reverse(eliminations)) {
      Rational value = pick(elimination, model);
      if (value == null) {
        return ROUNDING_FAILED;
      }
      model.put(elimination.var, value);
    }
    for (Map.Entry<Var, LinearTerm> definition : Lists.reverse(definitions)) {
      Rational value = evaluate(definition.getValue(), model);
      if (definition.getKey().sort().isIntegral() && !value.isInteger()) {
        return ROUNDING_FAILED;
      }
      model.put(definition.getKey(), value);
    }
    for (Constraint c : conjunct) {
      Constraint ground =
          Constraint.of(LinearTerm.constant(evaluate(c.term(), model)), c.relation());
      if (!ground.holdsTrivially()) {
        return ROUNDING_FAILED;
      }
    }
    return new Result(Status.MODEL, ImmutableMap.copyOf(model));
  }

  private void checkDeadline() {
    if (stopwatch.elapsed().compareTo(timeout) > 0) {
      throw new BudgetExceeded("deadline of " + timeout.toMillis() + "ms exceeded");
    }
  }

  /** Adds a tightened row; returns false if the row is unsatisfiable. */
  private static boolean add(Set<Constraint> rows, Constraint c) {
    Constraint row = tighten(c);
    if (row.term().isConstant()) {
      return row.holdsTrivially();
    }
    rows.add(row);
    return true;
  }

  static Constraint tighten(Constraint c) {
    LinearTerm term = c.term();
    if (term.isConstant() || !term.hasIntegralVars()) {
      return c;
    }
    term = term.clearDenominators();
    Relation relation = c.relation();
    if (relation == Relation.LT) {
      term = term.plus(LinearTerm.constant(1));
      relation = Relation.LE;
    }
    BigInteger gcd = term.coefficientGcd();
    if (gcd.compareTo(BigInteger.ONE) > 0) {
      BigInteger constant = term.constant().numerator();
      LinearTerm scaled =
          term.minus(LinearTerm.constant(term.constant())).times(Rational.of(BigInteger.ONE, gcd));
      switch (relation) {
        case EQ:
          if (constant.mod(gcd).signum() != 0) {
            return Constraint.of(LinearTerm.constant(1), Relation.EQ);
          }
          term = scaled.plus(LinearTerm.constant(Rational.of(constant, gcd)));
          break;
        case LE:
          term = scaled.plus(LinearTerm.constant(Rational.of(Rational.of(constant, gcd).ceil())));
          break;
        default:
          break;
      }
    }
    return Constraint.of(term, relation);
  }

  private static Optional<Constraint> firstEquality(Set<Constraint> rows) {
    for (Constraint c : rows) {
      if (c.relation() == Relation.EQ) {
        return Optional.of(c);
      }
    }
    return Optional.empty();
  }

  /** The variable to solve an equality for: the first with a unit coefficient, if any. */
  private static Var pivot(LinearTerm term) {
    for (Map.Entry<Var, Rational> e : term.coefficients().entrySet()) {
      if (e.getValue().abs().equals(Rational.ONE)) {
        return e.getKey();
      }
    }
    return term.coefficients().firstKey();
  }

  /** The next variable to eliminate: the one producing the fewest combined rows. */
  private static @Nullable Var choose(Set<Constraint> rows) {
    Set<Var> vars = new TreeSet<>();
    for (Constraint c : rows) {
      vars.addAll(c.term().coefficients().keySet());
    }
    Var best = null;
    long bestCost = Long.MAX_VALUE;
    for (Var var : vars) {
      long lower = 0;
      long upper = 0;
      for (Constraint c : rows) {
        int sign = c.term().coefficient(var).signum();
        if (sign > 0) {
          upper++;
        } else if (sign < 0) {
          lower++;
        }
      }
      long cost = lower * upper - lower - upper;
      if (cost < bestCost) {
        best = var;
        bestCost = cost;
      }
    }
    return best;
  }

  /** Combines {@code a*v + p rel 0} (a > 0) with {@code -b*v + q rel 0} (b > 0). */
  private static Constraint combine(Var var, Constraint upper, Constraint lower) {
    Rational a = upper.term().coefficient(var);
    Rational b = lower.term().coefficient(var).negate();
    LinearTerm sum = upper.term().times(b).plus(lower.term().times(a));
    boolean strict = upper.relation() == Relation.LT || lower.relation() == Relation.LT;
    return Constraint.of(sum, strict ? Relation.LT : Relation.LE);
  }

  /** Picks the value nearest zero allowed by the bounds of an eliminated variable. */
  private static @Nullable Rational pick(Elimination elimination, Map<Var, Rational> model) {
    Var var = elimination.var;
    Rational lo = null;
    boolean loStrict = false;
    Rational hi = null;
    boolean hiStrict = false;
    for (Constraint c : elimination.rows) {
      Rational a = c.term().coefficient(var);
      Rational rest = evaluate(c.term().minus(LinearTerm.var(var).times(a)), model);
      Rational bound = rest.negate().divide(a);
      boolean strict = c.relation() == Relation.LT;
      if (a.signum() > 0) {
        int cmp = hi == null ? -1 : bound.compareTo(hi);
        if (cmp < 0 || (cmp == 0 && strict)) {
          hi = bound;
          hiStrict = strict;
        }
      } else {
        int cmp = lo == null ? 1 : bound.compareTo(lo);
        if (cmp > 0 || (cmp == 0 && strict)) {
          lo = bound;
          loStrict = strict;
        }
      }
    }
    if (var.sort().isIntegral()) {
      BigInteger min = lo == null ? null : loStrict ? lo.floor().add(BigInteger.ONE) : lo.ceil();
      BigInteger max =
          hi == null ? null : hiStrict ? hi.ceil().subtract(BigInteger.ONE) : hi.floor();
      if (min != null && max != null && min.compareTo(max) > 0) {
        return null;
      }
      if (min != null && min.signum() > 0) {
        return Rational.of(min);
      }
      if (max != null && max.signum() < 0) {
        return Rational.of(max);
      }
      return Rational.ZERO;
    }
    boolean zeroAboveLo = lo == null || lo.signum() < 0 || (lo.signum() == 0 && !loStrict);
    boolean zeroBelowHi = hi == null || hi.signum() > 0 || (hi.signum() == 0 && !hiStrict);
    if (zeroAboveLo && zeroBelowHi) {
      return Rational.ZERO;
    }
    if (!zeroAboveLo) {
      if (!loStrict) {
        return lo;
      }
      Rational next = lo.add(Rational.ONE);
      return hi == null || next.compareTo(hi) < 0 ? next : midpoint(lo, hi);
    }
    if (!hiStrict) {
      return hi;
    }
    Rational next = hi.subtract(Rational.ONE);
    return lo == null || next.compareTo(lo) > 0 ? next : midpoint(lo, hi);
  }

  private static Rational midpoint(Rational a, Rational b) {
    return a.add(b).divide(Rational.of(2));
  }

  /** Evaluates a term, giving unconstrained variables the value zero. */
  static Rational evaluate(LinearTerm term, Map<Var, Rational> model) {
    for (Var var : term.coefficients().keySet()) {
      model.putIfAbsent(var, Rational.ZERO);
    }
    return term.evaluate(model);
  }
}
