package org.obligato.solver;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.obligato.logic.Constraint;
import org.obligato.logic.Constraint.Relation;
import org.obligato.logic.Formula;

/**
 * Disjunctive normal form of a {@link Formula}: a list of conjunctions of constraints, none of
 * them a disequality. An empty list is unsatisfiable; an empty conjunction is valid.
 */
final class Dnf {

  private final int maxDisjuncts;

  Dnf(int maxDisjuncts) {
    this.maxDisjuncts = maxDisjuncts;
  }

  List<List<Constraint>> convert(Formula f) {
    return convert(f, false);
  }

  private List<List<Constraint>> convert(Formula f, boolean negated) {
    switch (f.kind()) {
      case TRUE:
        return negated ? falsum() : verum();
      case FALSE:
        return negated ? verum() : falsum();
      case CONSTRAINT:
        {
          Constraint c = ((Formula.Atom) f).constraint();
          return atom(negated ? c.negate() : c);
        }
      case NOT:
        return convert(((Formula.Not) f).operand(), !negated);
      case AND:
      case OR:
        {
          boolean conjunction = (f.kind() == Formula.Kind.AND) != negated;
          List<List<Constraint>> result = conjunction ? verum() : falsum();
          for (Formula operand : ((Formula.Junction) f).operands()) {
            List<List<Constraint>> next = convert(operand, negated);
            result = conjunction ? product(result, next) : union(result, next);
          }
          return result;
        }
    }
    throw new AssertionError(f.kind());
  }

  private static List<List<Constraint>> verum() {
    List<List<Constraint>> result = new ArrayList<>();
    result.add(ImmutableList.of());
    return result;
  }

  private static List<List<Constraint>> falsum() {
    return new ArrayList<>();
  }

  private List<List<Constraint>> atom(Constraint c) {
    if (c.relation() != Relation.NE) {
      List<List<Constraint>> result = new ArrayList<>();
      result.add(ImmutableList.of(c));
      return result;
    }
    // t != 0 splits into t < 0 or -t < 0
    List<List<Constraint>> result = new ArrayList<>();
    result.add(ImmutableList.of(Constraint.of(c.term(), Relation.LT)));
    result.add(ImmutableList.of(Constraint.of(c.term().negate(), Relation.LT)));
    return result;
  }

  private List<List<Constraint>> union(List<List<Constraint>> a, List<List<Constraint>> b) {
    a.addAll(b);
    check(a.size());
    return a;
  }

  private List<List<Constraint>> product(List<List<Constraint>> a, List<List<Constraint>> b) {
    check((long) a.size() * b.size());
    List<List<Constraint>> result = new ArrayList<>();
    for (List<Constraint> x : a) {
      for (List<Constraint> y : b) {
        result.add(ImmutableList.<Constraint>builder().addAll(x).addAll(y).build());
      }
    }
    return result;
  }

  private void check(long size) {
    if (size > maxDisjuncts) {
      throw new BudgetExceeded("more than " + maxDisjuncts + " disjuncts");
    }
  }
}
