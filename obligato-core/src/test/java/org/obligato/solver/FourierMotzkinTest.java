package org.obligato.solver;

import static org.junit.Assert.assertEquals;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.time.Duration;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.obligato.logic.Constraint;
import org.obligato.logic.Constraint.Relation;
import org.obligato.logic.LinearTerm;
import org.obligato.logic.Rational;
import org.obligato.logic.Sort;
import org.obligato.logic.Var;

@RunWith(JUnit4.class)
public class FourierMotzkinTest {

  private static final Var X = new Var("x", Sort.INT, Var.Origin.BINDING);
  private static final Var Y = new Var("y", Sort.INT, Var.Origin.BINDING);
  private static final Var R = new Var("r", Sort.REAL, Var.Origin.BINDING);

  private static FourierMotzkin.Result solve(Constraint... constraints) {
    return new FourierMotzkin(100, Stopwatch.createStarted(), Duration.ofSeconds(10))
        .solve(ImmutableList.copyOf(constraints));
  }

  /** {@code lhs rel rhs}, for {@code lhs} a variable and {@code rhs} a constant. */
  private static Constraint cmp(Var lhs, Relation rel, long rhs) {
    return Constraint.of(LinearTerm.var(lhs).minus(LinearTerm.constant(rhs)), rel);
  }

  /** {@code lhs > rhs}. */
  private static Constraint above(Var lhs, long rhs) {
    return Constraint.of(LinearTerm.constant(rhs).minus(LinearTerm.var(lhs)), Relation.LT);
  }

  @Test
  public void picksTheIntegerNearestZero() {
    FourierMotzkin.Result result = solve(above(X, 5));
    assertEquals(FourierMotzkin.Status.MODEL, result.status());
    assertEquals(Rational.of(6), result.model().get(X));

    result = solve(cmp(X, Relation.LT, -2));
    assertEquals(Rational.of(-3), result.model().get(X));

    result = solve(cmp(X, Relation.LE, 10));
    assertEquals(Rational.ZERO, result.model().get(X));
  }

  @Test
  public void contradictoryBoundsAreInfeasible() {
    assertEquals(
        FourierMotzkin.Status.INFEASIBLE, solve(above(X, 5), cmp(X, Relation.LT, 3)).status());
  }

  @Test
  public void integerRowsAreTightened() {
    // no integer lies strictly between 0 and 1
    assertEquals(
        FourierMotzkin.Status.INFEASIBLE, solve(above(X, 0), cmp(X, Relation.LT, 1)).status());
  }

  @Test
  public void realsTakeAnInteriorPoint() {
    FourierMotzkin.Result result = solve(above(R, 0), cmp(R, Relation.LT, 1));
    assertEquals(FourierMotzkin.Status.MODEL, result.status());
    assertEquals(Rational.of(BigInteger.ONE, BigInteger.valueOf(2)), result.model().get(R));
  }

  @Test
  public void equalitiesAreSubstituted() {
    // x == y + 2 && y >= 3
    Constraint definition =
        Constraint.of(
            LinearTerm.var(X).minus(LinearTerm.var(Y)).minus(LinearTerm.constant(2)),
            Relation.EQ);
    Constraint bound =
        Constraint.of(LinearTerm.constant(3).minus(LinearTerm.var(Y)), Relation.LE);
    FourierMotzkin.Result result = solve(definition, bound);
    assertEquals(FourierMotzkin.Status.MODEL, result.status());
    assertEquals(Rational.of(3), result.model().get(Y));
    assertEquals(Rational.of(5), result.model().get(X));
  }

  @Test
  public void oddMultipleOfTwoIsInfeasibleOverIntegers() {
    Constraint twoXIsOne =
        Constraint.of(
            LinearTerm.var(X).times(Rational.of(2)).minus(LinearTerm.constant(1)), Relation.EQ);
    assertEquals(FourierMotzkin.Status.INFEASIBLE, solve(twoXIsOne).status());

    Constraint twoRIsOne =
        Constraint.of(
            LinearTerm.var(R).times(Rational.of(2)).minus(LinearTerm.constant(1)), Relation.EQ);
    FourierMotzkin.Result result = solve(twoRIsOne);
    assertEquals(FourierMotzkin.Status.MODEL, result.status());
    assertEquals("1/2", result.model().get(R).toString());
  }

  @Test(expected = BudgetExceeded.class)
  public void rowBudgetIsEnforced() {
    Var z = new Var("z", Sort.REAL, Var.Origin.BINDING);
    ImmutableList.Builder<Constraint> rows = ImmutableList.builder();
    for (int i = 0; i < 4; i++) {
      // z > x + i and z < y - i, over three variables
      rows.add(
          Constraint.of(
              LinearTerm.var(X).plus(LinearTerm.constant(i)).minus(LinearTerm.var(z)),
              Relation.LT));
      rows.add(
          Constraint.of(
              LinearTerm.var(z).minus(LinearTerm.var(Y)).plus(LinearTerm.constant(i)),
              Relation.LT));
    }
    new FourierMotzkin(2, Stopwatch.createStarted(), Duration.ofSeconds(10))
        .solve(rows.build());
  }
}
