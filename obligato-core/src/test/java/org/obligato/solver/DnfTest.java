package org.obligato.solver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.obligato.logic.Constraint;
import org.obligato.logic.Constraint.Relation;
import org.obligato.logic.Formula;
import org.obligato.logic.LinearTerm;
import org.obligato.logic.Sort;
import org.obligato.logic.Var;

@RunWith(JUnit4.class)
public class DnfTest {

  private static final Var X = new Var("x", Sort.INT, Var.Origin.BINDING);
  private static final Var Y = new Var("y", Sort.INT, Var.Origin.BINDING);

  private static Formula atom(Var var, Relation relation) {
    return Formula.atom(Constraint.of(LinearTerm.var(var), relation));
  }

  @Test
  public void constants() {
    assertEquals(ImmutableList.of(ImmutableList.of()), new Dnf(4).convert(Formula.TRUE));
    assertTrue(new Dnf(4).convert(Formula.FALSE).isEmpty());
    assertTrue(new Dnf(4).convert(Formula.not(Formula.TRUE)).isEmpty());
  }

  @Test
  public void disequalitiesSplit() {
    List<List<Constraint>> dnf = new Dnf(4).convert(atom(X, Relation.NE));
    assertEquals(2, dnf.size());
    for (List<Constraint> conjunct : dnf) {
      assertEquals(1, conjunct.size());
      assertEquals(Relation.LT, conjunct.get(0).relation());
    }
  }

  @Test
  public void negationIsPushedToTheAtoms() {
    // !(x <= 0 && y < 0) == x > 0 || y >= 0
    List<List<Constraint>> dnf =
        new Dnf(4)
            .convert(Formula.not(Formula.and(atom(X, Relation.LE), atom(Y, Relation.LT))));
    assertEquals(
        ImmutableList.of(
            ImmutableList.of(Constraint.of(LinearTerm.var(X).negate(), Relation.LT)),
            ImmutableList.of(Constraint.of(LinearTerm.var(Y).negate(), Relation.LE))),
        dnf);
  }

  @Test
  public void conjunctionDistributesOverDisjunction() {
    Formula f =
        Formula.and(
            Formula.or(atom(X, Relation.LT), atom(Y, Relation.LT)),
            Formula.or(atom(X, Relation.EQ), atom(Y, Relation.EQ)));
    List<List<Constraint>> dnf = new Dnf(4).convert(f);
    assertEquals(4, dnf.size());
    for (List<Constraint> conjunct : dnf) {
      assertEquals(2, conjunct.size());
    }
  }

  @Test
  public void disjunctBudgetIsEnforced() {
    Formula f =
        Formula.and(
            Formula.or(atom(X, Relation.LT), atom(Y, Relation.LT)),
            Formula.or(atom(X, Relation.EQ), atom(Y, Relation.EQ)));
    try {
      new Dnf(3).convert(f);
      fail();
    } catch (BudgetExceeded e) {
      assertEquals("more than 3 disjuncts", e.getMessage());
    }
  }
}
