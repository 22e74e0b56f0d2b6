package org.obligato.solver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.obligato.tree.Trees.and;
import static org.obligato.tree.Trees.call;
import static org.obligato.tree.Trees.forall;
import static org.obligato.tree.Trees.ge;
import static org.obligato.tree.Trees.gt;
import static org.obligato.tree.Trees.ident;
import static org.obligato.tree.Trees.le;
import static org.obligato.tree.Trees.lit;
import static org.obligato.tree.Trees.lt;
import static org.obligato.tree.Trees.ne;
import static org.obligato.tree.Trees.plus;
import static org.obligato.tree.Trees.range;
import static org.obligato.tree.Trees.times;

import com.google.common.collect.ImmutableMap;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.obligato.binder.BindingKind;
import org.obligato.binder.ContextSnapshot;
import org.obligato.binder.FactContext;
import org.obligato.binder.Provenance;
import org.obligato.binder.ScopeKind;
import org.obligato.options.EngineOptions;
import org.obligato.tree.NodeId;
import org.obligato.tree.Tree.Expression;
import org.obligato.type.Type;

@RunWith(JUnit4.class)
public class LinearArithmeticSolverTest {

  private static final NodeId ORIGIN = NodeId.root("solver");

  private final Solver solver = new LinearArithmeticSolver(EngineOptions.defaults());
  private FactContext ctx;

  @Before
  public void setUp() {
    ctx = new FactContext();
    ctx.enterScope(ScopeKind.FUNCTION);
    for (String name : new String[] {"n", "d", "x", "y"}) {
      ctx.bind(name, Type.INT, false, BindingKind.PARAMETER, ORIGIN);
    }
  }

  private void assume(Expression fact) {
    ctx.assume(fact, Provenance.PRECONDITION, ORIGIN);
  }

  private ContextSnapshot snapshot() {
    return new ContextSnapshot(ctx.visibleBindings(), ctx.visibleFacts(), ImmutableMap.of());
  }

  private SolverOutcome decide(Expression goal) {
    return solver.decide(goal, snapshot());
  }

  @Test
  public void unconstrainedDivisorIsIncompleteFacts() {
    SolverOutcome outcome = decide(ne(ident("d"), lit(0)));
    assertEquals(SolverResult.UNKNOWN, outcome.result());
    assertEquals(UnknownCategory.INCOMPLETE_FACTS, outcome.unknownReason().get().category());
  }

  @Test
  public void guardDischargesTheDivisor() {
    assume(ne(ident("d"), lit(0)));
    assertTrue(decide(ne(ident("d"), lit(0))).isDischarged());
  }

  @Test
  public void refinementMismatchHasAWitness() {
    assume(gt(ident("x"), lit(5)));
    SolverOutcome outcome = decide(le(ident("x"), lit(5)));
    assertEquals(SolverResult.COUNTEREXAMPLE, outcome.result());
    assertEquals(ImmutableMap.of("x", "6"), outcome.counterexample());
  }

  @Test
  public void chainedFactsDischarge() {
    assume(gt(ident("x"), lit(0)));
    assume(gt(ident("y"), plus(ident("x"), lit(2))));
    assertTrue(decide(ge(ident("y"), lit(4))).isDischarged());
    assertEquals(SolverResult.COUNTEREXAMPLE, decide(ge(ident("y"), lit(5))).result());
  }

  @Test
  public void unrelatedFactsAreIgnored() {
    assume(gt(ident("n"), lit(100)));
    assume(gt(ident("x"), lit(0)));
    SolverOutcome outcome = decide(lt(ident("x"), lit(3)));
    assertEquals(ImmutableMap.of("x", "3"), outcome.counterexample());
  }

  @Test
  public void nonlinearGoalIsUnknown() {
    assume(gt(ident("x"), lit(0)));
    assume(gt(ident("y"), lit(0)));
    SolverOutcome outcome = decide(gt(times(ident("x"), ident("y")), lit(0)));
    assertEquals(SolverResult.UNKNOWN, outcome.result());
    assertEquals(UnknownCategory.NONLINEAR, outcome.unknownReason().get().category());
  }

  @Test
  public void scalingByAConstantIsLinear() {
    assume(gt(ident("x"), lit(2)));
    assertTrue(decide(gt(times(lit(3), ident("x")), lit(6))).isDischarged());
  }

  @Test
  public void quantifiedGoalIsUnknown() {
    assume(gt(ident("n"), lit(0)));
    SolverOutcome outcome =
        decide(forall("i", range(lit(0), ident("n")), ge(ident("i"), lit(0))));
    assertEquals(UnknownCategory.QUANTIFIED, outcome.unknownReason().get().category());
  }

  @Test
  public void unboundNameIsUnsupported() {
    SolverOutcome outcome = decide(gt(ident("missing"), lit(0)));
    assertEquals(UnknownCategory.UNSUPPORTED, outcome.unknownReason().get().category());
  }

  @Test
  public void disjunctBudgetReportsTimeout() {
    Solver tight =
        new LinearArithmeticSolver(EngineOptions.defaults().toBuilder().setMaxDisjuncts(1).build());
    assume(ne(ident("x"), lit(3)));
    assume(ne(ident("y"), lit(3)));
    SolverOutcome outcome = tight.decide(ne(plus(ident("x"), ident("y")), lit(0)), snapshot());
    assertEquals(UnknownCategory.TIMEOUT, outcome.unknownReason().get().category());
  }

  @Test
  public void lowerBoundEntailmentMatchesBruteForce() {
    for (int a = -4; a <= 4; a++) {
      for (int b = -4; b <= 4; b++) {
        setUp();
        assume(gt(ident("x"), lit(a)));
        SolverOutcome outcome = decide(ge(ident("x"), lit(b)));
        String label = "x > " + a + " implies x >= " + b;
        if (b <= a + 1) {
          assertTrue(label, outcome.isDischarged());
        } else {
          assertEquals(label, SolverResult.COUNTEREXAMPLE, outcome.result());
          long witness = Long.parseLong(outcome.counterexample().get("x"));
          assertTrue(label, witness > a && witness < b);
        }
      }
    }
  }

  @Test
  public void uninterpretedCallsAreAtoms() {
    assume(and(ge(ident("n"), lit(0)), lt(ident("n"), call("len", ident("x")))));
    ContextSnapshot typed =
        new ContextSnapshot(
            ctx.visibleBindings(), ctx.visibleFacts(), ImmutableMap.of("len(x)", Type.INT));
    assertTrue(solver.decide(gt(call("len", ident("x")), lit(0)), typed).isDischarged());
    assertEquals(
        UnknownCategory.UNSUPPORTED,
        decide(gt(call("len", ident("x")), lit(0))).unknownReason().get().category());
  }
}
