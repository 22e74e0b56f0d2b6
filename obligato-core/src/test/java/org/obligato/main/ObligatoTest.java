package org.obligato.main;

import static com.google.common.collect.Iterables.getOnlyElement;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.obligato.tree.Trees.assign;
import static org.obligato.tree.Trees.call;
import static org.obligato.tree.Trees.div;
import static org.obligato.tree.Trees.eq;
import static org.obligato.tree.Trees.exprStmt;
import static org.obligato.tree.Trees.fn;
import static org.obligato.tree.Trees.forLoop;
import static org.obligato.tree.Trees.ge;
import static org.obligato.tree.Trees.gt;
import static org.obligato.tree.Trees.ident;
import static org.obligato.tree.Trees.ifElse;
import static org.obligato.tree.Trees.intTy;
import static org.obligato.tree.Trees.le;
import static org.obligato.tree.Trees.let;
import static org.obligato.tree.Trees.letMut;
import static org.obligato.tree.Trees.lit;
import static org.obligato.tree.Trees.lt;
import static org.obligato.tree.Trees.plus;
import static org.obligato.tree.Trees.range;
import static org.obligato.tree.Trees.refined;
import static org.obligato.tree.Trees.str;
import static org.obligato.tree.Trees.unit;
import static org.obligato.tree.Trees.valueBlock;
import static org.obligato.tree.Trees.whileLoop;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.MoreCollectors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.obligato.binder.Prelude;
import org.obligato.diag.Diagnostic;
import org.obligato.diag.DiagnosticKind;
import org.obligato.extract.Obligation;
import org.obligato.extract.ObligationKind;
import org.obligato.model.EffectSet;
import org.obligato.options.EngineOptions;
import org.obligato.repair.Confidence;
import org.obligato.repair.PatchOp;
import org.obligato.repair.PatchOpKind;
import org.obligato.repair.RepairCandidate;
import org.obligato.repair.Safety;
import org.obligato.solver.LinearArithmeticSolver;
import org.obligato.solver.Solver;
import org.obligato.solver.SolverResult;
import org.obligato.solver.UnknownCategory;
import org.obligato.tree.Ast;
import org.obligato.tree.Tree;
import org.obligato.tree.Tree.Decl;

@RunWith(JUnit4.class)
public class ObligatoTest {

  private Obligato engine;

  @Before
  public void setUp() {
    engine = new Obligato(EngineOptions.defaults());
  }

  @After
  public void tearDown() {
    engine.close();
  }

  private static Ast ast(Decl... decls) {
    return Ast.of(unit(decls), "test");
  }

  private static Decl ratio() {
    return fn("ratio")
        .param("n", intTy())
        .param("d", intTy())
        .returns(intTy())
        .body(valueBlock(div(ident("n"), ident("d"))));
  }

  @Test
  public void unconstrainedDivisorIsGuardedAndThenDischarged() {
    CompileResult first = engine.check(ast(ratio()));
    assertEquals(CompileStatus.INCOMPLETE, first.status());
    Obligation divisor = getOnlyElement(first.obligations());
    assertEquals(ObligationKind.PRECONDITION, divisor.kind());
    assertEquals("d != 0", divisor.goalText());
    assertEquals(SolverResult.UNKNOWN, divisor.result());
    assertEquals(
        UnknownCategory.INCOMPLETE_FACTS,
        divisor.outcome().get().unknownReason().get().category());

    RepairCandidate guard = first.repair(divisor.repairRefs().get(0)).get();
    assertEquals("guard", guard.template());
    assertEquals(PatchOpKind.WRAP, guard.edits().get(0).kind());
    assertEquals(Confidence.HIGH, guard.confidence());
    assertEquals(Safety.LIKELY_PRESERVING, guard.safety());

    CompileResult second = engine.check(engine.applyRepairs(first, ImmutableList.of(guard.id())));
    Obligation guarded = second.obligation(divisor.id()).get();
    assertTrue(guarded.isDischarged());
    assertTrue(guarded.context().factTexts().contains("d != 0"));
    assertEquals(CompileStatus.SUCCESS, second.status());
    assertEquals(PassState.SUCCESS, second.state());
    assertEquals(ImmutableList.of(), ExpectedDeltaVerifier.verify(guard, second));
  }

  @Test
  public void refinementContradictedByParameterHasCounterexample() {
    CompileResult result =
        engine.check(
            ast(
                fn("clamp")
                    .param("x", refined(intTy(), "v", gt(ident("v"), lit(5))))
                    .returns(intTy())
                    .body(
                        valueBlock(
                            ident("y"),
                            let("y", refined(intTy(), "v", le(ident("v"), lit(5))), ident("x"))))));
    Obligation bound = getOnlyElement(result.obligations());
    assertEquals(ObligationKind.REFINEMENT, bound.kind());
    assertEquals("x <= 5", bound.goalText());
    assertEquals(SolverResult.COUNTEREXAMPLE, bound.result());
    assertEquals(ImmutableMap.of("x", "6"), bound.outcome().get().counterexample());
    assertEquals(CompileStatus.INCOMPLETE, result.status());

    RepairCandidate guard = result.repair(bound.repairRefs().get(0)).get();
    assertEquals("guard", guard.template());
    assertEquals(Safety.BEHAVIOR_CHANGING, guard.safety());
  }

  @Test
  public void misspelledNameGetsRankedRenames() {
    CompileResult result =
        engine.check(
            ast(
                fn("pick")
                    .param("hello", intTy())
                    .param("help", intTy())
                    .returns(intTy())
                    .body(valueBlock(ident("helo")))));
    assertEquals(CompileStatus.ERROR, result.status());
    Diagnostic unresolved = getOnlyElement(result.diagnostics());
    assertEquals(DiagnosticKind.UNRESOLVED_NAME, unresolved.kind());
    assertEquals(2, unresolved.repairRefs().size());

    RepairCandidate hello = result.repair(unresolved.repairRefs().get(0)).get();
    RepairCandidate help = result.repair(unresolved.repairRefs().get(1)).get();
    assertEquals("rename_symbol", hello.template());
    assertEquals("hello", hello.edits().get(0).name());
    assertEquals(Confidence.HIGH, hello.confidence());
    assertEquals("help", help.edits().get(0).name());
    assertEquals(Confidence.MEDIUM, help.confidence());
    assertEquals(Safety.BEHAVIOR_CHANGING, hello.safety());
    assertTrue(hello.compatibility().conflictsWith().contains(help.id()));
    assertTrue(help.compatibility().conflictsWith().contains(hello.id()));
    assertFalse(hello.compatibility().batchKey().equals(help.compatibility().batchKey()));

    CompileResult renamed = engine.check(engine.applyRepairs(result, ImmutableList.of(hello.id())));
    assertEquals(CompileStatus.SUCCESS, renamed.status());
    assertEquals(ImmutableList.of(), ExpectedDeltaVerifier.verify(hello, renamed));
  }

  @Test
  public void ioInPureFunctionWidensExactlyIo() {
    CompileResult result =
        engine.check(ast(fn("greet").body(exprStmt(call("print", str("hi"))))));
    Obligation effect = getOnlyElement(result.obligations());
    assertEquals(ObligationKind.EFFECT, effect.kind());
    assertEquals(SolverResult.COUNTEREXAMPLE, effect.result());

    RepairCandidate widen = result.repair(getOnlyElement(effect.repairRefs())).get();
    assertEquals("widen_effect", widen.template());
    assertEquals(Confidence.HIGH, widen.confidence());
    assertEquals(Safety.LIKELY_PRESERVING, widen.safety());
    PatchOp op = getOnlyElement(widen.edits());
    assertEquals(PatchOpKind.WIDEN_EFFECT, op.kind());
    assertEquals(EffectSet.of(Prelude.IO), op.effects());

    CompileResult widened = engine.check(engine.applyRepairs(result, ImmutableList.of(widen.id())));
    assertEquals(CompileStatus.SUCCESS, widened.status());
    Tree.FnDecl greet = (Tree.FnDecl) widened.canonicalAst().root().decls().get(0);
    assertEquals(ImmutableList.of(Prelude.IO), greet.effects());
  }

  @Test
  public void unusedLinearHandleIsViolatedWithoutSolver() {
    AtomicInteger calls = new AtomicInteger();
    Solver delegate = new LinearArithmeticSolver(EngineOptions.defaults());
    Solver counting =
        (goal, context) -> {
          calls.incrementAndGet();
          return delegate.decide(goal, context);
        };
    try (Obligato counted = new Obligato(EngineOptions.defaults(), counting)) {
      CompileResult result =
          counted.check(
              ast(
                  fn("leak")
                      .effect(Prelude.IO)
                      .body(let("h", call("open_file", str("log.txt"))))));
      Obligation linear = getOnlyElement(result.obligations());
      assertEquals(ObligationKind.LINEARITY, linear.kind());
      assertEquals(SolverResult.COUNTEREXAMPLE, linear.result());
      assertEquals(ImmutableMap.of("uses(h)", "0"), linear.outcome().get().counterexample());
      assertEquals(0, calls.get());

      RepairCandidate close = result.repair(getOnlyElement(linear.repairRefs())).get();
      assertEquals("close_linear", close.template());
      PatchOp insert = getOnlyElement(close.edits());
      assertEquals(PatchOpKind.INSERT_AFTER, insert.kind());
      assertEquals(linear.primaryNode(), insert.target());

      CompileResult closed =
          counted.check(counted.applyRepairs(result, ImmutableList.of(close.id())));
      assertEquals(CompileStatus.SUCCESS, closed.status());
      assertTrue(closed.obligation(linear.id()).get().isDischarged());
    }
  }

  @Test
  public void passesAreDeterministicAcrossPoolSizes() {
    Ast input =
        ast(
            ratio(),
            fn("greet").body(exprStmt(call("print", str("hi")))),
            fn("sum")
                .param("a", intTy())
                .returns(intTy())
                .body(valueBlock(plus(ident("a"), ident("b")))));
    CompileResult serial = engine.check(input);
    try (Obligato parallel =
        new Obligato(EngineOptions.defaults().toBuilder().setParallelism(4).build())) {
      for (int i = 0; i < 3; i++) {
        CompileResult again = parallel.check(input);
        assertEquals(serial.canonicalAst(), again.canonicalAst());
        assertEquals(serial.diagnostics(), again.diagnostics());
        assertEquals(render(serial.obligations()), render(again.obligations()));
        assertEquals(serial.repairs(), again.repairs());
      }
    }
  }

  private static ImmutableList<String> render(ImmutableList<Obligation> obligations) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (Obligation obligation : obligations) {
      result.add(obligation + " " + obligation.repairRefs());
    }
    return result.build();
  }

  @Test
  public void emptySelectionOnSuccessIsFixedPoint() {
    CompileResult result =
        engine.check(
            ast(
                fn("half")
                    .param("n", intTy())
                    .param("d", refined(intTy(), "v", gt(ident("v"), lit(0))))
                    .returns(intTy())
                    .body(valueBlock(div(ident("n"), ident("d"))))));
    assertEquals(CompileStatus.SUCCESS, result.status());
    Ast same = engine.apply(result.canonicalAst(), ImmutableList.of());
    assertEquals(result.canonicalAst(), same);
    CompileResult again = engine.check(same);
    assertEquals(CompileStatus.SUCCESS, again.status());
    assertEquals(render(result.obligations()), render(again.obligations()));
  }

  @Test
  public void candidatesSharingBatchApplyInAnyOrder() {
    CompileResult result =
        engine.check(ast(ratio(), fn("greet").body(exprStmt(call("print", str("hi"))))));
    Ast ast = result.canonicalAst();
    int pairs = 0;
    for (RepairCandidate a : result.repairs()) {
      for (RepairCandidate b : result.repairs()) {
        if (a.id().compareTo(b.id()) >= 0
            || !a.compatibility().batchKey().equals(b.compatibility().batchKey())) {
          continue;
        }
        pairs++;
        ImmutableList<PatchOp> ab =
            ImmutableList.<PatchOp>builder().addAll(a.edits()).addAll(b.edits()).build();
        ImmutableList<PatchOp> ba =
            ImmutableList.<PatchOp>builder().addAll(b.edits()).addAll(a.edits()).build();
        Ast together = engine.apply(ast, ab);
        assertEquals(together, engine.apply(ast, ba));
        assertEquals(together, engine.apply(engine.apply(ast, a.edits()), b.edits()));
        assertEquals(together, engine.apply(engine.apply(ast, b.edits()), a.edits()));
      }
    }
    assertTrue(pairs > 0);
  }

  @Test
  public void appliedRepairsMeetExpectedDelta() {
    CompileResult result =
        engine.check(ast(ratio(), fn("greet").body(exprStmt(call("print", str("hi"))))));
    for (RepairCandidate repair : result.repairs()) {
      if (!repair.prerequisites().isEmpty()) {
        continue;
      }
      CompileResult next = engine.check(engine.applyRepairs(result, ImmutableList.of(repair.id())));
      assertEquals(repair.id(), ImmutableList.of(), ExpectedDeltaVerifier.verify(repair, next));
    }
  }

  @Test
  public void unknownRepairIdIsRejected() {
    CompileResult result = engine.check(ast(ratio()));
    try {
      engine.applyRepairs(result, ImmutableList.of("rp-nothing"));
      fail();
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage().contains("rp-nothing"));
    }
  }

  @Test
  public void successfulPassCannotBeRepaired() {
    CompileResult result = engine.check(ast(fn("noop").body()));
    assertEquals(CompileStatus.SUCCESS, result.status());
    try {
      engine.applyRepairs(result, ImmutableList.of());
      fail();
    } catch (IllegalStateException expected) {
    }
  }

  private static Obligation refinementOf(CompileResult result) {
    return result.obligations().stream()
        .filter(o -> o.kind() == ObligationKind.REFINEMENT)
        .collect(MoreCollectors.onlyElement());
  }

  @Test
  public void effectfulConditionSaysNothingAboutTheNextCall() {
    CompileResult result =
        engine.check(
            ast(
                fn("roll").returns(intTy()).effect("Random").extern(),
                fn("twice")
                    .returns(intTy())
                    .effect("Random")
                    .body(
                        valueBlock(
                            ifElse(
                                eq(call("roll"), lit(5)),
                                valueBlock(
                                    ident("y"),
                                    let(
                                        "y",
                                        refined(intTy(), "v", eq(ident("v"), lit(5))),
                                        call("roll"))),
                                valueBlock(lit(0)))))));
    Obligation obligation = refinementOf(result);
    assertFalse(obligation.isDischarged());
    assertEquals(CompileStatus.INCOMPLETE, result.status());
    for (RepairCandidate repair : result.repairs()) {
      assertFalse(repair.toString(), repair.template().equals("guard"));
    }
  }

  @Test
  public void loopCounterIsNotProvedConstant() {
    CompileResult result =
        engine.check(
            ast(
                fn("count")
                    .body(
                        letMut("i", lit(0)),
                        whileLoop(
                            lt(ident("i"), lit(10)),
                            let("z", refined(intTy(), "v", eq(ident("v"), lit(0))), ident("i")),
                            assign("i", plus(ident("i"), lit(1)))))));
    assertEquals(SolverResult.COUNTEREXAMPLE, refinementOf(result).result());
    assertEquals(CompileStatus.INCOMPLETE, result.status());
  }

  @Test
  public void rangeLoopDischargesItsLowerBound() {
    CompileResult result =
        engine.check(
            ast(
                fn("walk")
                    .param("n", intTy())
                    .body(
                        forLoop(
                            "i",
                            range(lit(0), ident("n")),
                            let("k", refined(intTy(), "v", ge(ident("v"), lit(0))), ident("i"))))));
    assertEquals(SolverResult.DISCHARGED, refinementOf(result).result());
    assertEquals(CompileStatus.SUCCESS, result.status());
  }
}
