package org.obligato.extract;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.obligato.tree.Trees.arm;
import static org.obligato.tree.Trees.assign;
import static org.obligato.tree.Trees.block;
import static org.obligato.tree.Trees.call;
import static org.obligato.tree.Trees.div;
import static org.obligato.tree.Trees.eq;
import static org.obligato.tree.Trees.exprStmt;
import static org.obligato.tree.Trees.fail;
import static org.obligato.tree.Trees.fn;
import static org.obligato.tree.Trees.forLoop;
import static org.obligato.tree.Trees.ge;
import static org.obligato.tree.Trees.gt;
import static org.obligato.tree.Trees.hole;
import static org.obligato.tree.Trees.ident;
import static org.obligato.tree.Trees.ifElse;
import static org.obligato.tree.Trees.ifThen;
import static org.obligato.tree.Trees.intTy;
import static org.obligato.tree.Trees.le;
import static org.obligato.tree.Trees.let;
import static org.obligato.tree.Trees.letMut;
import static org.obligato.tree.Trees.lit;
import static org.obligato.tree.Trees.litPat;
import static org.obligato.tree.Trees.lt;
import static org.obligato.tree.Trees.match;
import static org.obligato.tree.Trees.ne;
import static org.obligato.tree.Trees.plus;
import static org.obligato.tree.Trees.range;
import static org.obligato.tree.Trees.refined;
import static org.obligato.tree.Trees.ret;
import static org.obligato.tree.Trees.str;
import static org.obligato.tree.Trees.unit;
import static org.obligato.tree.Trees.valueBlock;
import static org.obligato.tree.Trees.whileLoop;
import static org.obligato.tree.Trees.wild;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.MoreCollectors;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.obligato.apply.Canonicalizer;
import org.obligato.binder.GlobalEnv;
import org.obligato.diag.Diagnostic;
import org.obligato.diag.DiagnosticKind;
import org.obligato.diag.DiagnosticLog;
import org.obligato.diag.Severity;
import org.obligato.model.Const;
import org.obligato.solver.SolverResult;
import org.obligato.tree.Ast;
import org.obligato.tree.Tree.CompUnit;
import org.obligato.tree.Tree.Decl;

@RunWith(JUnit4.class)
public class ObligationExtractorTest {

  private DiagnosticLog log;

  private Extraction extract(CompUnit unit) {
    Ast ast = Canonicalizer.canonicalize(Ast.of(unit, "extract"));
    log = new DiagnosticLog();
    return ObligationExtractor.extract(ast, GlobalEnv.create(ast.root(), log), log);
  }

  private static ImmutableList<String> goals(Extraction extraction) {
    return extraction.obligations().stream().map(Obligation::goalText).collect(toImmutableList());
  }

  @Test
  public void divisorMustBeNonzero() {
    Extraction extraction =
        extract(
            unit(
                fn("ratio")
                    .param("n", intTy())
                    .param("d", intTy())
                    .returns(intTy())
                    .body(valueBlock(div(ident("n"), ident("d"))))));
    Obligation obligation = Iterables.getOnlyElement(extraction.obligations());
    assertEquals(ObligationKind.PRECONDITION, obligation.kind());
    assertEquals("d != 0", obligation.goalText());
    assertTrue(obligation.id(), obligation.id().startsWith("ob-precondition-"));
    assertFalse(obligation.isDecided());
    assertEquals(ImmutableList.of(), obligation.context().factTexts());
    assertTrue(log.diagnostics().isEmpty());
  }

  @Test
  public void earlyReturnLeavesTheNegatedGuard() {
    Extraction extraction =
        extract(
            unit(
                fn("ratio")
                    .param("n", intTy())
                    .param("d", intTy())
                    .returns(intTy())
                    .body(
                        valueBlock(
                            div(ident("n"), ident("d")),
                            exprStmt(ifThen(eq(ident("d"), lit(0)), block(ret(lit(0)))))))));
    Obligation obligation = Iterables.getOnlyElement(extraction.obligations());
    assertEquals("d != 0", obligation.goalText());
    assertTrue(obligation.context().factTexts().contains("d != 0"));
  }

  @Test
  public void declaredRefinementOfALet() {
    Extraction extraction =
        extract(
            unit(
                fn("clamp")
                    .param("x", refined(intTy(), "v", gt(ident("v"), lit(5))))
                    .body(
                        let(
                            "y",
                            refined(intTy(), "v", le(ident("v"), lit(5))),
                            ident("x")))));
    Obligation obligation = Iterables.getOnlyElement(extraction.obligations());
    assertEquals(ObligationKind.REFINEMENT, obligation.kind());
    assertEquals("x <= 5", obligation.goalText());
    assertEquals(ImmutableList.of("x > 5"), obligation.context().factTexts());
    assertEquals("declared refinement of y", obligation.origin());
  }

  @Test
  public void postconditionIsStatedOverTheReturnedValue() {
    Extraction extraction =
        extract(
            unit(
                fn("inc")
                    .param("x", intTy())
                    .returns(intTy())
                    .ensures(gt(ident("result"), ident("x")))
                    .body(valueBlock(plus(ident("x"), lit(1))))));
    Obligation obligation = Iterables.getOnlyElement(extraction.obligations());
    assertEquals(ObligationKind.POSTCONDITION, obligation.kind());
    assertEquals("x + 1 > x", obligation.goalText());
  }

  @Test
  public void missingEffectIsDecidedImmediately() {
    Extraction extraction =
        extract(unit(fn("say").body(exprStmt(call("print", str("hi"))))));
    Obligation obligation = Iterables.getOnlyElement(extraction.obligations());
    assertEquals(ObligationKind.EFFECT, obligation.kind());
    assertEquals(SolverResult.COUNTEREXAMPLE, obligation.result());
    assertTrue(obligation.outcome().get().counterexample().containsKey("missing"));
    assertFalse(obligation.kind().needsSolver());
  }

  @Test
  public void declaredEffectNeedsNoObligation() {
    Extraction extraction =
        extract(unit(fn("say").effect("IO").body(exprStmt(call("print", str("hi"))))));
    assertEquals(ImmutableList.of(), extraction.obligations());
  }

  @Test
  public void leakedHandleIsALinearityCounterexample() {
    Extraction extraction =
        extract(unit(fn("leak").effect("IO").body(let("h", call("open_file", str("a"))))));
    Obligation obligation = Iterables.getOnlyElement(extraction.obligations());
    assertEquals(ObligationKind.LINEARITY, obligation.kind());
    assertEquals("uses(h) == 1", obligation.goalText());
    assertEquals(ImmutableMap.of("uses(h)", "0"), obligation.outcome().get().counterexample());
  }

  @Test
  public void closedHandleIsDischarged() {
    Extraction extraction =
        extract(
            unit(
                fn("tidy")
                    .effect("IO")
                    .body(
                        let("h", call("open_file", str("a"))),
                        exprStmt(call("close_file", ident("h"))))));
    Obligation obligation = Iterables.getOnlyElement(extraction.obligations());
    assertTrue(obligation.isDischarged());
  }

  @Test
  public void holesRecordTheirExpectedType() {
    Extraction extraction =
        extract(unit(fn("todo").returns(intTy()).body(valueBlock(hole("impl")))));
    TypedHole hole = Iterables.getOnlyElement(extraction.holes());
    assertEquals("impl", hole.name());
    assertEquals("Int", hole.expectedType().toString());
  }

  @Test
  public void unresolvedNameIsADiagnostic() {
    Extraction extraction =
        extract(
            unit(fn("f").param("hello", intTy()).returns(intTy()).body(valueBlock(ident("helo")))));
    assertEquals(ImmutableList.of(), goals(extraction));
    Diagnostic diagnostic = Iterables.getOnlyElement(log.diagnostics());
    assertEquals(DiagnosticKind.UNRESOLVED_NAME, diagnostic.kind());
    assertEquals("cannot find symbol helo", diagnostic.message());
    assertEquals("hello", diagnostic.structured().get("candidates"));
  }

  @Test
  public void codeAfterReturnIsUnreachable() {
    extract(
        unit(
            fn("f")
                .returns(intTy())
                .body(ret(lit(1)), let("x", div(lit(1), lit(0))))));
    Diagnostic diagnostic = Iterables.getOnlyElement(log.diagnostics());
    assertEquals(DiagnosticKind.UNREACHABLE_CODE, diagnostic.kind());
    assertEquals(Severity.WARNING, diagnostic.severity());
  }

  @Test
  public void obligationIdsAreStable() {
    CompUnit unit =
        unit(
            fn("ratio")
                .param("n", intTy())
                .param("d", intTy())
                .returns(intTy())
                .body(valueBlock(div(ident("n"), div(ident("n"), ident("d"))))));
    ImmutableList<String> first =
        extract(unit).obligations().stream().map(Obligation::id).collect(toImmutableList());
    ImmutableList<String> second =
        extract(unit).obligations().stream().map(Obligation::id).collect(toImmutableList());
    assertEquals(2, first.size());
    assertEquals(first, second);
  }

  private static Decl roll() {
    return fn("roll").returns(intTy()).effect("Random").extern();
  }

  private static Obligation refinementOf(Extraction extraction) {
    return extraction.obligations().stream()
        .filter(o -> o.kind() == ObligationKind.REFINEMENT)
        .collect(MoreCollectors.onlyElement());
  }

  @Test
  public void effectfulConditionIsNotAFact() {
    Extraction extraction =
        extract(
            unit(
                roll(),
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
    Obligation obligation = refinementOf(extraction);
    assertEquals("roll() == 5", obligation.goalText());
    assertEquals(ImmutableList.of(), obligation.context().factTexts());
  }

  @Test
  public void effectfulLoopConditionIsNotAFact() {
    Extraction extraction =
        extract(
            unit(
                roll(),
                fn("spin")
                    .effect("Random")
                    .body(
                        whileLoop(
                            lt(call("roll"), lit(5)),
                            let(
                                "y",
                                refined(intTy(), "v", lt(ident("v"), lit(5))),
                                call("roll"))))));
    Obligation obligation = refinementOf(extraction);
    assertEquals("roll() < 5", obligation.goalText());
    assertEquals(ImmutableList.of(), obligation.context().factTexts());
  }

  @Test
  public void valuesAssignedInALoopAreForgotten() {
    Extraction extraction =
        extract(
            unit(
                fn("count")
                    .body(
                        letMut("i", lit(0)),
                        whileLoop(
                            lt(ident("i"), lit(10)),
                            let("z", refined(intTy(), "v", eq(ident("v"), lit(0))), ident("i")),
                            assign("i", plus(ident("i"), lit(1)))))));
    Obligation obligation = refinementOf(extraction);
    assertEquals("i == 0", obligation.goalText());
    assertEquals(ImmutableList.of("i < 10"), obligation.context().factTexts());
  }

  @Test
  public void loopConditionIsNegatedAfterTheLoop() {
    Extraction extraction =
        extract(
            unit(
                fn("count")
                    .body(
                        letMut("i", lit(0)),
                        whileLoop(lt(ident("i"), lit(10)), assign("i", plus(ident("i"), lit(1)))),
                        let("z", refined(intTy(), "v", ge(ident("v"), lit(10))), ident("i")))));
    Obligation obligation = refinementOf(extraction);
    assertEquals(ImmutableList.of("i >= 10"), obligation.context().factTexts());
  }

  @Test
  public void rangeBoundsHoldInsideTheLoop() {
    Extraction extraction =
        extract(
            unit(
                fn("walk")
                    .param("n", intTy())
                    .body(
                        forLoop(
                            "i",
                            range(lit(0), ident("n")),
                            let("k", refined(intTy(), "v", ge(ident("v"), lit(0))), ident("i"))))));
    Obligation obligation = refinementOf(extraction);
    assertEquals("i >= 0", obligation.goalText());
    assertTrue(obligation.context().factTexts().contains("0 <= i"));
    assertTrue(obligation.context().factTexts().contains("i < n"));
  }

  private Extraction threeArms(boolean firstArmFails) {
    return extract(
        unit(
            fn("pick")
                .param("k", intTy())
                .body(
                    exprStmt(
                        match(
                            ident("k"),
                            arm(
                                litPat(Const.of(1)),
                                firstArmFails ? valueBlock(fail("one")) : block()),
                            arm(litPat(Const.of(2)), block()),
                            arm(wild(), block()))),
                    let("t", refined(intTy(), "v", ne(ident("v"), lit(1))), ident("k")))));
  }

  @Test
  public void mergeKeepsWhatEveryLiveArmKnows() {
    Obligation obligation = refinementOf(threeArms(true));
    assertEquals("k != 1", obligation.goalText());
    assertEquals(ImmutableList.of("k != 1"), obligation.context().factTexts());
  }

  @Test
  public void mergeDropsWhatOneLiveArmLacks() {
    Obligation obligation = refinementOf(threeArms(false));
    assertEquals(ImmutableList.of(), obligation.context().factTexts());
  }
}
