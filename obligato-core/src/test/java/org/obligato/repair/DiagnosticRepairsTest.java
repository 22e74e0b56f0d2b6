package org.obligato.repair;

import static com.google.common.collect.MoreCollectors.onlyElement;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.obligato.tree.Trees.arm;
import static org.obligato.tree.Trees.assign;
import static org.obligato.tree.Trees.boolTy;
import static org.obligato.tree.Trees.fieldDecl;
import static org.obligato.tree.Trees.fn;
import static org.obligato.tree.Trees.hole;
import static org.obligato.tree.Trees.ident;
import static org.obligato.tree.Trees.init;
import static org.obligato.tree.Trees.intTy;
import static org.obligato.tree.Trees.let;
import static org.obligato.tree.Trees.lit;
import static org.obligato.tree.Trees.litPat;
import static org.obligato.tree.Trees.match;
import static org.obligato.tree.Trees.realTy;
import static org.obligato.tree.Trees.recordDecl;
import static org.obligato.tree.Trees.recordLit;
import static org.obligato.tree.Trees.ret;
import static org.obligato.tree.Trees.ty;
import static org.obligato.tree.Trees.unit;
import static org.obligato.tree.Trees.valueBlock;

import com.google.common.collect.ImmutableList;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.obligato.diag.DiagnosticKind;
import org.obligato.main.CompileResult;
import org.obligato.main.CompileStatus;
import org.obligato.main.Obligato;
import org.obligato.main.PassState;
import org.obligato.model.Const;
import org.obligato.options.EngineOptions;
import org.obligato.tree.Ast;
import org.obligato.tree.Tree.Decl;

@RunWith(JUnit4.class)
public class DiagnosticRepairsTest {

  private final Obligato engine = new Obligato(EngineOptions.defaults());

  @After
  public void tearDown() {
    engine.close();
  }

  private CompileResult check(Decl... decls) {
    return engine.check(Ast.of(unit(decls), "repairs"));
  }

  private static RepairCandidate only(CompileResult result, String template) {
    return result.repairs().stream()
        .filter(r -> r.template().equals(template))
        .collect(onlyElement());
  }

  /** Applies one repair and checks the next pass. */
  private CompileResult repair(CompileResult result, RepairCandidate repair) {
    return engine.check(engine.applyRepairs(result, ImmutableList.of(repair.id())));
  }

  @Test
  public void immutableLetBecomesMutable() {
    CompileResult result =
        check(
            fn("f")
                .returns(intTy())
                .body(valueBlock(ident("x"), let("x", lit(1)), assign("x", lit(2)))));
    assertEquals(
        DiagnosticKind.IMMUTABLE_ASSIGNMENT,
        result.diagnostics().stream().map(d -> d.kind()).collect(onlyElement()));
    RepairCandidate repair = only(result, "make_mutable");
    assertEquals(Confidence.HIGH, repair.confidence());
    assertEquals(Safety.BEHAVIOR_PRESERVING, repair.safety());
    CompileResult next = repair(result, repair);
    assertEquals(CompileStatus.SUCCESS, next.status());
    assertTrue(next.canonicalAst().toString().contains("let mut x = 1;"));
  }

  @Test
  public void assignedParameterIsShadowed() {
    CompileResult result =
        check(
            fn("g")
                .param("n", intTy())
                .returns(intTy())
                .body(valueBlock(ident("n"), assign("n", lit(2)))));
    RepairCandidate repair = only(result, "shadow_mutable");
    assertEquals(PatchOpKind.INSERT_BEFORE, repair.edits().get(0).kind());
    CompileResult next = repair(result, repair);
    assertEquals(CompileStatus.SUCCESS, next.status());
    assertTrue(next.canonicalAst().toString().contains("let mut n = n;"));
  }

  @Test
  public void missingFieldGetsADefault() {
    CompileResult result =
        check(
            recordDecl("Point", fieldDecl("x", intTy()), fieldDecl("y", intTy())),
            fn("origin")
                .returns(ty("Point"))
                .body(valueBlock(recordLit("Point", init("x", lit(0))))));
    RepairCandidate repair = only(result, "add_field");
    assertEquals(Confidence.MEDIUM, repair.confidence());
    CompileResult next = repair(result, repair);
    assertEquals(CompileStatus.SUCCESS, next.status());
    assertTrue(next.canonicalAst().toString().contains("y: 0"));
  }

  @Test
  public void nonExhaustiveMatchGetsAFailingWildcard() {
    CompileResult result =
        check(
            fn("f")
                .param("b", boolTy())
                .returns(intTy())
                .body(
                    valueBlock(
                        match(ident("b"), arm(litPat(Const.of(true)), valueBlock(lit(1)))))));
    RepairCandidate repair = only(result, "wildcard_arm");
    assertEquals(Safety.BEHAVIOR_PRESERVING, repair.safety());
    assertEquals(CompileStatus.SUCCESS, repair(result, repair).status());
  }

  @Test
  public void intWidensToReal() {
    CompileResult result =
        check(fn("f").param("n", intTy()).returns(realTy()).body(valueBlock(ident("n"))));
    RepairCandidate repair = only(result, "to_real");
    assertEquals(Confidence.HIGH, repair.confidence());
    assertEquals(PatchOpKind.WRAP, repair.edits().get(0).kind());
    CompileResult next = repair(result, repair);
    assertEquals(CompileStatus.SUCCESS, next.status());
    assertTrue(next.canonicalAst().toString().contains("return to_real(n);"));
  }

  @Test
  public void unreachableCodeIsDeleted() {
    CompileResult result =
        check(fn("f").returns(intTy()).body(ret(lit(1)), let("x", lit(2))));
    assertEquals(CompileStatus.ERROR, result.status());
    assertEquals(PassState.REPORTED, result.state());
    RepairCandidate repair = only(result, "delete_unreachable");
    assertEquals(PatchOpKind.DELETE_NODE, repair.edits().get(0).kind());
    CompileResult next = repair(result, repair);
    assertEquals(CompileStatus.SUCCESS, next.status());
    assertTrue(next.diagnostics().isEmpty());
  }

  @Test
  public void holeIsFilledWithADefault() {
    CompileResult result = check(fn("todo").returns(intTy()).body(valueBlock(hole("impl"))));
    assertEquals(CompileStatus.INCOMPLETE, result.status());
    RepairCandidate repair = only(result, "fill_hole");
    assertEquals(Confidence.LOW, repair.confidence());
    CompileResult next = repair(result, repair);
    assertEquals(CompileStatus.SUCCESS, next.status());
    assertTrue(next.holes().isEmpty());
  }
}
