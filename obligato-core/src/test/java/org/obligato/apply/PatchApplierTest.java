package org.obligato.apply;

import static com.google.common.collect.MoreCollectors.onlyElement;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.obligato.tree.Trees.div;
import static org.obligato.tree.Trees.fn;
import static org.obligato.tree.Trees.hole;
import static org.obligato.tree.Trees.ident;
import static org.obligato.tree.Trees.intTy;
import static org.obligato.tree.Trees.let;
import static org.obligato.tree.Trees.lit;
import static org.obligato.tree.Trees.ne;
import static org.obligato.tree.Trees.plus;
import static org.obligato.tree.Trees.unit;
import static org.obligato.tree.Trees.valueBlock;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.obligato.diag.StructuralError;
import org.obligato.model.Effect;
import org.obligato.model.EffectSet;
import org.obligato.repair.PatchOp;
import org.obligato.tree.Ast;
import org.obligato.tree.NodeId;
import org.obligato.tree.Tree;

@RunWith(JUnit4.class)
public class PatchApplierTest {

  private static Ast ratio() {
    return Canonicalizer.canonicalize(
        Ast.of(
            unit(
                fn("ratio")
                    .param("n", intTy())
                    .param("d", intTy())
                    .returns(intTy())
                    .body(valueBlock(div(ident("n"), ident("d"))))),
            "patch"));
  }

  private static NodeId find(Ast ast, Tree.Kind kind) {
    return ast.ids().stream().filter(id -> ast.node(id).kind() == kind).collect(onlyElement());
  }

  private static NodeId param(Ast ast, String name) {
    return ast.ids().stream()
        .filter(id -> ast.node(id).kind() == Tree.Kind.PARAM)
        .filter(id -> ((Tree.Param) ast.node(id)).name().equals(name))
        .collect(onlyElement());
  }

  @Test
  public void wrapKeepsTheOriginalNode() {
    Ast ast = ratio();
    NodeId division = find(ast, Tree.Kind.BINARY);
    Ast patched =
        PatchApplier.apply(
            ast, ImmutableList.of(PatchOp.wrap(division, plus(hole(PatchOp.ORIGINAL), lit(0)))));
    assertTrue(patched.toString(), patched.toString().contains("return n / d + 0;"));
    assertTrue(patched.contains(division));
    assertEquals(Tree.Kind.BINARY, patched.node(division).kind());
  }

  @Test
  public void wrapTemplateNeedsTheOriginal() {
    Ast ast = ratio();
    try {
      PatchApplier.apply(
          ast, ImmutableList.of(PatchOp.wrap(find(ast, Tree.Kind.BINARY), plus(lit(1), lit(0)))));
      fail();
    } catch (StructuralError e) {
      assertEquals(StructuralError.Kind.INVALID_PATCH, e.kind());
    }
  }

  @Test
  public void insertionsAtOneAnchorAreAllApplied() {
    Ast ast = ratio();
    NodeId ret = find(ast, Tree.Kind.RETURN);
    Ast patched =
        PatchApplier.apply(
            ast,
            ImmutableList.of(
                PatchOp.insertBefore(ret, let("b", lit(2))),
                PatchOp.insertBefore(ret, let("a", lit(1)))));
    assertEquals(
        "fn ratio(n: Int, d: Int) -> Int {\n"
            + "  let a = 1;\n"
            + "  let b = 2;\n"
            + "  return n / d;\n"
            + "}\n",
        patched.toString());
    assertEquals(ast.ids().size() + 4, patched.ids().size());
  }

  @Test
  public void reapplyingABatchChangesNothing() {
    Ast ast = ratio();
    ImmutableList<PatchOp> batch =
        ImmutableList.of(
            PatchOp.insertBefore(find(ast, Tree.Kind.RETURN), let("k", lit(1))),
            PatchOp.wrap(find(ast, Tree.Kind.BINARY), plus(hole(PatchOp.ORIGINAL), lit(0))),
            PatchOp.widenEffect(find(ast, Tree.Kind.FN_DECL), EffectSet.of(Effect.of("IO"))),
            PatchOp.addRefinement(param(ast, "d"), "v", ne(ident("v"), lit(0))));
    Ast once = PatchApplier.apply(ast, batch);
    Ast twice = PatchApplier.apply(once, batch);
    assertEquals(once, twice);
  }

  @Test
  public void widenEffectAddsMissingEffects() {
    Ast ast = ratio();
    NodeId fn = find(ast, Tree.Kind.FN_DECL);
    Ast patched =
        PatchApplier.apply(
            ast, ImmutableList.of(PatchOp.widenEffect(fn, EffectSet.of(Effect.of("IO")))));
    assertEquals(ImmutableList.of(Effect.of("IO")), ((Tree.FnDecl) patched.node(fn)).effects());
  }

  @Test
  public void refinementIsStatedOverTheParameter() {
    Ast ast = ratio();
    NodeId d = param(ast, "d");
    PatchOp op = PatchOp.addRefinement(d, "v", ne(ident("v"), lit(0)));
    Ast once = PatchApplier.apply(ast, ImmutableList.of(op));
    Ast patched = PatchApplier.apply(once, ImmutableList.of(op));
    assertTrue(patched.toString(), patched.toString().contains("d: {v: Int | v != 0}"));
  }

  @Test
  public void unknownTargetIsStructural() {
    Ast ast = ratio();
    NodeId missing = NodeId.derive(NodeId.root("patch"), "missing", 0);
    try {
      PatchApplier.apply(ast, ImmutableList.of(PatchOp.replace(missing, lit(1))));
      fail();
    } catch (StructuralError e) {
      assertEquals(StructuralError.Kind.UNKNOWN_NODE_ID, e.kind());
    }
  }

  @Test
  public void deletingAMissingNodeIsANoOp() {
    Ast ast = ratio();
    NodeId missing = NodeId.derive(NodeId.root("patch"), "missing", 0);
    Ast patched = PatchApplier.apply(ast, ImmutableList.of(PatchOp.delete(missing)));
    assertEquals(ast, patched);
  }

  @Test
  public void emptyBatchReturnsAnEqualAst() {
    Ast ast = ratio();
    assertEquals(ast, PatchApplier.apply(ast, ImmutableList.of()));
  }
}
