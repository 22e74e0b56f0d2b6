package org.obligato.tree;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.obligato.tree.Trees.div;
import static org.obligato.tree.Trees.exprStmt;
import static org.obligato.tree.Trees.fn;
import static org.obligato.tree.Trees.ident;
import static org.obligato.tree.Trees.intTy;
import static org.obligato.tree.Trees.let;
import static org.obligato.tree.Trees.lit;
import static org.obligato.tree.Trees.ret;
import static org.obligato.tree.Trees.unit;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.obligato.diag.StructuralError;
import org.obligato.tree.Tree.Block;
import org.obligato.tree.Tree.CompUnit;
import org.obligato.tree.Tree.FnDecl;
import org.obligato.tree.Tree.Stmt;

@RunWith(JUnit4.class)
public class AstTest {

  private static CompUnit program() {
    return unit(
        fn("f")
            .param("n", intTy())
            .returns(intTy())
            .body(let("m", div(ident("n"), lit(2))), ret(ident("m"))),
        fn("g").body(exprStmt(lit(1))));
  }

  @Test
  public void idsArePureFunctionOfStructureAndSeed() {
    Ast a = Ast.of(program(), "s1");
    Ast b = Ast.of(program(), "s1");
    assertEquals(a, b);
    assertEquals(ImmutableList.copyOf(a.ids()), ImmutableList.copyOf(b.ids()));
    assertEquals(NodeId.root("s1"), a.root().id());

    Ast other = Ast.of(program(), "s2");
    assertNotEquals(a.root().id(), other.root().id());
    assertNotEquals(a, other);
  }

  @Test
  public void everyNodeIsIndexed() {
    Ast ast = Ast.of(program(), "s");
    FnDecl f = (FnDecl) ast.root().decls().get(0);
    Stmt let = f.body().get().stmts().get(0);
    assertTrue(ast.contains(let.id()));
    assertEquals(f.body().get().id(), ast.parent(let.id()).get());
    assertEquals("stmts", ast.slot(let.id()));
    assertEquals(f, ast.enclosingFn(let.id()).get());
    assertTrue(ast.order(f.id()) < ast.order(let.id()));
    assertFalse(ast.parent(ast.root().id()).isPresent());
    assertTrue(ast.subtreeIds(f.id()).contains(let.id()));
  }

  @Test
  public void existingIdsSurviveUnrelatedEdits() {
    Ast ast = Ast.of(program(), "s");
    FnDecl f = (FnDecl) ast.root().decls().get(0);
    FnDecl g = (FnDecl) ast.root().decls().get(1);
    Block body = f.body().get();
    Block longer =
        new Block(
            body.id(),
            body.position(),
            ImmutableList.<Stmt>builder().add(exprStmt(lit(0))).addAll(body.stmts()).build(),
            body.tail());
    FnDecl edited =
        new FnDecl(
            f.id(),
            f.position(),
            f.name(),
            f.params(),
            f.returnType(),
            f.effects(),
            f.requires(),
            f.ensures(),
            Optional.of(longer));
    Ast next = Ast.of(new CompUnit(ast.root().id(), -1, ImmutableList.of(edited, g)), "s");
    for (NodeId id : ast.ids()) {
      assertTrue(id.toString(), next.contains(id));
    }
    assertEquals(ast.ids().size() + 2, next.ids().size());
  }

  @Test
  public void duplicateIdsAreStructuralErrors() {
    FnDecl f = (FnDecl) Ast.of(program(), "s").root().decls().get(0);
    try {
      Ast.of(unit(f, f), "s");
      fail();
    } catch (StructuralError e) {
      assertEquals(StructuralError.Kind.DUPLICATE_NODE_ID, e.kind());
    }
  }

  @Test
  public void unknownIdsAreStructuralErrors() {
    Ast ast = Ast.of(program(), "s");
    try {
      ast.node(NodeId.parse("n0000000000000000"));
      fail();
    } catch (StructuralError e) {
      assertEquals(StructuralError.Kind.UNKNOWN_NODE_ID, e.kind());
    }
  }
}
