package org.obligato.apply;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.obligato.tree.Ast;
import org.obligato.tree.NodeId;
import org.obligato.tree.Tree;
import org.obligato.tree.Tree.Block;
import org.obligato.tree.Tree.CompUnit;
import org.obligato.tree.Tree.ExprStmt;
import org.obligato.tree.Tree.Expression;
import org.obligato.tree.Tree.FnDecl;
import org.obligato.tree.Tree.If;
import org.obligato.tree.Tree.Return;
import org.obligato.tree.Tree.Stmt;
import org.obligato.tree.TreeCopier;

/**
 * Puts a tree in canonical form: the tail of a function body becomes an explicit {@code return},
 * and an {@code if} in statement position gets an explicit empty {@code else}. Nodes created here
 * derive their ids from the node they complete, so canonicalizing twice is a no-op.
 */
public final class Canonicalizer extends TreeCopier {

  static final String RETURN_SLOT = "canon:return";
  static final String ELSE_SLOT = "canon:else";

  public static Ast canonicalize(Ast ast) {
    CompUnit unit = (CompUnit) new Canonicalizer().copy(ast.root());
    return Ast.of(unit, ast.seed());
  }

  private Canonicalizer() {}

  @Override
  public Tree visitFnDecl(FnDecl t, Slot slot) {
    FnDecl fn = (FnDecl) super.visitFnDecl(t, slot);
    if (fn.body().isEmpty() || fn.body().get().tail().isEmpty()) {
      return fn;
    }
    Block body = fn.body().get();
    Expression tail = body.tail().get();
    Return ret = new Return(NodeId.derive(tail.id(), RETURN_SLOT, 0), -1, Optional.of(tail));
    Block returning =
        new Block(
            body.id(),
            body.position(),
            ImmutableList.<Stmt>builder().addAll(body.stmts()).add(ret).build(),
            Optional.empty());
    return new FnDecl(
        fn.id(),
        fn.position(),
        fn.name(),
        fn.params(),
        fn.returnType(),
        fn.effects(),
        fn.requires(),
        fn.ensures(),
        Optional.of(returning));
  }

  @Override
  public Tree visitExprStmt(ExprStmt t, Slot slot) {
    ExprStmt stmt = (ExprStmt) super.visitExprStmt(t, slot);
    if (stmt.expr().kind() != Tree.Kind.IF) {
      return stmt;
    }
    If ifExpr = (If) stmt.expr();
    if (ifExpr.orElse().isPresent()) {
      return stmt;
    }
    Block empty =
        new Block(
            NodeId.derive(ifExpr.id(), ELSE_SLOT, 0), -1, ImmutableList.of(), Optional.empty());
    If complete =
        new If(ifExpr.id(), ifExpr.position(), ifExpr.cond(), ifExpr.then(), Optional.of(empty));
    return new ExprStmt(stmt.id(), stmt.position(), complete);
  }
}
