package org.obligato.tree;

import com.google.common.base.Strings;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.obligato.model.Const;
import org.obligato.model.Effect;
import org.obligato.tree.Tree.Assign;
import org.obligato.tree.Tree.Binary;
import org.obligato.tree.Tree.BindPat;
import org.obligato.tree.Tree.Block;
import org.obligato.tree.Tree.Call;
import org.obligato.tree.Tree.CompUnit;
import org.obligato.tree.Tree.Decl;
import org.obligato.tree.Tree.EnumDecl;
import org.obligato.tree.Tree.ExprStmt;
import org.obligato.tree.Tree.Expression;
import org.obligato.tree.Tree.Fail;
import org.obligato.tree.Tree.FieldAccess;
import org.obligato.tree.Tree.FieldDecl;
import org.obligato.tree.Tree.FieldInit;
import org.obligato.tree.Tree.FnDecl;
import org.obligato.tree.Tree.For;
import org.obligato.tree.Tree.Hole;
import org.obligato.tree.Tree.Ident;
import org.obligato.tree.Tree.If;
import org.obligato.tree.Tree.Index;
import org.obligato.tree.Tree.Let;
import org.obligato.tree.Tree.ListLit;
import org.obligato.tree.Tree.LitPat;
import org.obligato.tree.Tree.Literal;
import org.obligato.tree.Tree.Match;
import org.obligato.tree.Tree.MatchArm;
import org.obligato.tree.Tree.NamedTy;
import org.obligato.tree.Tree.Param;
import org.obligato.tree.Tree.Quantified;
import org.obligato.tree.Tree.Range;
import org.obligato.tree.Tree.RecordDecl;
import org.obligato.tree.Tree.RecordLit;
import org.obligato.tree.Tree.RefinedTy;
import org.obligato.tree.Tree.Return;
import org.obligato.tree.Tree.Stmt;
import org.obligato.tree.Tree.Unary;
import org.obligato.tree.Tree.VariantPat;
import org.obligato.tree.Tree.WildPat;
import org.obligato.tree.Tree.While;

/**
 * A pretty-printer for {@link Tree}s.
 *
 * <p>The output of {@link #pretty} is the canonical text of a tree: propositions are compared,
 * keyed and deduplicated by it, so it must not depend on node ids or positions. {@link #withIds}
 * additionally prefixes every node with its id, for debugging and for comparing ASTs including
 * their identities.
 */
public class Pretty implements Tree.Visitor<@Nullable Void, @Nullable Void> {

  public static String pretty(Tree tree) {
    Pretty pretty = new Pretty(false);
    tree.accept(pretty, null);
    return pretty.sb.toString();
  }

  public static String withIds(Tree tree) {
    Pretty pretty = new Pretty(true);
    tree.accept(pretty, null);
    return pretty.sb.toString();
  }

  private static final int ATOM = 10;
  private static final int LOOSE = 0;

  private final StringBuilder sb = new StringBuilder();
  private final boolean showIds;
  int indent = 0;
  boolean newLine = false;

  private Pretty(boolean showIds) {
    this.showIds = showIds;
  }

  void printLine() {
    append('\n');
    newLine = true;
  }

  @CanIgnoreReturnValue
  Pretty append(char c) {
    if (c == '\n') {
      newLine = true;
    } else if (newLine) {
      sb.append(Strings.repeat(" ", indent * 2));
      newLine = false;
    }
    sb.append(c);
    return this;
  }

  @CanIgnoreReturnValue
  Pretty append(String s) {
    if (newLine) {
      sb.append(Strings.repeat(" ", indent * 2));
      newLine = false;
    }
    sb.append(s);
    return this;
  }

  private void mark(Tree tree) {
    if (showIds) {
      append('@').append(tree.id().toString()).append(' ');
    }
  }

  private static int prec(Expression e) {
    switch (e.kind()) {
      case BINARY:
        return ((Binary) e).op().prec().rank();
      case UNARY:
        return OperatorKind.Precedence.UNARY.rank();
      case RANGE:
      case IF:
      case MATCH:
      case QUANTIFIED:
        return LOOSE;
      default:
        return ATOM;
    }
  }

  private void printExpr(Expression e, int minPrec) {
    if (prec(e) < minPrec) {
      append('(');
      e.accept(this, null);
      append(')');
    } else {
      e.accept(this, null);
    }
  }

  private void printCommaSeparated(List<? extends Tree> trees) {
    boolean first = true;
    for (Tree t : trees) {
      if (!first) {
        append(", ");
      }
      first = false;
      t.accept(this, null);
    }
  }

  @Override
  public @Nullable Void visitCompUnit(CompUnit compUnit, @Nullable Void input) {
    mark(compUnit);
    boolean first = true;
    for (Decl decl : compUnit.decls()) {
      if (!first) {
        printLine();
      }
      first = false;
      decl.accept(this, null);
      printLine();
    }
    return null;
  }

  @Override
  public @Nullable Void visitFnDecl(FnDecl fnDecl, @Nullable Void input) {
    mark(fnDecl);
    if (fnDecl.body().isEmpty()) {
      append("extern ");
    }
    append("fn ").append(fnDecl.name()).append('(');
    printCommaSeparated(fnDecl.params());
    append(") -> ");
    fnDecl.returnType().accept(this, null);
    if (!fnDecl.effects().isEmpty()) {
      append(" ! {");
      boolean first = true;
      for (Effect effect : fnDecl.effects()) {
        if (!first) {
          append(", ");
        }
        first = false;
        append(effect.toString());
      }
      append('}');
    }
    if (fnDecl.requires().isPresent()) {
      append(" requires ");
      printExpr(fnDecl.requires().get(), LOOSE);
    }
    if (fnDecl.ensures().isPresent()) {
      append(" ensures ");
      printExpr(fnDecl.ensures().get(), LOOSE);
    }
    if (fnDecl.body().isPresent()) {
      append(' ');
      fnDecl.body().get().accept(this, null);
    } else {
      append(';');
    }
    return null;
  }

  @Override
  public @Nullable Void visitParam(Param param, @Nullable Void input) {
    mark(param);
    append(param.name()).append(": ");
    param.type().accept(this, null);
    return null;
  }

  @Override
  public @Nullable Void visitRecordDecl(RecordDecl recordDecl, @Nullable Void input) {
    mark(recordDecl);
    append("record ").append(recordDecl.name()).append(" { ");
    printCommaSeparated(recordDecl.fields());
    append(" }");
    return null;
  }

  @Override
  public @Nullable Void visitFieldDecl(FieldDecl fieldDecl, @Nullable Void input) {
    mark(fieldDecl);
    append(fieldDecl.name()).append(": ");
    fieldDecl.type().accept(this, null);
    return null;
  }

  @Override
  public @Nullable Void visitEnumDecl(EnumDecl enumDecl, @Nullable Void input) {
    mark(enumDecl);
    append("enum ").append(enumDecl.name()).append(" { ");
    append(String.join(", ", enumDecl.variants()));
    append(" }");
    return null;
  }

  @Override
  public @Nullable Void visitNamedTy(NamedTy namedTy, @Nullable Void input) {
    mark(namedTy);
    append(namedTy.name());
    if (!namedTy.args().isEmpty()) {
      append('[');
      printCommaSeparated(namedTy.args());
      append(']');
    }
    return null;
  }

  @Override
  public @Nullable Void visitRefinedTy(RefinedTy refinedTy, @Nullable Void input) {
    mark(refinedTy);
    append('{').append(refinedTy.var()).append(": ");
    refinedTy.base().accept(this, null);
    append(" | ");
    printExpr(refinedTy.predicate(), LOOSE);
    append('}');
    return null;
  }

  @Override
  public @Nullable Void visitLet(Let let, @Nullable Void input) {
    mark(let);
    append("let ");
    if (let.mutable()) {
      append("mut ");
    }
    append(let.name());
    if (let.type().isPresent()) {
      append(": ");
      let.type().get().accept(this, null);
    }
    append(" = ");
    printExpr(let.init(), LOOSE);
    append(';');
    return null;
  }

  @Override
  public @Nullable Void visitAssign(Assign assign, @Nullable Void input) {
    mark(assign);
    append(assign.name()).append(" = ");
    printExpr(assign.value(), LOOSE);
    append(';');
    return null;
  }

  @Override
  public @Nullable Void visitExprStmt(ExprStmt exprStmt, @Nullable Void input) {
    mark(exprStmt);
    printExpr(exprStmt.expr(), LOOSE);
    switch (exprStmt.expr().kind()) {
      case IF:
      case MATCH:
      case BLOCK:
        break;
      default:
        append(';');
    }
    return null;
  }

  @Override
  public @Nullable Void visitReturn(Return ret, @Nullable Void input) {
    mark(ret);
    append("return");
    if (ret.expr().isPresent()) {
      append(' ');
      printExpr(ret.expr().get(), LOOSE);
    }
    append(';');
    return null;
  }

  @Override
  public @Nullable Void visitWhile(While whileStmt, @Nullable Void input) {
    mark(whileStmt);
    append("while ");
    printExpr(whileStmt.cond(), LOOSE + 1);
    append(' ');
    whileStmt.body().accept(this, null);
    return null;
  }

  @Override
  public @Nullable Void visitFor(For forStmt, @Nullable Void input) {
    mark(forStmt);
    append("for ").append(forStmt.var()).append(" in ");
    printExpr(forStmt.iterable(), LOOSE);
    append(' ');
    forStmt.body().accept(this, null);
    return null;
  }

  @Override
  public @Nullable Void visitLiteral(Literal literal, @Nullable Void input) {
    mark(literal);
    append(literal.value().toString());
    return null;
  }

  @Override
  public @Nullable Void visitIdent(Ident ident, @Nullable Void input) {
    mark(ident);
    append(ident.name());
    return null;
  }

  @Override
  public @Nullable Void visitUnary(Unary unary, @Nullable Void input) {
    mark(unary);
    append(unary.op().toString());
    printExpr(unary.expr(), OperatorKind.Precedence.UNARY.rank());
    return null;
  }

  @Override
  public @Nullable Void visitBinary(Binary binary, @Nullable Void input) {
    mark(binary);
    int rank = binary.op().prec().rank();
    int lhsPrec = rank;
    int rhsPrec = rank + 1;
    if (binary.op() == OperatorKind.IMPLIES) {
      lhsPrec = rank + 1;
      rhsPrec = rank;
    } else if (binary.op().isComparison()) {
      lhsPrec = rank + 1;
    }
    printExpr(binary.lhs(), lhsPrec);
    append(' ').append(binary.op().toString()).append(' ');
    printExpr(binary.rhs(), rhsPrec);
    return null;
  }

  @Override
  public @Nullable Void visitCall(Call call, @Nullable Void input) {
    mark(call);
    append(call.callee()).append('(');
    printCommaSeparated(call.args());
    append(')');
    return null;
  }

  @Override
  public @Nullable Void visitFieldAccess(FieldAccess fieldAccess, @Nullable Void input) {
    mark(fieldAccess);
    printExpr(fieldAccess.expr(), ATOM);
    append('.').append(fieldAccess.field());
    return null;
  }

  @Override
  public @Nullable Void visitIndex(Index index, @Nullable Void input) {
    mark(index);
    printExpr(index.expr(), ATOM);
    append('[');
    printExpr(index.index(), LOOSE);
    append(']');
    return null;
  }

  @Override
  public @Nullable Void visitRecordLit(RecordLit recordLit, @Nullable Void input) {
    mark(recordLit);
    append(recordLit.typeName()).append(" { ");
    printCommaSeparated(recordLit.fields());
    append(" }");
    return null;
  }

  @Override
  public @Nullable Void visitFieldInit(FieldInit fieldInit, @Nullable Void input) {
    mark(fieldInit);
    append(fieldInit.name()).append(": ");
    printExpr(fieldInit.value(), LOOSE);
    return null;
  }

  @Override
  public @Nullable Void visitListLit(ListLit listLit, @Nullable Void input) {
    mark(listLit);
    append('[');
    printCommaSeparated(listLit.elems());
    append(']');
    return null;
  }

  @Override
  public @Nullable Void visitRange(Range range, @Nullable Void input) {
    mark(range);
    printExpr(range.lo(), LOOSE + 1);
    append("..");
    printExpr(range.hi(), LOOSE + 1);
    return null;
  }

  @Override
  public @Nullable Void visitIf(If ifExpr, @Nullable Void input) {
    mark(ifExpr);
    append("if ");
    printExpr(ifExpr.cond(), LOOSE + 1);
    append(' ');
    ifExpr.then().accept(this, null);
    if (ifExpr.orElse().isPresent()) {
      append(" else ");
      ifExpr.orElse().get().accept(this, null);
    }
    return null;
  }

  @Override
  public @Nullable Void visitMatch(Match match, @Nullable Void input) {
    mark(match);
    append("match ");
    printExpr(match.scrutinee(), LOOSE + 1);
    append(" {");
    indent++;
    for (MatchArm arm : match.arms()) {
      printLine();
      arm.accept(this, null);
    }
    indent--;
    printLine();
    append('}');
    return null;
  }

  @Override
  public @Nullable Void visitMatchArm(MatchArm matchArm, @Nullable Void input) {
    mark(matchArm);
    matchArm.pattern().accept(this, null);
    append(" => ");
    matchArm.body().accept(this, null);
    return null;
  }

  @Override
  public @Nullable Void visitBlock(Block block, @Nullable Void input) {
    mark(block);
    if (block.stmts().isEmpty() && block.tail().isEmpty()) {
      append("{}");
      return null;
    }
    append('{');
    indent++;
    for (Stmt stmt : block.stmts()) {
      printLine();
      stmt.accept(this, null);
    }
    if (block.tail().isPresent()) {
      printLine();
      printExpr(block.tail().get(), LOOSE);
    }
    indent--;
    printLine();
    append('}');
    return null;
  }

  @Override
  public @Nullable Void visitFail(Fail fail, @Nullable Void input) {
    mark(fail);
    append("fail(").append(Const.of(fail.message()).toString()).append(')');
    return null;
  }

  @Override
  public @Nullable Void visitHole(Hole hole, @Nullable Void input) {
    mark(hole);
    append('?').append(hole.name());
    return null;
  }

  @Override
  public @Nullable Void visitQuantified(Quantified quantified, @Nullable Void input) {
    mark(quantified);
    append(quantified.quantifier().toString()).append(' ').append(quantified.var());
    append(" in ");
    printExpr(quantified.domain(), LOOSE);
    append(": ");
    printExpr(quantified.body(), LOOSE);
    return null;
  }

  @Override
  public @Nullable Void visitWildPat(WildPat wildPat, @Nullable Void input) {
    mark(wildPat);
    append('_');
    return null;
  }

  @Override
  public @Nullable Void visitBindPat(BindPat bindPat, @Nullable Void input) {
    mark(bindPat);
    append(bindPat.name());
    return null;
  }

  @Override
  public @Nullable Void visitLitPat(LitPat litPat, @Nullable Void input) {
    mark(litPat);
    append(litPat.value().toString());
    return null;
  }

  @Override
  public @Nullable Void visitVariantPat(VariantPat variantPat, @Nullable Void input) {
    mark(variantPat);
    append(variantPat.name());
    return null;
  }
}
