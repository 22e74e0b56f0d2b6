package org.obligato.tree;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.obligato.diag.StructuralError;
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
import org.obligato.tree.Tree.Pattern;
import org.obligato.tree.Tree.Quantified;
import org.obligato.tree.Tree.Range;
import org.obligato.tree.Tree.RecordDecl;
import org.obligato.tree.Tree.RecordLit;
import org.obligato.tree.Tree.RefinedTy;
import org.obligato.tree.Tree.Return;
import org.obligato.tree.Tree.Stmt;
import org.obligato.tree.Tree.Ty;
import org.obligato.tree.Tree.Unary;
import org.obligato.tree.Tree.VariantPat;
import org.obligato.tree.Tree.WildPat;
import org.obligato.tree.Tree.While;

/**
 * Rebuilds a tree bottom-up. Subclasses hook {@link #enter} to choose the id of each rebuilt node,
 * {@link #sub} to replace individual children, and {@link #copyList} to edit list slots.
 *
 * <p>The slot names used here are the ones recorded by {@link Ast} and fed to {@link
 * NodeId#derive}, so they are part of the id scheme and must not change.
 */
public class TreeCopier implements Tree.Visitor<TreeCopier.Slot, Tree> {

  /** The position of a child: its parent's (rebuilt) id, slot name and index within the slot. */
  public static final class Slot {
    public static final Slot ROOT = new Slot(NodeId.UNASSIGNED, "root", 0);

    private final NodeId parent;
    private final String name;
    private final int index;

    public Slot(NodeId parent, String name, int index) {
      this.parent = parent;
      this.name = name;
      this.index = index;
    }

    public NodeId parent() {
      return parent;
    }

    public String name() {
      return name;
    }

    public int index() {
      return index;
    }

    public boolean isRoot() {
      return this == ROOT;
    }
  }

  /** Copies {@code tree}, treating it as a root. */
  public Tree copy(Tree tree) {
    return tree.accept(this, Slot.ROOT);
  }

  /** Returns the id for the copy of {@code tree}, which is about to be rebuilt at {@code slot}. */
  protected NodeId enter(Tree tree, Slot slot) {
    return tree.id();
  }

  /** Copies one child. */
  protected <T extends Tree> T sub(Class<T> type, T child, NodeId parent, String slot, int index) {
    Tree result = child.accept(this, new Slot(parent, slot, index));
    return checkCategory(type, result, slot);
  }

  protected <T extends Tree> ImmutableList<T> copyList(
      Class<T> type, ImmutableList<T> list, NodeId parent, String slot) {
    ImmutableList.Builder<T> result = ImmutableList.builder();
    for (int i = 0; i < list.size(); i++) {
      result.add(sub(type, list.get(i), parent, slot, i));
    }
    return result.build();
  }

  protected <T extends Tree> Optional<T> copyOptional(
      Class<T> type, Optional<T> child, NodeId parent, String slot) {
    return child.map(c -> sub(type, c, parent, slot, 0));
  }

  protected static <T extends Tree> T checkCategory(Class<T> type, Tree tree, String slot) {
    if (!type.isInstance(tree)) {
      throw StructuralError.create(
          StructuralError.Kind.INVALID_PATCH,
          "%s cannot occupy slot '%s' (expected %s)",
          tree.kind(),
          slot,
          type.getSimpleName());
    }
    return type.cast(tree);
  }

  @Override
  public Tree visitCompUnit(CompUnit t, Slot slot) {
    NodeId id = enter(t, slot);
    return new CompUnit(id, t.position(), copyList(Decl.class, t.decls(), id, "decls"));
  }

  @Override
  public Tree visitFnDecl(FnDecl t, Slot slot) {
    NodeId id = enter(t, slot);
    return new FnDecl(
        id,
        t.position(),
        t.name(),
        copyList(Param.class, t.params(), id, "params"),
        sub(Ty.class, t.returnType(), id, "returnType", 0),
        t.effects(),
        copyOptional(Expression.class, t.requires(), id, "requires"),
        copyOptional(Expression.class, t.ensures(), id, "ensures"),
        copyOptional(Block.class, t.body(), id, "body"));
  }

  @Override
  public Tree visitParam(Param t, Slot slot) {
    NodeId id = enter(t, slot);
    return new Param(id, t.position(), t.name(), sub(Ty.class, t.type(), id, "type", 0));
  }

  @Override
  public Tree visitRecordDecl(RecordDecl t, Slot slot) {
    NodeId id = enter(t, slot);
    return new RecordDecl(
        id, t.position(), t.name(), copyList(FieldDecl.class, t.fields(), id, "fields"));
  }

  @Override
  public Tree visitFieldDecl(FieldDecl t, Slot slot) {
    NodeId id = enter(t, slot);
    return new FieldDecl(id, t.position(), t.name(), sub(Ty.class, t.type(), id, "type", 0));
  }

  @Override
  public Tree visitEnumDecl(EnumDecl t, Slot slot) {
    return new EnumDecl(enter(t, slot), t.position(), t.name(), t.variants());
  }

  @Override
  public Tree visitNamedTy(NamedTy t, Slot slot) {
    NodeId id = enter(t, slot);
    return new NamedTy(id, t.position(), t.name(), copyList(Ty.class, t.args(), id, "args"));
  }

  @Override
  public Tree visitRefinedTy(RefinedTy t, Slot slot) {
    NodeId id = enter(t, slot);
    return new RefinedTy(
        id,
        t.position(),
        sub(Ty.class, t.base(), id, "base", 0),
        t.var(),
        sub(Expression.class, t.predicate(), id, "predicate", 0));
  }

  @Override
  public Tree visitLet(Let t, Slot slot) {
    NodeId id = enter(t, slot);
    return new Let(
        id,
        t.position(),
        t.name(),
        t.mutable(),
        copyOptional(Ty.class, t.type(), id, "type"),
        sub(Expression.class, t.init(), id, "init", 0));
  }

  @Override
  public Tree visitAssign(Assign t, Slot slot) {
    NodeId id = enter(t, slot);
    return new Assign(
        id, t.position(), t.name(), sub(Expression.class, t.value(), id, "value", 0));
  }

  @Override
  public Tree visitExprStmt(ExprStmt t, Slot slot) {
    NodeId id = enter(t, slot);
    return new ExprStmt(id, t.position(), sub(Expression.class, t.expr(), id, "expr", 0));
  }

  @Override
  public Tree visitReturn(Return t, Slot slot) {
    NodeId id = enter(t, slot);
    return new Return(id, t.position(), copyOptional(Expression.class, t.expr(), id, "expr"));
  }

  @Override
  public Tree visitWhile(While t, Slot slot) {
    NodeId id = enter(t, slot);
    return new While(
        id,
        t.position(),
        sub(Expression.class, t.cond(), id, "cond", 0),
        sub(Block.class, t.body(), id, "body", 0));
  }

  @Override
  public Tree visitFor(For t, Slot slot) {
    NodeId id = enter(t, slot);
    return new For(
        id,
        t.position(),
        t.var(),
        sub(Expression.class, t.iterable(), id, "iterable", 0),
        sub(Block.class, t.body(), id, "body", 0));
  }

  @Override
  public Tree visitLiteral(Literal t, Slot slot) {
    return new Literal(enter(t, slot), t.position(), t.value());
  }

  @Override
  public Tree visitIdent(Ident t, Slot slot) {
    return new Ident(enter(t, slot), t.position(), t.name());
  }

  @Override
  public Tree visitUnary(Unary t, Slot slot) {
    NodeId id = enter(t, slot);
    return new Unary(id, t.position(), t.op(), sub(Expression.class, t.expr(), id, "expr", 0));
  }

  @Override
  public Tree visitBinary(Binary t, Slot slot) {
    NodeId id = enter(t, slot);
    return new Binary(
        id,
        t.position(),
        t.op(),
        sub(Expression.class, t.lhs(), id, "lhs", 0),
        sub(Expression.class, t.rhs(), id, "rhs", 0));
  }

  @Override
  public Tree visitCall(Call t, Slot slot) {
    NodeId id = enter(t, slot);
    return new Call(
        id, t.position(), t.callee(), copyList(Expression.class, t.args(), id, "args"));
  }

  @Override
  public Tree visitFieldAccess(FieldAccess t, Slot slot) {
    NodeId id = enter(t, slot);
    return new FieldAccess(
        id, t.position(), sub(Expression.class, t.expr(), id, "expr", 0), t.field());
  }

  @Override
  public Tree visitIndex(Index t, Slot slot) {
    NodeId id = enter(t, slot);
    return new Index(
        id,
        t.position(),
        sub(Expression.class, t.expr(), id, "expr", 0),
        sub(Expression.class, t.index(), id, "index", 0));
  }

  @Override
  public Tree visitRecordLit(RecordLit t, Slot slot) {
    NodeId id = enter(t, slot);
    return new RecordLit(
        id, t.position(), t.typeName(), copyList(FieldInit.class, t.fields(), id, "fields"));
  }

  @Override
  public Tree visitFieldInit(FieldInit t, Slot slot) {
    NodeId id = enter(t, slot);
    return new FieldInit(
        id, t.position(), t.name(), sub(Expression.class, t.value(), id, "value", 0));
  }

  @Override
  public Tree visitListLit(ListLit t, Slot slot) {
    NodeId id = enter(t, slot);
    return new ListLit(id, t.position(), copyList(Expression.class, t.elems(), id, "elems"));
  }

  @Override
  public Tree visitRange(Range t, Slot slot) {
    NodeId id = enter(t, slot);
    return new Range(
        id,
        t.position(),
        sub(Expression.class, t.lo(), id, "lo", 0),
        sub(Expression.class, t.hi(), id, "hi", 0));
  }

  @Override
  public Tree visitIf(If t, Slot slot) {
    NodeId id = enter(t, slot);
    return new If(
        id,
        t.position(),
        sub(Expression.class, t.cond(), id, "cond", 0),
        sub(Block.class, t.then(), id, "then", 0),
        copyOptional(Block.class, t.orElse(), id, "else"));
  }

  @Override
  public Tree visitMatch(Match t, Slot slot) {
    NodeId id = enter(t, slot);
    return new Match(
        id,
        t.position(),
        sub(Expression.class, t.scrutinee(), id, "scrutinee", 0),
        copyList(MatchArm.class, t.arms(), id, "arms"));
  }

  @Override
  public Tree visitMatchArm(MatchArm t, Slot slot) {
    NodeId id = enter(t, slot);
    return new MatchArm(
        id,
        t.position(),
        sub(Pattern.class, t.pattern(), id, "pattern", 0),
        sub(Block.class, t.body(), id, "body", 0));
  }

  @Override
  public Tree visitBlock(Block t, Slot slot) {
    NodeId id = enter(t, slot);
    return new Block(
        id,
        t.position(),
        copyList(Stmt.class, t.stmts(), id, "stmts"),
        copyOptional(Expression.class, t.tail(), id, "tail"));
  }

  @Override
  public Tree visitFail(Fail t, Slot slot) {
    return new Fail(enter(t, slot), t.position(), t.message());
  }

  @Override
  public Tree visitHole(Hole t, Slot slot) {
    return new Hole(enter(t, slot), t.position(), t.name());
  }

  @Override
  public Tree visitQuantified(Quantified t, Slot slot) {
    NodeId id = enter(t, slot);
    return new Quantified(
        id,
        t.position(),
        t.quantifier(),
        t.var(),
        sub(Expression.class, t.domain(), id, "domain", 0),
        sub(Expression.class, t.body(), id, "body", 0));
  }

  @Override
  public Tree visitWildPat(WildPat t, Slot slot) {
    return new WildPat(enter(t, slot), t.position());
  }

  @Override
  public Tree visitBindPat(BindPat t, Slot slot) {
    return new BindPat(enter(t, slot), t.position(), t.name());
  }

  @Override
  public Tree visitLitPat(LitPat t, Slot slot) {
    return new LitPat(enter(t, slot), t.position(), t.value());
  }

  @Override
  public Tree visitVariantPat(VariantPat t, Slot slot) {
    return new VariantPat(enter(t, slot), t.position(), t.name());
  }
}
