package org.obligato.tree;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
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
import org.obligato.tree.Tree.Pattern;
import org.obligato.tree.Tree.Quantified;
import org.obligato.tree.Tree.Quantifier;
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
 * Factories for detached trees. Drivers use them to hand a desugared program to the engine, and
 * the repair templates use them to build patch payloads. Every node built here is unassigned;
 * {@link Ast#of} and the patch applier give them ids.
 */
public final class Trees {

  private static final NodeId U = NodeId.UNASSIGNED;
  private static final int NO_POS = -1;

  // declarations

  public static CompUnit unit(Decl... decls) {
    return new CompUnit(U, NO_POS, ImmutableList.copyOf(decls));
  }

  public static FnBuilder fn(String name) {
    return new FnBuilder(name);
  }

  /** A builder for {@link FnDecl}s. */
  public static final class FnBuilder {
    private final String name;
    private final ImmutableList.Builder<Param> params = ImmutableList.builder();
    private Ty returnType = unitTy();
    private final ImmutableList.Builder<Effect> effects = ImmutableList.builder();
    private Optional<Expression> requires = Optional.empty();
    private Optional<Expression> ensures = Optional.empty();

    private FnBuilder(String name) {
      this.name = name;
    }

    @CanIgnoreReturnValue
    public FnBuilder param(String name, Ty type) {
      params.add(new Param(U, NO_POS, name, type));
      return this;
    }

    @CanIgnoreReturnValue
    public FnBuilder returns(Ty type) {
      this.returnType = type;
      return this;
    }

    @CanIgnoreReturnValue
    public FnBuilder effect(String effect) {
      effects.add(Effect.of(effect));
      return this;
    }

    @CanIgnoreReturnValue
    public FnBuilder effect(Effect effect) {
      effects.add(effect);
      return this;
    }

    @CanIgnoreReturnValue
    public FnBuilder requires(Expression requires) {
      this.requires = Optional.of(requires);
      return this;
    }

    @CanIgnoreReturnValue
    public FnBuilder ensures(Expression ensures) {
      this.ensures = Optional.of(ensures);
      return this;
    }

    public FnDecl body(Block body) {
      return build(Optional.of(body));
    }

    public FnDecl body(Stmt... stmts) {
      return build(Optional.of(block(stmts)));
    }

    /** Builds a function without a body. */
    public FnDecl extern() {
      return build(Optional.empty());
    }

    private FnDecl build(Optional<Block> body) {
      return new FnDecl(
          U,
          NO_POS,
          name,
          params.build(),
          returnType,
          effects.build(),
          requires,
          ensures,
          body);
    }
  }

  public static Param param(String name, Ty type) {
    return new Param(U, NO_POS, name, type);
  }

  public static RecordDecl recordDecl(String name, FieldDecl... fields) {
    return new RecordDecl(U, NO_POS, name, ImmutableList.copyOf(fields));
  }

  public static FieldDecl fieldDecl(String name, Ty type) {
    return new FieldDecl(U, NO_POS, name, type);
  }

  public static EnumDecl enumDecl(String name, String... variants) {
    return new EnumDecl(U, NO_POS, name, ImmutableList.copyOf(variants));
  }

  // types

  public static NamedTy ty(String name, Ty... args) {
    return new NamedTy(U, NO_POS, name, ImmutableList.copyOf(args));
  }

  public static NamedTy intTy() {
    return ty("Int");
  }

  public static NamedTy realTy() {
    return ty("Real");
  }

  public static NamedTy boolTy() {
    return ty("Bool");
  }

  public static NamedTy stringTy() {
    return ty("String");
  }

  public static NamedTy unitTy() {
    return ty("Unit");
  }

  public static NamedTy listTy(Ty elem) {
    return ty("List", elem);
  }

  public static NamedTy linearTy(Ty elem) {
    return ty("Linear", elem);
  }

  /** The refinement type {@code {var: base | predicate}}. */
  public static RefinedTy refined(Ty base, String var, Expression predicate) {
    return new RefinedTy(U, NO_POS, base, var, predicate);
  }

  // statements

  public static Let let(String name, Expression init) {
    return new Let(U, NO_POS, name, false, Optional.empty(), init);
  }

  public static Let let(String name, Ty type, Expression init) {
    return new Let(U, NO_POS, name, false, Optional.of(type), init);
  }

  public static Let letMut(String name, Expression init) {
    return new Let(U, NO_POS, name, true, Optional.empty(), init);
  }

  public static Assign assign(String name, Expression value) {
    return new Assign(U, NO_POS, name, value);
  }

  public static ExprStmt exprStmt(Expression expr) {
    return new ExprStmt(U, NO_POS, expr);
  }

  public static Return ret(Expression expr) {
    return new Return(U, NO_POS, Optional.of(expr));
  }

  public static Return ret() {
    return new Return(U, NO_POS, Optional.empty());
  }

  public static While whileLoop(Expression cond, Stmt... body) {
    return new While(U, NO_POS, cond, block(body));
  }

  public static For forLoop(String var, Expression iterable, Stmt... body) {
    return new For(U, NO_POS, var, iterable, block(body));
  }

  // expressions

  public static Literal lit(long value) {
    return new Literal(U, NO_POS, Const.of(value));
  }

  public static Literal lit(boolean value) {
    return new Literal(U, NO_POS, Const.of(value));
  }

  public static Literal lit(Const value) {
    return new Literal(U, NO_POS, value);
  }

  public static Literal str(String value) {
    return new Literal(U, NO_POS, Const.of(value));
  }

  public static Literal unitLit() {
    return new Literal(U, NO_POS, Const.UnitValue.INSTANCE);
  }

  public static Ident ident(String name) {
    return new Ident(U, NO_POS, name);
  }

  public static Unary unary(OperatorKind op, Expression expr) {
    return new Unary(U, NO_POS, op, expr);
  }

  public static Unary not(Expression expr) {
    return unary(OperatorKind.NOT, expr);
  }

  public static Unary neg(Expression expr) {
    return unary(OperatorKind.NEG, expr);
  }

  public static Binary binary(OperatorKind op, Expression lhs, Expression rhs) {
    return new Binary(U, NO_POS, op, lhs, rhs);
  }

  public static Binary and(Expression lhs, Expression rhs) {
    return binary(OperatorKind.AND, lhs, rhs);
  }

  public static Binary or(Expression lhs, Expression rhs) {
    return binary(OperatorKind.OR, lhs, rhs);
  }

  public static Binary eq(Expression lhs, Expression rhs) {
    return binary(OperatorKind.EQUAL, lhs, rhs);
  }

  public static Binary ne(Expression lhs, Expression rhs) {
    return binary(OperatorKind.NOT_EQUAL, lhs, rhs);
  }

  public static Binary lt(Expression lhs, Expression rhs) {
    return binary(OperatorKind.LESS_THAN, lhs, rhs);
  }

  public static Binary le(Expression lhs, Expression rhs) {
    return binary(OperatorKind.LESS_THAN_EQ, lhs, rhs);
  }

  public static Binary gt(Expression lhs, Expression rhs) {
    return binary(OperatorKind.GREATER_THAN, lhs, rhs);
  }

  public static Binary ge(Expression lhs, Expression rhs) {
    return binary(OperatorKind.GREATER_THAN_EQ, lhs, rhs);
  }

  public static Binary plus(Expression lhs, Expression rhs) {
    return binary(OperatorKind.PLUS, lhs, rhs);
  }

  public static Binary minus(Expression lhs, Expression rhs) {
    return binary(OperatorKind.MINUS, lhs, rhs);
  }

  public static Binary times(Expression lhs, Expression rhs) {
    return binary(OperatorKind.MULT, lhs, rhs);
  }

  public static Binary div(Expression lhs, Expression rhs) {
    return binary(OperatorKind.DIVIDE, lhs, rhs);
  }

  public static Binary mod(Expression lhs, Expression rhs) {
    return binary(OperatorKind.MODULO, lhs, rhs);
  }

  public static Call call(String callee, Expression... args) {
    return new Call(U, NO_POS, callee, ImmutableList.copyOf(args));
  }

  public static Call call(String callee, List<Expression> args) {
    return new Call(U, NO_POS, callee, ImmutableList.copyOf(args));
  }

  public static FieldAccess field(Expression expr, String field) {
    return new FieldAccess(U, NO_POS, expr, field);
  }

  public static Index index(Expression expr, Expression index) {
    return new Index(U, NO_POS, expr, index);
  }

  public static RecordLit recordLit(String typeName, FieldInit... fields) {
    return new RecordLit(U, NO_POS, typeName, ImmutableList.copyOf(fields));
  }

  public static FieldInit init(String name, Expression value) {
    return new FieldInit(U, NO_POS, name, value);
  }

  public static ListLit list(Expression... elems) {
    return new ListLit(U, NO_POS, ImmutableList.copyOf(elems));
  }

  public static Range range(Expression lo, Expression hi) {
    return new Range(U, NO_POS, lo, hi);
  }

  public static If ifThen(Expression cond, Block then) {
    return new If(U, NO_POS, cond, then, Optional.empty());
  }

  public static If ifElse(Expression cond, Block then, Block orElse) {
    return new If(U, NO_POS, cond, then, Optional.of(orElse));
  }

  public static Match match(Expression scrutinee, MatchArm... arms) {
    return new Match(U, NO_POS, scrutinee, ImmutableList.copyOf(arms));
  }

  public static MatchArm arm(Pattern pattern, Block body) {
    return new MatchArm(U, NO_POS, pattern, body);
  }

  public static Block block(Stmt... stmts) {
    return new Block(U, NO_POS, ImmutableList.copyOf(stmts), Optional.empty());
  }

  /** A block with a tail expression. */
  public static Block valueBlock(Expression tail, Stmt... stmts) {
    return new Block(U, NO_POS, ImmutableList.copyOf(Arrays.asList(stmts)), Optional.of(tail));
  }

  public static Fail fail(String message) {
    return new Fail(U, NO_POS, message);
  }

  public static Hole hole(String name) {
    return new Hole(U, NO_POS, name);
  }

  public static Quantified forall(String var, Expression domain, Expression body) {
    return new Quantified(U, NO_POS, Quantifier.FORALL, var, domain, body);
  }

  public static Quantified exists(String var, Expression domain, Expression body) {
    return new Quantified(U, NO_POS, Quantifier.EXISTS, var, domain, body);
  }

  // patterns

  public static WildPat wild() {
    return new WildPat(U, NO_POS);
  }

  public static BindPat bindPat(String name) {
    return new BindPat(U, NO_POS, name);
  }

  public static LitPat litPat(Const value) {
    return new LitPat(U, NO_POS, value);
  }

  public static VariantPat variantPat(String name) {
    return new VariantPat(U, NO_POS, name);
  }

  // identity

  /** Returns a copy of {@code tree} in which no node carries an id. */
  public static <T extends Tree> T detach(T tree) {
    @SuppressWarnings("unchecked") // copies preserve the node class
    T result =
        (T)
            tree.accept(
                new TreeCopier() {
                  @Override
                  protected NodeId enter(Tree t, Slot slot) {
                    return NodeId.UNASSIGNED;
                  }
                },
                TreeCopier.Slot.ROOT);
    return result;
  }

  /** Returns a copy of {@code tree} whose root carries {@code id}; descendants are unchanged. */
  public static <T extends Tree> T withId(T tree, NodeId id) {
    @SuppressWarnings("unchecked") // copies preserve the node class
    T result =
        (T)
            tree.accept(
                new TreeCopier() {
                  @Override
                  protected NodeId enter(Tree t, Slot slot) {
                    return t == tree ? id : t.id();
                  }
                },
                TreeCopier.Slot.ROOT);
    return result;
  }

  private Trees() {}
}
