package org.obligato.tree;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.obligato.model.Const;
import org.obligato.model.Effect;

/**
 * An AST node of the canonical program representation.
 *
 * <p>Nodes are immutable. Children are owned by their parent; cross references between
 * declarations (calls, type uses) are by name, so the tree never contains cycles. Every node
 * placed in an {@link Ast} carries a {@link NodeId}; detached nodes (patch templates, goals)
 * carry {@link NodeId#UNASSIGNED}.
 */
@Immutable
public abstract class Tree {

  public abstract Kind kind();

  public abstract <I extends @Nullable Object, O extends @Nullable Object> O accept(
      Visitor<I, O> visitor, I input);

  private final NodeId id;
  private final int position;

  protected Tree(NodeId id, int position) {
    this.id = requireNonNull(id);
    this.position = position;
  }

  public NodeId id() {
    return id;
  }

  /** The source offset reported by the parser, or -1 for synthesized nodes. */
  public int position() {
    return position;
  }

  @Override
  public String toString() {
    return Pretty.pretty(this);
  }

  /** The syntactic category of a node, which determines where it may be placed. */
  public enum Category {
    UNIT,
    DECL,
    PARAM,
    FIELD_DECL,
    TYPE,
    STMT,
    EXPR,
    FIELD_INIT,
    ARM,
    PATTERN
  }

  /** Tree kind. */
  public enum Kind {
    COMP_UNIT(Category.UNIT),
    FN_DECL(Category.DECL),
    PARAM(Category.PARAM),
    RECORD_DECL(Category.DECL),
    FIELD_DECL(Category.FIELD_DECL),
    ENUM_DECL(Category.DECL),
    NAMED_TY(Category.TYPE),
    REFINED_TY(Category.TYPE),
    LET(Category.STMT),
    ASSIGN(Category.STMT),
    EXPR_STMT(Category.STMT),
    RETURN(Category.STMT),
    WHILE(Category.STMT),
    FOR(Category.STMT),
    LITERAL(Category.EXPR),
    IDENT(Category.EXPR),
    UNARY(Category.EXPR),
    BINARY(Category.EXPR),
    CALL(Category.EXPR),
    FIELD_ACCESS(Category.EXPR),
    INDEX(Category.EXPR),
    RECORD_LIT(Category.EXPR),
    FIELD_INIT(Category.FIELD_INIT),
    LIST_LIT(Category.EXPR),
    RANGE(Category.EXPR),
    IF(Category.EXPR),
    MATCH(Category.EXPR),
    MATCH_ARM(Category.ARM),
    BLOCK(Category.EXPR),
    FAIL(Category.EXPR),
    HOLE(Category.EXPR),
    QUANTIFIED(Category.EXPR),
    PAT_WILD(Category.PATTERN),
    PAT_BIND(Category.PATTERN),
    PAT_LIT(Category.PATTERN),
    PAT_VARIANT(Category.PATTERN);

    private final Category category;

    Kind(Category category) {
      this.category = category;
    }

    public Category category() {
      return category;
    }
  }

  /** A compilation unit: the root of every {@link Ast}. */
  public static class CompUnit extends Tree {
    private final ImmutableList<Decl> decls;

    public CompUnit(NodeId id, int position, ImmutableList<Decl> decls) {
      super(id, position);
      this.decls = decls;
    }

    @Override
    public Kind kind() {
      return Kind.COMP_UNIT;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitCompUnit(this, input);
    }

    public ImmutableList<Decl> decls() {
      return decls;
    }
  }

  /** A top-level declaration. */
  public abstract static class Decl extends Tree {
    protected Decl(NodeId id, int position) {
      super(id, position);
    }

    public abstract String name();
  }

  /**
   * A function declaration. Functions without a body are externs (the built-in prelude is made of
   * them).
   */
  public static class FnDecl extends Decl {
    private final String name;
    private final ImmutableList<Param> params;
    private final Ty returnType;
    private final ImmutableList<Effect> effects;
    private final Optional<Expression> requires;
    private final Optional<Expression> ensures;
    private final Optional<Block> body;

    public FnDecl(
        NodeId id,
        int position,
        String name,
        ImmutableList<Param> params,
        Ty returnType,
        ImmutableList<Effect> effects,
        Optional<Expression> requires,
        Optional<Expression> ensures,
        Optional<Block> body) {
      super(id, position);
      this.name = name;
      this.params = params;
      this.returnType = returnType;
      this.effects = effects;
      this.requires = requires;
      this.ensures = ensures;
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.FN_DECL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitFnDecl(this, input);
    }

    @Override
    public String name() {
      return name;
    }

    public ImmutableList<Param> params() {
      return params;
    }

    public Ty returnType() {
      return returnType;
    }

    /** The declared effects; empty for a pure function. */
    public ImmutableList<Effect> effects() {
      return effects;
    }

    /** The precondition, over the parameters. */
    public Optional<Expression> requires() {
      return requires;
    }

    /** The postcondition, over the parameters and {@code result}. */
    public Optional<Expression> ensures() {
      return ensures;
    }

    public Optional<Block> body() {
      return body;
    }
  }

  /** A function parameter. */
  public static class Param extends Tree {
    private final String name;
    private final Ty type;

    public Param(NodeId id, int position, String name, Ty type) {
      super(id, position);
      this.name = name;
      this.type = type;
    }

    @Override
    public Kind kind() {
      return Kind.PARAM;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitParam(this, input);
    }

    public String name() {
      return name;
    }

    public Ty type() {
      return type;
    }
  }

  /** A record type declaration. */
  public static class RecordDecl extends Decl {
    private final String name;
    private final ImmutableList<FieldDecl> fields;

    public RecordDecl(NodeId id, int position, String name, ImmutableList<FieldDecl> fields) {
      super(id, position);
      this.name = name;
      this.fields = fields;
    }

    @Override
    public Kind kind() {
      return Kind.RECORD_DECL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitRecordDecl(this, input);
    }

    @Override
    public String name() {
      return name;
    }

    public ImmutableList<FieldDecl> fields() {
      return fields;
    }
  }

  /** A record field declaration. */
  public static class FieldDecl extends Tree {
    private final String name;
    private final Ty type;

    public FieldDecl(NodeId id, int position, String name, Ty type) {
      super(id, position);
      this.name = name;
      this.type = type;
    }

    @Override
    public Kind kind() {
      return Kind.FIELD_DECL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitFieldDecl(this, input);
    }

    public String name() {
      return name;
    }

    public Ty type() {
      return type;
    }
  }

  /** An enumeration of payload-free variants. */
  public static class EnumDecl extends Decl {
    private final String name;
    private final ImmutableList<String> variants;

    public EnumDecl(NodeId id, int position, String name, ImmutableList<String> variants) {
      super(id, position);
      this.name = name;
      this.variants = variants;
    }

    @Override
    public Kind kind() {
      return Kind.ENUM_DECL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitEnumDecl(this, input);
    }

    @Override
    public String name() {
      return name;
    }

    public ImmutableList<String> variants() {
      return variants;
    }
  }

  /** A type use. */
  public abstract static class Ty extends Tree {
    protected Ty(NodeId id, int position) {
      super(id, position);
    }
  }

  /**
   * A named type, possibly applied to arguments: {@code Int}, {@code List[Int]}, {@code
   * Linear[FileHandle]}, or a record, enum or opaque type name.
   */
  public static class NamedTy extends Ty {
    private final String name;
    private final ImmutableList<Ty> args;

    public NamedTy(NodeId id, int position, String name, ImmutableList<Ty> args) {
      super(id, position);
      this.name = name;
      this.args = args;
    }

    @Override
    public Kind kind() {
      return Kind.NAMED_TY;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitNamedTy(this, input);
    }

    public String name() {
      return name;
    }

    public ImmutableList<Ty> args() {
      return args;
    }
  }

  /** A refinement type {@code {v: T | P}}. */
  public static class RefinedTy extends Ty {
    private final Ty base;
    private final String var;
    private final Expression predicate;

    public RefinedTy(NodeId id, int position, Ty base, String var, Expression predicate) {
      super(id, position);
      this.base = base;
      this.var = var;
      this.predicate = predicate;
    }

    @Override
    public Kind kind() {
      return Kind.REFINED_TY;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitRefinedTy(this, input);
    }

    public Ty base() {
      return base;
    }

    /** The name the predicate uses for the refined value. */
    public String var() {
      return var;
    }

    public Expression predicate() {
      return predicate;
    }
  }

  /** A statement. */
  public abstract static class Stmt extends Tree {
    protected Stmt(NodeId id, int position) {
      super(id, position);
    }
  }

  /** A local binding {@code let [mut] x[: T] = e}. */
  public static class Let extends Stmt {
    private final String name;
    private final boolean mutable;
    private final Optional<Ty> type;
    private final Expression init;

    public Let(
        NodeId id,
        int position,
        String name,
        boolean mutable,
        Optional<Ty> type,
        Expression init) {
      super(id, position);
      this.name = name;
      this.mutable = mutable;
      this.type = type;
      this.init = init;
    }

    @Override
    public Kind kind() {
      return Kind.LET;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitLet(this, input);
    }

    public String name() {
      return name;
    }

    public boolean mutable() {
      return mutable;
    }

    public Optional<Ty> type() {
      return type;
    }

    public Expression init() {
      return init;
    }
  }

  /** An assignment to a local binding. */
  public static class Assign extends Stmt {
    private final String name;
    private final Expression value;

    public Assign(NodeId id, int position, String name, Expression value) {
      super(id, position);
      this.name = name;
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGN;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitAssign(this, input);
    }

    public String name() {
      return name;
    }

    public Expression value() {
      return value;
    }
  }

  /** An expression evaluated for its effects. */
  public static class ExprStmt extends Stmt {
    private final Expression expr;

    public ExprStmt(NodeId id, int position, Expression expr) {
      super(id, position);
      this.expr = expr;
    }

    @Override
    public Kind kind() {
      return Kind.EXPR_STMT;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitExprStmt(this, input);
    }

    public Expression expr() {
      return expr;
    }
  }

  /** A return from the enclosing function. */
  public static class Return extends Stmt {
    private final Optional<Expression> expr;

    public Return(NodeId id, int position, Optional<Expression> expr) {
      super(id, position);
      this.expr = expr;
    }

    @Override
    public Kind kind() {
      return Kind.RETURN;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitReturn(this, input);
    }

    public Optional<Expression> expr() {
      return expr;
    }
  }

  /** A while loop. */
  public static class While extends Stmt {
    private final Expression cond;
    private final Block body;

    public While(NodeId id, int position, Expression cond, Block body) {
      super(id, position);
      this.cond = cond;
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.WHILE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitWhile(this, input);
    }

    public Expression cond() {
      return cond;
    }

    public Block body() {
      return body;
    }
  }

  /** A loop over the elements of a list or an integer {@link Range}. */
  public static class For extends Stmt {
    private final String var;
    private final Expression iterable;
    private final Block body;

    public For(NodeId id, int position, String var, Expression iterable, Block body) {
      super(id, position);
      this.var = var;
      this.iterable = iterable;
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.FOR;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitFor(this, input);
    }

    public String var() {
      return var;
    }

    public Expression iterable() {
      return iterable;
    }

    public Block body() {
      return body;
    }
  }

  /** An expression. */
  public abstract static class Expression extends Tree {
    protected Expression(NodeId id, int position) {
      super(id, position);
    }
  }

  /** A literal. */
  public static class Literal extends Expression {
    private final Const value;

    public Literal(NodeId id, int position, Const value) {
      super(id, position);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.LITERAL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitLiteral(this, input);
    }

    public Const value() {
      return value;
    }
  }

  /** A reference to a binding or an enum variant. */
  public static class Ident extends Expression {
    private final String name;

    public Ident(NodeId id, int position, String name) {
      super(id, position);
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.IDENT;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitIdent(this, input);
    }

    public String name() {
      return name;
    }
  }

  /** A unary expression. */
  public static class Unary extends Expression {
    private final OperatorKind op;
    private final Expression expr;

    public Unary(NodeId id, int position, OperatorKind op, Expression expr) {
      super(id, position);
      this.op = op;
      this.expr = expr;
    }

    @Override
    public Kind kind() {
      return Kind.UNARY;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitUnary(this, input);
    }

    public OperatorKind op() {
      return op;
    }

    public Expression expr() {
      return expr;
    }
  }

  /** A binary expression. */
  public static class Binary extends Expression {
    private final OperatorKind op;
    private final Expression lhs;
    private final Expression rhs;

    public Binary(NodeId id, int position, OperatorKind op, Expression lhs, Expression rhs) {
      super(id, position);
      this.op = op;
      this.lhs = lhs;
      this.rhs = rhs;
    }

    @Override
    public Kind kind() {
      return Kind.BINARY;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitBinary(this, input);
    }

    public OperatorKind op() {
      return op;
    }

    public Expression lhs() {
      return lhs;
    }

    public Expression rhs() {
      return rhs;
    }
  }

  /** A call of a named function. */
  public static class Call extends Expression {
    private final String callee;
    private final ImmutableList<Expression> args;

    public Call(NodeId id, int position, String callee, ImmutableList<Expression> args) {
      super(id, position);
      this.callee = callee;
      this.args = args;
    }

    @Override
    public Kind kind() {
      return Kind.CALL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitCall(this, input);
    }

    public String callee() {
      return callee;
    }

    public ImmutableList<Expression> args() {
      return args;
    }
  }

  /** A record field selection. */
  public static class FieldAccess extends Expression {
    private final Expression expr;
    private final String field;

    public FieldAccess(NodeId id, int position, Expression expr, String field) {
      super(id, position);
      this.expr = expr;
      this.field = field;
    }

    @Override
    public Kind kind() {
      return Kind.FIELD_ACCESS;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitFieldAccess(this, input);
    }

    public Expression expr() {
      return expr;
    }

    public String field() {
      return field;
    }
  }

  /** A list element access {@code xs[i]}; carries an implicit bounds precondition. */
  public static class Index extends Expression {
    private final Expression expr;
    private final Expression index;

    public Index(NodeId id, int position, Expression expr, Expression index) {
      super(id, position);
      this.expr = expr;
      this.index = index;
    }

    @Override
    public Kind kind() {
      return Kind.INDEX;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitIndex(this, input);
    }

    public Expression expr() {
      return expr;
    }

    public Expression index() {
      return index;
    }
  }

  /** A record construction {@code Point { x: 1, y: 2 }}. */
  public static class RecordLit extends Expression {
    private final String typeName;
    private final ImmutableList<FieldInit> fields;

    public RecordLit(NodeId id, int position, String typeName, ImmutableList<FieldInit> fields) {
      super(id, position);
      this.typeName = typeName;
      this.fields = fields;
    }

    @Override
    public Kind kind() {
      return Kind.RECORD_LIT;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitRecordLit(this, input);
    }

    public String typeName() {
      return typeName;
    }

    public ImmutableList<FieldInit> fields() {
      return fields;
    }
  }

  /** A field initializer of a {@link RecordLit}. */
  public static class FieldInit extends Tree {
    private final String name;
    private final Expression value;

    public FieldInit(NodeId id, int position, String name, Expression value) {
      super(id, position);
      this.name = name;
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.FIELD_INIT;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitFieldInit(this, input);
    }

    public String name() {
      return name;
    }

    public Expression value() {
      return value;
    }
  }

  /** A list literal. */
  public static class ListLit extends Expression {
    private final ImmutableList<Expression> elems;

    public ListLit(NodeId id, int position, ImmutableList<Expression> elems) {
      super(id, position);
      this.elems = elems;
    }

    @Override
    public Kind kind() {
      return Kind.LIST_LIT;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitListLit(this, input);
    }

    public ImmutableList<Expression> elems() {
      return elems;
    }
  }

  /** A half-open integer range {@code lo..hi}, iterable by {@link For}. */
  public static class Range extends Expression {
    private final Expression lo;
    private final Expression hi;

    public Range(NodeId id, int position, Expression lo, Expression hi) {
      super(id, position);
      this.lo = lo;
      this.hi = hi;
    }

    @Override
    public Kind kind() {
      return Kind.RANGE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitRange(this, input);
    }

    public Expression lo() {
      return lo;
    }

    public Expression hi() {
      return hi;
    }
  }

  /** A conditional. In statement position the canonical form always has an else branch. */
  public static class If extends Expression {
    private final Expression cond;
    private final Block then;
    private final Optional<Block> orElse;

    public If(NodeId id, int position, Expression cond, Block then, Optional<Block> orElse) {
      super(id, position);
      this.cond = cond;
      this.then = then;
      this.orElse = orElse;
    }

    @Override
    public Kind kind() {
      return Kind.IF;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitIf(this, input);
    }

    public Expression cond() {
      return cond;
    }

    public Block then() {
      return then;
    }

    public Optional<Block> orElse() {
      return orElse;
    }
  }

  /** A match over a scrutinee. */
  public static class Match extends Expression {
    private final Expression scrutinee;
    private final ImmutableList<MatchArm> arms;

    public Match(NodeId id, int position, Expression scrutinee, ImmutableList<MatchArm> arms) {
      super(id, position);
      this.scrutinee = scrutinee;
      this.arms = arms;
    }

    @Override
    public Kind kind() {
      return Kind.MATCH;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitMatch(this, input);
    }

    public Expression scrutinee() {
      return scrutinee;
    }

    public ImmutableList<MatchArm> arms() {
      return arms;
    }
  }

  /** One arm of a {@link Match}. */
  public static class MatchArm extends Tree {
    private final Pattern pattern;
    private final Block body;

    public MatchArm(NodeId id, int position, Pattern pattern, Block body) {
      super(id, position);
      this.pattern = pattern;
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.MATCH_ARM;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitMatchArm(this, input);
    }

    public Pattern pattern() {
      return pattern;
    }

    public Block body() {
      return body;
    }
  }

  /** A block of statements with an optional tail expression. */
  public static class Block extends Expression {
    private final ImmutableList<Stmt> stmts;
    private final Optional<Expression> tail;

    public Block(NodeId id, int position, ImmutableList<Stmt> stmts, Optional<Expression> tail) {
      super(id, position);
      this.stmts = stmts;
      this.tail = tail;
    }

    @Override
    public Kind kind() {
      return Kind.BLOCK;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitBlock(this, input);
    }

    public ImmutableList<Stmt> stmts() {
      return stmts;
    }

    public Optional<Expression> tail() {
      return tail;
    }
  }

  /** A runtime failure; diverges. */
  public static class Fail extends Expression {
    private final String message;

    public Fail(NodeId id, int position, String message) {
      super(id, position);
      this.message = message;
    }

    @Override
    public Kind kind() {
      return Kind.FAIL;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitFail(this, input);
    }

    public String message() {
      return message;
    }
  }

  /** A typed hole {@code ?name} awaiting a value. */
  public static class Hole extends Expression {
    private final String name;

    public Hole(NodeId id, int position, String name) {
      super(id, position);
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.HOLE;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitHole(this, input);
    }

    public String name() {
      return name;
    }
  }

  /** A quantifier kind. */
  public enum Quantifier {
    FORALL("forall"),
    EXISTS("exists");

    private final String keyword;

    Quantifier(String keyword) {
      this.keyword = keyword;
    }

    @Override
    public String toString() {
      return keyword;
    }
  }

  /** A quantified predicate {@code forall i in lo..hi: P}; only meaningful in specifications. */
  public static class Quantified extends Expression {
    private final Quantifier quantifier;
    private final String var;
    private final Expression domain;
    private final Expression body;

    public Quantified(
        NodeId id,
        int position,
        Quantifier quantifier,
        String var,
        Expression domain,
        Expression body) {
      super(id, position);
      this.quantifier = quantifier;
      this.var = var;
      this.domain = domain;
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.QUANTIFIED;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitQuantified(this, input);
    }

    public Quantifier quantifier() {
      return quantifier;
    }

    public String var() {
      return var;
    }

    public Expression domain() {
      return domain;
    }

    public Expression body() {
      return body;
    }
  }

  /** A match pattern. */
  public abstract static class Pattern extends Tree {
    protected Pattern(NodeId id, int position) {
      super(id, position);
    }
  }

  /** The wildcard pattern {@code _}. */
  public static class WildPat extends Pattern {
    public WildPat(NodeId id, int position) {
      super(id, position);
    }

    @Override
    public Kind kind() {
      return Kind.PAT_WILD;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitWildPat(this, input);
    }
  }

  /** A pattern binding the scrutinee to a name. */
  public static class BindPat extends Pattern {
    private final String name;

    public BindPat(NodeId id, int position, String name) {
      super(id, position);
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.PAT_BIND;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitBindPat(this, input);
    }

    public String name() {
      return name;
    }
  }

  /** A literal pattern. */
  public static class LitPat extends Pattern {
    private final Const value;

    public LitPat(NodeId id, int position, Const value) {
      super(id, position);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.PAT_LIT;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitLitPat(this, input);
    }

    public Const value() {
      return value;
    }
  }

  /** An enum variant pattern. */
  public static class VariantPat extends Pattern {
    private final String name;

    public VariantPat(NodeId id, int position, String name) {
      super(id, position);
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.PAT_VARIANT;
    }

    @Override
    public <I extends @Nullable Object, O extends @Nullable Object> O accept(
        Visitor<I, O> visitor, I input) {
      return visitor.visitVariantPat(this, input);
    }

    public String name() {
      return name;
    }
  }

  /** A visitor for {@link Tree}s. */
  public interface Visitor<I extends @Nullable Object, O extends @Nullable Object> {
    O visitCompUnit(CompUnit compUnit, I input);

    O visitFnDecl(FnDecl fnDecl, I input);

    O visitParam(Param param, I input);

    O visitRecordDecl(RecordDecl recordDecl, I input);

    O visitFieldDecl(FieldDecl fieldDecl, I input);

    O visitEnumDecl(EnumDecl enumDecl, I input);

    O visitNamedTy(NamedTy namedTy, I input);

    O visitRefinedTy(RefinedTy refinedTy, I input);

    O visitLet(Let let, I input);

    O visitAssign(Assign assign, I input);

    O visitExprStmt(ExprStmt exprStmt, I input);

    O visitReturn(Return ret, I input);

    O visitWhile(While whileStmt, I input);

    O visitFor(For forStmt, I input);

    O visitLiteral(Literal literal, I input);

    O visitIdent(Ident ident, I input);

    O visitUnary(Unary unary, I input);

    O visitBinary(Binary binary, I input);

    O visitCall(Call call, I input);

    O visitFieldAccess(FieldAccess fieldAccess, I input);

    O visitIndex(Index index, I input);

    O visitRecordLit(RecordLit recordLit, I input);

    O visitFieldInit(FieldInit fieldInit, I input);

    O visitListLit(ListLit listLit, I input);

    O visitRange(Range range, I input);

    O visitIf(If ifExpr, I input);

    O visitMatch(Match match, I input);

    O visitMatchArm(MatchArm matchArm, I input);

    O visitBlock(Block block, I input);

    O visitFail(Fail fail, I input);

    O visitHole(Hole hole, I input);

    O visitQuantified(Quantified quantified, I input);

    O visitWildPat(WildPat wildPat, I input);

    O visitBindPat(BindPat bindPat, I input);

    O visitLitPat(LitPat litPat, I input);

    O visitVariantPat(VariantPat variantPat, I input);
  }
}
