package org.obligato.extract;

import static org.obligato.tree.Trees.and;
import static org.obligato.tree.Trees.call;
import static org.obligato.tree.Trees.eq;
import static org.obligato.tree.Trees.ident;
import static org.obligato.tree.Trees.le;
import static org.obligato.tree.Trees.lit;
import static org.obligato.tree.Trees.lt;
import static org.obligato.tree.Trees.ne;
import static org.obligato.tree.Trees.not;
import static org.obligato.tree.Trees.unitLit;

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;
import org.obligato.binder.Binding;
import org.obligato.binder.BindingKind;
import org.obligato.binder.ContextSnapshot;
import org.obligato.binder.Fact;
import org.obligato.binder.FactContext;
import org.obligato.binder.FnSignature;
import org.obligato.binder.GlobalEnv;
import org.obligato.binder.Provenance;
import org.obligato.binder.ScopeKind;
import org.obligato.diag.DiagnosticKind;
import org.obligato.diag.DiagnosticLog;
import org.obligato.model.Const;
import org.obligato.model.Effect;
import org.obligato.model.EffectSet;
import org.obligato.solver.SolverOutcome;
import org.obligato.tree.Ast;
import org.obligato.tree.Children;
import org.obligato.tree.FreeNames;
import org.obligato.tree.NodeId;
import org.obligato.tree.OperatorKind;
import org.obligato.tree.Pretty;
import org.obligato.tree.Substitution;
import org.obligato.tree.Tree;
import org.obligato.tree.Tree.Block;
import org.obligato.tree.Tree.Expression;
import org.obligato.tree.Tree.FieldDecl;
import org.obligato.tree.Tree.FnDecl;
import org.obligato.tree.Tree.Param;
import org.obligato.tree.Tree.Stmt;
import org.obligato.tree.Trees;
import org.obligato.type.Type;

/**
 * Walks a canonical tree once, in pre-order, and emits the proof obligations of every function
 * together with the static diagnostics that are not obligations.
 *
 * <p>Effect and linearity obligations are decided here. Refinement, precondition and
 * postcondition obligations are left undecided for the solver.
 */
public final class ObligationExtractor {

  /** Extracts the obligations and holes of {@code ast}, reporting diagnostics to {@code log}. */
  public static Extraction extract(Ast ast, GlobalEnv env, DiagnosticLog log) {
    ObligationExtractor extractor = new ObligationExtractor(env, log);
    for (Tree.Decl decl : ast.root().decls()) {
      switch (decl.kind()) {
        case FN_DECL:
          extractor.function((FnDecl) decl);
          break;
        case RECORD_DECL:
          extractor.record((Tree.RecordDecl) decl);
          break;
        case ENUM_DECL:
          break;
        default:
          throw new AssertionError(decl.kind());
      }
    }
    return Extraction.create(
        ImmutableList.copyOf(extractor.obligations), ImmutableList.copyOf(extractor.holes));
  }

  private final GlobalEnv env;
  private final DiagnosticLog log;
  private final List<Obligation> obligations = new ArrayList<>();
  private final List<TypedHole> holes = new ArrayList<>();
  private final Set<String> obligationIds = new HashSet<>();

  private FactContext ctx = new FactContext();
  private ExpressionTyper typer;
  private FnDecl fn;
  private Type returnType = Type.UNIT;
  private EffectSet allowed = EffectSet.PURE;
  private boolean reachable = true;

  /** Inside a contract or refinement predicate: names are checked, nothing needs proof. */
  private boolean inSpec = false;

  private ObligationExtractor(GlobalEnv env, DiagnosticLog log) {
    this.env = env;
    this.log = log;
    this.typer = new ExpressionTyper(env, ctx);
  }

  private void reset() {
    ctx = new FactContext();
    typer = new ExpressionTyper(env, ctx);
    reachable = true;
    inSpec = false;
  }

  // declarations

  private void record(Tree.RecordDecl decl) {
    reset();
    ctx.enterScope(ScopeKind.FUNCTION);
    List<Type> types = new ArrayList<>();
    for (FieldDecl field : decl.fields()) {
      Type type = env.resolve(field.type());
      types.add(type);
      ctx.bind(field.name(), type.base(), false, BindingKind.LET, field.id());
    }
    for (int i = 0; i < types.size(); i++) {
      checkRefinement(types.get(i), decl.fields().get(i).id());
    }
    ctx.exitScope();
  }

  private void function(FnDecl decl) {
    reset();
    fn = decl;
    allowed = EffectSet.copyOf(decl.effects());
    ctx.enterScope(ScopeKind.FUNCTION);
    for (Param param : decl.params()) {
      Type type = env.resolve(param.type());
      checkRefinement(type, param.id());
      ctx.bind(param.name(), type, false, BindingKind.PARAMETER, param.id());
      if (type instanceof Type.RefinedType) {
        ctx.assume(
            instantiate((Type.RefinedType) type, ident(param.name())),
            Provenance.PARAMETER_REFINEMENT,
            param.id());
      }
    }
    returnType = env.resolve(decl.returnType());
    checkRefinement(returnType, decl.returnType().id());
    if (decl.requires().isPresent()) {
      spec(decl.requires().get());
      ctx.assume(decl.requires().get(), Provenance.PRECONDITION, decl.id());
    }
    if (decl.ensures().isPresent()) {
      ctx.enterScope(ScopeKind.BLOCK);
      ctx.bind("result", returnType, false, BindingKind.LET, decl.id());
      spec(decl.ensures().get());
      ctx.exitScope();
    }
    if (decl.body().isPresent()) {
      Block body = decl.body().get();
      for (Param param : decl.params()) {
        Optional<Binding> binding = ctx.lookup(param.name());
        if (binding.isPresent() && binding.get().type().isLinear()) {
          linearity(param.name(), param.id(), body.stmts(), body.tail());
        }
      }
      Type result = block(body, returnType, true);
      if (reachable && body.tail().isEmpty() && decl.ensures().isPresent()) {
        postcondition(unitLit(), body.id());
      }
      if (reachable && body.tail().isPresent() && result.kind() != Type.Kind.ERROR) {
        returned(body.tail().get(), result, body.tail().get().id());
      }
    }
    ctx.exitScope();
  }

  /** Checks the names in the predicate of a refined type, with the refinement variable bound. */
  private void checkRefinement(Type type, NodeId declaration) {
    if (!(type instanceof Type.RefinedType)) {
      return;
    }
    Type.RefinedType refined = (Type.RefinedType) type;
    ctx.enterScope(ScopeKind.BLOCK);
    ctx.bind(refined.var(), refined.refinedBase(), false, BindingKind.LET, declaration);
    spec(refined.predicate());
    ctx.exitScope();
  }

  private void spec(Expression predicate) {
    boolean saved = inSpec;
    inSpec = true;
    expr(predicate, Type.BOOL);
    inSpec = saved;
  }

  // statements

  /**
   * Walks a block in its own scope and returns the type of its tail. Statements after one that
   * always diverges are reported as unreachable and skipped.
   */
  private Type block(Block block, Type expected, boolean functionBody) {
    ctx.enterScope(functionBody ? ScopeKind.FUNCTION : ScopeKind.BLOCK);
    ImmutableList<Stmt> stmts = block.stmts();
    Type result = Type.UNIT;
    for (int i = 0; i < stmts.size(); i++) {
      if (!reachable) {
        unreachable(stmts.get(i).id());
        ctx.exitScope();
        return Type.ANY;
      }
      stmt(stmts.get(i), stmts.subList(i + 1, stmts.size()), block.tail());
    }
    if (block.tail().isPresent()) {
      if (!reachable) {
        unreachable(block.tail().get().id());
      } else {
        result = expr(block.tail().get(), expected);
      }
    }
    ctx.exitScope();
    return reachable ? result : Type.ANY;
  }

  private void unreachable(NodeId node) {
    if (!inSpec) {
      log.error(DiagnosticKind.UNREACHABLE_CODE, node);
    }
  }

  private void stmt(Stmt stmt, List<Stmt> rest, Optional<Expression> tail) {
    switch (stmt.kind()) {
      case LET:
        let((Tree.Let) stmt, rest, tail);
        return;
      case ASSIGN:
        assign((Tree.Assign) stmt);
        return;
      case EXPR_STMT:
        expr(((Tree.ExprStmt) stmt).expr(), Type.ANY);
        return;
      case RETURN:
        ret((Tree.Return) stmt);
        return;
      case WHILE:
        whileLoop((Tree.While) stmt);
        return;
      case FOR:
        forLoop((Tree.For) stmt);
        return;
      default:
        throw new AssertionError(stmt.kind());
    }
  }

  private void let(Tree.Let let, List<Stmt> rest, Optional<Expression> tail) {
    Optional<Type> declared = let.type().map(env::resolve);
    if (declared.isPresent()) {
      checkRefinement(declared.get(), let.id());
    }
    Expression init = let.init();
    Type initType = expr(init, declared.orElse(Type.ANY));
    List<Expression> facts = new ArrayList<>();
    List<Provenance> provenances = new ArrayList<>();
    if (declared.isPresent()) {
      checkAssignable(init, initType, declared.get());
      if (declared.get() instanceof Type.RefinedType) {
        Type.RefinedType refined = (Type.RefinedType) declared.get();
        obligation(
            ObligationKind.REFINEMENT,
            instantiate(refined, init),
            init.id(),
            "declared refinement of " + let.name());
        facts.add(instantiate(refined, ident(let.name())));
        provenances.add(Provenance.DECLARED_REFINEMENT);
      }
    }
    if (init.kind() == Tree.Kind.CALL && !mentionsAny(init, let.name())) {
      Tree.Call call = (Tree.Call) init;
      Optional<FnSignature> sig = env.function(call.callee());
      if (sig.isPresent() && sig.get().arity() == call.args().size()) {
        Map<String, Expression> args = arguments(sig.get(), call);
        if (initType instanceof Type.RefinedType) {
          facts.add(instantiate((Type.RefinedType) initType, ident(let.name())));
          provenances.add(Provenance.POSTCONDITION_OF_CALLEE);
        }
        if (sig.get().ensures().isPresent()) {
          Map<String, Expression> withResult = new LinkedHashMap<>(args);
          withResult.put("result", ident(let.name()));
          facts.add(Substitution.apply(sig.get().ensures().get(), withResult));
          provenances.add(Provenance.POSTCONDITION_OF_CALLEE);
        }
      }
    }
    if (isPure(init) && !mentionsAny(init, let.name())) {
      facts.add(eq(ident(let.name()), init));
      provenances.add(Provenance.LET_DEFINITION);
    }
    if (init.kind() == Tree.Kind.LIST_LIT) {
      facts.add(
          eq(call("len", ident(let.name())), lit(((Tree.ListLit) init).elems().size())));
      provenances.add(Provenance.LET_DEFINITION);
    }
    Type type = declared.orElse(initType);
    ctx.bind(let.name(), type, let.mutable(), BindingKind.LET, let.id());
    for (int i = 0; i < facts.size(); i++) {
      ctx.assume(facts.get(i), provenances.get(i), let.id());
    }
    if (type.isLinear()) {
      linearity(let.name(), let.id(), rest, tail);
    }
  }

  private void assign(Tree.Assign assign) {
    Optional<Binding> binding = ctx.lookup(assign.name());
    Expression value = assign.value();
    Type valueType = expr(value, binding.map(Binding::type).orElse(Type.ANY));
    if (binding.isEmpty()) {
      unresolved(assign.name(), assign.id());
      return;
    }
    Binding b = binding.get();
    if (!b.mutable()) {
      log.report(
          DiagnosticKind.IMMUTABLE_ASSIGNMENT,
          assign.id(),
          ImmutableList.of(b.declaration()),
          ImmutableMap.of(
              "name", b.name(),
              "binding", Ascii.toLowerCase(b.kind().name()),
              "declaration", b.declaration().toString()),
          b.name());
      return;
    }
    checkAssignable(value, valueType, b.type());
    @Nullable Expression definition =
        isPure(value) && !mentionsAny(value, b.name()) ? eq(ident(b.name()), value) : null;
    if (b.type() instanceof Type.RefinedType) {
      obligation(
          ObligationKind.REFINEMENT,
          instantiate((Type.RefinedType) b.type(), value),
          value.id(),
          "refinement of " + b.name());
    }
    ctx.invalidate(b.name());
    if (b.type() instanceof Type.RefinedType) {
      ctx.assume(
          instantiate((Type.RefinedType) b.type(), ident(b.name())),
          Provenance.DECLARED_REFINEMENT,
          assign.id());
    }
    if (definition != null) {
      ctx.assume(definition, Provenance.LET_DEFINITION, assign.id());
    }
  }

  private void ret(Tree.Return ret) {
    if (ret.expr().isPresent()) {
      Expression value = ret.expr().get();
      Type type = expr(value, returnType);
      returned(value, type, ret.id());
    } else if (fn.ensures().isPresent()) {
      postcondition(unitLit(), ret.id());
    }
    reachable = false;
  }

  /** Checks a value leaving the function at {@code exit}. */
  private void returned(Expression value, Type type, NodeId exit) {
    checkAssignable(value, type, returnType);
    if (returnType instanceof Type.RefinedType) {
      obligation(
          ObligationKind.REFINEMENT,
          instantiate((Type.RefinedType) returnType, value),
          value.id(),
          "refinement of the return type of " + fn.name());
    }
    if (fn.ensures().isPresent()) {
      postcondition(value, exit);
    }
  }

  private void postcondition(Expression value, NodeId exit) {
    obligation(
        ObligationKind.POSTCONDITION,
        Substitution.apply(fn.ensures().get(), "result", value),
        exit,
        "postcondition of " + fn.name());
  }

  private void whileLoop(Tree.While loop) {
    for (String name : assignedIn(loop.body())) {
      ctx.invalidate(name);
    }
    Type cond = expr(loop.cond(), Type.BOOL);
    checkAssignable(loop.cond(), cond, Type.BOOL);
    boolean entry = reachable;
    boolean pure = isPure(loop.cond());
    ctx.enterScope(ScopeKind.LOOP);
    if (pure) {
      ctx.assume(loop.cond(), Provenance.LOOP_CONDITION, loop.id());
    }
    block(loop.body(), Type.ANY, false);
    ctx.exitScope();
    reachable = entry;
    if (pure) {
      ctx.assume(negate(loop.cond()), Provenance.LOOP_EXIT, loop.id());
    }
  }

  private void forLoop(Tree.For loop) {
    for (String name : assignedIn(loop.body())) {
      ctx.invalidate(name);
    }
    Type iterable = expr(loop.iterable(), Type.ANY).base();
    Type elem =
        iterable.kind() == Type.Kind.LIST ? ((Type.ElemType) iterable).elem() : Type.ERROR;
    boolean entry = reachable;
    ctx.enterScope(ScopeKind.LOOP);
    ctx.bind(loop.var(), elem, false, BindingKind.FOR, loop.id());
    if (loop.iterable().kind() == Tree.Kind.RANGE) {
      Tree.Range range = (Tree.Range) loop.iterable();
      if (isPure(range.lo()) && isPure(range.hi())) {
        ctx.assume(
            and(le(range.lo(), ident(loop.var())), lt(ident(loop.var()), range.hi())),
            Provenance.LOOP_RANGE,
            loop.id());
      }
    }
    block(loop.body(), Type.ANY, false);
    ctx.exitScope();
    reachable = entry;
  }

  private void linearity(
      String name, NodeId declaration, List<Stmt> rest, Optional<Expression> tail) {
    if (inSpec) {
      return;
    }
    LinearityAnalysis.Verdict verdict = LinearityAnalysis.analyze(name, rest, tail);
    SolverOutcome outcome;
    if (verdict.ok()) {
      outcome = SolverOutcome.discharged();
    } else {
      String uses = verdict.unused() && verdict.reused() ? "0|2" : verdict.unused() ? "0" : "2";
      outcome = SolverOutcome.counterexample(ImmutableMap.of("uses(" + name + ")", uses));
    }
    add(
        ObligationKind.LINEARITY,
        eq(call("uses", ident(name)), lit(1)),
        declaration,
        "linear binding " + name + " must be used exactly once",
        outcome);
  }

  // expressions

  /**
   * Walks an expression and returns its type. Refinements are kept where they are known (bindings
   * and call results), so that callers can turn them into facts.
   */
  private Type expr(Expression e, Type expected) {
    switch (e.kind()) {
      case LITERAL:
        return ExpressionTyper.typeOf(((Tree.Literal) e).value());
      case IDENT:
        return identifier((Tree.Ident) e);
      case UNARY:
        {
          Tree.Unary unary = (Tree.Unary) e;
          Type operand = expr(unary.expr(), Type.ANY);
          return unary.op() == OperatorKind.NOT ? Type.BOOL : operand.base();
        }
      case BINARY:
        return binary((Tree.Binary) e);
      case CALL:
        return callExpr((Tree.Call) e);
      case FIELD_ACCESS:
        return fieldAccess((Tree.FieldAccess) e);
      case INDEX:
        {
          Tree.Index index = (Tree.Index) e;
          Type list = expr(index.expr(), Type.ANY).base();
          expr(index.index(), Type.INT);
          obligation(
              ObligationKind.PRECONDITION,
              and(
                  le(lit(0), index.index()),
                  lt(index.index(), call("len", index.expr()))),
              e.id(),
              "index within bounds");
          return list.kind() == Type.Kind.LIST ? ((Type.ElemType) list).elem() : Type.ERROR;
        }
      case RECORD_LIT:
        return recordLit((Tree.RecordLit) e);
      case LIST_LIT:
        {
          Type elem = Type.ANY;
          for (Expression element : ((Tree.ListLit) e).elems()) {
            Type t = expr(element, Type.ANY).base();
            if (elem.kind() == Type.Kind.ANY) {
              elem = t;
            }
          }
          return Type.list(elem);
        }
      case RANGE:
        {
          Tree.Range range = (Tree.Range) e;
          expr(range.lo(), Type.INT);
          expr(range.hi(), Type.INT);
          return Type.list(Type.INT);
        }
      case IF:
        return ifExpr((Tree.If) e, expected);
      case MATCH:
        return match((Tree.Match) e, expected);
      case BLOCK:
        return block((Block) e, expected, false);
      case FAIL:
        reachable = false;
        return Type.ANY;
      case HOLE:
        if (!inSpec) {
          holes.add(TypedHole.create(e.id(), ((Tree.Hole) e).name(), expected));
        }
        return Type.ANY;
      case QUANTIFIED:
        {
          Tree.Quantified q = (Tree.Quantified) e;
          Type domain = expr(q.domain(), Type.ANY).base();
          ctx.enterScope(ScopeKind.BLOCK);
          ctx.bind(
              q.var(),
              domain.kind() == Type.Kind.LIST ? ((Type.ElemType) domain).elem() : Type.ERROR,
              false,
              BindingKind.FOR,
              q.id());
          boolean saved = inSpec;
          inSpec = true;
          expr(q.body(), Type.BOOL);
          inSpec = saved;
          ctx.exitScope();
          return Type.BOOL;
        }
      default:
        throw new AssertionError(e.kind());
    }
  }

  private Type identifier(Tree.Ident ident) {
    Optional<Binding> binding = ctx.lookup(ident.name());
    if (binding.isPresent()) {
      return binding.get().type();
    }
    Optional<Tree.EnumDecl> decl = env.enumOfVariant(ident.name());
    if (decl.isPresent()) {
      return Type.enumType(decl.get().name());
    }
    unresolved(ident.name(), ident.id());
    return Type.ERROR;
  }

  private void unresolved(String name, NodeId node) {
    Set<String> candidates = new TreeSet<>();
    for (Binding binding : ctx.visibleBindings()) {
      candidates.add(binding.name());
    }
    candidates.addAll(env.variantNames());
    log.report(
        DiagnosticKind.UNRESOLVED_NAME,
        node,
        ImmutableList.of(),
        ImmutableMap.of("name", name, "candidates", Joiner.on(',').join(candidates)),
        name);
  }

  private Type binary(Tree.Binary binary) {
    Type lhs = expr(binary.lhs(), Type.ANY);
    switch (binary.op()) {
      case AND:
      case OR:
      case IMPLIES:
        {
          // the right operand is only evaluated when the left one did not decide the result
          ctx.enterScope(ScopeKind.BRANCH);
          if (isPure(binary.lhs())) {
            ctx.assume(
                binary.op() == OperatorKind.OR ? negate(binary.lhs()) : binary.lhs(),
                Provenance.BRANCH_CONDITION,
                binary.id());
          }
          expr(binary.rhs(), Type.BOOL);
          ctx.exitScope();
          return Type.BOOL;
        }
      default:
        break;
    }
    Type rhs = expr(binary.rhs(), Type.ANY);
    if (binary.op() == OperatorKind.DIVIDE || binary.op() == OperatorKind.MODULO) {
      obligation(
          ObligationKind.PRECONDITION,
          ne(binary.rhs(), lit(0)),
          binary.id(),
          "divisor of " + binary.op() + " must be nonzero");
    }
    return binary.op().isArithmetic() ? ExpressionTyper.numericJoin(lhs, rhs) : Type.BOOL;
  }

  private Type callExpr(Tree.Call call) {
    Optional<FnSignature> maybeSig = env.function(call.callee());
    if (maybeSig.isEmpty()) {
      for (Expression arg : call.args()) {
        expr(arg, Type.ANY);
      }
      log.report(
          DiagnosticKind.UNKNOWN_FUNCTION,
          call.id(),
          ImmutableList.of(),
          ImmutableMap.of(
              "name",
              call.callee(),
              "candidates",
              Joiner.on(',').join(ImmutableSortedSet.copyOf(env.functionNames()))),
          call.callee());
      return Type.ERROR;
    }
    FnSignature sig = maybeSig.get();
    List<Type> argTypes = new ArrayList<>();
    for (int i = 0; i < call.args().size(); i++) {
      Type expected = i < sig.arity() ? sig.paramTypes().get(i) : Type.ANY;
      argTypes.add(expr(call.args().get(i), expected));
    }
    if (call.args().size() != sig.arity()) {
      log.report(
          DiagnosticKind.ARITY_MISMATCH,
          call.id(),
          ImmutableList.of(),
          ImmutableMap.of(
              "callee", sig.name(),
              "expected", String.valueOf(sig.arity()),
              "found", String.valueOf(call.args().size())),
          sig.name(),
          sig.arity(),
          call.args().size());
      return sig.returnType().base();
    }
    Map<String, Expression> args = arguments(sig, call);
    for (int i = 0; i < sig.arity(); i++) {
      Expression arg = call.args().get(i);
      Type param = sig.paramTypes().get(i);
      checkAssignable(arg, argTypes.get(i), param);
      if (param instanceof Type.RefinedType) {
        Type.RefinedType refined = (Type.RefinedType) param;
        Map<String, Expression> subst = new LinkedHashMap<>(args);
        subst.put(refined.var(), arg);
        obligation(
            ObligationKind.REFINEMENT,
            Substitution.apply(refined.predicate(), subst),
            arg.id(),
            "refinement of parameter " + sig.paramNames().get(i) + " of " + sig.name());
      }
    }
    if (sig.requires().isPresent()) {
      obligation(
          ObligationKind.PRECONDITION,
          Substitution.apply(sig.requires().get(), args),
          call.id(),
          "precondition of " + sig.name());
    }
    EffectSet missing = sig.effects().missingFrom(allowed);
    if (!missing.isPure() && !inSpec && reachable) {
      List<Expression> effects = new ArrayList<>();
      for (Effect effect : missing.effects()) {
        effects.add(ident(effect.toString()));
      }
      add(
          ObligationKind.EFFECT,
          call("allows", effects),
          call.id(),
          "effects of " + sig.name(),
          SolverOutcome.counterexample(ImmutableMap.of("missing", missing.toString())));
    }
    Type result = sig.returnType();
    if (result instanceof Type.RefinedType) {
      Type.RefinedType refined = (Type.RefinedType) result;
      Map<String, Expression> subst = new LinkedHashMap<>(args);
      subst.remove(refined.var());
      return Type.refined(
          refined.refinedBase(), refined.var(), Substitution.apply(refined.predicate(), subst));
    }
    return result;
  }

  private static Map<String, Expression> arguments(FnSignature sig, Tree.Call call) {
    Map<String, Expression> args = new LinkedHashMap<>();
    for (int i = 0; i < sig.arity(); i++) {
      args.put(sig.paramNames().get(i), call.args().get(i));
    }
    return args;
  }

  private Type fieldAccess(Tree.FieldAccess access) {
    Type target = expr(access.expr(), Type.ANY).base();
    if (target.kind() == Type.Kind.ERROR || target.kind() == Type.Kind.ANY) {
      return Type.ERROR;
    }
    String recordName = target.toString();
    if (target.kind() == Type.Kind.RECORD) {
      recordName = ((Type.NamedType) target).name();
      Optional<FieldDecl> field = env.field(recordName, access.field());
      if (field.isPresent()) {
        return env.resolve(field.get().type());
      }
    }
    unknownField(recordName, access.field(), access.id());
    return Type.ERROR;
  }

  private void unknownField(String record, String field, NodeId node) {
    Set<String> candidates = new TreeSet<>();
    env.record(record).ifPresent(r -> r.fields().forEach(f -> candidates.add(f.name())));
    log.report(
        DiagnosticKind.UNKNOWN_FIELD,
        node,
        ImmutableList.of(),
        ImmutableMap.of(
            "record", record, "field", field, "candidates", Joiner.on(',').join(candidates)),
        record,
        field);
  }

  private Type recordLit(Tree.RecordLit lit) {
    Optional<Tree.RecordDecl> decl = env.record(lit.typeName());
    if (decl.isEmpty()) {
      for (Tree.FieldInit init : lit.fields()) {
        expr(init.value(), Type.ANY);
      }
      log.report(
          DiagnosticKind.UNKNOWN_TYPE,
          lit.id(),
          ImmutableList.of(),
          ImmutableMap.of(
              "name",
              lit.typeName(),
              "candidates",
              Joiner.on(',').join(ImmutableSortedSet.copyOf(env.typeNames()))),
          lit.typeName());
      return Type.ERROR;
    }
    Map<String, Tree.FieldInit> seen = new LinkedHashMap<>();
    Map<String, Expression> values = new LinkedHashMap<>();
    for (Tree.FieldInit init : lit.fields()) {
      if (!values.containsKey(init.name())) {
        values.put(init.name(), init.value());
      }
    }
    for (Tree.FieldInit init : lit.fields()) {
      Optional<FieldDecl> field = env.field(lit.typeName(), init.name());
      Type expected = field.map(f -> env.resolve(f.type())).orElse(Type.ANY);
      Type valueType = expr(init.value(), expected);
      if (field.isEmpty()) {
        unknownField(lit.typeName(), init.name(), init.id());
        continue;
      }
      Tree.FieldInit previous = seen.putIfAbsent(init.name(), init);
      if (previous != null) {
        log.report(
            DiagnosticKind.DUPLICATE_FIELD,
            init.id(),
            ImmutableList.of(previous.id()),
            ImmutableMap.of("name", init.name(), "record", lit.typeName()),
            init.name());
        continue;
      }
      checkAssignable(init.value(), valueType, expected);
      if (expected instanceof Type.RefinedType) {
        Type.RefinedType refined = (Type.RefinedType) expected;
        Map<String, Expression> subst = new LinkedHashMap<>(values);
        subst.put(refined.var(), init.value());
        obligation(
            ObligationKind.REFINEMENT,
            Substitution.apply(refined.predicate(), subst),
            init.value().id(),
            "refinement of field " + init.name() + " of " + lit.typeName());
      }
    }
    for (FieldDecl field : decl.get().fields()) {
      if (!seen.containsKey(field.name())) {
        log.report(
            DiagnosticKind.MISSING_FIELD,
            lit.id(),
            ImmutableList.of(field.id()),
            ImmutableMap.of("field", field.name(), "record", lit.typeName()),
            field.name(),
            lit.typeName());
      }
    }
    return Type.record(lit.typeName());
  }

  private Type ifExpr(Tree.If ifExpr, Type expected) {
    Type cond = expr(ifExpr.cond(), Type.BOOL);
    checkAssignable(ifExpr.cond(), cond, Type.BOOL);
    boolean entry = reachable;
    // an effectful condition may differ from any later evaluation of the same text
    boolean pure = isPure(ifExpr.cond());
    List<ImmutableList<Fact>> survivors = new ArrayList<>();

    ctx.enterScope(ScopeKind.BRANCH);
    if (pure) {
      ctx.assume(ifExpr.cond(), Provenance.BRANCH_CONDITION, ifExpr.id());
    }
    Type then = block(ifExpr.then(), expected, false);
    boolean thenReachable = reachable;
    ImmutableList<Fact> thenFacts = ctx.exitBranch();
    if (thenReachable) {
      survivors.add(thenFacts);
    }

    reachable = entry;
    ctx.enterScope(ScopeKind.BRANCH);
    if (pure) {
      ctx.assume(negate(ifExpr.cond()), Provenance.BRANCH_CONDITION, ifExpr.id());
    }
    Type orElse = Type.UNIT;
    if (ifExpr.orElse().isPresent()) {
      orElse = block(ifExpr.orElse().get(), expected, false);
    }
    boolean elseReachable = reachable;
    ImmutableList<Fact> elseFacts = ctx.exitBranch();
    if (elseReachable) {
      survivors.add(elseFacts);
    }

    reachable = thenReachable || elseReachable;
    ctx.merge(survivors, survivors.size() < 2, ifExpr.id());
    if (ifExpr.orElse().isEmpty()) {
      return Type.UNIT;
    }
    if (!thenReachable) {
      return orElse;
    }
    return then.base();
  }

  private Type match(Tree.Match match, Type expected) {
    Expression scrutinee = match.scrutinee();
    Type type = expr(scrutinee, Type.ANY).base();
    boolean pure = isPure(scrutinee);
    boolean entry = reachable;
    boolean anyReachable = false;
    boolean catchAll = false;
    Set<String> covered = new LinkedHashSet<>();
    List<Expression> earlier = new ArrayList<>();
    List<ImmutableList<Fact>> survivors = new ArrayList<>();
    Type result = Type.ANY;
    for (Tree.MatchArm arm : match.arms()) {
      reachable = entry;
      ctx.enterScope(ScopeKind.ARM);
      if (pure) {
        for (Expression value : earlier) {
          ctx.assume(ne(scrutinee, value), Provenance.MATCH_PATTERN, arm.id());
        }
      }
      Tree.Pattern pattern = arm.pattern();
      switch (pattern.kind()) {
        case PAT_WILD:
          catchAll = true;
          break;
        case PAT_BIND:
          {
            String name = ((Tree.BindPat) pattern).name();
            catchAll = true;
            ctx.bind(name, type, false, BindingKind.MATCH, pattern.id());
            if (pure && !mentionsAny(scrutinee, name)) {
              ctx.assume(eq(ident(name), scrutinee), Provenance.MATCH_PATTERN, pattern.id());
            }
            break;
          }
        case PAT_LIT:
          {
            Const value = ((Tree.LitPat) pattern).value();
            Type valueType = ExpressionTyper.typeOf(value);
            if (!valueType.isAssignableTo(type)) {
              mismatch(pattern.id(), type, valueType);
            }
            covered.add(value.toString());
            Expression literal = lit(value);
            if (pure) {
              ctx.assume(eq(scrutinee, literal), Provenance.MATCH_PATTERN, pattern.id());
            }
            earlier.add(literal);
            break;
          }
        case PAT_VARIANT:
          {
            String variant = ((Tree.VariantPat) pattern).name();
            Optional<Tree.EnumDecl> decl = env.enumOfVariant(variant);
            if (decl.isEmpty()) {
              unresolved(variant, pattern.id());
            } else if (type.kind() == Type.Kind.ENUM
                && !decl.get().name().equals(((Type.NamedType) type).name())) {
              mismatch(pattern.id(), type, Type.enumType(decl.get().name()));
            }
            covered.add(variant);
            if (pure) {
              ctx.assume(eq(scrutinee, ident(variant)), Provenance.MATCH_PATTERN, pattern.id());
            }
            earlier.add(ident(variant));
            break;
          }
        default:
          throw new AssertionError(pattern.kind());
      }
      Type armType = block(arm.body(), expected, false);
      boolean armReachable = reachable;
      ImmutableList<Fact> facts = ctx.exitBranch();
      if (armReachable) {
        anyReachable = true;
        survivors.add(facts);
        if (result.kind() == Type.Kind.ANY) {
          result = armType.base();
        }
      }
    }
    reachable = anyReachable;
    ctx.merge(survivors, survivors.size() < match.arms().size(), match.id());
    if (!catchAll) {
      List<String> missing = new ArrayList<>();
      if (type.kind() == Type.Kind.BOOL) {
        for (String value : ImmutableList.of("true", "false")) {
          if (!covered.contains(value)) {
            missing.add(value);
          }
        }
      } else if (type.kind() == Type.Kind.ENUM) {
        env.enumDecl(((Type.NamedType) type).name())
            .ifPresent(
                decl -> {
                  for (String variant : decl.variants()) {
                    if (!covered.contains(variant)) {
                      missing.add(variant);
                    }
                  }
                });
      } else if (type.kind() != Type.Kind.ERROR) {
        missing.add("_");
      }
      if (!missing.isEmpty()) {
        String text = Joiner.on(", ").join(missing);
        log.report(
            DiagnosticKind.NON_EXHAUSTIVE_MATCH,
            match.id(),
            ImmutableList.of(),
            ImmutableMap.of("missing", text, "type", type.toString()),
            text);
      }
    }
    return result;
  }

  // checks and helpers

  private void checkAssignable(Expression value, Type found, Type expected) {
    if (!found.isAssignableTo(expected)) {
      mismatch(value.id(), expected, found);
    }
  }

  private void mismatch(NodeId node, Type expected, Type found) {
    if (inSpec) {
      return;
    }
    log.report(
        DiagnosticKind.TYPE_MISMATCH,
        node,
        ImmutableList.of(),
        ImmutableMap.of("expected", expected.base().toString(), "found", found.base().toString()),
        expected.base(),
        found.base());
  }

  private static Expression instantiate(Type.RefinedType type, Expression value) {
    return Substitution.apply(type.predicate(), type.var(), value);
  }

  /** The negation of a condition, pushed through comparisons and double negation. */
  static Expression negate(Expression cond) {
    if (cond.kind() == Tree.Kind.BINARY && ((Tree.Binary) cond).op().isComparison()) {
      Tree.Binary binary = (Tree.Binary) cond;
      return Trees.binary(binary.op().negate(), binary.lhs(), binary.rhs());
    }
    if (cond.kind() == Tree.Kind.UNARY && ((Tree.Unary) cond).op() == OperatorKind.NOT) {
      return ((Tree.Unary) cond).expr();
    }
    return not(cond);
  }

  private static boolean mentionsAny(Expression e, String name) {
    return FreeNames.mentions(e, name);
  }

  /**
   * Whether an expression denotes a value that can appear in a fact: it has no effects and no
   * control flow.
   */
  private boolean isPure(Tree tree) {
    switch (tree.kind()) {
      case CALL:
        {
          Optional<FnSignature> sig = env.function(((Tree.Call) tree).callee());
          if (sig.isEmpty() || !sig.get().isPure()) {
            return false;
          }
          break;
        }
      case HOLE:
      case FAIL:
      case BLOCK:
      case IF:
      case MATCH:
      case RECORD_LIT:
      case LIST_LIT:
        return false;
      default:
        break;
    }
    for (Children.Child child : Children.of(tree)) {
      if (!isPure(child.tree())) {
        return false;
      }
    }
    return true;
  }

  private static ImmutableSet<String> assignedIn(Tree tree) {
    ImmutableSet.Builder<String> result = ImmutableSet.builder();
    collectAssigned(tree, result);
    return result.build();
  }

  private static void collectAssigned(Tree tree, ImmutableSet.Builder<String> result) {
    if (tree.kind() == Tree.Kind.ASSIGN) {
      result.add(((Tree.Assign) tree).name());
    }
    for (Children.Child child : Children.of(tree)) {
      collectAssigned(child.tree(), result);
    }
  }

  // obligations

  private void obligation(ObligationKind kind, Expression goal, NodeId node, String origin) {
    if (inSpec || !reachable) {
      return;
    }
    add(kind, goal, node, origin, null);
  }

  private void add(
      ObligationKind kind,
      Expression goal,
      NodeId node,
      String origin,
      @Nullable SolverOutcome outcome) {
    String base = "ob-" + kind + "-" + node;
    String id = base;
    for (int k = 2; !obligationIds.add(id); k++) {
      id = base + "-" + k;
    }
    Expression detached = Trees.detach(goal);
    obligations.add(
        new Obligation(
            id,
            kind,
            detached,
            node,
            snapshot(detached, node),
            origin,
            outcome,
            ImmutableList.of()));
  }

  /**
   * Freezes the context for a goal. Refinements of the fields and pure calls that occur in the
   * goal or the facts are added as facts here, since they hold wherever the term is defined.
   */
  private ContextSnapshot snapshot(Expression goal, NodeId node) {
    ImmutableList<Fact> visible = ctx.visibleFacts();
    Set<String> texts = new HashSet<>();
    ImmutableList.Builder<Fact> facts = ImmutableList.builder();
    for (Fact fact : visible) {
      texts.add(fact.text());
      facts.add(fact);
    }
    Map<String, Type> termTypes = new LinkedHashMap<>();
    List<Fact> derived = new ArrayList<>();
    List<Expression> roots = new ArrayList<>();
    roots.add(goal);
    for (Fact fact : visible) {
      roots.add(fact.prop());
    }
    for (Expression root : roots) {
      terms(root, termTypes, derived, texts, node);
    }
    facts.addAll(derived);
    return new ContextSnapshot(
        ctx.visibleBindings(), facts.build(), ImmutableMap.copyOf(termTypes));
  }

  private void terms(
      Tree tree, Map<String, Type> termTypes, List<Fact> derived, Set<String> texts, NodeId node) {
    switch (tree.kind()) {
      case FIELD_ACCESS:
        {
          Tree.FieldAccess access = (Tree.FieldAccess) tree;
          String key = Pretty.pretty(access);
          Type record = typer.typeOf(access.expr());
          if (record.kind() == Type.Kind.RECORD) {
            Optional<FieldDecl> field =
                env.field(((Type.NamedType) record).name(), access.field());
            if (field.isPresent()) {
              Type type = env.resolve(field.get().type());
              termTypes.putIfAbsent(key, type.base());
              if (type instanceof Type.RefinedType) {
                Type.RefinedType refined = (Type.RefinedType) type;
                Map<String, Expression> subst = new LinkedHashMap<>();
                String recordName = ((Type.NamedType) record).name();
                for (FieldDecl sibling : env.record(recordName).get().fields()) {
                  subst.putIfAbsent(sibling.name(), Trees.field(access.expr(), sibling.name()));
                }
                subst.put(refined.var(), access);
                derive(
                    Substitution.apply(refined.predicate(), subst),
                    Provenance.FIELD_REFINEMENT,
                    node,
                    derived,
                    texts);
              }
            }
          }
          break;
        }
      case CALL:
        {
          Tree.Call call = (Tree.Call) tree;
          termTypes.putIfAbsent(Pretty.pretty(call), typer.typeOf(call));
          Optional<FnSignature> sig = env.function(call.callee());
          if (sig.isPresent()
              && sig.get().isPure()
              && sig.get().arity() == call.args().size()
              && sig.get().returnType() instanceof Type.RefinedType) {
            Type.RefinedType refined = (Type.RefinedType) sig.get().returnType();
            Map<String, Expression> subst = arguments(sig.get(), call);
            subst.put(refined.var(), call);
            derive(
                Substitution.apply(refined.predicate(), subst),
                Provenance.POSTCONDITION_OF_CALLEE,
                node,
                derived,
                texts);
          }
          break;
        }
      case INDEX:
        termTypes.putIfAbsent(Pretty.pretty(tree), typer.typeOf((Expression) tree));
        break;
      case IDENT:
        {
          String name = ((Tree.Ident) tree).name();
          if (ctx.lookup(name).isEmpty()) {
            env.enumOfVariant(name)
                .ifPresent(decl -> termTypes.putIfAbsent(name, Type.enumType(decl.name())));
          }
          break;
        }
      default:
        break;
    }
    for (Children.Child child : Children.of(tree)) {
      terms(child.tree(), termTypes, derived, texts, node);
    }
  }

  private static void derive(
      Expression prop, Provenance provenance, NodeId node, List<Fact> derived, Set<String> texts) {
    Fact fact = Fact.create(prop, provenance, node);
    if (texts.add(fact.text())) {
      derived.add(fact);
    }
  }
}
