package org.obligato.logic;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.obligato.binder.Binding;
import org.obligato.binder.ContextSnapshot;
import org.obligato.model.Const;
import org.obligato.tree.OperatorKind;
import org.obligato.tree.Pretty;
import org.obligato.tree.Tree;
import org.obligato.tree.Tree.Expression;
import org.obligato.type.Type;

/**
 * Translates predicate-language expressions into {@link Formula}s over {@link LinearTerm}s.
 *
 * <p>Calls, field accesses and element accesses become uninterpreted variables named by their
 * canonical text; products of two non-constant terms, integer division and remainder become
 * fresh nonlinear variables. One translator is used for one goal and its facts, so that equal
 * terms map to the same variable.
 */
public final class Translator {

  /** The spacing between the codes of distinct symbol literals. */
  static final long SYMBOL_SPACING = 1000;

  /** An uninterpreted application, kept to check that a model respects congruence. */
  public static final class Application {
    private final String function;
    private final ImmutableList<LinearTerm> args;

    Application(String function, ImmutableList<LinearTerm> args) {
      this.function = function;
      this.args = args;
    }

    public String function() {
      return function;
    }

    public ImmutableList<LinearTerm> args() {
      return args;
    }
  }

  private final ContextSnapshot context;
  private final Map<String, Binding> bindings = new HashMap<>();
  private final Map<String, Var> vars = new LinkedHashMap<>();
  private final Map<String, Long> symbols = new LinkedHashMap<>();
  private final Map<Var, Application> applications = new LinkedHashMap<>();

  public Translator(ContextSnapshot context) {
    this.context = context;
    for (Binding binding : context.bindings()) {
      bindings.put(binding.name(), binding);
    }
  }

  /** The applications seen so far, by the variable standing for them. */
  public ImmutableMap<Var, Application> applications() {
    return ImmutableMap.copyOf(applications);
  }

  /**
   * Axioms about the given variables: booleans are 0 or 1, lengths are non-negative, symbols are
   * integers.
   */
  public ImmutableList<Formula> axioms(Iterable<Var> of) {
    ImmutableList.Builder<Formula> result = ImmutableList.builder();
    for (Var var : of) {
      if (var.sort() == Sort.BOOL) {
        result.add(nonNegative(LinearTerm.var(var)));
        result.add(nonNegative(LinearTerm.constant(1).minus(LinearTerm.var(var))));
      }
      Application app = applications.get(var);
      if (app != null && app.function().equals("len")) {
        result.add(nonNegative(LinearTerm.var(var)));
      }
    }
    return result.build();
  }

  private static Formula nonNegative(LinearTerm term) {
    return Formula.atom(Constraint.of(term.negate(), Constraint.Relation.LE));
  }

  /** Renders a model value of {@code var} in the program's terms. */
  public String render(Var var, Rational value) {
    switch (var.sort()) {
      case BOOL:
        return value.isZero() ? "false" : "true";
      case SYMBOL:
        for (Map.Entry<String, Long> e : symbols.entrySet()) {
          if (value.equals(Rational.of(e.getValue()))) {
            return e.getKey();
          }
        }
        return "<other>";
      case REAL:
      case INT:
        return value.render();
    }
    throw new AssertionError(var.sort());
  }

  public Formula formula(Expression e) {
    switch (e.kind()) {
      case LITERAL:
        {
          Const value = ((Tree.Literal) e).value();
          if (value.kind() != Const.Kind.BOOL) {
            throw unsupported(e);
          }
          return Formula.of(((Const.BoolValue) value).value());
        }
      case IDENT:
      case CALL:
      case FIELD_ACCESS:
      case INDEX:
        if (sortOf(e) != Sort.BOOL) {
          throw unsupported(e);
        }
        return Formula.atom(
            Constraint.of(term(e).minus(LinearTerm.constant(1)), Constraint.Relation.EQ));
      case UNARY:
        {
          Tree.Unary unary = (Tree.Unary) e;
          if (unary.op() != OperatorKind.NOT) {
            throw unsupported(e);
          }
          return Formula.not(formula(unary.expr()));
        }
      case BINARY:
        return binary((Tree.Binary) e);
      case QUANTIFIED:
        throw new Untranslatable(Untranslatable.Reason.QUANTIFIED, Pretty.pretty(e));
      default:
        throw unsupported(e);
    }
  }

  private Formula binary(Tree.Binary binary) {
    Expression lhs = binary.lhs();
    Expression rhs = binary.rhs();
    switch (binary.op()) {
      case AND:
        return Formula.and(formula(lhs), formula(rhs));
      case OR:
        return Formula.or(formula(lhs), formula(rhs));
      case IMPLIES:
        return Formula.or(Formula.not(formula(lhs)), formula(rhs));
      case EQUAL:
      case NOT_EQUAL:
        {
          Formula eq;
          if (sortOf(lhs) == Sort.BOOL || sortOf(rhs) == Sort.BOOL) {
            Formula a = formula(lhs);
            Formula b = formula(rhs);
            eq = Formula.or(Formula.and(a, b), Formula.and(Formula.not(a), Formula.not(b)));
          } else {
            eq = Formula.atom(Constraint.of(term(lhs).minus(term(rhs)), Constraint.Relation.EQ));
          }
          return binary.op() == OperatorKind.EQUAL ? eq : Formula.not(eq);
        }
      case LESS_THAN:
        return compare(lhs, rhs, Constraint.Relation.LT);
      case LESS_THAN_EQ:
        return compare(lhs, rhs, Constraint.Relation.LE);
      case GREATER_THAN:
        return compare(rhs, lhs, Constraint.Relation.LT);
      case GREATER_THAN_EQ:
        return compare(rhs, lhs, Constraint.Relation.LE);
      default:
        throw unsupported(binary);
    }
  }

  private Formula compare(Expression small, Expression large, Constraint.Relation relation) {
    if (sortOf(small) == Sort.SYMBOL || sortOf(large) == Sort.SYMBOL) {
      throw unsupported(small);
    }
    return Formula.atom(Constraint.of(term(small).minus(term(large)), relation));
  }

  /** Translates a numeric or symbolic expression. */
  public LinearTerm term(Expression e) {
    switch (e.kind()) {
      case LITERAL:
        return literal(((Tree.Literal) e).value());
      case IDENT:
        {
          String name = ((Tree.Ident) e).name();
          Binding binding = bindings.get(name);
          if (binding != null) {
            return LinearTerm.var(var(name, sortOf(binding.type()), Var.Origin.BINDING));
          }
          if (context.termTypes().containsKey(name)) {
            return symbol(name);
          }
          throw new Untranslatable(Untranslatable.Reason.UNSUPPORTED, "unbound name " + name);
        }
      case UNARY:
        {
          Tree.Unary unary = (Tree.Unary) e;
          if (unary.op() != OperatorKind.NEG) {
            throw unsupported(e);
          }
          return term(unary.expr()).negate();
        }
      case BINARY:
        return arithmetic((Tree.Binary) e);
      case CALL:
      case FIELD_ACCESS:
      case INDEX:
        return application(e);
      default:
        throw unsupported(e);
    }
  }

  private LinearTerm arithmetic(Tree.Binary binary) {
    switch (binary.op()) {
      case PLUS:
        return term(binary.lhs()).plus(term(binary.rhs()));
      case MINUS:
        return term(binary.lhs()).minus(term(binary.rhs()));
      case MULT:
        {
          LinearTerm lhs = term(binary.lhs());
          LinearTerm rhs = term(binary.rhs());
          if (lhs.isConstant()) {
            return rhs.times(lhs.constant());
          }
          if (rhs.isConstant()) {
            return lhs.times(rhs.constant());
          }
          return nonlinear(binary);
        }
      case DIVIDE:
        {
          LinearTerm rhs = term(binary.rhs());
          if (sortOf(binary) == Sort.REAL && rhs.isConstant() && !rhs.constant().isZero()) {
            return term(binary.lhs()).times(Rational.ONE.divide(rhs.constant()));
          }
          return nonlinear(binary);
        }
      case MODULO:
        return nonlinear(binary);
      default:
        throw unsupported(binary);
    }
  }

  private LinearTerm nonlinear(Expression e) {
    return LinearTerm.var(var(Pretty.pretty(e), sortOf(e), Var.Origin.NONLINEAR));
  }

  private LinearTerm application(Expression e) {
    Var var = var(Pretty.pretty(e), sortOf(e), Var.Origin.ATOM);
    if (!applications.containsKey(var)) {
      ImmutableList.Builder<LinearTerm> args = ImmutableList.builder();
      String function;
      switch (e.kind()) {
        case CALL:
          {
            Tree.Call call = (Tree.Call) e;
            function = call.callee();
            for (Expression arg : call.args()) {
              args.add(term(arg));
            }
            break;
          }
        case FIELD_ACCESS:
          {
            Tree.FieldAccess access = (Tree.FieldAccess) e;
            function = "." + access.field();
            args.add(term(access.expr()));
            break;
          }
        default:
          {
            Tree.Index index = (Tree.Index) e;
            function = "[]";
            args.add(term(index.expr()));
            args.add(term(index.index()));
            break;
          }
      }
      applications.put(var, new Application(function, args.build()));
    }
    return LinearTerm.var(var);
  }

  private LinearTerm literal(Const value) {
    switch (value.kind()) {
      case INT:
        return LinearTerm.constant(Rational.of(((Const.IntValue) value).value()));
      case REAL:
        return LinearTerm.constant(Rational.of(((Const.RealValue) value).value()));
      case BOOL:
        return LinearTerm.constant(((Const.BoolValue) value).value() ? 1 : 0);
      case STRING:
      case UNIT:
        return symbol(value.toString());
    }
    throw new AssertionError(value.kind());
  }

  private LinearTerm symbol(String text) {
    Long code = symbols.get(text);
    if (code == null) {
      code = SYMBOL_SPACING * (symbols.size() + 1);
      symbols.put(text, code);
    }
    return LinearTerm.constant(code);
  }

  private Var var(String name, Sort sort, Var.Origin origin) {
    Var var = vars.get(name);
    if (var == null) {
      var = new Var(name, sort, origin);
      vars.put(name, var);
    }
    return var;
  }

  /** The sort of an expression, from the bindings and term types of the context. */
  public Sort sortOf(Expression e) {
    switch (e.kind()) {
      case LITERAL:
        switch (((Tree.Literal) e).value().kind()) {
          case INT:
            return Sort.INT;
          case REAL:
            return Sort.REAL;
          case BOOL:
            return Sort.BOOL;
          default:
            return Sort.SYMBOL;
        }
      case IDENT:
        {
          String name = ((Tree.Ident) e).name();
          Binding binding = bindings.get(name);
          if (binding != null) {
            return sortOf(binding.type());
          }
          Type type = context.termTypes().get(name);
          if (type != null) {
            return sortOf(type);
          }
          throw new Untranslatable(Untranslatable.Reason.UNSUPPORTED, "unbound name " + name);
        }
      case UNARY:
        {
          Tree.Unary unary = (Tree.Unary) e;
          return unary.op() == OperatorKind.NOT
              ? Sort.BOOL
              : sortOf(unary.expr());
        }
      case BINARY:
        {
          Tree.Binary binary = (Tree.Binary) e;
          if (!binary.op().isArithmetic()) {
            return Sort.BOOL;
          }
          return sortOf(binary.lhs()) == Sort.REAL || sortOf(binary.rhs()) == Sort.REAL
              ? Sort.REAL
              : Sort.INT;
        }
      case CALL:
      case FIELD_ACCESS:
      case INDEX:
        {
          Type type = context.termTypes().get(Pretty.pretty(e));
          if (type == null) {
            throw new Untranslatable(
                Untranslatable.Reason.UNSUPPORTED, "untyped term " + Pretty.pretty(e));
          }
          return sortOf(type);
        }
      case QUANTIFIED:
        return Sort.BOOL;
      default:
        throw unsupported(e);
    }
  }

  private static Sort sortOf(Type type) {
    switch (type.base().kind()) {
      case INT:
        return Sort.INT;
      case REAL:
        return Sort.REAL;
      case BOOL:
        return Sort.BOOL;
      case ERROR:
      case ANY:
        throw new Untranslatable(Untranslatable.Reason.UNSUPPORTED, "untyped value");
      default:
        return Sort.SYMBOL;
    }
  }

  private static Untranslatable unsupported(Expression e) {
    return new Untranslatable(
        Untranslatable.Reason.UNSUPPORTED, "outside the linear fragment: " + Pretty.pretty(e));
  }
}
