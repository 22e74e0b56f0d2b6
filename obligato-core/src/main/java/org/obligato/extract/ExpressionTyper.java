package org.obligato.extract;

import java.util.Optional;
import org.obligato.binder.Binding;
import org.obligato.binder.FactContext;
import org.obligato.binder.FnSignature;
import org.obligato.binder.GlobalEnv;
import org.obligato.model.Const;
import org.obligato.tree.OperatorKind;
import org.obligato.tree.Tree;
import org.obligato.tree.Tree.Expression;
import org.obligato.tree.Tree.FieldDecl;
import org.obligato.type.Type;

/**
 * Computes base types of expressions in the current context, without reporting anything. Used
 * for goal and fact terms, which are detached and have already been checked at their source.
 */
final class ExpressionTyper {

  static Type typeOf(Const value) {
    switch (value.kind()) {
      case INT:
        return Type.INT;
      case REAL:
        return Type.REAL;
      case BOOL:
        return Type.BOOL;
      case STRING:
        return Type.STRING;
      case UNIT:
        return Type.UNIT;
    }
    throw new AssertionError(value.kind());
  }

  /** The type of an arithmetic expression over the given operand types. */
  static Type numericJoin(Type a, Type b) {
    return a.base().kind() == Type.Kind.REAL || b.base().kind() == Type.Kind.REAL
        ? Type.REAL
        : Type.INT;
  }

  private final GlobalEnv env;
  private final FactContext ctx;

  ExpressionTyper(GlobalEnv env, FactContext ctx) {
    this.env = env;
    this.ctx = ctx;
  }

  Type typeOf(Expression e) {
    switch (e.kind()) {
      case LITERAL:
        return typeOf(((Tree.Literal) e).value());
      case IDENT:
        {
          String name = ((Tree.Ident) e).name();
          Optional<Binding> binding = ctx.lookup(name);
          if (binding.isPresent()) {
            return binding.get().type().base();
          }
          return env.enumOfVariant(name)
              .map(decl -> Type.enumType(decl.name()))
              .orElse(Type.ERROR);
        }
      case UNARY:
        {
          Tree.Unary unary = (Tree.Unary) e;
          return unary.op() == OperatorKind.NOT ? Type.BOOL : typeOf(unary.expr()).base();
        }
      case BINARY:
        {
          Tree.Binary binary = (Tree.Binary) e;
          if (binary.op().isArithmetic()) {
            return numericJoin(typeOf(binary.lhs()), typeOf(binary.rhs()));
          }
          return Type.BOOL;
        }
      case CALL:
        return env.function(((Tree.Call) e).callee())
            .map(FnSignature::returnType)
            .map(Type::base)
            .orElse(Type.ERROR);
      case FIELD_ACCESS:
        {
          Tree.FieldAccess access = (Tree.FieldAccess) e;
          Type record = typeOf(access.expr()).base();
          if (record.kind() != Type.Kind.RECORD) {
            return Type.ERROR;
          }
          Optional<FieldDecl> field =
              env.field(((Type.NamedType) record).name(), access.field());
          return field.map(f -> env.resolve(f.type()).base()).orElse(Type.ERROR);
        }
      case INDEX:
        {
          Type list = typeOf(((Tree.Index) e).expr()).base();
          return list.kind() == Type.Kind.LIST ? ((Type.ElemType) list).elem().base() : Type.ERROR;
        }
      case RECORD_LIT:
        return env.record(((Tree.RecordLit) e).typeName())
            .map(r -> Type.record(r.name()))
            .orElse(Type.ERROR);
      case LIST_LIT:
        {
          Tree.ListLit list = (Tree.ListLit) e;
          return Type.list(list.elems().isEmpty() ? Type.ANY : typeOf(list.elems().get(0)));
        }
      case RANGE:
        return Type.list(Type.INT);
      case QUANTIFIED:
        return Type.BOOL;
      default:
        return Type.ANY;
    }
  }
}
