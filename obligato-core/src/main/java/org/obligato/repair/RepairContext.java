package org.obligato.repair;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.obligato.binder.GlobalEnv;
import org.obligato.diag.Diagnostic;
import org.obligato.extract.Obligation;
import org.obligato.model.Const;
import org.obligato.options.EngineOptions;
import org.obligato.tree.Ast;
import org.obligato.tree.Children;
import org.obligato.tree.NodeId;
import org.obligato.tree.Tree;
import org.obligato.tree.Tree.Expression;
import org.obligato.tree.Tree.Ty;
import org.obligato.tree.Trees;
import org.obligato.type.Type;

/** What the repair templates of one pass can see. Read-only, and shared by concurrent tasks. */
final class RepairContext {

  final Ast ast;
  final GlobalEnv env;
  final EngineOptions options;
  final ImmutableList<Obligation> obligations;

  RepairContext(
      Ast ast, GlobalEnv env, EngineOptions options, ImmutableList<Obligation> obligations) {
    this.ast = ast;
    this.env = env;
    this.options = options;
    this.obligations = obligations;
  }

  /** Starts a candidate for a diagnostic; the id is assigned once all candidates are known. */
  RepairCandidate.Builder forDiagnostic(Diagnostic diagnostic, String template) {
    return RepairCandidate.builder()
        .setTemplate(template)
        .setTargets(
            Targets.builder()
                .setNodeIds(ImmutableList.of(diagnostic.primaryNode()))
                .setDiagnosticIds(ImmutableList.of(diagnostic.id()))
                .setDiagnosticCodes(ImmutableList.of(diagnostic.code()))
                .build())
        .setExpectedDelta(
            ExpectedDelta.create(
                ImmutableList.of(diagnostic.id()), ImmutableList.of(), ImmutableList.of()));
  }

  RepairCandidate.Builder forObligation(Obligation obligation, String template) {
    return RepairCandidate.builder()
        .setTemplate(template)
        .setTargets(
            Targets.builder()
                .setNodeIds(ImmutableList.of(obligation.primaryNode()))
                .setObligationIds(ImmutableList.of(obligation.id()))
                .build())
        .setExpectedDelta(
            ExpectedDelta.create(
                ImmutableList.of(), ImmutableList.of(obligation.id()), ImmutableList.of()));
  }

  /** The size of a set of edits: one per op plus the nodes it brings in. */
  static RepairScope scope(List<PatchOp> edits, boolean crossesFunction) {
    int count = 0;
    for (PatchOp op : edits) {
      count += 1 + op.payload().map(RepairContext::size).orElse(0);
    }
    return RepairScope.create(count, crossesFunction);
  }

  static int size(Tree tree) {
    int result = 1;
    for (Children.Child child : Children.of(tree)) {
      result += size(child.tree());
    }
    return result;
  }

  /** A placeholder value of the given type, if the type has an obvious one. */
  static Optional<Expression> defaultValue(Type type) {
    switch (type.base().kind()) {
      case INT:
        return Optional.of(Trees.lit(0));
      case REAL:
        return Optional.of(Trees.lit(new Const.RealValue(BigDecimal.ZERO)));
      case BOOL:
        return Optional.of(Trees.lit(false));
      case STRING:
        return Optional.of(Trees.str(""));
      case UNIT:
        return Optional.of(Trees.unitLit());
      case LIST:
        return Optional.of(Trees.list());
      default:
        return Optional.empty();
    }
  }

  /** A placeholder value for a declared type, read off the syntax. */
  static Optional<Expression> defaultValue(Ty ty) {
    if (ty.kind() == Tree.Kind.REFINED_TY) {
      return defaultValue(((Tree.RefinedTy) ty).base());
    }
    switch (((Tree.NamedTy) ty).name()) {
      case "Int":
        return defaultValue(Type.INT);
      case "Real":
        return defaultValue(Type.REAL);
      case "Bool":
        return defaultValue(Type.BOOL);
      case "String":
        return defaultValue(Type.STRING);
      case "Unit":
        return defaultValue(Type.UNIT);
      case "List":
        return Optional.of(Trees.list());
      default:
        return Optional.empty();
    }
  }

  /** The source form of a semantic type, for types that have one. */
  static Optional<Ty> ty(Type type) {
    Type base = type.base();
    switch (base.kind()) {
      case INT:
        return Optional.of(Trees.intTy());
      case REAL:
        return Optional.of(Trees.realTy());
      case BOOL:
        return Optional.of(Trees.boolTy());
      case STRING:
        return Optional.of(Trees.stringTy());
      case UNIT:
        return Optional.of(Trees.unitTy());
      case LIST:
        return ty(((Type.ElemType) base).elem()).map(Trees::listTy);
      case RECORD:
      case ENUM:
      case OPAQUE:
        return Optional.of(Trees.ty(((Type.NamedType) base).name()));
      default:
        return Optional.empty();
    }
  }

  /** The type of a literal; other expressions are not typed here. */
  static Optional<Type> literalType(Expression e) {
    if (e.kind() != Tree.Kind.LITERAL) {
      return Optional.empty();
    }
    switch (((Tree.Literal) e).value().kind()) {
      case INT:
        return Optional.of(Type.INT);
      case REAL:
        return Optional.of(Type.REAL);
      case BOOL:
        return Optional.of(Type.BOOL);
      case STRING:
        return Optional.of(Type.STRING);
      default:
        return Optional.empty();
    }
  }

  Optional<Tree.FnDecl> enclosingFn(NodeId node) {
    return ast.enclosingFn(node);
  }
}
