package org.obligato.type;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Optional;
import org.obligato.diag.DiagnosticKind;
import org.obligato.diag.DiagnosticLog;
import org.obligato.tree.Tree;
import org.obligato.tree.Tree.NamedTy;
import org.obligato.tree.Tree.RefinedTy;
import org.obligato.tree.Tree.Ty;

/** Resolves type uses to semantic {@link Type}s. */
public final class TypeResolver {

  /** Looks up user-declared and opaque type names. */
  public interface TypeScope {
    Optional<Type> lookupType(String name);
  }

  private final TypeScope scope;
  private final DiagnosticLog log;

  public TypeResolver(TypeScope scope, DiagnosticLog log) {
    this.scope = scope;
    this.log = log;
  }

  public Type resolve(Ty ty) {
    switch (ty.kind()) {
      case NAMED_TY:
        return resolveNamed((NamedTy) ty);
      case REFINED_TY:
        RefinedTy refined = (RefinedTy) ty;
        return Type.refined(resolve(refined.base()), refined.var(), refined.predicate());
      default:
        throw new AssertionError(ty.kind());
    }
  }

  private Type resolveNamed(NamedTy ty) {
    ImmutableList<Tree.Ty> args = ty.args();
    switch (ty.name()) {
      case "Int":
        return Type.INT;
      case "Real":
        return Type.REAL;
      case "Bool":
        return Type.BOOL;
      case "String":
        return Type.STRING;
      case "Unit":
        return Type.UNIT;
      case "List":
        return Type.list(args.isEmpty() ? Type.ANY : resolve(args.get(0)));
      case "Linear":
        return Type.linear(args.isEmpty() ? Type.ANY : resolve(args.get(0)));
      default:
        Optional<Type> declared = scope.lookupType(ty.name());
        if (declared.isPresent()) {
          return declared.get();
        }
        if (ty.id().isAssigned()) {
          log.report(
              DiagnosticKind.UNKNOWN_TYPE,
              ty.id(),
              ImmutableList.of(),
              ImmutableMap.of("name", ty.name()),
              ty.name());
        }
        return Type.ERROR;
    }
  }
}
