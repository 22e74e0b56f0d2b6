package org.obligato.binder;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.obligato.model.EffectSet;
import org.obligato.tree.Tree.Expression;
import org.obligato.tree.Tree.FnDecl;
import org.obligato.type.Type;

/** The resolved signature of a user or built-in function. */
@AutoValue
public abstract class FnSignature {

  public abstract String name();

  public abstract ImmutableList<String> paramNames();

  public abstract ImmutableList<Type> paramTypes();

  public abstract Type returnType();

  public abstract EffectSet effects();

  public abstract Optional<Expression> requires();

  public abstract Optional<Expression> ensures();

  public abstract FnDecl declaration();

  public abstract boolean builtin();

  public int arity() {
    return paramNames().size();
  }

  public boolean isPure() {
    return effects().isPure();
  }

  static FnSignature create(
      FnDecl declaration,
      ImmutableList<Type> paramTypes,
      Type returnType,
      boolean builtin) {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    declaration.params().forEach(p -> names.add(p.name()));
    return new AutoValue_FnSignature(
        declaration.name(),
        names.build(),
        paramTypes,
        returnType,
        EffectSet.copyOf(declaration.effects()),
        declaration.requires(),
        declaration.ensures(),
        declaration,
        builtin);
  }
}
