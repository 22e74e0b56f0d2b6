package org.obligato.binder;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;
import org.obligato.tree.NodeId;
import org.obligato.type.Type;

/**
 * A local variable. Shadowing creates a new binding with a new serial number in a nested scope;
 * the outer binding survives.
 */
@AutoValue
@Immutable
public abstract class Binding {

  public abstract String name();

  public abstract Type type();

  public abstract boolean mutable();

  public abstract BindingKind kind();

  /** The declaring node: a parameter, {@code let}, {@code for} or pattern. */
  public abstract NodeId declaration();

  /** Distinguishes bindings of the same name within one pass. */
  public abstract int serial();

  static Binding create(
      String name, Type type, boolean mutable, BindingKind kind, NodeId declaration, int serial) {
    return new AutoValue_Binding(name, type, mutable, kind, declaration, serial);
  }

  @Override
  public final String toString() {
    return (mutable() ? "mut " : "") + name() + ": " + type();
  }
}
