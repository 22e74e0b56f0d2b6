package org.obligato.binder;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;
import org.obligato.tree.NodeId;
import org.obligato.tree.Pretty;
import org.obligato.tree.Tree.Expression;

/** A proposition known to hold at some program point. */
@AutoValue
@Immutable
public abstract class Fact {

  /** The proposition, as a detached tree. */
  public abstract Expression prop();

  /** The canonical text of {@link #prop}; facts are compared by it. */
  public abstract String text();

  public abstract Provenance provenance();

  /** The node that established the fact. */
  public abstract NodeId origin();

  public static Fact create(Expression prop, Provenance provenance, NodeId origin) {
    return new AutoValue_Fact(prop, Pretty.pretty(prop), provenance, origin);
  }

  @Override
  public final String toString() {
    return text() + " [" + provenance() + "]";
  }
}
