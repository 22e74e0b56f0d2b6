package org.obligato.tree;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import org.obligato.tree.Tree.Expression;
import org.obligato.tree.Tree.Ident;
import org.obligato.tree.Tree.Quantified;

/**
 * Replaces free identifiers of an expression, e.g. {@code P[arg/param]}. The result is always a
 * detached tree, so it can be used as a goal or spliced into a patch without duplicating ids.
 */
public final class Substitution extends TreeCopier {

  public static Expression apply(Expression expression, Map<String, Expression> replacements) {
    return (Expression) new Substitution(ImmutableMap.copyOf(replacements)).copy(expression);
  }

  public static Expression apply(Expression expression, String name, Expression replacement) {
    return apply(expression, ImmutableMap.of(name, replacement));
  }

  private final ImmutableMap<String, Expression> replacements;
  private final Deque<String> bound = new ArrayDeque<>();

  private Substitution(ImmutableMap<String, Expression> replacements) {
    this.replacements = replacements;
  }

  @Override
  protected NodeId enter(Tree tree, Slot slot) {
    return NodeId.UNASSIGNED;
  }

  @Override
  public Tree visitIdent(Ident ident, Slot slot) {
    Expression replacement = replacements.get(ident.name());
    if (replacement != null && !bound.contains(ident.name())) {
      return Trees.detach(replacement);
    }
    return super.visitIdent(ident, slot);
  }

  @Override
  public Tree visitQuantified(Quantified quantified, Slot slot) {
    bound.push(quantified.var());
    try {
      return super.visitQuantified(quantified, slot);
    } finally {
      bound.pop();
    }
  }
}
