package org.obligato.tree;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import org.obligato.tree.Tree.Expression;

/** Computes the names an expression refers to that are not bound by one of its quantifiers. */
public final class FreeNames {

  /** The free names of {@code tree}, in order of first occurrence. */
  public static ImmutableSet<String> of(Tree tree) {
    ImmutableSet.Builder<String> result = ImmutableSet.builder();
    scan(tree, new ArrayDeque<>(), result);
    return result.build();
  }

  public static boolean mentions(Expression expression, String name) {
    return of(expression).contains(name);
  }

  private static void scan(Tree tree, Deque<String> bound, ImmutableSet.Builder<String> result) {
    switch (tree.kind()) {
      case IDENT:
        String name = ((Tree.Ident) tree).name();
        if (!bound.contains(name)) {
          result.add(name);
        }
        return;
      case QUANTIFIED:
        Tree.Quantified q = (Tree.Quantified) tree;
        scan(q.domain(), bound, result);
        bound.push(q.var());
        scan(q.body(), bound, result);
        bound.pop();
        return;
      default:
        for (Children.Child child : Children.of(tree)) {
          scan(child.tree(), bound, result);
        }
    }
  }

  private FreeNames() {}
}
