package org.obligato.tree;

import java.util.HashSet;
import java.util.Set;
import org.obligato.tree.Tree.CompUnit;

/**
 * Gives an id to every node that lacks one, deriving it from the parent's id and the node's slot.
 * Existing ids are preserved. A derived id that is already taken gets a collision counter, which
 * is scoped to one assignment run so that the same input always yields the same ids.
 */
final class IdAssigner extends TreeCopier {

  static CompUnit assign(CompUnit unit, String seed) {
    Set<NodeId> used = new HashSet<>();
    collect(unit, used);
    return (CompUnit) new IdAssigner(seed, used).copy(unit);
  }

  private static void collect(Tree tree, Set<NodeId> used) {
    if (tree.id().isAssigned()) {
      used.add(tree.id());
    }
    for (Children.Child child : Children.of(tree)) {
      collect(child.tree(), used);
    }
  }

  private final String seed;
  private final Set<NodeId> used;
  private final Set<NodeId> fresh = new HashSet<>();
  private int collisions = 0;

  private IdAssigner(String seed, Set<NodeId> used) {
    this.seed = seed;
    this.used = used;
  }

  @Override
  protected NodeId enter(Tree tree, Slot slot) {
    if (tree.id().isAssigned()) {
      return tree.id();
    }
    NodeId base =
        slot.isRoot()
            ? NodeId.root(seed)
            : NodeId.derive(slot.parent(), slot.name(), slot.index());
    NodeId id = base;
    while (used.contains(id) || fresh.contains(id)) {
      id = base.withCollisionCounter(++collisions);
    }
    fresh.add(id);
    return id;
  }
}
