package org.obligato.tree;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.Immutable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.obligato.diag.StructuralError;
import org.obligato.tree.Tree.CompUnit;
import org.obligato.tree.Tree.FnDecl;

/**
 * A canonical AST: a compilation unit whose nodes all carry ids, plus a flat index from id to
 * node, parent and slot. Declarations refer to each other by name, so the index never has to
 * represent cycles.
 *
 * <p>The pre-order index of a node is its source position for sorting purposes.
 */
@Immutable
public final class Ast {

  /** Builds an AST, assigning ids to every node of {@code unit} that lacks one. */
  public static Ast of(CompUnit unit, String seed) {
    checkArgument(!seed.isEmpty(), "empty session seed");
    return new Ast(IdAssigner.assign(unit, seed), seed);
  }

  @Immutable
  private static final class Entry {
    final Tree tree;
    final @Nullable NodeId parent;
    final String slot;
    final int order;

    Entry(Tree tree, @Nullable NodeId parent, String slot, int order) {
      this.tree = tree;
      this.parent = parent;
      this.slot = slot;
      this.order = order;
    }
  }

  private final String seed;
  private final CompUnit root;

  private final ImmutableMap<NodeId, Entry> index;

  private Ast(CompUnit root, String seed) {
    this.seed = seed;
    this.root = root;
    Map<NodeId, Entry> entries = new LinkedHashMap<>();
    index(root, null, "root", entries);
    this.index = ImmutableMap.copyOf(entries);
  }

  private static void index(
      Tree tree, @Nullable NodeId parent, String slot, Map<NodeId, Entry> entries) {
    if (entries.containsKey(tree.id())) {
      throw StructuralError.create(StructuralError.Kind.DUPLICATE_NODE_ID, "%s", tree.id());
    }
    entries.put(tree.id(), new Entry(tree, parent, slot, entries.size()));
    for (Children.Child child : Children.of(tree)) {
      index(child.tree(), tree.id(), child.slot(), entries);
    }
  }

  public String seed() {
    return seed;
  }

  public CompUnit root() {
    return root;
  }

  public boolean contains(NodeId id) {
    return index.containsKey(id);
  }

  public Optional<Tree> find(NodeId id) {
    Entry entry = index.get(id);
    return entry == null ? Optional.empty() : Optional.of(entry.tree);
  }

  /** Returns the node with the given id, or throws a {@link StructuralError}. */
  public Tree node(NodeId id) {
    return entry(id).tree;
  }

  public Optional<NodeId> parent(NodeId id) {
    return Optional.ofNullable(entry(id).parent);
  }

  /** The name of the slot of the parent that holds the node. */
  public String slot(NodeId id) {
    return entry(id).slot;
  }

  /** The pre-order position of the node. */
  public int order(NodeId id) {
    return entry(id).order;
  }

  /** All node ids, in pre-order. */
  public ImmutableSet<NodeId> ids() {
    return index.keySet();
  }

  /** The ids of the node and all its descendants. */
  public ImmutableSet<NodeId> subtreeIds(NodeId id) {
    ImmutableSet.Builder<NodeId> result = ImmutableSet.builder();
    collect(node(id), result);
    return result.build();
  }

  private static void collect(Tree tree, ImmutableSet.Builder<NodeId> result) {
    result.add(tree.id());
    for (Children.Child child : Children.of(tree)) {
      collect(child.tree(), result);
    }
  }

  /** The function declaration enclosing the node, if any (a function encloses itself). */
  public Optional<FnDecl> enclosingFn(NodeId id) {
    NodeId current = id;
    while (true) {
      Entry entry = entry(current);
      if (entry.tree.kind() == Tree.Kind.FN_DECL) {
        return Optional.of((FnDecl) entry.tree);
      }
      if (entry.parent == null) {
        return Optional.empty();
      }
      current = entry.parent;
    }
  }

  private Entry entry(NodeId id) {
    Entry entry = index.get(id);
    if (entry == null) {
      throw StructuralError.unknownNode(id);
    }
    return entry;
  }

  /** Prints the AST with node ids. */
  public String print() {
    return Pretty.withIds(root);
  }

  @Override
  public String toString() {
    return Pretty.pretty(root);
  }

  @Override
  public int hashCode() {
    return print().hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof Ast)) {
      return false;
    }
    Ast that = (Ast) obj;
    return seed.equals(that.seed) && print().equals(that.print());
  }
}
