package org.obligato.tree;

import com.google.common.collect.ImmutableList;

/** Lists the direct children of a node, with the slot each one occupies. */
public final class Children {

  /** A direct child of a node. */
  public static final class Child {
    private final String slot;
    private final int index;
    private final Tree tree;

    Child(String slot, int index, Tree tree) {
      this.slot = slot;
      this.index = index;
      this.tree = tree;
    }

    public String slot() {
      return slot;
    }

    public int index() {
      return index;
    }

    public Tree tree() {
      return tree;
    }
  }

  /** Returns the children of {@code tree} in source order. */
  public static ImmutableList<Child> of(Tree tree) {
    Lister lister = new Lister();
    tree.accept(lister, TreeCopier.Slot.ROOT);
    return lister.children.build();
  }

  /** Returns true if the given slot of {@code kind} holds a list of children. */
  public static boolean isListSlot(Tree.Kind kind, String slot) {
    switch (kind) {
      case COMP_UNIT:
        return slot.equals("decls");
      case FN_DECL:
        return slot.equals("params");
      case RECORD_DECL:
      case RECORD_LIT:
        return slot.equals("fields");
      case NAMED_TY:
        return slot.equals("args");
      case CALL:
        return slot.equals("args");
      case LIST_LIT:
        return slot.equals("elems");
      case MATCH:
        return slot.equals("arms");
      case BLOCK:
        return slot.equals("stmts");
      default:
        return false;
    }
  }

  /** Returns true if the given slot of {@code kind} may be empty. */
  public static boolean isOptionalSlot(Tree.Kind kind, String slot) {
    switch (kind) {
      case FN_DECL:
        return slot.equals("requires") || slot.equals("ensures") || slot.equals("body");
      case LET:
        return slot.equals("type");
      case RETURN:
        return slot.equals("expr");
      case IF:
        return slot.equals("else");
      case BLOCK:
        return slot.equals("tail");
      default:
        return false;
    }
  }

  private static class Lister extends TreeCopier {
    final ImmutableList.Builder<Child> children = ImmutableList.builder();

    @Override
    protected <T extends Tree> T sub(
        Class<T> type, T child, NodeId parent, String slot, int index) {
      children.add(new Child(slot, index, child));
      return child;
    }
  }

  private Children() {}
}
