package org.obligato.repair;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.obligato.model.EffectSet;
import org.obligato.tree.NodeId;
import org.obligato.tree.Pretty;
import org.obligato.tree.Tree;
import org.obligato.tree.Tree.Expression;

/**
 * One structural edit, addressed by node id. Ops are self-contained: the payload is a tree whose
 * nodes either carry ids of nodes that the op moves, or no id at all.
 *
 * <p>A {@link PatchOpKind#WRAP} template is an expression containing exactly one hole named
 * {@link #ORIGINAL}, which marks where the wrapped node goes.
 */
@Immutable
public final class PatchOp {

  /** The name of the hole marking the wrapped node in a wrap template. */
  public static final String ORIGINAL = "original";

  public static PatchOp replace(NodeId target, Tree replacement) {
    return new PatchOp(PatchOpKind.REPLACE_NODE, target, replacement, "", EffectSet.PURE);
  }

  public static PatchOp insertBefore(NodeId anchor, Tree inserted) {
    return new PatchOp(PatchOpKind.INSERT_BEFORE, anchor, inserted, "", EffectSet.PURE);
  }

  public static PatchOp insertAfter(NodeId anchor, Tree inserted) {
    return new PatchOp(PatchOpKind.INSERT_AFTER, anchor, inserted, "", EffectSet.PURE);
  }

  public static PatchOp wrap(NodeId target, Expression template) {
    return new PatchOp(PatchOpKind.WRAP, target, template, "", EffectSet.PURE);
  }

  public static PatchOp delete(NodeId target) {
    return new PatchOp(PatchOpKind.DELETE_NODE, target, null, "", EffectSet.PURE);
  }

  public static PatchOp widenEffect(NodeId function, EffectSet effects) {
    checkArgument(!effects.isPure(), "nothing to widen");
    return new PatchOp(PatchOpKind.WIDEN_EFFECT, function, null, "", effects);
  }

  /** Renames the reference at {@code target}: an identifier, call, type name or pattern. */
  public static PatchOp renameSymbol(NodeId target, String name) {
    return new PatchOp(PatchOpKind.RENAME_SYMBOL, target, null, name, EffectSet.PURE);
  }

  /** Renames the declaration at {@code target}. */
  public static PatchOp rename(NodeId target, String name) {
    return new PatchOp(PatchOpKind.RENAME, target, null, name, EffectSet.PURE);
  }

  public static PatchOp renameField(NodeId target, String name) {
    return new PatchOp(PatchOpKind.RENAME_FIELD, target, null, name, EffectSet.PURE);
  }

  /** Adds a field declaration to a record, or a field initializer to a record literal. */
  public static PatchOp addField(NodeId target, Tree field) {
    checkArgument(
        field.kind() == Tree.Kind.FIELD_DECL || field.kind() == Tree.Kind.FIELD_INIT,
        "not a field: %s",
        field.kind());
    return new PatchOp(PatchOpKind.ADD_FIELD, target, field, "", EffectSet.PURE);
  }

  public static PatchOp addParam(NodeId function, Tree.Param param) {
    return new PatchOp(PatchOpKind.ADD_PARAM, function, param, "", EffectSet.PURE);
  }

  /** Refines the type of a parameter with {@code predicate}, stated over {@code var}. */
  public static PatchOp addRefinement(NodeId param, String var, Expression predicate) {
    return new PatchOp(PatchOpKind.ADD_REFINEMENT, param, predicate, var, EffectSet.PURE);
  }

  private final PatchOpKind kind;
  private final NodeId target;

  private final @Nullable Tree payload;

  private final String name;
  private final EffectSet effects;

  private PatchOp(
      PatchOpKind kind, NodeId target, @Nullable Tree payload, String name, EffectSet effects) {
    checkArgument(target.isAssigned(), "unassigned target");
    this.kind = kind;
    this.target = target;
    this.payload = payload;
    this.name = name;
    this.effects = effects;
  }

  public PatchOpKind kind() {
    return kind;
  }

  /** The node the op edits, or the anchor of an insertion. */
  public NodeId target() {
    return target;
  }

  public Optional<Tree> payload() {
    return Optional.ofNullable(payload);
  }

  /** The new name of a rename, or the refinement variable of an added refinement. */
  public String name() {
    return name;
  }

  /** The effects a {@link PatchOpKind#WIDEN_EFFECT} adds. */
  public EffectSet effects() {
    return effects;
  }

  /** The id of the node this op creates at its target, derived from the target and the op. */
  public NodeId createdId() {
    String slot = kind.tag();
    if (!name.isEmpty()) {
      slot += ":" + name;
    } else if (payload != null && payload.kind() == Tree.Kind.FIELD_INIT) {
      slot += ":" + ((Tree.FieldInit) payload).name();
    } else if (payload != null && payload.kind() == Tree.Kind.FIELD_DECL) {
      slot += ":" + ((Tree.FieldDecl) payload).name();
    } else if (payload != null && payload.kind() == Tree.Kind.PARAM) {
      slot += ":" + ((Tree.Param) payload).name();
    } else if (payload != null) {
      // distinct insertions at one anchor must not collide
      slot += ":" + Pretty.pretty(payload);
    }
    return NodeId.derive(target, slot, 0);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind).append('(').append(target);
    if (!name.isEmpty()) {
      sb.append(", ").append(name);
    }
    if (!effects.isPure()) {
      sb.append(", ").append(effects);
    }
    if (payload != null) {
      sb.append(", ").append(Pretty.pretty(payload).replace('\n', ' '));
    }
    return sb.append(')').toString();
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, target, name, effects, payload == null ? "" : Pretty.pretty(payload));
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof PatchOp)) {
      return false;
    }
    PatchOp that = (PatchOp) obj;
    return kind == that.kind
        && target.equals(that.target)
        && name.equals(that.name)
        && effects.equals(that.effects)
        && Objects.equals(
            payload == null ? null : Pretty.withIds(payload),
            that.payload == null ? null : Pretty.withIds(that.payload));
  }
}
