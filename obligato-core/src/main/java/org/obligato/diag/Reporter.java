package org.obligato.diag;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.FormatMethod;
import com.google.errorprone.annotations.FormatString;
import java.util.Collection;
import java.util.Comparator;
import java.util.function.Function;
import org.obligato.extract.Obligation;
import org.obligato.extract.TypedHole;
import org.obligato.repair.PatchOp;
import org.obligato.repair.RepairCandidate;
import org.obligato.tree.Ast;
import org.obligato.tree.NodeId;

/**
 * Puts the results of a pass in report order, by the pre-order position of their primary node and
 * then by id, and checks that everything they reference exists.
 */
public final class Reporter {

  private final Ast ast;

  public Reporter(Ast ast) {
    this.ast = ast;
  }

  public ImmutableList<Diagnostic> diagnostics(Collection<Diagnostic> diagnostics) {
    return sorted(diagnostics, Diagnostic::primaryNode, Diagnostic::id);
  }

  public ImmutableList<Obligation> obligations(Collection<Obligation> obligations) {
    return sorted(obligations, Obligation::primaryNode, Obligation::id);
  }

  public ImmutableList<TypedHole> holes(Collection<TypedHole> holes) {
    return sorted(holes, TypedHole::id, h -> h.id().toString());
  }

  /** Repairs are reported by the position of their first target node. */
  public ImmutableList<RepairCandidate> repairs(Collection<RepairCandidate> repairs) {
    return sorted(repairs, r -> r.targets().nodeIds().get(0), RepairCandidate::id);
  }

  private <T> ImmutableList<T> sorted(
      Collection<T> items, Function<T, NodeId> node, Function<T, String> id) {
    for (T item : items) {
      if (!ast.contains(node.apply(item))) {
        throw StructuralError.unknownNode(node.apply(item));
      }
    }
    return ImmutableList.sortedCopyOf(
        Comparator.comparingInt((T item) -> ast.order(node.apply(item))).thenComparing(id),
        items);
  }

  /**
   * Checks the cross references of a finished pass: every node id names a node of the tree, and
   * every repair reference names a reported repair.
   */
  public void verify(
      Collection<Diagnostic> diagnostics,
      Collection<Obligation> obligations,
      Collection<RepairCandidate> repairs) {
    ImmutableSet<String> repairIds =
        repairs.stream().map(RepairCandidate::id).collect(ImmutableSet.toImmutableSet());
    verify(repairIds.size() == repairs.size(), "duplicate repair ids");
    for (Diagnostic diagnostic : diagnostics) {
      verifyNode(diagnostic.primaryNode(), diagnostic.id());
      for (NodeId secondary : diagnostic.secondaryNodes()) {
        verifyNode(secondary, diagnostic.id());
      }
      verifyRefs(diagnostic.repairRefs(), repairIds, diagnostic.id());
    }
    for (Obligation obligation : obligations) {
      verifyNode(obligation.primaryNode(), obligation.id());
      verify(obligation.isDecided(), "%s was never decided", obligation.id());
      verifyRefs(obligation.repairRefs(), repairIds, obligation.id());
    }
    for (RepairCandidate repair : repairs) {
      for (PatchOp op : repair.edits()) {
        verifyNode(op.target(), repair.id());
      }
      for (NodeId node : repair.targets().nodeIds()) {
        verifyNode(node, repair.id());
      }
      verifyRefs(repair.compatibility().conflictsWith(), repairIds, repair.id());
      verifyRefs(repair.compatibility().requires(), repairIds, repair.id());
    }
  }

  private void verifyNode(NodeId node, String owner) {
    verify(ast.contains(node), "%s references unknown node %s", owner, node);
  }

  private static void verifyRefs(
      Collection<String> refs, ImmutableSet<String> repairIds, String owner) {
    for (String ref : refs) {
      verify(repairIds.contains(ref), "%s references unknown repair %s", owner, ref);
    }
  }

  @FormatMethod
  private static void verify(boolean condition, @FormatString String format, Object... args) {
    if (!condition) {
      throw StructuralError.create(StructuralError.Kind.INCONSISTENT_RESULT, format, args);
    }
  }
}
