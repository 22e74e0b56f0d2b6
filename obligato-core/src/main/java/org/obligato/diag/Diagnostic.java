package org.obligato.diag;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.obligato.tree.Ast;
import org.obligato.tree.NodeId;
import org.obligato.tree.Pretty;

/** A static error or warning that is not modeled as an obligation. */
@Immutable
public final class Diagnostic {

  private final String id;
  private final DiagnosticKind kind;
  private final String message;
  private final NodeId primaryNode;
  private final ImmutableList<NodeId> secondaryNodes;
  private final ImmutableMap<String, String> structured;
  private final ImmutableList<String> repairRefs;

  Diagnostic(
      String id,
      DiagnosticKind kind,
      String message,
      NodeId primaryNode,
      ImmutableList<NodeId> secondaryNodes,
      ImmutableMap<String, String> structured,
      ImmutableList<String> repairRefs) {
    this.id = requireNonNull(id);
    this.kind = requireNonNull(kind);
    this.message = requireNonNull(message);
    this.primaryNode = requireNonNull(primaryNode);
    this.secondaryNodes = requireNonNull(secondaryNodes);
    this.structured = requireNonNull(structured);
    this.repairRefs = requireNonNull(repairRefs);
  }

  /** The stable id, {@code dg-<code>-<node id>}. */
  public String id() {
    return id;
  }

  public DiagnosticKind kind() {
    return kind;
  }

  public Severity severity() {
    return kind.severity();
  }

  public String code() {
    return kind.code();
  }

  public String message() {
    return message;
  }

  public NodeId primaryNode() {
    return primaryNode;
  }

  public ImmutableList<NodeId> secondaryNodes() {
    return secondaryNodes;
  }

  /**
   * Machine-readable details. Always contains {@code kind}; the other keys depend on the kind
   * (for example {@code name} and {@code candidates} for unresolved names).
   */
  public ImmutableMap<String, String> structured() {
    return structured;
  }

  /** Ids of the repair candidates for this diagnostic, best first. */
  public ImmutableList<String> repairRefs() {
    return repairRefs;
  }

  public boolean isError() {
    return severity() == Severity.ERROR;
  }

  public Diagnostic withRepairRefs(ImmutableList<String> repairRefs) {
    return new Diagnostic(
        id, kind, message, primaryNode, secondaryNodes, structured, repairRefs);
  }

  /** Renders the diagnostic with the offending node, for drivers that print to a terminal. */
  public String render(Ast ast) {
    StringBuilder sb = new StringBuilder();
    sb.append(severity()).append('[').append(code()).append("]: ").append(message);
    ast.find(primaryNode)
        .ifPresent(
            node -> {
              for (String line : Pretty.pretty(node).split("\n", -1)) {
                sb.append("\n  | ").append(line);
              }
            });
    if (!repairRefs.isEmpty()) {
      sb.append("\n  = repairs: ").append(String.join(", ", repairRefs));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return id + ": " + message;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, message, repairRefs);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof Diagnostic)) {
      return false;
    }
    Diagnostic that = (Diagnostic) obj;
    return id.equals(that.id)
        && kind == that.kind
        && message.equals(that.message)
        && primaryNode.equals(that.primaryNode)
        && secondaryNodes.equals(that.secondaryNodes)
        && structured.equals(that.structured)
        && repairRefs.equals(that.repairRefs);
  }
}
