package org.obligato.diag;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.obligato.tree.NodeId;

/** A log that collects diagnostics, in report order. */
public class DiagnosticLog {

  private final Map<String, Diagnostic> diagnostics = new LinkedHashMap<>();

  public ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics.values());
  }

  public boolean anyErrors() {
    for (Diagnostic diagnostic : diagnostics.values()) {
      if (diagnostic.isError()) {
        return true;
      }
    }
    return false;
  }

  public void error(DiagnosticKind kind, NodeId node, Object... args) {
    report(kind, node, ImmutableList.of(), ImmutableMap.of(), args);
  }

  /**
   * Reports a diagnostic. Reporting the same message twice for one node is a no-op; a different
   * message of the same kind on the same node gets a numbered id.
   */
  public void report(
      DiagnosticKind kind,
      NodeId node,
      ImmutableList<NodeId> secondary,
      ImmutableMap<String, String> details,
      Object... args) {
    String message = kind.format(args);
    String base = "dg-" + kind.code() + "-" + node;
    String id = base;
    for (int k = 2; diagnostics.containsKey(id); k++) {
      if (diagnostics.get(id).message().equals(message)) {
        return;
      }
      id = base + "-" + k;
    }
    ImmutableMap<String, String> structured =
        ImmutableMap.<String, String>builder()
            .put("kind", kind.code())
            .putAll(details)
            .buildKeepingLast();
    diagnostics.put(
        id,
        new Diagnostic(id, kind, message, node, secondary, structured, ImmutableList.of()));
  }
}
