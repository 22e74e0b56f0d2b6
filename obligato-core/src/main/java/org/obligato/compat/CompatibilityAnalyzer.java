package org.obligato.compat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.obligato.repair.Compatibility;
import org.obligato.repair.PatchOp;
import org.obligato.repair.PatchOpKind;
import org.obligato.repair.RepairCandidate;
import org.obligato.tree.Ast;
import org.obligato.tree.NodeId;

/**
 * Computes which repairs conflict, which require others, and a partition of the repairs into
 * batches that can be applied together.
 *
 * <p>Each edit has a footprint: the resources it writes and the ones it only reads. A structural
 * edit writes every node of the subtree it replaces, an insertion writes its anchor, and an edit
 * of a declaration's attribute writes that attribute and reads the declaration. Two repairs
 * conflict when one writes what the other touches and their edits differ, when they address the
 * same problem, or when both widen the effects of one function.
 */
public final class CompatibilityAnalyzer {

  private final Ast ast;

  public CompatibilityAnalyzer(Ast ast) {
    this.ast = ast;
  }

  /** Returns the repairs, in the same order, with their compatibility filled in. */
  public ImmutableList<RepairCandidate> analyze(List<RepairCandidate> repairs) {
    int n = repairs.size();
    List<Footprint> footprints = new ArrayList<>();
    for (RepairCandidate repair : repairs) {
      footprints.add(footprint(repair));
    }
    List<Set<Integer>> conflicts = new ArrayList<>();
    List<Set<Integer>> requires = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      conflicts.add(new TreeSet<>());
      requires.add(new TreeSet<>());
    }
    for (int i = 0; i < n; i++) {
      for (int j = i + 1; j < n; j++) {
        if (conflict(repairs.get(i), footprints.get(i), repairs.get(j), footprints.get(j))) {
          conflicts.get(i).add(j);
          conflicts.get(j).add(i);
        }
      }
      for (int j = 0; j < n; j++) {
        if (i != j && provides(repairs.get(j), repairs.get(i).prerequisites())) {
          requires.get(i).add(j);
        }
      }
    }
    int[] batches = batches(repairs, conflicts, requires);

    ImmutableList.Builder<RepairCandidate> result = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      result.add(
          repairs
              .get(i)
              .withCompatibility(
                  Compatibility.create(
                      ids(repairs, conflicts.get(i)),
                      ids(repairs, requires.get(i)),
                      Optional.of("b" + batches[i]))));
    }
    return result.build();
  }

  private static ImmutableList<String> ids(List<RepairCandidate> repairs, Set<Integer> indices) {
    Set<String> ids = new TreeSet<>();
    for (int index : indices) {
      ids.add(repairs.get(index).id());
    }
    return ImmutableList.copyOf(ids);
  }

  // footprints

  private static final class Footprint {
    final Set<String> writes = new LinkedHashSet<>();
    final Set<String> reads = new LinkedHashSet<>();
  }

  private Footprint footprint(RepairCandidate repair) {
    Footprint result = new Footprint();
    for (PatchOp op : repair.edits()) {
      NodeId target = op.target();
      switch (op.kind()) {
        case REPLACE_NODE:
        case WRAP:
        case DELETE_NODE:
          for (NodeId id : ast.subtreeIds(target)) {
            result.writes.add(node(id));
          }
          break;
        case INSERT_BEFORE:
        case INSERT_AFTER:
        case RENAME_SYMBOL:
        case RENAME_FIELD:
          result.writes.add(node(target));
          break;
        case WIDEN_EFFECT:
        case RENAME:
        case ADD_FIELD:
        case ADD_PARAM:
        case ADD_REFINEMENT:
          result.writes.add(attribute(op));
          result.reads.add(node(target));
          break;
      }
    }
    return result;
  }

  private static String node(NodeId id) {
    return "node:" + id;
  }

  private static String attribute(PatchOp op) {
    return op.kind().tag() + ":" + op.target();
  }

  private static boolean conflict(
      RepairCandidate a, Footprint fa, RepairCandidate b, Footprint fb) {
    if (!Sets.intersection(
            ImmutableSet.copyOf(a.targets().problemIds()),
            ImmutableSet.copyOf(b.targets().problemIds()))
        .isEmpty()) {
      return true;
    }
    Set<String> shared = new LinkedHashSet<>();
    shared.addAll(Sets.intersection(fa.writes, Sets.union(fb.writes, fb.reads)));
    shared.addAll(Sets.intersection(fb.writes, fa.reads));
    if (shared.isEmpty()) {
      return false;
    }
    for (String resource : shared) {
      if (resource.startsWith(PatchOpKind.WIDEN_EFFECT.tag() + ":")) {
        return true;
      }
    }
    return !a.edits().equals(b.edits());
  }

  /** Some edit of {@code repair} establishes every prerequisite. */
  private static boolean provides(RepairCandidate repair, List<PatchOp> prerequisites) {
    if (prerequisites.isEmpty()) {
      return false;
    }
    for (PatchOp needed : prerequisites) {
      boolean found = false;
      for (PatchOp op : repair.edits()) {
        if (op.equals(needed)
            || (op.kind() == PatchOpKind.WIDEN_EFFECT
                && needed.kind() == PatchOpKind.WIDEN_EFFECT
                && op.target().equals(needed.target())
                && needed.effects().isSubsetOf(op.effects()))) {
          found = true;
          break;
        }
      }
      if (!found) {
        return false;
      }
    }
    return true;
  }

  // batches

  /**
   * Greedily places repairs, best ranked first, into the lowest batch that holds nothing they
   * conflict with and that comes after every batch holding a repair they require.
   */
  private static int[] batches(
      List<RepairCandidate> repairs, List<Set<Integer>> conflicts, List<Set<Integer>> requires) {
    int n = repairs.size();
    List<Integer> order = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      order.add(i);
    }
    order.sort((x, y) -> RepairCandidate.RANKING.compare(repairs.get(x), repairs.get(y)));

    int[] batch = new int[n];
    boolean[] placed = new boolean[n];
    Map<Integer, Set<Integer>> members = new HashMap<>();
    for (int round = 0; round < n; round++) {
      int next = -1;
      for (int candidate : order) {
        if (placed[candidate]) {
          continue;
        }
        if (next < 0) {
          next = candidate;
        }
        boolean ready = true;
        for (int required : requires.get(candidate)) {
          ready &= placed[required];
        }
        if (ready) {
          next = candidate;
          break;
        }
      }
      int lowest = 0;
      for (int required : requires.get(next)) {
        if (placed[required]) {
          lowest = Math.max(lowest, batch[required] + 1);
        }
      }
      int b = lowest;
      while (!fits(next, members.getOrDefault(b, Set.of()), conflicts, requires)) {
        b++;
      }
      batch[next] = b;
      placed[next] = true;
      members.computeIfAbsent(b, k -> new TreeSet<>()).add(next);
    }
    return batch;
  }

  private static boolean fits(
      int candidate,
      Set<Integer> members,
      List<Set<Integer>> conflicts,
      List<Set<Integer>> requires) {
    for (int member : members) {
      if (conflicts.get(candidate).contains(member)
          || requires.get(candidate).contains(member)
          || requires.get(member).contains(candidate)) {
        return false;
      }
    }
    return true;
  }
}
