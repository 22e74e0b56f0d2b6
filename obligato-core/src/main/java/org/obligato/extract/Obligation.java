package org.obligato.extract;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.Immutable;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.obligato.binder.ContextSnapshot;
import org.obligato.solver.SolverOutcome;
import org.obligato.solver.SolverResult;
import org.obligato.tree.NodeId;
import org.obligato.tree.Pretty;
import org.obligato.tree.Tree.Expression;

/**
 * A proof goal at one program site. Immutable except that the solver's verdict and the repair
 * references are filled in later, by returning updated copies.
 */
@Immutable
public final class Obligation {

  private final String id;
  private final ObligationKind kind;

  private final Expression goal;

  private final String goalText;
  private final NodeId primaryNode;
  private final ContextSnapshot context;
  private final String origin;
  private final @Nullable SolverOutcome outcome;
  private final ImmutableList<String> repairRefs;

  Obligation(
      String id,
      ObligationKind kind,
      Expression goal,
      NodeId primaryNode,
      ContextSnapshot context,
      String origin,
      @Nullable SolverOutcome outcome,
      ImmutableList<String> repairRefs) {
    this.id = requireNonNull(id);
    this.kind = requireNonNull(kind);
    this.goal = requireNonNull(goal);
    this.goalText = Pretty.pretty(goal);
    this.primaryNode = requireNonNull(primaryNode);
    this.context = requireNonNull(context);
    this.origin = requireNonNull(origin);
    this.outcome = outcome;
    this.repairRefs = requireNonNull(repairRefs);
  }

  /** The stable id, {@code ob-<kind>-<node id>}. */
  public String id() {
    return id;
  }

  public ObligationKind kind() {
    return kind;
  }

  /** The proposition to prove, as a detached tree. */
  public Expression goal() {
    return goal;
  }

  public String goalText() {
    return goalText;
  }

  public NodeId primaryNode() {
    return primaryNode;
  }

  public ContextSnapshot context() {
    return context;
  }

  /** What required the proof, for humans. */
  public String origin() {
    return origin;
  }

  public Optional<SolverOutcome> outcome() {
    return Optional.ofNullable(outcome);
  }

  public boolean isDecided() {
    return outcome != null;
  }

  public SolverResult result() {
    checkState(outcome != null, "%s has not been decided", id);
    return outcome.result();
  }

  public boolean isDischarged() {
    return outcome != null && outcome.isDischarged();
  }

  /** Ids of the repair candidates for this obligation, best first. */
  public ImmutableList<String> repairRefs() {
    return repairRefs;
  }

  public Obligation withOutcome(SolverOutcome outcome) {
    return new Obligation(id, kind, goal, primaryNode, context, origin, outcome, repairRefs);
  }

  public Obligation withRepairRefs(ImmutableList<String> repairRefs) {
    return new Obligation(id, kind, goal, primaryNode, context, origin, outcome, repairRefs);
  }

  @Override
  public String toString() {
    return id + ": " + goalText + (outcome == null ? "" : " => " + outcome);
  }
}
