package org.obligato.solver;

import org.obligato.binder.ContextSnapshot;
import org.obligato.tree.Tree.Expression;

/**
 * A decision procedure for obligation goals.
 *
 * <p>Implementations must be sound: {@link SolverResult#DISCHARGED} only when {@code not goal}
 * is refuted by the facts of the context. Calls must not share mutable state, since a pass
 * decides obligations concurrently.
 */
public interface Solver {

  SolverOutcome decide(Expression goal, ContextSnapshot context);
}
