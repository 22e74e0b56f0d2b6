package org.obligato.main;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.obligato.extract.Obligation;
import org.obligato.extract.TypedHole;
import org.obligato.repair.ExpectedDelta;
import org.obligato.repair.RepairCandidate;

/** Checks a repair's expected delta against the pass that followed its application. */
public final class ExpectedDeltaVerifier {

  /** Returns the ways in which {@code next} breaks the contract; empty if it holds. */
  public static ImmutableList<String> verify(RepairCandidate candidate, CompileResult next) {
    ExpectedDelta delta = candidate.expectedDelta();
    ImmutableList.Builder<String> violations = ImmutableList.builder();
    for (String id : delta.diagnosticsResolved()) {
      if (next.diagnostic(id).isPresent()) {
        violations.add("diagnostic " + id + " is still reported");
      }
    }
    for (String id : delta.obligationsDischarged()) {
      Optional<Obligation> obligation = next.obligation(id);
      if (obligation.isPresent() && !obligation.get().isDischarged()) {
        violations.add("obligation " + id + " is " + obligation.get().outcome().get());
      }
    }
    for (String id : delta.holesFilled()) {
      for (TypedHole hole : next.holes()) {
        if (hole.id().toString().equals(id)) {
          violations.add("hole " + id + " is still open");
        }
      }
    }
    return violations.build();
  }

  private ExpectedDeltaVerifier() {}
}
