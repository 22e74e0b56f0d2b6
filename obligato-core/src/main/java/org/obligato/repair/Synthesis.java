package org.obligato.repair;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import org.obligato.diag.Diagnostic;
import org.obligato.extract.Obligation;

/** The repairs of one pass, and the diagnostics and obligations annotated with them. */
@AutoValue
public abstract class Synthesis {

  public abstract ImmutableList<Diagnostic> diagnostics();

  public abstract ImmutableList<Obligation> obligations();

  /** All candidates, grouped by the problem they address, best first within a group. */
  public abstract ImmutableList<RepairCandidate> repairs();

  static Synthesis create(
      ImmutableList<Diagnostic> diagnostics,
      ImmutableList<Obligation> obligations,
      ImmutableList<RepairCandidate> repairs) {
    return new AutoValue_Synthesis(diagnostics, obligations, repairs);
  }
}
