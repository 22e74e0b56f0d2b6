package org.obligato.main;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.obligato.diag.Diagnostic;
import org.obligato.extract.Obligation;
import org.obligato.extract.TypedHole;
import org.obligato.repair.RepairCandidate;
import org.obligato.tree.Ast;

/** Everything a pass reports. Lists are always present, and sorted in report order. */
@AutoValue
public abstract class CompileResult {

  public abstract CompileStatus status();

  /** The canonical tree that every node id of this result refers to. */
  public abstract Ast canonicalAst();

  public abstract ImmutableList<RepairCandidate> repairs();

  public abstract ImmutableList<Diagnostic> diagnostics();

  public abstract ImmutableList<Obligation> obligations();

  public abstract ImmutableList<TypedHole> holes();

  /** Generated code. Code generation is done by the driver, so this is always empty. */
  public abstract Optional<String> output();

  public abstract PassStats stats();

  /** {@link PassState#REPORTED}, or {@link PassState#SUCCESS} for a successful pass. */
  public abstract PassState state();

  public Optional<RepairCandidate> repair(String id) {
    return repairs().stream().filter(r -> r.id().equals(id)).findFirst();
  }

  public Optional<Diagnostic> diagnostic(String id) {
    return diagnostics().stream().filter(d -> d.id().equals(id)).findFirst();
  }

  public Optional<Obligation> obligation(String id) {
    return obligations().stream().filter(o -> o.id().equals(id)).findFirst();
  }

  static CompileResult create(
      CompileStatus status,
      Ast canonicalAst,
      ImmutableList<RepairCandidate> repairs,
      ImmutableList<Diagnostic> diagnostics,
      ImmutableList<Obligation> obligations,
      ImmutableList<TypedHole> holes,
      PassStats stats,
      PassState state) {
    return new AutoValue_CompileResult(
        status,
        canonicalAst,
        repairs,
        diagnostics,
        obligations,
        holes,
        Optional.empty(),
        stats,
        state);
  }
}
