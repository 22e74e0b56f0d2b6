package org.obligato.repair;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import org.obligato.tree.NodeId;

/** What a repair is about: nodes, and the diagnostics, obligations and holes it addresses. */
@AutoValue
public abstract class Targets {

  public abstract ImmutableList<NodeId> nodeIds();

  public abstract ImmutableList<String> diagnosticIds();

  public abstract ImmutableList<String> diagnosticCodes();

  public abstract ImmutableList<String> obligationIds();

  public abstract ImmutableList<String> holeIds();

  public static Builder builder() {
    return new AutoValue_Targets.Builder()
        .setNodeIds(ImmutableList.of())
        .setDiagnosticIds(ImmutableList.of())
        .setDiagnosticCodes(ImmutableList.of())
        .setObligationIds(ImmutableList.of())
        .setHoleIds(ImmutableList.of());
  }

  /** The ids of the diagnostics, obligations and holes; alternatives share at least one. */
  public ImmutableList<String> problemIds() {
    return ImmutableList.<String>builder()
        .addAll(diagnosticIds())
        .addAll(obligationIds())
        .addAll(holeIds())
        .build();
  }

  /** A builder for {@link Targets}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setNodeIds(ImmutableList<NodeId> nodeIds);

    public abstract Builder setDiagnosticIds(ImmutableList<String> diagnosticIds);

    public abstract Builder setDiagnosticCodes(ImmutableList<String> diagnosticCodes);

    public abstract Builder setObligationIds(ImmutableList<String> obligationIds);

    public abstract Builder setHoleIds(ImmutableList<String> holeIds);

    public abstract Targets build();
  }
}
