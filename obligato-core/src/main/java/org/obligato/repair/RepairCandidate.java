package org.obligato.repair;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Comparator;

/** A ranked, safety-classified, machine-applicable fix. */
@AutoValue
public abstract class RepairCandidate {

  /** Best candidates first: by confidence, then safety, then size, then id. */
  public static final Comparator<RepairCandidate> RANKING =
      Comparator.comparing(RepairCandidate::confidence)
          .thenComparing(RepairCandidate::safety)
          .thenComparingInt(c -> c.scope().nodeCount())
          .thenComparing(RepairCandidate::id);

  /** {@code rp-<template>-<target node id>[-k]}. */
  public abstract String id();

  /** The name of the template that produced the candidate, e.g. {@code guard}. */
  public abstract String template();

  public abstract String title();

  public abstract Confidence confidence();

  public abstract Safety safety();

  public abstract RepairKind kind();

  public abstract RepairScope scope();

  public abstract Targets targets();

  /** The edits, never empty. */
  public abstract ImmutableList<PatchOp> edits();

  public abstract ExpectedDelta expectedDelta();

  public abstract Compatibility compatibility();

  public abstract String rationale();

  /** Edits that must already be present in the tree before this candidate applies. */
  public abstract ImmutableList<PatchOp> prerequisites();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_RepairCandidate.Builder()
        .setCompatibility(Compatibility.unanalyzed())
        .setPrerequisites(ImmutableList.of());
  }

  public RepairCandidate withCompatibility(Compatibility compatibility) {
    return toBuilder().setCompatibility(compatibility).build();
  }

  @Override
  public final String toString() {
    return id() + " [" + confidence() + ", " + safety() + "]: " + title();
  }

  /** A builder for {@link RepairCandidate}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setId(String id);

    public abstract Builder setTemplate(String template);

    public abstract Builder setTitle(String title);

    public abstract Builder setConfidence(Confidence confidence);

    public abstract Builder setSafety(Safety safety);

    public abstract Builder setKind(RepairKind kind);

    public abstract Builder setScope(RepairScope scope);

    public abstract Builder setTargets(Targets targets);

    public abstract Builder setEdits(ImmutableList<PatchOp> edits);

    public abstract Builder setExpectedDelta(ExpectedDelta expectedDelta);

    public abstract Builder setCompatibility(Compatibility compatibility);

    public abstract Builder setRationale(String rationale);

    public abstract Builder setPrerequisites(ImmutableList<PatchOp> prerequisites);

    abstract String template();

    abstract ImmutableList<PatchOp> edits();

    abstract RepairCandidate autoBuild();

    public RepairCandidate build() {
      RepairCandidate candidate = autoBuild();
      if (candidate.edits().isEmpty()) {
        throw new IllegalArgumentException("repair " + candidate.id() + " has no edits");
      }
      return candidate;
    }
  }
}
