package org.obligato.main;

import com.google.auto.value.AutoValue;

/** Counts describing a pass. */
@AutoValue
public abstract class PassStats {

  public abstract int obligations();

  public abstract int discharged();

  public abstract int counterexamples();

  public abstract int unknown();

  public abstract int diagnostics();

  public abstract int repairs();

  public abstract int holes();

  public static Builder builder() {
    return new AutoValue_PassStats.Builder()
        .setObligations(0)
        .setDischarged(0)
        .setCounterexamples(0)
        .setUnknown(0)
        .setDiagnostics(0)
        .setRepairs(0)
        .setHoles(0);
  }

  /** A builder for {@link PassStats}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setObligations(int obligations);

    public abstract Builder setDischarged(int discharged);

    public abstract Builder setCounterexamples(int counterexamples);

    public abstract Builder setUnknown(int unknown);

    public abstract Builder setDiagnostics(int diagnostics);

    public abstract Builder setRepairs(int repairs);

    public abstract Builder setHoles(int holes);

    public abstract PassStats build();
  }
}
