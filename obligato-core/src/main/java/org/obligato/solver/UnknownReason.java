package org.obligato.solver;

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/** An explanation of an {@link SolverResult#UNKNOWN} verdict. */
@AutoValue
@Immutable
public abstract class UnknownReason {

  public abstract UnknownCategory category();

  public abstract String detail();

  public static UnknownReason create(UnknownCategory category, String detail) {
    return new AutoValue_UnknownReason(category, detail);
  }
}
