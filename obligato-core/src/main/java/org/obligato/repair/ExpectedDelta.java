package org.obligato.repair;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * The contract of a repair: after it is applied, the next pass reports none of these
 * diagnostics, reports these obligations only as discharged, and has none of these holes.
 */
@AutoValue
public abstract class ExpectedDelta {

  public abstract ImmutableList<String> diagnosticsResolved();

  public abstract ImmutableList<String> obligationsDischarged();

  public abstract ImmutableList<String> holesFilled();

  public static ExpectedDelta create(
      ImmutableList<String> diagnosticsResolved,
      ImmutableList<String> obligationsDischarged,
      ImmutableList<String> holesFilled) {
    return new AutoValue_ExpectedDelta(diagnosticsResolved, obligationsDischarged, holesFilled);
  }

  public boolean isEmpty() {
    return diagnosticsResolved().isEmpty()
        && obligationsDischarged().isEmpty()
        && holesFilled().isEmpty();
  }
}
