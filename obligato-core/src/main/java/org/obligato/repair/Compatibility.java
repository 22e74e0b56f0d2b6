package org.obligato.repair;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Optional;

/** How a candidate relates to the other candidates of the same result. */
@AutoValue
public abstract class Compatibility {

  private static final Compatibility UNANALYZED =
      create(ImmutableList.of(), ImmutableList.of(), Optional.empty());

  /** Candidates that must not be applied together with this one. */
  public abstract ImmutableList<String> conflictsWith();

  /** Candidates whose edits must have landed before this one applies. */
  public abstract ImmutableList<String> requires();

  /** Candidates with equal batch keys are safe to apply together in one pass. */
  public abstract Optional<String> batchKey();

  public static Compatibility create(
      ImmutableList<String> conflictsWith,
      ImmutableList<String> requires,
      Optional<String> batchKey) {
    return new AutoValue_Compatibility(conflictsWith, requires, batchKey);
  }

  /** The compatibility of a candidate before the analyzer has run. */
  public static Compatibility unanalyzed() {
    return UNANALYZED;
  }
}
