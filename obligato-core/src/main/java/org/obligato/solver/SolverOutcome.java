package org.obligato.solver;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.errorprone.annotations.Immutable;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/** The outcome of deciding one goal. */
@Immutable
public final class SolverOutcome {

  private static final SolverOutcome DISCHARGED =
      new SolverOutcome(SolverResult.DISCHARGED, ImmutableSortedMap.of(), Optional.empty());

  public static SolverOutcome discharged() {
    return DISCHARGED;
  }

  /** A witness: one value per free variable, rendered as text. */
  public static SolverOutcome counterexample(Map<String, String> values) {
    checkArgument(!values.isEmpty(), "empty counterexample");
    return new SolverOutcome(
        SolverResult.COUNTEREXAMPLE, ImmutableSortedMap.copyOf(values), Optional.empty());
  }

  public static SolverOutcome unknown(UnknownCategory category, String detail) {
    return new SolverOutcome(
        SolverResult.UNKNOWN,
        ImmutableSortedMap.of(),
        Optional.of(UnknownReason.create(category, detail)));
  }

  private final SolverResult result;
  private final ImmutableSortedMap<String, String> counterexample;

  private final Optional<UnknownReason> unknownReason;

  private SolverOutcome(
      SolverResult result,
      ImmutableSortedMap<String, String> counterexample,
      Optional<UnknownReason> unknownReason) {
    this.result = result;
    this.counterexample = counterexample;
    this.unknownReason = unknownReason;
  }

  public SolverResult result() {
    return result;
  }

  public boolean isDischarged() {
    return result == SolverResult.DISCHARGED;
  }

  /** The witnessing assignment; empty unless the result is a counterexample. */
  public ImmutableMap<String, String> counterexample() {
    return counterexample;
  }

  public Optional<UnknownReason> unknownReason() {
    return unknownReason;
  }

  @Override
  public String toString() {
    switch (result) {
      case COUNTEREXAMPLE:
        return "counterexample " + counterexample;
      case UNKNOWN:
        UnknownReason reason = unknownReason.get();
        return "unknown(" + reason.category() + ": " + reason.detail() + ")";
      default:
        return result.toString();
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(result, counterexample, unknownReason);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (!(obj instanceof SolverOutcome)) {
      return false;
    }
    SolverOutcome that = (SolverOutcome) obj;
    return result == that.result
        && counterexample.equals(that.counterexample)
        && unknownReason.equals(that.unknownReason);
  }
}
