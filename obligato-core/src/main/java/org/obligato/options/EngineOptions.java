package org.obligato.options;

import com.google.auto.value.AutoValue;
import java.time.Duration;

/** Tuning knobs of the obligation engine, handed through by the driver. */
@AutoValue
public abstract class EngineOptions {

  /** Wall-clock budget of one solver call. */
  public abstract Duration solverTimeout();

  /** Upper bound on the disjuncts produced when normalizing one goal. */
  public abstract int maxDisjuncts();

  /** Upper bound on the constraints alive during elimination of one disjunct. */
  public abstract int maxConstraints();

  /** Worker threads for solving and repair synthesis; 1 runs everything on the caller thread. */
  public abstract int parallelism();

  /** Seeds node ids, so that ids are stable for one input within a session. */
  public abstract String sessionSeed();

  /** Rename candidates at or below this edit distance are high confidence. */
  public abstract int highConfidenceDistance();

  /** Rename candidates above this edit distance are not proposed. */
  public abstract int maxRenameDistance();

  public abstract int maxRenameCandidates();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_EngineOptions.Builder()
        .setSolverTimeout(Duration.ofSeconds(2))
        .setMaxDisjuncts(64)
        .setMaxConstraints(2048)
        .setParallelism(1)
        .setSessionSeed("obligato")
        .setHighConfidenceDistance(1)
        .setMaxRenameDistance(3)
        .setMaxRenameCandidates(3);
  }

  public static EngineOptions defaults() {
    return builder().build();
  }

  /** A {@link Builder} for {@link EngineOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setSolverTimeout(Duration solverTimeout);

    public abstract Builder setMaxDisjuncts(int maxDisjuncts);

    public abstract Builder setMaxConstraints(int maxConstraints);

    public abstract Builder setParallelism(int parallelism);

    public abstract Builder setSessionSeed(String sessionSeed);

    public abstract Builder setHighConfidenceDistance(int highConfidenceDistance);

    public abstract Builder setMaxRenameDistance(int maxRenameDistance);

    public abstract Builder setMaxRenameCandidates(int maxRenameCandidates);

    abstract EngineOptions autoBuild();

    public EngineOptions build() {
      EngineOptions options = autoBuild();
      if (options.solverTimeout().isNegative() || options.solverTimeout().isZero()) {
        throw new IllegalArgumentException("solver timeout must be positive");
      }
      if (options.maxDisjuncts() < 1 || options.maxConstraints() < 1) {
        throw new IllegalArgumentException("solver budgets must be positive");
      }
      if (options.parallelism() < 1) {
        throw new IllegalArgumentException("parallelism must be at least 1");
      }
      if (options.highConfidenceDistance() > options.maxRenameDistance()) {
        throw new IllegalArgumentException(
            "high confidence distance exceeds the maximum rename distance");
      }
      return options;
    }
  }
}
