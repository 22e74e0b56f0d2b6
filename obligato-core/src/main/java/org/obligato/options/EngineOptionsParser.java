package org.obligato.options;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/** Parses {@code --flag value} arguments handed through by a driver into {@link EngineOptions}. */
public final class EngineOptionsParser {

  public static EngineOptions parse(Iterable<String> args) {
    EngineOptions.Builder builder = EngineOptions.builder();
    parse(builder, args);
    return builder.build();
  }

  /** Parses arguments into an existing builder, overriding the values it already holds. */
  public static void parse(EngineOptions.Builder builder, Iterable<String> args) {
    Deque<String> argumentDeque = new ArrayDeque<>();
    for (String arg : args) {
      if (!arg.isEmpty()) {
        argumentDeque.addLast(arg);
      }
    }
    parse(builder, argumentDeque);
  }

  private static void parse(EngineOptions.Builder builder, Deque<String> argumentDeque) {
    while (!argumentDeque.isEmpty()) {
      String next = argumentDeque.removeFirst();
      switch (next) {
        case "--solver_timeout_ms":
          builder.setSolverTimeout(Duration.ofMillis(readLong(next, argumentDeque)));
          break;
        case "--max_disjuncts":
          builder.setMaxDisjuncts(readInt(next, argumentDeque));
          break;
        case "--max_constraints":
          builder.setMaxConstraints(readInt(next, argumentDeque));
          break;
        case "--parallelism":
          builder.setParallelism(readInt(next, argumentDeque));
          break;
        case "--session_seed":
          builder.setSessionSeed(readOne(next, argumentDeque));
          break;
        case "--high_confidence_distance":
          builder.setHighConfidenceDistance(readInt(next, argumentDeque));
          break;
        case "--max_rename_distance":
          builder.setMaxRenameDistance(readInt(next, argumentDeque));
          break;
        case "--max_rename_candidates":
          builder.setMaxRenameCandidates(readInt(next, argumentDeque));
          break;
        default:
          throw new IllegalArgumentException("unknown option: " + next);
      }
    }
  }

  /**
   * Returns the value of an option, or throws {@link IllegalArgumentException} if the value is not
   * present.
   */
  private static String readOne(String flag, Deque<String> argumentDeque) {
    if (argumentDeque.isEmpty() || argumentDeque.getFirst().startsWith("--")) {
      throw new IllegalArgumentException("missing required argument for: " + flag);
    }
    return argumentDeque.removeFirst();
  }

  private static int readInt(String flag, Deque<String> argumentDeque) {
    return Ints.checkedCast(readLong(flag, argumentDeque));
  }

  private static long readLong(String flag, Deque<String> argumentDeque) {
    String value = readOne(flag, argumentDeque);
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("expected a number for " + flag + ", found: " + value, e);
    }
  }

  /** The flags this parser understands, for driver help output. */
  public static ImmutableList<String> flags() {
    return ImmutableList.of(
        "--solver_timeout_ms",
        "--max_disjuncts",
        "--max_constraints",
        "--parallelism",
        "--session_seed",
        "--high_confidence_distance",
        "--max_rename_distance",
        "--max_rename_candidates");
  }

  private EngineOptionsParser() {}
}
