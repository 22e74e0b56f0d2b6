package org.obligato.options;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EngineOptionsParserTest {

  @Test
  public void noArgumentsGiveDefaults() {
    assertEquals(EngineOptions.defaults(), EngineOptionsParser.parse(ImmutableList.of()));
  }

  @Test
  public void parsesEveryFlag() {
    EngineOptions options =
        EngineOptionsParser.parse(
            ImmutableList.of(
                "--solver_timeout_ms", "500",
                "--max_disjuncts", "8",
                "--max_constraints", "100",
                "--parallelism", "4",
                "--session_seed", "s1",
                "--high_confidence_distance", "2",
                "--max_rename_distance", "4",
                "--max_rename_candidates", "5"));
    assertEquals(Duration.ofMillis(500), options.solverTimeout());
    assertEquals(8, options.maxDisjuncts());
    assertEquals(100, options.maxConstraints());
    assertEquals(4, options.parallelism());
    assertEquals("s1", options.sessionSeed());
    assertEquals(2, options.highConfidenceDistance());
    assertEquals(4, options.maxRenameDistance());
    assertEquals(5, options.maxRenameCandidates());
  }

  @Test
  public void laterFlagsWin() {
    EngineOptions options =
        EngineOptionsParser.parse(ImmutableList.of("--parallelism", "2", "--parallelism", "3"));
    assertEquals(3, options.parallelism());
  }

  @Test
  public void parseIntoExistingBuilder() {
    EngineOptions.Builder builder = EngineOptions.defaults().toBuilder().setSessionSeed("kept");
    EngineOptionsParser.parse(builder, ImmutableList.of("--max_disjuncts", "2"));
    EngineOptions options = builder.build();
    assertEquals("kept", options.sessionSeed());
    assertEquals(2, options.maxDisjuncts());
  }

  @Test
  public void unknownFlag() {
    try {
      EngineOptionsParser.parse(ImmutableList.of("--verbose"));
      fail();
    } catch (IllegalArgumentException e) {
      assertEquals("unknown option: --verbose", e.getMessage());
    }
  }

  @Test
  public void missingValue() {
    try {
      EngineOptionsParser.parse(ImmutableList.of("--parallelism", "--session_seed", "x"));
      fail();
    } catch (IllegalArgumentException e) {
      assertEquals("missing required argument for: --parallelism", e.getMessage());
    }
  }

  @Test
  public void notANumber() {
    try {
      EngineOptionsParser.parse(ImmutableList.of("--max_constraints", "many"));
      fail();
    } catch (IllegalArgumentException e) {
      assertEquals("expected a number for --max_constraints, found: many", e.getMessage());
    }
  }

  @Test
  public void inconsistentBudgetsAreRejected() {
    try {
      EngineOptionsParser.parse(ImmutableList.of("--parallelism", "0"));
      fail();
    } catch (IllegalArgumentException e) {
      assertEquals("parallelism must be at least 1", e.getMessage());
    }
    try {
      EngineOptionsParser.parse(ImmutableList.of("--high_confidence_distance", "5"));
      fail();
    } catch (IllegalArgumentException e) {
      assertEquals(
          "high confidence distance exceeds the maximum rename distance", e.getMessage());
    }
  }
}
