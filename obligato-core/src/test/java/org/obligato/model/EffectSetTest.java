package org.obligato.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EffectSetTest {

  private static final Effect IO = Effect.of("IO");
  private static final Effect RANDOM = Effect.of("Random");

  @Test
  public void canonicalOrder() {
    assertEquals("{IO, Random}", EffectSet.of(RANDOM, IO, IO).toString());
    assertEquals(EffectSet.of(IO, RANDOM), EffectSet.of(RANDOM, IO));
    assertEquals("{}", EffectSet.PURE.toString());
  }

  @Test
  public void pureIsASubsetOfEverything() {
    assertTrue(EffectSet.PURE.isSubsetOf(EffectSet.PURE));
    assertTrue(EffectSet.PURE.isSubsetOf(EffectSet.of(IO)));
    assertFalse(EffectSet.of(IO).isSubsetOf(EffectSet.PURE));
  }

  @Test
  public void missingEffects() {
    EffectSet used = EffectSet.of(IO, RANDOM);
    assertEquals(EffectSet.of(RANDOM), used.missingFrom(EffectSet.of(IO)));
    assertTrue(used.missingFrom(used).isPure());
    assertEquals(used, EffectSet.of(IO).union(EffectSet.of(RANDOM)));
  }

  @Test
  public void payloadsAreCovariant() {
    Effect stateInt = Effect.of("State", "Int");
    assertTrue(stateInt.isSubEffectOf(Effect.of("State")));
    assertTrue(stateInt.isSubEffectOf(Effect.of("State", Effect.TOP_PAYLOAD)));
    assertTrue(Effect.of("State", Effect.BOTTOM_PAYLOAD).isSubEffectOf(stateInt));
    assertFalse(Effect.of("State").isSubEffectOf(stateInt));
    assertFalse(stateInt.isSubEffectOf(Effect.of("State", "Real")));
    assertFalse(stateInt.isSubEffectOf(IO));
    assertEquals("State[Int]", stateInt.toString());
  }
}
