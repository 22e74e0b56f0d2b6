package org.obligato.main;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PassStateTest {

  @Test
  public void repairLoop() {
    PassState state = PassState.PENDING;
    state = state.moveTo(PassState.SOLVED).moveTo(PassState.REPORTED);
    state = state.moveTo(PassState.APPLIED).moveTo(PassState.PENDING);
    state = state.moveTo(PassState.SOLVED).moveTo(PassState.REPORTED);
    assertEquals(PassState.SUCCESS, state.moveTo(PassState.SUCCESS));
  }

  @Test
  public void successIsTerminal() {
    for (PassState next : PassState.values()) {
      assertFalse(next.toString(), PassState.SUCCESS.canMoveTo(next));
    }
  }

  @Test
  public void reportingCannotBeSkipped() {
    assertFalse(PassState.SOLVED.canMoveTo(PassState.APPLIED));
    assertFalse(PassState.PENDING.canMoveTo(PassState.REPORTED));
    assertTrue(PassState.REPORTED.canMoveTo(PassState.APPLIED));
    try {
      PassState.SOLVED.moveTo(PassState.SUCCESS);
      fail();
    } catch (IllegalStateException e) {
      assertEquals("illegal pass transition solved -> success", e.getMessage());
    }
  }
}
