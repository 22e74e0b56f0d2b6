package org.obligato.extract;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.obligato.tree.Trees.block;
import static org.obligato.tree.Trees.call;
import static org.obligato.tree.Trees.exprStmt;
import static org.obligato.tree.Trees.fail;
import static org.obligato.tree.Trees.ident;
import static org.obligato.tree.Trees.ifElse;
import static org.obligato.tree.Trees.ifThen;
import static org.obligato.tree.Trees.let;
import static org.obligato.tree.Trees.lit;
import static org.obligato.tree.Trees.ret;
import static org.obligato.tree.Trees.whileLoop;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.obligato.tree.Tree.Stmt;

@RunWith(JUnit4.class)
public class LinearityAnalysisTest {

  private static LinearityAnalysis.Verdict analyze(Stmt... stmts) {
    return LinearityAnalysis.analyze("h", ImmutableList.copyOf(stmts), Optional.empty());
  }

  private static Stmt close() {
    return exprStmt(call("close_file", ident("h")));
  }

  @Test
  public void singleUse() {
    assertTrue(analyze(close()).ok());
  }

  @Test
  public void noUse() {
    LinearityAnalysis.Verdict verdict = analyze();
    assertTrue(verdict.unused());
    assertFalse(verdict.reused());
    assertTrue(verdict.closableAtEnd());
  }

  @Test
  public void doubleUse() {
    LinearityAnalysis.Verdict verdict = analyze(close(), close());
    assertTrue(verdict.reused());
    assertFalse(verdict.unused());
    assertFalse(verdict.closableAtEnd());
  }

  @Test
  public void useOnOneBranchOnly() {
    LinearityAnalysis.Verdict verdict =
        analyze(exprStmt(ifThen(ident("c"), block(close()))));
    assertTrue(verdict.unused());
    assertFalse(verdict.closableAtEnd());
  }

  @Test
  public void returnedOnOnePathAndDroppedOnTheOther() {
    LinearityAnalysis.Verdict verdict =
        analyze(exprStmt(ifThen(ident("c"), block(ret(ident("h"))))));
    assertTrue(verdict.unused());
    assertTrue(verdict.closableAtEnd());
  }

  @Test
  public void failingPathsAreNotCounted() {
    LinearityAnalysis.Verdict verdict =
        analyze(exprStmt(ifElse(ident("c"), block(exprStmt(fail("no"))), block(close()))));
    assertTrue(verdict.ok());
  }

  @Test
  public void shadowingEndsTracking() {
    LinearityAnalysis.Verdict verdict = analyze(let("h", lit(1)), close());
    assertTrue(verdict.unused());
  }

  @Test
  public void useInALoopMayRepeat() {
    LinearityAnalysis.Verdict verdict = analyze(whileLoop(ident("c"), close()));
    assertTrue(verdict.reused());
    assertTrue(verdict.unused());
  }
}
