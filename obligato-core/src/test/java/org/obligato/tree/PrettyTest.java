package org.obligato.tree;

import static org.junit.Assert.assertEquals;
import static org.obligato.tree.Trees.and;
import static org.obligato.tree.Trees.call;
import static org.obligato.tree.Trees.fail;
import static org.obligato.tree.Trees.fn;
import static org.obligato.tree.Trees.gt;
import static org.obligato.tree.Trees.hole;
import static org.obligato.tree.Trees.ident;
import static org.obligato.tree.Trees.ifElse;
import static org.obligato.tree.Trees.intTy;
import static org.obligato.tree.Trees.let;
import static org.obligato.tree.Trees.lit;
import static org.obligato.tree.Trees.minus;
import static org.obligato.tree.Trees.not;
import static org.obligato.tree.Trees.plus;
import static org.obligato.tree.Trees.refined;
import static org.obligato.tree.Trees.ret;
import static org.obligato.tree.Trees.str;
import static org.obligato.tree.Trees.times;
import static org.obligato.tree.Trees.valueBlock;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PrettyTest {

  @Test
  public void parenthesizesByPrecedence() {
    assertEquals(
        "(a + b) * 2", Pretty.pretty(times(plus(ident("a"), ident("b")), lit(2))));
    assertEquals("a + b * 2", Pretty.pretty(plus(ident("a"), times(ident("b"), lit(2)))));
    assertEquals("a - (b - c)", Pretty.pretty(minus(ident("a"), minus(ident("b"), ident("c")))));
    assertEquals("a - b - c", Pretty.pretty(minus(minus(ident("a"), ident("b")), ident("c"))));
  }

  @Test
  public void printsCallsAndNegation() {
    assertEquals(
        "!(x > 0 && len(xs) > x)",
        Pretty.pretty(
            not(and(gt(ident("x"), lit(0)), gt(call("len", ident("xs")), ident("x"))))));
  }

  @Test
  public void printsGuardTemplate() {
    assertEquals(
        "if d > 0 {\n  ?original\n} else {\n  fail(\"d > 0 violated\")\n}",
        Pretty.pretty(
            ifElse(
                gt(ident("d"), lit(0)),
                valueBlock(hole("original")),
                valueBlock(fail("d > 0 violated")))));
  }

  @Test
  public void printsFunctions() {
    assertEquals(
        "fn pos(x: {v: Int | v > 0}) -> Int ! {IO} {\n"
            + "  let s = \"x\";\n"
            + "  return x;\n"
            + "}",
        Pretty.pretty(
            fn("pos")
                .param("x", refined(intTy(), "v", gt(ident("v"), lit(0))))
                .returns(intTy())
                .effect("IO")
                .body(let("s", str("x")), ret(ident("x")))));
  }
}
