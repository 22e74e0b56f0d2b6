package org.obligato.apply;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.obligato.tree.Trees.block;
import static org.obligato.tree.Trees.call;
import static org.obligato.tree.Trees.div;
import static org.obligato.tree.Trees.exprStmt;
import static org.obligato.tree.Trees.fn;
import static org.obligato.tree.Trees.gt;
import static org.obligato.tree.Trees.ident;
import static org.obligato.tree.Trees.ifThen;
import static org.obligato.tree.Trees.intTy;
import static org.obligato.tree.Trees.lit;
import static org.obligato.tree.Trees.str;
import static org.obligato.tree.Trees.unit;
import static org.obligato.tree.Trees.valueBlock;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.obligato.tree.Ast;
import org.obligato.tree.NodeId;

@RunWith(JUnit4.class)
public class CanonicalizerTest {

  private static Ast program() {
    return Ast.of(
        unit(
            fn("ratio")
                .param("n", intTy())
                .param("d", intTy())
                .returns(intTy())
                .body(valueBlock(div(ident("n"), ident("d")))),
            fn("say")
                .param("n", intTy())
                .effect("IO")
                .body(
                    exprStmt(
                        ifThen(
                            gt(ident("n"), lit(0)),
                            block(exprStmt(call("print", str("+")))))))),
        "canon");
  }

  @Test
  public void makesReturnsAndElsesExplicit() {
    assertEquals(
        "fn ratio(n: Int, d: Int) -> Int {\n"
            + "  return n / d;\n"
            + "}\n"
            + "\n"
            + "fn say(n: Int) -> Unit ! {IO} {\n"
            + "  if n > 0 {\n"
            + "    print(\"+\");\n"
            + "  } else {}\n"
            + "}\n",
        Canonicalizer.canonicalize(program()).toString());
  }

  @Test
  public void isIdempotent() {
    Ast once = Canonicalizer.canonicalize(program());
    Ast twice = Canonicalizer.canonicalize(once);
    assertEquals(once, twice);
    assertEquals(once.print(), twice.print());
  }

  @Test
  public void keepsExistingIds() {
    Ast ast = program();
    Ast canonical = Canonicalizer.canonicalize(ast);
    for (NodeId id : ast.ids()) {
      assertTrue(id.toString(), canonical.contains(id));
    }
  }
}
