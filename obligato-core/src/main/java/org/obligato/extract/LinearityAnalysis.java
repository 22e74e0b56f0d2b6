package org.obligato.extract;

import java.util.List;
import java.util.Optional;
import org.obligato.tree.Children;
import org.obligato.tree.Tree;
import org.obligato.tree.Tree.Block;
import org.obligato.tree.Tree.Expression;
import org.obligato.tree.Tree.Stmt;

/**
 * Counts, along every control-flow path, how many times a linear binding is used between its
 * declaration and the end of its scope. A use count is tracked as a set of possibilities (zero,
 * one, more than one); paths that fail are not counted, since a failing program releases
 * everything.
 */
public final class LinearityAnalysis {

  private static final int ZERO = 1;
  private static final int ONE = 2;
  private static final int MANY = 4;

  /** The use counts observed where control leaves a binding's scope. */
  public static final class Verdict {
    private final int returns;
    private final int fallthrough;

    private Verdict(int returns, int fallthrough) {
      this.returns = returns;
      this.fallthrough = fallthrough;
    }

    /** Some path leaves the scope without using the binding. */
    public boolean unused() {
      return ((returns | fallthrough) & ZERO) != 0;
    }

    /** Some path uses the binding more than once. */
    public boolean reused() {
      return ((returns | fallthrough) & MANY) != 0;
    }

    public boolean ok() {
      return !unused() && !reused();
    }

    /**
     * Every return uses the binding and no path that falls off the end of the scope does, so a
     * single use appended to the scope makes every path use it exactly once.
     */
    public boolean closableAtEnd() {
      return fallthrough == ZERO && (returns & (ZERO | MANY)) == 0;
    }
  }

  /** Analyzes {@code name}, whose scope continues with {@code stmts} and {@code tail}. */
  public static Verdict analyze(String name, List<Stmt> stmts, Optional<Expression> tail) {
    LinearityAnalysis analysis = new LinearityAnalysis(name);
    int end = analysis.stmts(stmts, tail, ZERO);
    return new Verdict(analysis.exits, end);
  }

  private final String name;
  private int exits = 0;
  private boolean shadowed = false;

  private LinearityAnalysis(String name) {
    this.name = name;
  }

  private static int use(int state) {
    int result = 0;
    if ((state & ZERO) != 0) {
      result |= ONE;
    }
    if ((state & (ONE | MANY)) != 0) {
      result |= MANY;
    }
    return result;
  }

  private int stmts(List<Stmt> stmts, Optional<Expression> tail, int state) {
    boolean saved = shadowed;
    for (Stmt stmt : stmts) {
      state = stmt(stmt, state);
    }
    if (tail.isPresent()) {
      state = expr(tail.get(), state);
    }
    shadowed = saved;
    return state;
  }

  private int block(Block block, int state) {
    return stmts(block.stmts(), block.tail(), state);
  }

  private int stmt(Stmt stmt, int state) {
    if (state == 0) {
      return 0;
    }
    switch (stmt.kind()) {
      case LET:
        {
          Tree.Let let = (Tree.Let) stmt;
          state = expr(let.init(), state);
          if (let.name().equals(name)) {
            shadowed = true;
          }
          return state;
        }
      case ASSIGN:
        return expr(((Tree.Assign) stmt).value(), state);
      case EXPR_STMT:
        return expr(((Tree.ExprStmt) stmt).expr(), state);
      case RETURN:
        {
          Optional<Expression> value = ((Tree.Return) stmt).expr();
          if (value.isPresent()) {
            state = expr(value.get(), state);
          }
          exits |= state;
          return 0;
        }
      case WHILE:
        {
          Tree.While loop = (Tree.While) stmt;
          int s0 = expr(loop.cond(), state);
          int s1 = expr(loop.cond(), block(loop.body(), s0));
          int s2 = expr(loop.cond(), block(loop.body(), s1));
          return s0 | s1 | s2;
        }
      case FOR:
        {
          Tree.For loop = (Tree.For) stmt;
          int s0 = expr(loop.iterable(), state);
          boolean saved = shadowed;
          shadowed |= loop.var().equals(name);
          int s1 = block(loop.body(), s0);
          int s2 = block(loop.body(), s1);
          shadowed = saved;
          return s0 | s1 | s2;
        }
      default:
        throw new AssertionError(stmt.kind());
    }
  }

  private int expr(Expression e, int state) {
    if (state == 0) {
      return 0;
    }
    switch (e.kind()) {
      case IDENT:
        return !shadowed && ((Tree.Ident) e).name().equals(name) ? use(state) : state;
      case IF:
        {
          Tree.If ifExpr = (Tree.If) e;
          int cond = expr(ifExpr.cond(), state);
          int then = block(ifExpr.then(), cond);
          int orElse = ifExpr.orElse().isPresent() ? block(ifExpr.orElse().get(), cond) : cond;
          return then | orElse;
        }
      case MATCH:
        {
          Tree.Match match = (Tree.Match) e;
          int scrutinee = expr(match.scrutinee(), state);
          int result = 0;
          for (Tree.MatchArm arm : match.arms()) {
            boolean saved = shadowed;
            if (arm.pattern().kind() == Tree.Kind.PAT_BIND
                && ((Tree.BindPat) arm.pattern()).name().equals(name)) {
              shadowed = true;
            }
            result |= block(arm.body(), scrutinee);
            shadowed = saved;
          }
          return result;
        }
      case BLOCK:
        return block((Block) e, state);
      case FAIL:
        return 0;
      case QUANTIFIED:
        return state;
      default:
        for (Children.Child child : Children.of(e)) {
          Tree tree = child.tree();
          if (tree instanceof Expression) {
            state = expr((Expression) tree, state);
          } else if (tree.kind() == Tree.Kind.FIELD_INIT) {
            state = expr(((Tree.FieldInit) tree).value(), state);
          }
        }
        return state;
    }
  }
}
