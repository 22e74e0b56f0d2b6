package org.obligato.binder;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.obligato.tree.Trees.and;
import static org.obligato.tree.Trees.gt;
import static org.obligato.tree.Trees.ident;
import static org.obligato.tree.Trees.lit;
import static org.obligato.tree.Trees.lt;
import static org.obligato.tree.Trees.ne;

import com.google.common.collect.ImmutableList;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.obligato.tree.NodeId;
import org.obligato.type.Type;

@RunWith(JUnit4.class)
public class FactContextTest {

  private static final NodeId ORIGIN = NodeId.root("facts");

  private FactContext ctx;

  @Before
  public void setUp() {
    ctx = new FactContext();
    ctx.enterScope(ScopeKind.FUNCTION);
    ctx.bind("x", Type.INT, true, BindingKind.PARAMETER, ORIGIN);
    ctx.bind("y", Type.INT, false, BindingKind.PARAMETER, ORIGIN);
  }

  private static ImmutableList<String> texts(ImmutableList<Fact> facts) {
    return facts.stream().map(Fact::text).collect(toImmutableList());
  }

  @Test
  public void conjunctionsAreSplitAndDeduplicated() {
    ctx.assume(
        and(gt(ident("x"), lit(0)), lt(ident("y"), lit(9))), Provenance.PRECONDITION, ORIGIN);
    ctx.assume(gt(ident("x"), lit(0)), Provenance.BRANCH_CONDITION, ORIGIN);
    ctx.assume(lit(true), Provenance.GUARD, ORIGIN);
    assertEquals(ImmutableList.of("x > 0", "y < 9"), texts(ctx.visibleFacts()));
    assertEquals(Provenance.PRECONDITION, ctx.visibleFacts().get(0).provenance());
  }

  @Test
  public void factsDieWithTheirScope() {
    ctx.assume(gt(ident("x"), lit(0)), Provenance.PRECONDITION, ORIGIN);
    ctx.enterScope(ScopeKind.BLOCK);
    ctx.assume(ne(ident("y"), lit(0)), Provenance.BRANCH_CONDITION, ORIGIN);
    assertEquals(ImmutableList.of("x > 0", "y != 0"), texts(ctx.visibleFacts()));
    ctx.exitScope();
    assertEquals(ImmutableList.of("x > 0"), texts(ctx.visibleFacts()));
  }

  @Test
  public void invalidateHidesFactsAboutTheBinding() {
    ctx.assume(gt(ident("x"), lit(0)), Provenance.PRECONDITION, ORIGIN);
    ctx.assume(gt(ident("y"), ident("x")), Provenance.PRECONDITION, ORIGIN);
    ctx.assume(gt(ident("y"), lit(1)), Provenance.PRECONDITION, ORIGIN);
    ctx.invalidate("x");
    assertEquals(ImmutableList.of("y > 1"), texts(ctx.visibleFacts()));
    ctx.assume(gt(ident("x"), lit(3)), Provenance.LET_DEFINITION, ORIGIN);
    assertEquals(ImmutableList.of("y > 1", "x > 3"), texts(ctx.visibleFacts()));
  }

  @Test
  public void invalidationInsideABranchOutlivesIt() {
    ctx.assume(gt(ident("x"), lit(0)), Provenance.PRECONDITION, ORIGIN);
    ctx.enterScope(ScopeKind.BRANCH);
    ctx.invalidate("x");
    ctx.exitScope();
    assertEquals(ImmutableList.of(), texts(ctx.visibleFacts()));
  }

  @Test
  public void shadowingHidesOuterFactsUntilTheScopeExits() {
    ctx.assume(gt(ident("x"), lit(0)), Provenance.PRECONDITION, ORIGIN);
    ctx.enterScope(ScopeKind.BLOCK);
    Binding inner = ctx.bind("x", Type.INT, false, BindingKind.LET, ORIGIN);
    assertEquals(inner, ctx.lookup("x").get());
    assertEquals(ImmutableList.of(), texts(ctx.visibleFacts()));
    ctx.exitScope();
    assertEquals(ImmutableList.of("x > 0"), texts(ctx.visibleFacts()));
  }

  @Test
  public void branchLocalFactsDoNotEscape() {
    ctx.enterScope(ScopeKind.BRANCH);
    ctx.bind("t", Type.INT, false, BindingKind.LET, ORIGIN);
    ctx.assume(gt(ident("t"), lit(0)), Provenance.LET_DEFINITION, ORIGIN);
    ctx.assume(gt(ident("x"), lit(0)), Provenance.BRANCH_CONDITION, ORIGIN);
    ImmutableList<Fact> surviving = ctx.exitBranch();
    assertEquals(ImmutableList.of("x > 0"), texts(surviving));
    assertEquals(1, ctx.depth());
  }

  @Test
  public void mergeKeepsOnlyCommonFacts() {
    ctx.enterScope(ScopeKind.BRANCH);
    ctx.assume(gt(ident("x"), lit(0)), Provenance.BRANCH_CONDITION, ORIGIN);
    ctx.assume(ne(ident("y"), lit(0)), Provenance.BRANCH_CONDITION, ORIGIN);
    ImmutableList<Fact> then = ctx.exitBranch();
    ctx.enterScope(ScopeKind.BRANCH);
    ctx.assume(ne(ident("y"), lit(0)), Provenance.BRANCH_CONDITION, ORIGIN);
    ImmutableList<Fact> orElse = ctx.exitBranch();

    ctx.merge(ImmutableList.of(then, orElse), false, ORIGIN);
    assertEquals(ImmutableList.of("y != 0"), texts(ctx.visibleFacts()));
    assertEquals(Provenance.BRANCH_MERGE, ctx.visibleFacts().get(0).provenance());
  }

  @Test
  public void guardedMergeRecordsGuardProvenance() {
    ctx.enterScope(ScopeKind.BRANCH);
    ctx.assume(ne(ident("y"), lit(0)), Provenance.BRANCH_CONDITION, ORIGIN);
    ctx.merge(ImmutableList.of(ctx.exitBranch()), true, ORIGIN);
    assertEquals(Provenance.GUARD, ctx.visibleFacts().get(0).provenance());
  }

  @Test
  public void mergeOfNoBranchesKeepsNothingNew() {
    ctx.assume(gt(ident("x"), lit(0)), Provenance.PRECONDITION, ORIGIN);
    ctx.merge(ImmutableList.of(), false, ORIGIN);
    assertEquals(ImmutableList.of("x > 0"), texts(ctx.visibleFacts()));
  }

  @Test
  public void visibleBindingsAreSortedInnermostFirst() {
    ctx.enterScope(ScopeKind.BLOCK);
    ctx.bind("a", Type.BOOL, false, BindingKind.LET, ORIGIN);
    Binding x = ctx.bind("x", Type.BOOL, false, BindingKind.LET, ORIGIN);
    ImmutableList<Binding> visible = ctx.visibleBindings();
    assertEquals(
        ImmutableList.of("a", "x", "y"),
        visible.stream().map(Binding::name).collect(toImmutableList()));
    assertTrue(visible.contains(x));
  }
}
