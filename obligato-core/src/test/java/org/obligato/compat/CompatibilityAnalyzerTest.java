package org.obligato.compat;

import static com.google.common.collect.MoreCollectors.onlyElement;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.obligato.tree.Trees.div;
import static org.obligato.tree.Trees.fn;
import static org.obligato.tree.Trees.hole;
import static org.obligato.tree.Trees.ident;
import static org.obligato.tree.Trees.intTy;
import static org.obligato.tree.Trees.let;
import static org.obligato.tree.Trees.lit;
import static org.obligato.tree.Trees.ne;
import static org.obligato.tree.Trees.plus;
import static org.obligato.tree.Trees.ret;
import static org.obligato.tree.Trees.unit;
import static org.obligato.tree.Trees.valueBlock;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.obligato.apply.Canonicalizer;
import org.obligato.model.Effect;
import org.obligato.model.EffectSet;
import org.obligato.repair.Confidence;
import org.obligato.repair.ExpectedDelta;
import org.obligato.repair.PatchOp;
import org.obligato.repair.RepairCandidate;
import org.obligato.repair.RepairKind;
import org.obligato.repair.RepairScope;
import org.obligato.repair.Safety;
import org.obligato.repair.Targets;
import org.obligato.tree.Ast;
import org.obligato.tree.NodeId;
import org.obligato.tree.Tree;

@RunWith(JUnit4.class)
public class CompatibilityAnalyzerTest {

  private final Ast ast =
      Canonicalizer.canonicalize(
          Ast.of(
              unit(
                  fn("ratio")
                      .param("n", intTy())
                      .param("d", intTy())
                      .returns(intTy())
                      .body(valueBlock(div(ident("n"), ident("d"))))),
              "compat"));

  private NodeId find(Tree.Kind kind) {
    return ast.ids().stream().filter(id -> ast.node(id).kind() == kind).collect(onlyElement());
  }

  private NodeId param(String name) {
    return ast.ids().stream()
        .filter(id -> ast.node(id).kind() == Tree.Kind.PARAM)
        .filter(id -> ((Tree.Param) ast.node(id)).name().equals(name))
        .collect(onlyElement());
  }

  private PatchOp insertLet() {
    return PatchOp.insertBefore(find(Tree.Kind.RETURN), let("k", lit(1)));
  }

  private static RepairCandidate candidate(
      String id, String problem, ImmutableList<PatchOp> prerequisites, PatchOp... edits) {
    return RepairCandidate.builder()
        .setId(id)
        .setTemplate("test")
        .setTitle(id)
        .setConfidence(Confidence.HIGH)
        .setSafety(Safety.LIKELY_PRESERVING)
        .setKind(RepairKind.LOCAL_FIX)
        .setScope(RepairScope.create(1, false))
        .setTargets(Targets.builder().setObligationIds(ImmutableList.of(problem)).build())
        .setEdits(ImmutableList.copyOf(edits))
        .setExpectedDelta(
            ExpectedDelta.create(ImmutableList.of(), ImmutableList.of(problem), ImmutableList.of()))
        .setRationale("")
        .setPrerequisites(prerequisites)
        .build();
  }

  private static RepairCandidate candidate(String id, String problem, PatchOp... edits) {
    return candidate(id, problem, ImmutableList.of(), edits);
  }

  private ImmutableList<RepairCandidate> analyze(RepairCandidate... repairs) {
    return new CompatibilityAnalyzer(ast).analyze(ImmutableList.copyOf(repairs));
  }

  @Test
  public void alternativesForOneProblemConflict() {
    ImmutableList<RepairCandidate> result =
        analyze(
            candidate("rp-a", "ob-1", insertLet()),
            candidate(
                "rp-b",
                "ob-1",
                PatchOp.addRefinement(param("d"), "v", ne(ident("v"), lit(0)))));
    assertEquals(ImmutableList.of("rp-b"), result.get(0).compatibility().conflictsWith());
    assertEquals(ImmutableList.of("rp-a"), result.get(1).compatibility().conflictsWith());
    assertNotEquals(
        result.get(0).compatibility().batchKey(), result.get(1).compatibility().batchKey());
  }

  @Test
  public void disjointRepairsShareABatch() {
    ImmutableList<RepairCandidate> result =
        analyze(
            candidate("rp-a", "ob-1", insertLet()),
            candidate(
                "rp-b",
                "ob-2",
                PatchOp.addRefinement(param("d"), "v", ne(ident("v"), lit(0)))));
    for (RepairCandidate repair : result) {
      assertEquals(ImmutableList.of(), repair.compatibility().conflictsWith());
      assertEquals(Optional.of("b0"), repair.compatibility().batchKey());
    }
  }

  @Test
  public void overlappingStructuralEditsConflict() {
    NodeId division = find(Tree.Kind.BINARY);
    ImmutableList<RepairCandidate> result =
        analyze(
            candidate("rp-a", "ob-1", PatchOp.wrap(division, plus(hole(PatchOp.ORIGINAL), lit(0)))),
            candidate("rp-b", "ob-2", PatchOp.replace(find(Tree.Kind.RETURN), ret(lit(0)))));
    assertEquals(ImmutableList.of("rp-b"), result.get(0).compatibility().conflictsWith());
    assertEquals(Optional.of("b0"), result.get(0).compatibility().batchKey());
    assertEquals(Optional.of("b1"), result.get(1).compatibility().batchKey());
  }

  @Test
  public void identicalEditsForDifferentProblemsAreCompatible() {
    PatchOp insert = insertLet();
    ImmutableList<RepairCandidate> result =
        analyze(candidate("rp-a", "ob-1", insert), candidate("rp-b", "ob-2", insert));
    assertEquals(ImmutableList.of(), result.get(0).compatibility().conflictsWith());
    assertEquals(
        result.get(0).compatibility().batchKey(), result.get(1).compatibility().batchKey());
  }

  @Test
  public void twoWideningsOfOneFunctionConflict() {
    NodeId fn = find(Tree.Kind.FN_DECL);
    ImmutableList<RepairCandidate> result =
        analyze(
            candidate("rp-a", "ob-1", PatchOp.widenEffect(fn, EffectSet.of(Effect.of("IO")))),
            candidate("rp-b", "ob-2", PatchOp.widenEffect(fn, EffectSet.of(Effect.of("IO")))));
    assertEquals(ImmutableList.of("rp-b"), result.get(0).compatibility().conflictsWith());
  }

  @Test
  public void prerequisitesOrderBatches() {
    NodeId fn = find(Tree.Kind.FN_DECL);
    PatchOp widen = PatchOp.widenEffect(fn, EffectSet.of(Effect.of("IO")));
    ImmutableList<RepairCandidate> result =
        analyze(
            candidate(
                "rp-a",
                "ob-1",
                ImmutableList.of(widen),
                insertLet()),
            candidate("rp-b", "ob-2", widen));
    assertEquals(ImmutableList.of("rp-b"), result.get(0).compatibility().requires());
    assertEquals(Optional.of("b1"), result.get(0).compatibility().batchKey());
    assertEquals(Optional.of("b0"), result.get(1).compatibility().batchKey());
  }
}
