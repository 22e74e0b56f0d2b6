package org.obligato.repair;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.obligato.binder.GlobalEnv;
import org.obligato.diag.Diagnostic;
import org.obligato.extract.Obligation;
import org.obligato.extract.TypedHole;
import org.obligato.options.EngineOptions;
import org.obligato.tree.Ast;
import org.obligato.tree.Tree.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the repair candidates of a pass. Each diagnostic, undischarged obligation and hole is
 * handled by its own task; the results are put back together in report order, so the ids and the
 * ranking do not depend on scheduling.
 */
public final class RepairSynthesizer {

  private static final Logger logger = LoggerFactory.getLogger(RepairSynthesizer.class);

  private final GlobalEnv env;
  private final EngineOptions options;
  private final ListeningExecutorService executor;

  public RepairSynthesizer(
      GlobalEnv env, EngineOptions options, ListeningExecutorService executor) {
    this.env = env;
    this.options = options;
    this.executor = executor;
  }

  /** Synthesizes repairs for reported (sorted) diagnostics, obligations and holes. */
  public Synthesis synthesize(
      Ast ast,
      ImmutableList<Diagnostic> diagnostics,
      ImmutableList<Obligation> obligations,
      ImmutableList<TypedHole> holes) {
    RepairContext cx = new RepairContext(ast, env, options, obligations);
    DiagnosticRepairs diagnosticRepairs = new DiagnosticRepairs(cx);
    ObligationRepairs obligationRepairs = new ObligationRepairs(cx);

    List<ListenableFuture<List<RepairCandidate.Builder>>> tasks = new ArrayList<>();
    for (Diagnostic diagnostic : diagnostics) {
      tasks.add(executor.submit(() -> diagnosticRepairs.repairs(diagnostic)));
    }
    for (Obligation obligation : obligations) {
      tasks.add(executor.submit(() -> obligationRepairs.repairs(obligation)));
    }
    for (TypedHole hole : holes) {
      tasks.add(executor.submit(() -> fillHole(cx, hole)));
    }
    List<List<RepairCandidate.Builder>> drafts;
    try {
      drafts = Futures.getUnchecked(Futures.allAsList(tasks));
    } catch (UncheckedExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw e;
    }

    Set<String> ids = new HashSet<>();
    List<ImmutableList<RepairCandidate>> groups = new ArrayList<>();
    for (List<RepairCandidate.Builder> group : drafts) {
      List<RepairCandidate> built = new ArrayList<>();
      for (RepairCandidate.Builder draft : group) {
        String base = "rp-" + draft.template() + "-" + draft.edits().get(0).target();
        String id = base;
        for (int k = 2; !ids.add(id); k++) {
          id = base + "-" + k;
        }
        built.add(draft.setId(id).build());
      }
      built.sort(RepairCandidate.RANKING);
      groups.add(ImmutableList.copyOf(built));
    }

    ImmutableList.Builder<RepairCandidate> repairs = ImmutableList.builder();
    ImmutableList.Builder<Diagnostic> annotatedDiagnostics = ImmutableList.builder();
    ImmutableList.Builder<Obligation> annotatedObligations = ImmutableList.builder();
    int next = 0;
    for (Diagnostic diagnostic : diagnostics) {
      ImmutableList<RepairCandidate> group = groups.get(next++);
      repairs.addAll(group);
      annotatedDiagnostics.add(diagnostic.withRepairRefs(refs(group)));
    }
    for (Obligation obligation : obligations) {
      ImmutableList<RepairCandidate> group = groups.get(next++);
      repairs.addAll(group);
      annotatedObligations.add(obligation.withRepairRefs(refs(group)));
    }
    for (int i = 0; i < holes.size(); i++) {
      repairs.addAll(groups.get(next++));
    }
    ImmutableList<RepairCandidate> result = repairs.build();
    logger.debug("synthesized {} repair(s)", result.size());
    return Synthesis.create(annotatedDiagnostics.build(), annotatedObligations.build(), result);
  }

  private static ImmutableList<String> refs(List<RepairCandidate> group) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (RepairCandidate candidate : group) {
      result.add(candidate.id());
    }
    return result.build();
  }

  private static List<RepairCandidate.Builder> fillHole(RepairContext cx, TypedHole hole) {
    Optional<Expression> value = RepairContext.defaultValue(hole.expectedType());
    if (value.isEmpty()) {
      return ImmutableList.of();
    }
    ImmutableList<PatchOp> edits = ImmutableList.of(PatchOp.replace(hole.id(), value.get()));
    return ImmutableList.of(
        RepairCandidate.builder()
            .setTemplate("fill_hole")
            .setTitle("fill ?" + hole.name() + " with a default " + hole.expectedType().base())
            .setConfidence(Confidence.LOW)
            .setSafety(Safety.BEHAVIOR_CHANGING)
            .setKind(RepairKind.SEMANTICS_CHANGE)
            .setScope(RepairContext.scope(edits, false))
            .setTargets(
                Targets.builder()
                    .setNodeIds(ImmutableList.of(hole.id()))
                    .setHoleIds(ImmutableList.of(hole.id().toString()))
                    .build())
            .setEdits(edits)
            .setExpectedDelta(
                ExpectedDelta.create(
                    ImmutableList.of(), ImmutableList.of(), ImmutableList.of(hole.id().toString())))
            .setRationale("a placeholder value, not a considered one"));
  }
}
