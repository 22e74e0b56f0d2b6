package org.obligato.main;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import org.obligato.apply.Canonicalizer;
import org.obligato.apply.PatchApplier;
import org.obligato.binder.GlobalEnv;
import org.obligato.compat.CompatibilityAnalyzer;
import org.obligato.diag.Diagnostic;
import org.obligato.diag.DiagnosticLog;
import org.obligato.diag.Reporter;
import org.obligato.extract.Extraction;
import org.obligato.extract.Obligation;
import org.obligato.extract.ObligationExtractor;
import org.obligato.extract.TypedHole;
import org.obligato.options.EngineOptions;
import org.obligato.repair.PatchOp;
import org.obligato.repair.RepairCandidate;
import org.obligato.repair.RepairSynthesizer;
import org.obligato.repair.Synthesis;
import org.obligato.solver.LinearArithmeticSolver;
import org.obligato.solver.Solver;
import org.obligato.solver.SolverOutcome;
import org.obligato.solver.UnknownCategory;
import org.obligato.tree.Ast;
import org.obligato.tree.Tree.CompUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The engine's entry point. A driver hands in a canonical tree, inspects the {@link
 * CompileResult}, selects repairs, applies them and checks the new tree, until it is satisfied.
 *
 * <p>Solving and repair synthesis run on a pool of {@link EngineOptions#parallelism()} threads,
 * or on the calling thread when that is 1. Results do not depend on the pool.
 */
public final class Obligato implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(Obligato.class);

  private final EngineOptions options;
  private final Solver solver;
  private final ListeningExecutorService executor;

  public Obligato(EngineOptions options) {
    this(options, new LinearArithmeticSolver(options));
  }

  public Obligato(EngineOptions options, Solver solver) {
    this.options = options;
    this.solver = solver;
    if (options.parallelism() == 1) {
      this.executor = MoreExecutors.newDirectExecutorService();
    } else {
      this.executor =
          MoreExecutors.listeningDecorator(
              Executors.newFixedThreadPool(
                  options.parallelism(),
                  new ThreadFactoryBuilder()
                      .setNameFormat("obligato-%d")
                      .setDaemon(true)
                      .build()));
    }
  }

  public EngineOptions options() {
    return options;
  }

  /** Indexes a driver's tree with this engine's session seed. */
  public Ast index(CompUnit unit) {
    return Ast.of(unit, options.sessionSeed());
  }

  /** Runs one pass over {@code input}, which is canonicalized first. */
  public CompileResult check(Ast input) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    PassState state = PassState.PENDING;
    Ast ast = Canonicalizer.canonicalize(input);

    DiagnosticLog log = new DiagnosticLog();
    GlobalEnv env = GlobalEnv.create(ast.root(), log);
    Extraction extraction = ObligationExtractor.extract(ast, env, log);
    ImmutableList<Obligation> decided = solve(extraction.obligations());
    state = state.moveTo(PassState.SOLVED);

    Reporter reporter = new Reporter(ast);
    Synthesis synthesis =
        new RepairSynthesizer(env, options, executor)
            .synthesize(
                ast,
                reporter.diagnostics(log.diagnostics()),
                reporter.obligations(decided),
                reporter.holes(extraction.holes()));
    ImmutableList<RepairCandidate> repairs =
        reporter.repairs(new CompatibilityAnalyzer(ast).analyze(synthesis.repairs()));
    ImmutableList<Diagnostic> diagnostics = synthesis.diagnostics();
    ImmutableList<Obligation> obligations = synthesis.obligations();
    ImmutableList<TypedHole> holes = reporter.holes(extraction.holes());
    reporter.verify(diagnostics, obligations, repairs);
    state = state.moveTo(PassState.REPORTED);

    CompileStatus status = status(diagnostics, obligations, holes);
    if (status == CompileStatus.SUCCESS) {
      state = state.moveTo(PassState.SUCCESS);
    }
    PassStats stats = stats(diagnostics, obligations, holes, repairs);
    logger.debug("pass finished in {}: {} {}", stopwatch, status, stats);
    return CompileResult.create(
        status, ast, repairs, diagnostics, obligations, holes, stats, state);
  }

  /** Applies edits to a tree and canonicalizes the result. */
  public Ast apply(Ast ast, List<PatchOp> ops) {
    return PatchApplier.apply(ast, ops);
  }

  /** Applies the edits of the selected repairs of a reported pass. */
  public Ast applyRepairs(CompileResult result, List<String> repairIds) {
    result.state().moveTo(PassState.APPLIED);
    List<PatchOp> ops = new ArrayList<>();
    for (String id : repairIds) {
      Optional<RepairCandidate> repair = result.repair(id);
      checkArgument(repair.isPresent(), "unknown repair %s", id);
      ops.addAll(repair.get().edits());
    }
    return apply(result.canonicalAst(), ops);
  }

  private ImmutableList<Obligation> solve(ImmutableList<Obligation> obligations) {
    List<ListenableFuture<Obligation>> tasks = new ArrayList<>();
    for (Obligation obligation : obligations) {
      if (obligation.isDecided() || !obligation.kind().needsSolver()) {
        tasks.add(Futures.immediateFuture(obligation));
      } else {
        tasks.add(executor.submit(() -> obligation.withOutcome(decide(obligation))));
      }
    }
    try {
      return ImmutableList.copyOf(Futures.getUnchecked(Futures.allAsList(tasks)));
    } catch (UncheckedExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw e;
    }
  }

  private SolverOutcome decide(Obligation obligation) {
    try {
      return solver.decide(obligation.goal(), obligation.context());
    } catch (RuntimeException e) {
      logger.warn("solver failed on {}", obligation.id(), e);
      return SolverOutcome.unknown(UnknownCategory.UNSUPPORTED, "solver failure: " + e);
    }
  }

  private static CompileStatus status(
      List<Diagnostic> diagnostics, List<Obligation> obligations, List<TypedHole> holes) {
    // warnings count too: a pass is only clean when nothing was reported
    if (!diagnostics.isEmpty()) {
      return CompileStatus.ERROR;
    }
    for (Obligation obligation : obligations) {
      if (!obligation.isDischarged()) {
        return CompileStatus.INCOMPLETE;
      }
    }
    return holes.isEmpty() ? CompileStatus.SUCCESS : CompileStatus.INCOMPLETE;
  }

  private static PassStats stats(
      List<Diagnostic> diagnostics,
      List<Obligation> obligations,
      List<TypedHole> holes,
      List<RepairCandidate> repairs) {
    int discharged = 0;
    int counterexamples = 0;
    int unknown = 0;
    for (Obligation obligation : obligations) {
      switch (obligation.result()) {
        case DISCHARGED:
          discharged++;
          break;
        case COUNTEREXAMPLE:
          counterexamples++;
          break;
        case UNKNOWN:
          unknown++;
          break;
      }
    }
    return PassStats.builder()
        .setObligations(obligations.size())
        .setDischarged(discharged)
        .setCounterexamples(counterexamples)
        .setUnknown(unknown)
        .setDiagnostics(diagnostics.size())
        .setRepairs(repairs.size())
        .setHoles(holes.size())
        .build();
  }

  @Override
  public void close() {
    MoreExecutors.shutdownAndAwaitTermination(executor, Duration.ofSeconds(10));
  }
}
