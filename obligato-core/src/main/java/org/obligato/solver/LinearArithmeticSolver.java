package org.obligato.solver;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.obligato.binder.ContextSnapshot;
import org.obligato.binder.Fact;
import org.obligato.logic.Constraint;
import org.obligato.logic.Formula;
import org.obligato.logic.LinearTerm;
import org.obligato.logic.Rational;
import org.obligato.logic.Translator;
import org.obligato.logic.Untranslatable;
import org.obligato.logic.Var;
import org.obligato.options.EngineOptions;
import org.obligato.tree.Pretty;
import org.obligato.tree.Tree.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The default {@link Solver}: refutes {@code not goal} together with the facts by case-splitting
 * into disjunctive normal form and running {@link FourierMotzkin} on every case.
 */
public final class LinearArithmeticSolver implements Solver {

  private static final Logger logger = LoggerFactory.getLogger(LinearArithmeticSolver.class);

  private final Duration timeout;
  private final int maxDisjuncts;
  private final int maxConstraints;

  public LinearArithmeticSolver(EngineOptions options) {
    this.timeout = options.solverTimeout();
    this.maxDisjuncts = options.maxDisjuncts();
    this.maxConstraints = options.maxConstraints();
  }

  @Override
  public SolverOutcome decide(Expression goal, ContextSnapshot context) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    SolverOutcome outcome;
    try {
      outcome = decide(goal, context, stopwatch);
    } catch (BudgetExceeded e) {
      outcome = SolverOutcome.unknown(UnknownCategory.TIMEOUT, e.getMessage());
    }
    logger.debug("{} decided in {}: {}", Pretty.pretty(goal), stopwatch, outcome);
    return outcome;
  }

  private SolverOutcome decide(Expression goal, ContextSnapshot context, Stopwatch stopwatch) {
    Translator translator = new Translator(context);
    Formula goalFormula;
    try {
      goalFormula = translator.formula(goal);
    } catch (Untranslatable e) {
      UnknownCategory category =
          e.reason() == Untranslatable.Reason.QUANTIFIED
              ? UnknownCategory.QUANTIFIED
              : UnknownCategory.UNSUPPORTED;
      return SolverOutcome.unknown(category, e.getMessage());
    }

    List<Formula> facts = new ArrayList<>();
    for (Fact fact : context.facts()) {
      try {
        facts.add(translator.formula(fact.prop()));
      } catch (Untranslatable e) {
        logger.debug("dropping fact {}: {}", fact.text(), e.getMessage());
      }
    }
    facts = coneOfInfluence(goalFormula, facts);

    Formula factFormula = Formula.and(facts);
    Formula negated = Formula.and(Formula.not(goalFormula), factFormula);
    List<Formula> conjuncts = new ArrayList<>();
    conjuncts.add(negated);
    conjuncts.addAll(translator.axioms(negated.vars()));
    Formula query = Formula.and(conjuncts);

    FourierMotzkin procedure = new FourierMotzkin(maxConstraints, stopwatch, timeout);
    boolean roundingFailed = false;
    for (List<Constraint> conjunct : new Dnf(maxDisjuncts).convert(query)) {
      FourierMotzkin.Result result = procedure.solve(conjunct);
      switch (result.status()) {
        case INFEASIBLE:
          continue;
        case ROUNDING_FAILED:
          roundingFailed = true;
          continue;
        case MODEL:
          return verdict(translator, goalFormula, factFormula, query, result.model());
      }
    }
    if (roundingFailed) {
      return SolverOutcome.unknown(
          UnknownCategory.UNSUPPORTED, "no integral assignment found by rounding");
    }
    return SolverOutcome.discharged();
  }

  /** Keeps the facts that share variables, transitively, with the goal. */
  private static List<Formula> coneOfInfluence(Formula goal, List<Formula> facts) {
    Set<Var> reached = new HashSet<>(goal.vars());
    List<Formula> remaining = new ArrayList<>(facts);
    List<Formula> kept = new ArrayList<>();
    boolean changed = true;
    while (changed) {
      changed = false;
      for (int i = 0; i < remaining.size(); i++) {
        ImmutableSortedSet<Var> vars = remaining.get(i).vars();
        if (vars.isEmpty() || vars.stream().anyMatch(reached::contains)) {
          reached.addAll(vars);
          kept.add(remaining.remove(i--));
          changed = true;
        }
      }
    }
    return kept;
  }

  private static SolverOutcome verdict(
      Translator translator,
      Formula goal,
      Formula facts,
      Formula query,
      Map<Var, Rational> model) {
    ImmutableSortedSet<Var> factVars = facts.vars();
    List<String> unconstrained = new ArrayList<>();
    for (Var var : goal.vars()) {
      if (var.origin() != Var.Origin.NONLINEAR && !factVars.contains(var)) {
        unconstrained.add(var.name());
      }
    }
    if (!unconstrained.isEmpty()) {
      return SolverOutcome.unknown(
          UnknownCategory.INCOMPLETE_FACTS,
          "no facts constrain " + String.join(", ", unconstrained));
    }
    for (Var var : query.vars()) {
      if (var.origin() == Var.Origin.NONLINEAR) {
        return SolverOutcome.unknown(
            UnknownCategory.NONLINEAR, "depends on nonlinear term " + var.name());
      }
    }
    String violation = congruenceViolation(translator, model);
    if (violation != null) {
      return SolverOutcome.unknown(UnknownCategory.UNSUPPORTED, violation);
    }

    Map<String, String> witness = new LinkedHashMap<>();
    for (Var var : query.vars()) {
      boolean inGoal = goal.vars().contains(var);
      if (var.origin() == Var.Origin.BINDING || inGoal) {
        witness.put(var.name(), translator.render(var, model.getOrDefault(var, Rational.ZERO)));
      }
    }
    if (witness.isEmpty()) {
      witness.put("<goal>", "false");
    }
    return SolverOutcome.counterexample(witness);
  }

  /** Finds two applications of one function to equal arguments with different values. */
  private static @Nullable String congruenceViolation(
      Translator translator, Map<Var, Rational> model) {
    Map<Var, Translator.Application> applications = translator.applications();
    List<Var> vars = ImmutableList.copyOf(applications.keySet());
    Map<Var, Rational> values = new LinkedHashMap<>(model);
    for (int i = 0; i < vars.size(); i++) {
      for (int j = i + 1; j < vars.size(); j++) {
        Translator.Application a = applications.get(vars.get(i));
        Translator.Application b = applications.get(vars.get(j));
        if (!a.function().equals(b.function()) || a.args().size() != b.args().size()) {
          continue;
        }
        boolean sameArgs = true;
        for (int k = 0; k < a.args().size() && sameArgs; k++) {
          sameArgs = value(a.args().get(k), values).equals(value(b.args().get(k), values));
        }
        if (sameArgs
            && !value(LinearTerm.var(vars.get(i)), values)
                .equals(value(LinearTerm.var(vars.get(j)), values))) {
          return vars.get(i).name()
              + " and "
              + vars.get(j).name()
              + " disagree on equal arguments";
        }
      }
    }
    return null;
  }

  private static Rational value(LinearTerm term, Map<Var, Rational> values) {
    for (Var var : term.coefficients().keySet()) {
      values.putIfAbsent(var, Rational.ZERO);
    }
    return term.evaluate(values);
  }
}
